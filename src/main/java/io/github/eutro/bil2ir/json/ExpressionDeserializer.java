package io.github.eutro.bil2ir.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.github.eutro.bil2ir.bil.BinOpType;
import io.github.eutro.bil2ir.bil.CastType;
import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.bil.UnOpType;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.function.Consumer;

import static io.github.eutro.bil2ir.json.ValueCodecs.*;

/**
 * Reads {@link Expression}s in the lifter's format.
 * <p>
 * Nodes are created with their children missing and filled in from a worklist,
 * so decoding does not recurse on the depth of the tree.
 */
class ExpressionDeserializer extends StdDeserializer<Expression> {
    ExpressionDeserializer() {
        super(Expression.class);
    }

    private static final class Pending {
        final JsonNode json;
        final Consumer<Expression> sink;

        Pending(JsonNode json, Consumer<Expression> sink) {
            this.json = json;
            this.sink = sink;
        }
    }

    @Override
    public Expression deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode root = ctxt.readTree(p);
        Expression[] result = new Expression[1];
        Deque<Pending> work = new ArrayDeque<>();
        work.push(new Pending(root, $ -> result[0] = $));
        while (!work.isEmpty()) {
            Pending next = work.pop();
            next.sink.accept(readNode(p, next.json, work));
        }
        return result[0];
    }

    private static Expression readNode(JsonParser p, JsonNode json, Deque<Pending> work) throws IOException {
        Map.Entry<String, JsonNode> variant = variant(p, Expression.class, json);
        JsonNode body = variant.getValue();
        switch (variant.getKey()) {
            case "Var":
                return new Expression.Var(readVariable(p, body));
            case "Const":
                return new Expression.Const(readBitvector(p, body));
            case "Load": {
                Expression.Load load = new Expression.Load(null, null, readEndian(p, body), readInt(p, body, "size"));
                child(p, work, body, "memory", $ -> load.memory = $);
                child(p, work, body, "address", $ -> load.address = $);
                return load;
            }
            case "Store": {
                Expression.Store store = new Expression.Store(null, null, null,
                        readEndian(p, body), readInt(p, body, "size"));
                child(p, work, body, "memory", $ -> store.memory = $);
                child(p, work, body, "address", $ -> store.address = $);
                child(p, work, body, "value", $ -> store.value = $);
                return store;
            }
            case "BinOp": {
                Expression.BinOp binOp = new Expression.BinOp(readEnum(p, body, "op", BinOpType.class), null, null);
                child(p, work, body, "lhs", $ -> binOp.lhs = $);
                child(p, work, body, "rhs", $ -> binOp.rhs = $);
                return binOp;
            }
            case "UnOp": {
                Expression.UnOp unOp = new Expression.UnOp(readEnum(p, body, "op", UnOpType.class), null);
                child(p, work, body, "arg", $ -> unOp.arg = $);
                return unOp;
            }
            case "Cast": {
                Expression.Cast cast = new Expression.Cast(readEnum(p, body, "kind", CastType.class),
                        readInt(p, body, "width"), null);
                child(p, work, body, "arg", $ -> cast.arg = $);
                return cast;
            }
            case "Let": {
                Expression.Let let = new Expression.Let(readVariable(p, required(p, body, "var")), null, null);
                child(p, work, body, "bound_exp", $ -> let.boundExp = $);
                child(p, work, body, "body_exp", $ -> let.bodyExp = $);
                return let;
            }
            case "Unknown":
                return new Expression.Unknown(readString(p, body, "description"),
                        readType(p, required(p, body, "type_")));
            case "IfThenElse": {
                Expression.IfThenElse ite = new Expression.IfThenElse(null, null, null);
                child(p, work, body, "condition", $ -> ite.condition = $);
                child(p, work, body, "true_exp", $ -> ite.trueExp = $);
                child(p, work, body, "false_exp", $ -> ite.falseExp = $);
                return ite;
            }
            case "Extract": {
                Expression.Extract extract = new Expression.Extract(readInt(p, body, "low_bit"),
                        readInt(p, body, "high_bit"), null);
                child(p, work, body, "arg", $ -> extract.arg = $);
                return extract;
            }
            case "Concat": {
                Expression.Concat concat = new Expression.Concat(null, null);
                child(p, work, body, "left", $ -> concat.left = $);
                child(p, work, body, "right", $ -> concat.right = $);
                return concat;
            }
            default:
                throw mismatch(p, Expression.class, "unknown expression variant \"" + variant.getKey() + "\"");
        }
    }

    private static void child(
            JsonParser p,
            Deque<Pending> work,
            JsonNode body,
            String field,
            Consumer<Expression> sink
    ) throws IOException {
        work.push(new Pending(required(p, body, field), sink));
    }
}
