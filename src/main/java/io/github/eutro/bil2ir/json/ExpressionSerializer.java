package io.github.eutro.bil2ir.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.eutro.bil2ir.bil.Expression;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Writes {@link Expression}s in the lifter's format, each variant as a single-key
 * object wrapping its fields, the fields in alphabetical order.
 * <p>
 * The tree is walked with an explicit stack; only the generator's nesting limit
 * bounds the depth of what can be written.
 */
class ExpressionSerializer extends StdSerializer<Expression> {
    private static final Step CLOSE = gen -> {
        gen.writeEndObject();
        gen.writeEndObject();
    };
    private static final Step NULL = JsonGenerator::writeNull;

    ExpressionSerializer() {
        super(Expression.class);
    }

    @FunctionalInterface
    private interface Step {
        void write(JsonGenerator gen) throws IOException;
    }

    @Override
    public void serialize(Expression value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        Deque<Object> stack = new ArrayDeque<>();
        List<Object> steps = new ArrayList<>();
        stack.push(value);
        while (!stack.isEmpty()) {
            Object top = stack.pop();
            if (top instanceof Step) {
                ((Step) top).write(gen);
                continue;
            }
            steps.clear();
            plan((Expression) top, steps);
            for (int i = steps.size() - 1; i >= 0; i--) {
                stack.push(steps.get(i));
            }
        }
    }

    private static void plan(Expression expr, List<Object> steps) {
        if (expr instanceof Expression.Var) {
            Expression.Var var = (Expression.Var) expr;
            steps.add((Step) gen -> {
                gen.writeStartObject();
                gen.writeFieldName("Var");
                ValueCodecs.writeVariable(gen, var.variable);
                gen.writeEndObject();
            });
        } else if (expr instanceof Expression.Const) {
            Expression.Const c = (Expression.Const) expr;
            steps.add((Step) gen -> {
                gen.writeStartObject();
                gen.writeFieldName("Const");
                ValueCodecs.writeBitvector(gen, c.value);
                gen.writeEndObject();
            });
        } else if (expr instanceof Expression.Load) {
            Expression.Load load = (Expression.Load) expr;
            steps.add(open("Load"));
            child(steps, "address", load.address);
            steps.add(string("endian", load.endian.serialName()));
            child(steps, "memory", load.memory);
            steps.add(number("size", load.size));
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Store) {
            Expression.Store store = (Expression.Store) expr;
            steps.add(open("Store"));
            child(steps, "address", store.address);
            steps.add(string("endian", store.endian.serialName()));
            child(steps, "memory", store.memory);
            steps.add(number("size", store.size));
            child(steps, "value", store.value);
            steps.add(CLOSE);
        } else if (expr instanceof Expression.BinOp) {
            Expression.BinOp binOp = (Expression.BinOp) expr;
            steps.add(open("BinOp"));
            child(steps, "lhs", binOp.lhs);
            steps.add(string("op", binOp.op.name()));
            child(steps, "rhs", binOp.rhs);
            steps.add(CLOSE);
        } else if (expr instanceof Expression.UnOp) {
            Expression.UnOp unOp = (Expression.UnOp) expr;
            steps.add(open("UnOp"));
            child(steps, "arg", unOp.arg);
            steps.add(string("op", unOp.op.name()));
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Cast) {
            Expression.Cast cast = (Expression.Cast) expr;
            steps.add(open("Cast"));
            child(steps, "arg", cast.arg);
            steps.add(string("kind", cast.kind.name()));
            steps.add(number("width", cast.width));
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Let) {
            Expression.Let let = (Expression.Let) expr;
            steps.add(open("Let"));
            child(steps, "body_exp", let.bodyExp);
            child(steps, "bound_exp", let.boundExp);
            steps.add((Step) gen -> {
                gen.writeFieldName("var");
                ValueCodecs.writeVariable(gen, let.var);
            });
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Unknown) {
            Expression.Unknown unknown = (Expression.Unknown) expr;
            steps.add(open("Unknown"));
            steps.add(string("description", unknown.description));
            steps.add((Step) gen -> {
                gen.writeFieldName("type_");
                ValueCodecs.writeType(gen, unknown.type);
            });
            steps.add(CLOSE);
        } else if (expr instanceof Expression.IfThenElse) {
            Expression.IfThenElse ite = (Expression.IfThenElse) expr;
            steps.add(open("IfThenElse"));
            child(steps, "condition", ite.condition);
            child(steps, "false_exp", ite.falseExp);
            child(steps, "true_exp", ite.trueExp);
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Extract) {
            Expression.Extract extract = (Expression.Extract) expr;
            steps.add(open("Extract"));
            child(steps, "arg", extract.arg);
            steps.add(number("high_bit", extract.highBit));
            steps.add(number("low_bit", extract.lowBit));
            steps.add(CLOSE);
        } else if (expr instanceof Expression.Concat) {
            Expression.Concat concat = (Expression.Concat) expr;
            steps.add(open("Concat"));
            child(steps, "left", concat.left);
            child(steps, "right", concat.right);
            steps.add(CLOSE);
        } else {
            throw new IllegalArgumentException("unknown expression: " + expr.getClass());
        }
    }

    private static Step open(String variant) {
        return gen -> {
            gen.writeStartObject();
            gen.writeObjectFieldStart(variant);
        };
    }

    private static Step string(String field, String value) {
        return gen -> gen.writeStringField(field, value);
    }

    private static Step number(String field, int value) {
        return gen -> gen.writeNumberField(field, value);
    }

    private static void child(List<Object> steps, String field, Expression child) {
        steps.add((Step) gen -> gen.writeFieldName(field));
        steps.add(child == null ? NULL : child);
    }
}
