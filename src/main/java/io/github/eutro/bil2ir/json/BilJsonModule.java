package io.github.eutro.bil2ir.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.github.eutro.bil2ir.bil.Expression;
import io.github.eutro.bil2ir.bil.Type;
import io.github.eutro.bil2ir.bil.Variable;
import io.github.eutro.bil2ir.bits.Bitvector;

/**
 * A Jackson module reading and writing lifted expressions, variables, types and
 * bitvectors in the lifter's JSON format.
 * <p>
 * Register this with any {@link com.fasterxml.jackson.databind.ObjectMapper};
 * {@link BilJson} does so with suitable nesting limits.
 */
public class BilJsonModule extends SimpleModule {
    public BilJsonModule() {
        super("bil-json");
        addSerializer(Expression.class, new ExpressionSerializer());
        addDeserializer(Expression.class, new ExpressionDeserializer());
        addSerializer(Variable.class, new ValueCodecs.VariableSerializer());
        addDeserializer(Variable.class, new ValueCodecs.VariableDeserializer());
        addSerializer(Type.class, new ValueCodecs.TypeSerializer());
        addDeserializer(Type.class, new ValueCodecs.TypeDeserializer());
        addSerializer(Bitvector.class, new ValueCodecs.BitvectorSerializer());
        addDeserializer(Bitvector.class, new ValueCodecs.BitvectorDeserializer());
    }
}
