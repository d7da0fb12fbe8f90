package io.github.eutro.bil2ir.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.eutro.bil2ir.bil.Expression;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Encodes and decodes lifted expressions as JSON, in the format the lifter emits.
 * <p>
 * Each expression variant is an object with a single key, the variant name, whose value
 * holds the variant's fields by their snake_case names:
 * <pre>{@code
 * {"BinOp":{"lhs":{"Var":{"is_temp":false,"name":"RAX","type_":{"Immediate":64}}},
 *           "op":"PLUS",
 *           "rhs":{"Const":{"digits":[1],"width":[64]}}}}
 * }</pre>
 * Malformed input is reported as a {@link com.fasterxml.jackson.databind.exc.MismatchedInputException}.
 */
public class BilJson {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 1 << 20;

    private static final BilJson DEFAULT = builder().build();

    private final ObjectMapper mapper;

    private BilJson(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @return A codec with the default nesting limit.
     */
    public static BilJson getDefault() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return The underlying mapper, with a {@link BilJsonModule} registered.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public String encode(Expression expr) throws JsonProcessingException {
        return mapper.writeValueAsString(expr);
    }

    public Expression decode(String json) throws JsonProcessingException {
        return mapper.readValue(json, Expression.class);
    }

    /**
     * Write an expression. The writer is flushed, but not closed.
     *
     * @param writer The writer.
     * @param expr   The expression.
     * @throws IOException If writing fails.
     */
    public void write(Writer writer, Expression expr) throws IOException {
        mapper.writeValue(writer, expr);
    }

    /**
     * Read an expression. The reader is not closed.
     *
     * @param reader The reader.
     * @return The expression.
     * @throws IOException If reading fails, or the input is not a valid expression.
     */
    public Expression read(Reader reader) throws IOException {
        return mapper.readValue(reader, Expression.class);
    }

    public static class Builder {
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

        /**
         * Set the deepest JSON nesting that will be read or written.
         * Every expression level takes two levels of JSON.
         * <p>
         * Defaults to {@link #DEFAULT_MAX_NESTING_DEPTH}.
         *
         * @param maxNestingDepth The maximum depth.
         * @return This builder.
         */
        public Builder setMaxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth <= 0) {
                throw new IllegalArgumentException("nesting depth must be positive, got " + maxNestingDepth);
            }
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public BilJson build() {
            JsonFactory factory = JsonFactory.builder()
                    .streamReadConstraints(StreamReadConstraints.builder()
                            .maxNestingDepth(maxNestingDepth)
                            .build())
                    .streamWriteConstraints(StreamWriteConstraints.builder()
                            .maxNestingDepth(maxNestingDepth)
                            .build())
                    .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
                    .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                    .build();
            ObjectMapper mapper = new ObjectMapper(factory);
            mapper.registerModule(new BilJsonModule());
            return new BilJson(mapper);
        }
    }
}
