package io.github.eutro.bil2ir.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.github.eutro.bil2ir.bil.Endianness;
import io.github.eutro.bil2ir.bil.Type;
import io.github.eutro.bil2ir.bil.Variable;
import io.github.eutro.bil2ir.bits.Bitvector;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;

/**
 * Reading and writing of the leaf values of the lifter's format:
 * {@link Variable}s, {@link Type}s, {@link Bitvector}s and enum names.
 */
class ValueCodecs {
    static void writeVariable(JsonGenerator gen, Variable var) throws IOException {
        gen.writeStartObject();
        gen.writeBooleanField("is_temp", var.isTemp);
        gen.writeStringField("name", var.name);
        gen.writeFieldName("type_");
        writeType(gen, var.type);
        gen.writeEndObject();
    }

    static Variable readVariable(JsonParser p, JsonNode node) throws IOException {
        JsonNode isTemp = required(p, node, "is_temp");
        if (!isTemp.isBoolean()) throw mismatch(p, Variable.class, "\"is_temp\" must be a boolean");
        return new Variable(readString(p, node, "name"), readType(p, required(p, node, "type_")), isTemp.booleanValue());
    }

    static void writeType(JsonGenerator gen, Type type) throws IOException {
        if (type instanceof Type.Immediate) {
            gen.writeStartObject();
            gen.writeNumberField("Immediate", ((Type.Immediate) type).bitSize);
            gen.writeEndObject();
        } else if (type instanceof Type.Memory) {
            Type.Memory memory = (Type.Memory) type;
            gen.writeStartObject();
            gen.writeObjectFieldStart("Memory");
            gen.writeNumberField("addr_size", memory.addrSize);
            gen.writeNumberField("elem_size", memory.elemSize);
            gen.writeEndObject();
            gen.writeEndObject();
        } else {
            gen.writeString("Unknown");
        }
    }

    static Type readType(JsonParser p, JsonNode node) throws IOException {
        if (node.isTextual()) {
            if (node.textValue().equals("Unknown")) return Type.Unknown.INSTANCE;
            throw mismatch(p, Type.class, "unknown type \"" + node.textValue() + "\"");
        }
        Map.Entry<String, JsonNode> variant = variant(p, Type.class, node);
        switch (variant.getKey()) {
            case "Immediate":
                return Type.immediate(asInt(p, variant.getValue(), "Immediate"));
            case "Memory":
                return Type.memory(
                        readInt(p, variant.getValue(), "addr_size"),
                        readInt(p, variant.getValue(), "elem_size"));
            default:
                throw mismatch(p, Type.class, "unknown type \"" + variant.getKey() + "\"");
        }
    }

    static void writeBitvector(JsonGenerator gen, Bitvector bv) throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart("digits");
        for (long digit : bv.digits()) {
            if (digit >= 0) {
                gen.writeNumber(digit);
            } else {
                gen.writeNumber(new BigInteger(Long.toUnsignedString(digit)));
            }
        }
        gen.writeEndArray();
        gen.writeArrayFieldStart("width");
        gen.writeNumber(bv.width());
        gen.writeEndArray();
        gen.writeEndObject();
    }

    static Bitvector readBitvector(JsonParser p, JsonNode node) throws IOException {
        JsonNode digitsNode = required(p, node, "digits");
        if (!digitsNode.isArray()) throw mismatch(p, Bitvector.class, "\"digits\" must be an array");
        long[] digits = new long[digitsNode.size()];
        for (int i = 0; i < digits.length; i++) {
            JsonNode digit = digitsNode.get(i);
            if (!digit.isIntegralNumber() || digit.bigIntegerValue().signum() < 0
                    || digit.bigIntegerValue().bitLength() > 64) {
                throw mismatch(p, Bitvector.class, "digit " + digit + " is not an unsigned 64-bit integer");
            }
            digits[i] = digit.bigIntegerValue().longValue();
        }
        JsonNode widthNode = required(p, node, "width");
        // the lifter wraps the width in a single-element array
        if (widthNode.isArray() && widthNode.size() == 1) widthNode = widthNode.get(0);
        int width = asInt(p, widthNode, "width");
        if (width <= 0) throw mismatch(p, Bitvector.class, "bitvector width must be positive, got " + width);
        return Bitvector.fromDigits(digits, width);
    }

    static Endianness readEndian(JsonParser p, JsonNode node) throws IOException {
        String name = readString(p, node, "endian");
        Endianness endianness = Endianness.bySerialName(name);
        if (endianness == null) throw mismatch(p, Endianness.class, "unknown endianness \"" + name + "\"");
        return endianness;
    }

    static <E extends Enum<E>> E readEnum(JsonParser p, JsonNode node, String field, Class<E> type) throws IOException {
        String name = readString(p, node, field);
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw mismatch(p, type, "unknown " + type.getSimpleName() + " \"" + name + "\"");
        }
    }

    static Map.Entry<String, JsonNode> variant(JsonParser p, Class<?> type, JsonNode node) throws IOException {
        if (!node.isObject() || node.size() != 1) {
            throw mismatch(p, type, "expected an object with exactly one variant key, got " + node.getNodeType()
                    + (node.isObject() ? " with " + node.size() + " keys" : ""));
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        return fields.next();
    }

    static JsonNode required(JsonParser p, JsonNode node, String field) throws IOException {
        if (!node.isObject()) throw mismatch(p, Object.class, "expected an object containing \"" + field + "\"");
        JsonNode value = node.get(field);
        if (value == null) throw mismatch(p, Object.class, "missing field \"" + field + "\"");
        return value;
    }

    static int readInt(JsonParser p, JsonNode node, String field) throws IOException {
        return asInt(p, required(p, node, field), field);
    }

    static String readString(JsonParser p, JsonNode node, String field) throws IOException {
        JsonNode value = required(p, node, field);
        if (!value.isTextual()) throw mismatch(p, String.class, "\"" + field + "\" must be a string");
        return value.textValue();
    }

    private static int asInt(JsonParser p, JsonNode value, String what) throws IOException {
        if (!value.isIntegralNumber() || !value.canConvertToInt() || value.intValue() < 0) {
            throw mismatch(p, Integer.class, "\"" + what + "\" must be a non-negative integer, got " + value);
        }
        return value.intValue();
    }

    static MismatchedInputException mismatch(JsonParser p, Class<?> type, String message) {
        return MismatchedInputException.from(p, type, message);
    }

    static class VariableSerializer extends StdSerializer<Variable> {
        VariableSerializer() {
            super(Variable.class);
        }

        @Override
        public void serialize(Variable value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeVariable(gen, value);
        }
    }

    static class VariableDeserializer extends StdDeserializer<Variable> {
        VariableDeserializer() {
            super(Variable.class);
        }

        @Override
        public Variable deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readVariable(p, ctxt.readTree(p));
        }
    }

    static class TypeSerializer extends StdSerializer<Type> {
        TypeSerializer() {
            super(Type.class);
        }

        @Override
        public void serialize(Type value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeType(gen, value);
        }
    }

    static class TypeDeserializer extends StdDeserializer<Type> {
        TypeDeserializer() {
            super(Type.class);
        }

        @Override
        public Type deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readType(p, ctxt.readTree(p));
        }
    }

    static class BitvectorSerializer extends StdSerializer<Bitvector> {
        BitvectorSerializer() {
            super(Bitvector.class);
        }

        @Override
        public void serialize(Bitvector value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            writeBitvector(gen, value);
        }
    }

    static class BitvectorDeserializer extends StdDeserializer<Bitvector> {
        BitvectorDeserializer() {
            super(Bitvector.class);
        }

        @Override
        public Bitvector deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            return readBitvector(p, ctxt.readTree(p));
        }
    }
}
