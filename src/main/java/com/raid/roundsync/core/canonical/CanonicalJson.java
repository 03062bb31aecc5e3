package com.raid.roundsync.core.canonical;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Deterministic JSON serialization used for content hashing and event ids.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Object keys are sorted by UTF-16 code unit order ({@link String#compareTo}).</li>
 *   <li>No insignificant whitespace.</li>
 *   <li>Integers are written as plain digits; other numbers in their shortest plain form.</li>
 *   <li>NaN and infinities are rejected.</li>
 *   <li>Array order is preserved.</li>
 * </ul>
 *
 * <p>Output is independent of the JVM default locale and of the insertion order of object
 * fields, so two devices building the same logical value produce identical bytes.</p>
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonFactory FACTORY = MAPPER.getFactory();

    private CanonicalJson() {
    }

    public static String write(JsonNode node) {
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            writeNode(gen, node);
        } catch (IOException e) {
            throw new UncheckedIOException("Canonical serialization failed", e);
        }
        return out.toString();
    }

    /** Converts any Jackson-mappable value to its canonical string. */
    public static String write(Object value) {
        return write(MAPPER.valueToTree(value));
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed JSON content", e);
        }
    }

    private static void writeNode(JsonGenerator gen, JsonNode node) throws IOException {
        if (node == null || node.isNull() || node.isMissingNode()) {
            gen.writeNull();
        } else if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            names.sort(String::compareTo);
            gen.writeStartObject();
            for (String name : names) {
                gen.writeFieldName(name);
                writeNode(gen, node.get(name));
            }
            gen.writeEndObject();
        } else if (node.isArray()) {
            gen.writeStartArray();
            for (JsonNode element : node) {
                writeNode(gen, element);
            }
            gen.writeEndArray();
        } else if (node.isIntegralNumber()) {
            gen.writeNumber(node.bigIntegerValue());
        } else if (node.isNumber()) {
            double d = node.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Non-finite numbers have no canonical form");
            }
            BigDecimal decimal = node.decimalValue().stripTrailingZeros();
            gen.writeRawValue(decimal.scale() <= 0
                    ? decimal.toBigInteger().toString()
                    : decimal.toPlainString());
        } else if (node.isBoolean()) {
            gen.writeBoolean(node.booleanValue());
        } else if (node.isTextual()) {
            gen.writeString(node.textValue());
        } else {
            throw new IllegalArgumentException("Unsupported JSON node type: " + node.getNodeType());
        }
    }
}
