package com.raid.roundsync.api;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient {@link Duration} reader for request bodies.
 *
 * <pre>
 * "PT2S" / "pt2s"  ISO-8601
 * "500ms" "2s" "1m" "1h"
 * 2000             milliseconds
 * null, ""         null (the caller applies its default)
 * </pre>
 *
 * Anything else is rejected with a 400 rather than silently replaced.
 */
public final class FlexibleDurationDeserializer extends JsonDeserializer<Duration> {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)(ms|s|m|h)$", Pattern.CASE_INSENSITIVE);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Duration.ofMillis(node.asLong());
        }
        String s = node.asText("").trim();
        if (s.isEmpty()) {
            return null;
        }
        return parse(s);
    }

    static Duration parse(String s) {
        Matcher m = SHORTHAND.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            return switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                default -> Duration.ofHours(n);
            };
        }
        try {
            return Duration.parse(s.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized duration: " + s, e);
        }
    }
}
