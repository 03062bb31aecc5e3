package com.raid.roundsync.service.invite;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.raid.roundsync.core.codec.Bech32;

/**
 * Encodes a round's initiation id as a shareable {@code nevent} token.
 *
 * <pre>
 * payload = TLV*   type(1) length(1) value(length)
 *   0: event id, 32 bytes (exactly one)
 *   1: relay URL, UTF-8 (zero or more)
 * </pre>
 *
 * Unknown TLV types are skipped when decoding. Pure and stateless.
 */
public final class InviteCodec {

    public static final String HRP = "nevent";
    public static final String URI_PREFIX = "nostr:";

    private static final int TYPE_EVENT_ID = 0;
    private static final int TYPE_RELAY = 1;
    private static final int MAX_TLV_LENGTH = 255;

    /** A nevent token anywhere in free text, optionally as a nostr: URI. */
    private static final Pattern IN_TEXT = Pattern.compile("(?:nostr:)?(nevent1[02-9ac-hj-np-z]+)");

    private static final HexFormat HEX = HexFormat.of();

    private InviteCodec() {
    }

    public static String encode(String eventId, List<String> relayHints) {
        byte[] id = HEX.parseHex(eventId);
        if (id.length != 32) {
            throw new IllegalArgumentException("Event id must be 32 bytes");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeTlv(out, TYPE_EVENT_ID, id);
        if (relayHints != null) {
            for (String relay : relayHints) {
                byte[] url = relay.getBytes(StandardCharsets.UTF_8);
                if (url.length > MAX_TLV_LENGTH) {
                    throw new IllegalArgumentException("Relay URL too long for an invite: " + relay);
                }
                writeTlv(out, TYPE_RELAY, url);
            }
        }
        return Bech32.encode(HRP, out.toByteArray());
    }

    public static String toUri(String eventId, List<String> relayHints) {
        return URI_PREFIX + encode(eventId, relayHints);
    }

    /**
     * Accepts a bare token or a {@code nostr:} URI.
     *
     * @throws IllegalArgumentException if the token is malformed, not a {@code nevent}, or
     *                                  carries no 32-byte event id
     */
    public static InviteToken decode(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Invite token is required");
        }
        String s = token.trim();
        if (s.regionMatches(true, 0, URI_PREFIX, 0, URI_PREFIX.length())) {
            s = s.substring(URI_PREFIX.length());
        }
        Bech32.Decoded decoded = Bech32.decode(s);
        if (!HRP.equals(decoded.hrp())) {
            throw new IllegalArgumentException("Not an event invite: " + decoded.hrp());
        }
        byte[] data = decoded.data();
        String eventId = null;
        List<String> relays = new ArrayList<>();
        int i = 0;
        while (i + 2 <= data.length) {
            int type = data[i] & 0xff;
            int len = data[i + 1] & 0xff;
            if (i + 2 + len > data.length) {
                throw new IllegalArgumentException("Truncated invite TLV");
            }
            if (type == TYPE_EVENT_ID) {
                if (len != 32) {
                    throw new IllegalArgumentException("Event id must be 32 bytes, got " + len);
                }
                if (eventId == null) {
                    eventId = HEX.formatHex(data, i + 2, i + 2 + len);
                }
            } else if (type == TYPE_RELAY) {
                relays.add(new String(data, i + 2, len, StandardCharsets.UTF_8));
            }
            i += 2 + len;
        }
        if (eventId == null) {
            throw new IllegalArgumentException("Invite carries no event id");
        }
        return new InviteToken(eventId, relays);
    }

    /** Finds the first invite token in a message body, if any. */
    public static String findToken(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = IN_TEXT.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static void writeTlv(ByteArrayOutputStream out, int type, byte[] value) {
        out.write(type);
        out.write(value.length);
        out.write(value, 0, value.length);
    }
}
