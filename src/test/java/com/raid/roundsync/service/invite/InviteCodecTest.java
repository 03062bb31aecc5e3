package com.raid.roundsync.service.invite;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.HexFormat;
import java.util.List;

import org.junit.Test;

import com.raid.roundsync.core.codec.Bech32;

public class InviteCodecTest {

    private static final String EVENT_ID = "5c83da77af1dec6d7289834998ad7aafbd9e2191396d75ec3cc27f5a77226f36";

    @Test
    public void encode_thenDecodeKeepsIdAndRelayHints() {
        List<String> relays = List.of("nats://relay-a:4222", "tls://relay-b.example:4222");
        String token = InviteCodec.encode(EVENT_ID, relays);

        assertTrue(token.startsWith("nevent1"));
        InviteToken decoded = InviteCodec.decode(token);
        assertEquals(EVENT_ID, decoded.eventId());
        assertEquals(relays, decoded.relayHints());
    }

    @Test
    public void decode_acceptsNostrUri() {
        String uri = InviteCodec.toUri(EVENT_ID, List.of());
        assertTrue(uri.startsWith("nostr:nevent1"));
        assertEquals(EVENT_ID, InviteCodec.decode(uri).eventId());
        assertTrue(InviteCodec.decode(uri).relayHints().isEmpty());
    }

    @Test
    public void decode_skipsUnknownTlvTypes() {
        byte[] id = HexFormat.of().parseHex(EVENT_ID);
        byte[] payload = new byte[2 + 32 + 2 + 4];
        payload[0] = 0;
        payload[1] = 32;
        System.arraycopy(id, 0, payload, 2, 32);
        payload[34] = 3;
        payload[35] = 4;
        String token = Bech32.encode(InviteCodec.HRP, payload);

        InviteToken decoded = InviteCodec.decode(token);
        assertEquals(EVENT_ID, decoded.eventId());
        assertTrue(decoded.relayHints().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void decode_rejectsOtherPrefix() {
        InviteCodec.decode(Bech32.encode("npub", HexFormat.of().parseHex(EVENT_ID)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void decode_rejectsTokenWithoutEventId() {
        InviteCodec.decode(Bech32.encode(InviteCodec.HRP, new byte[] {1, 3, 'a', 'b', 'c'}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void decode_rejectsGarbage() {
        InviteCodec.decode("nevent1notreallyatoken");
    }

    @Test
    public void findToken_extractsTokenFromInviteMessage() {
        String token = InviteCodec.encode(EVENT_ID, List.of("nats://relay-a:4222"));
        String text = "You've been invited to play golf at Pebble Creek!\n\nJoin: nostr:" + token + "\n\nSent from RAID Golf";
        assertEquals(token, InviteCodec.findToken(text));
        assertNull(InviteCodec.findToken("see you on the first tee"));
        assertNull(InviteCodec.findToken(null));
    }
}
