package com.raid.roundsync.core.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.Tags;
import com.raid.roundsync.core.event.UnsignedEvent;

/**
 * Three-layer private message: an unsigned rumor, sealed (encrypted and signed) by the real
 * sender, then wrapped (encrypted again and signed) by a throwaway key.
 *
 * <p>Relays only see the wrap: a random author, the recipient's {@code p} tag and a
 * {@code created_at} shifted up to two days into the past.</p>
 */
public final class GiftWrap {

    static final long MAX_BACKDATE_SECONDS = 2 * 24 * 60 * 60;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final SecureRandom RANDOM = new SecureRandom();

    private GiftWrap() {
    }

    /** What a recipient recovers from a wrap. */
    public record Opened(RelayEvent rumor, String senderPublicKeyHex, String wrapEventId) {
    }

    public static RelayEvent wrap(UnsignedEvent rumor, IdentityKeys sender, String recipientPublicKeyHex, long nowSeconds) {
        if (!rumor.pubkey().equals(sender.publicKeyHex())) {
            throw new IllegalArgumentException("Rumor author must be the sender");
        }
        String rumorJson = toJson(rumor.asRumor());
        UnsignedEvent seal = new UnsignedEvent(sender.publicKeyHex(), randomPast(nowSeconds), EventKind.SEAL,
                List.of(), PrivateMessageCipher.encrypt(rumorJson, sender, recipientPublicKeyHex));
        RelayEvent signedSeal = EventSigner.sign(seal, sender);

        IdentityKeys ephemeral = IdentityKeys.generate();
        UnsignedEvent wrap = new UnsignedEvent(ephemeral.publicKeyHex(), randomPast(nowSeconds), EventKind.GIFT_WRAP,
                List.of(Tags.tag("p", recipientPublicKeyHex)),
                PrivateMessageCipher.encrypt(toJson(signedSeal), ephemeral, recipientPublicKeyHex));
        return EventSigner.sign(wrap, ephemeral);
    }

    /**
     * Opens a wrap addressed to {@code recipient}.
     *
     * @throws GeneralSecurityException if any layer fails to decrypt, the seal signature is invalid,
     *                                  or the rumor claims a different author than the seal
     */
    public static Opened open(RelayEvent wrap, IdentityKeys recipient) throws GeneralSecurityException {
        if (wrap.kind() != EventKind.GIFT_WRAP) {
            throw new GeneralSecurityException("Not a gift wrap: kind " + wrap.kind());
        }
        RelayEvent seal = fromJson(PrivateMessageCipher.decrypt(wrap.content(), recipient, wrap.pubkey()));
        if (seal.kind() != EventKind.SEAL || !EventSigner.verify(seal)) {
            throw new GeneralSecurityException("Seal inside wrap " + wrap.id() + " is invalid");
        }
        RelayEvent rumor = fromJson(PrivateMessageCipher.decrypt(seal.content(), recipient, seal.pubkey()));
        if (!seal.pubkey().equals(rumor.pubkey())) {
            throw new GeneralSecurityException("Rumor author does not match seal author");
        }
        if (!rumor.hasValidId()) {
            throw new GeneralSecurityException("Rumor id does not match its content");
        }
        return new Opened(rumor, seal.pubkey(), wrap.id());
    }

    private static long randomPast(long nowSeconds) {
        return nowSeconds - (long) (RANDOM.nextDouble() * MAX_BACKDATE_SECONDS);
    }

    private static String toJson(RelayEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Event serialization failed", e);
        }
    }

    private static RelayEvent fromJson(String json) throws GeneralSecurityException {
        try {
            return MAPPER.readValue(json, RelayEvent.class);
        } catch (JsonProcessingException e) {
            throw new GeneralSecurityException("Decrypted layer is not an event", e);
        }
    }
}
