package com.raid.roundsync.core.crypto;

import java.util.HexFormat;

import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.UnsignedEvent;

/**
 * Signs events with an identity and verifies events received from relays.
 *
 * <p>The signature covers the 32 bytes of the event id.</p>
 */
public final class EventSigner {

    private static final HexFormat HEX = HexFormat.of();

    private EventSigner() {
    }

    public static RelayEvent sign(UnsignedEvent event, IdentityKeys keys) {
        if (!event.pubkey().equals(keys.publicKeyHex())) {
            throw new IllegalArgumentException("Event author " + event.pubkey() + " is not the signing identity");
        }
        String id = event.computeId();
        String sig = HEX.formatHex(keys.sign(HEX.parseHex(id)));
        return new RelayEvent(id, event.pubkey(), event.createdAt(), event.kind(), event.tags(), event.content(), sig);
    }

    /**
     * True when the id matches the content and the signature is valid for the author key.
     */
    public static boolean verify(RelayEvent event) {
        if (event.sig() == null || !event.hasValidId()) {
            return false;
        }
        byte[] sig;
        try {
            sig = HEX.parseHex(event.sig());
        } catch (IllegalArgumentException e) {
            return false;
        }
        return IdentityKeys.verify(event.pubkey(), HEX.parseHex(event.id()), sig);
    }
}
