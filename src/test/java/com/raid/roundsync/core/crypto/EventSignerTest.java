package com.raid.roundsync.core.crypto;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.Tags;
import com.raid.roundsync.core.event.UnsignedEvent;

public class EventSignerTest {

    private final IdentityKeys alice = IdentityKeys.generate();

    private UnsignedEvent note(String author) {
        return new UnsignedEvent(author, 1_760_000_000L, EventKind.ROUND_INITIATION,
                List.of(Tags.tag("t", "golf")), "{\"a\":1}");
    }

    @Test
    public void sign_producesVerifiableEvent() {
        RelayEvent signed = EventSigner.sign(note(alice.publicKeyHex()), alice);
        assertEquals(64, signed.id().length());
        assertEquals(128, signed.sig().length());
        assertTrue(EventSigner.verify(signed));
    }

    @Test
    public void verify_rejectsAlteredContent() {
        RelayEvent signed = EventSigner.sign(note(alice.publicKeyHex()), alice);
        RelayEvent altered = new RelayEvent(signed.id(), signed.pubkey(), signed.createdAt(), signed.kind(),
                signed.tags(), "{\"a\":2}", signed.sig());
        assertFalse(EventSigner.verify(altered));
    }

    @Test
    public void verify_rejectsSignatureFromOtherKey() {
        IdentityKeys mallory = IdentityKeys.generate();
        RelayEvent signed = EventSigner.sign(note(alice.publicKeyHex()), alice);
        RelayEvent forged = EventSigner.sign(note(mallory.publicKeyHex()), mallory);
        RelayEvent swapped = new RelayEvent(signed.id(), signed.pubkey(), signed.createdAt(), signed.kind(),
                signed.tags(), signed.content(), forged.sig());
        assertFalse(EventSigner.verify(swapped));
    }

    @Test
    public void verify_rejectsUnsignedRumor() {
        assertFalse(EventSigner.verify(note(alice.publicKeyHex()).asRumor()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void sign_refusesEventOfAnotherAuthor() {
        EventSigner.sign(note(IdentityKeys.generate().publicKeyHex()), alice);
    }

    @Test
    public void restore_roundTripsStoredIdentity() {
        IdentityKeys restored = IdentityKeys.restore(alice.seedHex(), alice.publicKeyHex());
        assertEquals(alice.publicKeyHex(), restored.publicKeyHex());
        RelayEvent signed = EventSigner.sign(note(restored.publicKeyHex()), restored);
        assertTrue(EventSigner.verify(signed));
    }

    @Test(expected = IllegalArgumentException.class)
    public void restore_rejectsMismatchedPublicKey() {
        IdentityKeys.restore(alice.seedHex(), IdentityKeys.generate().publicKeyHex());
    }
}
