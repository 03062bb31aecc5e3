package com.raid.roundsync.core.subject;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.List;

import org.junit.Test;

import com.raid.roundsync.core.crypto.EventSigner;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.RelayEvent;
import com.raid.roundsync.core.event.Tags;
import com.raid.roundsync.core.event.UnsignedEvent;

public class RelaySubjectTest {

    private static final String INITIATION = "ab".repeat(32);

    private final IdentityKeys keys = IdentityKeys.generate();

    private RelayEvent event(int kind, List<List<String>> tags) {
        return EventSigner.sign(new UnsignedEvent(keys.publicKeyHex(), 1_760_000_000L, kind, tags, ""), keys);
    }

    @Test
    public void of_initiationHasNoRef() {
        RelayEvent e = event(EventKind.ROUND_INITIATION, List.of());
        assertEquals("raid.1501." + keys.publicKeyHex() + "._." + e.id(), RelaySubject.of(e).toSubject());
    }

    @Test
    public void of_finalRecordIsFiledUnderItsInitiation() {
        RelayEvent e = event(EventKind.FINAL_RECORD, List.of(Tags.tag("e", INITIATION)));
        assertEquals(INITIATION, RelaySubject.of(e).ref());
    }

    @Test
    public void of_liveScorecardUsesIdentifier() {
        RelayEvent e = event(EventKind.LIVE_SCORECARD, List.of(Tags.tag("d", INITIATION), Tags.tag("e", "other")));
        assertEquals(INITIATION, RelaySubject.of(e).ref());
    }

    @Test
    public void of_hashesRefWithWildcardCharacters() {
        RelayEvent e = event(EventKind.FOLLOW_SET, List.of(Tags.tag("d", "golf.buddies>*")));
        String ref = RelaySubject.of(e).ref();
        assertEquals(64, ref.length());
        assertEquals(RelaySubject.refToken("golf.buddies>*"), ref);
    }

    @Test
    public void filter_nullsBecomeWildcards() {
        assertEquals("raid.0.*.*.*", RelaySubject.filter(EventKind.PROFILE, null, null, null));
        assertEquals("raid.1059.*." + INITIATION + ".*", RelaySubject.filter(EventKind.GIFT_WRAP, null, INITIATION, null));
    }

    @Test(expected = IllegalArgumentException.class)
    public void filter_rejectsWildcardInjectionThroughAuthor() {
        RelaySubject.filter(EventKind.PROFILE, "abc.>", null, null);
    }

    @Test
    public void tryParse_readsCanonicalSubjectAndRejectsOthers() {
        RelaySubject.Parsed p = RelaySubject.tryParse("raid.30501.author1.ref1.id1");
        assertEquals(30501, p.kind);
        assertEquals("author1", p.author);
        assertEquals("ref1", p.ref);
        assertEquals("id1", p.id);

        assertNull(RelaySubject.tryParse("raid.30501.author1.ref1"));
        assertNull(RelaySubject.tryParse("up.leaf.z1.sz1.n1"));
        assertNull(RelaySubject.tryParse("raid.x1.a.b.c"));
        assertNull(RelaySubject.tryParse(null));
    }
}
