package com.raid.roundsync.service.identity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.raid.roundsync.core.crypto.EventSigner;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.event.EventKind;
import com.raid.roundsync.core.event.Tags;
import com.raid.roundsync.core.event.UnsignedEvent;
import com.raid.roundsync.core.model.CachedList;
import com.raid.roundsync.core.model.Profile;
import com.raid.roundsync.core.model.SocialListKind;
import com.raid.roundsync.support.TestDevice;

public class ThreeTierIdentityCacheTest {

    private TestDevice device;
    private final IdentityKeys alice = IdentityKeys.generate();

    @Before
    public void setUp() {
        device = TestDevice.create();
    }

    @After
    public void tearDown() {
        device.close();
    }

    private long at(int minutesAgo) {
        return device.clock.instant().getEpochSecond() - minutesAgo * 60L;
    }

    private void seed(IdentityKeys author, int kind, long createdAt, List<List<String>> tags, String content) {
        device.relays.seed(EventSigner.sign(new UnsignedEvent(author.publicKeyHex(), createdAt, kind, tags, content), author));
    }

    private ThreeTierIdentityCache freshMemory() {
        return new ThreeTierIdentityCache(device.profileRows, device.listRows, device.relays, device.mapper, device.clock);
    }

    @Test
    public void resolve_fetchesAndPersistsProfile() {
        seed(alice, EventKind.PROFILE, at(30), List.of(), "{\"name\":\"alice\",\"about\":\"golfer\"}");

        Profile p = device.identities.profile(alice.publicKeyHex()).block();
        assertEquals("alice", p.name());
        assertEquals("golfer", p.about());

        device.relays.setOffline(true);
        Profile fromDb = freshMemory().cached(List.of(alice.publicKeyHex())).block().get(alice.publicKeyHex());
        assertEquals("alice", fromDb.name());
        assertEquals(Instant.ofEpochSecond(at(30)), fromDb.eventCreatedAt());
    }

    @Test
    public void resolve_sparseNewerProfileDoesNotBlankKnownFields() {
        seed(alice, EventKind.PROFILE, at(30), List.of(), "{\"name\":\"alice\",\"about\":\"golfer\"}");
        device.identities.profile(alice.publicKeyHex()).block();

        seed(alice, EventKind.PROFILE, at(5), List.of(), "{\"display_name\":\"Alice B\"}");
        Profile p = device.identities.profile(alice.publicKeyHex()).block();

        assertEquals("alice", p.name());
        assertEquals("golfer", p.about());
        assertEquals("Alice B", p.displayName());
        assertEquals("Alice B", p.label());
    }

    @Test
    public void resolve_relayFailureKeepsCachedProfile() {
        seed(alice, EventKind.PROFILE, at(30), List.of(), "{\"name\":\"alice\"}");
        device.identities.profile(alice.publicKeyHex()).block();
        device.relays.setOffline(true);

        assertEquals("alice", device.identities.profile(alice.publicKeyHex()).block().name());
    }

    @Test
    public void cached_unknownKeyIsEmptyProfileWithoutNetwork() {
        String unknown = IdentityKeys.generate().publicKeyHex();
        Map<String, Profile> cached = device.identities.cached(List.of(unknown)).block();
        assertNull(cached.get(unknown).name());
        assertEquals(Instant.EPOCH, cached.get(unknown).eventCreatedAt());
    }

    @Test
    public void list_emptyFetchNeverOverwritesFollows() {
        String bob = IdentityKeys.generate().publicKeyHex();
        String carol = IdentityKeys.generate().publicKeyHex();
        seed(alice, EventKind.CONTACTS, at(30), List.of(Tags.tag("p", bob), Tags.tag("p", carol)), "");
        assertEquals(List.of(bob, carol), device.identities.list(SocialListKind.FOLLOWS, alice.publicKeyHex()).block().members());

        seed(alice, EventKind.CONTACTS, at(1), List.of(), "");
        CachedList after = device.identities.list(SocialListKind.FOLLOWS, alice.publicKeyHex()).block();
        assertEquals(List.of(bob, carol), after.members());

        CachedList persisted = freshMemory().cachedList(SocialListKind.FOLLOWS, alice.publicKeyHex()).block();
        assertEquals(List.of(bob, carol), persisted.members());
    }

    @Test
    public void list_newerNonEmptyFetchReplaces() {
        String bob = IdentityKeys.generate().publicKeyHex();
        String dave = IdentityKeys.generate().publicKeyHex();
        seed(alice, EventKind.FOLLOW_SET, at(30), List.of(Tags.tag("d", EventKind.CLUBHOUSE_SET), Tags.tag("p", bob)), "");
        device.identities.list(SocialListKind.FAVORITES, alice.publicKeyHex()).block();

        seed(alice, EventKind.FOLLOW_SET, at(2), List.of(Tags.tag("d", EventKind.CLUBHOUSE_SET), Tags.tag("p", dave)), "");
        seed(alice, EventKind.FOLLOW_SET, at(1), List.of(Tags.tag("d", "range-buddies"), Tags.tag("p", bob)), "");

        assertEquals(List.of(dave), device.identities.list(SocialListKind.FAVORITES, alice.publicKeyHex()).block().members());
    }

    @Test
    public void replaceIfFresher_olderFetchIsIgnored() {
        Instant now = device.clock.instant();
        CachedList current = new CachedList(SocialListKind.INBOX_RELAYS, alice.publicKeyHex(), List.of("nats://a:4222"), now);
        CachedList older = new CachedList(SocialListKind.INBOX_RELAYS, alice.publicKeyHex(), List.of("nats://b:4222"),
                now.minusSeconds(60));
        assertEquals(current, device.identities.replaceIfFresher(current, older).block());
    }

    @Test
    public void inboxRelays_emptyWhenNothingPublished() {
        assertTrue(device.identities.inboxRelays(alice.publicKeyHex()).block().isEmpty());
        List<String> relays = new ArrayList<>(List.of("nats://inbox:4222"));
        seed(alice, EventKind.INBOX_RELAYS, at(3), List.of(Tags.tag("relay", relays.get(0))), "");
        assertEquals(relays, device.identities.inboxRelays(alice.publicKeyHex()).block());
    }
}
