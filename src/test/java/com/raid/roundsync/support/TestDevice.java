package com.raid.roundsync.support;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.R2dbcTransactionManager;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raid.roundsync.api.JacksonConfig;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.model.AccountState;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.r2dbc.store.CourseSnapshotStore;
import com.raid.roundsync.r2dbc.store.HoleScoreStore;
import com.raid.roundsync.r2dbc.store.LocalWriteQueue;
import com.raid.roundsync.r2dbc.store.ProfileCacheStore;
import com.raid.roundsync.r2dbc.store.RemoteScoreStore;
import com.raid.roundsync.r2dbc.store.RoundNetworkStore;
import com.raid.roundsync.r2dbc.store.RoundStore;
import com.raid.roundsync.r2dbc.store.SocialListCacheStore;
import com.raid.roundsync.service.course.ContentAddressedCourseStore;
import com.raid.roundsync.service.identity.ThreeTierIdentityCache;
import com.raid.roundsync.service.invite.DirectMessageInviter;
import com.raid.roundsync.service.join.RoundJoinService;
import com.raid.roundsync.service.publish.EventPublisher;
import com.raid.roundsync.service.round.RoundAggregate;
import com.raid.roundsync.service.sync.SyncPoller;
import com.raid.roundsync.service.task.RoundTaskRegistry;

import io.r2dbc.h2.H2ConnectionFactory;
import io.r2dbc.spi.ConnectionFactory;

/**
 * One device wired by hand: its own in-memory database, identity and clock, talking to a
 * relay that may be shared with other devices.
 */
public final class TestDevice implements AutoCloseable {

    public static final Instant START = Instant.parse("2026-05-02T14:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final ObjectMapper mapper = new JacksonConfig().objectMapper();
    public final IdentityKeys keys;
    public final AccountState account;
    public final FakeRelayClient relays;
    public final RaidProperties props = new RaidProperties();

    public final DatabaseClient db;
    public final LocalWriteQueue writes = new LocalWriteQueue();
    public final CourseSnapshotStore courseRows;
    public final RoundStore roundRows;
    public final HoleScoreStore scoreRows;
    public final RoundNetworkStore network;
    public final RemoteScoreStore remoteScores;
    public final ProfileCacheStore profileRows;
    public final SocialListCacheStore listRows;

    public final RoundTaskRegistry tasks = new RoundTaskRegistry();
    public final ContentAddressedCourseStore courses;
    public final RoundAggregate rounds;
    public final EventPublisher publisher;
    public final SyncPoller poller;
    public final ThreeTierIdentityCache identities;
    public final DirectMessageInviter inviter;
    public final RoundJoinService joiner;

    private TestDevice(IdentityKeys keys, boolean activated, FakeRelayClient relays) {
        this.keys = keys;
        this.account = new AccountState(keys.publicKeyHex(), activated);
        this.relays = relays;
        props.getRelays().setPublish(List.of(FakeRelayClient.RELAY));
        props.getRelays().setRead(List.of(FakeRelayClient.RELAY));
        props.getRelays().setInboxFallback(List.of(FakeRelayClient.RELAY));

        ConnectionFactory cf = H2ConnectionFactory.inMemory("raid-" + UUID.randomUUID());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).populate(cf).block();
        this.db = DatabaseClient.create(cf);
        TransactionalOperator tx = TransactionalOperator.create(new R2dbcTransactionManager(cf));

        this.courseRows = new CourseSnapshotStore(db, tx, writes);
        this.roundRows = new RoundStore(db, tx, writes);
        this.scoreRows = new HoleScoreStore(db, writes);
        this.network = new RoundNetworkStore(db, writes);
        this.remoteScores = new RemoteScoreStore(db, mapper, writes);
        this.profileRows = new ProfileCacheStore(db, writes);
        this.listRows = new SocialListCacheStore(db, mapper, writes);

        this.courses = new ContentAddressedCourseStore(courseRows, clock);
        this.rounds = new RoundAggregate(roundRows, scoreRows, courses, clock);
        this.publisher = new EventPublisher(rounds, network, relays, keys, account, tasks, clock);
        this.poller = new SyncPoller(rounds, network, remoteScores, relays, clock);
        this.identities = new ThreeTierIdentityCache(profileRows, listRows, relays, mapper, clock);
        this.inviter = new DirectMessageInviter(rounds, network, identities, relays, keys, account, props, clock);
        this.joiner = new RoundJoinService(relays, courses, rounds, network, keys, props);
    }

    public static TestDevice create() {
        return new TestDevice(IdentityKeys.generate(), true, new FakeRelayClient());
    }

    /** Another device on the same relay. */
    public static TestDevice sharing(FakeRelayClient relays) {
        return new TestDevice(IdentityKeys.generate(), true, relays);
    }

    public static TestDevice readOnly() {
        return new TestDevice(IdentityKeys.generate(), false, new FakeRelayClient());
    }

    public String key() {
        return keys.publicKeyHex();
    }

    @Override
    public void close() {
        tasks.destroy();
        writes.destroy();
    }
}
