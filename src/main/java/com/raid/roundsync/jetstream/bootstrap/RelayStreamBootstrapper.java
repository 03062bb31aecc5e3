package com.raid.roundsync.jetstream.bootstrap;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.raid.roundsync.core.error.RelayUnavailableException;
import com.raid.roundsync.jetstream.config.RaidProperties;
import com.raid.roundsync.jetstream.config.RelayBootstrapProperties;
import com.raid.roundsync.jetstream.config.RelayConnectionPool;
import com.raid.roundsync.jetstream.config.RelayStreamProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;

/**
 * =====================================================================
 * RelayStreamBootstrapper
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Ensures that the event stream exists on every relay this device is
 * configured with, and that an existing stream matches the expected
 * configuration.
 *
 * WHEN THIS RUNS
 * --------------
 * - Once during Spring Boot startup, when raid.bootstrap.enabled=true
 *
 * FAILURE MODEL
 * -------------
 * - Relay unreachable → warn and continue with the next relay
 * - Auth / permission errors → fail
 * - Config drift → fail OR warn depending on failOnMismatch
 */
@Component
@ConditionalOnProperty(
        prefix = "raid.bootstrap",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class RelayStreamBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RelayStreamBootstrapper.class);

    /**
     * JetStream API error code indicating "stream not found".
     * Only the numeric code is relied on, never the message text.
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final RelayConnectionPool pool;
    private final RaidProperties raidProps;
    private final RelayStreamProperties streamProps;
    private final RelayBootstrapProperties bootstrapProps;

    public RelayStreamBootstrapper(
            RelayConnectionPool pool,
            RaidProperties raidProps,
            RelayStreamProperties streamProps,
            RelayBootstrapProperties bootstrapProps
    ) {
        this.pool = pool;
        this.raidProps = raidProps;
        this.streamProps = streamProps;
        this.bootstrapProps = bootstrapProps;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        StreamConfiguration desired = toStreamConfig(streamProps);
        int ensured = 0;
        for (String relay : raidProps.getRelays().all()) {
            JetStreamManagement jsm;
            try {
                jsm = pool.connection(relay).jetStreamManagement();
            } catch (RelayUnavailableException e) {
                log.warn("Skipping stream bootstrap on unreachable relay {}: {}", relay, e.getMessage());
                continue;
            }
            ensureStream(relay, jsm, desired);
            ensured++;
        }
        log.info("Relay stream bootstrap complete ({} relays)", ensured);
    }

    /**
     * Creates the stream if it does not exist, otherwise validates it.
     */
    void ensureStream(String relay, JetStreamManagement jsm, StreamConfiguration desired) throws Exception {
        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(relay, desired, existing);
            return;
        } catch (JetStreamApiException e) {
            // Only create the stream if it truly does not exist.
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created stream {} on {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={})",
                desired.getName(),
                relay,
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas());
    }

    private void validateExisting(String relay, StreamConfiguration desired, StreamInfo existing) {
        StreamConfiguration actual = existing.getConfiguration();
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType()
                    + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge()
                    + " expected=" + desired.getMaxAge());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects()
                    + " expected=" + desired.getSubjects());
        }

        if (diffs.isEmpty()) {
            log.info("Stream {} exists on {} and matches config", desired.getName(), relay);
            return;
        }

        String msg = "Stream " + desired.getName() + " on " + relay + " differs from expected :: "
                + String.join("; ", diffs);
        if (bootstrapProps.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    static StreamConfiguration toStreamConfig(RelayStreamProperties spec) {
        String name = spec.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("raid.relay.stream.name is required");
        }
        List<String> subjects = spec.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new IllegalArgumentException("subjects is required for stream " + name);
        }
        Duration maxAge = Objects.requireNonNull(spec.getMaxAge(), "maxAge is required for stream " + name);

        StreamConfiguration.Builder b = StreamConfiguration.builder()
                .name(name)
                .subjects(subjects.toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(spec.getRetentionPolicy()))
                .storageType(parseStorageType(spec.getStorageType()))
                .maxAge(maxAge)
                .replicas(spec.getReplicas());
        if (spec.getDuplicateWindow() != null) {
            b.duplicateWindow(spec.getDuplicateWindow());
        }
        return b.build();
    }

    /**
     * Default: Limits. Reading must never remove events from a relay.
     */
    private static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    private static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
