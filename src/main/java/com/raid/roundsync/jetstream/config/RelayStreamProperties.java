package com.raid.roundsync.jetstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Definition of the JetStream stream every relay stores events in.
 *
 * <p><b>Conceptual model</b></p>
 * <ul>
 *   <li>One stream per relay holds all event kinds under {@code raid.>}.</li>
 *   <li>{@code Limits} retention: events stay until they age out, whatever the number of readers.
 *       Queries create short-lived consumers and never acknowledge, so nothing is removed by
 *       reading.</li>
 *   <li>The duplicate window lets a re-published event (same id) be dropped server-side.</li>
 * </ul>
 *
 * <p>Configuration prefix: {@code raid.relay.stream}</p>
 */
@ConfigurationProperties(prefix = "raid.relay.stream")
public class RelayStreamProperties {

    private String name = "RAID_EVENTS";

    private List<String> subjects = new ArrayList<>(List.of("raid.>"));

    /** How long events are retained. */
    private Duration maxAge = Duration.ofDays(365);

    /** {@code limits | interest | workqueue}. */
    private String retentionPolicy = "limits";

    /** {@code file | memory}. */
    private String storageType = "file";

    private int replicas = 1;

    /** JetStream message-id de-duplication window. */
    private Duration duplicateWindow = Duration.ofMinutes(2);

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<String> getSubjects() { return subjects; }
    public void setSubjects(List<String> subjects) { this.subjects = subjects; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public String getRetentionPolicy() { return retentionPolicy; }
    public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

    public String getStorageType() { return storageType; }
    public void setStorageType(String storageType) { this.storageType = storageType; }

    public int getReplicas() { return replicas; }
    public void setReplicas(int replicas) { this.replicas = replicas; }

    public Duration getDuplicateWindow() { return duplicateWindow; }
    public void setDuplicateWindow(Duration duplicateWindow) { this.duplicateWindow = duplicateWindow; }
}
