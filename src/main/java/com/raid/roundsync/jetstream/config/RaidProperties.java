package com.raid.roundsync.jetstream.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Device-level configuration: identity, account activation, relay sets and NATS credentials.
 *
 * <h2>Binding</h2>
 * Bound from the {@code raid} prefix, e.g.:
 * <pre>
 * raid:
 *   identity-key-file: ./data/identity.key
 *   account:
 *     activated: true
 *   relays:
 *     publish: [nats://relay-a:4222, tls://relay-b:4222]
 *     read: [nats://relay-a:4222]
 *     inbox-fallback: [nats://relay-a:4222]
 *     read-timeout: 5s
 *   nats:
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *   invite:
 *     await-attempts: 10
 *     await-interval: 2s
 *     lookback: 7d
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Relays are independent NATS JetStream servers; no single relay is authoritative, so
 *       publishing goes to every relay in {@code publish}.</li>
 *   <li>TLS is selected per relay by using a {@code tls://} URL.</li>
 *   <li>Credentials apply to every relay. Treat password and token as secrets.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "raid")
public class RaidProperties {

    /** File holding the device's Ed25519 seed and public key; created on first start. */
    private String identityKeyFile = "./data/identity.key";

    private Account account = new Account();
    private Relays relays = new Relays();
    private NatsAuth nats = new NatsAuth();
    private Invite invite = new Invite();

    public String getIdentityKeyFile() { return identityKeyFile; }
    public void setIdentityKeyFile(String identityKeyFile) { this.identityKeyFile = identityKeyFile; }

    public Account getAccount() { return account; }
    public void setAccount(Account account) { this.account = account; }

    public Relays getRelays() { return relays; }
    public void setRelays(Relays relays) { this.relays = relays; }

    public NatsAuth getNats() { return nats; }
    public void setNats(NatsAuth nats) { this.nats = nats; }

    public Invite getInvite() { return invite; }
    public void setInvite(Invite invite) { this.invite = invite; }

    public static class Account {

        /**
         * Whether this device may write to the relay network. A non-activated device still
         * scores locally.
         */
        private boolean activated = true;

        public boolean isActivated() { return activated; }
        public void setActivated(boolean activated) { this.activated = activated; }
    }

    public static class Relays {

        private List<String> publish = new ArrayList<>(List.of("nats://localhost:4222"));
        private List<String> read = new ArrayList<>(List.of("nats://localhost:4222"));

        /** Used for private messages when a recipient has no inbox relay list. */
        private List<String> inboxFallback = new ArrayList<>(List.of("nats://localhost:4222"));

        /** Upper bound on a single relay query. */
        private Duration readTimeout = Duration.ofSeconds(5);

        /** Maximum messages pulled per subject per relay. */
        private int fetchBatch = 256;

        public List<String> getPublish() { return publish; }
        public void setPublish(List<String> publish) { this.publish = publish == null ? new ArrayList<>() : publish; }

        public List<String> getRead() { return read; }
        public void setRead(List<String> read) { this.read = read == null ? new ArrayList<>() : read; }

        public List<String> getInboxFallback() { return inboxFallback; }
        public void setInboxFallback(List<String> inboxFallback) {
            this.inboxFallback = inboxFallback == null ? new ArrayList<>() : inboxFallback;
        }

        public Duration getReadTimeout() { return readTimeout; }
        public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }

        public int getFetchBatch() { return fetchBatch; }
        public void setFetchBatch(int fetchBatch) { this.fetchBatch = fetchBatch; }

        /** Every relay this device talks to, in configuration order, without duplicates. */
        public Set<String> all() {
            Set<String> out = new LinkedHashSet<>(publish);
            out.addAll(read);
            out.addAll(inboxFallback);
            return out;
        }
    }

    public static class NatsAuth {

        private String user;

        /** Secret; never logged. */
        private String password;

        /** Secret; never logged. */
        private String token;

        /** Path to a {@code .creds} file for NKey/JWT authentication. */
        private String creds;

        public String getUser() { return user; }
        public void setUser(String user) { this.user = user; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public String getCreds() { return creds; }
        public void setCreds(String creds) { this.creds = creds; }
    }

    public static class Invite {

        /** Attempts made while waiting for a round's initiation id before issuing a token. */
        private int awaitAttempts = 10;

        private Duration awaitInterval = Duration.ofSeconds(2);

        /** How far back incoming invites are looked up. */
        private Duration lookback = Duration.ofDays(7);

        public int getAwaitAttempts() { return awaitAttempts; }
        public void setAwaitAttempts(int awaitAttempts) { this.awaitAttempts = awaitAttempts; }

        public Duration getAwaitInterval() { return awaitInterval; }
        public void setAwaitInterval(Duration awaitInterval) { this.awaitInterval = awaitInterval; }

        public Duration getLookback() { return lookback; }
        public void setLookback(Duration lookback) { this.lookback = lookback; }
    }
}
