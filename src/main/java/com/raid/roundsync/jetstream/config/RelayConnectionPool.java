package com.raid.roundsync.jetstream.config;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import com.raid.roundsync.core.error.RelayUnavailableException;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;

/**
 * One lazily opened NATS connection per relay URL.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Relays are reached on demand: a relay that is down at startup does not prevent the
 *       application from starting or from scoring.</li>
 *   <li>Shared auth settings (user/password, token, creds) apply to every relay; TLS follows
 *       the URL scheme.</li>
 *   <li>All connections are closed on application shutdown.</li>
 * </ul>
 *
 * <h2>Failure behavior</h2>
 * A failed connect raises {@link RelayUnavailableException} and is not cached, so the next
 * operation tries again.
 */
public class RelayConnectionPool implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RelayConnectionPool.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(3);

    private final RaidProperties.NatsAuth auth;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public RelayConnectionPool(RaidProperties.NatsAuth auth) {
        this.auth = auth;
    }

    /**
     * Returns an open connection to {@code relayUrl}, connecting if needed. Blocking; call from
     * a bounded-elastic thread.
     */
    public Connection connection(String relayUrl) {
        Connection existing = connections.get(relayUrl);
        if (existing != null && existing.getStatus() != Connection.Status.CLOSED) {
            return existing;
        }
        return connections.compute(relayUrl, (url, current) -> {
            if (current != null && current.getStatus() != Connection.Status.CLOSED) {
                return current;
            }
            return connect(url);
        });
    }

    private Connection connect(String url) {
        Options.Builder builder = new Options.Builder()
                .server(url)
                .connectionTimeout(CONNECT_TIMEOUT)
                .maxReconnects(60)
                .connectionName("raid-round-sync");

        if (notBlank(auth.getToken())) {
            builder.token(auth.getToken().toCharArray());
        }
        if (notBlank(auth.getUser())) {
            String pass = auth.getPassword() == null ? "" : auth.getPassword();
            builder.userInfo(auth.getUser().toCharArray(), pass.toCharArray());
        }
        if (notBlank(auth.getCreds())) {
            builder.authHandler(Nats.credentials(auth.getCreds()));
        }

        try {
            Connection c = Nats.connect(builder.build());
            log.info("Connected to relay (url={}, user={}, creds={})",
                    url,
                    auth.getUser() == null ? "" : mask(auth.getUser()),
                    auth.getCreds() == null ? "" : auth.getCreds());
            return c;
        } catch (IOException e) {
            throw new RelayUnavailableException(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayUnavailableException(url, e);
        }
    }

    @Override
    public void destroy() {
        for (Map.Entry<String, Connection> e : connections.entrySet()) {
            try {
                e.getValue().close();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while closing relay connection {}", e.getKey());
            }
        }
        connections.clear();
    }

    private static boolean notBlank(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * Masks an identifier for logging. Example: "admin" -> "a***n".
     */
    private static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
