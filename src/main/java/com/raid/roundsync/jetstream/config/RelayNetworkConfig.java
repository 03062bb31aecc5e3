package com.raid.roundsync.jetstream.config;

import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.raid.roundsync.core.crypto.IdentityKeyFile;
import com.raid.roundsync.core.crypto.IdentityKeys;
import com.raid.roundsync.core.model.AccountState;

/**
 * Spring configuration that wires up:
 * - the relay connection pool (one NATS connection per relay, opened lazily)
 * - the device identity and its {@link AccountState}
 * - property binding for all relay-related configuration classes
 */
@Configuration
@EnableConfigurationProperties({
        RaidProperties.class,            // identity, relay sets, NATS auth, invite timing
        RelayStreamProperties.class,     // stream spec used by bootstrap and queries
        RelayBootstrapProperties.class   // bootstrap toggles
})
public class RelayNetworkConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayNetworkConfig.class);

    @Bean
    public RelayConnectionPool relayConnectionPool(RaidProperties props) {
        log.info("Relays: publish={} read={} inboxFallback={}",
                props.getRelays().getPublish(), props.getRelays().getRead(), props.getRelays().getInboxFallback());
        return new RelayConnectionPool(props.getNats());
    }

    @Bean
    public IdentityKeys identityKeys(RaidProperties props) {
        return IdentityKeyFile.loadOrCreate(Path.of(props.getIdentityKeyFile()));
    }

    /**
     * Activation is read once from configuration and passed explicitly to the services that
     * publish.
     */
    @Bean
    public AccountState accountState(IdentityKeys keys, RaidProperties props) {
        AccountState state = new AccountState(keys.publicKeyHex(), props.getAccount().isActivated());
        if (!state.canPublish()) {
            log.warn("Account {} is not activated; relay publishing is disabled", keys.publicKeyHex());
        }
        return state;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
