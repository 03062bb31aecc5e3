package com.raid.roundsync.core.model;

import java.util.Objects;

/**
 * Identity and activation state of the device owner, passed explicitly to the services that
 * publish to the relay network.
 *
 * <p>A non-activated account can still score rounds locally; every network write is refused.</p>
 */
public record AccountState(String publicKeyHex, boolean activated) {

    public AccountState {
        Objects.requireNonNull(publicKeyHex, "publicKeyHex");
    }

    public boolean canPublish() {
        return activated;
    }
}
