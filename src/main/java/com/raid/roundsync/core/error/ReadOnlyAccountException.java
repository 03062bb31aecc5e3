package com.raid.roundsync.core.error;

/**
 * A network write was requested while the account is not activated.
 */
public class ReadOnlyAccountException extends RuntimeException {

    public ReadOnlyAccountException(String operation) {
        super("Account is read-only; cannot " + operation);
    }
}
