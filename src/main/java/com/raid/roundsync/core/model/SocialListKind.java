package com.raid.roundsync.core.model;

/**
 * The three key-owned lists mirrored by the identity cache.
 */
public enum SocialListKind {

    /** Contact list, kind 3, ordered followed keys. */
    FOLLOWS,

    /** Curated "clubhouse" set, kind 30000 with d=clubhouse. */
    FAVORITES,

    /** Preferred private-message relays, kind 10050. */
    INBOX_RELAYS
}
