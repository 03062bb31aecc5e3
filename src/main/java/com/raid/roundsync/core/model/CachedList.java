package com.raid.roundsync.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Durable mirror of one owner's follow list, favorites or inbox relay list.
 */
public record CachedList(
        SocialListKind kind,
        String ownerPublicKeyHex,
        List<String> members,
        Instant eventCreatedAt
) {

    public CachedList {
        members = List.copyOf(members);
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Whether a fetched list may replace this one: it must be non-empty, not older, and
     * actually different.
     */
    public boolean isReplaceableBy(CachedList fetched) {
        if (fetched == null || fetched.isEmpty()) {
            return false;
        }
        if (fetched.eventCreatedAt.isBefore(eventCreatedAt)) {
            return false;
        }
        return !fetched.members.equals(members);
    }
}
