package com.raid.roundsync.service.invite;

import java.util.List;

/**
 * Decoded invite: the round's initiation event id plus relays where it can be found.
 */
public record InviteToken(String eventId, List<String> relayHints) {

    public InviteToken {
        relayHints = relayHints == null ? List.of() : List.copyOf(relayHints);
    }
}
