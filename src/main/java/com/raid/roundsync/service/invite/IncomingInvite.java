package com.raid.roundsync.service.invite;

import java.time.Instant;
import java.util.List;

/**
 * A round invite received as a private message.
 */
public record IncomingInvite(
        String initiationEventId,
        List<String> relayHints,
        String senderPublicKeyHex,
        String senderLabel,
        String message,
        Instant receivedAt
) {

    public IncomingInvite {
        relayHints = List.copyOf(relayHints);
    }
}
