package com.raid.roundsync.service.invite;

import java.util.List;

/**
 * Outcome of {@link DirectMessageInviter#sendInvites}: who got the message and who did not.
 */
public record InviteReport(String initiationEventId, String inviteUri, List<String> sent, List<String> failed) {

    public InviteReport {
        sent = List.copyOf(sent);
        failed = List.copyOf(failed);
    }
}
