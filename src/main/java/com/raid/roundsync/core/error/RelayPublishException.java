package com.raid.roundsync.core.error;

import java.util.List;

/**
 * No configured relay accepted a published event.
 */
public class RelayPublishException extends RuntimeException {

    private final String eventId;
    private final List<String> failedRelays;

    public RelayPublishException(String eventId, List<String> failedRelays, Throwable lastCause) {
        super("Event " + eventId + " was not accepted by any relay " + failedRelays, lastCause);
        this.eventId = eventId;
        this.failedRelays = List.copyOf(failedRelays);
    }

    public String getEventId() {
        return eventId;
    }

    public List<String> getFailedRelays() {
        return failedRelays;
    }
}
