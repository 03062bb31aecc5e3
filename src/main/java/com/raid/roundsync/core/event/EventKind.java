package com.raid.roundsync.core.event;

/**
 * Event kinds exchanged over the relay network.
 */
public final class EventKind {

    public static final int PROFILE = 0;
    public static final int CONTACTS = 3;
    public static final int SEAL = 13;
    public static final int PRIVATE_MESSAGE = 14;
    public static final int GIFT_WRAP = 1059;
    public static final int ROUND_INITIATION = 1501;
    public static final int FINAL_RECORD = 1502;
    public static final int INBOX_RELAYS = 10050;
    public static final int FOLLOW_SET = 30000;
    public static final int LIVE_SCORECARD = 30501;

    /** d tag of the curated favorites set. */
    public static final String CLUBHOUSE_SET = "clubhouse";

    private EventKind() {
    }

    /** Addressable kinds are identified by (kind, author, d tag) rather than by id. */
    public static boolean isAddressable(int kind) {
        return kind >= 30000 && kind < 40000;
    }
}
