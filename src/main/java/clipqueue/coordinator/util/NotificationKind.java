package clipqueue.coordinator.util;

public enum NotificationKind {
    /** Structural or status change, published synchronously */
    IMMEDIATE,
    /** Bare progress tick, coalesced into one trailing publish per window */
    THROTTLED
}
