package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Kinds of jobs the scheduler knows how to run.
 * <p>
 * The code is persisted inside the job metadata blob, so existing codes must never
 * be reassigned. Unique kinds may have at most one live job in the store.
 */
@Getter
@RequiredArgsConstructor
public enum SchedulerJobType {

    /**
     * Periodically sends notifications whose scheduled time has come
     */
    NOTIFICATIONS_SEND((byte) 0, "Notifications Send", true),

    /**
     * Triggers a single web page tracker, created on demand per tracker
     */
    WEB_PAGE_TRACKERS_TRIGGER((byte) 1, "Web Page Trackers Trigger", false);

    private final byte code;
    private final String displayName;
    private final boolean unique;

    /**
     * Find SchedulerJobType by its persisted code
     */
    public static SchedulerJobType fromCode(byte code) {
        for (var type : values()) {
            if (type.getCode() == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + Byte.toUnsignedInt(code));
    }
}
