package com.reviewroster.scheduler.reviewer.model;

/**
 * Stored busy state of a reviewer. Codes are persisted as-is in {@code reviewer.status}.
 */
public enum ReviewerStatus {
    IDLE(0),
    BUSY(1),
    VERY_BUSY(2);

    private final int code;

    ReviewerStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public EffectiveStatus toEffective() {
        return switch (this) {
            case IDLE -> EffectiveStatus.IDLE;
            case BUSY -> EffectiveStatus.BUSY;
            case VERY_BUSY -> EffectiveStatus.VERY_BUSY;
        };
    }

    public static ReviewerStatus fromCode(int code) {
        for (var status : values()) {
            if (status.code == code) return status;
        }
        throw new IllegalArgumentException("invalid_status");
    }
}
