package com.reviewroster.scheduler.reviewer.model;

/**
 * Status as seen by the selection pipeline.
 * <p>
 * Mirrors {@link ReviewerStatus} plus {@link #ANTI_REPEAT}, which is computed per snapshot and never stored.
 */
public enum EffectiveStatus {
    IDLE,
    BUSY,
    VERY_BUSY,
    ANTI_REPEAT;

    public boolean isAssignable() {
        return this == IDLE || this == BUSY;
    }
}
