package com.reviewroster.scheduler.reviewer.model;

public record ReviewerWorkload(
        String id,
        String name,
        String phone,
        ReviewerRole role,
        EffectiveStatus effectiveStatus,
        int backlogDifferential,
        int currentCount
) {
}
