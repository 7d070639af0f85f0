package com.reviewroster.scheduler.reviewer.model;

import java.time.Instant;

public record Reviewer(
        String id,
        String name,
        String phone,
        ReviewerRole role,
        boolean available,
        ReviewerStatus status,
        Instant statusSince,
        int backlogPages
) {

    public boolean isEligible() {
        return available && role == ReviewerRole.REVIEWER;
    }
}
