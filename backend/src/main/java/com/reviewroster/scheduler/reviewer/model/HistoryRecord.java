package com.reviewroster.scheduler.reviewer.model;

import java.time.Instant;

public record HistoryRecord(long id, String reviewerId, Instant endedAt) {
}
