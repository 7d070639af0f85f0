package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.reviewer.model.ReviewerStatus;
import com.reviewroster.scheduler.reviewer.repo.ReviewerDirectory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Owns every change to a reviewer's stored status and {@code status_since}.
 */
@Service
public class ReviewerStatusService {

    private static final Logger log = LoggerFactory.getLogger(ReviewerStatusService.class);

    private final ReviewerDirectory reviewerDirectory;
    private final Clock clock;
    private final Counter reclaimed;

    public ReviewerStatusService(ReviewerDirectory reviewerDirectory, Clock clock, MeterRegistry meterRegistry) {
        this.reviewerDirectory = reviewerDirectory;
        this.clock = clock;
        this.reclaimed = Counter.builder("review_roster.status_reset.reclaimed")
                .description("Reviewers returned to idle by the stale status reset")
                .register(meterRegistry);
    }

    public void setStatus(String reviewerId, int statusCode) {
        setStatus(reviewerId, ReviewerStatus.fromCode(statusCode));
    }

    public void setStatus(String reviewerId, ReviewerStatus status) {
        if (reviewerId == null || reviewerId.isBlank()) throw new IllegalArgumentException("reviewer_id_required");
        if (status == null) throw new IllegalArgumentException("invalid_status");

        var reviewer = reviewerDirectory.findReviewer(reviewerId)
                .orElseThrow(() -> new ReviewerNotFoundException(ReviewerNotFoundException.NOT_FOUND, reviewerId));
        if (!reviewer.isEligible()) {
            throw new ReviewerNotFoundException(ReviewerNotFoundException.NOT_ELIGIBLE, reviewerId);
        }

        var now = clock.instant();
        var updated = reviewerDirectory.updateStatus(reviewerId, status, now);
        if (updated == 0) {
            throw new ReviewerNotFoundException(ReviewerNotFoundException.NOT_FOUND, reviewerId);
        }
        log.info("reviewer_status_set reviewerId={} from={} to={}", reviewerId, reviewer.status(), status);
    }

    /**
     * Returns every non-idle reviewer whose status is at least {@code timeoutDays} calendar days old to idle.
     *
     * @return number of reviewers reset
     */
    public int resetStaleStatus(int timeoutDays) {
        if (timeoutDays < 0) throw new IllegalArgumentException("invalid_timeout_days");

        var now = clock.instant();
        var cutoff = LocalDate.now(clock).minusDays(timeoutDays);
        var affected = reviewerDirectory.bulkResetStatus(cutoff, now);
        reclaimed.increment(affected);
        if (affected > 0) {
            log.info("reviewer_status_reset timeoutDays={} cutoff={} reset={}", timeoutDays, cutoff, affected);
        }
        return affected;
    }
}
