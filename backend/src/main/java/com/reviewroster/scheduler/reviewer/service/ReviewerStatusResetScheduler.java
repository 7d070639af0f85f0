package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.common.config.StatusResetProperties;
import com.reviewroster.scheduler.reviewer.repo.AdvisoryLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Lease-expiry sweep: a busy status that nobody refreshed within the timeout falls back to idle.
 */
@Component
@ConditionalOnProperty(name = "app.reviewer.status-reset.enabled", havingValue = "true", matchIfMissing = true)
public class ReviewerStatusResetScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReviewerStatusResetScheduler.class);

    static final String LOCK_KEY = "reviewer_status_reset";

    private final AdvisoryLockRepository lockRepository;
    private final ReviewerStatusService reviewerStatusService;
    private final int timeoutDays;

    public ReviewerStatusResetScheduler(
            AdvisoryLockRepository lockRepository,
            ReviewerStatusService reviewerStatusService,
            StatusResetProperties properties
    ) {
        this.lockRepository = lockRepository;
        this.reviewerStatusService = reviewerStatusService;
        this.timeoutDays = properties.timeoutDays();
    }

    @Scheduled(
            fixedDelayString = "${app.reviewer.status-reset.scan-interval-ms:3600000}",
            initialDelayString = "${app.reviewer.status-reset.initial-delay-ms:60000}"
    )
    public void sweepStaleStatuses() {
        try {
            var ran = lockRepository.runExclusively(LOCK_KEY, () -> {
                var reset = reviewerStatusService.resetStaleStatus(timeoutDays);
                log.debug("reviewer_status_reset_sweep timeoutDays={} reset={}", timeoutDays, reset);
            });
            if (!ran) {
                log.debug("reviewer_status_reset_skipped lockKey={}", LOCK_KEY);
            }
        } catch (Exception e) {
            log.warn("reviewer_status_reset_failed timeoutDays={}", timeoutDays, e);
        }
    }
}
