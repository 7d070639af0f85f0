package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.reviewer.model.EffectiveStatus;
import com.reviewroster.scheduler.reviewer.model.HistoryRecord;
import com.reviewroster.scheduler.reviewer.model.Reviewer;
import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import com.reviewroster.scheduler.reviewer.repo.ReviewerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the per-reviewer workload view the selection pipeline runs over.
 * <p>
 * The returned list is ordered by active assignment count, then backlog differential. The sort is stable,
 * so reviewers with equal keys keep the directory's enumeration order.
 */
@Service
public class WorkloadSnapshotBuilder {

    private static final Logger log = LoggerFactory.getLogger(WorkloadSnapshotBuilder.class);

    static final Comparator<ReviewerWorkload> WORKLOAD_ORDER = Comparator
            .comparingInt(ReviewerWorkload::currentCount)
            .thenComparingInt(ReviewerWorkload::backlogDifferential);

    private final ReviewerDirectory reviewerDirectory;

    public WorkloadSnapshotBuilder(ReviewerDirectory reviewerDirectory) {
        this.reviewerDirectory = reviewerDirectory;
    }

    public List<ReviewerWorkload> buildSnapshot() {
        var reviewers = reviewerDirectory.listEligibleReviewers();
        if (reviewers.isEmpty()) {
            log.debug("workload_snapshot size=0");
            return List.of();
        }

        var counts = reviewerDirectory.countActiveAssignments();
        var minPages = reviewers.stream().mapToInt(Reviewer::backlogPages).min().orElse(0);
        var antiRepeatId = resolveAntiRepeatReviewer(reviewerDirectory.findLatestHistory().orElse(null));

        var snapshot = new ArrayList<ReviewerWorkload>(reviewers.size());
        for (var r : reviewers) {
            var effective = r.id().equals(antiRepeatId)
                    ? EffectiveStatus.ANTI_REPEAT
                    : r.status().toEffective();
            snapshot.add(new ReviewerWorkload(
                    r.id(),
                    r.name(),
                    r.phone(),
                    r.role(),
                    effective,
                    r.backlogPages() - minPages,
                    counts.getOrDefault(r.id(), 0)
            ));
        }
        snapshot.sort(WORKLOAD_ORDER);

        log.debug("workload_snapshot size={} antiRepeat={}", snapshot.size(), antiRepeatId);
        return List.copyOf(snapshot);
    }

    /**
     * The reviewer of the latest history record is held back only while no routed assignment has started after
     * that record ended. A record without an end time has nothing after it.
     *
     * @return reviewer id to flag, or null
     */
    private String resolveAntiRepeatReviewer(HistoryRecord latest) {
        if (latest == null || latest.reviewerId() == null || latest.reviewerId().isBlank()) return null;

        var endedAt = latest.endedAt();
        if (endedAt != null && reviewerDirectory.existsRoutedAssignmentStartedAfter(endedAt)) {
            return null;
        }
        return latest.reviewerId();
    }
}
