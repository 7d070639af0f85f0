package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import com.reviewroster.scheduler.reviewer.service.selection.SelectionPipeline;
import com.reviewroster.scheduler.reviewer.service.selection.SelectionRequest;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Picks the next reviewers to receive work.
 * <p>
 * Selection is advisory: nothing is reserved, so two callers can be handed the same reviewer until one of them
 * records an active assignment. Callers that must not double-book need their own compare-and-set around
 * "select, then create the assignment".
 */
@Service
public class AssignmentSelector {

    private static final Logger log = LoggerFactory.getLogger(AssignmentSelector.class);

    private final WorkloadSnapshotBuilder snapshotBuilder;
    private final SelectionPipeline pipeline;

    // Low-cardinality metrics: do NOT tag by reviewer.
    private final Timer selectionDuration;
    private final DistributionSummary pickedPerSelection;

    public AssignmentSelector(
            WorkloadSnapshotBuilder snapshotBuilder,
            SelectionPipeline pipeline,
            MeterRegistry meterRegistry
    ) {
        this.snapshotBuilder = snapshotBuilder;
        this.pipeline = pipeline;

        this.selectionDuration = Timer.builder("review_roster.selection.duration")
                .description("Duration of reviewer selection including the snapshot read")
                .register(meterRegistry);
        this.pickedPerSelection = DistributionSummary.builder("review_roster.selection.picked")
                .description("Reviewers returned per selection")
                .baseUnit("reviewers")
                .register(meterRegistry);
    }

    /**
     * @return the single best reviewer, or an empty list when nobody is assignable
     */
    public List<ReviewerWorkload> next() {
        return select(1, null, false, true);
    }

    public List<ReviewerWorkload> select(int count, Collection<String> excludes, boolean urgent) {
        return select(count, excludes, urgent, true);
    }

    /**
     * @param count    maximum number of reviewers to return, must not be negative
     * @param excludes reviewer ids never to return; null or unknown ids are fine
     * @param urgent   move idle reviewers ahead of everybody else
     * @param hideBusy drop very-busy reviewers and the one who just finished work
     */
    public List<ReviewerWorkload> select(int count, Collection<String> excludes, boolean urgent, boolean hideBusy) {
        var request = SelectionRequest.of(count, excludes, urgent, hideBusy);
        if (request.count() == 0) {
            return List.of();
        }

        Timer.Sample sample = Timer.start();
        try {
            var snapshot = snapshotBuilder.buildSnapshot();
            var picked = pipeline.run(snapshot, request);
            pickedPerSelection.record(picked.size());
            log.debug(
                    "reviewer_selection count={} excludes={} urgent={} hideBusy={} pool={} picked={}",
                    request.count(),
                    request.excludes().size(),
                    urgent,
                    hideBusy,
                    snapshot.size(),
                    picked.stream().map(ReviewerWorkload::id).toList()
            );
            return picked;
        } finally {
            sample.stop(selectionDuration);
        }
    }
}
