package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the selection stages in order: exclusion, urgency boost, busy hiding, truncation.
 */
@Component
public class SelectionPipeline {

    private final List<SelectionStage> stages;

    public SelectionPipeline(List<SelectionStage> stages) {
        if (stages == null || stages.isEmpty()) throw new IllegalArgumentException("selection_stages_required");
        this.stages = List.copyOf(stages);
    }

    public static SelectionPipeline standard() {
        return new SelectionPipeline(List.of(
                new ExclusionStage(),
                new UrgencyBoostStage(),
                new BusyHidingStage(),
                new TruncationStage()
        ));
    }

    public List<ReviewerWorkload> run(List<ReviewerWorkload> snapshot, SelectionRequest request) {
        var current = snapshot;
        for (var stage : stages) {
            current = stage.apply(current, request);
        }
        return List.copyOf(current);
    }
}
