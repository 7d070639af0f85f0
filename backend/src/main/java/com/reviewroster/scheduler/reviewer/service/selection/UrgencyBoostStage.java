package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.EffectiveStatus;
import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Urgent requests move idle reviewers to the front. Nobody is dropped.
 */
@Component
@Order(20)
public class UrgencyBoostStage implements SelectionStage {

    @Override
    public List<ReviewerWorkload> apply(List<ReviewerWorkload> workloads, SelectionRequest request) {
        if (!request.urgent()) return workloads;

        var idle = new ArrayList<ReviewerWorkload>(workloads.size());
        var rest = new ArrayList<ReviewerWorkload>();
        for (var w : workloads) {
            if (w.effectiveStatus() == EffectiveStatus.IDLE) {
                idle.add(w);
            } else {
                rest.add(w);
            }
        }
        idle.addAll(rest);
        return idle;
    }
}
