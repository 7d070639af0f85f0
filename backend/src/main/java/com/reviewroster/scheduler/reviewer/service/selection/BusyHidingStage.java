package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.EffectiveStatus;
import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keeps idle and busy reviewers only. Drops very-busy reviewers and the anti-repeat one.
 *
 * @see EffectiveStatus#isAssignable()
 */
@Component
@Order(30)
public class BusyHidingStage implements SelectionStage {

    @Override
    public List<ReviewerWorkload> apply(List<ReviewerWorkload> workloads, SelectionRequest request) {
        if (!request.hideBusy()) return workloads;
        return workloads.stream().filter(w -> w.effectiveStatus().isAssignable()).toList();
    }
}
