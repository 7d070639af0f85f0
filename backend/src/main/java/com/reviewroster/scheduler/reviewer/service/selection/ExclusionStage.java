package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(10)
public class ExclusionStage implements SelectionStage {

    @Override
    public List<ReviewerWorkload> apply(List<ReviewerWorkload> workloads, SelectionRequest request) {
        var excludes = request.excludes();
        if (excludes.isEmpty()) return workloads;
        return workloads.stream().filter(w -> !excludes.contains(w.id())).toList();
    }
}
