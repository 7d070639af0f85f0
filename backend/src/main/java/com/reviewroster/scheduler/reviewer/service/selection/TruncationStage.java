package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Order(40)
public class TruncationStage implements SelectionStage {

    @Override
    public List<ReviewerWorkload> apply(List<ReviewerWorkload> workloads, SelectionRequest request) {
        if (workloads.size() <= request.count()) return workloads;
        return workloads.subList(0, request.count());
    }
}
