package com.reviewroster.scheduler.reviewer.service.selection;

import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;

import java.util.List;

/**
 * One step of the reviewer selection pipeline.
 * <p>
 * Stages must keep the relative order of the reviewers they pass through.
 */
public interface SelectionStage {

    List<ReviewerWorkload> apply(List<ReviewerWorkload> workloads, SelectionRequest request);
}
