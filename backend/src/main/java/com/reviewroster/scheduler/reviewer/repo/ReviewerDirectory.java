package com.reviewroster.scheduler.reviewer.repo;

import com.reviewroster.scheduler.reviewer.model.HistoryRecord;
import com.reviewroster.scheduler.reviewer.model.Reviewer;
import com.reviewroster.scheduler.reviewer.model.ReviewerStatus;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage contract for reviewer records, active assignments and assignment history.
 * <p>
 * Every call is a complete unit against the store; implementations surface storage failures as
 * {@link org.springframework.dao.DataAccessException} and never retry.
 */
public interface ReviewerDirectory {

    /**
     * @return available reviewers with role {@code REVIEWER}, enumerated by id ascending
     */
    List<Reviewer> listEligibleReviewers();

    /**
     * @return active assignment count per reviewer id; unrouted assignments (empty reviewer id) are not counted
     */
    Map<String, Integer> countActiveAssignments();

    /**
     * @return whether any routed assignment (non-empty reviewer id) started strictly after {@code instant}
     */
    boolean existsRoutedAssignmentStartedAfter(Instant instant);

    /**
     * @return the history record with the highest id, if any
     */
    Optional<HistoryRecord> findLatestHistory();

    /**
     * Exact id lookup regardless of availability or role, so callers can tell "absent" from "ineligible".
     */
    Optional<Reviewer> findReviewer(String reviewerId);

    int updateStatus(String reviewerId, ReviewerStatus status, Instant changedAt);

    /**
     * Resets every non-idle reviewer whose status changed on or before {@code cutoffDate}.
     *
     * @return number of rows reset
     */
    int bulkResetStatus(LocalDate cutoffDate, Instant changedAt);

    /**
     * Substring search over available reviewers. Null fragments match everything.
     */
    List<Reviewer> search(String idFragment, String nameFragment, String phoneFragment, boolean onlyReviewers);

    boolean exists(String reviewerId, boolean onlyReviewers);
}
