package com.reviewroster.scheduler.reviewer.service;

import com.reviewroster.scheduler.reviewer.model.EffectiveStatus;
import com.reviewroster.scheduler.reviewer.model.Reviewer;
import com.reviewroster.scheduler.reviewer.model.ReviewerRole;
import com.reviewroster.scheduler.reviewer.model.ReviewerStatus;
import com.reviewroster.scheduler.reviewer.model.ReviewerWorkload;
import com.reviewroster.scheduler.reviewer.repo.InMemoryReviewerDirectory;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkloadSnapshotBuilderTest {

    private static final Instant T0 = Instant.parse("2026-05-01T08:00:00Z");

    private static List<String> ids(List<ReviewerWorkload> list) {
        return list.stream().map(ReviewerWorkload::id).toList();
    }

    private static ReviewerWorkload find(List<ReviewerWorkload> list, String id) {
        return list.stream().filter(w -> w.id().equals(id)).findFirst().orElseThrow();
    }

    @Test
    void orders_by_current_count_then_backlog_differential() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 12)
                .reviewer("r2", ReviewerStatus.IDLE, 10)
                .reviewer("r3", ReviewerStatus.BUSY, 15)
                .reviewer("r4", ReviewerStatus.IDLE, 30)
                .assignment("r1", T0)
                .assignment("r4", T0)
                .assignment("r4", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(List.of("r2", "r3", "r1", "r4"), ids(snapshot));
        assertEquals(0, find(snapshot, "r2").backlogDifferential());
        assertEquals(5, find(snapshot, "r3").backlogDifferential());
        assertEquals(2, find(snapshot, "r1").backlogDifferential());
        assertEquals(20, find(snapshot, "r4").backlogDifferential());
        assertEquals(2, find(snapshot, "r4").currentCount());
        assertEquals(0, find(snapshot, "r3").currentCount());
    }

    @Test
    void ties_keep_directory_enumeration_order() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("d", ReviewerStatus.IDLE, 5)
                .reviewer("b", ReviewerStatus.BUSY, 5)
                .reviewer("c", ReviewerStatus.IDLE, 5)
                .reviewer("a", ReviewerStatus.VERY_BUSY, 5);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        // directory enumerates by id
        assertEquals(List.of("a", "b", "c", "d"), ids(snapshot));
        snapshot.forEach(w -> assertEquals(0, w.backlogDifferential()));
    }

    @Test
    void only_eligible_reviewers_take_part_and_set_the_minimum() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 8)
                .put(new Reviewer("gone", "g", "", ReviewerRole.REVIEWER, false, ReviewerStatus.IDLE, T0, 0))
                .put(new Reviewer("plain", "p", "", ReviewerRole.ORDINARY, true, ReviewerStatus.IDLE, T0, 1))
                .assignment("gone", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(List.of("r1"), ids(snapshot));
        assertEquals(0, snapshot.get(0).backlogDifferential());
    }

    @Test
    void latest_history_reviewer_flagged_when_nothing_started_since() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 0)
                .reviewer("r2", ReviewerStatus.BUSY, 0)
                .history(1, "r2", T0.minusSeconds(600))
                .history(2, "r1", T0)
                .assignment("r2", T0.minusSeconds(60))
                .assignment("r2", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(EffectiveStatus.ANTI_REPEAT, find(snapshot, "r1").effectiveStatus());
        assertEquals(EffectiveStatus.BUSY, find(snapshot, "r2").effectiveStatus());
    }

    @Test
    void flag_cleared_once_a_newer_assignment_starts() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 0)
                .reviewer("r2", ReviewerStatus.IDLE, 0)
                .history(7, "r1", T0)
                .assignment("r2", T0.plusSeconds(1));

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        snapshot.forEach(w -> assertEquals(EffectiveStatus.IDLE, w.effectiveStatus()));
    }

    @Test
    void unrouted_assignments_do_not_clear_the_flag() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.BUSY, 0)
                .history(3, "r1", T0)
                .assignment("", T0.plusSeconds(30))
                .assignment(null, T0.plusSeconds(40));

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(EffectiveStatus.ANTI_REPEAT, find(snapshot, "r1").effectiveStatus());
        assertEquals(0, find(snapshot, "r1").currentCount());
    }

    @Test
    void only_the_single_latest_record_counts() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 0)
                .reviewer("r2", ReviewerStatus.IDLE, 0)
                .history(10, "r2", T0)
                .history(4, "r1", T0.plusSeconds(100));

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(EffectiveStatus.IDLE, find(snapshot, "r1").effectiveStatus());
        assertEquals(EffectiveStatus.ANTI_REPEAT, find(snapshot, "r2").effectiveStatus());
    }

    @Test
    void start_equal_to_end_is_not_after() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 0)
                .reviewer("r2", ReviewerStatus.IDLE, 0)
                .history(1, "r1", T0)
                .assignment("r2", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(EffectiveStatus.ANTI_REPEAT, find(snapshot, "r1").effectiveStatus());
    }

    @Test
    void history_without_end_time_still_flags() {
        var dir = new InMemoryReviewerDirectory()
                .reviewer("r1", ReviewerStatus.IDLE, 0)
                .reviewer("r2", ReviewerStatus.IDLE, 0)
                .history(1, "r1", null)
                .assignment("r2", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertEquals(EffectiveStatus.ANTI_REPEAT, find(snapshot, "r1").effectiveStatus());
    }

    @Test
    void empty_pool_reads_nothing_else() {
        var dir = new InMemoryReviewerDirectory().history(1, "r1", T0);

        var snapshot = new WorkloadSnapshotBuilder(dir).buildSnapshot();

        assertTrue(snapshot.isEmpty());
        assertEquals(1, dir.reads());
    }
}
