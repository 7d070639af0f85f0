package com.reviewroster.scheduler.reviewer.repo;

import com.reviewroster.scheduler.reviewer.model.HistoryRecord;
import com.reviewroster.scheduler.reviewer.model.Reviewer;
import com.reviewroster.scheduler.reviewer.model.ReviewerRole;
import com.reviewroster.scheduler.reviewer.model.ReviewerStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class JdbcReviewerDirectory implements ReviewerDirectory {

    private static final String REVIEWER_COLUMNS = "id, name, phone, role, available, status, status_since, pages";

    private static final RowMapper<Reviewer> REVIEWER_MAPPER = (rs, rowNum) -> new Reviewer(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("phone"),
            ReviewerRole.fromCode(rs.getInt("role")),
            rs.getBoolean("available"),
            ReviewerStatus.fromCode(rs.getInt("status")),
            toInstant(rs.getTimestamp("status_since")),
            rs.getInt("pages")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcReviewerDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Reviewer> listEligibleReviewers() {
        var sql = """
                select %s
                from reviewer
                where available = true
                  and role = ?
                order by id asc
                """.formatted(REVIEWER_COLUMNS);
        return jdbcTemplate.query(sql, REVIEWER_MAPPER, ReviewerRole.REVIEWER.code());
    }

    @Override
    public Map<String, Integer> countActiveAssignments() {
        var sql = """
                select reviewer_id, count(1) as active
                from active_assignment
                where reviewer_id <> ''
                group by reviewer_id
                """;
        var map = new HashMap<String, Integer>();
        jdbcTemplate.query(sql, rs -> {
            map.put(rs.getString("reviewer_id"), rs.getInt("active"));
        });
        return map;
    }

    @Override
    public boolean existsRoutedAssignmentStartedAfter(Instant instant) {
        var sql = """
                select 1
                from active_assignment
                where started_at > ?
                  and reviewer_id <> ''
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> 1, Timestamp.from(instant));
        return !list.isEmpty();
    }

    @Override
    public Optional<HistoryRecord> findLatestHistory() {
        var sql = """
                select id, reviewer_id, ended_at
                from assignment_history
                order by id desc
                limit 1
                """;
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> new HistoryRecord(
                rs.getLong("id"),
                rs.getString("reviewer_id"),
                toInstant(rs.getTimestamp("ended_at"))
        ));
        return list.stream().findFirst();
    }

    @Override
    public Optional<Reviewer> findReviewer(String reviewerId) {
        var sql = "select %s from reviewer where id = ?".formatted(REVIEWER_COLUMNS);
        var list = jdbcTemplate.query(sql, REVIEWER_MAPPER, reviewerId);
        return list.stream().findFirst();
    }

    @Override
    public int updateStatus(String reviewerId, ReviewerStatus status, Instant changedAt) {
        var sql = """
                update reviewer
                set status = ?, status_since = ?
                where id = ?
                """;
        return jdbcTemplate.update(sql, status.code(), Timestamp.from(changedAt), reviewerId);
    }

    @Override
    public int bulkResetStatus(LocalDate cutoffDate, Instant changedAt) {
        var sql = """
                update reviewer
                set status = ?, status_since = ?
                where status <> ?
                  and cast(status_since as date) <= ?
                """;
        return jdbcTemplate.update(
                sql,
                ReviewerStatus.IDLE.code(),
                Timestamp.from(changedAt),
                ReviewerStatus.IDLE.code(),
                Date.valueOf(cutoffDate)
        );
    }

    @Override
    public List<Reviewer> search(String idFragment, String nameFragment, String phoneFragment, boolean onlyReviewers) {
        var sql = new StringBuilder();
        sql.append("select ").append(REVIEWER_COLUMNS).append(" ");
        sql.append("from reviewer ");
        sql.append("where available = true ");
        sql.append("  and id like ? and name like ? and phone like ? ");
        if (onlyReviewers) {
            sql.append("  and role = ").append(ReviewerRole.REVIEWER.code()).append(" ");
        }
        sql.append("order by id asc");
        return jdbcTemplate.query(
                sql.toString(),
                REVIEWER_MAPPER,
                containsPattern(idFragment),
                containsPattern(nameFragment),
                containsPattern(phoneFragment)
        );
    }

    @Override
    public boolean exists(String reviewerId, boolean onlyReviewers) {
        var sql = onlyReviewers
                ? "select 1 from reviewer where available = true and role = " + ReviewerRole.REVIEWER.code() + " and id = ? limit 1"
                : "select 1 from reviewer where available = true and id = ? limit 1";
        var list = jdbcTemplate.query(sql, (rs, rowNum) -> 1, reviewerId);
        return !list.isEmpty();
    }

    private static String containsPattern(String fragment) {
        if (fragment == null || fragment.isEmpty()) return "%";
        var escaped = fragment
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
