package net.driftwatch.adapter.jdbc.repo;

import net.driftwatch.adapter.jdbc.JdbcUtil;
import net.driftwatch.adapter.jdbc.TxContext;
import net.driftwatch.adapter.jdbc.mapper.RowMappers;
import net.driftwatch.core.model.ExecutionRecord;
import net.driftwatch.core.model.ExecutionResult;
import net.driftwatch.core.model.ScheduleStatistics;
import net.driftwatch.core.spi.ExecutionRecordRepository;

import java.sql.ResultSet;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcExecutionRecordRepository implements ExecutionRecordRepository {
    private static final int MAX_TEXT = 4000;
    private static final int MAX_SUMMARY = 400;

    @Override
    public ExecutionRecord insertStarted(ExecutionRecord started) throws Exception {
        long id;
        try (var ps = TxContext.mustGet().prepareStatement("""
            INSERT INTO TB_EXECUTION (SCHEDULE_ID, USER_ID, KIND, TRIGGER_KIND, STARTED_AT, SUCCESS)
            VALUES (?, ?, ?, ?, ?, 'N')
        """, new String[]{"ID"})) {
            ps.setLong(1, started.scheduleId());
            ps.setString(2, started.userId());
            ps.setString(3, started.kind());
            ps.setString(4, started.triggerKind().code());
            JdbcUtil.setInstant(ps, 5, started.startedAt());
            ps.executeUpdate();
            try (var k = ps.getGeneratedKeys()) { k.next(); id = k.getLong(1); }
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("insert failed to load execution"));
    }

    @Override
    public boolean complete(long id, ExecutionResult r) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
            UPDATE TB_EXECUTION
               SET COMPLETED_AT    = ?,
                   SUCCESS         = ?,
                   ITEMS_PROCESSED = ?,
                   ITEMS_ADDED     = ?,
                   ITEMS_UPDATED   = ?,
                   ITEMS_REMOVED   = ?,
                   ITEMS_FAILED    = ?,
                   DURATION_MS     = ?,
                   ERROR_MESSAGE   = ?,
                   ERROR_DETAILS   = ?,
                   CHANGE_SUMMARY  = ?
             WHERE ID = ?
               AND COMPLETED_AT IS NULL
        """)) {
            int i = 1;
            JdbcUtil.setInstant(ps, i++, r.completedAt());
            ps.setString(i++, JdbcUtil.yn(r.success()));
            ps.setInt(i++, r.itemsProcessed());
            ps.setInt(i++, r.itemsAdded());
            ps.setInt(i++, r.itemsUpdated());
            ps.setInt(i++, r.itemsRemoved());
            ps.setInt(i++, r.itemsFailed());
            if (r.duration() == null) ps.setNull(i++, Types.BIGINT);
            else ps.setLong(i++, Math.max(0, r.duration().toMillis()));
            ps.setString(i++, JdbcUtil.clip(r.errorMessage(), MAX_TEXT));
            ps.setString(i++, JdbcUtil.clip(r.errorDetails(), MAX_TEXT));
            ps.setString(i++, JdbcUtil.clip(r.changeSummary(), MAX_SUMMARY));
            ps.setLong(i, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public Optional<ExecutionRecord> findById(long id) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("SELECT * FROM TB_EXECUTION WHERE ID = ?")) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toExecution(rs));
            }
        }
    }

    @Override
    public List<ExecutionRecord> findByUserAndKind(String userId, String kind, int limit, int offset) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
            SELECT *
              FROM TB_EXECUTION
             WHERE USER_ID = ? AND KIND = ?
             ORDER BY STARTED_AT DESC, ID DESC
            OFFSET ? ROWS FETCH NEXT ? ROWS ONLY
        """)) {
            ps.setString(1, userId);
            ps.setString(2, kind);
            ps.setInt(3, offset);
            ps.setInt(4, limit);
            List<ExecutionRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toExecution(rs));
            }
            return out;
        }
    }

    @Override
    public List<ExecutionRecord> findOpen() throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
            SELECT * FROM TB_EXECUTION WHERE COMPLETED_AT IS NULL ORDER BY ID
        """)) {
            List<ExecutionRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toExecution(rs));
            }
            return out;
        }
    }

    @Override
    public ScheduleStatistics statistics(String userId, String kind, Instant since) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
            SELECT COUNT(*)                                               AS TOTAL_RUNS,
                   SUM(CASE WHEN SUCCESS = 'Y' THEN 1 ELSE 0 END)         AS OK_RUNS,
                   AVG(DURATION_MS)                                       AS AVG_MS,
                   SUM(ITEMS_PROCESSED)                                   AS ITEMS,
                   MAX(CASE WHEN SUCCESS = 'Y' THEN COMPLETED_AT END)     AS LAST_OK_AT,
                   MAX(CASE WHEN SUCCESS = 'N' THEN COMPLETED_AT END)     AS LAST_FAIL_AT
              FROM TB_EXECUTION
             WHERE USER_ID = ?
               AND KIND = ?
               AND STARTED_AT >= ?
               AND COMPLETED_AT IS NOT NULL
        """)) {
            ps.setString(1, userId);
            ps.setString(2, kind);
            JdbcUtil.setInstant(ps, 3, since);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return ScheduleStatistics.empty(userId, kind, since);
                long total = rs.getLong("TOTAL_RUNS");
                if (total == 0) return ScheduleStatistics.empty(userId, kind, since);
                long ok = rs.getLong("OK_RUNS");
                double avgMs = rs.getDouble("AVG_MS");
                return new ScheduleStatistics(
                        userId, kind, since,
                        total, ok, total - ok,
                        Duration.ofMillis(Math.round(avgMs)),
                        rs.getLong("ITEMS"),
                        JdbcUtil.getInstant(rs, "LAST_OK_AT"),
                        JdbcUtil.getInstant(rs, "LAST_FAIL_AT"));
            }
        }
    }
}
