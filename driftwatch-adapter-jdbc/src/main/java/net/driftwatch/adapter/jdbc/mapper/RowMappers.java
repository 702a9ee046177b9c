package net.driftwatch.adapter.jdbc.mapper;

import net.driftwatch.adapter.jdbc.JdbcUtil;
import net.driftwatch.core.model.*;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;

public final class RowMappers {
    private RowMappers() {}

    // --- Schedule ---
    public static ScheduleConfig toSchedule(ResultSet rs) throws SQLException {
        int start = rs.getInt("ACTIVE_START_HOUR");
        boolean noHours = rs.wasNull();
        int end = rs.getInt("ACTIVE_END_HOUR");
        noHours |= rs.wasNull();
        return new ScheduleConfig(
                rs.getLong("ID"),
                rs.getString("USER_ID"),
                rs.getString("KIND"),
                Duration.ofMillis(rs.getLong("INTERVAL_MS")),
                noHours ? null : new ActiveHours(start, end),
                JdbcUtil.isY(rs.getString("ENABLED")),
                JdbcUtil.getInstant(rs, "LAST_RUN_AT"),
                JdbcUtil.getInstant(rs, "NEXT_RUN_AT"),
                rs.getInt("CONSECUTIVE_FAILURES"),
                rs.getString("LAST_ERROR"),
                JdbcUtil.getInstant(rs, "CREATED_AT"),
                JdbcUtil.getInstant(rs, "UPDATED_AT")
        );
    }

    // --- Execution ---
    public static ExecutionRecord toExecution(ResultSet rs) throws SQLException {
        long durationMs = rs.getLong("DURATION_MS");
        Duration duration = rs.wasNull() ? null : Duration.ofMillis(durationMs);
        long scheduleId = rs.getLong("SCHEDULE_ID");
        return new ExecutionRecord(
                rs.getLong("ID"),
                rs.wasNull() ? null : scheduleId,
                rs.getString("USER_ID"),
                rs.getString("KIND"),
                TriggerKind.from(rs.getString("TRIGGER_KIND")),
                JdbcUtil.getInstant(rs, "STARTED_AT"),
                JdbcUtil.getInstant(rs, "COMPLETED_AT"),
                JdbcUtil.isY(rs.getString("SUCCESS")),
                rs.getInt("ITEMS_PROCESSED"),
                rs.getInt("ITEMS_ADDED"),
                rs.getInt("ITEMS_UPDATED"),
                rs.getInt("ITEMS_REMOVED"),
                rs.getInt("ITEMS_FAILED"),
                duration,
                rs.getString("ERROR_MESSAGE"),
                rs.getString("ERROR_DETAILS"),
                rs.getString("CHANGE_SUMMARY")
        );
    }

    // --- JobRecord ---
    public static JobRecord toJobRecord(ResultSet rs) throws SQLException {
        return new JobRecord(
                rs.getString("JOB_ID"),
                rs.getString("GROUP_KEY"),
                JdbcUtil.getDate(rs, "SCHEDULED_DATE"),
                rs.getString("SERVICE_TYPE"),
                rs.getInt("QUANTITY")
        );
    }
}
