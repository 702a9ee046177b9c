package net.driftwatch.adapter.jdbc.repo;

import net.driftwatch.adapter.jdbc.JdbcUtil;
import net.driftwatch.adapter.jdbc.TxContext;
import net.driftwatch.adapter.jdbc.mapper.RowMappers;
import net.driftwatch.core.model.ScheduleConfig;
import net.driftwatch.core.model.ScheduleFilter;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.ScheduleRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class JdbcScheduleRepository implements ScheduleRepository {
    private static final int MAX_ERROR = 4000;

    private final Clock clock;

    public JdbcScheduleRepository(Clock clock) { this.clock = clock; }

    @Override
    public ScheduleConfig upsert(ScheduleConfig config) throws Exception {
        Connection c = TxContext.mustGet();
        Instant now = clock.now();

        // (USER_ID, KIND) 유니크. UPDATE 먼저, 없으면 INSERT
        int updated;
        try (var ps = c.prepareStatement("""
            UPDATE TB_SCHEDULE
               SET INTERVAL_MS       = ?,
                   ACTIVE_START_HOUR = ?,
                   ACTIVE_END_HOUR   = ?,
                   ENABLED           = ?,
                   NEXT_RUN_AT       = ?,
                   UPDATED_AT        = ?
             WHERE USER_ID = ? AND KIND = ?
        """)) {
            int i = bindSettings(ps, config, now);
            ps.setString(i++, config.userId());
            ps.setString(i, config.kind());
            updated = ps.executeUpdate();
        }

        if (updated == 0) {
            try (var ps = c.prepareStatement("""
                INSERT INTO TB_SCHEDULE
                    (INTERVAL_MS, ACTIVE_START_HOUR, ACTIVE_END_HOUR, ENABLED, NEXT_RUN_AT, UPDATED_AT,
                     USER_ID, KIND, CONSECUTIVE_FAILURES, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?)
            """)) {
                int i = bindSettings(ps, config, now);
                ps.setString(i++, config.userId());
                ps.setString(i++, config.kind());
                JdbcUtil.setInstant(ps, i, now);
                ps.executeUpdate();
            }
        }
        return findByUserAndKind(config.userId(), config.kind())
                .orElseThrow(() -> new IllegalStateException(
                        "upsert failed to load schedule: " + config.userId() + "/" + config.kind()));
    }

    private static int bindSettings(PreparedStatement ps, ScheduleConfig s, Instant now) throws SQLException {
        int i = 1;
        ps.setLong(i++, s.interval().toMillis());
        if (s.activeHours() == null) {
            ps.setNull(i++, Types.INTEGER);
            ps.setNull(i++, Types.INTEGER);
        } else {
            ps.setInt(i++, s.activeHours().startHour());
            ps.setInt(i++, s.activeHours().endHour());
        }
        ps.setString(i++, JdbcUtil.yn(s.enabled()));
        JdbcUtil.setInstant(ps, i++, s.nextRunAt());
        JdbcUtil.setInstant(ps, i++, now);
        return i;
    }

    @Override
    public Optional<ScheduleConfig> findById(long id) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("SELECT * FROM TB_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<ScheduleConfig> findByUserAndKind(String userId, String kind) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULE
                 WHERE USER_ID = ? AND KIND = ?
            """)) {
            ps.setString(1, userId);
            ps.setString(2, kind);
            return single(ps);
        }
    }

    @Override
    public List<ScheduleConfig> findAll(ScheduleFilter filter) throws Exception {
        StringBuilder sql = new StringBuilder("SELECT * FROM TB_SCHEDULE WHERE 1 = 1");
        List<String> args = new ArrayList<>();
        if (filter.userId() != null) { sql.append(" AND USER_ID = ?"); args.add(filter.userId()); }
        if (filter.kind() != null)   { sql.append(" AND KIND = ?");    args.add(filter.kind()); }
        if (filter.enabledOnly())    { sql.append(" AND ENABLED = 'Y'"); }
        sql.append(" ORDER BY USER_ID, KIND");

        try (var ps = TxContext.mustGet().prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) ps.setString(i + 1, args.get(i));
            return list(ps);
        }
    }

    @Override
    public List<ScheduleConfig> findEnabled() throws Exception {
        return findAll(ScheduleFilter.enabled());
    }

    @Override
    public List<ScheduleConfig> findDue(Instant now) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
                SELECT *
                  FROM TB_SCHEDULE
                 WHERE ENABLED = 'Y'
                   AND NEXT_RUN_AT <= ?
                 ORDER BY NEXT_RUN_AT ASC, ID ASC
            """)) {
            JdbcUtil.setInstant(ps, 1, now);
            return list(ps);
        }
    }

    @Override
    public void updateNextRun(long id, Instant nextRunAt) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET NEXT_RUN_AT = ?, UPDATED_AT = ?
                 WHERE ID = ?
            """)) {
            JdbcUtil.setInstant(ps, 1, nextRunAt);
            JdbcUtil.setInstant(ps, 2, clock.now());
            ps.setLong(3, id);
            ps.executeUpdate();
        }
    }

    @Override
    public void recordOutcome(long id, Instant lastRunAt, Instant nextRunAt, boolean success, String error) throws Exception {
        // 실패 카운트 증감은 한 문장으로 (동시 갱신 시 유실 없음)
        try (var ps = TxContext.mustGet().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LAST_RUN_AT          = ?,
                       NEXT_RUN_AT          = ?,
                       CONSECUTIVE_FAILURES = CASE WHEN CAST(? AS CHAR(1)) = 'Y' THEN 0
                                                   ELSE CONSECUTIVE_FAILURES + 1 END,
                       LAST_ERROR           = ?,
                       UPDATED_AT           = ?
                 WHERE ID = ?
            """)) {
            JdbcUtil.setInstant(ps, 1, lastRunAt);
            JdbcUtil.setInstant(ps, 2, nextRunAt);
            ps.setString(3, JdbcUtil.yn(success));
            ps.setString(4, success ? null : JdbcUtil.clip(error, MAX_ERROR));
            JdbcUtil.setInstant(ps, 5, clock.now());
            ps.setLong(6, id);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean deleteById(long id) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("DELETE FROM TB_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public boolean deleteByUserAndKind(String userId, String kind) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("DELETE FROM TB_SCHEDULE WHERE USER_ID = ? AND KIND = ?")) {
            ps.setString(1, userId);
            ps.setString(2, kind);
            return ps.executeUpdate() > 0;
        }
    }

    private static Optional<ScheduleConfig> single(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toSchedule(rs));
        }
    }

    private static List<ScheduleConfig> list(PreparedStatement ps) throws SQLException {
        List<ScheduleConfig> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toSchedule(rs));
        }
        return out;
    }
}
