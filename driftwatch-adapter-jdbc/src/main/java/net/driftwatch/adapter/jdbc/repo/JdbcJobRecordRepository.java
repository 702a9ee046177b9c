package net.driftwatch.adapter.jdbc.repo;

import net.driftwatch.adapter.jdbc.JdbcUtil;
import net.driftwatch.adapter.jdbc.TxContext;
import net.driftwatch.adapter.jdbc.mapper.RowMappers;
import net.driftwatch.core.model.JobRecord;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.JobRecordRepository;

import java.sql.Connection;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class JdbcJobRecordRepository implements JobRecordRepository {
    private final Clock clock;

    public JdbcJobRecordRepository(Clock clock) { this.clock = clock; }

    @Override
    public List<JobRecord> findAll(String userId, String kind) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("""
            SELECT *
              FROM TB_JOB_RECORD
             WHERE USER_ID = ? AND KIND = ?
             ORDER BY JOB_ID
        """)) {
            ps.setString(1, userId);
            ps.setString(2, kind);
            List<JobRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toJobRecord(rs));
            }
            return out;
        }
    }

    @Override
    public void upsertAll(String userId, String kind, Collection<JobRecord> records) throws Exception {
        if (records.isEmpty()) return;
        Connection c = TxContext.mustGet();
        Instant now = clock.now();
        try (var upd = c.prepareStatement("""
                UPDATE TB_JOB_RECORD
                   SET GROUP_KEY = ?, SCHEDULED_DATE = ?, SERVICE_TYPE = ?, QUANTITY = ?, UPDATED_AT = ?
                 WHERE USER_ID = ? AND KIND = ? AND JOB_ID = ?
             """);
             var ins = c.prepareStatement("""
                INSERT INTO TB_JOB_RECORD
                    (GROUP_KEY, SCHEDULED_DATE, SERVICE_TYPE, QUANTITY, UPDATED_AT, USER_ID, KIND, JOB_ID)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
             """)) {
            for (JobRecord r : records) {
                if (r == null || r.id() == null) continue;
                for (var ps : List.of(upd, ins)) {
                    ps.setString(1, r.groupKey());
                    JdbcUtil.setDate(ps, 2, r.scheduledDate());
                    ps.setString(3, r.serviceType());
                    ps.setInt(4, r.quantity());
                    JdbcUtil.setInstant(ps, 5, now);
                    ps.setString(6, userId);
                    ps.setString(7, kind);
                    ps.setString(8, r.id());
                }
                if (upd.executeUpdate() == 0) ins.executeUpdate();
            }
        }
    }

    @Override
    public int deleteByIds(String userId, String kind, Collection<String> jobIds) throws Exception {
        if (jobIds.isEmpty()) return 0;
        int deleted = 0;
        try (var ps = TxContext.mustGet().prepareStatement("""
            DELETE FROM TB_JOB_RECORD WHERE USER_ID = ? AND KIND = ? AND JOB_ID = ?
        """)) {
            for (String id : jobIds) {
                ps.setString(1, userId);
                ps.setString(2, kind);
                ps.setString(3, id);
                deleted += ps.executeUpdate();
            }
        }
        return deleted;
    }
}
