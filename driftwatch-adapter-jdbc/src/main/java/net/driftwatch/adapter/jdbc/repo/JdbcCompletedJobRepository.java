package net.driftwatch.adapter.jdbc.repo;

import net.driftwatch.adapter.jdbc.JdbcUtil;
import net.driftwatch.adapter.jdbc.TxContext;
import net.driftwatch.core.spi.Clock;
import net.driftwatch.core.spi.CompletedJobRepository;

import java.sql.Connection;
import java.sql.ResultSet;
import java.util.HashSet;
import java.util.Set;

public final class JdbcCompletedJobRepository implements CompletedJobRepository {
    private final Clock clock;

    public JdbcCompletedJobRepository(Clock clock) { this.clock = clock; }

    @Override
    public Set<String> findJobIds(String userId) throws Exception {
        try (var ps = TxContext.mustGet().prepareStatement("SELECT JOB_ID FROM TB_COMPLETED_JOB WHERE USER_ID = ?")) {
            ps.setString(1, userId);
            Set<String> out = new HashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
            return out;
        }
    }

    @Override
    public void markCompleted(String userId, String jobId) throws Exception {
        Connection c = TxContext.mustGet();
        // 멱등: 이미 있으면 시각만 갱신
        try (var upd = c.prepareStatement("UPDATE TB_COMPLETED_JOB SET COMPLETED_AT = ? WHERE USER_ID = ? AND JOB_ID = ?")) {
            JdbcUtil.setInstant(upd, 1, clock.now());
            upd.setString(2, userId);
            upd.setString(3, jobId);
            if (upd.executeUpdate() > 0) return;
        }
        try (var ins = c.prepareStatement("INSERT INTO TB_COMPLETED_JOB (USER_ID, JOB_ID, COMPLETED_AT) VALUES (?, ?, ?)")) {
            ins.setString(1, userId);
            ins.setString(2, jobId);
            JdbcUtil.setInstant(ins, 3, clock.now());
            ins.executeUpdate();
        }
    }
}
