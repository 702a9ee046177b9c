package net.driftwatch.adapter.jdbc;

import net.driftwatch.core.error.PersistenceException;
import net.driftwatch.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** Spring 없이 쓰는 TxRunner. SQLException은 PersistenceException으로 감싼다. */
public final class JdbcTxRunner implements TxRunner {
    private static final Logger log = LoggerFactory.getLogger(JdbcTxRunner.class);

    private final DataSource ds;

    public JdbcTxRunner(DataSource ds) { this.ds = ds; }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 진행 중인 트랜잭션에 참여
            return body.call();
        }
        return inNewTransaction(body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        // 바깥 커넥션은 잠시 내려두고 끝나면 복원
        Connection suspended = TxContext.get();
        try {
            return inNewTransaction(body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T inNewTransaction(Callable<T> body) throws Exception {
        try (Connection c = open()) {
            boolean prevAuto = c.getAutoCommit();
            c.setAutoCommit(false);
            TxContext.set(c);
            try {
                T r = body.call();
                c.commit();
                return r;
            } catch (Throwable t) {            // Throwable로 롤백 보장
                rollback(c, t);
                if (t instanceof SQLException e) throw new PersistenceException("transaction failed: " + e.getMessage(), e);
                sneakyThrow(t);
                return null; // unreachable
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        } catch (SQLException e) {
            // getConnection / commit / close 실패
            throw new PersistenceException("connection failure: " + e.getMessage(), e);
        }
    }

    private Connection open() throws SQLException {
        return ds.getConnection();
    }

    private static void rollback(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.toString());
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prevAuto) {
        try {
            c.setAutoCommit(prevAuto);
        } catch (SQLException e) {
            log.debug("Could not restore autoCommit on pooled connection: {}", e.toString());
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E { throw (E) t; }
}
