package net.driftwatch.integration.spring.tx;

import net.driftwatch.adapter.jdbc.TxContext;
import net.driftwatch.core.error.PersistenceException;
import net.driftwatch.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/**
 * Spring 트랜잭션 위에서 TxContext를 채워 adapter-jdbc 리포지토리를 그대로 쓴다.
 * SQLException은 PersistenceException으로, 그 외 검사 예외는 원래 타입으로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) throws Exception {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        Connection outer = TxContext.get();
        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌 (REQUIRES_NEW면 새 커넥션)
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (SQLException e) {
                    throw new PersistenceException("transaction failed: " + e.getMessage(), e);
                } catch (Exception e) {
                    throw new CheckedWrapper(e);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedWrapper w) {
            throw w.checked;
        } finally {
            // 바깥 트랜잭션 컨텍스트 복원
            if (outer != null) TxContext.set(outer);
        }
    }

    /** 롤백을 일으키기 위해 검사 예외를 잠시 감싼다. */
    private static final class CheckedWrapper extends RuntimeException {
        final Exception checked;

        CheckedWrapper(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
