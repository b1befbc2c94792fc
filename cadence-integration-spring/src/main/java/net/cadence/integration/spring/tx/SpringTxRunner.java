package net.cadence.integration.spring.tx;

import net.cadence.adapter.jdbc.TxContext;
import net.cadence.core.service.StoreUnavailableException;
import net.cadence.core.spi.TxRunner;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

public final class SpringTxRunner implements TxRunner {
    private final PlatformTransactionManager tm;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.tm = tm;
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) {
        return execute(TransactionDefinition.PROPAGATION_REQUIRED, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) {
        return execute(TransactionDefinition.PROPAGATION_REQUIRES_NEW, body);
    }

    private <T> T execute(int propagation, Callable<T> body) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);

        try {
            return tpl.execute(status -> {
                // REQUIRED 로 참여한 경우 바깥 TxContext 그대로 사용
                Connection existing = TxContext.get();
                if (existing != null && propagation == TransactionDefinition.PROPAGATION_REQUIRED) {
                    return call(body);
                }

                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌 (REQUIRES_NEW 면 바깥 것은 잠시 보관)
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return call(body);
                } finally {
                    if (existing != null) TxContext.set(existing);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CannotCreateTransactionException | CannotGetJdbcConnectionException e) {
            throw new StoreUnavailableException("Cannot open transaction: " + e.getMessage(), e);
        }
    }

    private static <T> T call(Callable<T> body) {
        try {
            return body.call();
        } catch (RuntimeException re) {
            throw re;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
