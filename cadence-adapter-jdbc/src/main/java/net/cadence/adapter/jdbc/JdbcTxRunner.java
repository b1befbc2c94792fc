package net.cadence.adapter.jdbc;

import net.cadence.core.service.StoreUnavailableException;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.Callable;

/** 스프링 없이 DataSource 만으로 동작하는 TxRunner. 커넥션은 TxContext 로 스레드에 묶는다. */
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
        // 바깥 트랜잭션은 잠시 떼어 두고 새 커넥션으로 실행, 끝나면 복원
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
            } catch (Throwable t) {
                rollbackQuietly(c, t);
                throw t;
            } finally {
                TxContext.clear();
                restoreAutoCommit(c, prevAuto);
            }
        }
    }

    private Connection open() {
        try {
            return ds.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Cannot obtain connection: " + e.getMessage(), e);
        }
    }

    private static void rollbackQuietly(Connection c, Throwable cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection c, boolean prev) {
        try {
            c.setAutoCommit(prev);
        } catch (SQLException e) {
            log.debug("Could not restore autoCommit={} on pooled connection: {}", prev, e.getMessage());
        }
    }
}
