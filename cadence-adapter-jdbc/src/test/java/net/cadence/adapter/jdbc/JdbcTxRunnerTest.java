package net.cadence.adapter.jdbc;

import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class JdbcTxRunnerTest extends TestSupport {

    private final JdbcJobRepository repo = new JdbcJobRepository();

    @Test
    @DisplayName("예외가 나면 롤백된다")
    void rollback_on_failure() throws Exception {
        String name = "rollback-" + UUID.randomUUID().toString().substring(0, 8);

        RuntimeException ex = assertThrows(RuntimeException.class, () -> tx.required(() -> {
            repo.insert(Job.ofNew(name, null, "5m", Job.Status.ACTIVE, Instant.now()));
            throw new RuntimeException("boom");
        }));
        assertEquals("boom", ex.getMessage());

        assertTrue(tx.required(() -> repo.findByName(name)).isEmpty());
    }

    @Test
    @DisplayName("required 는 바깥 커넥션에 참여, requiresNew 는 별도 커넥션 후 복원")
    void propagation() throws Exception {
        tx.requiredVoid(() -> {
            Connection outer = TxContext.require();
            Connection joined = tx.required(TxContext::require);
            Connection inner = tx.requiresNew(TxContext::require);

            assertSame(outer, joined);
            assertNotSame(outer, inner);
            assertSame(outer, TxContext.get());
        });
        assertNull(TxContext.get());
    }
}
