package net.cadence.adapter.jdbc;

import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.core.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class JdbcJobRepositoryTest extends TestSupport {

    private final JdbcJobRepository repo = new JdbcJobRepository();

    private static String uniqueName(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    @DisplayName("insert 후 id/name 으로 다시 읽을 수 있다")
    void insert_and_find() throws Exception {
        String name = uniqueName("backup");
        Instant next = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);

        Job saved = tx.required(() -> repo.insert(Job.ofNew(name, "nightly backup", "2 hours", Job.Status.ACTIVE, next)));

        assertNotNull(saved.id());
        assertEquals(name, saved.name());
        assertEquals("2 hours", saved.interval());
        assertEquals(Job.Status.ACTIVE, saved.status());
        assertEquals(next, saved.nextRun());
        assertNull(saved.lastRun());

        Optional<Job> byId = tx.required(() -> repo.findById(saved.id()));
        Optional<Job> byName = tx.required(() -> repo.findByName(name.toUpperCase()));
        assertTrue(byId.isPresent());
        assertEquals(saved.id(), byName.orElseThrow().id());
    }

    @Test
    @DisplayName("recordRun 은 last/next 만 갱신하고, 없는 id 면 false")
    void record_run_updates_cursor() throws Exception {
        Job saved = tx.required(() -> repo.insert(
                Job.ofNew(uniqueName("report"), null, "30m", Job.Status.ACTIVE, Instant.now())));
        Instant last = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Instant next = last.plus(30, ChronoUnit.MINUTES);

        assertTrue(tx.required(() -> repo.recordRun(saved.id(), last, next)));
        assertFalse(tx.required(() -> repo.recordRun(-1L, last, next)));

        Job reloaded = tx.required(() -> repo.findById(saved.id())).orElseThrow();
        assertEquals(last, reloaded.lastRun());
        assertEquals(next, reloaded.nextRun());
        assertEquals("30m", reloaded.interval());
    }

    @Test
    @DisplayName("upsert: 같은 이름이면 정의만 바꾸고 id 는 유지")
    void upsert_by_name() throws Exception {
        String name = uniqueName("sync");
        Job first = tx.required(() -> repo.upsert(name, "v1", "1 hour", Instant.now()));
        Job second = tx.required(() -> repo.upsert(name, "v2", "daily", Instant.now().plus(1, ChronoUnit.DAYS)));

        assertEquals(first.id(), second.id());
        assertEquals("v2", second.description());
        assertEquals("daily", second.interval());
        assertEquals(Job.Status.ACTIVE, second.status());
        // 기존 커서는 건드리지 않는다
        assertEquals(first.nextRun(), second.nextRun());
    }

    @Test
    @DisplayName("update + findAllByStatus + delete")
    void update_filter_delete() throws Exception {
        Job saved = tx.required(() -> repo.insert(
                Job.ofNew(uniqueName("cleanup"), null, "weekly", Job.Status.ACTIVE, Instant.now())));

        tx.requiredVoid(() -> repo.update(saved.withStatus(Job.Status.PAUSED)));

        List<Job> paused = tx.required(() -> repo.findAllByStatus(Job.Status.PAUSED));
        assertTrue(paused.stream().anyMatch(j -> j.id().equals(saved.id())));
        List<Job> all = tx.required(repo::findAll);
        assertTrue(all.stream().anyMatch(j -> j.id().equals(saved.id())));

        assertTrue(tx.required(() -> repo.delete(saved.id())));
        assertFalse(tx.required(() -> repo.delete(saved.id())));
        assertTrue(tx.required(() -> repo.findById(saved.id())).isEmpty());
    }

    @Test
    @DisplayName("트랜잭션 밖에서 호출하면 TxContext 예외")
    void requires_tx_context() {
        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> repo.findById(1L));
        assertTrue(ex.getMessage().contains("TxContext"));
    }
}
