package net.cadence.core.cache;

import net.cadence.core.model.Job;
import net.cadence.core.support.InMemoryJobRepository;
import net.cadence.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachingJobRepositoryTest {

    private MutableClock clock;
    private InMemoryJobRepository delegate;
    private CachingJobRepository cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        delegate = new InMemoryJobRepository();
        cache = new CachingJobRepository(delegate, clock, 2, Duration.ofMinutes(5));
    }

    @Test
    void second_read_is_served_from_cache() throws Exception {
        Job j = delegate.seed("a", "5m", Job.Status.ACTIVE, clock.now());

        cache.findById(j.id());
        cache.findById(j.id());

        assertThat(delegate.findByIdCalls.get()).isEqualTo(1);
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    void writes_invalidate() throws Exception {
        Job j = delegate.seed("a", "5m", Job.Status.ACTIVE, clock.now());
        cache.findById(j.id());

        cache.recordRun(j.id(), clock.now(), clock.now().plusSeconds(300));

        Job reloaded = cache.findById(j.id()).orElseThrow();
        assertThat(reloaded.lastRun()).isEqualTo(clock.now());
        assertThat(delegate.findByIdCalls.get()).isEqualTo(2);

        cache.update(reloaded.withStatus(Job.Status.PAUSED));
        assertThat(cache.findById(j.id()).orElseThrow().status()).isEqualTo(Job.Status.PAUSED);

        cache.delete(j.id());
        assertThat(cache.findById(j.id())).isEmpty();
    }

    @Test
    void entries_expire_after_ttl() throws Exception {
        Job j = delegate.seed("a", "5m", Job.Status.ACTIVE, clock.now());
        cache.findById(j.id());

        clock.advance(Duration.ofMinutes(5));
        cache.findById(j.id());

        assertThat(delegate.findByIdCalls.get()).isEqualTo(2);
    }

    @Test
    void least_recently_used_is_evicted() throws Exception {
        Job a = delegate.seed("a", "5m", Job.Status.ACTIVE, clock.now());
        Job b = delegate.seed("b", "5m", Job.Status.ACTIVE, clock.now());
        Job c = delegate.seed("c", "5m", Job.Status.ACTIVE, clock.now());

        cache.findById(a.id());
        cache.findById(b.id());
        cache.findById(a.id());     // a 를 최근으로
        cache.findById(c.id());     // b 밀려남

        assertThat(cache.size()).isEqualTo(2);
        int before = delegate.findByIdCalls.get();
        cache.findById(a.id());
        assertThat(delegate.findByIdCalls.get()).isEqualTo(before);
        cache.findById(b.id());
        assertThat(delegate.findByIdCalls.get()).isEqualTo(before + 1);
    }

    @Test
    void write_during_load_does_not_leave_stale_entry() throws Exception {
        Job j = delegate.seed("a", "5m", Job.Status.ACTIVE, clock.now());
        delegate.afterFind = () -> {
            try {
                cache.recordRun(j.id(), clock.now(), clock.now().plusSeconds(300));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };

        Job loaded = cache.findById(j.id()).orElseThrow();
        assertThat(loaded.lastRun()).isNull();       // 쓰기 전에 읽은 값

        assertThat(cache.findById(j.id()).orElseThrow().lastRun()).isEqualTo(clock.now());
        assertThat(delegate.findByIdCalls.get()).isEqualTo(2);
    }

    @Test
    void misses_are_not_cached() throws Exception {
        assertThat(cache.findById(9L)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void needs_room_for_at_least_one_entry() {
        assertThatThrownBy(() -> new CachingJobRepository(delegate, clock, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
