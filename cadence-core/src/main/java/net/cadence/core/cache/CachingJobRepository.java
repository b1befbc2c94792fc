package net.cadence.core.cache;

import net.cadence.core.model.Job;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 잡 메타데이터 read-through 캐시 (LRU + TTL).
 * 권위 있는 원본은 항상 delegate 이고, 쓰기는 모두 해당 id 를 무효화한다.
 */
public final class CachingJobRepository implements JobRepository {
    private final JobRepository delegate;
    private final Clock clock;
    private final Duration ttl;     // null 또는 0 이면 만료 없음
    private final Map<Long, Cached> cache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private long generation;        // 무효화마다 증가. guarded by cache

    public CachingJobRepository(JobRepository delegate, Clock clock, int maxEntries, Duration ttl) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        this.delegate = delegate;
        this.clock = clock;
        this.ttl = ttl;
        this.cache = new LruMap<>(maxEntries);
    }

    @Override
    public Optional<Job> findById(long id) throws Exception {
        Instant now = clock.now();
        long gen;
        synchronized (cache) {
            gen = generation;
            Cached c = cache.get(id);
            if (c != null && (c.expiresAt() == null || now.isBefore(c.expiresAt()))) {
                hits.incrementAndGet();
                return Optional.of(c.job());
            }
            if (c != null) cache.remove(id);
        }
        misses.incrementAndGet();
        Optional<Job> loaded = delegate.findById(id);
        loaded.ifPresent(j -> put(j, now, gen));
        return loaded;
    }

    @Override
    public Optional<Job> findByName(String name) throws Exception {
        return delegate.findByName(name);
    }

    @Override
    public List<Job> findAll() throws Exception {
        return delegate.findAll();
    }

    @Override
    public List<Job> findAllByStatus(Job.Status status) throws Exception {
        return delegate.findAllByStatus(status);
    }

    @Override
    public Job insert(Job job) throws Exception {
        Job saved = delegate.insert(job);
        invalidate(saved.id());
        return saved;
    }

    @Override
    public Job upsert(String name, String description, String interval, Instant nextRun) throws Exception {
        Job saved = delegate.upsert(name, description, interval, nextRun);
        invalidate(saved.id());
        return saved;
    }

    @Override
    public void update(Job job) throws Exception {
        try {
            delegate.update(job);
        } finally {
            invalidate(job.id());
        }
    }

    @Override
    public boolean recordRun(long id, Instant lastRun, Instant nextRun) throws Exception {
        try {
            return delegate.recordRun(id, lastRun, nextRun);
        } finally {
            invalidate(id);
        }
    }

    @Override
    public boolean delete(long id) throws Exception {
        try {
            return delegate.delete(id);
        } finally {
            invalidate(id);
        }
    }

    public void invalidate(Long id) {
        if (id == null) return;
        synchronized (cache) {
            cache.remove(id);
            generation++;
        }
    }

    public void invalidateAll() {
        synchronized (cache) {
            cache.clear();
            generation++;
        }
    }

    public int size() {
        synchronized (cache) { return cache.size(); }
    }

    public long hits() { return hits.get(); }

    public long misses() { return misses.get(); }

    // 로드하는 사이 무효화가 있었으면 읽은 값이 이미 낡았을 수 있으니 넣지 않는다
    private void put(Job job, Instant now, long loadedAt) {
        Instant expiresAt = ttl == null || ttl.isZero() ? null : now.plus(ttl);
        synchronized (cache) {
            if (generation != loadedAt) return;
            cache.put(job.id(), new Cached(job, expiresAt));
        }
    }

    private record Cached(Job job, Instant expiresAt) {}

    // --- 내부 LRU ---
    private static final class LruMap<K,V> extends LinkedHashMap<K,V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K,V> eldest) { return size() > max; }
    }
}
