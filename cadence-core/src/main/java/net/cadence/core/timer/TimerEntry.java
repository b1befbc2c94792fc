package net.cadence.core.timer;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 잡 하나의 활성 타이머. {@link JobTimerTable} 만 생성/변경한다.
 * 같은 id 로 교체될 때 실행 중 플래그(inFlight)는 새 엔트리로 넘겨서
 * 교체 전후 콜백이 겹치지 않게 한다.
 */
public final class TimerEntry {
    private final long jobId;
    private final Duration interval;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean inFlight;
    private final AtomicLong fires = new AtomicLong();
    private final AtomicLong suppressed = new AtomicLong();
    private final AtomicLong misfires = new AtomicLong();
    private volatile Instant nextFireAt;

    TimerEntry(long jobId, Duration interval, Instant firstFireAt, AtomicBoolean inFlight) {
        this.jobId = jobId;
        this.interval = interval;
        this.nextFireAt = firstFireAt;
        this.inFlight = inFlight;
    }

    static TimerEntry fresh(long jobId, Duration interval, Instant firstFireAt) {
        return new TimerEntry(jobId, interval, firstFireAt, new AtomicBoolean(false));
    }

    TimerEntry replacedBy(Duration interval, Instant firstFireAt) {
        return new TimerEntry(jobId, interval, firstFireAt, inFlight);
    }

    // --- 테이블 내부 전이 ---

    boolean cancel() { return cancelled.compareAndSet(false, true); }

    boolean tryBeginFire() { return inFlight.compareAndSet(false, true); }

    void endFire() { inFlight.set(false); }

    void rearm(Instant at) { this.nextFireAt = at; }

    void countFire() { fires.incrementAndGet(); }

    void countSuppressed() { suppressed.incrementAndGet(); }

    void countMisfire(long missed) { misfires.addAndGet(missed); }

    // --- 조회 ---

    public long jobId() { return jobId; }

    public Duration interval() { return interval; }

    public Instant nextFireAt() { return nextFireAt; }

    public boolean isCancelled() { return cancelled.get(); }

    public boolean isRunning() { return inFlight.get(); }

    public long fireCount() { return fires.get(); }

    public long suppressedCount() { return suppressed.get(); }

    public long missedCount() { return misfires.get(); }

    @Override
    public String toString() {
        return "TimerEntry{" +
                "jobId=" + jobId +
                ", interval=" + interval +
                ", nextFireAt=" + nextFireAt +
                ", cancelled=" + cancelled.get() +
                ", running=" + inFlight.get() +
                '}';
    }
}
