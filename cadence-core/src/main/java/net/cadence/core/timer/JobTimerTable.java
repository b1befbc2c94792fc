package net.cadence.core.timer;

import net.cadence.core.config.SchedulerSettings;
import net.cadence.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 잡 id → 활성 타이머 레지스트리 + 단일 디스패치 루프.
 * <p>
 * 보장:
 * <ol>
 *   <li>id 당 타이머는 항상 하나. 같은 id 로 다시 schedule 하면 이전 것을 취소하고 교체한다.</li>
 *   <li>id 당 콜백 동시 실행은 최대 1. 실행 중에 도래한 발화는 큐잉하지 않고 버린다(suppress).</li>
 *   <li>놓친 발화는 몇 번을 놓쳤든 한 번의 따라잡기 발화로 합친다.</li>
 * </ol>
 * 레지스트리 변경(설치/교체/삭제/셧다운)은 {@code lock} 으로 직렬화하고,
 * 콜백은 디스패치 스레드가 아닌 워커 풀에서 실행한다.
 * 다음 발화는 해당 실행의 <b>완료 시각</b> + 주기로 다시 잡는다.
 */
public final class JobTimerTable {
    private static final Logger log = LoggerFactory.getLogger(JobTimerTable.class);

    private final FireCallback callback;
    private final Clock clock;
    private final ExecutorService workers;
    private final SchedulerSettings settings;
    private final TriggerClock trigger;

    private final Map<Long, TimerEntry> registry = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private ScheduledExecutorService dispatcher; // guarded by lock

    public JobTimerTable(FireCallback callback,
                         Clock clock,
                         ExecutorService workers,
                         SchedulerSettings settings) {
        this.callback = Objects.requireNonNull(callback);
        this.clock = Objects.requireNonNull(clock);
        this.workers = Objects.requireNonNull(workers);
        this.settings = Objects.requireNonNull(settings);
        this.trigger = new TriggerClock(settings.graceDelay());
    }

    public static ExecutorService newWorkerPool(int threads) {
        return Executors.newFixedThreadPool(threads, named("cadence-worker-"));
    }

    /** 디스패치 루프 시작. 여러 번 불러도 한 번만 뜬다 */
    public void start() {
        synchronized (lock) {
            if (shuttingDown.get()) throw new SchedulerShutdownException("timer table already shut down");
            if (dispatcher != null) return;
            dispatcher = Executors.newSingleThreadScheduledExecutor(named("cadence-timer-"));
            long period = settings.tickInterval().toMillis();
            dispatcher.scheduleWithFixedDelay(this::safeTick, period, period, TimeUnit.MILLISECONDS);
        }
        log.info("Timer table started (tick={}, workers={}, minInterval={})",
                settings.tickInterval(), settings.workerThreads(), settings.minInterval());
    }

    /**
     * 타이머 설치 또는 교체.
     *
     * @return 설치된 엔트리. 셧다운 중이면 empty
     */
    public Optional<TimerEntry> schedule(long jobId, Duration interval, Instant firstFireHint) {
        Objects.requireNonNull(interval, "interval");
        Duration effective = interval;
        if (interval.compareTo(settings.minInterval()) < 0) {
            log.warn("Interval {} too short for job {}, raising to minimum {}", interval, jobId, settings.minInterval());
            effective = settings.minInterval();
        }

        synchronized (lock) {
            if (shuttingDown.get()) {
                log.warn("Refusing to schedule job {}: scheduler is shutting down", jobId);
                return Optional.empty();
            }
            Instant first = trigger.firstFire(firstFireHint, clock.now());
            TimerEntry prev = registry.get(jobId);
            TimerEntry next;
            if (prev != null) {
                prev.cancel();
                next = prev.replacedBy(effective, first);
            } else {
                next = TimerEntry.fresh(jobId, effective, first);
            }
            registry.put(jobId, next);
            log.debug("{} job {} every {} (first fire {})",
                    prev == null ? "Scheduled" : "Rescheduled", jobId, effective, first);
            return Optional.of(next);
        }
    }

    /** 있으면 취소 후 제거. 없으면 아무 일도 하지 않는다 */
    public boolean remove(long jobId) {
        synchronized (lock) {
            TimerEntry prev = registry.remove(jobId);
            if (prev == null) return false;
            prev.cancel();
            log.debug("Removed timer for job {}", jobId);
            return true;
        }
    }

    public List<Long> listActive() {
        List<Long> ids = new ArrayList<>(registry.keySet());
        ids.sort(Long::compare);
        return ids;
    }

    public Optional<TimerEntry> entry(long jobId) {
        return Optional.ofNullable(registry.get(jobId));
    }

    public boolean isShutdown() {
        return shuttingDown.get();
    }

    /**
     * 한 번의 디스패치: due 인 엔트리를 워커 풀에 넘긴다.
     * 디스패치 루프가 주기적으로 호출하며, 테스트에서는 직접 호출해도 된다.
     *
     * @return 워커에 넘긴 발화 수
     */
    public int tick() {
        if (shuttingDown.get()) return 0;
        Instant now = clock.now();
        int dispatched = 0;

        for (TimerEntry e : registry.values()) {
            try {
                if (dispatch(e, now)) dispatched++;
            } catch (RuntimeException ex) {
                // 엔트리 하나의 계산 오류가 나머지 잡 디스패치를 막으면 안 됨
                log.error("Dispatch failed for job {}; dropping its timer", e.jobId(), ex);
                drop(e);
            }
        }
        return dispatched;
    }

    private boolean dispatch(TimerEntry e, Instant now) {
        if (e.isCancelled()) return false;
        Instant due = e.nextFireAt();
        if (now.isBefore(due)) return false;

        if (!e.tryBeginFire()) {
            // 이전 실행이 아직 안 끝남 → 이번 발화는 버림
            e.countSuppressed();
            e.rearm(now.plus(e.interval()));
            log.debug("Job {} still running, suppressed fire due at {}", e.jobId(), due);
            return false;
        }

        boolean handedOff = false;
        try {
            // due 를 읽은 뒤 이전 실행이 끝나 완료 기준으로 재무장됐을 수 있다
            if (now.isBefore(e.nextFireAt())) return false;

            Duration late = Duration.between(due, now);
            if (late.compareTo(settings.misfireGrace()) > 0) {
                long missed = late.toMillis() / Math.max(1L, e.interval().toMillis());
                e.countMisfire(Math.max(1L, missed));
                log.warn("Job {} fire was {} late ({} interval(s) missed), coalescing into one run",
                        e.jobId(), late, missed);
            }

            // 임시 재무장: 실행 완료 시점에 완료 시각 기준으로 다시 잡는다
            e.rearm(now.plus(e.interval()));
            workers.execute(() -> runFire(e));
            handedOff = true;
            return true;
        } catch (RejectedExecutionException rex) {
            log.warn("Worker pool rejected fire for job {}: {}", e.jobId(), rex.getMessage());
            return false;
        } finally {
            if (!handedOff) e.endFire();
        }
    }

    private void drop(TimerEntry e) {
        synchronized (lock) {
            e.cancel();
            registry.remove(e.jobId(), e);
        }
    }

    /** 전체 타이머 취소 + 런타임 정지. 실행 중인 콜백은 shutdownGrace 만큼 기다린다. 멱등 */
    public void shutdown() {
        ScheduledExecutorService d;
        int cancelled;
        synchronized (lock) {
            if (!shuttingDown.compareAndSet(false, true)) return;
            registry.values().forEach(TimerEntry::cancel);
            cancelled = registry.size();
            registry.clear();
            d = dispatcher;
            dispatcher = null;
        }
        if (d != null) d.shutdownNow();

        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = workers.shutdownNow();
                log.warn("Shutdown grace {} elapsed with callbacks still running; abandoning them ({} queued dropped)",
                        settings.shutdownGrace(), abandoned.size());
            }
        } catch (InterruptedException ie) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for running callbacks to finish");
        }
        log.info("Timer table shut down ({} timer(s) cancelled)", cancelled);
    }

    private void runFire(TimerEntry e) {
        try {
            // 디스패치 후 제거/셧다운 됐으면 실행하지 않는다
            if (e.isCancelled() || shuttingDown.get()) return;
            e.countFire();
            callback.fire(e.jobId());
        } catch (Throwable t) {
            // 잡 하나의 실패가 런타임이나 이후 발화에 영향을 주면 안 됨
            log.error("Callback for job {} failed; future fires stay scheduled", e.jobId(), t);
        } finally {
            try {
                if (!e.isCancelled()) e.rearm(trigger.next(clock.now(), e.interval()));
            } catch (RuntimeException ex) {
                log.error("Cannot compute next fire for job {}; dropping its timer", e.jobId(), ex);
                drop(e);
            } finally {
                e.endFire();
            }
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException ex) {
            // scheduleWithFixedDelay 는 예외가 새면 루프를 멈춘다
            log.error("Timer dispatch tick failed", ex);
        }
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
