package net.cadence.core.service;

import net.cadence.core.event.SchedulingEvent;
import net.cadence.core.interval.IntervalParser;
import net.cadence.core.interval.InvalidIntervalException;
import net.cadence.core.interval.ParsedInterval;
import net.cadence.core.model.Job;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.EventSink;
import net.cadence.core.timer.JobTimerTable;
import net.cadence.core.timer.TimerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * API 계층이 쓰는 스케줄링 진입점.
 * 파싱 실패/셧다운은 결과값으로만 알리고 예외로 던지지 않는다.
 */
public final class SchedulingEngine {
    private static final Logger log = LoggerFactory.getLogger(SchedulingEngine.class);

    private final JobTimerTable timers;
    private final EventSink events;
    private final Clock clock;

    public SchedulingEngine(JobTimerTable timers, EventSink events, Clock clock) {
        this.timers = Objects.requireNonNull(timers);
        this.events = Objects.requireNonNull(events);
        this.clock = Objects.requireNonNull(clock);
    }

    public void start() {
        timers.start();
    }

    /** 잡 타이머 설치(이미 있으면 교체). next_run 이 미래면 첫 발화 힌트로 쓴다 */
    public ScheduleResult scheduleJob(Job job) {
        Objects.requireNonNull(job, "job");
        if (job.id() == null) throw new IllegalArgumentException("job must be persisted before scheduling");
        Instant now = clock.now();

        if (timers.isShutdown()) {
            return reject(job, RejectedReason.SHUTDOWN_IN_PROGRESS, "scheduler is shutting down", now);
        }

        ParsedInterval parsed;
        try {
            parsed = IntervalParser.parse(job.interval());
        } catch (InvalidIntervalException e) {
            log.warn("Rejected job {} '{}': {}", job.id(), job.name(), e.getMessage());
            return reject(job, RejectedReason.INVALID_INTERVAL, e.getMessage(), now);
        }

        Instant hint = job.nextRun() != null && job.nextRun().isAfter(now) ? job.nextRun() : null;
        Optional<TimerEntry> installed = timers.schedule(job.id(), parsed.duration(), hint);
        if (installed.isEmpty()) {
            return reject(job, RejectedReason.SHUTDOWN_IN_PROGRESS, "scheduler is shutting down", now);
        }

        TimerEntry entry = installed.get();
        log.info("Scheduled job {} '{}' ({}) first fire at {}", job.id(), job.name(), job.interval(), entry.nextFireAt());
        publish(SchedulingEvent.of(job.id(), job.name(), SchedulingEvent.Type.SCHEDULED, now,
                "every " + entry.interval() + ", first fire " + entry.nextFireAt()));
        return ScheduleResult.accepted(job.id(), entry.interval(), entry.nextFireAt());
    }

    /** 멱등. 없는 id 여도 성공 */
    public RemovalResult removeJob(long jobId) {
        if (timers.isShutdown()) {
            log.debug("Ignoring remove of job {}: scheduler is shutting down", jobId);
            return RemovalResult.SHUTDOWN_IN_PROGRESS;
        }
        if (!timers.remove(jobId)) return RemovalResult.NOT_SCHEDULED;

        log.info("Removed job {}", jobId);
        publish(SchedulingEvent.of(jobId, null, SchedulingEvent.Type.REMOVED, clock.now(), null));
        return RemovalResult.REMOVED;
    }

    public List<Long> listActive() {
        return timers.listActive();
    }

    public Optional<TimerEntry> timer(long jobId) {
        return timers.entry(jobId);
    }

    public boolean isShutdown() {
        return timers.isShutdown();
    }

    /** 실행 중 콜백이 끝나거나 grace 가 지날 때까지 블록 */
    public void shutdown() {
        if (timers.isShutdown()) return;
        log.info("Shutting down scheduling engine ({} active timer(s))", timers.listActive().size());
        timers.shutdown();
    }

    private ScheduleResult reject(Job job, RejectedReason reason, String detail, Instant at) {
        publish(SchedulingEvent.of(job.id(), job.name(), SchedulingEvent.Type.REJECTED, at, reason + ": " + detail));
        return ScheduleResult.rejected(job.id(), reason, detail);
    }

    private void publish(SchedulingEvent event) {
        try {
            events.publish(event);
        } catch (RuntimeException e) {
            log.warn("Event sink failed for job {} ({}): {}", event.jobId(), event.type(), e.toString());
        }
    }
}
