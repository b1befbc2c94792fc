package net.cadence.core.service;

import net.cadence.core.config.SchedulerSettings;
import net.cadence.core.event.SchedulingEvent;
import net.cadence.core.interval.IntervalParser;
import net.cadence.core.interval.InvalidIntervalException;
import net.cadence.core.model.Job;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.EventSink;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.timer.FireCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * 타이머 발화 시 실행되는 콜백: last_run = now, next_run = now + 주기 를 기록한다.
 * 발화마다 새 세션(requiresNew)을 열고, 어떤 실패도 여기서 결과값으로 바꿔 밖으로 던지지 않는다.
 */
public final class JobFireHandler implements FireCallback {
    private static final Logger log = LoggerFactory.getLogger(JobFireHandler.class);
    private static final DateTimeFormatter HMS = DateTimeFormatter.ofPattern("HH:mm:ss");

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final EventSink events;
    private final SchedulerSettings settings;

    public JobFireHandler(JobRepository jobs,
                          TxRunner tx,
                          Clock clock,
                          EventSink events,
                          SchedulerSettings settings) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.events = events;
        this.settings = settings;
    }

    @Override
    public void fire(long jobId) {
        execute(jobId);
    }

    public FireOutcome execute(long jobId) {
        Instant now = clock.now();
        Optional<Job> ran;
        try {
            ran = tx.requiresNew(() -> {
                Optional<Job> found = jobs.findById(jobId);
                if (found.isEmpty()) return Optional.<Job>empty();

                Job job = found.get();
                Duration interval = IntervalParser.parse(job.interval()).atLeast(settings.minInterval());
                Instant next = now.plus(interval);
                // 읽은 뒤 삭제됐으면 갱신 0건
                if (!jobs.recordRun(jobId, now, next)) return Optional.<Job>empty();
                return Optional.of(job.withRun(now, next));
            });
        } catch (InvalidIntervalException e) {
            log.error("Job {} has an unparseable interval '{}', fire skipped", jobId, e.intervalText());
            publish(jobId, null, SchedulingEvent.Type.FAILED, now, e.getMessage());
            return FireOutcome.FAILED;
        } catch (Exception e) {
            log.error("Store unavailable while firing job {}; next_run left unchanged", jobId, e);
            publish(jobId, null, SchedulingEvent.Type.FAILED, now, "store unavailable: " + e.getMessage());
            return FireOutcome.STORE_UNAVAILABLE;
        }

        if (ran.isEmpty()) {
            log.warn("Job {} not found at fire time (deleted concurrently?), skipping", jobId);
            publish(jobId, null, SchedulingEvent.Type.SKIPPED, now, "job not found at fire time");
            return FireOutcome.JOB_NOT_FOUND;
        }

        Job job = ran.get();
        String at = HMS.withZone(settings.zone()).format(now);
        log.info("Reminder: {} at {}", job.name(), at);
        publish(jobId, job.name(), SchedulingEvent.Type.FIRED, now,
                "ran at " + at + " " + settings.zone().getId() + ", next run " + job.nextRun());
        return FireOutcome.FIRED;
    }

    private void publish(Long jobId, String name, SchedulingEvent.Type type, Instant at, String detail) {
        try {
            events.publish(SchedulingEvent.of(jobId, name, type, at, detail));
        } catch (RuntimeException e) {
            log.warn("Event sink failed for job {} ({}): {}", jobId, type, e.toString());
        }
    }
}
