package net.cadence.core.service;

import net.cadence.core.config.SchedulerSettings;
import net.cadence.core.event.SchedulingEvent;
import net.cadence.core.model.Job;
import net.cadence.core.support.MutableClock;
import net.cadence.core.support.RecordingEventSink;
import net.cadence.core.timer.JobTimerTable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchedulingEngineTest {

    private MutableClock clock;
    private RecordingEventSink events;
    private SchedulingEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        events = new RecordingEventSink();
        JobTimerTable timers = new JobTimerTable(id -> { }, clock, JobTimerTable.newWorkerPool(1), SchedulerSettings.defaults());
        engine = new SchedulingEngine(timers, events, clock);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private Job job(long id, String interval, Instant nextRun) {
        return new Job(id, "job-" + id, null, interval, null, nextRun, Job.Status.ACTIVE, clock.now(), clock.now());
    }

    @Test
    void schedule_accepts_and_installs_one_timer() {
        ScheduleResult r = engine.scheduleJob(job(1L, "5 minutes", clock.now()));

        assertThat(r.accepted()).isTrue();
        assertThat(r.reason()).isNull();
        assertThat(r.interval()).isEqualTo(Duration.ofMinutes(5));
        // next_run 이 과거/현재면 grace 후 첫 발화
        assertThat(r.firstFireAt()).isEqualTo(clock.now().plusSeconds(1));
        assertThat(engine.listActive()).containsExactly(1L);
        assertThat(events.ofType(SchedulingEvent.Type.SCHEDULED)).hasSize(1);
    }

    @Test
    void future_next_run_is_honoured() {
        Instant next = clock.now().plus(Duration.ofHours(3));
        ScheduleResult r = engine.scheduleJob(job(1L, "daily", next));
        assertThat(r.firstFireAt()).isEqualTo(next);
    }

    @Test
    void invalid_interval_is_rejected_without_touching_existing_timer() {
        engine.scheduleJob(job(1L, "1 hour", null));
        var before = engine.timer(1L).orElseThrow();

        ScheduleResult r = engine.scheduleJob(job(1L, "every other tuesday", null));

        assertThat(r.rejected()).isTrue();
        assertThat(r.reason()).isEqualTo(RejectedReason.INVALID_INTERVAL);
        assertThat(r.detail()).contains("every other tuesday");
        assertThat(engine.timer(1L)).containsSame(before);
        assertThat(before.isCancelled()).isFalse();
        assertThat(events.ofType(SchedulingEvent.Type.REJECTED)).hasSize(1);
    }

    @Test
    void invalid_interval_for_new_job_installs_nothing() {
        ScheduleResult r = engine.scheduleJob(job(2L, "5 seconds", null));
        assertThat(r.reason()).isEqualTo(RejectedReason.INVALID_INTERVAL);
        assertThat(engine.listActive()).isEmpty();
    }

    @Test
    void zero_interval_is_clamped_to_minimum() {
        ScheduleResult r = engine.scheduleJob(job(1L, "0 minutes", null));
        assertThat(r.accepted()).isTrue();
        assertThat(r.interval()).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    void unsaved_job_is_a_programming_error() {
        Job unsaved = Job.ofNew("x", null, "5m", Job.Status.ACTIVE, clock.now());
        assertThatThrownBy(() -> engine.scheduleJob(unsaved)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void remove_reports_what_happened() {
        engine.scheduleJob(job(1L, "5m", null));

        assertThat(engine.removeJob(1L)).isEqualTo(RemovalResult.REMOVED);
        assertThat(engine.removeJob(1L)).isEqualTo(RemovalResult.NOT_SCHEDULED);
        assertThat(engine.removeJob(42L)).isEqualTo(RemovalResult.NOT_SCHEDULED);
        assertThat(engine.listActive()).isEmpty();
        assertThat(events.ofType(SchedulingEvent.Type.REMOVED)).hasSize(1);
    }

    @Test
    void after_shutdown_everything_is_refused_quietly() {
        engine.scheduleJob(job(1L, "5m", null));
        engine.shutdown();
        engine.shutdown();

        assertThat(engine.isShutdown()).isTrue();
        assertThat(engine.listActive()).isEmpty();
        assertThat(engine.scheduleJob(job(2L, "5m", null)).reason()).isEqualTo(RejectedReason.SHUTDOWN_IN_PROGRESS);
        assertThat(engine.removeJob(1L)).isEqualTo(RemovalResult.SHUTDOWN_IN_PROGRESS);
    }

    @Test
    void failing_event_sink_does_not_break_scheduling() {
        JobTimerTable timers = new JobTimerTable(id -> { }, clock, JobTimerTable.newWorkerPool(1), SchedulerSettings.defaults());
        SchedulingEngine noisy = new SchedulingEngine(timers, e -> { throw new IllegalStateException("sink down"); }, clock);
        try {
            assertThat(noisy.scheduleJob(job(1L, "5m", null)).accepted()).isTrue();
            assertThat(noisy.removeJob(1L)).isEqualTo(RemovalResult.REMOVED);
        } finally {
            noisy.shutdown();
        }
    }
}
