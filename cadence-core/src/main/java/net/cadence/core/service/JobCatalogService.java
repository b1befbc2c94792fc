package net.cadence.core.service;

import net.cadence.core.model.Job;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.timer.TimerEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 잡 CRUD 유스케이스. 저장소 변경 후 엔진 타이머를 맞춰 준다.
 * (HTTP 라우팅은 이 서비스를 그대로 감싸기만 하면 된다)
 */
public final class JobCatalogService {
    private final JobRepository jobs;
    private final TxRunner tx;
    private final SchedulingEngine engine;
    private final Clock clock;

    public JobCatalogService(JobRepository jobs, TxRunner tx, SchedulingEngine engine, Clock clock) {
        this.jobs = jobs;
        this.tx = tx;
        this.engine = engine;
        this.clock = clock;
    }

    /** 저장 + (멈춤 상태가 아니면) 스케줄. 주기가 잘못돼도 잡은 저장된 채로 남는다 */
    public Registration create(String name, String description, String interval, Job.Status status) throws Exception {
        requireText(name, "name");
        requireText(interval, "interval");
        Job saved = tx.required(() -> jobs.insert(Job.ofNew(name, description, interval, status, clock.now())));
        return register(saved);
    }

    public Job get(long id) throws Exception {
        return tx.required(() -> jobs.findById(id)).orElseThrow(() -> new JobNotFoundException(id));
    }

    public List<Job> list(Job.Status status) throws Exception {
        return tx.required(() -> status == null ? jobs.findAll() : jobs.findAllByStatus(status));
    }

    /** 부분 수정. null 필드는 유지 */
    public Registration update(long id, JobPatch patch) throws Exception {
        if (patch.name() != null) requireText(patch.name(), "name");
        if (patch.interval() != null) requireText(patch.interval(), "interval");

        Job updated = tx.required(() -> {
            Job cur = jobs.findById(id).orElseThrow(() -> new JobNotFoundException(id));
            Job.Status status = patch.status() != null ? patch.status() : cur.status();
            Instant nextRun = cur.nextRun();
            // 멈췄던 잡을 다시 켜거나 주기를 바꾸면 next_run 초기화 (새 주기로 다시 시작)
            boolean resumed = cur.status().halted() && !status.halted();
            boolean intervalChanged = patch.interval() != null && !patch.interval().equals(cur.interval());
            if (resumed || intervalChanged) nextRun = clock.now();

            Job next = new Job(cur.id(),
                    patch.name() != null ? patch.name() : cur.name(),
                    patch.description() != null ? patch.description() : cur.description(),
                    patch.interval() != null ? patch.interval() : cur.interval(),
                    cur.lastRun(), nextRun, status, cur.createdAt(), cur.updatedAt());
            jobs.update(next);
            return next;
        });
        return register(updated);
    }

    public void delete(long id) throws Exception {
        boolean deleted = tx.required(() -> jobs.delete(id));
        if (!deleted) throw new JobNotFoundException(id);
        engine.removeJob(id);
    }

    /** 저장소 상태 + 엔진 타이머 상태 */
    public StatusView status(long id) throws Exception {
        Job job = get(id);
        Optional<TimerEntry> timer = engine.timer(id);
        return new StatusView(id, job.status(), job.lastRun(), job.nextRun(),
                timer.isPresent(),
                timer.map(TimerEntry::nextFireAt).orElse(null),
                timer.map(TimerEntry::isRunning).orElse(false));
    }

    private Registration register(Job job) {
        if (job.status().halted()) {
            engine.removeJob(job.id());
            return new Registration(job, Optional.empty());
        }
        return new Registration(job, Optional.of(engine.scheduleJob(job)));
    }

    private static void requireText(String v, String field) {
        if (v == null || v.isBlank()) throw new IllegalArgumentException(field + " is required");
    }

    public record Registration(Job job, Optional<ScheduleResult> schedule) {
        public boolean scheduled() {
            return schedule.map(ScheduleResult::accepted).orElse(false);
        }
    }

    public record JobPatch(String name, String description, String interval, Job.Status status) {
        public static JobPatch status(Job.Status status) { return new JobPatch(null, null, null, status); }
        public static JobPatch interval(String interval) { return new JobPatch(null, null, interval, null); }
    }

    public record StatusView(
            long id,
            Job.Status storeStatus,
            Instant lastRun,
            Instant nextRun,
            boolean timerActive,
            Instant nextFireAt,
            boolean running
    ) {}
}
