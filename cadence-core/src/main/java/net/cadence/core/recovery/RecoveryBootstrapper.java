package net.cadence.core.recovery;

import net.cadence.core.model.Job;
import net.cadence.core.service.ScheduleResult;
import net.cadence.core.service.SchedulingEngine;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 기동 시 저장된 잡을 모두 읽어 타이머를 다시 건다.
 * 순차 처리이며, 한 잡의 거절이 나머지 복구를 멈추지 않는다.
 */
public final class RecoveryBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(RecoveryBootstrapper.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final SchedulingEngine engine;

    public RecoveryBootstrapper(JobRepository jobs, TxRunner tx, SchedulingEngine engine) {
        this.jobs = jobs;
        this.tx = tx;
        this.engine = engine;
    }

    /** 저장소 자체를 못 읽으면 예외 (기동 실패로 보는 게 맞다) */
    public RecoveryReport recover() throws Exception {
        List<Job> all = tx.required(jobs::findAll);
        RecoveryReport r = new RecoveryReport();
        r.total = all.size();

        for (Job job : all) {
            if (job.status().halted()) {
                r.halted++;
                log.debug("Skipping job {} '{}' in status {}", job.id(), job.name(), job.status());
                continue;
            }
            try {
                ScheduleResult res = engine.scheduleJob(job);
                if (res.accepted()) {
                    r.scheduled++;
                } else {
                    r.rejected++;
                    r.rejectedIds.add(job.id());
                    log.warn("Could not restore job {} '{}': {} ({})", job.id(), job.name(), res.reason(), res.detail());
                }
            } catch (RuntimeException e) {
                r.rejected++;
                r.rejectedIds.add(job.id());
                log.error("Unexpected failure restoring job {} '{}'", job.id(), job.name(), e);
            }
        }

        log.info("Loaded and scheduled {} of {} jobs from store ({} rejected, {} halted)",
                r.scheduled, r.total, r.rejected, r.halted);
        return r;
    }
}
