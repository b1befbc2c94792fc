package net.cadence.bootstrap.catalog;

import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.interval.IntervalParser;
import net.cadence.core.model.Job;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 설정(cadence.catalog.jobs)에 선언된 잡을 저장소에 upsert 한다.
 * 타이머는 걸지 않는다. 이어서 도는 복구 단계가 저장소 기준으로 건다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobRepository jobs;
    private final TxRunner tx;
    private final Clock clock;

    public CatalogRegistrar(JobRepository jobs, TxRunner tx, Clock clock) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
    }

    public List<Job> register(CadenceProperties.Catalog catalog) throws Exception {
        List<Job> out = new ArrayList<>();
        for (var def : catalog.getJobs()) {
            out.add(upsert(def));
        }
        return out;
    }

    private Job upsert(CadenceProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank() || def.getInterval() == null) {
            throw new IllegalArgumentException("job.name and job.interval are required");
        }
        // 잘못된 주기도 저장은 한다 (복구 때 거절로 드러남). 여기선 경고만
        if (!IntervalParser.isValid(def.getInterval())) {
            log.warn("Catalog job '{}' has an interval the scheduler will reject: '{}'", def.getName(), def.getInterval());
        }
        var job = tx.required(() -> jobs.upsert(def.getName(), def.getDescription(), def.getInterval(), clock.now()));
        log.info("Catalog registered: job='{}' id={} interval='{}'", job.name(), job.id(), job.interval());
        return job;
    }
}
