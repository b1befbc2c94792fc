package net.cadence.bootstrap.autoconfigure;

import net.cadence.adapter.jdbc.repo.JdbcJobRepository;
import net.cadence.bootstrap.catalog.CatalogRegistrar;
import net.cadence.bootstrap.props.CadenceProperties;
import net.cadence.core.cache.CachingJobRepository;
import net.cadence.core.config.SchedulerSettings;
import net.cadence.core.event.Slf4jEventSink;
import net.cadence.core.recovery.RecoveryBootstrapper;
import net.cadence.core.recovery.RecoveryReport;
import net.cadence.core.service.JobCatalogService;
import net.cadence.core.service.JobFireHandler;
import net.cadence.core.service.SchedulingEngine;
import net.cadence.core.spi.Clock;
import net.cadence.core.spi.EventSink;
import net.cadence.core.spi.JobRepository;
import net.cadence.core.spi.TxRunner;
import net.cadence.core.timer.JobTimerTable;
import net.cadence.integration.spring.CadenceSpringConfig;
import net.cadence.integration.spring.lifecycle.CadenceLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(CadenceProperties.class)
@Import(CadenceSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class CadenceAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CadenceAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(EventSink.class)
    public EventSink eventSink() {
        return new Slf4jEventSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(CadenceProperties props) {
        return props.toSettings();
    }

    // 캐시가 켜져 있으면 JobRepository 주입은 모두 캐시 데코레이터를 받는다
    @Bean
    @Primary
    @ConditionalOnProperty(prefix = "cadence.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CachingJobRepository cachingJobRepository(JdbcJobRepository jdbc, Clock clock, CadenceProperties props) {
        var c = props.getCache();
        return new CachingJobRepository(jdbc, clock, c.getMaxEntries(), c.getTtl());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public JobFireHandler jobFireHandler(JobRepository jobs,
                                         TxRunner tx,
                                         Clock clock,
                                         EventSink events,
                                         SchedulerSettings settings) {
        return new JobFireHandler(jobs, tx, clock, events, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobTimerTable jobTimerTable(JobFireHandler fireHandler, Clock clock, SchedulerSettings settings) {
        return new JobTimerTable(fireHandler, clock, JobTimerTable.newWorkerPool(settings.workerThreads()), settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(JobTimerTable timers, EventSink events, Clock clock) {
        return new SchedulingEngine(timers, events, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobCatalogService jobCatalogService(JobRepository jobs, TxRunner tx, SchedulingEngine engine, Clock clock) {
        return new JobCatalogService(jobs, tx, engine, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecoveryBootstrapper recoveryBootstrapper(JobRepository jobs, TxRunner tx, SchedulingEngine engine) {
        return new RecoveryBootstrapper(jobs, tx, engine);
    }

    // --- 런타임 기동/종료 (프로퍼티로 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "cadence.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CadenceLifecycle cadenceLifecycle(SchedulingEngine engine) {
        return new CadenceLifecycle(engine);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobRepository jobs, TxRunner tx, Clock clock) {
        return new CatalogRegistrar(jobs, tx, clock);
    }

    /** 기동 순서: 카탈로그 upsert → 저장소 기준 복구 */
    @Bean
    public ApplicationRunner cadenceStartupRunner(CatalogRegistrar registrar,
                                                  RecoveryBootstrapper recovery,
                                                  CadenceProperties props) {
        return args -> {
            if (props.getCatalog().isEnabled()) {
                log.info("Catalog registration start: {} job(s)\n{}", props.getCatalog().getJobs().size(),
                        props.getCatalog().getJobs().stream()
                                .map(CadenceProperties.JobDef::toString)
                                .collect(Collectors.joining("\n")));
                registrar.register(props.getCatalog());
            }
            if (props.getRecovery().isEnabled() && props.getScheduler().isEnabled()) {
                RecoveryReport report = recovery.recover();
                log.info("Recovery finished: {}", report);
            } else {
                log.info("Recovery skipped (recovery.enabled={}, scheduler.enabled={})",
                        props.getRecovery().isEnabled(), props.getScheduler().isEnabled());
            }
        };
    }
}
