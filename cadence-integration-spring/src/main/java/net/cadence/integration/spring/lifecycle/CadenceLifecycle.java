package net.cadence.integration.spring.lifecycle;

import net.cadence.core.service.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * 컨텍스트 기동 시 타이머 런타임을 시작하고, 종료 시 엔진을 내린다.
 * 엔진 shutdown 은 멱등이라 stop 이 여러 번 불려도 무방.
 */
public class CadenceLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(CadenceLifecycle.class);

    private final SchedulingEngine engine;
    private volatile boolean running;

    public CadenceLifecycle(SchedulingEngine engine) {
        this.engine = engine;
    }

    @Override
    public void start() {
        engine.start();
        running = true;
        log.info("Cadence scheduler started");
    }

    @Override
    public void stop() {
        try {
            engine.shutdown();
        } finally {
            running = false;
        }
        log.info("Cadence scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // 다른 빈보다 늦게 시작하고 먼저 멈춘다
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }
}
