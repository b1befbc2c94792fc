package net.cadence.core.event;

import net.cadence.core.spi.EventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 기본 알림 수집기: 이벤트를 cadence.events 로거로 흘려보낸다. */
public final class Slf4jEventSink implements EventSink {
    private static final Logger events = LoggerFactory.getLogger("cadence.events");

    @Override
    public void publish(SchedulingEvent e) {
        switch (e.type()) {
            case REJECTED, FAILED, SKIPPED ->
                    events.warn("job={} name='{}' event={} at={} detail={}",
                            e.jobId(), e.jobName(), e.type().code(), e.timestamp(), e.detail());
            default ->
                    events.info("job={} name='{}' event={} at={} detail={}",
                            e.jobId(), e.jobName(), e.type().code(), e.timestamp(), e.detail());
        }
    }
}
