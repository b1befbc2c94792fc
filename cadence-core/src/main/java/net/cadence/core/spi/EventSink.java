package net.cadence.core.spi;

import net.cadence.core.event.SchedulingEvent;

/** 알림/로그 수집기. 엔진은 이벤트를 보고만 하고 포맷/전송은 구현체 몫. */
@FunctionalInterface
public interface EventSink {
    void publish(SchedulingEvent event);

    EventSink NOOP = event -> { };
}
