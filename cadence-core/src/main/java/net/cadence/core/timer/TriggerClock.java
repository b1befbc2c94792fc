package net.cadence.core.timer;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 발화 시각 계산기. cron 처럼 벽시계에 정렬하지 않고 순수 간격 반복만 한다.
 */
public final class TriggerClock {
    private final Duration graceDelay;

    public TriggerClock(Duration graceDelay) {
        this.graceDelay = Objects.requireNonNull(graceDelay);
    }

    /** 힌트가 미래면 그대로, 과거/없음이면 now + grace. 즉시/소급 발화는 없다 */
    public Instant firstFire(Instant hint, Instant now) {
        Instant earliest = now.plus(graceDelay);
        if (hint == null || !hint.isAfter(now)) return earliest;
        return hint;
    }

    /** 이번 발화의 완료 시각 기준으로 다음 발화 */
    public Instant next(Instant completedAt, Duration interval) {
        return completedAt.plus(interval);
    }

    public Duration graceDelay() {
        return graceDelay;
    }
}
