package net.cadence.core.interval;

import java.time.Duration;
import java.util.Objects;

/** 파싱 결과. 항상 0 이상의 고정 길이. */
public record ParsedInterval(String text, Duration duration) {
    public ParsedInterval {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) throw new IllegalArgumentException("negative interval: " + duration);
    }

    /** 최소 단위 미만이면 최소값으로 올린 길이 */
    public Duration atLeast(Duration minimum) {
        return duration.compareTo(minimum) < 0 ? minimum : duration;
    }

    public boolean isBelow(Duration minimum) {
        return duration.compareTo(minimum) < 0;
    }
}
