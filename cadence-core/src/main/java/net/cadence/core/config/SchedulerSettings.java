package net.cadence.core.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * 스케줄러 가변 상수 모음.
 *
 * @param minInterval   이보다 짧은 주기는 이 값으로 올린다
 * @param graceDelay    첫 발화 힌트가 과거/없음일 때 now 에 더하는 지연
 * @param misfireGrace  이 이상 늦은 발화는 misfire 로 보고 (발화 자체는 1회로 합쳐서 수행)
 * @param tickInterval  타이머 디스패치 루프 주기
 * @param shutdownGrace shutdown 시 실행 중 콜백을 기다리는 최대 시간
 * @param workerThreads 콜백 실행 워커 수
 * @param zone          이벤트 표시용 전역 타임존
 */
public record SchedulerSettings(
        Duration minInterval,
        Duration graceDelay,
        Duration misfireGrace,
        Duration tickInterval,
        Duration shutdownGrace,
        int workerThreads,
        ZoneId zone
) {
    public SchedulerSettings {
        Objects.requireNonNull(minInterval, "minInterval");
        Objects.requireNonNull(graceDelay, "graceDelay");
        Objects.requireNonNull(misfireGrace, "misfireGrace");
        Objects.requireNonNull(tickInterval, "tickInterval");
        Objects.requireNonNull(shutdownGrace, "shutdownGrace");
        Objects.requireNonNull(zone, "zone");
        if (minInterval.isZero() || minInterval.isNegative())
            throw new IllegalArgumentException("minInterval must be positive: " + minInterval);
        if (graceDelay.isNegative() || misfireGrace.isNegative() || shutdownGrace.isNegative())
            throw new IllegalArgumentException("grace durations must not be negative");
        if (tickInterval.isZero() || tickInterval.isNegative())
            throw new IllegalArgumentException("tickInterval must be positive: " + tickInterval);
        if (workerThreads < 1)
            throw new IllegalArgumentException("workerThreads must be >= 1: " + workerThreads);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(
                Duration.ofSeconds(60),
                Duration.ofSeconds(1),
                Duration.ofSeconds(60),
                Duration.ofMillis(250),
                Duration.ofSeconds(30),
                4,
                ZoneId.of("UTC"));
    }

    public SchedulerSettings withZone(ZoneId zone) {
        return new SchedulerSettings(minInterval, graceDelay, misfireGrace, tickInterval, shutdownGrace, workerThreads, zone);
    }
}
