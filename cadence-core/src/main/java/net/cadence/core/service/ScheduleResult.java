package net.cadence.core.service;

import java.time.Duration;
import java.time.Instant;

/**
 * scheduleJob 결과. accepted 면 reason 은 null, 아니면 interval/firstFireAt 이 null.
 */
public record ScheduleResult(
        Long jobId,
        boolean accepted,
        RejectedReason reason,
        String detail,
        Duration interval,      // 최소 단위 보정 후 실제 주기
        Instant firstFireAt
) {
    public static ScheduleResult accepted(Long jobId, Duration interval, Instant firstFireAt) {
        return new ScheduleResult(jobId, true, null, null, interval, firstFireAt);
    }

    public static ScheduleResult rejected(Long jobId, RejectedReason reason, String detail) {
        return new ScheduleResult(jobId, false, reason, detail, null, null);
    }

    public boolean rejected() {
        return !accepted;
    }
}
