package net.cadence.core.event;

import java.time.Instant;

public record SchedulingEvent(
        Long jobId,
        String jobName,     // 모르면 null (예: id만으로 remove)
        Type type,
        Instant timestamp,
        String detail
) {
    public enum Type {
        SCHEDULED, FIRED, REMOVED, REJECTED, FAILED, SKIPPED;

        public String code() { return name().toLowerCase(); }
    }

    public static SchedulingEvent of(Long jobId, String jobName, Type type, Instant at, String detail) {
        return new SchedulingEvent(jobId, jobName, type, at, detail);
    }
}
