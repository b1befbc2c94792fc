package net.cadence.core.model;

import java.time.Instant;
import java.util.Locale;

public record Job(
        Long id,
        String name,
        String description,
        String interval,    // 예: "5 minutes", "2h", "daily"
        Instant lastRun,    // 한 번도 실행 안 됐으면 null
        Instant nextRun,
        Status status,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        ACTIVE, PENDING, COMPLETED, FAILED, PAUSED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.trim().toUpperCase(Locale.ROOT)); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        /** 엔진 타이머를 걸지 않는 상태 (API 계층이 removeJob 호출 책임) */
        public boolean halted() { return this == PAUSED || this == COMPLETED; }
    }

    public static Job ofNew(String name, String description, String interval, Status status, Instant nextRun) {
        return new Job(null, name, description, interval, null, nextRun,
                status == null ? Status.PENDING : status, null, null);
    }

    public Job withRun(Instant lastRun, Instant nextRun) {
        return new Job(id, name, description, interval, lastRun, nextRun, status, createdAt, updatedAt);
    }

    public Job withStatus(Status status) {
        return new Job(id, name, description, interval, lastRun, nextRun, status, createdAt, updatedAt);
    }
}
