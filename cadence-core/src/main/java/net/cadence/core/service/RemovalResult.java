package net.cadence.core.service;

/** removeJob 결과. 어떤 값이든 호출자 입장에서는 성공이다 (멱등). */
public enum RemovalResult {
    REMOVED,
    NOT_SCHEDULED,
    SHUTDOWN_IN_PROGRESS
}
