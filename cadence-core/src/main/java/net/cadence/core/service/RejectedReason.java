package net.cadence.core.service;

public enum RejectedReason {
    /** 주기 문자열 파싱 실패. 잡은 저장된 채로 스케줄만 안 됨 */
    INVALID_INTERVAL,
    /** shutdown 진행 중에 들어온 요청 (큐잉하지 않음) */
    SHUTDOWN_IN_PROGRESS
}
