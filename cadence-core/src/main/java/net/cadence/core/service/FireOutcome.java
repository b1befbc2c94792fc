package net.cadence.core.service;

public enum FireOutcome {
    FIRED,
    /** 발화 사이에 잡이 삭제됨. 오류가 아니라 skip */
    JOB_NOT_FOUND,
    /** 저장소 읽기/쓰기 실패. next_run 은 그대로 두고 재시도 없이 다음 발화를 기다린다 */
    STORE_UNAVAILABLE,
    /** 저장된 주기 문자열이 발화 시점에 해석 불가 */
    FAILED
}
