package net.cadence.core.service;

/** 저장소 세션을 열 수 없음 (커넥션 획득 실패 등). */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
