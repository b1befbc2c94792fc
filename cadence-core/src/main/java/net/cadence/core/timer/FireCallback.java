package net.cadence.core.timer;

/** 타이머 발화 시 워커 스레드에서 호출된다. 던진 예외는 타이머 테이블이 잡아서 로그만 남긴다. */
@FunctionalInterface
public interface FireCallback {
    void fire(long jobId) throws Exception;
}
