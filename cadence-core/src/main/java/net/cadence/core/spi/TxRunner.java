package net.cadence.core.spi;

import java.util.concurrent.Callable;

/**
 * 저장소 세션(트랜잭션) 경계.
 * <ul>
 *   <li>{@link #required}: 진행 중인 세션이 있으면 참여, 없으면 새로 연다.</li>
 *   <li>{@link #requiresNew}: 항상 새 세션을 열고, 성공/실패와 무관하게 종료 시 반납한다.</li>
 * </ul>
 */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;

    <T> T requiresNew(Callable<T> body) throws Exception;

    default void requiredVoid(Work body) throws Exception {
        required(() -> { body.run(); return null; });
    }

    @FunctionalInterface
    interface Work {
        void run() throws Exception;
    }
}
