package net.cadence.core.support;

import net.cadence.core.spi.TxRunner;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/** 트랜잭션 없이 바로 실행. 어떤 전파로 불렸는지만 센다 */
public final class DirectTxRunner implements TxRunner {
    public final AtomicInteger required = new AtomicInteger();
    public final AtomicInteger requiresNew = new AtomicInteger();

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        required.incrementAndGet();
        return body.call();
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        requiresNew.incrementAndGet();
        return body.call();
    }
}
