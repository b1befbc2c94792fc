package net.cadence.core.spi;

import java.time.Instant;

/** 엔진 전체가 참조하는 시간 원천. 테스트에서는 수동으로 전진시키는 구현을 주입한다. */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock system() { return Instant::now; }
}
