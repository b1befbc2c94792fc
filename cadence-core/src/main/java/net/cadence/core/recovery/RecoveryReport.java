package net.cadence.core.recovery;

import java.util.ArrayList;
import java.util.List;

/** 재기동 복구 결과 DTO */
public final class RecoveryReport {
    public int total;
    public int scheduled;
    public int rejected;
    public int halted;
    public final List<Long> rejectedIds = new ArrayList<>();

    @Override public String toString() {
        return "RecoveryReport{" +
                "total=" + total +
                ", scheduled=" + scheduled +
                ", rejected=" + rejected +
                ", halted=" + halted +
                ", rejectedIds=" + rejectedIds +
                '}';
    }
}
