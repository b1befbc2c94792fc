package net.cadence.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드에 묶인 트랜잭션 커넥션. 저장소 구현은 여기서만 커넥션을 얻는다. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}

    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    /** 진행 중인 트랜잭션이 없으면 IllegalStateException */
    public static Connection require() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with a TxRunner)");
        return c;
    }
}
