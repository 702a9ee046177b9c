package net.driftwatch.adapter.jdbc;

import java.sql.Connection;

/** 현재 스레드의 트랜잭션 커넥션. 리포지토리는 여기서만 커넥션을 얻는다. */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();
    private TxContext() {}
    public static void set(Connection c) { LOCAL.set(c); }
    public static Connection get() { return LOCAL.get(); }
    public static void clear() { LOCAL.remove(); }

    public static Connection mustGet() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("TxContext required (wrap with JdbcTxRunner)");
        return c;
    }
}
