package io.github.yok.sqlinsert.db;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.util.Arrays;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class ConnectionInsertExecutorTest {

    private static final String SQL = "INSERT INTO t (id, note, weight) VALUES (?, ?, ?)";

    private Connection conn;
    private PreparedStatement ps;
    private ConnectionInsertExecutor executor;

    @BeforeEach
    void setUp() throws SQLException {
        conn = mock(Connection.class);
        ps = mock(PreparedStatement.class);
        when(conn.prepareStatement(SQL)).thenReturn(ps);
        executor = new ConnectionInsertExecutor(conn);
    }

    @Test
    void prepare_正常ケース_引数を束縛して実行する_位置順に設定され更新件数が返ること()
            throws Exception {
        when(ps.executeUpdate()).thenReturn(1);

        try (PreparedHandle handle = executor.prepare(SQL)) {
            assertEquals(1, handle.execute(Arrays.asList("x", null, 1.5)));
        }

        InOrder order = inOrder(ps);
        order.verify(ps).setObject(1, "x");
        order.verify(ps).setNull(2, Types.NULL);
        order.verify(ps).setObject(3, 1.5);
        order.verify(ps).executeUpdate();
        order.verify(ps).close();
        verify(conn, never()).close();
    }

    @Test
    void prepare_異常ケース_準備に失敗する_同一の例外が送出されること() throws Exception {
        SQLException failure = new SQLException("bad sql");
        when(conn.prepareStatement(anyString())).thenThrow(failure);

        assertSame(failure, assertThrows(SQLException.class, () -> executor.prepare(SQL)));
    }

    @Test
    void prepare_正常ケース_タイムアウト付きコンテキスト_切り上げた秒数が設定されること()
            throws Exception {
        ExecutionContext context = ExecutionContext.withTimeout(Duration.ofMillis(1500));

        try (PreparedHandle handle = executor.prepare(context, SQL)) {
            handle.execute(context, Arrays.asList("x", null, 1.5));
        }

        verify(ps).setQueryTimeout(2);
        verify(ps).executeUpdate();
    }

    @Test
    void prepare_正常ケース_タイムアウトなしのコンテキスト_タイムアウトが設定されないこと()
            throws Exception {
        try (PreparedHandle handle = executor.prepare(ExecutionContext.create(), SQL)) {
            verify(ps, never()).setQueryTimeout(anyInt());
        }
    }

    @Test
    void prepare_正常ケース_準備後にキャンセルする_ステートメントがキャンセルされること()
            throws Exception {
        ExecutionContext context = ExecutionContext.create();

        try (PreparedHandle handle = executor.prepare(context, SQL)) {
            context.cancel();
            verify(ps).cancel();
            assertThrows(ExecutionCancelledException.class,
                    () -> handle.execute(context, Arrays.asList("x", null, 1.5)));
        }
        verify(ps, never()).executeUpdate();
    }

    @Test
    void close_正常ケース_クローズ後にキャンセルする_ステートメントはキャンセルされないこと()
            throws Exception {
        ExecutionContext context = ExecutionContext.create();

        executor.prepare(context, SQL).close();
        context.cancel();

        verify(ps).close();
        verify(ps, never()).cancel();
    }

    @Test
    void prepare_異常ケース_キャンセル済みのコンテキスト_準備されずに例外が送出されること()
            throws Exception {
        ExecutionContext context = ExecutionContext.create();
        context.cancel();

        assertThrows(ExecutionCancelledException.class, () -> executor.prepare(context, SQL));
        verify(conn, never()).prepareStatement(anyString());
    }

    @Test
    void prepare_異常ケース_タイムアウト設定に失敗する_ステートメントが閉じられること()
            throws Exception {
        SQLException failure = new SQLException("unsupported");
        doThrow(failure).when(ps).setQueryTimeout(anyInt());

        assertSame(failure, assertThrows(SQLException.class,
                () -> executor.prepare(ExecutionContext.withTimeout(Duration.ofSeconds(3)), SQL)));
        verify(ps).close();
    }

    @Test
    void prepare_正常ケース_キャンセルに失敗する_例外が呼び出し元に伝播しないこと() throws Exception {
        doThrow(new SQLException("cancel not supported")).when(ps).cancel();
        ExecutionContext context = ExecutionContext.create();

        try (PreparedHandle handle = executor.prepare(context, SQL)) {
            context.cancel();
        }
        verify(ps).cancel();
    }

    @Test
    void toSeconds_正常ケース_各種時間を指定する_1秒以上に切り上げられること() {
        assertEquals(1, JdbcPreparedHandle.toSeconds(Duration.ofMillis(1)));
        assertEquals(1, JdbcPreparedHandle.toSeconds(Duration.ofSeconds(1)));
        assertEquals(2, JdbcPreparedHandle.toSeconds(Duration.ofMillis(1001)));
        assertEquals(1, JdbcPreparedHandle.toSeconds(Duration.ofNanos(1)));
        assertEquals(Integer.MAX_VALUE, JdbcPreparedHandle.toSeconds(Duration.ofDays(100000)));
    }

    @Test
    void constructor_異常ケース_接続がnull_NullPointerExceptionが送出されること() {
        assertThrows(NullPointerException.class, () -> new ConnectionInsertExecutor(null));
    }
}
