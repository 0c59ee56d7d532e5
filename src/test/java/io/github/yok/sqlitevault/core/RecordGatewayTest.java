package io.github.yok.sqlitevault.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.sqlitevault.codec.DecodingException;
import io.github.yok.sqlitevault.codec.PlainValueCodec;
import io.github.yok.sqlitevault.codec.ValueCodecFactory;
import io.github.yok.sqlitevault.config.DataMode;
import io.github.yok.sqlitevault.db.ConnectionProvider;
import io.github.yok.sqlitevault.schema.ColumnDescriptor;
import io.github.yok.sqlitevault.schema.SchemaIntrospector;
import io.github.yok.sqlitevault.type.TypeCoercer;
import io.github.yok.sqlitevault.type.TypeConversionException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

class RecordGatewayTest {

    @TempDir
    Path tempDir;

    private ConnectionProvider provider;
    private RecordGateway gateway;

    @BeforeEach
    void setUp() throws SQLException {
        provider = new ConnectionProvider(tempDir.resolve("gateway.db").toString(), 1000);
        gateway = gateway(DataMode.PLAIN);
        try (Connection conn = provider.open(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE users (id INTEGER, name TEXT)");
            stmt.execute("CREATE TABLE people (name TEXT, age INTEGER)");
            stmt.execute("CREATE TABLE typed (id INTEGER, score REAL, active BOOLEAN,"
                    + " joined DATETIME, name TEXT, memo)");
        }
    }

    private RecordGateway gateway(DataMode mode) {
        String secret = mode.requiresSecret() ? "s3cret" : null;
        return new RecordGateway(provider, new SchemaIntrospector(provider),
                ValueCodecFactory.create(mode, secret), new TypeCoercer(ZoneOffset.UTC));
    }

    private static Map<String, Object> record(Object... keyValues) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            record.put((String) keyValues[i], keyValues[i + 1]);
        }
        return record;
    }

    private int countRows(String table) throws SQLException {
        try (Connection conn = provider.open(); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private String rawValue(String sql) throws SQLException {
        try (Connection conn = provider.open(); Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getString(1);
        }
    }

    // -------------------------------------------------------------------------
    // 一連の操作
    // -------------------------------------------------------------------------

    @Test
    void 一連の操作_正常ケース_追加取得更新削除を行う_各結果が期待どおりであること() throws Exception {
        DatabaseResponse added = gateway.add(record("id", 1, "name", "Ann"), "users");
        assertTrue(added.isStatus());

        DatabaseResponse fetched = gateway.fetch(record("id", 1), "users", FetchMode.ONE);
        assertTrue(fetched.isStatus());
        assertEquals(record("id", 1L, "name", "Ann"), fetched.asRecord());

        DatabaseResponse updated =
                gateway.update(record("id", 1), record("name", "Annie"), "users");
        assertTrue(updated.isStatus());
        assertEquals(1, updated.asCount());
        assertEquals("Annie", gateway.fetch(record("id", 1), "users").asRecord().get("name"));

        DatabaseResponse removed = gateway.remove(record("id", 1), "users");
        assertTrue(removed.isStatus());
        assertEquals(1, removed.asCount());

        DatabaseResponse after = gateway.fetch(record("id", 1), "users", FetchMode.ONE);
        assertFalse(after.isStatus());
        assertNull(after.getValue());
    }

    // -------------------------------------------------------------------------
    // add
    // -------------------------------------------------------------------------

    @ParameterizedTest
    @EnumSource(DataMode.class)
    void add_正常ケース_各モードで型付きの値を書き込む_読み出し時に型変換されること(DataMode mode)
            throws Exception {
        RecordGateway modeGateway = gateway(mode);
        Map<String, Object> input = record("id", 42, "score", 1.5d, "active", true, "joined",
                1700000000, "name", "日本語", "memo", "raw");

        assertTrue(modeGateway.add(input, "typed").isStatus());
        Map<String, Object> row = modeGateway.fetch(record("id", 42), "typed").asRecord();

        assertEquals(42L, row.get("id"));
        assertEquals(1.5d, row.get("score"));
        assertEquals(Boolean.TRUE, row.get("active"));
        assertEquals(LocalDateTime.of(2023, 11, 14, 22, 13, 20), row.get("joined"));
        assertEquals("日本語", row.get("name"));
        assertEquals("raw", row.get("memo"));

        // 符号化された値で等価検索ができること
        assertTrue(modeGateway.fetch(record("name", "日本語"), "typed").isStatus());
    }

    @ParameterizedTest
    @EnumSource(value = DataMode.class, names = {"OBFUSCATE", "SECURE", "AES"})
    void add_正常ケース_符号化モードで書き込む_ストレージ上は平文でないこと(DataMode mode)
            throws Exception {
        gateway(mode).add(record("id", 1, "name", "Ann"), "users");
        assertNotEquals("Ann", rawValue("SELECT name FROM users"));
    }

    @Test
    void add_正常ケース_PLAINモードで書き込む_ストレージ上も同じ値であること() throws Exception {
        gateway.add(record("id", 1, "name", "Ann"), "users");
        assertEquals("Ann", rawValue("SELECT name FROM users"));
        assertEquals("1", rawValue("SELECT id FROM users"));
    }

    @Test
    void add_正常ケース_DATETIME列にUnix秒とISO文字列を書き込む_同じ日時として読めること()
            throws Exception {
        gateway.add(record("id", 1, "joined", 1700000000), "typed");
        gateway.add(record("id", 2, "joined", "2023-11-14T22:13:20"), "typed");
        gateway.add(record("id", 3, "joined", LocalDateTime.of(2023, 11, 14, 22, 13, 20)),
                "typed");

        List<Map<String, Object>> rows =
                gateway.fetch(Collections.emptyMap(), "typed", FetchMode.ALL).asRecords();
        assertEquals(3, rows.size());
        for (Map<String, Object> row : rows) {
            assertEquals(LocalDateTime.of(2023, 11, 14, 22, 13, 20), row.get("joined"));
        }
    }

    static Stream<Arguments> timestampsAcrossModes() {
        List<Arguments> cases = new ArrayList<>();
        for (DataMode mode : DataMode.values()) {
            cases.add(Arguments.of(mode, 1.7E9, LocalDateTime.of(2023, 11, 14, 22, 13, 20)));
            cases.add(Arguments.of(mode, -86400, LocalDateTime.of(1969, 12, 31, 0, 0)));
            cases.add(Arguments.of(mode, -1.5d,
                    LocalDateTime.of(1969, 12, 31, 23, 59, 58, 500_000_000)));
            cases.add(Arguments.of(mode,
                    ZonedDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneId.of("Asia/Tokyo")),
                    LocalDateTime.of(2024, 1, 1, 1, 0)));
        }
        return cases.stream();
    }

    @ParameterizedTest
    @MethodSource("timestampsAcrossModes")
    void add_正常ケース_DATETIME列に指数表記負値ゾーン付きの値を書き込む_同じ日時として読めること(
            DataMode mode, Object written, LocalDateTime expected) throws Exception {
        RecordGateway modeGateway = gateway(mode);

        assertTrue(modeGateway.add(record("id", 7, "joined", written), "typed").isStatus());

        Map<String, Object> row = modeGateway.fetch(record("id", 7), "typed").asRecord();
        assertEquals(expected, row.get("joined"));
    }

    @ParameterizedTest
    @EnumSource(DataMode.class)
    void add_正常ケース_64ビットに収まるBigIntegerを書き込む_Longとして読めること(DataMode mode)
            throws Exception {
        RecordGateway modeGateway = gateway(mode);

        assertTrue(modeGateway.add(record("id", BigInteger.valueOf(Long.MAX_VALUE)), "typed")
                .isStatus());

        assertEquals(Long.MAX_VALUE, modeGateway.fetch(Collections.emptyMap(), "typed").asRecord()
                .get("id"));
    }

    @ParameterizedTest
    @EnumSource(DataMode.class)
    void add_異常ケース_64ビットを超えるBigIntegerを書き込む_拒否され何も挿入されないこと(DataMode mode)
            throws Exception {
        DatabaseResponse response = gateway(mode)
                .add(record("id", new BigInteger("123456789012345678901234567890")), "typed");

        assertFalse(response.isStatus());
        assertNull(response.getValue());
        assertEquals(0, countRows("typed"));
    }

    @Test
    void add_異常ケース_SECUREモードで符号化できない文字を含む_拒否され何も挿入されないこと()
            throws Exception {
        RecordGateway secure = gateway(DataMode.SECURE);
        List<Map<String, Object>> records =
                Arrays.asList(record("id", 1, "name", "Ann"), record("id", 2, "name", "\uD300"));

        DatabaseResponse single = secure.add(record("id", 3, "name", "\uD300"), "users");
        DatabaseResponse batch = secure.add(records, "users");

        assertFalse(single.isStatus());
        assertNull(single.getValue());
        assertFalse(batch.isStatus());
        assertNull(batch.getValue());
        assertEquals(0, countRows("users"));
    }

    @Test
    void add_正常ケース_キーの順序が列順と異なる_宣言順で挿入されること() throws Exception {
        DatabaseResponse response = gateway.add(record("name", "Bob", "id", 2), "users");

        assertTrue(response.isStatus());
        assertEquals("INSERT INTO \"users\" (\"id\", \"name\") VALUES (?, ?)", response.getQuery());
        assertEquals(record("id", 2L, "name", "Bob"),
                gateway.fetch(record("id", 2), "users").asRecord());
    }

    @Test
    void add_正常ケース_一部の列だけを指定する_残りの列はnullになること() throws Exception {
        assertTrue(gateway.add(record("id", 3), "users").isStatus());
        Map<String, Object> row = gateway.fetch(record("id", 3), "users").asRecord();
        assertTrue(row.containsKey("name"));
        assertNull(row.get("name"));
    }

    @Test
    void add_正常ケース_null値を指定する_符号化されずnullとして保存されること() throws Exception {
        RecordGateway secure = gateway(DataMode.SECURE);
        assertTrue(secure.add(record("id", 1, "name", null), "users").isStatus());
        assertNull(rawValue("SELECT name FROM users"));
        assertNull(secure.fetch(record("id", 1), "users").asRecord().get("name"));
    }

    @Test
    void add_正常ケース_レコード一覧を指定する_入力がそのまま値として返ること() throws Exception {
        List<Map<String, Object>> records =
                Arrays.asList(record("id", 1, "name", "Ann"), record("id", 2, "name", "Bob"));

        DatabaseResponse response = gateway.add(records, "users");

        assertTrue(response.isStatus());
        assertSame(records, response.getValue());
        assertEquals(2, countRows("users"));
    }

    @Test
    void add_正常ケース_空の一覧を指定する_statusがfalseであること() throws Exception {
        DatabaseResponse response = gateway.add(new ArrayList<Map<String, Object>>(), "users");
        assertFalse(response.isStatus());
        assertEquals(0, countRows("users"));
    }

    @Test
    void add_異常ケース_INTEGER列に文字列を指定する_例外なしでstatusがfalseになること() throws Exception {
        DatabaseResponse response =
                gateway.add(record("name", "x", "age", "not-a-number"), "people");

        assertFalse(response.isStatus());
        assertNull(response.getValue());
        assertEquals(0, countRows("people"));
    }

    @Test
    void add_異常ケース_一覧の途中に不正なレコードがある_1件も挿入されないこと() throws Exception {
        List<Map<String, Object>> records = Arrays.asList(record("name", "a", "age", 1),
                record("name", "b", "age", "two"), record("name", "c", "age", 3));

        assertFalse(gateway.add(records, "people").isStatus());
        assertEquals(0, countRows("people"));
    }

    @Test
    void add_異常ケース_存在しない列を指定する_statusがfalseになること() throws Exception {
        assertFalse(gateway.add(record("id", 1, "nickname", "x"), "users").isStatus());
        assertEquals(0, countRows("users"));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void add_異常ケース_文字列以外のキーを含む_statusがfalseになること() throws Exception {
        Map raw = new HashMap();
        raw.put(1, "x");
        assertFalse(gateway.add((Map<String, Object>) raw, "users").isStatus());
        assertEquals(0, countRows("users"));
    }

    @Test
    void add_異常ケース_大文字小文字違いで同じ列を2回指定する_statusがfalseになること() throws Exception {
        assertFalse(gateway.add(record("name", "a", "NAME", "b"), "users").isStatus());
    }

    @Test
    void add_異常ケース_存在しないテーブルを指定する_TableNotFoundExceptionが送出されること() {
        TableNotFoundException ex = assertThrows(TableNotFoundException.class,
                () -> gateway.add(record("id", 1), "missing"));
        assertEquals("missing", ex.getTable());
    }

    // -------------------------------------------------------------------------
    // fetch
    // -------------------------------------------------------------------------

    @Test
    void fetch_正常ケース_空の条件でALLを指定する_全行が挿入順で返ること() throws Exception {
        for (int i = 1; i <= 3; i++) {
            gateway.add(record("id", i, "name", "n" + i), "users");
        }

        DatabaseResponse response = gateway.fetch(Collections.emptyMap(), "users", FetchMode.ALL);

        assertTrue(response.isStatus());
        List<Map<String, Object>> rows = response.asRecords();
        assertEquals(3, rows.size());
        assertEquals(1L, rows.get(0).get("id"));
        assertEquals(3L, rows.get(2).get("id"));
        assertEquals("SELECT * FROM \"users\"", response.getQuery());
    }

    @Test
    void fetch_正常ケース_ONEを指定する_最初の1行だけが返りLIMIT_1が付くこと() throws Exception {
        gateway.add(record("id", 3, "name", "a"), "users");
        gateway.add(record("id", 3, "name", "b"), "users");

        DatabaseResponse response = gateway.fetch(record("id", 3), "users", FetchMode.ONE);

        assertEquals("a", response.asRecord().get("name"));
        assertEquals("SELECT * FROM \"users\" WHERE \"id\" = ? LIMIT 1", response.getQuery());
    }

    @Test
    void fetch_正常ケース_一致する行がない_ONEはnullでALLは空一覧が返ること() throws Exception {
        DatabaseResponse one = gateway.fetch(record("id", 3), "users", FetchMode.ONE);
        assertFalse(one.isStatus());
        assertNull(one.getValue());

        DatabaseResponse all = gateway.fetch(record("id", 3), "users", FetchMode.ALL);
        assertFalse(all.isStatus());
        assertTrue(all.asRecords().isEmpty());
    }

    @Test
    void fetch_正常ケース_null値を条件に指定する_IS_NULLで検索されること() throws Exception {
        gateway.add(record("id", 1, "name", null), "users");
        gateway.add(record("id", 2, "name", "Bob"), "users");

        DatabaseResponse response = gateway.fetch(record("name", null), "users", FetchMode.ALL);

        assertEquals(1, response.size());
        assertEquals(1L, response.asRecords().get(0).get("id"));
    }

    @Test
    void fetch_正常ケース_列名の大文字小文字が異なる_宣言された列名で一致すること() throws Exception {
        gateway.add(record("id", 1, "name", "Ann"), "users");
        Map<String, Object> row = gateway.fetch(record("ID", 1), "USERS").asRecord();
        assertEquals(record("id", 1L, "name", "Ann"), row);
    }

    @Test
    void fetch_異常ケース_存在しない列を条件に指定する_statusがfalseになること() throws Exception {
        gateway.add(record("id", 1, "name", "Ann"), "users");

        DatabaseResponse one = gateway.fetch(record("nickname", "x"), "users");
        assertFalse(one.isStatus());
        assertNull(one.getValue());
        assertNull(one.getQuery());

        DatabaseResponse all = gateway.fetch(record("nickname", "x"), "users", FetchMode.ALL);
        assertFalse(all.isStatus());
        assertTrue(all.asRecords().isEmpty());
    }

    @Test
    void fetch_異常ケース_存在しないテーブルを指定する_statusがfalseになること() throws Exception {
        assertFalse(gateway.fetch(record("id", 1), "missing").isStatus());
        assertTrue(gateway.fetch(record("id", 1), "missing", FetchMode.ALL).asRecords().isEmpty());
    }

    @Test
    void fetch_異常ケース_別の秘密鍵で書き込まれた値を読む_DecodingExceptionが送出されること()
            throws Exception {
        gateway(DataMode.SECURE).add(record("id", 1, "name", "Ann"), "users");
        RecordGateway other = new RecordGateway(provider, new SchemaIntrospector(provider),
                ValueCodecFactory.create(DataMode.SECURE, "another"),
                new TypeCoercer(ZoneOffset.UTC));

        assertThrows(DecodingException.class,
                () -> other.fetch(Collections.emptyMap(), "users", FetchMode.ALL));
    }

    @Test
    void fetch_異常ケース_INTEGER列に外部から文字列が書かれている_TypeConversionExceptionが送出されること()
            throws Exception {
        try (Connection conn = provider.open(); Statement stmt = conn.createStatement()) {
            stmt.execute("INSERT INTO users VALUES ('abc', 'x')");
        }
        assertThrows(TypeConversionException.class,
                () -> gateway.fetch(Collections.emptyMap(), "users"));
    }

    // -------------------------------------------------------------------------
    // remove
    // -------------------------------------------------------------------------

    @Test
    void remove_正常ケース_一致しない条件で2回削除する_どちらもstatusがfalseで件数0であること()
            throws Exception {
        gateway.add(record("id", 1, "name", "Ann"), "users");

        for (int i = 0; i < 2; i++) {
            DatabaseResponse response = gateway.remove(record("id", 99), "users");
            assertFalse(response.isStatus());
            assertEquals(0, response.asCount());
        }
        assertEquals(1, countRows("users"));
    }

    @Test
    void remove_正常ケース_件数上限を指定する_上限件数だけ削除されること() throws Exception {
        for (int i = 0; i < 3; i++) {
            gateway.add(record("id", 7, "name", "dup"), "users");
        }

        DatabaseResponse response = gateway.remove(record("name", "dup"), "users", 2);

        assertEquals(2, response.asCount());
        assertEquals(1, countRows("users"));
        assertEquals("DELETE FROM \"users\" WHERE rowid IN (SELECT rowid FROM \"users\""
                + " WHERE \"name\" = ? LIMIT ?)", response.getQuery());
    }

    @Test
    void remove_正常ケース_条件の一覧を指定する_件数が合算されること() throws Exception {
        gateway.add(Arrays.asList(record("id", 1, "name", "a"), record("id", 2, "name", "b"),
                record("id", 3, "name", "c")), "users");

        DatabaseResponse response =
                gateway.remove(Arrays.asList(record("id", 1), record("id", 3), record("id", 9)),
                        "users", null);

        assertTrue(response.isStatus());
        assertEquals(2, response.asCount());
        assertEquals(1, countRows("users"));
    }

    @Test
    void remove_正常ケース_空の条件を指定する_全行が削除されること() throws Exception {
        gateway.add(Arrays.asList(record("id", 1), record("id", 2)), "users");
        assertEquals(2, gateway.remove(Collections.emptyMap(), "users").asCount());
        assertEquals(0, countRows("users"));
    }

    @Test
    void remove_正常ケース_SECUREモードで符号化された値を条件にする_一致した行が削除されること()
            throws Exception {
        RecordGateway secure = gateway(DataMode.SECURE);
        secure.add(record("id", 1, "name", "Ann"), "users");
        secure.add(record("id", 2, "name", "Bob"), "users");

        assertEquals(1, secure.remove(record("name", "Bob"), "users").asCount());
        assertEquals(1, countRows("users"));
    }

    @Test
    void remove_異常ケース_存在しないテーブルまたは列を指定する_件数0が返ること() throws Exception {
        DatabaseResponse missingTable = gateway.remove(record("id", 1), "missing");
        assertFalse(missingTable.isStatus());
        assertEquals(0, missingTable.asCount());

        DatabaseResponse unknownColumn = gateway.remove(record("nickname", 1), "users");
        assertFalse(unknownColumn.isStatus());
        assertEquals(0, unknownColumn.asCount());
    }

    @Test
    void remove_異常ケース_件数上限に0を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> gateway.remove(record("id", 1), "users", 0));
    }

    // -------------------------------------------------------------------------
    // update
    // -------------------------------------------------------------------------

    @Test
    void update_異常ケース_更新値が空である_EmptyUpdateExceptionが送出され接続しないこと()
            throws Exception {
        ConnectionProvider mockProvider = mock(ConnectionProvider.class);
        RecordGateway mocked = new RecordGateway(mockProvider, mock(SchemaIntrospector.class),
                new PlainValueCodec(), new TypeCoercer());

        assertThrows(EmptyUpdateException.class,
                () -> mocked.update(record("id", 1), Collections.emptyMap(), "users"));
        assertThrows(EmptyUpdateException.class,
                () -> mocked.update(record("id", 1), null, "users"));
        verify(mockProvider, never()).open();
    }

    @Test
    void update_異常ケース_存在しないテーブルを指定する_TableNotFoundExceptionが送出されること() {
        assertThrows(TableNotFoundException.class,
                () -> gateway.update(record("id", 1), record("name", "x"), "missing"));
    }

    @Test
    void update_異常ケース_存在しない列を指定する_statusがfalseで件数0であること() throws Exception {
        gateway.add(record("id", 1, "name", "Ann"), "users");

        DatabaseResponse badValue =
                gateway.update(record("id", 1), record("nickname", "x"), "users");
        assertFalse(badValue.isStatus());
        assertEquals(0, badValue.asCount());

        DatabaseResponse badPredicate =
                gateway.update(record("nickname", 1), record("name", "x"), "users");
        assertFalse(badPredicate.isStatus());
        assertEquals("Ann", gateway.fetch(record("id", 1), "users").asRecord().get("name"));
    }

    @Test
    void update_正常ケース_件数上限を指定する_上限件数だけ更新されること() throws Exception {
        for (int i = 0; i < 3; i++) {
            gateway.add(record("id", i, "name", "old"), "users");
        }

        DatabaseResponse response =
                gateway.update(record("name", "old"), record("name", "new"), "users", 2);

        assertEquals(2, response.asCount());
        assertEquals(2, gateway.fetch(record("name", "new"), "users", FetchMode.ALL).size());
        assertEquals("UPDATE \"users\" SET \"name\" = ? WHERE rowid IN (SELECT rowid FROM"
                + " \"users\" WHERE \"name\" = ? LIMIT ?)", response.getQuery());
    }

    @Test
    void update_正常ケース_一致しない条件を指定する_statusがfalseで件数0であること() throws Exception {
        DatabaseResponse response = gateway.update(record("id", 1), record("name", "x"), "users");
        assertFalse(response.isStatus());
        assertEquals(0, response.asCount());
    }

    @Test
    void update_正常ケース_AESモードで更新する_更新後の値が復号できること() throws Exception {
        RecordGateway aes = gateway(DataMode.AES);
        aes.add(record("id", 1, "name", "Ann"), "users");

        assertEquals(1, aes.update(record("name", "Ann"), record("name", "Annie"), "users")
                .asCount());
        assertEquals("Annie", aes.fetch(record("id", 1), "users").asRecord().get("name"));
    }

    @Test
    void update_異常ケース_SECUREモードで符号化できない文字を指定する_件数0で拒否されること()
            throws Exception {
        RecordGateway secure = gateway(DataMode.SECURE);
        secure.add(record("id", 1, "name", "Ann"), "users");

        DatabaseResponse response =
                secure.update(record("id", 1), record("name", "\uD300"), "users");

        assertFalse(response.isStatus());
        assertEquals(0, response.asCount());
        assertEquals("Ann", secure.fetch(record("id", 1), "users").asRecord().get("name"));
    }

    @Test
    void fetch_異常ケース_SECUREモードで符号化できない検索値を指定する_該当なしが返ること()
            throws Exception {
        RecordGateway secure = gateway(DataMode.SECURE);
        secure.add(record("id", 1, "name", "Ann"), "users");

        assertNull(secure.fetch(record("name", "\uD300"), "users").getValue());
        assertTrue(secure.fetch(record("name", "\uD300"), "users", FetchMode.ALL).asRecords()
                .isEmpty());

        List<Map<String, Object>> predicates =
                Arrays.asList(record("id", 1), record("name", "\uD300"));
        DatabaseResponse removed = secure.remove(predicates, "users", null);
        assertFalse(removed.isStatus());
        assertEquals(0, removed.asCount());
        assertEquals(1, countRows("users"));
    }

    // -------------------------------------------------------------------------
    // 接続の解放と例外の伝播
    // -------------------------------------------------------------------------

    @Test
    void fetch_異常ケース_SQL実行で例外が発生する_SQLExceptionが伝播し接続が閉じられること()
            throws Exception {
        ConnectionProvider mockProvider = mock(ConnectionProvider.class);
        SchemaIntrospector mockIntrospector = mock(SchemaIntrospector.class);
        Connection conn = mock(Connection.class);
        when(mockProvider.open()).thenReturn(conn);
        when(mockIntrospector.columns(conn, "users")).thenReturn(Optional.of(
                Collections.singletonList(new ColumnDescriptor(0, "id", "INTEGER", false, null,
                        false))));
        SQLException failure = new SQLException("disk I/O error");
        when(conn.prepareStatement(anyString())).thenThrow(failure);
        RecordGateway mocked = new RecordGateway(mockProvider, mockIntrospector,
                new PlainValueCodec(), new TypeCoercer());

        SQLException ex = assertThrows(SQLException.class,
                () -> mocked.fetch(record("id", 1), "users"));
        assertSame(failure, ex);
        verify(conn).close();

        assertThrows(SQLException.class, () -> mocked.add(record("id", 1), "users"));
        assertThrows(SQLException.class, () -> mocked.remove(record("id", 1), "users"));
        assertThrows(SQLException.class,
                () -> mocked.update(record("id", 1), record("id", 2), "users"));
        verify(conn, times(4)).close();
    }

    @Test
    void add_異常ケース_検証で拒否される_接続が閉じられること() throws Exception {
        ConnectionProvider mockProvider = mock(ConnectionProvider.class);
        SchemaIntrospector mockIntrospector = mock(SchemaIntrospector.class);
        Connection conn = mock(Connection.class);
        when(mockProvider.open()).thenReturn(conn);
        when(mockIntrospector.columns(eq(conn), anyString())).thenReturn(Optional.empty());
        RecordGateway mocked = new RecordGateway(mockProvider, mockIntrospector,
                new PlainValueCodec(), new TypeCoercer());

        assertThrows(TableNotFoundException.class, () -> mocked.add(record("id", 1), "users"));
        assertFalse(mocked.fetch(record("id", 1), "users").isStatus());
        verify(conn, times(2)).close();
        verify(conn, never()).prepareStatement(anyString());
    }
}
