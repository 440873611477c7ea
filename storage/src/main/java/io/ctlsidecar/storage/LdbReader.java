// file: storage/src/main/java/io/ctlsidecar/storage/LdbReader.java
package io.ctlsidecar.storage;

import io.ctlsidecar.core.ReadContext;
import io.ctlsidecar.core.Reader;
import io.ctlsidecar.core.ReaderException;
import io.ctlsidecar.core.Row;
import io.ctlsidecar.core.RowCursor;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link io.ctlsidecar.core.Reader} over the local SQLite replica of the control store (the "LDB").
 * <p>
 * Layout of the LDB:
 *  - Each replicated table lives in a SQLite table named {@code family___table}.
 *  - {@code _ldb_last_update(name, timestamp)} holds, under name {@code 'ldb'}, the
 *    epoch-millis time at which the replica last applied a ledger entry.
 * <p>
 * Concurrency:
 *  - Every call opens its own read-only connection, so the reader is safe to share.
 *  - Prefix-scan cursors own their connection until closed.
 *  - Primary-key column lists are cached per table after the first lookup.
 */
public final class LdbReader implements Reader {
    private static final Logger log = Logger.getLogger(LdbReader.class.getName());

    static final String LAST_UPDATE_TABLE = "_ldb_last_update";
    static final String LAST_UPDATE_NAME = "ldb";

    private static final String TABLE_SEPARATOR = "___";
    private static final Pattern NAME = Pattern.compile("[a-z][a-z0-9_]*");

    private final String url;
    private final Properties connectionProps;
    private final Clock clock;
    private final Map<String, List<String>> primaryKeys = new ConcurrentHashMap<>();

    public LdbReader(Path ldbPath) {
        this(ldbPath, Clock.systemUTC());
    }

    public LdbReader(Path ldbPath, Clock clock) {
        Objects.requireNonNull(ldbPath, "ldbPath");
        this.url = "jdbc:sqlite:" + ldbPath.toAbsolutePath();
        this.clock = Objects.requireNonNull(clock, "clock");

        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        this.connectionProps = config.toProperties();
    }

    /** SQLite table holding {@code family.table}. */
    public static String ldbTableName(String family, String table) throws ReaderException {
        if (family == null || !NAME.matcher(family).matches()) {
            throw new ReaderException("invalid family name: " + family);
        }
        if (table == null || !NAME.matcher(table).matches()) {
            throw new ReaderException("invalid table name: " + table);
        }
        return family + TABLE_SEPARATOR + table;
    }

    @Override
    public Optional<Row> lookupByKey(ReadContext ctx, String family, String table, List<Object> key)
            throws ReaderException {
        ctx.checkActive();
        String tableName = ldbTableName(family, table);

        try (Connection conn = open()) {
            List<String> pk = primaryKey(conn, tableName);
            if (key.size() != pk.size()) {
                throw new ReaderException(
                        "key has " + key.size() + " columns, primary key has " + pk.size());
            }
            String sql = "SELECT * FROM " + quote(tableName) + where(pk, key.size()) + " LIMIT 1";
            try (PreparedStatement st = conn.prepareStatement(sql)) {
                bind(st, key);
                attach(ctx, st);
                try (ResultSet rs = st.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(decodeRow(rs));
                }
            }
        } catch (SQLException e) {
            throw failure(ctx, e);
        }
    }

    @Override
    public RowCursor scanByKeyPrefix(ReadContext ctx, String family, String table, List<Object> keyPrefix)
            throws ReaderException {
        ctx.checkActive();
        String tableName = ldbTableName(family, table);

        Connection conn = null;
        try {
            conn = open();
            List<String> pk = primaryKey(conn, tableName);
            if (keyPrefix.size() > pk.size()) {
                throw new ReaderException(
                        "key prefix has " + keyPrefix.size() + " columns, primary key has " + pk.size());
            }
            String sql = "SELECT * FROM " + quote(tableName)
                    + where(pk, keyPrefix.size())
                    + " ORDER BY " + String.join(", ", pk.stream().map(LdbReader::quote).toList());
            PreparedStatement st = conn.prepareStatement(sql);
            bind(st, keyPrefix);
            attach(ctx, st);
            ResultSet rs = st.executeQuery();
            return new LdbRowCursor(ctx, conn, st, rs);
        } catch (SQLException e) {
            closeQuietly(conn);
            throw failure(ctx, e);
        } catch (ReaderException | RuntimeException e) {
            closeQuietly(conn);
            throw e;
        }
    }

    @Override
    public Duration ledgerLatency(ReadContext ctx) throws ReaderException {
        ctx.checkActive();
        String sql = "SELECT timestamp FROM " + LAST_UPDATE_TABLE + " WHERE name = ?";
        try (Connection conn = open();
             PreparedStatement st = conn.prepareStatement(sql)) {
            st.setString(1, LAST_UPDATE_NAME);
            attach(ctx, st);
            try (ResultSet rs = st.executeQuery()) {
                if (!rs.next()) {
                    throw new ReaderException("no ledger updates have been received yet");
                }
                Instant lastUpdate = Instant.ofEpochMilli(rs.getLong(1));
                Duration lag = Duration.between(lastUpdate, clock.instant());
                return lag.isNegative() ? Duration.ZERO : lag;
            }
        } catch (SQLException e) {
            throw failure(ctx, e);
        }
    }

    // ---------- helpers ----------

    private Connection open() throws SQLException {
        return DriverManager.getConnection(url, connectionProps);
    }

    /**
     * Primary-key columns of {@code tableName} in key order.
     * SQLite reports each column's 1-based position inside the primary key in the "pk" column.
     */
    private List<String> primaryKey(Connection conn, String tableName) throws SQLException, ReaderException {
        List<String> cached = primaryKeys.get(tableName);
        if (cached != null) {
            return cached;
        }

        TreeMap<Integer, String> byPosition = new TreeMap<>();
        boolean exists = false;
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + quote(tableName) + ")")) {
            while (rs.next()) {
                exists = true;
                int pos = rs.getInt("pk");
                if (pos > 0) {
                    byPosition.put(pos, rs.getString("name"));
                }
            }
        }
        if (!exists) {
            throw new ReaderException("table not found: " + tableName);
        }
        if (byPosition.isEmpty()) {
            throw new ReaderException("table has no primary key: " + tableName);
        }

        List<String> pk = List.copyOf(byPosition.values());
        primaryKeys.put(tableName, pk);
        return pk;
    }

    private static String where(List<String> pk, int boundColumns) {
        if (boundColumns == 0) {
            return "";
        }
        List<String> clauses = new ArrayList<>(boundColumns);
        for (int i = 0; i < boundColumns; i++) {
            clauses.add(quote(pk.get(i)) + " = ?");
        }
        return " WHERE " + String.join(" AND ", clauses);
    }

    private static void bind(PreparedStatement st, List<Object> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object v = args.get(i);
            if (v instanceof byte[] bytes) {
                st.setBytes(i + 1, bytes);
            } else {
                st.setObject(i + 1, v);
            }
        }
    }

    /** Map the request deadline onto a query timeout and cancel the statement if the request goes away. */
    private static void attach(ReadContext ctx, Statement st) throws SQLException {
        Optional<Duration> remaining = ctx.remaining();
        if (remaining.isPresent()) {
            long millis = remaining.get().toMillis();
            st.setQueryTimeout((int) Math.max(1, (millis + 999) / 1000));
        }
        ctx.onCancel(() -> {
            try {
                if (!st.isClosed()) {
                    st.cancel();
                }
            } catch (SQLException e) {
                log.log(Level.FINE, "statement cancel failed", e);
            }
        });
    }

    static Row decodeRow(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        Map<String, Object> columns = new LinkedHashMap<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            columns.put(md.getColumnLabel(i), rs.getObject(i));
        }
        return new Row(columns);
    }

    static ReaderException failure(ReadContext ctx, SQLException e) {
        if (ctx.isCancelled()) {
            return new ReaderException("context canceled", e);
        }
        return new ReaderException(e.getMessage(), e);
    }

    private static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    static void closeQuietly(AutoCloseable c) {
        if (c == null) {
            return;
        }
        try {
            c.close();
        } catch (Exception e) {
            log.log(Level.WARNING, "failed to release LDB resource", e);
        }
    }
}
