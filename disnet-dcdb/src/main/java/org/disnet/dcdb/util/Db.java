package org.disnet.dcdb.util;

/*
 * This file is part of DISNET DCDB.
 *
 * Copyright (C) 2025 DISNET
 *
 * DISNET DCDB is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DISNET DCDB is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DISNET DCDB.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Minimal JDBC helper with connection retries, scoped transactions, an
 * idempotent insert primitive and streaming support. Used for both the MySQL
 * destination store and the SQLite staging store.
 *
 * <p><b>Usage</b>:
 * <pre>
 * Long id = Db.inTransaction(conn, c -&gt; {
 *     Db.InsertResult r = Db.insertIfAbsent(c, "INSERT INTO score (score_name) VALUES (?)",
 *             ps -&gt; ps.setString(1, "HSA"));
 *     return r.existed() ? lookup(c) : r.generatedKey();
 * });
 * </pre>
 *
 * <p>This class does <i>not</i> own the {@link Connection} lifecycle; callers open/close it.</p>
 */
public final class Db {

    /** Token replaced by {@link #bindIn(String, int)}. */
    public static final String IN_TOKEN = "(:in)";

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final String UNIQUE_VIOLATION_STATE = "23505";

    private Db() {}

    /* ---------------------------- Functional types ---------------------------- */

    @FunctionalInterface
    public interface ParamSetter {
        void accept(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    public interface ResultSetConsumer {
        void accept(ResultSet rs) throws SQLException;
    }

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Binds one item of a batch onto the statement. */
    @FunctionalInterface
    public interface BatchBinder<T> {
        void bind(PreparedStatement ps, T item) throws SQLException;
    }

    /** A unit of work run inside a transaction. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    @FunctionalInterface
    public interface RunnableEx {
        void run() throws SQLException;
    }

    /**
     * Outcome of {@link #insertIfAbsent}: either the row was new (with its
     * generated key when the table assigns one) or a row with the same unique
     * key was already present.
     */
    public static final class InsertResult {
        private final boolean existed;
        private final Long generatedKey;

        private InsertResult(boolean existed, Long generatedKey) {
            this.existed = existed;
            this.generatedKey = generatedKey;
        }

        static InsertResult inserted(Long key) { return new InsertResult(false, key); }
        static InsertResult alreadyExisted()   { return new InsertResult(true, null); }

        public boolean existed()     { return existed; }
        public Long generatedKey()   { return generatedKey; }
    }

    /* ---------------------------- Connection helpers ---------------------------- */

    /**
     * Get a JDBC connection with simple retry + exponential backoff.
     * If {@code driverClass} is provided, we try to load it once.
     * {@code user}/{@code pass} may be null for embedded stores.
     */
    public static Connection getConnection(String jdbcUrl,
                                           String user,
                                           String pass,
                                           String driverClass,
                                           int maxRetries,
                                           Duration initialBackoff) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = Duration.ofMillis(200);
        }

        if (driverClass != null && !driverClass.isEmpty()) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException ex) {
                Logger.debug("Driver class {} not found, relying on service loader", driverClass);
            }
        }

        int attempt = 0;
        long sleepMs = initialBackoff.toMillis();
        while (true) {
            try {
                Properties props = new Properties();
                if (user != null) props.setProperty("user", user);
                if (pass != null) props.setProperty("password", pass);

                if (jdbcUrl.startsWith("jdbc:mysql:")) {
                    props.setProperty("useServerPrepStmts", "true");
                    props.setProperty("rewriteBatchedStatements", "true");
                    props.setProperty("useCursorFetch", "true");
                }
                return DriverManager.getConnection(jdbcUrl, props);
            } catch (SQLException ex) {
                attempt++;
                if (attempt > maxRetries) {
                    throw new IllegalStateException("DB connection failed after " + maxRetries + " retries: " + ex, ex);
                }
                Logger.warn("DB connection attempt {} failed ({}), retrying in {} ms", attempt, ex.getMessage(), sleepMs);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("DB connection retry interrupted", ie);
                }
                sleepMs = Math.min((long) (sleepMs * 2.0), Duration.ofSeconds(30).toMillis());
            }
        }
    }

    /* ---------------------------- Query helpers ---------------------------- */

    /**
     * Stream a large read-only query through a forward-only cursor with a positive
     * fetch size.
     */
    public static void streamQuery(Connection conn,
                                   String sql,
                                   ParamSetter params,
                                   ResultSetConsumer consumer,
                                   int fetchSize) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(consumer, "consumer must not be null");
        if (fetchSize <= 0) fetchSize = 1_000;

        try (PreparedStatement ps = conn.prepareStatement(
                sql,
                ResultSet.TYPE_FORWARD_ONLY,
                ResultSet.CONCUR_READ_ONLY)) {
            ps.setFetchSize(fetchSize);
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                consumer.accept(rs);
            }
        }
    }

    /** Run a small query and collect all rows via RowMapper. */
    public static <T> List<T> runQuery(Connection conn,
                                       String sql,
                                       ParamSetter params,
                                       RowMapper<T> mapper) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        List<T> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
        }
        return out;
    }

    /** First row of a query, if any. */
    public static <T> Optional<T> queryFirst(Connection conn,
                                             String sql,
                                             ParamSetter params,
                                             RowMapper<T> mapper) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    /** Execute DDL/DML that doesn't return rows. Returns the update count. */
    public static int execute(Connection conn, String sql, ParamSetter params) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            return ps.executeUpdate();
        }
    }

    /** Execute one statement per item as a JDBC batch. Returns the summed update count. */
    public static <T> int executeBatch(Connection conn,
                                       String sql,
                                       Collection<T> items,
                                       BatchBinder<T> binder) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        if (items == null || items.isEmpty()) return 0;

        int total = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (T item : items) {
                binder.bind(ps, item);
                ps.addBatch();
            }
            for (int n : ps.executeBatch()) {
                // SUCCESS_NO_INFO (-2) counts as one row
                total += (n == Statement.SUCCESS_NO_INFO) ? 1 : Math.max(0, n);
            }
        }
        return total;
    }

    /**
     * Insert a row that may already exist under a unique key. A uniqueness
     * violation is reported as {@link InsertResult#existed()}
     * instead of an exception; any other failure propagates.
     */
    public static InsertResult insertIfAbsent(Connection conn, String sql, ParamSetter params) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            if (params != null) params.accept(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                // Tables keyed by a natural key report no numeric key
                if (keys != null && keys.getMetaData().getColumnCount() > 0 && keys.next()) {
                    Object key = keys.getObject(1);
                    if (key instanceof Number) {
                        return InsertResult.inserted(((Number) key).longValue());
                    }
                }
            }
            return InsertResult.inserted(null);
        } catch (SQLException ex) {
            if (isDuplicateKey(ex)) {
                return InsertResult.alreadyExisted();
            }
            throw ex;
        }
    }

    /** MySQL error 1062 or the standard SQLState 23505; foreign-key violations are not duplicates. */
    static boolean isDuplicateKey(SQLException ex) {
        if (ex.getErrorCode() == MYSQL_DUPLICATE_ENTRY) return true;
        return UNIQUE_VIOLATION_STATE.equals(ex.getSQLState());
    }

    /* ---------------------------- Transaction helpers ---------------------------- */

    /**
     * Run {@code body} as one unit of work: commit on success, roll back on any
     * exception, always restore auto-commit. If a transaction is already open on
     * {@code conn}, the body joins it and the outer scope decides.
     */
    public static <T> T inTransaction(Connection conn, SqlWork<T> body) throws SQLException {
        Objects.requireNonNull(conn, "conn must not be null");
        boolean prevAuto = conn.getAutoCommit();
        if (!prevAuto) {
            return body.run(conn);
        }
        conn.setAutoCommit(false);
        try {
            T result = body.run(conn);
            conn.commit();
            return result;
        } catch (SQLException | RuntimeException ex) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                ex.addSuppressed(rollbackEx);
            }
            throw ex;
        } finally {
            try {
                conn.setAutoCommit(true);
            } catch (SQLException restoreEx) {
                Logger.warn("Unable to restore auto-commit: {}", restoreEx.getMessage());
            }
        }
    }

    public static void withTransaction(Connection conn, RunnableEx body) throws SQLException {
        inTransaction(conn, c -> {
            body.run();
            return null;
        });
    }

    /* ---------------------------- IN-list helpers ---------------------------- */

    /** Replace {@value #IN_TOKEN} in {@code sql} with {@code n} positional placeholders. */
    public static String bindIn(String sql, int n) {
        if (n <= 0) throw new IllegalArgumentException("IN list must not be empty");
        return sql.replace(IN_TOKEN, "(" + String.join(", ", Collections.nCopies(n, "?")) + ")");
    }

    /** Bind string values to positions {@code start..start+values.size()-1}. Returns the next free index. */
    public static int bind(PreparedStatement ps, int start, List<String> values) throws SQLException {
        int i = start;
        for (String v : values) {
            ps.setString(i++, v);
        }
        return i;
    }
}
