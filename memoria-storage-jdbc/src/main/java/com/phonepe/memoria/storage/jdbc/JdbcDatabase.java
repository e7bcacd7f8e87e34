/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memoria.storage.jdbc;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connection source shared by the JDBC stores of one database file. Writers are serialised in process so that
 * SQLite's single writer lock is only contended across processes. Every statement carries the query timeout.
 */
@Slf4j
public class JdbcDatabase {
    private static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);
    private static final Set<SQLiteErrorCode> TRANSIENT_CODES = Set.of(SQLiteErrorCode.SQLITE_BUSY,
                                                                       SQLiteErrorCode.SQLITE_LOCKED,
                                                                       SQLiteErrorCode.SQLITE_BUSY_SNAPSHOT,
                                                                       SQLiteErrorCode.SQLITE_BUSY_RECOVERY);

    /**
     * JDBC work that may fail with {@link SQLException}
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final SQLiteDataSource dataSource;
    private final int queryTimeoutSeconds;
    private final ReentrantLock writeLock = new ReentrantLock();

    @Builder
    public JdbcDatabase(@NonNull String url, Duration queryTimeout, Duration busyTimeout) {
        final var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout((int) Objects.requireNonNullElse(busyTimeout, DEFAULT_BUSY_TIMEOUT).toMillis());
        config.enforceForeignKeys(false);
        this.dataSource = new SQLiteDataSource(config);
        this.dataSource.setUrl(url);
        this.queryTimeoutSeconds = (int) Math.max(1, Objects.requireNonNullElse(queryTimeout, DEFAULT_QUERY_TIMEOUT)
                .toSeconds());
        log.info("Using database {}", url);
    }

    public static JdbcDatabase sqlite(String file) {
        return JdbcDatabase.builder().url("jdbc:sqlite:" + file).build();
    }

    /**
     * Run read only work on a fresh connection
     */
    public <T> T read(SqlWork<T> work) {
        try (var connection = dataSource.getConnection()) {
            return work.apply(connection);
        }
        catch (SQLException e) {
            throw translate(e);
        }
    }

    /**
     * Run work in a single transaction. Rolls back on any failure.
     */
    public <T> T inTransaction(SqlWork<T> work) {
        writeLock.lock();
        try (var connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                final var result = work.apply(connection);
                connection.commit();
                return result;
            }
            catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        }
        catch (SQLException e) {
            throw translate(e);
        }
        finally {
            writeLock.unlock();
        }
    }

    public PreparedStatement prepare(Connection connection, String sql) throws SQLException {
        final var statement = connection.prepareStatement(sql);
        statement.setQueryTimeout(queryTimeoutSeconds);
        return statement;
    }

    /**
     * Lock contention and timeouts are worth retrying, everything else is a hard store failure
     */
    static MemoriaException translate(SQLException e) {
        final var transientFailure = e instanceof SQLTransientException
                || (e instanceof SQLiteException sqlite && TRANSIENT_CODES.contains(sqlite.getResultCode()));
        log.warn("Database call failed ({}): {}", transientFailure ? "transient" : "permanent", e.getMessage());
        return MemoriaException.wrap(transientFailure ? ErrorType.TRANSIENT_STORE_ERROR : ErrorType.STORE_FAILURE, e);
    }
}
