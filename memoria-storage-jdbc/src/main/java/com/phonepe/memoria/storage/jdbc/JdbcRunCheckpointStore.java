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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpoint;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpointStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checkpoints of durable runs, one row per run in the same database as the metadata
 */
@Slf4j
public class JdbcRunCheckpointStore implements RunCheckpointStore {
    private final JdbcDatabase database;
    private final ObjectMapper mapper;

    public JdbcRunCheckpointStore(@NonNull JdbcDatabase database, @NonNull ObjectMapper mapper) {
        this.database = database;
        this.mapper = mapper;
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    CREATE TABLE IF NOT EXISTS run_checkpoints (run_id TEXT PRIMARY KEY, started_at INTEGER,
                    body TEXT NOT NULL)
                    """)) {
                return statement.execute();
            }
        });
    }

    @Override
    public void save(RunCheckpoint checkpoint) {
        final var body = toJson(checkpoint);
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    INSERT INTO run_checkpoints (run_id, started_at, body) VALUES (?, ?, ?)
                    ON CONFLICT (run_id) DO UPDATE SET started_at = excluded.started_at, body = excluded.body
                    """)) {
                statement.setString(1, checkpoint.getRunId());
                statement.setObject(2, millis(checkpoint.getStartedAt()));
                statement.setString(3, body);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public Optional<RunCheckpoint> get(String runId) {
        return database.read(connection -> {
            try (var statement = database.prepare(connection,
                                                   "SELECT body FROM run_checkpoints WHERE run_id = ?")) {
                statement.setString(1, runId);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(fromJson(rs.getString(1))) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<RunCheckpoint> incomplete() {
        return database.read(connection -> {
            try (var statement = database.prepare(connection,
                                                   "SELECT run_id, body FROM run_checkpoints ORDER BY started_at, run_id");
                 var rs = statement.executeQuery()) {
                final var checkpoints = new ArrayList<RunCheckpoint>();
                while (rs.next()) {
                    try {
                        checkpoints.add(mapper.readValue(rs.getString("body"), RunCheckpoint.class));
                    }
                    catch (IOException e) {
                        log.warn("Skipping unreadable checkpoint of run {}: {}", rs.getString("run_id"),
                                 e.getMessage());
                    }
                }
                return checkpoints;
            }
        });
    }

    @Override
    public void delete(String runId) {
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, "DELETE FROM run_checkpoints WHERE run_id = ?")) {
                statement.setString(1, runId);
                return statement.executeUpdate();
            }
        });
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private String toJson(RunCheckpoint checkpoint) {
        try {
            return mapper.writeValueAsString(checkpoint);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    private RunCheckpoint fromJson(String json) {
        try {
            return mapper.readValue(json, RunCheckpoint.class);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }
}
