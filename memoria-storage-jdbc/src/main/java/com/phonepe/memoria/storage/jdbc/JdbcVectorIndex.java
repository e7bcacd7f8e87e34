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
import com.phonepe.memoria.core.model.EntityType;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.utils.VectorUtils;
import com.phonepe.memoria.core.vector.VectorHit;
import com.phonepe.memoria.core.vector.VectorIndex;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Vectors kept as little endian float blobs next to the scope columns. Queries narrow by scope and entity type in
 * SQL and rank by cosine similarity in process, which is adequate for per tenant volumes in the tens of thousands.
 */
@Slf4j
public class JdbcVectorIndex implements VectorIndex {
    private static final String TABLE = "vectors";

    private final JdbcDatabase database;
    private volatile ScopeColumns scopeColumns;
    private volatile int dimension;

    public JdbcVectorIndex(@NonNull JdbcDatabase database) {
        this.database = database;
    }

    @Override
    public synchronized void provision(ScopeSchema schema, int dimension) {
        final var columns = new ScopeColumns(schema);
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    CREATE TABLE IF NOT EXISTS %s (%s, entity_type TEXT NOT NULL, entity_id TEXT NOT NULL,
                    dim INTEGER NOT NULL, vector BLOB NOT NULL, PRIMARY KEY (%s))
                    """.formatted(TABLE, columns.definitions(), columns.indexed("entity_type", "entity_id")))) {
                statement.execute();
            }
            return null;
        });
        this.scopeColumns = columns;
        this.dimension = dimension;
        log.info("Vector table provisioned with dimension {}", dimension);
    }

    @Override
    public void upsert(Scope scope, EntityType entityType, String entityId, float[] vector) {
        if (dimension > 0 && vector.length != dimension) {
            throw MemoriaException.of(ErrorType.INVALID_INPUT,
                                      "Vector dimension %d does not match index dimension %d"
                                              .formatted(vector.length, dimension));
        }
        final var columns = columns();
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    INSERT INTO %s (%s, entity_type, entity_id, dim, vector) VALUES (%s, ?, ?, ?, ?)
                    ON CONFLICT (%s) DO UPDATE SET dim = excluded.dim, vector = excluded.vector
                    """.formatted(TABLE,
                                  columns.columnList(),
                                  columns.placeholders(),
                                  columns.indexed("entity_type", "entity_id")))) {
                var index = columns.bind(statement, scope, 1);
                statement.setString(index++, entityType.name());
                statement.setString(index++, entityId);
                statement.setInt(index++, vector.length);
                statement.setBytes(index, toBytes(vector));
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public void delete(Scope scope, EntityType entityType, String entityId) {
        final var condition = columns().exact(scope);
        database.inTransaction(connection -> {
            try (var statement = database.prepare(
                    connection,
                    "DELETE FROM %s WHERE %s AND entity_type = ? AND entity_id = ?".formatted(TABLE,
                                                                                             condition.sql()))) {
                final var index = condition.bind(statement, 1);
                statement.setString(index, entityType.name());
                statement.setString(index + 1, entityId);
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public List<VectorHit> query(ScopeSelector selector, EntityType entityType, float[] vector, int k) {
        final var columns = columns();
        final var condition = columns.where(selector);
        final var candidates = database.read(connection -> {
            try (var statement = database.prepare(
                    connection,
                    "SELECT %s, entity_id, vector FROM %s WHERE %s AND entity_type = ?".formatted(
                            columns.columnList(), TABLE, condition.sql()))) {
                statement.setString(condition.bind(statement, 1), entityType.name());
                try (var rs = statement.executeQuery()) {
                    final var hits = new ArrayList<VectorHit>();
                    while (rs.next()) {
                        hits.add(new VectorHit(columns.read(rs),
                                               entityType,
                                               rs.getString("entity_id"),
                                               VectorUtils.cosineSimilarity(fromBytes(rs.getBytes("vector")),
                                                                            vector)));
                    }
                    return hits;
                }
            }
        });
        return candidates.stream()
                .sorted(Comparator.comparingDouble(VectorHit::getScore).reversed()
                                .thenComparing(VectorHit::getEntityId))
                .limit(k)
                .toList();
    }

    @Override
    public int deleteScope(Scope scope) {
        final var condition = columns().exact(scope);
        final int removed = database.inTransaction(connection -> {
            try (var statement = database.prepare(connection,
                                                   "DELETE FROM %s WHERE %s".formatted(TABLE, condition.sql()))) {
                condition.bind(statement, 1);
                return statement.executeUpdate();
            }
        });
        log.info("Removed {} vectors of scope {}", removed, scope);
        return removed;
    }

    private ScopeColumns columns() {
        final var columns = scopeColumns;
        if (columns == null) {
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "vector index has not been provisioned");
        }
        return columns;
    }

    private static byte[] toBytes(float[] vector) {
        final var buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    private static float[] fromBytes(byte[] bytes) {
        final var buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
        final var vector = new float[buffer.remaining()];
        buffer.get(vector);
        return vector;
    }
}
