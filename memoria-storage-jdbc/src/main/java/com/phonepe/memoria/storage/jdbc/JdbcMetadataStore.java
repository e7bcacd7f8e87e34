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
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.runlog.RunLog;
import com.phonepe.memoria.core.runlog.RunLogStore;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.BatchChecks;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.store.WriteBatch;
import com.phonepe.memoria.core.tenancy.ServiceMetadata;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Relational metadata store. Every entity table has one column per scope field; primary keys and secondary
 * indexes lead with them, so every read is an indexed, scope filtered scan. Entities are kept as JSON next to the
 * columns needed for lookups.
 */
@Slf4j
public class JdbcMetadataStore implements MetadataStore, RunLogStore {
    private static final String RESOURCES = "resources";
    private static final String ITEMS = "items";
    private static final String CATEGORIES = "categories";
    private static final String LINKS = "category_items";
    private static final String INTENTIONS = "intentions";
    private static final List<String> ENTITY_TABLES = List.of(LINKS, ITEMS, CATEGORIES, INTENTIONS, RESOURCES);

    private final JdbcDatabase database;
    private final ObjectMapper mapper;
    private volatile ScopeColumns scopeColumns;

    @Builder
    public JdbcMetadataStore(@NonNull JdbcDatabase database, @NonNull ObjectMapper mapper) {
        this.database = database;
        this.mapper = mapper;
        createServiceTables();
    }

    @Override
    public synchronized void provision(ScopeSchema schema) {
        final var columns = new ScopeColumns(schema);
        final var scope = columns.definitions();
        final var ddl = List.of(
                "CREATE TABLE IF NOT EXISTS %s (%s, id TEXT NOT NULL, live INTEGER NOT NULL, uri TEXT, content_hash TEXT, created_at INTEGER, body TEXT NOT NULL, PRIMARY KEY (%s))"
                        .formatted(RESOURCES, scope, columns.indexed("id")),
                "CREATE INDEX IF NOT EXISTS idx_resources_hash ON %s (%s)"
                        .formatted(RESOURCES, columns.indexed("content_hash")),
                "CREATE INDEX IF NOT EXISTS idx_resources_uri ON %s (%s)".formatted(RESOURCES, columns.indexed("uri")),
                "CREATE TABLE IF NOT EXISTS %s (%s, id TEXT NOT NULL, live INTEGER NOT NULL, resource_id TEXT NOT NULL, item_key TEXT, content_hash TEXT, created_at INTEGER, body TEXT NOT NULL, PRIMARY KEY (%s))"
                        .formatted(ITEMS, scope, columns.indexed("id")),
                "CREATE INDEX IF NOT EXISTS idx_items_hash ON %s (%s)".formatted(ITEMS, columns.indexed("content_hash")),
                "CREATE INDEX IF NOT EXISTS idx_items_key ON %s (%s)".formatted(ITEMS, columns.indexed("item_key")),
                "CREATE INDEX IF NOT EXISTS idx_items_resource ON %s (%s)"
                        .formatted(ITEMS, columns.indexed("resource_id")),
                "CREATE TABLE IF NOT EXISTS %s (%s, id TEXT NOT NULL, name_key TEXT NOT NULL, body TEXT NOT NULL, PRIMARY KEY (%s))"
                        .formatted(CATEGORIES, scope, columns.indexed("id")),
                "CREATE INDEX IF NOT EXISTS idx_categories_name ON %s (%s)"
                        .formatted(CATEGORIES, columns.indexed("name_key")),
                "CREATE TABLE IF NOT EXISTS %s (%s, id TEXT NOT NULL, category_id TEXT NOT NULL, item_id TEXT NOT NULL, body TEXT NOT NULL, PRIMARY KEY (%s))"
                        .formatted(LINKS, scope, columns.indexed("id")),
                "CREATE INDEX IF NOT EXISTS idx_links_category ON %s (%s)"
                        .formatted(LINKS, columns.indexed("category_id")),
                "CREATE INDEX IF NOT EXISTS idx_links_item ON %s (%s)".formatted(LINKS, columns.indexed("item_id")),
                "CREATE TABLE IF NOT EXISTS %s (%s, body TEXT NOT NULL, PRIMARY KEY (%s))"
                        .formatted(INTENTIONS, scope, columns.columnList()));
        database.inTransaction(connection -> {
            for (var sql : ddl) {
                try (var statement = database.prepare(connection, sql)) {
                    statement.execute();
                }
            }
            return null;
        });
        this.scopeColumns = columns;
        log.info("Provisioned metadata tables for scope fields {}", schema.fieldNames());
    }

    @Override
    public Optional<ServiceMetadata> serviceMetadata() {
        return database.read(connection -> {
            try (var statement = database.prepare(connection, "SELECT body FROM service_metadata WHERE id = 1");
                 var rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(fromJson(rs.getString(1), ServiceMetadata.class)) : Optional.empty();
            }
        });
    }

    @Override
    public void saveServiceMetadata(ServiceMetadata metadata) {
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    INSERT INTO service_metadata (id, body) VALUES (1, ?)
                    ON CONFLICT (id) DO UPDATE SET body = excluded.body
                    """)) {
                statement.setString(1, toJson(metadata));
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public Optional<Resource> getResource(Scope scope, String id) {
        return getById(RESOURCES, scope, id, Resource.class);
    }

    @Override
    public List<Resource> listResources(ScopeSelector selector, ResourceFilter filter) {
        final var extra = new LinkedHashMap<String, Object>();
        if (!filter.isIncludeSuperseded()) {
            extra.put("live", 1);
        }
        if (filter.getUri() != null) {
            extra.put("uri", filter.getUri());
        }
        if (filter.getContentHash() != null) {
            extra.put("content_hash", filter.getContentHash());
        }
        return list(RESOURCES, selector, extra, "created_at, id", Resource.class, filter::test);
    }

    @Override
    public Optional<MemoryItem> getItem(Scope scope, String id) {
        return getById(ITEMS, scope, id, MemoryItem.class);
    }

    @Override
    public List<MemoryItem> listItems(ScopeSelector selector, ItemFilter filter) {
        final var extra = new LinkedHashMap<String, Object>();
        if (!filter.isIncludeSuperseded()) {
            extra.put("live", 1);
        }
        if (filter.getResourceId() != null) {
            extra.put("resource_id", filter.getResourceId());
        }
        if (filter.getKey() != null) {
            extra.put("item_key", filter.getKey());
        }
        if (filter.getContentHash() != null) {
            extra.put("content_hash", filter.getContentHash());
        }
        return list(ITEMS, selector, extra, "created_at, id", MemoryItem.class, filter::test);
    }

    @Override
    public Optional<MemoryCategory> getCategory(Scope scope, String id) {
        return getById(CATEGORIES, scope, id, MemoryCategory.class);
    }

    @Override
    public Optional<MemoryCategory> findCategoryByName(Scope scope, String name) {
        return list(CATEGORIES, ScopeSelector.exact(scope), Map.of("name_key", nameKey(name)), "id",
                    MemoryCategory.class, category -> true)
                .stream()
                .findFirst();
    }

    @Override
    public List<MemoryCategory> listCategories(ScopeSelector selector) {
        return list(CATEGORIES, selector, Map.of(), "name_key, id", MemoryCategory.class, category -> true);
    }

    @Override
    public List<CategoryItem> listLinks(Scope scope, String categoryId, String itemId) {
        final var extra = new LinkedHashMap<String, Object>();
        if (categoryId != null) {
            extra.put("category_id", categoryId);
        }
        if (itemId != null) {
            extra.put("item_id", itemId);
        }
        return list(LINKS, ScopeSelector.exact(scope), extra, "id", CategoryItem.class, link -> true);
    }

    @Override
    public Optional<Intention> getIntention(Scope scope) {
        return listIntentions(ScopeSelector.exact(scope)).stream().findFirst();
    }

    @Override
    public List<Intention> listIntentions(ScopeSelector selector) {
        return list(INTENTIONS, selector, Map.of(), columns().columnList(), Intention.class, intention -> true);
    }

    @Override
    public void commit(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        final var columns = columns();
        database.inTransaction(connection -> {
            BatchChecks.validate(batch,
                                 (scope, id) -> exists(connection, RESOURCES, scope, id),
                                 (scope, id) -> exists(connection, ITEMS, scope, id),
                                 (scope, id) -> exists(connection, CATEGORIES, scope, id));
            for (var link : batch.getDeletedLinks()) {
                deleteById(connection, LINKS, link.getScope(), link.getId());
            }
            for (var category : batch.getDeletedCategories()) {
                deleteById(connection, CATEGORIES, category.getScope(), category.getId());
            }
            for (var resource : batch.getResources()) {
                upsert(connection, columns, RESOURCES, resource.getScope(), row(
                        "id", resource.getId(),
                        "live", resource.isLive() ? 1 : 0,
                        "uri", resource.getUri(),
                        "content_hash", resource.getContentHash(),
                        "created_at", millis(resource.getCreatedAt()),
                        "body", toJson(resource)));
            }
            for (var item : batch.getItems()) {
                upsert(connection, columns, ITEMS, item.getScope(), row(
                        "id", item.getId(),
                        "live", item.isLive() ? 1 : 0,
                        "resource_id", item.getResourceId(),
                        "item_key", item.getKey(),
                        "content_hash", item.getContentHash(),
                        "created_at", millis(item.getCreatedAt()),
                        "body", toJson(item)));
            }
            for (var category : batch.getCategories()) {
                upsert(connection, columns, CATEGORIES, category.getScope(), row(
                        "id", category.getId(),
                        "name_key", nameKey(category.getName()),
                        "body", toJson(category)));
            }
            for (var link : batch.getLinks()) {
                upsert(connection, columns, LINKS, link.getScope(), row(
                        "id", link.getId(),
                        "category_id", link.getCategoryId(),
                        "item_id", link.getItemId(),
                        "body", toJson(link)));
            }
            for (var intention : batch.getIntentions()) {
                upsert(connection, columns, INTENTIONS, intention.getScope(), row("body", toJson(intention)));
            }
            return null;
        });
        log.debug("Committed batch of {} writes for scopes {}", batch.size(), batch.scopes());
    }

    @Override
    public int purge(Scope scope) {
        final var condition = columns().exact(scope);
        final int removed = database.inTransaction(connection -> {
            var count = 0;
            for (var table : ENTITY_TABLES) {
                try (var statement = database.prepare(connection,
                                                       "DELETE FROM %s WHERE %s".formatted(table,
                                                                                           condition.sql()))) {
                    condition.bind(statement, 1);
                    count += statement.executeUpdate();
                }
            }
            return count;
        });
        log.info("Purged {} rows of scope {}", removed, scope);
        return removed;
    }

    @Override
    public void save(RunLog runLog) {
        database.inTransaction(connection -> {
            try (var statement = database.prepare(connection, """
                    INSERT INTO run_logs (run_id, started_at, body) VALUES (?, ?, ?)
                    ON CONFLICT (run_id) DO UPDATE SET started_at = excluded.started_at, body = excluded.body
                    """)) {
                statement.setString(1, runLog.getRunId());
                statement.setObject(2, millis(runLog.getStartedAt()));
                statement.setString(3, toJson(runLog));
                return statement.executeUpdate();
            }
        });
    }

    @Override
    public Optional<RunLog> get(String runId) {
        return database.read(connection -> {
            try (var statement = database.prepare(connection, "SELECT body FROM run_logs WHERE run_id = ?")) {
                statement.setString(1, runId);
                try (var rs = statement.executeQuery()) {
                    return rs.next() ? Optional.of(fromJson(rs.getString(1), RunLog.class)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<RunLog> recent(int count) {
        return database.read(connection -> {
            try (var statement = database.prepare(connection,
                                                   "SELECT body FROM run_logs ORDER BY started_at DESC LIMIT ?")) {
                statement.setInt(1, count);
                try (var rs = statement.executeQuery()) {
                    final var logs = new ArrayList<RunLog>();
                    while (rs.next()) {
                        logs.add(fromJson(rs.getString(1), RunLog.class));
                    }
                    return logs;
                }
            }
        });
    }

    private void createServiceTables() {
        database.inTransaction(connection -> {
            for (var sql : List.of(
                    "CREATE TABLE IF NOT EXISTS service_metadata (id INTEGER PRIMARY KEY, body TEXT NOT NULL)",
                    "CREATE TABLE IF NOT EXISTS run_logs (run_id TEXT PRIMARY KEY, started_at INTEGER, body TEXT NOT NULL)",
                    "CREATE INDEX IF NOT EXISTS idx_run_logs_started ON run_logs (started_at)")) {
                try (var statement = database.prepare(connection, sql)) {
                    statement.execute();
                }
            }
            return null;
        });
    }

    private <T> Optional<T> getById(String table, Scope scope, String id, Class<T> type) {
        return list(table, ScopeSelector.exact(scope), Map.of("id", id), "id", type, entity -> true)
                .stream()
                .findFirst();
    }

    private <T> List<T> list(
            String table,
            ScopeSelector selector,
            Map<String, Object> extra,
            String orderBy,
            Class<T> type,
            Predicate<T> filter) {
        final var condition = columns().where(selector);
        final var where = new StringBuilder(condition.sql());
        extra.keySet().forEach(column -> where.append(" AND ").append(column).append(" = ?"));
        final var sql = "SELECT body FROM %s WHERE %s ORDER BY %s".formatted(table, where, orderBy);
        return database.read(connection -> {
            try (var statement = database.prepare(connection, sql)) {
                var index = condition.bind(statement, 1);
                for (var value : extra.values()) {
                    statement.setObject(index++, value);
                }
                try (var rs = statement.executeQuery()) {
                    final var rows = new ArrayList<T>();
                    while (rs.next()) {
                        final var entity = fromJson(rs.getString(1), type);
                        if (filter.test(entity)) {
                            rows.add(entity);
                        }
                    }
                    return rows;
                }
            }
        });
    }

    private boolean exists(Connection connection, String table, Scope scope, String id) {
        final var condition = columns().exact(scope);
        try (var statement = database.prepare(connection,
                                               "SELECT 1 FROM %s WHERE %s AND id = ?".formatted(table,
                                                                                               condition.sql()))) {
            statement.setString(condition.bind(statement, 1), id);
            try (var rs = statement.executeQuery()) {
                return rs.next();
            }
        }
        catch (SQLException e) {
            throw JdbcDatabase.translate(e);
        }
    }

    private void deleteById(Connection connection, String table, Scope scope, String id) throws SQLException {
        final var condition = columns().exact(scope);
        try (var statement = database.prepare(connection,
                                               "DELETE FROM %s WHERE %s AND id = ?".formatted(table,
                                                                                             condition.sql()))) {
            statement.setString(condition.bind(statement, 1), id);
            statement.executeUpdate();
        }
    }

    private void upsert(
            Connection connection,
            ScopeColumns columns,
            String table,
            Scope scope,
            Map<String, Object> values) throws SQLException {
        final var keyColumns = values.containsKey("id") ? columns.indexed("id") : columns.columnList();
        final var updates = values.keySet()
                .stream()
                .filter(column -> !column.equals("id"))
                .map(column -> column + " = excluded." + column)
                .collect(Collectors.joining(", "));
        final var sql = "INSERT INTO %s (%s, %s) VALUES (%s, %s) ON CONFLICT (%s) DO UPDATE SET %s"
                .formatted(table,
                           columns.columnList(),
                           String.join(", ", values.keySet()),
                           columns.placeholders(),
                           values.keySet().stream().map(c -> "?").collect(Collectors.joining(", ")),
                           keyColumns,
                           updates);
        try (PreparedStatement statement = database.prepare(connection, sql)) {
            var index = columns.bind(statement, scope, 1);
            for (var value : values.values()) {
                statement.setObject(index++, value);
            }
            statement.executeUpdate();
        }
    }

    private ScopeColumns columns() {
        final var columns = scopeColumns;
        if (columns == null) {
            throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "metadata store has not been provisioned");
        }
        return columns;
    }

    private static Map<String, Object> row(Object... columnsAndValues) {
        final var row = new LinkedHashMap<String, Object>();
        for (int i = 0; i < columnsAndValues.length; i += 2) {
            row.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
        }
        return row;
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static String nameKey(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }
}
