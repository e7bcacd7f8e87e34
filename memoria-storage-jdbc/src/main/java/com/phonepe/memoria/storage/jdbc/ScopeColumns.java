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
import com.phonepe.memoria.core.scope.FieldSelector;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps the scope fields of a schema to table columns. Every table carries one column per field, in schema order,
 * as the leading part of its primary key and of every secondary index.
 */
public class ScopeColumns {
    private static final String PREFIX = "s_";

    private final List<String> fields;

    /**
     * A WHERE fragment with the values to bind, in order
     */
    public record Condition(String sql, List<String> params) {
        public int bind(PreparedStatement statement, int firstIndex) throws SQLException {
            var index = firstIndex;
            for (var param : params) {
                statement.setString(index++, param);
            }
            return index;
        }
    }

    public ScopeColumns(ScopeSchema schema) {
        this.fields = schema.fieldNames();
    }

    public List<String> columns() {
        return fields.stream().map(ScopeColumns::column).toList();
    }

    public String columnList() {
        return String.join(", ", columns());
    }

    public String definitions() {
        return fields.stream().map(field -> column(field) + " TEXT NOT NULL").collect(Collectors.joining(", "));
    }

    /**
     * Column list for an index led by the scope columns
     */
    public String indexed(String... trailing) {
        final var all = new ArrayList<>(columns());
        Collections.addAll(all, trailing);
        return String.join(", ", all);
    }

    public String placeholders() {
        return fields.stream().map(f -> "?").collect(Collectors.joining(", "));
    }

    public Condition exact(Scope scope) {
        return where(ScopeSelector.exact(scope));
    }

    public Condition where(ScopeSelector selector) {
        final var clauses = new ArrayList<String>();
        final var params = new ArrayList<String>();
        for (var name : selector.fieldNames()) {
            if (!fields.contains(name)) {
                throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "unknown scope field " + name);
            }
        }
        for (var field : fields) {
            final var selected = selector.field(field);
            if (selected == null) {
                throw MemoriaException.of(ErrorType.SCOPE_SCHEMA_MISMATCH, "missing scope field " + field);
            }
            switch (selected.getMode()) {
                case EXACT -> {
                    clauses.add(column(field) + " = ?");
                    params.add(selected.singleValue());
                }
                case ANY_OF -> {
                    clauses.add(column(field) + " IN (" + placeholders(selected) + ")");
                    params.addAll(selected.getValues());
                }
                case WILDCARD -> {
                    //No restriction
                }
            }
        }
        return new Condition(clauses.isEmpty() ? "1 = 1" : String.join(" AND ", clauses), params);
    }

    public int bind(PreparedStatement statement, Scope scope, int firstIndex) throws SQLException {
        var index = firstIndex;
        for (var field : fields) {
            statement.setString(index++, scope.get(field));
        }
        return index;
    }

    public Scope read(ResultSet resultSet) throws SQLException {
        final var values = new LinkedHashMap<String, String>();
        for (var field : fields) {
            values.put(field, resultSet.getString(column(field)));
        }
        return Scope.of(values);
    }

    private static String placeholders(FieldSelector selector) {
        return selector.getValues().stream().map(v -> "?").collect(Collectors.joining(", "));
    }

    private static String column(String field) {
        return PREFIX + field;
    }
}
