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

package com.phonepe.memoria.filesystem.store;

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.store.WriteBatch;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Objects;

/**
 * On disk form of everything stored for one scope
 */
@Value
@Builder
@Jacksonized
public class ScopeSnapshot {
    Scope scope;
    List<Resource> resources;
    List<MemoryItem> items;
    List<MemoryCategory> categories;
    List<CategoryItem> links;
    Intention intention;

    public boolean isEmpty() {
        return resources.isEmpty() && items.isEmpty() && categories.isEmpty() && links.isEmpty()
                && intention == null;
    }

    /**
     * Batch that recreates the snapshot in an empty store
     */
    public WriteBatch toBatch() {
        final var batch = WriteBatch.builder()
                .resources(Objects.requireNonNullElse(resources, List.of()))
                .items(Objects.requireNonNullElse(items, List.of()))
                .categories(Objects.requireNonNullElse(categories, List.of()))
                .links(Objects.requireNonNullElse(links, List.of()));
        if (intention != null) {
            batch.intention(intention);
        }
        return batch.build();
    }
}
