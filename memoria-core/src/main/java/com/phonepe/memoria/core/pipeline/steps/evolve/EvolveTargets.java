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

package com.phonepe.memoria.core.pipeline.steps.evolve;

import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Snapshot of a scope taken at the start of an evolve run, plus what needs work
 */
@Value
@Builder
@Jacksonized
public class EvolveTargets {
    /**
     * Items to refresh
     */
    @Singular
    List<MemoryItem> staleItems;
    @Singular
    List<MemoryItem> liveItems;
    @Singular
    List<MemoryCategory> categories;
    @Singular
    List<CategoryItem> links;
    /**
     * Categories whose summary is older than their last change
     */
    @Singular
    List<String> staleCategoryIds;
    @Singular
    List<String> unlinkedItemIds;
    Intention intention;
}
