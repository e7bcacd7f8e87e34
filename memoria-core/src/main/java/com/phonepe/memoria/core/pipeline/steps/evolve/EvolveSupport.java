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

import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.pipeline.steps.ItemPlan;
import lombok.experimental.UtilityClass;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * View of the scope as it will be once an evolve plan is committed
 */
@UtilityClass
public class EvolveSupport {

    /**
     * Live items after the plan: the snapshot minus superseded rows, with in place updates and new versions applied
     */
    public static Map<String, MemoryItem> liveAfter(EvolveTargets targets, ItemPlan plan) {
        final var live = new LinkedHashMap<String, MemoryItem>();
        targets.getLiveItems().forEach(item -> live.put(item.getId(), item));
        plan.getUpdated().forEach(row -> {
            if (row.isLive()) {
                live.put(row.getId(), row);
            }
            else {
                live.remove(row.getId());
            }
        });
        plan.getCreated().forEach(candidate -> live.put(candidate.getItem().getId(), candidate.getItem()));
        return live;
    }

    /**
     * Follows successor links to the id of the row that is live at the end of the chain
     */
    public static String resolve(Map<String, String> successors, String id) {
        final var seen = new HashSet<String>();
        var current = id;
        while (successors.containsKey(current) && seen.add(current)) {
            current = successors.get(current);
        }
        return current;
    }
}
