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

package com.phonepe.memoria.core.policy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of evaluating a retrieve selector: whether it spans scopes, whether vector search may be used and the
 * caps that apply
 */
@Value
@Builder
@Jacksonized
public class PolicyDecision {
    public static final int UNCAPPED = Integer.MAX_VALUE;

    boolean crossScope;
    /**
     * Concrete scope combinations of the non wildcard fields
     */
    long scopeCombinations;
    boolean vectorSearchAllowed;
    /**
     * Why vector search was switched off, null if it was not
     */
    String vectorDisabledReason;
    /**
     * Item recall must go through the routed categories only
     */
    boolean categoryOnly;
    /**
     * {@link #UNCAPPED} for single scope requests
     */
    int candidateCap;
    int rerankCap;

    @JsonIgnore
    public boolean isCapped() {
        return candidateCap != UNCAPPED;
    }
}
