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

package com.phonepe.memoria.core.tenancy;

import com.phonepe.memoria.core.scope.ScopeSchema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Deployment wide metadata record. There is exactly one per deployment, never one per scope.
 */
@Value
@With
@Builder
@Jacksonized
public class ServiceMetadata {
    ScopeSchema schema;
    String schemaFingerprint;
    int schemaVersion;
    int taxonomyVersion;
    /**
     * Active revision token per pipeline name
     */
    @Singular
    Map<String, String> pipelineRevisions;
    Instant provisionedAt;
    Instant updatedAt;
}
