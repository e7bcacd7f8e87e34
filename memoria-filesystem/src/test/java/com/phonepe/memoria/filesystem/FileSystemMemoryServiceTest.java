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

package com.phonepe.memoria.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.config.MemoriaConfig;
import com.phonepe.memoria.core.config.RunnerConfig;
import com.phonepe.memoria.core.config.RunnerMode;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.Scored;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.service.MemoryService;
import com.phonepe.memoria.core.service.ResourceInput;
import com.phonepe.memoria.core.utils.JsonUtils;
import com.phonepe.memoria.filesystem.runner.FileSystemRunCheckpointStore;
import com.phonepe.memoria.filesystem.store.FileSystemMetadataStore;
import com.phonepe.memoria.filesystem.vector.FileSystemVectorIndex;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemMemoryServiceTest {
    private static final ScopeSchema SCHEMA = ScopeSchema.parse("project:string, agent:string");
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");

    private final ObjectMapper mapper = JsonUtils.createMapper();

    @TempDir
    Path baseDir;

    @Test
    void testMemoriesAreRecalledAfterRestart() {
        final String itemId;
        final String runId;
        try (var service = service(SCHEMA)) {
            final var memorized = service.memorize(P1, ResourceInput.conversation("My favorite color is blue"));
            assertTrue(memorized.isSuccess(), () -> memorized.getError().getMessage());
            itemId = memorized.getData().getItems().get(0).getId();
            runId = memorized.getRunId();
        }
        try (var service = service(SCHEMA)) {
            final var recalled = service.retrieve(P1, "what color do they like");
            assertTrue(recalled.isSuccess(), () -> recalled.getError().getMessage());
            assertTrue(recalled.getData()
                               .getItems()
                               .stream()
                               .map(Scored::getValue)
                               .map(MemoryItem::getId)
                               .anyMatch(itemId::equals));
            assertTrue(service.runLog(runId).isPresent());
            assertFalse(service.listCategories(P1, true).getData().isEmpty());
        }
    }

    @Test
    void testSchemaStaysLockedAcrossRestarts() {
        try (var service = service(SCHEMA)) {
            assertEquals(SCHEMA.fingerprint(), service.metadata().getSchemaFingerprint());
        }
        final var error = assertThrows(MemoriaException.class,
                                       () -> service(ScopeSchema.parse("tenant:string")).close());
        assertEquals(ErrorType.SCOPE_SCHEMA_MISMATCH, error.getErrorType());
    }

    private MemoryService service(ScopeSchema schema) {
        return MemoryService.builder()
                .metadataStore(FileSystemMetadataStore.builder()
                                       .baseDir(baseDir.resolve("metadata").toString())
                                       .mapper(mapper)
                                       .build())
                .vectorIndex(FileSystemVectorIndex.builder()
                                     .baseDir(baseDir.resolve("vectors").toString())
                                     .mapper(mapper)
                                     .build())
                .checkpointStore(FileSystemRunCheckpointStore.builder()
                                         .baseDir(baseDir.resolve("checkpoints").toString())
                                         .mapper(mapper)
                                         .build())
                .schema(schema)
                .mapper(mapper)
                .config(MemoriaConfig.builder()
                                .runner(RunnerConfig.builder().mode(RunnerMode.DURABLE).build())
                                .build())
                .build();
    }
}
