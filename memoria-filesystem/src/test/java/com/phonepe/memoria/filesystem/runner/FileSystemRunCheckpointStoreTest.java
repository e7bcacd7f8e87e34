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

package com.phonepe.memoria.filesystem.runner;

import com.fasterxml.jackson.databind.node.IntNode;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpoint;
import com.phonepe.memoria.core.runlog.StepRecord;
import com.phonepe.memoria.core.runlog.StepStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemRunCheckpointStoreTest {
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path baseDir;

    @Test
    void testCheckpointsSurviveRestart() {
        final var store = store();
        store.save(checkpoint("late", NOW.plusSeconds(10)));
        store.save(checkpoint("early", NOW));

        final var reopened = store();
        assertEquals(List.of("early", "late"), reopened.incomplete().stream().map(RunCheckpoint::getRunId).toList());
        final var early = reopened.get("early").orElseThrow();
        assertEquals(Scope.of("project", "p1"), early.getScope());
        assertEquals(5, early.getState().get("seed").intValue());
        assertEquals(StepStatus.COMPLETED, early.getSteps().get(0).getStatus());

        reopened.delete("early");
        assertTrue(reopened.get("early").isEmpty());
        assertEquals(1, reopened.incomplete().size());
    }

    @Test
    void testUnreadableCheckpointIsSkipped() throws Exception {
        final var store = store();
        store.save(checkpoint("good", NOW));
        Files.writeString(baseDir.resolve("broken.checkpoint.json"), "{ not json");
        assertEquals(List.of("good"), store.incomplete().stream().map(RunCheckpoint::getRunId).toList());
    }

    private FileSystemRunCheckpointStore store() {
        return FileSystemRunCheckpointStore.builder()
                .baseDir(baseDir.toString())
                .mapper(JsonUtils.createMapper())
                .build();
    }

    private static RunCheckpoint checkpoint(String runId, Instant startedAt) {
        return RunCheckpoint.builder()
                .runId(runId)
                .operation(OperationType.MEMORIZE)
                .pipeline("memorize")
                .revision(1)
                .revisionToken("token")
                .scope(Scope.of("project", "p1"))
                .steps(List.of(StepRecord.builder().stepId("ingest_resource").status(StepStatus.COMPLETED).build()))
                .state(Map.of("seed", IntNode.valueOf(5)))
                .startedAt(startedAt)
                .updatedAt(startedAt)
                .build();
    }
}
