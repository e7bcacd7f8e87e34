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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.model.CategoryItem;
import com.phonepe.memoria.core.model.EvidencePointer;
import com.phonepe.memoria.core.model.Intention;
import com.phonepe.memoria.core.model.MemoryCategory;
import com.phonepe.memoria.core.model.MemoryItem;
import com.phonepe.memoria.core.model.MemoryType;
import com.phonepe.memoria.core.model.Modality;
import com.phonepe.memoria.core.model.OperationType;
import com.phonepe.memoria.core.model.Resource;
import com.phonepe.memoria.core.runlog.RunLog;
import com.phonepe.memoria.core.runlog.RunStatus;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.ItemFilter;
import com.phonepe.memoria.core.store.ResourceFilter;
import com.phonepe.memoria.core.store.WriteBatch;
import com.phonepe.memoria.core.tenancy.ServiceMetadata;
import com.phonepe.memoria.core.utils.JsonUtils;
import com.phonepe.memoria.core.utils.TextUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemMetadataStoreTest {
    private static final Scope P1 = Scope.of("project", "p1", "agent", "a1");
    private static final Scope P2 = Scope.of("project", "p2", "agent", "a1");
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final ObjectMapper mapper = JsonUtils.createMapper();

    @TempDir
    Path baseDir;

    @Test
    void testCommittedDataSurvivesRestart() {
        store().commit(WriteBatch.builder()
                               .resource(resource(P1, "r1"))
                               .item(item(P1, "i1", "r1", "My favorite color is blue"))
                               .category(category(P1, "c1", "preferences"))
                               .link(CategoryItem.link(P1, "c1", "i1", NOW))
                               .intention(Intention.builder().scope(P1).goals(List.of("learn")).version(1).build())
                               .build());

        final var reopened = store();
        assertEquals(TextUtils.sha256("r1"), reopened.getResource(P1, "r1").orElseThrow().getContentHash());
        assertEquals("My favorite color is blue", reopened.getItem(P1, "i1").orElseThrow().getContent());
        assertEquals("c1", reopened.findCategoryByName(P1, "PREFERENCES").orElseThrow().getId());
        assertEquals(1, reopened.listLinks(P1, "c1", null).size());
        assertEquals(List.of("learn"), reopened.getIntention(P1).orElseThrow().getGoals());
        assertTrue(reopened.getItem(P2, "i1").isEmpty());
    }

    @Test
    void testRejectedBatchLeavesNothingOnDisk() {
        final var store = store();
        final var crossScope = WriteBatch.builder()
                .resource(resource(P1, "r1"))
                .item(item(P1, "i1", "r1", "My favorite color is blue"))
                .category(category(P2, "c1", "preferences"))
                .link(CategoryItem.link(P2, "c1", "i1", NOW))
                .build();
        assertEquals(ErrorType.INVALID_INPUT,
                     assertThrows(MemoriaException.class, () -> store.commit(crossScope)).getErrorType());
        assertTrue(store.listItems(ScopeSelector.exact(P1), ItemFilter.ALL).isEmpty());
        assertTrue(store().listResources(ScopeSelector.exact(P1), ResourceFilter.LIVE).isEmpty());
    }

    @Test
    void testBatchSpanningScopesIsPersistedForEach() {
        store().commit(WriteBatch.builder()
                               .resource(resource(P1, "r1"))
                               .resource(resource(P2, "r2"))
                               .build());
        final var reopened = store();
        final var selector = ScopeSelector.builder().anyOf("project", "p1", "p2").exact("agent", "a1").build();
        assertEquals(2, reopened.listResources(selector, ResourceFilter.LIVE).size());
        assertFalse(Files.exists(baseDir.resolve("journal.json")));
    }

    @Test
    void testPendingJournalIsReplayedOnStart() throws Exception {
        final var snapshot = ScopeSnapshot.builder()
                .scope(P2)
                .resources(List.of(resource(P2, "r9")))
                .items(List.of())
                .categories(List.of())
                .links(List.of())
                .build();
        Files.write(baseDir.resolve("journal.json"), mapper.writeValueAsBytes(List.of(snapshot)));
        final var store = store();
        assertTrue(store.getResource(P2, "r9").isPresent());
        assertFalse(Files.exists(baseDir.resolve("journal.json")));
    }

    @Test
    void testPurgeRemovesScopeFile() {
        final var store = store();
        store.commit(WriteBatch.builder()
                             .resource(resource(P1, "r1"))
                             .item(item(P1, "i1", "r1", "My favorite color is blue"))
                             .build());
        store.putResource(resource(P2, "r2"));
        assertEquals(2, store.purge(P1));
        assertEquals(0, store.purge(P1));
        final var reopened = store();
        assertTrue(reopened.getResource(P1, "r1").isEmpty());
        assertTrue(reopened.getResource(P2, "r2").isPresent());
    }

    @Test
    void testServiceMetadataAndRunLogs() {
        final var store = store();
        assertTrue(store.serviceMetadata().isEmpty());
        final var schema = ScopeSchema.parse("project:string, agent:string");
        store.saveServiceMetadata(ServiceMetadata.builder()
                                          .schema(schema)
                                          .schemaFingerprint(schema.fingerprint())
                                          .schemaVersion(1)
                                          .pipelineRevision("memorize", "abc")
                                          .provisionedAt(NOW)
                                          .build());
        store.save(runLog("run-1", NOW));
        store.save(runLog("run-2", NOW.plusSeconds(5)));
        store.save(runLog("run-1", NOW).withStatus(RunStatus.SUCCEEDED));

        final var reopened = store();
        final var metadata = reopened.serviceMetadata().orElseThrow();
        assertEquals(schema.fingerprint(), metadata.getSchemaFingerprint());
        assertEquals("abc", metadata.getPipelineRevisions().get("memorize"));
        assertEquals(RunStatus.SUCCEEDED, reopened.get("run-1").orElseThrow().getStatus());
        assertEquals(List.of("run-2", "run-1"), reopened.recent(10).stream().map(RunLog::getRunId).toList());
        assertEquals(1, reopened.recent(1).size());
    }

    private FileSystemMetadataStore store() {
        return FileSystemMetadataStore.builder().baseDir(baseDir.toString()).mapper(mapper).build();
    }

    private static RunLog runLog(String runId, Instant startedAt) {
        return RunLog.builder()
                .runId(runId)
                .operation(OperationType.MEMORIZE)
                .pipeline("memorize")
                .revision(1)
                .scope(P1.key())
                .status(RunStatus.RUNNING)
                .steps(List.of())
                .startedAt(startedAt)
                .build();
    }

    private static Resource resource(Scope scope, String id) {
        return Resource.builder()
                .id(id)
                .scope(scope)
                .modality(Modality.CONVERSATION)
                .content("My favorite color is blue")
                .contentHash(TextUtils.sha256(id))
                .segments(List.of())
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static MemoryItem item(Scope scope, String id, String resourceId, String content) {
        return MemoryItem.builder()
                .id(id)
                .lineageId(id)
                .scope(scope)
                .resourceId(resourceId)
                .memoryType(MemoryType.PROFILE)
                .key("FavoriteColor")
                .content(content)
                .contentHash(TextUtils.itemContentHash(MemoryType.PROFILE, content))
                .evidence(EvidencePointer.builder().resourceId(resourceId).length(content.length()).build())
                .confidence(0.9)
                .stable(true)
                .version(1)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static MemoryCategory category(Scope scope, String id, String name) {
        return MemoryCategory.builder()
                .id(id)
                .scope(scope)
                .name(name)
                .summary("")
                .anchorItemIds(List.of())
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
