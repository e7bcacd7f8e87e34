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

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.scope.Scope;
import com.phonepe.memoria.core.scope.ScopeField;
import com.phonepe.memoria.core.scope.ScopeFieldType;
import com.phonepe.memoria.core.scope.ScopeSchema;
import com.phonepe.memoria.core.scope.ScopeSelector;
import com.phonepe.memoria.core.store.InMemoryMetadataStore;
import com.phonepe.memoria.core.store.MetadataStore;
import com.phonepe.memoria.core.vector.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class TenancyManagerTest {
    private static final ScopeSchema SCHEMA = ScopeSchema.of(ScopeField.string("project"),
                                                             ScopeField.of("user_id", ScopeFieldType.LONG));

    private InMemoryMetadataStore store;
    private TenancyManager tenancy;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
        tenancy = new TenancyManager(store, null, 0, Clock.systemUTC());
    }

    @Test
    void testProvisionIsIdempotent() {
        final var first = tenancy.provision(SCHEMA);
        final var second = new TenancyManager(store, null, 0, Clock.systemUTC()).provision(SCHEMA);
        assertEquals(first.getSchemaFingerprint(), second.getSchemaFingerprint());
        assertEquals(first.getProvisionedAt(), second.getProvisionedAt());
        assertEquals(1, second.getTaxonomyVersion());
    }

    @Test
    void testDifferentSchemaIsRefused() {
        tenancy.provision(SCHEMA);
        final var other = new TenancyManager(store, null, 0, Clock.systemUTC());
        final var error = assertThrows(MemoriaException.class,
                                       () -> other.provision(ScopeSchema.parse("project:string, agent:string")));
        assertEquals(ErrorType.SCOPE_SCHEMA_MISMATCH, error.getErrorType());
        final var reordered = ScopeSchema.of(ScopeField.of("user_id", ScopeFieldType.LONG),
                                             ScopeField.string("project"));
        assertThrows(MemoriaException.class, () -> other.provision(reordered));
    }

    @Test
    void testVectorIndexIsProvisionedWithTheSchema() {
        final var metadataStore = mock(MetadataStore.class);
        final var index = mock(VectorIndex.class);
        new TenancyManager(metadataStore, index, 384, Clock.systemUTC()).provision(SCHEMA);
        verify(metadataStore).provision(SCHEMA);
        verify(index).provision(SCHEMA, 384);
        verify(metadataStore).saveServiceMetadata(any());
    }

    @Test
    void testScopesAreValidatedAndOrdered() {
        tenancy.provision(SCHEMA);
        final var validated = tenancy.validate(Scope.of("user_id", "42", "project", "p1"));
        assertEquals(List.of("project", "user_id"), List.copyOf(validated.fieldNames()));
        assertEquals("project=p1|user_id=42", validated.key());

        assertMismatch(() -> tenancy.validate(Scope.of("project", "p1")));
        assertMismatch(() -> tenancy.validate(Scope.of("project", "p1", "user_id", "42", "agent", "a1")));
        assertMismatch(() -> tenancy.validate(Scope.of("project", "p1", "user_id", "forty two")));
        assertMismatch(() -> tenancy.validate((Scope) null));
    }

    @Test
    void testSelectorsAreValidated() {
        tenancy.provision(SCHEMA);
        final var selector = tenancy.validate(ScopeSelector.builder()
                                                      .anyOf("user_id", "1", "2")
                                                      .wildcard("project")
                                                      .build());
        assertEquals(List.of("project", "user_id"), List.copyOf(selector.fieldNames()));
        assertMismatch(() -> tenancy.validate(ScopeSelector.builder().anyOf("user_id", "1", "x")
                                                      .exact("project", "p1")
                                                      .build()));
        assertMismatch(() -> tenancy.validate(ScopeSelector.builder().exact("project", "p1").build()));
    }

    @Test
    void testNothingIsAcceptedBeforeProvisioning() {
        assertMismatch(() -> tenancy.validate(Scope.of("project", "p1", "user_id", "1")));
    }

    @Test
    void testTaxonomyAndPipelineVersionsArePersisted() {
        tenancy.provision(SCHEMA);
        tenancy.bumpTaxonomyVersion();
        tenancy.recordPipelineRevision("retrieve", "abc");
        final var stored = store.serviceMetadata().orElseThrow();
        assertEquals(2, stored.getTaxonomyVersion());
        assertEquals("abc", stored.getPipelineRevisions().get("retrieve"));
    }

    private static void assertMismatch(Runnable call) {
        final var error = assertThrows(MemoriaException.class, call::run);
        assertEquals(ErrorType.SCOPE_SCHEMA_MISMATCH, error.getErrorType());
    }
}
