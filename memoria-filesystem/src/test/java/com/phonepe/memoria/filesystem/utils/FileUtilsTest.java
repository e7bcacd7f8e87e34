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

package com.phonepe.memoria.filesystem.utils;

import com.phonepe.memoria.core.scope.Scope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testEnsurePathCreate() {
        final Path path = tempDir.resolve("new-dir");
        final Path ensured = FileUtils.ensurePath(path.toString(), true, true);
        assertTrue(Files.isDirectory(ensured));
        assertEquals(ensured, FileUtils.ensurePath(path.toString(), false, true));
    }

    @Test
    void testEnsurePathRejectsFilesAndMissingPaths() throws Exception {
        final Path file = tempDir.resolve("a-file");
        Files.writeString(file, "content");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(file.toString(), true, true));
        final Path missing = tempDir.resolve("not-exists");
        assertThrows(IllegalArgumentException.class, () -> FileUtils.ensurePath(missing.toString(), false, true));
    }

    @Test
    void testWriteAtomicallyReplacesContent() throws Exception {
        final Path path = tempDir.resolve("test-file");
        FileUtils.writeAtomically(path, "hello".getBytes());
        FileUtils.writeAtomically(path, "world".getBytes());
        assertEquals("world", Files.readString(path));
        assertFalse(Files.exists(tempDir.resolve("test-file.tmp")));
    }

    @Test
    void testDeleteRecursively() throws Exception {
        final var root = FileUtils.ensurePath(tempDir.resolve("tree/a/b").toString(), true, true);
        Files.writeString(root.resolve("leaf.json"), "{}");
        FileUtils.deleteRecursively(tempDir.resolve("tree"));
        assertFalse(Files.exists(tempDir.resolve("tree")));
        assertFalse(FileUtils.delete(tempDir.resolve("tree")));
    }

    @Test
    void testScopeFileNameIsStableAndSafe() {
        final var name = FileUtils.scopeFileName(Scope.of("project", "../p1", "agent", "a/1"));
        assertEquals(name, FileUtils.scopeFileName(Scope.of("project", "../p1", "agent", "a/1")));
        assertNotEquals(name, FileUtils.scopeFileName(Scope.of("project", "p1", "agent", "a1")));
        assertTrue(name.matches("[0-9a-f]{32}\\.json"));
    }
}
