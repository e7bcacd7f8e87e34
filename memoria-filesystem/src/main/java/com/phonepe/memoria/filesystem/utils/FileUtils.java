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

import com.google.common.hash.Hashing;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.scope.Scope;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;

@UtilityClass
@Slf4j
public class FileUtils {

    /**
     * Ensures that the provided path exists and is a directory with the required permissions. If the path does not
     * exist and createIfNotExists is true, it will attempt to create the directory.
     *
     * @param path              The path to check or create.
     * @param createIfNotExists Whether to create the directory if it does not exist.
     * @param writeCheck        Whether to check for write permissions on the directory.
     * @return The absolute, normalized Path object representing the directory.
     * @throws IllegalArgumentException If the path is invalid, does not have the required permissions, or cannot be
     *                                  created when requested.
     */
    public static Path ensurePath(String path, boolean createIfNotExists, boolean writeCheck) {
        final var absolutePath = Path.of(path).toAbsolutePath().normalize();
        if (Files.exists(absolutePath)) {
            if (!Files.isDirectory(absolutePath)
                    || !Files.isReadable(absolutePath)
                    || (writeCheck && !Files.isWritable(absolutePath))) {
                throw new IllegalArgumentException(
                        "Sanity check for %s failed. Please check it exists and has the required permissions"
                                .formatted(absolutePath));
            }
        }
        else if (createIfNotExists) {
            try {
                Files.createDirectories(absolutePath);
            }
            catch (IOException e) {
                throw new IllegalArgumentException("Failed to create directory: " + absolutePath, e);
            }
        }
        else {
            throw new IllegalArgumentException("Provided path does not exist: " + absolutePath);
        }
        return absolutePath;
    }

    /**
     * Replaces the file content atomically: data goes to a sibling temporary file which is then moved over the
     * target. Readers see either the old or the new content, never a partial write.
     *
     * @param filePath Target file
     * @param data     New content
     * @throws MemoriaException with {@link ErrorType#STORE_FAILURE} if the file could not be written
     */
    public static void writeAtomically(Path filePath, byte[] data) {
        final var temp = filePath.resolveSibling(filePath.getFileName() + ".tmp");
        try {
            Files.write(temp, data);
            try {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", filePath);
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    public static boolean delete(Path filePath) {
        try {
            return Files.deleteIfExists(filePath);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    /**
     * Removes a directory tree, deepest entries first.
     */
    public static void deleteRecursively(Path root) {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (var children = Files.walk(root)) {
            children.sorted(Comparator.reverseOrder()).forEach(FileUtils::delete);
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    /**
     * File name safe, fixed length name for a scope. Scope values may contain anything, so they are hashed.
     */
    public static String scopeFileName(Scope scope) {
        return Hashing.sha256().hashString(scope.key(), StandardCharsets.UTF_8).toString().substring(0, 32)
                + ".json";
    }
}
