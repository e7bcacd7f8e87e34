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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpoint;
import com.phonepe.memoria.core.pipeline.runner.RunCheckpointStore;
import com.phonepe.memoria.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps one JSON file per unfinished run, so a durable runner can pick runs up after a restart
 */
@Slf4j
public class FileSystemRunCheckpointStore implements RunCheckpointStore {
    private static final String SUFFIX = ".checkpoint.json";

    private final Path checkpointRoot;
    private final ObjectMapper mapper;

    @Builder
    public FileSystemRunCheckpointStore(@NonNull String baseDir, @NonNull ObjectMapper mapper) {
        this.checkpointRoot = FileUtils.ensurePath(baseDir, true, true);
        this.mapper = mapper;
    }

    @Override
    public void save(RunCheckpoint checkpoint) {
        try {
            FileUtils.writeAtomically(file(checkpoint.getRunId()), mapper.writeValueAsBytes(checkpoint));
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    @Override
    public Optional<RunCheckpoint> get(String runId) {
        final var file = file(runId);
        return Files.exists(file) ? Optional.ofNullable(read(file)) : Optional.empty();
    }

    @Override
    public List<RunCheckpoint> incomplete() {
        try (var files = Files.list(checkpointRoot)) {
            return files.filter(file -> file.getFileName().toString().endsWith(SUFFIX))
                    .map(this::read)
                    .filter(Objects::nonNull)
                    .sorted(Comparator.comparing(RunCheckpoint::getStartedAt,
                                                 Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                    .toList();
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.STORE_FAILURE, e);
        }
    }

    @Override
    public void delete(String runId) {
        FileUtils.delete(file(runId));
    }

    private Path file(String runId) {
        return checkpointRoot.resolve(runId + SUFFIX);
    }

    private RunCheckpoint read(Path file) {
        try {
            return mapper.readValue(file.toFile(), RunCheckpoint.class);
        }
        catch (IOException e) {
            log.warn("Skipping unreadable checkpoint {}: {}", file, e.getMessage());
            return null;
        }
    }
}
