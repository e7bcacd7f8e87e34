package com.phonepe.memoria.core.config;

import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import com.phonepe.memoria.core.utils.JsonUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MemoriaConfigTest {

    @Test
    void testEmptyConfigUsesDefaults(@TempDir Path dir) throws IOException {
        final var file = Files.writeString(dir.resolve("memoria.json"), "{}");
        final var config = MemoriaConfig.load(file, JsonUtils.createMapper());
        assertEquals(MemoriaConfig.DEFAULT, config);
        assertEquals(64, config.getPolicy().getMaxScopeCombinations());
        assertEquals(RunnerMode.INLINE, config.getRunner().getMode());
        assertEquals(10, config.getTaxonomy().getCatalog().size());
    }

    @Test
    void testPartialSectionsKeepOtherDefaults(@TempDir Path dir) throws IOException {
        final var file = Files.writeString(dir.resolve("memoria.json"), """
                {
                  "policy": { "maxScopeCombinations": 8 },
                  "runner": { "mode": "durable", "stepTimeout": "PT5S" },
                  "retrieve": { "method": "LEXICAL", "itemTopK": 10 },
                  "unknownSection": {}
                }
                """);
        final var config = MemoriaConfig.load(file, JsonUtils.createMapper());
        assertEquals(8, config.getPolicy().getMaxScopeCombinations());
        assertEquals(16, config.getPolicy().getMaxVectorScopeCombinations());
        assertEquals(RunnerMode.DURABLE, config.getRunner().getMode());
        assertEquals(Duration.ofSeconds(5), config.getRunner().getStepTimeout());
        assertEquals(3, config.getRunner().getMaxAttempts());
        assertEquals(RecallMethod.LEXICAL, config.getRetrieve().getMethod());
        assertEquals(10, config.getRetrieve().getItemTopK());
        assertEquals(TaxonomyConfig.DEFAULT, config.getTaxonomy());
    }

    @Test
    void testUnreadableConfigIsInvalidInput(@TempDir Path dir) throws IOException {
        final var mapper = JsonUtils.createMapper();
        final var missing = dir.resolve("missing.json");
        assertEquals(ErrorType.INVALID_INPUT,
                     assertThrows(MemoriaException.class, () -> MemoriaConfig.load(missing, mapper)).getErrorType());
        final var broken = Files.writeString(dir.resolve("broken.json"), "{ policy: ");
        assertEquals(ErrorType.INVALID_INPUT,
                     assertThrows(MemoriaException.class, () -> MemoriaConfig.load(broken, mapper)).getErrorType());
    }
}
