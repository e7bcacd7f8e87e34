package com.phonepe.memoria.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.memoria.core.errors.ErrorType;
import com.phonepe.memoria.core.errors.MemoriaException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Deployment configuration. Every section has defaults, so an empty JSON object is a valid configuration.
 */
@Value
@Builder
@Jacksonized
@Slf4j
public class MemoriaConfig {
    public static final MemoriaConfig DEFAULT = MemoriaConfig.builder().build();

    @Builder.Default
    PolicyConfig policy = PolicyConfig.DEFAULT;

    @Builder.Default
    RetrieveConfig retrieve = RetrieveConfig.DEFAULT;

    @Builder.Default
    TaxonomyConfig taxonomy = TaxonomyConfig.DEFAULT;

    @Builder.Default
    EvolveConfig evolve = EvolveConfig.DEFAULT;

    @Builder.Default
    RunnerConfig runner = RunnerConfig.DEFAULT;

    public static MemoriaConfig load(Path path, ObjectMapper mapper) {
        try {
            final var config = mapper.readValue(path.toFile(), MemoriaConfig.class);
            log.info("Loaded configuration from {}", path);
            return config;
        }
        catch (IOException e) {
            throw MemoriaException.wrap(ErrorType.INVALID_INPUT, e);
        }
    }
}
