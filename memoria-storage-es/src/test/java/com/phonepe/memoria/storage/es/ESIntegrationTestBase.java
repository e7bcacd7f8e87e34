package com.phonepe.memoria.storage.es;

import com.google.common.base.CaseFormat;
import org.testcontainers.elasticsearch.ElasticsearchContainer;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for tests that need an elasticsearch container
 */
public class ESIntegrationTestBase {
    protected static final ElasticsearchContainer ELASTICSEARCH_CONTAINER = new ElasticsearchContainer(
            "docker.elastic.co/elasticsearch/elasticsearch:8.17.3")
            .withEnv(Map.of(
                    "xpack.license.self_generated.type", "basic",
                    "xpack.security.enabled", "false",
                    "discovery.type", "single-node",
                    "ES_JAVA_OPTS", "-Xms512m -Xmx512m"))
            .withCreateContainerCmdModifier(container -> Objects.requireNonNull(container.getHostConfig())
                    .withMemory(2 * 1024 * 1024 * 1024L))
            .withStartupTimeout(Duration.ofMinutes(5));

    //Started once per JVM and shared by all subclasses. Do not manage with @Container.
    static {
        ELASTICSEARCH_CONTAINER.start();
    }

    protected final <T extends ESIntegrationTestBase> String indexPrefix(T test) {
        return CaseFormat.UPPER_CAMEL.converterTo(CaseFormat.LOWER_UNDERSCORE).convert(test.getClass().getSimpleName());
    }

    protected static ESClient client() {
        return ESClient.builder()
                .serverUrl(ELASTICSEARCH_CONTAINER.getHttpHostAddress())
                .build();
    }
}
