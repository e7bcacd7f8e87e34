package com.phonepe.memoria.storage.es;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.google.common.base.Strings;
import com.phonepe.memoria.core.utils.JsonUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.apache.http.Header;
import org.apache.http.HttpHost;
import org.apache.http.message.BasicHeader;
import org.elasticsearch.client.RestClient;

/**
 * Elasticsearch client wrapper
 */
public class ESClient implements AutoCloseable {
    @Getter
    private final ElasticsearchClient elasticsearchClient;

    @Builder
    public ESClient(@NonNull String serverUrl, String apiKey) {
        final var builder = RestClient.builder(HttpHost.create(serverUrl));
        if (!Strings.isNullOrEmpty(apiKey)) {
            builder.setDefaultHeaders(new Header[]{
                    new BasicHeader("Authorization", "ApiKey " + apiKey)
            });
        }
        final ElasticsearchTransport transport = new RestClientTransport(
                builder.build(), new JacksonJsonpMapper(JsonUtils.createMapper()));
        this.elasticsearchClient = new ElasticsearchClient(transport);
    }

    @Override
    public void close() throws Exception {
        elasticsearchClient._transport().close();
    }
}
