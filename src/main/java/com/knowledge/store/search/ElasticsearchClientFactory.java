package com.knowledge.store.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;

import java.net.URI;

/**
 * Builds the synchronous Elasticsearch client from a {@link SearchConfig}.
 */
public final class ElasticsearchClientFactory {

    private ElasticsearchClientFactory() {
    }

    public static ElasticsearchClient create(SearchConfig config) {
        int timeoutMillis = (int) config.getRequestTimeout().toMillis();
        URI endpoint = config.getEndpoint();
        RestClientBuilder builder = RestClient.builder(httpHost(endpoint))
                .setRequestConfigCallback(requestConfig -> requestConfig
                        .setConnectTimeout(timeoutMillis)
                        .setSocketTimeout(timeoutMillis))
                .setHttpClientConfigCallback(httpClient -> httpClient
                        .setMaxConnPerRoute(config.getConnectionsPerNode())
                        .setMaxConnTotal(config.getConnectionsPerNode()));
        String pathPrefix = pathPrefix(endpoint);
        if (pathPrefix != null) {
            builder.setPathPrefix(pathPrefix);
        }
        RestClient restClient = builder.build();
        ElasticsearchTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        return new ElasticsearchClient(transport);
    }

    /**
     * Host of an already validated endpoint. A missing port keeps the scheme's default.
     */
    static HttpHost httpHost(URI endpoint) {
        return new HttpHost(endpoint.getHost(), endpoint.getPort(), endpoint.getScheme().toLowerCase());
    }

    /**
     * Path the cluster is mounted under behind a proxy, or {@code null} when the endpoint has none.
     */
    static String pathPrefix(URI endpoint) {
        String path = endpoint.getPath();
        if (path == null) {
            return null;
        }
        String trimmed = path.replaceAll("/+$", "");
        return trimmed.isEmpty() ? null : trimmed;
    }
}
