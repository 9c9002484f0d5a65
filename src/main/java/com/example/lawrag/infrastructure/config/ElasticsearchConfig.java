package com.example.lawrag.infrastructure.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import com.example.lawrag.infrastructure.search.HybridSearchSettings;
import java.net.URI;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch client for the per-country law indices, the thread pool that runs the two
 * retrieval legs, and the hybrid search tuning.
 */
@Configuration
public class ElasticsearchConfig {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchConfig.class);

    static final int DEFAULT_PORT = 9200;

    @Bean(destroyMethod = "close")
    public RestClient elasticRestClient(
            @Value("${lawrag.elasticsearch.url}") String url,
            @Value("${lawrag.elasticsearch.username:}") String username,
            @Value("${lawrag.elasticsearch.password:}") String password,
            @Value("${lawrag.elasticsearch.connect-timeout-ms}") int connectTimeoutMs,
            @Value("${lawrag.elasticsearch.socket-timeout-ms}") int socketTimeoutMs
    ) {
        HttpHost host = toHttpHost(url);
        boolean secured = username != null && !username.isBlank();

        log.info("event=elasticsearch_client_config host={} auth={} connectTimeoutMs={} socketTimeoutMs={}",
                host.toURI(), secured, connectTimeoutMs, socketTimeoutMs);

        RestClientBuilder builder = RestClient.builder(host)
                .setRequestConfigCallback(rcb -> rcb
                        .setConnectTimeout(connectTimeoutMs)
                        .setConnectionRequestTimeout(connectTimeoutMs)
                        .setSocketTimeout(socketTimeoutMs));

        if (secured) {
            BasicCredentialsProvider credentials = new BasicCredentialsProvider();
            credentials.setCredentials(AuthScope.ANY, new UsernamePasswordCredentials(username, password));
            builder.setHttpClientConfigCallback(hcb -> hcb.setDefaultCredentialsProvider(credentials));
        }
        return builder.build();
    }

    @Bean
    public ElasticsearchClient elasticsearchClient(RestClient restClient) {
        ElasticsearchTransport transport = new RestClientTransport(restClient, new JacksonJsonpMapper());
        return new ElasticsearchClient(transport);
    }

    @Bean
    public HybridSearchSettings hybridSearchSettings(
            @Value("${lawrag.retrieval.rrf-k:60}") int rrfK,
            @Value("${lawrag.elasticsearch.num-candidates-factor:4}") int numCandidatesFactor
    ) {
        HybridSearchSettings settings = new HybridSearchSettings(rrfK, numCandidatesFactor);
        log.info("event=hybrid_search_config rrfK={} numCandidatesFactor={}",
                settings.rrfK(), settings.numCandidatesFactor());
        return settings;
    }

    /**
     * Runs the dense and sparse legs of a hybrid search concurrently.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService hybridSearchExecutor(
            @Value("${lawrag.elasticsearch.search-threads:0}") int configuredThreads) {
        int threads = searchThreads(configuredThreads, Runtime.getRuntime().availableProcessors());
        log.info("event=hybrid_executor_config threads={}", threads);
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "hybrid-search-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    static int searchThreads(int configured, int cpus) {
        return configured > 0 ? configured : Math.max(4, cpus);
    }

    /**
     * Parses the cluster URL; a URL without an explicit port targets {@value #DEFAULT_PORT}.
     */
    static HttpHost toHttpHost(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("lawrag.elasticsearch.url is required");
        }
        URI uri = URI.create(url.trim());
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Invalid Elasticsearch url: " + url);
        }
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme();
        int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        return new HttpHost(uri.getHost(), port, scheme);
    }
}
