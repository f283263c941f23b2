package com.pulseanalytics.infrastructure.search;

import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.opensearch.client.RestClient;
import org.opensearch.client.RestClientBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(OpenSearchProperties.class)
public class OpenSearchConfig {

    /**
     * Low-level REST client shared by all tenants. Request bodies are built
     * with Jackson by OpenSearchAggregationIndex.
     */
    @Bean(destroyMethod = "close")
    public RestClient openSearchRestClient(OpenSearchProperties properties) {
        log.info("Initializing OpenSearch client for {}://{}:{}",
                properties.getScheme(), properties.getHost(), properties.getPort());

        RestClientBuilder builder = RestClient.builder(
                        new HttpHost(properties.getHost(), properties.getPort(), properties.getScheme()))
                .setRequestConfigCallback(requestConfig -> requestConfig
                        .setConnectTimeout(properties.getConnectTimeoutMs())
                        .setSocketTimeout(properties.getSocketTimeoutMs()));

        if (properties.hasCredentials()) {
            BasicCredentialsProvider credentials = new BasicCredentialsProvider();
            credentials.setCredentials(AuthScope.ANY,
                    new UsernamePasswordCredentials(properties.getUsername(), properties.getPassword()));
            builder.setHttpClientConfigCallback(httpClient -> httpClient.setDefaultCredentialsProvider(credentials));
        }

        return builder.build();
    }
}
