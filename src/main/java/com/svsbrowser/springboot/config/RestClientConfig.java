package com.svsbrowser.springboot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * RestClients for the source site and the local embedding server, both on the JDK HttpClient.
 */
@Configuration
public class RestClientConfig {

    @Bean("sourceRestClient")
    public RestClient sourceRestClient(RestClient.Builder builder,
                                       @Value("${app.source.timeout-ms:30000}") long timeoutMs,
                                       @Value("${app.source.user-agent:SVS-Browser-Ingestion/1.0}") String userAgent) {
        return builder
                .requestFactory(requestFactory(timeoutMs))
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    @Bean("embeddingRestClient")
    public RestClient embeddingRestClient(RestClient.Builder builder,
                                          @Value("${app.embedding.local.base-url:http://localhost:11434}") String baseUrl,
                                          @Value("${app.embedding.local.timeout-ms:120000}") long timeoutMs) {
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory(timeoutMs))
                .build();
    }

    private JdkClientHttpRequestFactory requestFactory(long timeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(Duration.ofMillis(timeoutMs));
        return requestFactory;
    }
}
