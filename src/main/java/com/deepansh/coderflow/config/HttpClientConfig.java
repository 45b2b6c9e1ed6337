package com.deepansh.coderflow.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient 5 behind every outbound RestClient.
 *
 * The read timeout also bounds a single agent turn: a model call that hangs
 * fails as a network error, gets retried, and eventually aborts the run.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${llm.http.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${llm.http.read-timeout-ms:120000}")
    private long readTimeoutMs;

    @Bean
    public RestClient.Builder restClientBuilder() {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(20)
                                .setMaxConnPerRoute(10)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                                        .setSocketTimeout(Timeout.ofMilliseconds(readTimeoutMs))
                                        .build())
                                .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, readTimeout={}ms]", connectTimeoutMs, readTimeoutMs);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
