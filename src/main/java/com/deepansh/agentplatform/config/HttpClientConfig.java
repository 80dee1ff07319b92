package com.deepansh.agentplatform.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client used by the model-provider probe.
 *
 * Timeouts live on the Apache client itself: connect and socket timeouts on the
 * pooled connections, response timeout per request. The probe's circuit
 * breaker adds its own overall time limit on top.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient modelProviderRestClient(PlatformProperties properties) {
        PlatformProperties.Probes.ModelProvider settings = properties.getProbes().getModelProvider();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(Timeout.ofMilliseconds(settings.getConnectTimeoutMs()))
                                .setSocketTimeout(Timeout.ofMilliseconds(settings.getReadTimeoutMs()))
                                .build())
                        .setMaxConnTotal(4)
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(settings.getReadTimeoutMs()))
                        .build())
                .build();

        log.info("Model provider HTTP client configured [connectTimeout={}ms, readTimeout={}ms]",
                settings.getConnectTimeoutMs(), settings.getReadTimeoutMs());
        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient))
                .build();
    }
}
