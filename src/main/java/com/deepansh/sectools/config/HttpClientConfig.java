package com.deepansh.sectools.config;

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
 * Outbound HTTP for the NVD client.
 *
 * Apache HttpClient 5 with a small connection pool. Connect, socket and
 * response timeouts all come from tools.nvd.timeout-seconds so no request
 * can hang a worker thread indefinitely.
 *
 * Named "nvdRestClientBuilder" so Boot's own RestClient.Builder is left alone.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestClient.Builder nvdRestClientBuilder(ToolProperties toolProperties) {
        Timeout timeout = Timeout.ofSeconds(toolProperties.nvd().timeoutSeconds());

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(timeout)
                                        .setSocketTimeout(timeout)
                                        .build())
                                .setMaxConnTotal(20)
                                .setMaxConnPerRoute(10)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(timeout)
                        .build())
                .disableAutomaticRetries()
                .build();

        log.info("NVD HttpClient configured [timeout={}s]", toolProperties.nvd().timeoutSeconds());
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
