package com.deepansh.focus.config;

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
 * Pooled Apache HttpClient behind every outbound RestClient (model backends, calendar).
 *
 * Per-request deadlines are enforced by the backend adapters. The socket timeout here
 * is only a backstop so an abandoned call cannot hold a pooled connection forever, so
 * it is set just above the longest configured backend deadline.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    private static final long CONNECT_TIMEOUT_MS = 5_000;
    private static final long BACKSTOP_MARGIN_MS = 10_000;

    @Bean
    public RestClient.Builder focusRestClientBuilder(FocusProperties properties) {
        long longest = Math.max(
                properties.getBackends().getCloud().getComplexTimeoutMs(),
                properties.getBackends().getOnDevice().getComplexTimeoutMs());
        Timeout socketTimeout = Timeout.ofMilliseconds(longest + BACKSTOP_MARGIN_MS);

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(20)
                                .setMaxConnPerRoute(10)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(CONNECT_TIMEOUT_MS))
                                        .setSocketTimeout(socketTimeout)
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(socketTimeout)
                        .build())
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, socketTimeout={}]", CONNECT_TIMEOUT_MS, socketTimeout);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
