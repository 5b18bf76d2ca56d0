package com.deepansh.focus.backend;

import com.deepansh.focus.config.FocusProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.web.client.RestClient;

/**
 * Builds the two backends, each wrapped with retry and circuit breaker
 * settings from focus.backends.*.
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class BackendConfig {

    private final FocusProperties properties;

    @PostConstruct
    public void logBackends() {
        FocusProperties.Backend cloud = properties.getBackends().getCloud();
        FocusProperties.Backend onDevice = properties.getBackends().getOnDevice();
        log.info("================================================================");
        log.info("  Cloud backend     : {} @ {}", cloud.getModel(), cloud.getBaseUrl());
        logKey(cloud.getApiKey());
        log.info("  On-device backend : {} @ {}", onDevice.getModel(), onDevice.getBaseUrl());
        log.info("================================================================");
    }

    @Bean
    public BackendAdapter cloudBackend(@Qualifier("focusRestClientBuilder") RestClient.Builder builder,
                                       @Qualifier("cloudCallExecutor") AsyncTaskExecutor callExecutor,
                                       RetryRegistry retryRegistry,
                                       CircuitBreakerRegistry circuitBreakerRegistry) {
        FocusProperties.Backend props = properties.getBackends().getCloud();
        return ResilientBackendAdapter.wrap(
                new CloudBackendAdapter(props, builder.clone(), callExecutor),
                props, retryRegistry, circuitBreakerRegistry);
    }

    @Bean
    public BackendAdapter onDeviceBackend(ObjectMapper objectMapper,
                                          @Qualifier("focusRestClientBuilder") RestClient.Builder builder,
                                          @Qualifier("onDeviceCallExecutor") AsyncTaskExecutor callExecutor,
                                          RetryRegistry retryRegistry,
                                          CircuitBreakerRegistry circuitBreakerRegistry) {
        FocusProperties.Backend props = properties.getBackends().getOnDevice();
        return ResilientBackendAdapter.wrap(
                new OnDeviceBackendAdapter(props, objectMapper, builder.clone(), callExecutor),
                props, retryRegistry, circuitBreakerRegistry);
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  Cloud API key not set! Set env var: OPENAI_API_KEY={your-key}");
        } else {
            log.info("  Cloud key         : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
