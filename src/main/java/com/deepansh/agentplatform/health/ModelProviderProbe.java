package com.deepansh.agentplatform.health;

import com.deepansh.agentplatform.config.PlatformProperties;
import com.deepansh.agentplatform.resilience.DependencyNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * GET against the model provider's health URL. Disabled when no URL is configured.
 * Any non-2xx answer surfaces as an exception from RestClient.
 */
@Component
@Slf4j
public class ModelProviderProbe implements DependencyProbe {

    private final RestClient restClient;
    private final PlatformProperties.Probes.ModelProvider settings;

    public ModelProviderProbe(@Qualifier("modelProviderRestClient") RestClient restClient,
                              PlatformProperties properties) {
        this.restClient = restClient;
        this.settings = properties.getProbes().getModelProvider();
        if (!isEnabled()) {
            log.info("Model provider probe disabled: no health URL configured");
        }
    }

    @Override
    public String dependencyName() {
        return DependencyNames.MODEL_PROVIDER;
    }

    @Override
    public boolean isEnabled() {
        return settings.getHealthUrl() != null && !settings.getHealthUrl().isBlank();
    }

    @Override
    public void probe() {
        RestClient.RequestHeadersSpec<?> request = restClient.get().uri(settings.getHealthUrl());
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey());
        }
        request.retrieve().toBodilessEntity();
    }
}
