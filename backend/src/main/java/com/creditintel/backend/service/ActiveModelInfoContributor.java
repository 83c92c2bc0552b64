package com.creditintel.backend.service;

import com.creditintel.backend.dto.ModelMetricsResponse;
import com.creditintel.backend.service.model.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.info.Info;
import org.springframework.boot.actuate.info.InfoContributor;
import org.springframework.stereotype.Component;

/**
 * Publishes the active model's holdout and explanation metrics under {@code activeModel}.
 */
@Component
@RequiredArgsConstructor
public class ActiveModelInfoContributor implements InfoContributor {

    private final ModelRegistry registry;

    @Override
    public void contribute(Info.Builder builder) {
        registry.active()
                .map(ModelMetricsResponse::from)
                .ifPresent(metrics -> builder.withDetail("activeModel", metrics));
    }
}
