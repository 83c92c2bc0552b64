package com.creditintel.backend.service;

import com.creditintel.backend.pipeline.ModelVersion;
import com.creditintel.backend.service.model.ModelRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ModelRegistryHealthIndicator implements HealthIndicator {

    private final ModelRegistry registry;

    @Override
    public Health health() {
        Optional<ModelVersion> active = registry.active();
        if (active.isEmpty()) {
            return Health.down()
                    .withDetail("reason", "no active model version")
                    .withDetail("versions", registry.versions().size())
                    .build();
        }
        return Health.up()
                .withDetail("activeVersion", active.get().versionId())
                .withDetail("versions", registry.versions().size())
                .withDetail("promotionInFlight", registry.isPromotionInFlight())
                .build();
    }
}
