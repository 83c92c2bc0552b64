package com.creditintel.backend.dto;

import com.creditintel.backend.pipeline.FeatureAttribution;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class KeyFactorResponse {

    private String feature;
    private String label;
    private double value;
    private double contribution;

    public static KeyFactorResponse from(FeatureAttribution attribution) {
        return KeyFactorResponse.builder()
                .feature(attribution.feature())
                .label(attribution.label())
                .value(attribution.value())
                .contribution(attribution.contribution())
                .build();
    }
}
