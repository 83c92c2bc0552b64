package com.creditintel.backend.dto;

import com.creditintel.backend.exception.CreditIntelligenceException;
import com.creditintel.backend.exception.ErrorKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApiError {

    private ErrorKind kind;
    private String message;
    private String issuerId;
    private List<String> details;
    private Instant timestamp;

    public static ApiError from(RuntimeException exception, String issuerId, Instant timestamp) {
        if (exception instanceof CreditIntelligenceException domain) {
            return ApiError.builder()
                    .kind(domain.getKind())
                    .message(domain.getMessage())
                    .issuerId(domain.getIssuerId() != null ? domain.getIssuerId() : issuerId)
                    .details(domain.getDetails())
                    .timestamp(timestamp)
                    .build();
        }
        return ApiError.builder()
                .kind(ErrorKind.INTERNAL)
                .message(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName())
                .issuerId(issuerId)
                .details(List.of(exception.getClass().getSimpleName()))
                .timestamp(timestamp)
                .build();
    }
}
