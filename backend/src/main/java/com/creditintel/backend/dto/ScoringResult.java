package com.creditintel.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Either a score or a structured error, never both.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScoringResult {

    private boolean success;
    private CreditScoreResponse score;
    private ApiError error;

    public static ScoringResult success(CreditScoreResponse score) {
        return new ScoringResult(true, score, null);
    }

    public static ScoringResult failure(ApiError error) {
        return new ScoringResult(false, null, error);
    }
}
