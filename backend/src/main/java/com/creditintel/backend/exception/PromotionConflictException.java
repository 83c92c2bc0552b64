package com.creditintel.backend.exception;

import java.util.List;

public class PromotionConflictException extends CreditIntelligenceException {

    public PromotionConflictException(long candidateId) {
        super(ErrorKind.PROMOTION_CONFLICT, null,
                "Promotion of model " + candidateId + " rejected: another promotion is in flight", List.of());
    }
}
