package com.creditintel.backend.exception;

import java.util.List;

public class ObservationValidationException extends CreditIntelligenceException {

    private final ValidationReason reason;

    public ObservationValidationException(String issuerId, ValidationReason reason, String message) {
        super(ErrorKind.VALIDATION, issuerId, message, List.of(reason.name()));
        this.reason = reason;
    }

    public ValidationReason getReason() {
        return reason;
    }
}
