package com.creditintel.backend.exception;

import java.util.List;

public class ExplanationMismatchException extends CreditIntelligenceException {

    public ExplanationMismatchException(String issuerId, String message, List<String> details) {
        super(ErrorKind.EXPLANATION_MISMATCH, issuerId, message, details);
    }
}
