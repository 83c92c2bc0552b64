package com.creditintel.backend.exception;

import java.util.List;

public class NoActiveModelException extends CreditIntelligenceException {

    public NoActiveModelException(String issuerId) {
        super(ErrorKind.NO_ACTIVE_MODEL, issuerId, "No active model version", List.of());
    }
}
