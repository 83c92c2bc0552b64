package com.creditintel.backend.exception;

import java.util.List;

/**
 * Base of every pipeline failure. Carries the issuer when known so callers can build an
 * {@code ApiError} without parsing messages.
 */
public class CreditIntelligenceException extends RuntimeException {

    private final ErrorKind kind;
    private final String issuerId;
    private final List<String> details;

    public CreditIntelligenceException(ErrorKind kind, String issuerId, String message, List<String> details) {
        super(message);
        this.kind = kind;
        this.issuerId = issuerId;
        this.details = details == null ? List.of() : List.copyOf(details);
    }

    public CreditIntelligenceException(ErrorKind kind, String issuerId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.issuerId = issuerId;
        this.details = List.of();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getIssuerId() {
        return issuerId;
    }

    public List<String> getDetails() {
        return details;
    }
}
