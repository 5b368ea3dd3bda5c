package com.leadhunter.enrichment;

public class EnrichmentException extends RuntimeException {
    public enum Kind {
        API_UNAVAILABLE,
        RATE_LIMITED,
        INVALID_DATA
    }

    private final Kind kind;

    public EnrichmentException(Kind kind, String message) {
        this(kind, message, null);
    }

    public EnrichmentException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
