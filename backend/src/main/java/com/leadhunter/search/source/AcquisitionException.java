package com.leadhunter.search.source;

public class AcquisitionException extends Exception {
    public enum Kind {
        BLOCKED,
        TRANSPORT,
        PARSE_EMPTY
    }

    private final Kind kind;
    private final String sourceName;

    public AcquisitionException(Kind kind, String sourceName, String message) {
        this(kind, sourceName, message, null);
    }

    public AcquisitionException(Kind kind, String sourceName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.sourceName = sourceName;
    }

    public Kind kind() {
        return kind;
    }

    public String sourceName() {
        return sourceName;
    }

    /**
     * Blocking and transport failures are worth another attempt; a page without results will look the same.
     */
    public boolean isRetryable() {
        return kind == Kind.BLOCKED || kind == Kind.TRANSPORT;
    }
}
