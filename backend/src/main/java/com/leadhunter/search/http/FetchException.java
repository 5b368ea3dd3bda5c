package com.leadhunter.search.http;

public class FetchException extends Exception {
    public enum Kind {
        TIMEOUT,
        HTTP_STATUS,
        NETWORK
    }

    private final Kind kind;
    private final int statusCode;

    public FetchException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException timeout(String message, Throwable cause) {
        return new FetchException(Kind.TIMEOUT, 0, message, cause);
    }

    public static FetchException httpStatus(int statusCode, String message) {
        return new FetchException(Kind.HTTP_STATUS, statusCode, message, null);
    }

    public static FetchException network(String message, Throwable cause) {
        return new FetchException(Kind.NETWORK, 0, message, cause);
    }

    public Kind kind() {
        return kind;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Transport-level failures that say something about the proxy used rather than the target.
     */
    public boolean isConnectionFailure() {
        return kind == Kind.TIMEOUT || kind == Kind.NETWORK || statusCode == 407;
    }
}
