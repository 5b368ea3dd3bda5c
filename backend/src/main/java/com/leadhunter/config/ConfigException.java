package com.leadhunter.config;

public class ConfigException extends RuntimeException {
    public enum Kind {
        INVALID_RANGE,
        MISSING_REQUIRED_PROXY
    }

    private final Kind kind;

    public ConfigException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
