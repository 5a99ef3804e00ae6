package com.pagewatch.monitor.api;

public class FetchException extends Exception {
    private final FetchErrorKind kind;

    public FetchException(FetchErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FetchException(FetchErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FetchErrorKind kind() {
        return kind;
    }
}
