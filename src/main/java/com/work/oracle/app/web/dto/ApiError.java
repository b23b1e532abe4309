package com.work.oracle.app.web.dto;

public class ApiError {

    private final String kind;
    private final String message;
    private final boolean partial;

    public ApiError(String kind, String message, boolean partial) {
        this.kind = kind;
        this.message = message;
        this.partial = partial;
    }

    public String getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    public boolean isPartial() {
        return partial;
    }
}
