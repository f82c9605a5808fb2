package com.chambua.standings.dto;

import java.time.Instant;

/**
 * Error body returned by the operator and read APIs. {@code category} tells the caller whether to retry
 * later, fix the request, or escalate to an operator.
 */
public class ApiError {
    private final String code;
    private final String category;
    private final String message;
    private final String path;
    private final Instant timestamp;

    public ApiError(String code, String category, String message, String path) {
        this.code = code;
        this.category = category;
        this.message = message;
        this.path = path;
        this.timestamp = Instant.now();
    }

    public String getCode() { return code; }
    public String getCategory() { return category; }
    public String getMessage() { return message; }
    public String getPath() { return path; }
    public Instant getTimestamp() { return timestamp; }
}
