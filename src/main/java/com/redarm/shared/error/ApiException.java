package com.redarm.shared.error;

import org.springframework.http.HttpStatus;

/**
 * Base for errors that map onto the canonical HTTP error envelope.
 * Messages are client-facing and must not carry internal details.
 */
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    protected ApiException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}
