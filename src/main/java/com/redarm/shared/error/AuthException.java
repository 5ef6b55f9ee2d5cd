package com.redarm.shared.error;

import org.springframework.http.HttpStatus;

/**
 * Missing or invalid identity (401) or identity that does not own the resource (403).
 */
public class AuthException extends ApiException {

    private AuthException(HttpStatus status, String code, String message) {
        super(status, code, message);
    }

    public static AuthException unauthenticated(String message) {
        return new AuthException(HttpStatus.UNAUTHORIZED, "unauthorized", message);
    }

    public static AuthException forbidden(String message) {
        return new AuthException(HttpStatus.FORBIDDEN, "forbidden", message);
    }
}
