package com.strata.platform.error;

import org.springframework.http.HttpStatus;

/**
 * Client-facing error categories. Kinds that are not {@link #exposesDetail() detail-exposing}
 * answer with a generic message; the real cause is only logged.
 */
public enum ErrorKind {
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", true),
    AUTH_ERROR(HttpStatus.UNAUTHORIZED, "Authentication Failed", "auth-error", true),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", true),
    FORBIDDEN(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", true),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "storage-failure", false),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", false);

    public static final String GENERIC_MESSAGE = "Internal error";

    private final HttpStatus status;
    private final String title;
    private final String slug;
    private final boolean exposesDetail;

    ErrorKind(HttpStatus status, String title, String slug, boolean exposesDetail) {
        this.status = status;
        this.title = title;
        this.slug = slug;
        this.exposesDetail = exposesDetail;
    }

    public HttpStatus status() {
        return status;
    }

    public String title() {
        return title;
    }

    public String slug() {
        return slug;
    }

    public boolean exposesDetail() {
        return exposesDetail;
    }

    /**
     * The message a client may see for an error of this kind.
     */
    public String clientMessage(String message) {
        return exposesDetail && message != null && !message.isBlank() ? message : GENERIC_MESSAGE;
    }
}
