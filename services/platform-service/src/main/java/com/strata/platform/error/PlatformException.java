package com.strata.platform.error;

import java.util.Objects;

/**
 * Request failure with a known {@link ErrorKind}. The message is shown to the client for
 * 4xx kinds.
 */
public class PlatformException extends RuntimeException {

    private final ErrorKind kind;

    public PlatformException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public PlatformException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind kind() {
        return kind;
    }

    public static PlatformException badRequest(String message) {
        return new PlatformException(ErrorKind.BAD_REQUEST, message);
    }

    public static PlatformException authError(String message) {
        return new PlatformException(ErrorKind.AUTH_ERROR, message);
    }

    public static PlatformException forbidden(String message) {
        return new PlatformException(ErrorKind.FORBIDDEN, message);
    }

    public static PlatformException internal(String message, Throwable cause) {
        return new PlatformException(ErrorKind.INTERNAL_ERROR, message, cause);
    }
}
