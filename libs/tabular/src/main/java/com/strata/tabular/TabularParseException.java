package com.strata.tabular;

/**
 * Thrown when an uploaded file cannot be turned into a {@link ParsedTable}.
 *
 * <p>The stage names the part of the input that failed, e.g. {@code header} or {@code row 4}.
 */
public class TabularParseException extends RuntimeException {

    private final String stage;

    public TabularParseException(String stage, String message) {
        super(stage + ": " + message);
        this.stage = stage;
    }

    public TabularParseException(String stage, String message, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }
}
