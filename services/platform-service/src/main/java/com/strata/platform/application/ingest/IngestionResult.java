package com.strata.platform.application.ingest;

/**
 * Outcome of a committed upload.
 */
public record IngestionResult(String message, int rowsProcessed, String schemaName) {

    public static final String SUCCESS_MESSAGE = "File processed successfully";
}
