package com.strata.platform.api.dto;

import com.strata.platform.application.ingest.IngestionResult;

public record UploadResponse(String message, int rowsProcessed, String schemaName) {

    public static UploadResponse from(IngestionResult result) {
        return new UploadResponse(result.message(), result.rowsProcessed(), result.schemaName());
    }
}
