package com.strata.platform.api.dto;

import com.strata.platform.application.AnalyticsService;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record AnalyticsResponse(List<DatasetSummary> recentUploads, long totalRows) {

    public record DatasetSummary(UUID schemaId, String schemaName, long rowCount, OffsetDateTime createdAt) {}

    public static AnalyticsResponse from(AnalyticsService.Analytics analytics) {
        return new AnalyticsResponse(
                analytics.recentUploads().stream()
                        .map(s -> new DatasetSummary(s.id(), s.name(), s.rowCount(), s.createdAt()))
                        .toList(),
                analytics.totalRows());
    }
}
