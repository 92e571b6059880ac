package com.avtimeline.projection;

import com.avtimeline.contract.ServiceEvent;
import com.avtimeline.diagnostics.DiagnosticsReport;
import com.avtimeline.geometry.GeometryKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * The published timeline: every state, the raw log it was built from, and
 * what the build ran into.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimelineDocument(
    Metadata metadata,
    ExportStats exportStats,
    DateRange dateRange,
    List<ServiceAreaSnapshot> serviceAreas,
    DiagnosticsReport diagnostics,
    List<ServiceEvent> events,
    List<GeometrySummary> geometries
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Metadata(
        Instant generatedAt,
        long version,
        int eventCount,
        int stateCount,
        int serviceCount,
        int geometryFailures
    ) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExportStats(
        int totalEvents,
        int totalGeometries,
        int loadedGeometries,
        int failedGeometries,
        int totalServiceAreas,
        long exportTimeMs
    ) {}

    /** First event date up to the generation date; start is null for an empty log. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DateRange(LocalDate start, LocalDate end) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GeometrySummary(String reference, GeometryKind kind, Double areaSquareMiles, String failure) {}
}
