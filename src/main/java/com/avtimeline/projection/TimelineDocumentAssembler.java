package com.avtimeline.projection;

import com.avtimeline.contract.ServiceEvent;
import com.avtimeline.diagnostics.DiagnosticsReport;
import com.avtimeline.geometry.GeometryResolution;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

/**
 * Builds the output document from a finished projection. Pure: the same
 * result and timestamps always give an equal document.
 */
@Component
public class TimelineDocumentAssembler {

    public TimelineDocument assemble(ProjectionResult result, Instant generatedAt, long exportTimeMs) {
        List<ServiceAreaSnapshot> areas = result.states().stream().map(ServiceAreaSnapshot::of).toList();

        List<TimelineDocument.GeometrySummary> geometries = result.geometry().asMap().entrySet().stream()
            .map(entry -> {
                if (entry.getValue() instanceof GeometryResolution.Resolved resolved) {
                    return new TimelineDocument.GeometrySummary(
                        entry.getKey(), resolved.kind(), resolved.areaSquareMiles(), null);
                }
                GeometryResolution.Failed failed = (GeometryResolution.Failed) entry.getValue();
                return new TimelineDocument.GeometrySummary(entry.getKey(), null, null, failed.reason());
            })
            .toList();
        int loaded = (int) result.geometry().resolvedCount();
        int failed = (int) result.geometry().failedCount();
        int services = (int) result.states().stream().map(ServiceState::getServiceId).distinct().count();

        LocalDate start = result.events().stream()
            .map(ServiceEvent::getEventDate)
            .filter(Objects::nonNull)
            .findFirst()
            .orElse(null);

        return new TimelineDocument(
            new TimelineDocument.Metadata(generatedAt, generatedAt.toEpochMilli(),
                result.events().size(), areas.size(), services, failed),
            new TimelineDocument.ExportStats(result.events().size(), geometries.size(), loaded, failed,
                areas.size(), exportTimeMs),
            new TimelineDocument.DateRange(start, LocalDate.ofInstant(generatedAt, ZoneOffset.UTC)),
            areas,
            DiagnosticsReport.of(result.diagnostics()),
            result.events(),
            geometries
        );
    }
}
