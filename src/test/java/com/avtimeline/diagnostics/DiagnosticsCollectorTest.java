package com.avtimeline.diagnostics;

import com.avtimeline.contract.ServiceEvent;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsCollectorTest {

    private final ServiceEvent event =
        ServiceEvent.of("Waymo", "Austin", LocalDate.of(2025, 3, 4), "service_ended", Map.of());

    @Test
    void severity_comesFromTheCode() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        Diagnostic error = collector.record(DiagnosticCode.LIFECYCLE_ORDER_VIOLATION, event, 0, "not active");
        Diagnostic warning = collector.record(DiagnosticCode.GEOMETRY_UNRESOLVED, event, 1, "missing");

        assertEquals(Severity.ERROR, error.severity());
        assertEquals(Severity.WARNING, warning.severity());
        assertEquals("waymo-austin", error.serviceId());
        assertEquals(LocalDate.of(2025, 3, 4), error.eventDate());
        assertTrue(collector.hasErrors());
        assertEquals(List.of(error), collector.errors());
        assertEquals(List.of(warning), collector.warnings());
    }

    @Test
    void absorbedDiagnostics_areOrderedByEventPosition() {
        DiagnosticsCollector left = new DiagnosticsCollector();
        DiagnosticsCollector right = new DiagnosticsCollector();
        Diagnostic third = left.record(DiagnosticCode.UNKNOWN_EVENT_KIND, event, 5, "c");
        Diagnostic first = right.record(DiagnosticCode.REDUNDANT_UPDATE, event, 1, "a");
        Diagnostic second = right.record(DiagnosticCode.DATA_QUALITY, event, 1, "b");

        DiagnosticsCollector merged = new DiagnosticsCollector();
        merged.absorb(left.all());
        merged.absorb(right.all());

        assertEquals(List.of(first, second, third), merged.all());
        assertFalse(merged.hasErrors());
    }

    @Test
    void report_splitsBySeverity() {
        DiagnosticsCollector collector = new DiagnosticsCollector();
        collector.record(DiagnosticCode.INVALID_FIRST_EVENT, event, 0, "x");
        collector.record(DiagnosticCode.DATA_QUALITY, event, 0, "y");
        collector.record(DiagnosticCode.DATA_QUALITY, event, 0, "z");

        DiagnosticsReport report = DiagnosticsReport.of(collector.all());

        assertEquals(1, report.errorCount());
        assertEquals(2, report.warningCount());
    }
}
