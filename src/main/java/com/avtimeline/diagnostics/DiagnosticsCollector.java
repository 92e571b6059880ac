package com.avtimeline.diagnostics;

import com.avtimeline.contract.ServiceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Accumulates diagnostics for one projection run. Recording never throws and
 * never stops the batch. Not thread-safe: each parallel service group gets its
 * own collector and the results are merged with {@link #absorb(Collection)}.
 */
public class DiagnosticsCollector {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsCollector.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public Diagnostic record(DiagnosticCode code, ServiceEvent event, int position, String message) {
        Diagnostic diagnostic = new Diagnostic(
            code.severity(),
            code,
            event == null ? null : event.getServiceId(),
            event == null ? null : event.getEventDate(),
            event == null ? null : event.getEventType(),
            event == null ? null : event.getSequenceNumber(),
            message,
            position
        );
        diagnostics.add(diagnostic);
        log.warn("{} {} at {} ({}): {}", diagnostic.severity(), code,
            diagnostic.serviceId(), diagnostic.eventDate(), diagnostic.eventType(), message);
        return diagnostic;
    }

    public void absorb(Collection<Diagnostic> others) {
        diagnostics.addAll(others);
    }

    /** All diagnostics in event order; the sort is stable so same-event entries keep record order. */
    public List<Diagnostic> all() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Comparator.comparingInt(Diagnostic::position));
        return List.copyOf(sorted);
    }

    public List<Diagnostic> errors() {
        return all().stream().filter(d -> d.severity() == Severity.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return all().stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }
}
