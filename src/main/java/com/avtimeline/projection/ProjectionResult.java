package com.avtimeline.projection;

import com.avtimeline.contract.ServiceEvent;
import com.avtimeline.diagnostics.Diagnostic;
import com.avtimeline.diagnostics.Severity;
import com.avtimeline.geometry.GeometryLookup;

import java.util.List;

/**
 * Output of one replay. Always carries both the states and every diagnostic;
 * callers decide whether errors make the run unusable.
 *
 * @param events the input log in replay (date) order
 * @param states every state produced, in creation order
 */
public record ProjectionResult(
    List<ServiceEvent> events,
    List<ServiceState> states,
    List<Diagnostic> diagnostics,
    GeometryLookup geometry
) {

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public List<ServiceState> statesFor(String serviceId) {
        return states.stream().filter(s -> s.getServiceId().equals(serviceId)).toList();
    }

    public List<Diagnostic> diagnosticsFor(String serviceId) {
        return diagnostics.stream().filter(d -> serviceId.equals(d.serviceId())).toList();
    }
}
