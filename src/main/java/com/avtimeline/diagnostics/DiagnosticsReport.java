package com.avtimeline.diagnostics;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DiagnosticsReport(int errorCount, int warningCount, List<Diagnostic> errors, List<Diagnostic> warnings) {

    public static DiagnosticsReport of(List<Diagnostic> diagnostics) {
        List<Diagnostic> errors = diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).toList();
        List<Diagnostic> warnings = diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
        return new DiagnosticsReport(errors.size(), warnings.size(), errors, warnings);
    }
}
