package com.avtimeline.diagnostics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;

/**
 * One reported problem, tied to the event that caused it.
 *
 * @param position index of the event in date order, used to keep diagnostics
 *                 in replay order when services are projected in parallel
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(
    Severity severity,
    DiagnosticCode code,
    String serviceId,
    LocalDate eventDate,
    String eventType,
    Long sequenceNumber,
    String message,
    @JsonIgnore int position
) {
}
