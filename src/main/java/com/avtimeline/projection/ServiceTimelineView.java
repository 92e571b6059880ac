package com.avtimeline.projection;

import com.avtimeline.diagnostics.Diagnostic;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/** One service's states and the diagnostics raised while replaying it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServiceTimelineView(
    String serviceId,
    LifecycleStage stage,
    boolean open,
    List<ServiceAreaSnapshot> states,
    List<Diagnostic> diagnostics
) {}
