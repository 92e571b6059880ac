package com.avtimeline.projection;

import com.avtimeline.diagnostics.DiagnosticsCollector;
import com.avtimeline.geometry.GeometryLookup;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one replay owns: the service timelines, the diagnostics and the
 * prefetched geometry. Created per run and per parallel service group; never
 * shared between runs.
 */
class ProjectionContext {

    private final Map<String, ServiceTimeline> timelines = new LinkedHashMap<>();
    private final DiagnosticsCollector diagnostics = new DiagnosticsCollector();
    private final GeometryLookup geometry;

    ProjectionContext(GeometryLookup geometry) {
        this.geometry = geometry;
    }

    ServiceTimeline timeline(String serviceId) {
        return timelines.computeIfAbsent(serviceId, ServiceTimeline::new);
    }

    Collection<ServiceTimeline> timelines() {
        return timelines.values();
    }

    DiagnosticsCollector diagnostics() {
        return diagnostics;
    }

    GeometryLookup geometry() {
        return geometry;
    }
}
