package com.avtimeline.projection;

import com.avtimeline.bus.EventStore;
import com.avtimeline.contract.ServiceEvent;
import com.avtimeline.geometry.GeometryLookup;
import com.avtimeline.geometry.GeometryPrefetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs the full pipeline over the event log: prefetch geometry, replay, and
 * assemble the output document. Nothing is cached between calls; every call
 * replays the whole log.
 */
@Service
public class ProjectionService {

    private static final Logger log = LoggerFactory.getLogger(ProjectionService.class);

    private final EventStore eventStore;
    private final ServiceTimelineProjector projector;
    private final GeometryPrefetcher prefetcher;
    private final TimelineDocumentAssembler assembler;
    private final Clock clock;

    public ProjectionService(EventStore eventStore, ServiceTimelineProjector projector,
                             GeometryPrefetcher prefetcher, TimelineDocumentAssembler assembler, Clock clock) {
        this.eventStore = eventStore;
        this.projector = projector;
        this.prefetcher = prefetcher;
        this.assembler = assembler;
        this.clock = clock;
    }

    public ProjectionResult project() {
        List<ServiceEvent> events = eventStore.findAll();
        GeometryLookup geometry = prefetcher.prefetch(ServiceTimelineProjector.geometryReferences(events));
        return projector.project(events, geometry);
    }

    public TimelineDocument buildTimeline() {
        long started = clock.millis();
        ProjectionResult result = project();
        Instant generatedAt = clock.instant();
        TimelineDocument document = assembler.assemble(result, generatedAt, generatedAt.toEpochMilli() - started);
        log.info("Built timeline with {} service areas from {} events",
            document.serviceAreas().size(), document.events().size());
        return document;
    }

    /** States and diagnostics of one service; empty when the log never mentions it. */
    public Optional<ServiceTimelineView> timelineFor(String serviceId) {
        if (!eventStore.existsByServiceId(serviceId)) {
            return Optional.empty();
        }
        ProjectionResult result = project();
        List<ServiceState> states = result.statesFor(serviceId);
        Optional<ServiceState> latest = states.isEmpty() ? Optional.empty() : Optional.of(states.get(states.size() - 1));
        LifecycleStage stage = latest
            .map(s -> s.isOpen() ? LifecycleStage.of(s.getStatus()) : LifecycleStage.ENDED)
            .orElse(LifecycleStage.NONE);
        return Optional.of(new ServiceTimelineView(
            serviceId,
            stage,
            latest.map(ServiceState::isOpen).orElse(false),
            states.stream().map(ServiceAreaSnapshot::of).toList(),
            result.diagnosticsFor(serviceId)
        ));
    }
}
