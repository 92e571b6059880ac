package com.avtimeline.projection;

import com.avtimeline.contract.ContractViolationException;
import com.avtimeline.contract.EventContractValidator;
import com.avtimeline.contract.EventKind;
import com.avtimeline.contract.EventPayload;
import com.avtimeline.contract.EventQualityInspector;
import com.avtimeline.contract.ServiceAttribute;
import com.avtimeline.contract.ServiceEvent;
import com.avtimeline.contract.ServiceStatus;
import com.avtimeline.diagnostics.DiagnosticCode;
import com.avtimeline.diagnostics.DiagnosticsCollector;
import com.avtimeline.geometry.GeometryLookup;
import com.avtimeline.geometry.GeometryReference;
import com.avtimeline.geometry.GeometryResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Replays a service event log into dated service states.
 *
 * Events are stably sorted by date and replayed per service through the
 * lifecycle {@code none -> testing -> announced -> active -> ended}. An event
 * on the same date as the open state changes it in place; a later event closes
 * it and opens a successor carrying the change. A bad event is reported and
 * skipped, never the batch.
 *
 * Services never interact, so with {@code parallel} enabled each service is
 * replayed on the executor. States and diagnostics are merged back by event
 * position, which makes both modes produce the same output.
 */
public class ServiceTimelineProjector {

    private static final Logger log = LoggerFactory.getLogger(ServiceTimelineProjector.class);

    private static final Comparator<ServiceEvent> BY_DATE =
        Comparator.comparing(ServiceEvent::getEventDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final EventContractValidator validator;
    private final EventQualityInspector inspector;
    private final Executor executor;
    private final boolean parallel;

    public ServiceTimelineProjector(EventContractValidator validator, EventQualityInspector inspector,
                                    Executor executor, boolean parallel) {
        this.validator = validator;
        this.inspector = inspector;
        this.executor = executor;
        this.parallel = parallel;
    }

    public ProjectionResult project(List<ServiceEvent> events, GeometryLookup geometry) {
        List<ServiceEvent> ordered = new ArrayList<>(events);
        ordered.sort(BY_DATE);

        DiagnosticsCollector diagnostics = new DiagnosticsCollector();
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int position = 0; position < ordered.size(); position++) {
            ServiceEvent event = ordered.get(position);
            String serviceId = event.getServiceId();
            if (serviceId == null) {
                diagnostics.record(DiagnosticCode.MISSING_IDENTITY, event, position,
                    "company and location are required to identify a service");
                continue;
            }
            groups.computeIfAbsent(serviceId, id -> new ArrayList<>()).add(position);
        }

        List<ProjectionContext> contexts;
        if (parallel && groups.size() > 1) {
            List<CompletableFuture<ProjectionContext>> futures = groups.values().stream()
                .map(positions -> CompletableFuture.supplyAsync(() -> replay(ordered, positions, geometry), executor))
                .toList();
            contexts = futures.stream().map(CompletableFuture::join).toList();
        } else {
            contexts = groups.values().stream().map(positions -> replay(ordered, positions, geometry)).toList();
        }

        List<ServiceState> states = new ArrayList<>();
        for (ProjectionContext context : contexts) {
            context.timelines().forEach(t -> states.addAll(t.getStates()));
            diagnostics.absorb(context.diagnostics().all());
        }
        states.sort(Comparator.comparingInt(ServiceState::getCreationPosition));

        ProjectionResult result = new ProjectionResult(
            List.copyOf(ordered), List.copyOf(states), diagnostics.all(), geometry);
        log.info("Projected {} events for {} services into {} states ({} errors, {} warnings)",
            ordered.size(), groups.size(), states.size(), result.errors().size(), result.warnings().size());
        return result;
    }

    /**
     * Every geometry reference replay can apply, for prefetching. Updates of
     * other attributes never write geometry, so their stray keys are skipped.
     */
    public static List<GeometryReference> geometryReferences(Collection<ServiceEvent> events) {
        return events.stream()
            .filter(e -> e.kind().filter(ServiceTimelineProjector::appliesGeometry).isPresent())
            .map(e -> ServiceAttribute.GEOMETRY.rawValue(e.getPayload()))
            .flatMap(Optional::stream)
            .map(GeometryReference::parse)
            .flatMap(Optional::stream)
            .toList();
    }

    private static boolean appliesGeometry(EventKind kind) {
        return kind.isLifecycleStart() || kind.targetAttribute() == ServiceAttribute.GEOMETRY;
    }

    private ProjectionContext replay(List<ServiceEvent> ordered, List<Integer> positions, GeometryLookup geometry) {
        ProjectionContext context = new ProjectionContext(geometry);
        for (int position : positions) {
            apply(context, ordered.get(position), position);
        }
        return context;
    }

    private void apply(ProjectionContext context, ServiceEvent event, int position) {
        DiagnosticsCollector diagnostics = context.diagnostics();
        EventPayload payload;
        try {
            payload = validator.validate(event);
        } catch (ContractViolationException ex) {
            diagnostics.record(DiagnosticCode.INVALID_EVENT, event, position, ex.getMessage());
            return;
        }
        if (payload instanceof EventPayload.Unrecognized unrecognized) {
            diagnostics.record(DiagnosticCode.UNKNOWN_EVENT_KIND, event, position,
                "unknown event type " + unrecognized.eventType() + " kept in the raw log only");
            return;
        }

        ServiceTimeline timeline = context.timeline(event.getServiceId());
        if (timeline.openStates().size() > 1) {
            diagnostics.record(DiagnosticCode.OPEN_STATE_CONFLICT, event, position,
                timeline.openStates().size() + " open states for " + timeline.getServiceId());
            return;
        }
        inspector.inspect(event, payload)
            .forEach(finding -> diagnostics.record(DiagnosticCode.DATA_QUALITY, event, position, finding));

        if (payload instanceof EventPayload.Lifecycle lifecycle) {
            applyLifecycle(context, timeline, event, position, lifecycle);
        } else if (payload instanceof EventPayload.Termination) {
            applyTermination(context, timeline, event, position);
        } else if (payload instanceof EventPayload.AttributeChange change) {
            applyChange(context, timeline, event, position, change);
        }
    }

    private void applyLifecycle(ProjectionContext context, ServiceTimeline timeline, ServiceEvent event,
                                int position, EventPayload.Lifecycle lifecycle) {
        LifecycleStage stage = timeline.getStage();
        EventKind kind = lifecycle.kind();
        boolean allowed = kind == EventKind.SERVICE_CREATED
            ? stage != LifecycleStage.ACTIVE
            : stage.isPreLaunch();
        if (!allowed) {
            context.diagnostics().record(DiagnosticCode.LIFECYCLE_ORDER_VIOLATION, event, position,
                kind.getValue() + " is not allowed while the service is " + stage.name().toLowerCase());
            return;
        }

        ServiceState state = stateFor(timeline, event, position, lifecycle.status());
        state.setStatus(lifecycle.status());
        lifecycle.attributes().forEach((attribute, value) -> write(context, state, event, position, attribute, value));
        timeline.setStage(LifecycleStage.of(lifecycle.status()));
        log.debug("{} {} -> {}", event.getEventDate(), kind.getValue(), state);
    }

    private void applyTermination(ProjectionContext context, ServiceTimeline timeline, ServiceEvent event,
                                  int position) {
        LifecycleStage stage = timeline.getStage();
        if (stage == LifecycleStage.NONE) {
            firstEventError(context, event, position);
            return;
        }
        Optional<ServiceState> open = timeline.openState();
        if (stage != LifecycleStage.ACTIVE || open.isEmpty()) {
            context.diagnostics().record(DiagnosticCode.LIFECYCLE_ORDER_VIOLATION, event, position,
                "service_ended requires an active service, found " + stage.name().toLowerCase());
            return;
        }
        ServiceState state = open.get();
        state.close(event.getEventDate());
        state.touch(event.getEventDate());
        timeline.setStage(LifecycleStage.ENDED);
        log.debug("{} service_ended closes {}", event.getEventDate(), state);
    }

    private void applyChange(ProjectionContext context, ServiceTimeline timeline, ServiceEvent event,
                             int position, EventPayload.AttributeChange change) {
        LifecycleStage stage = timeline.getStage();
        if (stage == LifecycleStage.NONE) {
            firstEventError(context, event, position);
            return;
        }
        if (!stage.acceptsUpdates()) {
            context.diagnostics().record(DiagnosticCode.UPDATE_OUTSIDE_LIFECYCLE, event, position,
                change.kind().getValue() + " ignored, service is " + stage.name().toLowerCase());
            return;
        }

        ServiceAttribute attribute = change.attribute();
        Object current = timeline.openState().map(s -> s.get(attribute)).orElse(null);
        if (Objects.equals(current, change.value())) {
            DiagnosticCode code = attribute.isMultiValue()
                ? DiagnosticCode.REDUNDANT_MULTI_VALUE_UPDATE
                : DiagnosticCode.REDUNDANT_UPDATE;
            context.diagnostics().record(code, event, position,
                attribute.key() + " already has value " + render(current));
        }

        ServiceState state = stateFor(timeline, event, position, null);
        write(context, state, event, position, attribute, change.value());
        log.debug("{} {} sets {} on {}", event.getEventDate(), change.kind().getValue(), attribute.key(), state);
    }

    /**
     * Returns the state an event on this date writes to: the open state when it
     * started on the same date, otherwise a successor that inherits the latest
     * state. Closes the previous open state at the event date. A relaunch on
     * the start date of the state that just ended reopens that state, so no two
     * states of a service share an effective date.
     */
    private ServiceState stateFor(ServiceTimeline timeline, ServiceEvent event, int position, ServiceStatus status) {
        LocalDate date = event.getEventDate();
        Optional<ServiceState> open = timeline.openState();
        if (open.isPresent() && open.get().getEffectiveDate().equals(date)) {
            ServiceState same = open.get();
            same.touch(date);
            return same;
        }
        if (open.isEmpty()) {
            Optional<ServiceState> ended = timeline.latest().filter(s -> s.getEffectiveDate().equals(date));
            if (ended.isPresent()) {
                ServiceState reopened = ended.get();
                reopened.reopen();
                reopened.touch(date);
                return reopened;
            }
        }
        open.ifPresent(s -> s.close(date));

        ServiceState next = timeline.latest()
            .map(previous -> previous.successor(date, position))
            .orElseGet(() -> new ServiceState(timeline.getServiceId(), event.getCompany().trim(),
                event.getLocation().trim(), status, date, position));
        timeline.add(next);
        return next;
    }

    private void write(ProjectionContext context, ServiceState state, ServiceEvent event, int position,
                       ServiceAttribute attribute, Object value) {
        state.put(attribute, value);
        if (attribute != ServiceAttribute.GEOMETRY) {
            return;
        }
        GeometryReference reference = GeometryReference.parse((String) value).orElseThrow();
        GeometryResolution resolution = context.geometry().find(reference)
            .orElseGet(() -> new GeometryResolution.Failed("geometry " + reference.id() + " was not prefetched"));
        if (resolution instanceof GeometryResolution.Resolved resolved) {
            state.setGeometry(resolved.kind(), reference.isPoint() ? reference.coordinates() : null,
                resolved.areaSquareMiles());
        } else {
            String reason = ((GeometryResolution.Failed) resolution).reason();
            state.setGeometry(reference.kind(), reference.isPoint() ? reference.coordinates() : null, null);
            context.diagnostics().record(DiagnosticCode.GEOMETRY_UNRESOLVED, event, position, reason);
        }
    }

    private void firstEventError(ProjectionContext context, ServiceEvent event, int position) {
        context.diagnostics().record(DiagnosticCode.INVALID_FIRST_EVENT, event, position,
            "first event must be service_testing, service_announced or service_created, got "
                + event.getEventType());
    }

    private static String render(Object value) {
        return value instanceof List<?> list
            ? String.join(ServiceAttribute.LIST_SEPARATOR, list.stream().map(String::valueOf).toList())
            : String.valueOf(value);
    }
}
