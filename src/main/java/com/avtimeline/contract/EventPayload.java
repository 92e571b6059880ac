package com.avtimeline.contract;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed view of a service event's payload, one variant per event category.
 * Each variant carries only the fields that category may set.
 */
public sealed interface EventPayload {

    /** service_testing / service_announced / service_created: any number of attributes. */
    record Lifecycle(EventKind kind, ServiceStatus status,
                     Map<ServiceAttribute, Object> attributes) implements EventPayload {
        public Lifecycle {
            attributes = Collections.unmodifiableMap(new EnumMap<>(attributes));
        }
    }

    /** A single-attribute update; {@code value} is already parsed for the attribute. */
    record AttributeChange(EventKind kind, ServiceAttribute attribute, Object value) implements EventPayload {}

    /** service_ended. */
    record Termination(EventKind kind) implements EventPayload {}

    /** An event type outside the closed set of kinds. */
    record Unrecognized(String eventType) implements EventPayload {}

    /**
     * Decodes the raw payload of an event.
     *
     * @throws ContractViolationException if an update carries no value for its
     *         attribute or a value cannot be parsed for its attribute
     */
    static EventPayload decode(ServiceEvent event) {
        EventKind kind = event.kind().orElse(null);
        if (kind == null) {
            return new Unrecognized(event.getEventType());
        }
        Map<String, String> raw = event.getPayload();
        return switch (kind.category()) {
            case LIFECYCLE_START -> {
                Map<ServiceAttribute, Object> attributes = new EnumMap<>(ServiceAttribute.class);
                for (ServiceAttribute attribute : ServiceAttribute.values()) {
                    attribute.rawValue(raw).ifPresent(v -> attributes.put(attribute, attribute.parse(v)));
                }
                yield new Lifecycle(kind, kind.targetStatus(), attributes);
            }
            case TERMINATION -> new Termination(kind);
            case ATTRIBUTE_UPDATE -> {
                ServiceAttribute attribute = kind.targetAttribute();
                String value = attribute.rawValue(raw).orElseThrow(() -> new ContractViolationException(
                    kind.getValue() + " event has no " + attribute.key() + " value"));
                yield new AttributeChange(kind, attribute, attribute.parse(value));
            }
        };
    }
}
