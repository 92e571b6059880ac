package com.avtimeline.contract;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The closed set of event kinds the projection understands.
 *
 * Lifecycle kinds name the status they move a service to. Update kinds name
 * the single attribute they write; adding an update kind without a target
 * attribute does not compile.
 */
public enum EventKind {
    SERVICE_TESTING("service_testing", ServiceStatus.TESTING),
    SERVICE_ANNOUNCED("service_announced", ServiceStatus.ANNOUNCED),
    SERVICE_CREATED("service_created", ServiceStatus.ACTIVE),
    SERVICE_ENDED("service_ended", ServiceStatus.ENDED),

    FARES_POLICY_CHANGED("fares_policy_changed", ServiceAttribute.FARES),
    ACCESS_POLICY_CHANGED("access_policy_changed", ServiceAttribute.ACCESS),
    VEHICLE_TYPES_UPDATED("vehicle_types_updated", ServiceAttribute.VEHICLES),
    PLATFORM_UPDATED("platform_updated", ServiceAttribute.PLATFORM),
    SUPERVISION_UPDATED("supervision_updated", ServiceAttribute.SUPERVISION),
    SERVICE_MODEL_UPDATED("service_model_updated", ServiceAttribute.SERVICE_MODEL),
    FLEET_PARTNER_CHANGED("fleet_partner_changed", ServiceAttribute.FLEET_PARTNER),
    DIRECT_BOOKING_UPDATED("direct_booking_updated", ServiceAttribute.DIRECT_BOOKING),
    GEOMETRY_UPDATED("geometry_updated", ServiceAttribute.GEOMETRY, "Service Area Change");

    private final String value;
    private final EventCategory category;
    private final ServiceStatus targetStatus;
    private final ServiceAttribute targetAttribute;
    private final List<String> aliases;

    EventKind(String value, ServiceStatus targetStatus) {
        this.value = value;
        this.category = targetStatus == ServiceStatus.ENDED
            ? EventCategory.TERMINATION
            : EventCategory.LIFECYCLE_START;
        this.targetStatus = targetStatus;
        this.targetAttribute = null;
        this.aliases = List.of();
    }

    EventKind(String value, ServiceAttribute targetAttribute, String... aliases) {
        this.value = value;
        this.category = EventCategory.ATTRIBUTE_UPDATE;
        this.targetStatus = null;
        this.targetAttribute = targetAttribute;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public EventCategory category() {
        return category;
    }

    /** Status reached by a lifecycle or termination kind; null for updates. */
    public ServiceStatus targetStatus() {
        return targetStatus;
    }

    /** Attribute written by an update kind; null for lifecycle kinds. */
    public ServiceAttribute targetAttribute() {
        return targetAttribute;
    }

    public boolean isLifecycleStart() {
        return category == EventCategory.LIFECYCLE_START;
    }

    /**
     * Resolves a raw event type. Unknown types are not an error here: the
     * projection keeps them in the raw log and reports a warning.
     */
    public static Optional<EventKind> lookup(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
            .filter(k -> k.value.equalsIgnoreCase(trimmed)
                || k.aliases.stream().anyMatch(a -> a.equalsIgnoreCase(trimmed)))
            .findFirst();
    }
}
