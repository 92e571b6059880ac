package com.avtimeline.contract;

import com.avtimeline.geometry.GeometryReference;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The logical attributes a service state carries besides its identity.
 *
 * Each attribute knows the payload keys it is read from (the first key is the
 * canonical one, the rest are names used by older event payloads) and how a
 * raw payload string is turned into its value.
 */
public enum ServiceAttribute {
    VEHICLES(ValueType.LIST, "vehicles", "vehicle_types", "new_vehicle_types"),
    PLATFORM(ValueType.LIST, "platform", "new_platform"),
    FARES(ValueType.YES_NO, "fares", "new_fares"),
    DIRECT_BOOKING(ValueType.YES_NO, "direct_booking", "new_direct_booking"),
    SERVICE_MODEL(ValueType.TEXT, "service_model", "new_service_model"),
    SUPERVISION(ValueType.TEXT, "supervision", "new_supervision"),
    ACCESS(ValueType.TEXT, "access", "new_access"),
    FLEET_PARTNER(ValueType.TEXT, "fleet_partner", "new_fleet_partner"),
    GEOMETRY(ValueType.GEOMETRY_REF, "geometry_file", "geometry_name", "new_geometry_name"),
    COMPANY_LINK(ValueType.TEXT, "company_link"),
    BOOKING_LINK(ValueType.TEXT, "booking_platform_link"),
    SOURCE_URL(ValueType.TEXT, "source_url", "event_url"),
    NOTES(ValueType.TEXT, "notes"),
    EXPECTED_LAUNCH(ValueType.TEXT, "expected_launch");

    public static final String LIST_SEPARATOR = ";";

    public enum ValueType { TEXT, LIST, YES_NO, GEOMETRY_REF }

    private final ValueType valueType;
    private final List<String> payloadKeys;

    ServiceAttribute(ValueType valueType, String... payloadKeys) {
        this.valueType = valueType;
        this.payloadKeys = List.of(payloadKeys);
    }

    public boolean isMultiValue() {
        return valueType == ValueType.LIST;
    }

    @JsonValue
    public String key() {
        return payloadKeys.get(0);
    }

    /**
     * Returns the first non-blank raw value found under any of this
     * attribute's payload keys.
     */
    public Optional<String> rawValue(Map<String, String> payload) {
        if (payload == null) {
            return Optional.empty();
        }
        for (String key : payloadKeys) {
            String value = payload.get(key);
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Parses a raw payload string into the attribute's value: a trimmed
     * string, a {@link YesNo}, a normalized geometry reference id, or for
     * multi-value attributes an ordered list split on {@value #LIST_SEPARATOR}
     * with blank components dropped.
     */
    public Object parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ContractViolationException(key() + " value is required");
        }
        return switch (valueType) {
            case TEXT -> raw.trim();
            case GEOMETRY_REF -> GeometryReference.parse(raw).orElseThrow().id();
            case YES_NO -> YesNo.fromValue(raw);
            case LIST -> {
                List<String> items = Arrays.stream(raw.split(LIST_SEPARATOR))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
                if (items.isEmpty()) {
                    throw new ContractViolationException(key() + " must contain at least one value");
                }
                yield items;
            }
        };
    }
}
