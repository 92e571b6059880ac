package com.avtimeline.contract;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class EventContractValidator {

    /**
     * Checks the structural contract of one event and decodes its payload.
     *
     * @return the typed payload; {@link EventPayload.Unrecognized} for event
     *         types outside the known set
     * @throws ContractViolationException when the event cannot be placed in
     *         any service timeline
     */
    public EventPayload validate(ServiceEvent event) {
        requireNonNull(event, "event cannot be null");
        requireString(event.getCompany(), "company is required");
        requireString(event.getLocation(), "location is required");
        requireNonNull(event.getEventDate(), "event_date is required");
        requireString(event.getEventType(), "event_type is required");

        if (event.getEventId() != null && !event.getEventId().isBlank()) {
            requireUuid(event.getEventId(), "event_id must be a valid UUID when provided");
        }
        if (event.getPayload() == null) {
            throw new ContractViolationException("payload is required");
        }
        return EventPayload.decode(event);
    }

    private String requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
        return value;
    }

    private void requireNonNull(Object value, String message) {
        if (value == null) {
            throw new ContractViolationException(message);
        }
    }

    private void requireUuid(String value, String message) {
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException ex) {
            throw new ContractViolationException(message);
        }
    }
}
