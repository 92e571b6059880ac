package com.avtimeline.contract;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One recorded change in the service event log.
 *
 * The payload is kept as the sparse attribute map the event source delivers;
 * {@link EventPayload#decode(ServiceEvent)} turns it into the typed variant
 * for the event's kind.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceEvent {

    private Long sequenceNumber;
    private String eventId;
    private String company;
    @JsonAlias("city")
    private String location;
    @JsonAlias("date")
    private LocalDate eventDate;
    private String eventType;
    @JsonAlias("event_data")
    private Map<String, String> payload = new LinkedHashMap<>();

    public ServiceEvent() {
    }

    public static ServiceEvent of(String company, String location, LocalDate eventDate,
                                  String eventType, Map<String, String> payload) {
        ServiceEvent event = new ServiceEvent();
        event.setCompany(company);
        event.setLocation(location);
        event.setEventDate(eventDate);
        event.setEventType(eventType);
        event.setPayload(payload);
        return event;
    }

    public Long getSequenceNumber() {
        return sequenceNumber;
    }

    public void setSequenceNumber(Long sequenceNumber) {
        this.sequenceNumber = sequenceNumber;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getCompany() {
        return company;
    }

    public void setCompany(String company) {
        this.company = company;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public LocalDate getEventDate() {
        return eventDate;
    }

    public void setEventDate(LocalDate eventDate) {
        this.eventDate = eventDate;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public Map<String, String> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, String> payload) {
        this.payload = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }

    /** Normalized service identifier, or null while company or location is missing. */
    @JsonProperty(value = "service_id", access = JsonProperty.Access.READ_ONLY)
    public String getServiceId() {
        if (company == null || company.isBlank() || location == null || location.isBlank()) {
            return null;
        }
        return ServiceIds.of(company, location);
    }

    @JsonIgnore
    public Optional<EventKind> kind() {
        return EventKind.lookup(eventType);
    }

    /** Detached copy, used when the same log is replayed into another store. */
    public ServiceEvent copy() {
        ServiceEvent copy = of(company, location, eventDate, eventType, payload);
        copy.setEventId(eventId);
        copy.setSequenceNumber(sequenceNumber);
        return copy;
    }

    @Override
    public String toString() {
        return "ServiceEvent{" + eventDate + " " + eventType + " " + getServiceId()
            + (sequenceNumber != null ? " #" + sequenceNumber : "") + "}";
    }
}
