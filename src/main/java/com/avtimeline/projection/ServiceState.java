package com.avtimeline.projection;

import com.avtimeline.contract.ServiceAttribute;
import com.avtimeline.contract.ServiceStatus;
import com.avtimeline.geometry.GeometryKind;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A complete snapshot of one service's attributes, valid over
 * {@code [effectiveDate, endDate)}. A state with no end date is open.
 * Mutable only while the projection run that created it is replaying.
 */
public class ServiceState {

    private final String serviceId;
    private final String company;
    private final String location;
    private final LocalDate effectiveDate;
    private final int creationPosition;
    private final Map<ServiceAttribute, Object> attributes = new EnumMap<>(ServiceAttribute.class);

    private ServiceStatus status;
    private LocalDate endDate;
    private LocalDate lastUpdated;
    private GeometryKind geometryKind;
    private List<Double> coordinates;
    private Double resolvedArea;

    ServiceState(String serviceId, String company, String location, ServiceStatus status,
                 LocalDate effectiveDate, int creationPosition) {
        this.serviceId = serviceId;
        this.company = company;
        this.location = location;
        this.status = status;
        this.effectiveDate = effectiveDate;
        this.lastUpdated = effectiveDate;
        this.creationPosition = creationPosition;
    }

    /** A new open state starting at {@code date} that inherits every attribute of this one. */
    ServiceState successor(LocalDate date, int position) {
        ServiceState next = new ServiceState(serviceId, company, location, status, date, position);
        next.attributes.putAll(attributes);
        next.geometryKind = geometryKind;
        next.coordinates = coordinates;
        next.resolvedArea = resolvedArea;
        return next;
    }

    /** Synthetic id; the projector never starts two states of a service on one date. */
    public String getId() {
        return serviceId + "-" + effectiveDate;
    }

    public String getServiceId() {
        return serviceId;
    }

    public String getCompany() {
        return company;
    }

    public String getLocation() {
        return location;
    }

    public ServiceStatus getStatus() {
        return status;
    }

    void setStatus(ServiceStatus status) {
        this.status = status;
    }

    public LocalDate getEffectiveDate() {
        return effectiveDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    void close(LocalDate endDate) {
        this.endDate = endDate;
    }

    void reopen() {
        this.endDate = null;
    }

    public boolean isOpen() {
        return endDate == null;
    }

    public LocalDate getLastUpdated() {
        return lastUpdated;
    }

    void touch(LocalDate date) {
        this.lastUpdated = date;
    }

    public Object get(ServiceAttribute attribute) {
        return attributes.get(attribute);
    }

    @SuppressWarnings("unchecked")
    public List<String> getList(ServiceAttribute attribute) {
        Object value = attributes.get(attribute);
        return value instanceof List<?> ? (List<String>) value : null;
    }

    /** Writes one attribute, replacing list values wholesale; returns the previous value. */
    Object put(ServiceAttribute attribute, Object value) {
        return attributes.put(attribute, value);
    }

    public Map<ServiceAttribute, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public GeometryKind getGeometryKind() {
        return geometryKind;
    }

    public List<Double> getCoordinates() {
        return coordinates;
    }

    public Double getResolvedArea() {
        return resolvedArea;
    }

    void setGeometry(GeometryKind kind, List<Double> coordinates, Double resolvedArea) {
        this.geometryKind = kind;
        this.coordinates = coordinates;
        this.resolvedArea = resolvedArea;
    }

    int getCreationPosition() {
        return creationPosition;
    }

    @Override
    public String toString() {
        return "ServiceState{" + getId() + " " + status + " until " + endDate + "}";
    }
}
