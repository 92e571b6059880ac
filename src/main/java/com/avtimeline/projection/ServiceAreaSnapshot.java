package com.avtimeline.projection;

import com.avtimeline.contract.ServiceAttribute;
import com.avtimeline.contract.ServiceStatus;
import com.avtimeline.contract.YesNo;
import com.avtimeline.geometry.GeometryKind;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDate;
import java.util.List;

/** Serialized form of one {@link ServiceState}. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServiceAreaSnapshot(
    String id,
    String serviceId,
    String company,
    String location,
    ServiceStatus status,
    LocalDate effectiveDate,
    LocalDate endDate,
    LocalDate lastUpdated,
    List<String> vehicles,
    List<String> platform,
    YesNo fares,
    YesNo directBooking,
    String serviceModel,
    String supervision,
    String access,
    String fleetPartner,
    String geometryName,
    GeometryKind geometryKind,
    List<Double> coordinates,
    Double areaSquareMiles,
    String companyLink,
    String bookingPlatformLink,
    String sourceUrl,
    String notes,
    String expectedLaunch
) {

    public static ServiceAreaSnapshot of(ServiceState state) {
        return new ServiceAreaSnapshot(
            state.getId(),
            state.getServiceId(),
            state.getCompany(),
            state.getLocation(),
            state.getStatus(),
            state.getEffectiveDate(),
            state.getEndDate(),
            state.getLastUpdated(),
            state.getList(ServiceAttribute.VEHICLES),
            state.getList(ServiceAttribute.PLATFORM),
            (YesNo) state.get(ServiceAttribute.FARES),
            (YesNo) state.get(ServiceAttribute.DIRECT_BOOKING),
            text(state, ServiceAttribute.SERVICE_MODEL),
            text(state, ServiceAttribute.SUPERVISION),
            text(state, ServiceAttribute.ACCESS),
            text(state, ServiceAttribute.FLEET_PARTNER),
            text(state, ServiceAttribute.GEOMETRY),
            state.getGeometryKind(),
            state.getCoordinates(),
            state.getResolvedArea(),
            text(state, ServiceAttribute.COMPANY_LINK),
            text(state, ServiceAttribute.BOOKING_LINK),
            text(state, ServiceAttribute.SOURCE_URL),
            text(state, ServiceAttribute.NOTES),
            text(state, ServiceAttribute.EXPECTED_LAUNCH)
        );
    }

    private static String text(ServiceState state, ServiceAttribute attribute) {
        return (String) state.get(attribute);
    }
}
