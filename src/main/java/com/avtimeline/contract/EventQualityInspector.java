package com.avtimeline.contract;

import com.avtimeline.geometry.GeometryReference;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Data-quality checks that never reject an event. Each finding is reported
 * as a warning by the projection; the event is still applied.
 */
@Component
public class EventQualityInspector {

    private static final Pattern HTTP_URL = Pattern.compile("^https?://\\S+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMBEDDED_URL = Pattern.compile("(https?://|www\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_URL = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR = Pattern.compile("20\\d{2}");
    private static final String GEOMETRY_FILE_SUFFIX = ".geojson";
    private static final List<ServiceAttribute> LINK_ATTRIBUTES = List.of(
        ServiceAttribute.COMPANY_LINK, ServiceAttribute.BOOKING_LINK);

    public List<String> inspect(ServiceEvent event, EventPayload payload) {
        List<String> findings = new ArrayList<>();
        if (payload instanceof EventPayload.Unrecognized) {
            return findings;
        }
        Map<String, String> raw = event.getPayload();
        EventKind kind = event.kind().orElseThrow();

        for (ServiceAttribute link : LINK_ATTRIBUTES) {
            link.rawValue(raw)
                .filter(value -> !HTTP_URL.matcher(value).matches())
                .ifPresent(value -> findings.add(link.key() + " is not an http(s) URL: " + value));
        }
        // update events may carry a free-text note in source_url
        if (kind.isLifecycleStart()) {
            ServiceAttribute.SOURCE_URL.rawValue(raw)
                .filter(value -> !HTTP_URL.matcher(value).matches())
                .ifPresent(value -> findings.add("source_url is not an http(s) URL: " + value));
        }

        ServiceAttribute.NOTES.rawValue(raw)
            .filter(notes -> EMBEDDED_URL.matcher(notes).find())
            .ifPresent(notes -> findings.add("notes contain a URL, columns may be misaligned"));

        ServiceAttribute.EXPECTED_LAUNCH.rawValue(raw).ifPresent(expected -> {
            if (kind != EventKind.SERVICE_TESTING && kind != EventKind.SERVICE_ANNOUNCED) {
                findings.add("expected_launch is only meaningful on service_testing or service_announced");
            } else if (LEADING_URL.matcher(expected).find()) {
                findings.add("expected_launch contains a URL, columns may be misaligned");
            }
        });

        if (kind == EventKind.SERVICE_CREATED && ServiceAttribute.PLATFORM.rawValue(raw).isEmpty()) {
            findings.add("service_created has no platform");
        }

        ServiceAttribute.GEOMETRY.rawValue(raw)
            .filter(file -> !GeometryReference.isInlinePoint(file))
            .ifPresent(file -> inspectGeometryFile(file, event.getServiceId(), findings));

        return findings;
    }

    /** Naming rules for boundary files: {@code <service-id>-<year>-boundary.geojson}. */
    private void inspectGeometryFile(String file, String serviceId, List<String> findings) {
        if (!file.endsWith(GEOMETRY_FILE_SUFFIX)) {
            findings.add("geometry file " + file + " should end with .geojson or be an inline lng,lat point");
            return;
        }
        String name = file.substring(0, file.length() - GEOMETRY_FILE_SUFFIX.length());
        if (serviceId != null && !name.startsWith(serviceId)) {
            findings.add("geometry file " + file + " does not start with service id " + serviceId);
        }
        if (!YEAR.matcher(name).find()) {
            findings.add("geometry file " + file + " does not contain a year");
        }
        if (!name.toLowerCase(Locale.ROOT).contains("boundary")) {
            findings.add("geometry file " + file + " does not follow the <name>-boundary naming");
        }
    }
}
