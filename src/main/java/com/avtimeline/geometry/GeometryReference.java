package com.avtimeline.geometry;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A geometry reference as written in an event: either the id of a boundary
 * file or an inline point given as {@code longitude,latitude}.
 */
public record GeometryReference(String id, GeometryKind kind, List<Double> coordinates) {

    private static final Pattern INLINE_POINT = Pattern.compile("^-?\\d+(\\.\\d+)?,-?\\d+(\\.\\d+)?$");
    private static final String FILE_SUFFIX = ".geojson";

    public GeometryReference {
        coordinates = coordinates == null ? List.of() : List.copyOf(coordinates);
    }

    /**
     * Parses a raw reference. File ids lose a trailing {@code .geojson}
     * extension so {@code foo-boundary.geojson} and {@code foo-boundary}
     * resolve to the same entry. Blank input yields empty.
     */
    public static Optional<GeometryReference> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (INLINE_POINT.matcher(text).matches()) {
            String[] parts = text.split(",");
            List<Double> lngLat = List.of(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]));
            return Optional.of(new GeometryReference(text, GeometryKind.POINT, lngLat));
        }
        String id = text.endsWith(FILE_SUFFIX) ? text.substring(0, text.length() - FILE_SUFFIX.length()) : text;
        return Optional.of(new GeometryReference(id, GeometryKind.POLYGON, List.of()));
    }

    public static boolean isInlinePoint(String raw) {
        return raw != null && INLINE_POINT.matcher(raw.trim()).matches();
    }

    public boolean isPoint() {
        return kind == GeometryKind.POINT;
    }
}
