package com.avtimeline.geometry;

import java.util.Collections;
import java.util.TreeMap;
import java.util.Map;
import java.util.Optional;

/** Prefetched resolutions for one projection run, keyed and ordered by reference id. */
public final class GeometryLookup {

    private static final GeometryLookup EMPTY = new GeometryLookup(Map.of());

    private final Map<String, GeometryResolution> resolutions;

    public GeometryLookup(Map<String, GeometryResolution> resolutions) {
        this.resolutions = Collections.unmodifiableMap(new TreeMap<>(resolutions));
    }

    public static GeometryLookup empty() {
        return EMPTY;
    }

    public Optional<GeometryResolution> find(GeometryReference reference) {
        return Optional.ofNullable(resolutions.get(reference.id()));
    }

    public Map<String, GeometryResolution> asMap() {
        return resolutions;
    }

    public int size() {
        return resolutions.size();
    }

    public long resolvedCount() {
        return resolutions.values().stream().filter(r -> r instanceof GeometryResolution.Resolved).count();
    }

    public long failedCount() {
        return resolutions.values().stream().filter(r -> r instanceof GeometryResolution.Failed).count();
    }
}
