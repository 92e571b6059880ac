package com.avtimeline.geometry;

import com.fasterxml.jackson.databind.JsonNode;

/** Outcome of resolving one geometry reference. */
public sealed interface GeometryResolution {

    record Resolved(GeometryKind kind, JsonNode geometry, double areaSquareMiles) implements GeometryResolution {}

    record Failed(String reason) implements GeometryResolution {}
}
