package com.avtimeline.geometry;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeometryReferenceTest {

    @Test
    void inlinePoint_isLongitudeThenLatitude() {
        GeometryReference ref = GeometryReference.parse(" -122.4194,37.7749 ").orElseThrow();
        assertTrue(ref.isPoint());
        assertEquals(GeometryKind.POINT, ref.kind());
        assertEquals(List.of(-122.4194, 37.7749), ref.coordinates());
        assertEquals("-122.4194,37.7749", ref.id());
    }

    @Test
    void fileId_losesGeojsonExtension() {
        GeometryReference ref = GeometryReference.parse("sf-2024-boundary.geojson").orElseThrow();
        assertFalse(ref.isPoint());
        assertEquals("sf-2024-boundary", ref.id());
        assertTrue(ref.coordinates().isEmpty());
        assertEquals(ref, GeometryReference.parse("sf-2024-boundary").orElseThrow());
    }

    @Test
    void nearMissPoints_areFileIds() {
        assertFalse(GeometryReference.isInlinePoint("-122.4, 37.7"));
        assertFalse(GeometryReference.isInlinePoint("122.,37"));
        assertTrue(GeometryReference.isInlinePoint("122,37"));
        assertEquals(GeometryKind.POLYGON, GeometryReference.parse("-122.4, 37.7").orElseThrow().kind());
    }

    @Test
    void blank_isEmpty() {
        assertTrue(GeometryReference.parse("  ").isEmpty());
        assertTrue(GeometryReference.parse(null).isEmpty());
    }
}
