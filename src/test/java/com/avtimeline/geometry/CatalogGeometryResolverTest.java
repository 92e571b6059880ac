package com.avtimeline.geometry;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CatalogGeometryResolverTest {

    private CatalogGeometryResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CatalogGeometryResolver(new ObjectMapper(),
            new ClassPathResource("fixtures/geometry-catalog.json"));
    }

    @Test
    void catalogEntry_resolvesWithArea() {
        GeometryResolution resolution = resolver.resolve(ref("acme-springfield-2024-boundary.geojson"));
        GeometryResolution.Resolved resolved = assertInstanceOf(GeometryResolution.Resolved.class, resolution);
        assertEquals(GeometryKind.POLYGON, resolved.kind());
        assertEquals(42.5, resolved.areaSquareMiles());
        assertEquals("Polygon", resolved.geometry().path("type").asText());
    }

    @Test
    void catalogNames_areNormalizedLikeReferences() {
        assertEquals(3, resolver.size());
        assertInstanceOf(GeometryResolution.Resolved.class, resolver.resolve(ref("acme-springfield-2025-boundary")));
    }

    @Test
    void unknownId_fails() {
        GeometryResolution.Failed failed = assertInstanceOf(GeometryResolution.Failed.class,
            resolver.resolve(ref("nowhere-boundary")));
        assertTrue(failed.reason().contains("nowhere-boundary"));
    }

    @Test
    void entryWithoutArea_fails() {
        GeometryResolution.Failed failed = assertInstanceOf(GeometryResolution.Failed.class,
            resolver.resolve(ref("unmeasured-boundary")));
        assertTrue(failed.reason().contains("area_square_miles"));
    }

    @Test
    void inlinePoint_resolvesWithoutCatalog() {
        CatalogGeometryResolver empty = new CatalogGeometryResolver(new ObjectMapper(), null);
        GeometryResolution.Resolved resolved = assertInstanceOf(GeometryResolution.Resolved.class,
            empty.resolve(ref("-115.17,36.11")));
        assertEquals(GeometryKind.POINT, resolved.kind());
        assertEquals(0.0, resolved.areaSquareMiles());
        assertEquals(-115.17, resolved.geometry().path("coordinates").get(0).asDouble());
    }

    @Test
    void unreadableCatalog_failsFast() {
        ByteArrayResource broken = new ByteArrayResource("{ not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(IllegalStateException.class, () -> new CatalogGeometryResolver(new ObjectMapper(), broken));
        assertThrows(IllegalStateException.class, () -> new CatalogGeometryResolver(new ObjectMapper(),
            new ClassPathResource("fixtures/does-not-exist.json")));
    }

    private static GeometryReference ref(String raw) {
        return GeometryReference.parse(raw).orElseThrow();
    }
}
