package com.avtimeline.geometry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves boundary-file ids against a JSON catalog of pre-measured service
 * areas. The catalog has the form
 * <pre>
 * { "geometries": [ { "geometry_name": "...", "display_name": "...",
 *                     "area_square_miles": 12.5, "geojson": { ... } } ] }
 * </pre>
 * Inline points resolve without the catalog and have no area.
 */
public class CatalogGeometryResolver implements GeometryResolver {

    private static final Logger log = LoggerFactory.getLogger(CatalogGeometryResolver.class);

    private final ObjectMapper objectMapper;
    private final Map<String, JsonNode> entries;

    public CatalogGeometryResolver(ObjectMapper objectMapper, Resource catalog) {
        this.objectMapper = objectMapper;
        this.entries = catalog == null ? Map.of() : load(catalog);
    }

    private Map<String, JsonNode> load(Resource catalog) {
        try (InputStream in = catalog.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            Map<String, JsonNode> loaded = new LinkedHashMap<>();
            for (JsonNode entry : root.path("geometries")) {
                String name = entry.path("geometry_name").asText("");
                if (!name.isBlank()) {
                    loaded.put(GeometryReference.parse(name).orElseThrow().id(), entry);
                }
            }
            log.info("Loaded geometry catalog {} with {} entries", catalog.getDescription(), loaded.size());
            return Collections.unmodifiableMap(loaded);
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read geometry catalog " + catalog.getDescription(), ex);
        }
    }

    @Override
    public GeometryResolution resolve(GeometryReference reference) {
        if (reference.isPoint()) {
            ObjectNode point = objectMapper.createObjectNode();
            point.put("type", "Point");
            ArrayNode coordinates = point.putArray("coordinates");
            reference.coordinates().forEach(coordinates::add);
            return new GeometryResolution.Resolved(GeometryKind.POINT, point, 0.0);
        }
        JsonNode entry = entries.get(reference.id());
        if (entry == null) {
            return new GeometryResolution.Failed("geometry " + reference.id() + " not found in catalog");
        }
        JsonNode area = entry.get("area_square_miles");
        if (area == null || !area.isNumber()) {
            return new GeometryResolution.Failed("geometry " + reference.id() + " has no area_square_miles");
        }
        return new GeometryResolution.Resolved(GeometryKind.POLYGON, entry.path("geojson"), area.asDouble());
    }

    int size() {
        return entries.size();
    }
}
