package com.avtimeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "timeline")
public record TimelineProperties(
    @DefaultValue Geometry geometry,
    @DefaultValue Events events,
    @DefaultValue Projection projection
) {

    /**
     * @param catalog resource location of the geometry catalog; no catalog
     *                means only inline points resolve
     * @param prefetchConcurrency references resolved at once
     */
    public record Geometry(String catalog, @DefaultValue("8") int prefetchConcurrency) {}

    /** @param seed resource location of a JSON event log loaded at startup */
    public record Events(String seed) {}

    /** @param parallel replay services concurrently */
    public record Projection(@DefaultValue("false") boolean parallel) {}
}
