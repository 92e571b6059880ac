package com.avtimeline.geometry;

/**
 * Turns a geometry reference into a shape and its area. Implementations
 * report failure as {@link GeometryResolution.Failed} rather than throwing;
 * callers still treat any thrown exception as a failure.
 */
public interface GeometryResolver {

    GeometryResolution resolve(GeometryReference reference);
}
