package com.avtimeline.geometry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GeometryKind {
    POLYGON("polygon"),
    POINT("point");

    private final String value;

    GeometryKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
