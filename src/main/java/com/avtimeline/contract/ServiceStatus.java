package com.avtimeline.contract;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ServiceStatus {
    TESTING("testing"),
    ANNOUNCED("announced"),
    ACTIVE("active"),
    ENDED("ended");

    private final String value;

    ServiceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
