package com.avtimeline.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Boolean-like flag used by the fares and direct booking attributes.
 */
public enum YesNo {
    YES("Yes"),
    NO("No");

    private final String value;

    YesNo(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static YesNo fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(trimmed))
            .findFirst()
            .orElseThrow(() -> new ContractViolationException("expected Yes or No, got: " + raw));
    }
}
