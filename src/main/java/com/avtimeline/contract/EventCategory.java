package com.avtimeline.contract;

public enum EventCategory {
    LIFECYCLE_START,
    TERMINATION,
    ATTRIBUTE_UPDATE
}
