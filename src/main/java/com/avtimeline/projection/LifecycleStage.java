package com.avtimeline.projection;

import com.avtimeline.contract.ServiceStatus;

/** Coarse per-service phase that gates which event kinds may be applied. */
public enum LifecycleStage {
    NONE,
    TESTING,
    ANNOUNCED,
    ACTIVE,
    ENDED;

    public static LifecycleStage of(ServiceStatus status) {
        return switch (status) {
            case TESTING -> TESTING;
            case ANNOUNCED -> ANNOUNCED;
            case ACTIVE -> ACTIVE;
            case ENDED -> ENDED;
        };
    }

    /** Testing and announcement may repeat or alternate until the service goes live. */
    public boolean isPreLaunch() {
        return this == NONE || this == TESTING || this == ANNOUNCED;
    }

    /** Single-attribute updates apply only while the service has a live timeline. */
    public boolean acceptsUpdates() {
        return this == TESTING || this == ANNOUNCED || this == ACTIVE;
    }
}
