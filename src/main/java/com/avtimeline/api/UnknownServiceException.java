package com.avtimeline.api;

/**
 * Thrown when a timeline is requested for a service id the event log never
 * mentions.
 */
public class UnknownServiceException extends RuntimeException {

    public UnknownServiceException(String serviceId) {
        super("no events recorded for service " + serviceId);
    }
}
