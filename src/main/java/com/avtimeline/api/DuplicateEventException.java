package com.avtimeline.api;

/**
 * Thrown when a client publishes an event whose event_id is already in the
 * log.
 */
public class DuplicateEventException extends RuntimeException {

    public DuplicateEventException(String eventId) {
        super("event_id already exists: " + eventId);
    }
}
