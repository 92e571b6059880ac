package com.avtimeline.bus;

import com.avtimeline.contract.ServiceEvent;

import java.util.List;
import java.util.Optional;

/** Append-only service event log. Events come back in append order. */
public interface EventStore {
    ServiceEvent append(ServiceEvent event);

    List<ServiceEvent> findAll();

    List<ServiceEvent> query(Optional<String> serviceId, Optional<String> eventType, int limit);

    boolean existsByEventId(String eventId);

    boolean existsByServiceId(String serviceId);

    long getLatestSequence();

    List<ServiceEvent> queryBySequenceRange(long fromInclusive, long toInclusive, int limit);
}
