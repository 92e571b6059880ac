package com.avtimeline.bus;

import com.avtimeline.api.DuplicateEventException;
import com.avtimeline.contract.EventContractValidator;
import com.avtimeline.contract.EventPayload;
import com.avtimeline.contract.ServiceEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class EventLogService {

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);

    private final EventContractValidator validator;
    private final EventStore eventStore;

    public EventLogService(EventContractValidator validator, EventStore eventStore) {
        this.validator = validator;
        this.eventStore = eventStore;
    }

    /**
     * Validates and appends one event. Unknown event types are accepted and
     * kept in the log; the projection reports them.
     */
    public synchronized ServiceEvent publish(ServiceEvent event) {
        // Idempotency: a client retry with the same event_id is rejected
        if (event.getEventId() != null && eventStore.existsByEventId(event.getEventId())) {
            throw new DuplicateEventException(event.getEventId());
        }

        EventPayload payload = validator.validate(event);
        if (event.getEventId() == null || event.getEventId().isBlank()) {
            event.setEventId(UUID.randomUUID().toString());
        }
        ServiceEvent appended = eventStore.append(event);
        if (payload instanceof EventPayload.Unrecognized) {
            log.warn("Accepted event {} with unknown type {} for service={}",
                appended.getEventId(), appended.getEventType(), appended.getServiceId());
        } else {
            log.info("Appended {} for service={} on {} seq={}",
                appended.getEventType(), appended.getServiceId(), appended.getEventDate(),
                appended.getSequenceNumber());
        }
        return appended;
    }

    public List<ServiceEvent> query(Optional<String> serviceId, Optional<String> eventType, int limit) {
        return eventStore.query(serviceId, eventType, limit);
    }

    public long latestSequence() {
        return eventStore.getLatestSequence();
    }
}
