package com.avtimeline.bus;

import com.avtimeline.contract.ServiceEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
public class InMemoryEventStore implements EventStore {

    private final CopyOnWriteArrayList<ServiceEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public synchronized ServiceEvent append(ServiceEvent event) {
        event.setSequenceNumber(sequence.incrementAndGet());
        events.add(event);
        return event;
    }

    @Override
    public List<ServiceEvent> findAll() {
        return List.copyOf(events);
    }

    @Override
    public List<ServiceEvent> query(Optional<String> serviceId, Optional<String> eventType, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        return events.stream()
            .filter(e -> serviceId.map(s -> s.equals(e.getServiceId())).orElse(true))
            .filter(e -> eventType.map(t -> t.equalsIgnoreCase(e.getEventType())).orElse(true))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public boolean existsByEventId(String eventId) {
        return events.stream().anyMatch(e -> eventId.equals(e.getEventId()));
    }

    @Override
    public boolean existsByServiceId(String serviceId) {
        return events.stream().anyMatch(e -> serviceId.equals(e.getServiceId()));
    }

    @Override
    public long getLatestSequence() {
        return sequence.get();
    }

    @Override
    public List<ServiceEvent> queryBySequenceRange(long fromInclusive, long toInclusive, int limit) {
        if (limit <= 0 || toInclusive < fromInclusive) {
            return Collections.emptyList();
        }
        return events.stream()
            .filter(e -> e.getSequenceNumber() != null)
            .filter(e -> e.getSequenceNumber() >= fromInclusive && e.getSequenceNumber() <= toInclusive)
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }
}
