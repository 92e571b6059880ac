package com.avtimeline.bus;

import com.avtimeline.api.DuplicateEventException;
import com.avtimeline.contract.ContractViolationException;
import com.avtimeline.contract.EventContractValidator;
import com.avtimeline.contract.ServiceEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EventLogServiceTest {

    private InMemoryEventStore store;
    private EventLogService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        service = new EventLogService(new EventContractValidator(), store);
    }

    @Nested
    @DisplayName("Publishing")
    class Publishing {

        @Test
        void append_assignsSequenceAndEventId() {
            ServiceEvent first = service.publish(event("service_testing", Map.of("platform", "Zoox")));
            ServiceEvent second = service.publish(event("service_created", Map.of()));

            assertEquals(1L, first.getSequenceNumber());
            assertEquals(2L, second.getSequenceNumber());
            assertDoesNotThrow(() -> UUID.fromString(first.getEventId()));
            assertEquals(2, service.latestSequence());
        }

        @Test
        void duplicateEventId_isRejected() {
            String id = UUID.randomUUID().toString();
            ServiceEvent original = event("service_testing", Map.of());
            original.setEventId(id);
            service.publish(original);

            ServiceEvent retry = event("service_testing", Map.of());
            retry.setEventId(id);
            assertThrows(DuplicateEventException.class, () -> service.publish(retry));
            assertEquals(1, store.findAll().size());
        }

        @Test
        void contractViolation_isNotAppended() {
            assertThrows(ContractViolationException.class,
                () -> service.publish(event("fares_policy_changed", Map.of("fares", "perhaps"))));
            assertEquals(0, store.getLatestSequence());
        }

        @Test
        void unknownEventType_isKept() {
            service.publish(event("ride_count_reported", Map.of("rides", "12")));
            assertEquals(1, store.findAll().size());
        }
    }

    @Nested
    @DisplayName("Querying")
    class Querying {

        @Test
        void query_filtersByServiceAndType() {
            service.publish(event("service_testing", Map.of()));
            service.publish(ServiceEvent.of("Zoox", "Las Vegas", LocalDate.of(2024, 1, 1), "service_testing", Map.of()));
            service.publish(event("service_created", Map.of()));

            assertEquals(2, service.query(Optional.of("waymo-phoenix"), Optional.empty(), 10).size());
            assertEquals(1, service.query(Optional.of("waymo-phoenix"), Optional.of("SERVICE_CREATED"), 10).size());
            assertEquals(1, service.query(Optional.empty(), Optional.empty(), 1).size());
            assertTrue(service.query(Optional.empty(), Optional.empty(), 0).isEmpty());
            assertTrue(store.existsByServiceId("zoox-las-vegas"));
            assertFalse(store.existsByServiceId("cruise-austin"));
        }

        @Test
        void sequenceRange_isInclusive() {
            for (int i = 0; i < 5; i++) {
                service.publish(event("service_testing", Map.of()));
            }
            List<ServiceEvent> range = store.queryBySequenceRange(2, 4, 100);
            assertEquals(List.of(2L, 3L, 4L), range.stream().map(ServiceEvent::getSequenceNumber).toList());
            assertTrue(store.queryBySequenceRange(4, 2, 100).isEmpty());
        }
    }

    private static ServiceEvent event(String type, Map<String, String> payload) {
        return ServiceEvent.of("Waymo", "Phoenix", LocalDate.of(2024, 1, 1), type, payload);
    }
}
