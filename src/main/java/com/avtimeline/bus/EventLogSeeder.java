package com.avtimeline.bus;

import com.avtimeline.api.DuplicateEventException;
import com.avtimeline.config.TimelineProperties;
import com.avtimeline.contract.ContractViolationException;
import com.avtimeline.contract.ServiceEvent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Loads the configured event log into the store once the application is up.
 * A missing or unreadable file stops startup; individual events that break
 * the contract are skipped with a warning.
 */
@Component
public class EventLogSeeder {

    private static final Logger log = LoggerFactory.getLogger(EventLogSeeder.class);

    private final EventLogService eventLogService;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final TimelineProperties properties;

    public EventLogSeeder(EventLogService eventLogService, ObjectMapper objectMapper,
                          ResourceLoader resourceLoader, TimelineProperties properties) {
        this.eventLogService = eventLogService;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        String location = properties.events().seed();
        if (location == null || location.isBlank()) {
            return;
        }
        int loaded = load(resourceLoader.getResource(location));
        log.info("Seeded {} events from {}", loaded, location);
    }

    int load(Resource resource) {
        List<ServiceEvent> events;
        try (InputStream in = resource.getInputStream()) {
            events = objectMapper.readValue(in, new TypeReference<List<ServiceEvent>>() { });
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read event seed " + resource.getDescription(), ex);
        }
        int loaded = 0;
        for (ServiceEvent event : events) {
            try {
                eventLogService.publish(event);
                loaded++;
            } catch (ContractViolationException | DuplicateEventException ex) {
                log.warn("Skipping seed event {}: {}", event, ex.getMessage());
            }
        }
        return loaded;
    }
}
