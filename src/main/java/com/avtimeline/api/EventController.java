package com.avtimeline.api;

import com.avtimeline.bus.EventLogService;
import com.avtimeline.contract.ServiceEvent;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/v1/events")
public class EventController {

    private final EventLogService eventLogService;

    public EventController(EventLogService eventLogService) {
        this.eventLogService = eventLogService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, Object> publish(@RequestBody ServiceEvent event) {
        ServiceEvent published = eventLogService.publish(event);
        return Map.of(
            "status", "accepted",
            "event_id", published.getEventId(),
            "service_id", published.getServiceId(),
            "sequence_number", published.getSequenceNumber()
        );
    }

    @GetMapping
    public List<ServiceEvent> query(@RequestParam(required = false) String serviceId,
                                    @RequestParam(required = false) String eventType,
                                    @RequestParam(defaultValue = "100") int limit) {
        return eventLogService.query(
            Optional.ofNullable(serviceId),
            Optional.ofNullable(eventType),
            Math.min(limit, 1000)
        );
    }
}
