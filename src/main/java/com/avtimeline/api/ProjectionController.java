package com.avtimeline.api;

import com.avtimeline.projection.ProjectionService;
import com.avtimeline.projection.ServiceTimelineView;
import com.avtimeline.projection.TimelineDocument;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /v1/timeline
 * GET /v1/timeline/services/{serviceId}
 */
@RestController
@RequestMapping("/v1/timeline")
public class ProjectionController {

    private final ProjectionService projectionService;

    public ProjectionController(ProjectionService projectionService) {
        this.projectionService = projectionService;
    }

    @GetMapping
    public TimelineDocument timeline() {
        return projectionService.buildTimeline();
    }

    @GetMapping("/services/{serviceId}")
    public ServiceTimelineView service(@PathVariable String serviceId) {
        return projectionService.timelineFor(serviceId)
            .orElseThrow(() -> new UnknownServiceException(serviceId));
    }
}
