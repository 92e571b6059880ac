package com.avtimeline.config;

import com.avtimeline.contract.EventContractValidator;
import com.avtimeline.contract.EventQualityInspector;
import com.avtimeline.geometry.CatalogGeometryResolver;
import com.avtimeline.geometry.GeometryPrefetcher;
import com.avtimeline.geometry.GeometryResolver;
import com.avtimeline.projection.ServiceTimelineProjector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class TimelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GeometryResolver geometryResolver(ObjectMapper objectMapper, ResourceLoader resourceLoader,
                                             TimelineProperties properties) {
        String catalog = properties.geometry().catalog();
        return new CatalogGeometryResolver(objectMapper,
            catalog == null || catalog.isBlank() ? null : resourceLoader.getResource(catalog));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService timelineExecutor(TimelineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.geometry().prefetchConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, "timeline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public GeometryPrefetcher geometryPrefetcher(GeometryResolver geometryResolver, ExecutorService timelineExecutor,
                                                 TimelineProperties properties) {
        return new GeometryPrefetcher(geometryResolver, timelineExecutor, properties.geometry().prefetchConcurrency());
    }

    @Bean
    public ServiceTimelineProjector serviceTimelineProjector(EventContractValidator validator,
                                                             EventQualityInspector inspector,
                                                             ExecutorService timelineExecutor,
                                                             TimelineProperties properties) {
        return new ServiceTimelineProjector(validator, inspector, timelineExecutor,
            properties.projection().parallel());
    }
}
