package com.avtimeline.api;

import com.avtimeline.integration.FixedClockConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(FixedClockConfiguration.class)
class TimelineApiTest {

    @Autowired MockMvc mvc;

    @Nested
    @DisplayName("POST /v1/events")
    class Publish {

        @Test
        void validEvent_isAccepted() throws Exception {
            mvc.perform(post("/v1/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"company": "Hooli", "city": "Palo Alto", "event_date": "2024-07-01",
                         "event_type": "service_testing", "payload": {"platform": "Hooli Go"}}
                        """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.service_id").value("hooli-palo-alto"))
                .andExpect(jsonPath("$.event_id").isNotEmpty());
        }

        @Test
        void missingIdentity_isContractViolation() throws Exception {
            mvc.perform(post("/v1/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"location": "Palo Alto", "event_date": "2024-07-01", "event_type": "service_testing"}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("CONTRACT_VIOLATION"))
                .andExpect(jsonPath("$.message").value("company is required"))
                .andExpect(jsonPath("$.timestamp").value("2025-06-30T00:00:00Z"));
        }

        @Test
        void duplicateEventId_isConflict() throws Exception {
            String body = """
                {"event_id": "%s", "company": "Hooli", "location": "Mountain View",
                 "event_date": "2024-07-01", "event_type": "service_announced", "payload": {}}
                """.formatted(UUID.randomUUID());
            mvc.perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isAccepted());
            mvc.perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DUPLICATE_EVENT"));
        }

        @Test
        void malformedJson_isBadRequest() throws Exception {
            mvc.perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON).content("{\"event_date\": \"soon\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }
    }

    @Nested
    @DisplayName("GET endpoints")
    class Read {

        @Test
        void events_filterByService() throws Exception {
            mvc.perform(get("/v1/events").param("serviceId", "acme-springfield"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[0].event_type").value("service_testing"))
                .andExpect(jsonPath("$[0].service_id").value("acme-springfield"));
        }

        @Test
        void serviceTimeline_isServedAsSnakeCase() throws Exception {
            mvc.perform(get("/v1/timeline/services/acme-springfield"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service_id").value("acme-springfield"))
                .andExpect(jsonPath("$.states", hasSize(3)))
                .andExpect(jsonPath("$.states[1].id").value("acme-springfield-2024-03-01"))
                .andExpect(jsonPath("$.states[1].status").value("active"))
                .andExpect(jsonPath("$.states[1].effective_date").value("2024-03-01"))
                .andExpect(jsonPath("$.states[2].fares").value("Yes"));
        }

        @Test
        void unknownService_isNotFound() throws Exception {
            mvc.perform(get("/v1/timeline/services/nobody-nowhere"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("SERVICE_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("no events recorded for service nobody-nowhere"))
                .andExpect(jsonPath("$.timestamp").value("2025-06-30T00:00:00Z"));
        }

        @Test
        void timeline_hasMetadataEnvelope() throws Exception {
            mvc.perform(get("/v1/timeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metadata.generated_at").value("2025-06-30T00:00:00Z"))
                .andExpect(jsonPath("$.export_stats.total_events").isNumber())
                .andExpect(jsonPath("$.date_range.start").value("2024-01-01"))
                .andExpect(jsonPath("$.service_areas").isArray())
                .andExpect(jsonPath("$.diagnostics.error_count").value(0));
        }
    }
}
