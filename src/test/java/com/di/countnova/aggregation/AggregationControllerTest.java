package com.di.countnova.aggregation;

import com.di.countnova.config.AggregationProperties;
import com.di.countnova.config.DimensionRange;
import com.di.countnova.exception.GlobalExceptionHandler;
import com.di.countnova.store.InMemoryIndexStore;
import com.di.countnova.util.MetricsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("AggregationController Tests")
class AggregationControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AggregationProperties properties = new AggregationProperties();
        properties.setPoolSize(2);
        properties.setQueueCapacity(4);
        properties.setBaselineDimension(new DimensionRange("cab_type", 0, 1));

        InMemoryIndexStore store = new InMemoryIndexStore(sel -> sel.containsKey("cab_type") ? 3L : 1L);
        MetricsCollector metrics = new MetricsCollector(new SimpleMeterRegistry());
        AggregationService service = new AggregationService(new BaselineEstimator(store, metrics),
                new CountWorkerPool(store, metrics), properties, metrics);

        mockMvc = MockMvcBuilders.standaloneSetup(new AggregationController(service))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should run an ad-hoc count sorted by the first dimension")
    void testCount() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": ["
                                + "{\"name\": \"passenger_count\", \"from\": 1, \"to\": 3},"
                                + "{\"name\": \"pickup_year\", \"from\": 2009, \"to\": 2010}],"
                                + " \"thresholdFraction\": 1.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows.length()").value(6))
                .andExpect(jsonPath("$.rows[0].passenger_count").value(1))
                .andExpect(jsonPath("$.numProfiles").value(6))
                .andExpect(jsonPath("$.stoppedEarly").value(false))
                .andExpect(jsonPath("$.description").value("ad-hoc grouped count"));
    }

    @Test
    @DisplayName("Should reject a request without dimensions")
    void testMissingDimensions() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should reject an out-of-range threshold")
    void testInvalidThreshold() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": [{\"name\": \"pickup_year\", \"from\": 2009, \"to\": 2010}],"
                                + " \"thresholdFraction\": 2.0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Should reject a pool size above the limit")
    void testPoolSizeLimit() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": [{\"name\": \"pickup_year\", \"from\": 2009, \"to\": 2010}],"
                                + " \"poolSize\": 100000}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.poolSize").exists());
    }

    @Test
    @DisplayName("Should reject an oversized dimension range without building it")
    void testRangeWidthLimit() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": [{\"name\": \"d\", \"from\": 0, \"to\": 30000000}]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should reject an unknown sort dimension as a configuration error")
    void testUnknownSortDimension() throws Exception {
        mockMvc.perform(post("/api/aggregation/count")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dimensions\": [{\"name\": \"pickup_year\", \"from\": 2009, \"to\": 2010}],"
                                + " \"sortDimension\": \"dist_miles\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCategory").value("CONFIGURATION_ERROR"));
    }

    @Test
    @DisplayName("Should expose and reset the cached baseline")
    void testBaseline() throws Exception {
        mockMvc.perform(get("/api/aggregation/baseline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.baseline").value(6));
        mockMvc.perform(delete("/api/aggregation/baseline"))
                .andExpect(status().isNoContent());
    }
}
