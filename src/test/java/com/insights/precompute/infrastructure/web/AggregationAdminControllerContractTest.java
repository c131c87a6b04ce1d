package com.insights.precompute.infrastructure.web;

import com.insights.precompute.application.AggregationBackfill;
import com.insights.precompute.application.AggregationService;
import com.insights.precompute.application.BackfillResult;
import com.insights.precompute.domain.exception.AggregationNotRegisteredException;
import com.insights.precompute.domain.exception.AggregationValidationException;
import com.insights.precompute.domain.exception.RecordSourceException;
import com.insights.precompute.domain.model.AggregationEnvelope;
import com.insights.precompute.domain.model.AggregationSource;
import com.insights.precompute.infrastructure.cache.AggregationCacheStrategy;
import com.insights.precompute.infrastructure.cache.CacheStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AggregationAdminController.class)
class AggregationAdminControllerContractTest {

    private static final Instant COMPUTED_AT = Instant.parse("2024-05-15T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AggregationService aggregationService;

    @MockBean
    private AggregationBackfill backfill;

    @MockBean
    private AggregationCacheStrategy cache;

    @Test
    void shouldRefreshAndReturnEnvelope() throws Exception {
        // Given
        AggregationEnvelope<Object> envelope = new AggregationEnvelope<>(
                Map.of("totalVideos", 42),
                COMPUTED_AT,
                COMPUTED_AT.plusSeconds(900),
                1,
                Map.of(),
                AggregationSource.COMPUTED
        );
        when(aggregationService.refreshAggregation(any())).thenReturn(envelope);

        // When & Then
        mockMvc.perform(post("/admin/aggregations/kpi/refresh")
                        .param("userId", "user-1")
                        .param("timeframe", "YTD")
                        .param("topics", "Tech", "Music"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.data.totalVideos", is(42)))
                .andExpect(jsonPath("$.source", is("computed")))
                .andExpect(jsonPath("$.version", is(1)))
                .andExpect(jsonPath("$.computedAt").exists());

        verify(aggregationService).refreshAggregation(argThat(request ->
                request.userId().equals("user-1")
                        && request.type().equals("kpi")
                        && request.filters().timeframe().equals("YTD")
                        && request.filters().product().equals("All")
                        && request.filters().topics().equals(List.of("Tech", "Music"))
                        && request.filters().channels() == null));
    }

    @Test
    void shouldReturnNotFoundForUnregisteredType() throws Exception {
        // Given
        when(aggregationService.refreshAggregation(any()))
                .thenThrow(new AggregationNotRegisteredException("heatmap"));

        // When & Then
        mockMvc.perform(post("/admin/aggregations/heatmap/refresh").param("userId", "user-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", is("unknown_aggregation")));
    }

    @Test
    void shouldReturnUnprocessableWhenValidationFails() throws Exception {
        // Given
        when(aggregationService.refreshAggregation(any()))
                .thenThrow(new AggregationValidationException("kpi", new IllegalArgumentException("bad totals")));

        // When & Then
        mockMvc.perform(post("/admin/aggregations/kpi/refresh").param("userId", "user-1"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error", is("validation_failed")));
    }

    @Test
    void shouldReturnServiceUnavailableWhenComputeFails() throws Exception {
        // Given
        when(aggregationService.refreshAggregation(any()))
                .thenThrow(new RecordSourceException("database unreachable", null));

        // When & Then
        mockMvc.perform(post("/admin/aggregations/kpi/refresh").param("userId", "user-1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message", is("database unreachable")));
    }

    @Test
    void shouldRequireUserId() throws Exception {
        // When & Then
        mockMvc.perform(post("/admin/aggregations/kpi/refresh"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(aggregationService);
    }

    @Test
    void shouldClearAggregation() throws Exception {
        // When & Then
        mockMvc.perform(delete("/admin/aggregations/kpi")
                        .param("userId", "user-1")
                        .param("product", "YouTube"))
                .andExpect(status().isNoContent());

        verify(aggregationService).clearAggregation(argThat(request ->
                request.type().equals("kpi") && request.filters().product().equals("YouTube")));
    }

    @Test
    void shouldRunBackfill() throws Exception {
        // Given
        when(backfill.run(any())).thenReturn(new BackfillResult(4, 4, false));

        // When & Then
        mockMvc.perform(post("/admin/aggregations/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "userId": "user-1",
                                  "aggregationTypes": ["kpi", "heatmap"],
                                  "filterSets": [
                                    {"timeframe": "YTD", "product": "All"},
                                    {"timeframe": "MTD", "product": "YouTube", "topics": ["Tech"]}
                                  ],
                                  "batchSize": 5
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed", is(4)))
                .andExpect(jsonPath("$.total", is(4)))
                .andExpect(jsonPath("$.skipped", is(false)));

        verify(backfill).run(argThat(config ->
                config.userId().equals("user-1")
                        && config.totalWork() == 4
                        && config.batchSize() == 5
                        && config.filterSets().get(1).topics().equals(List.of("Tech"))));
    }

    @Test
    void shouldRejectBackfillWithoutUser() throws Exception {
        // When & Then
        mockMvc.perform(post("/admin/aggregations/backfill")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"aggregationTypes\": [\"kpi\"], \"filterSets\": []}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(backfill);
    }

    @Test
    void shouldExposeCacheStats() throws Exception {
        // Given
        when(cache.getStats()).thenReturn(new CacheStats(8, 2, 5, 1, 6));

        // When & Then
        mockMvc.perform(get("/admin/aggregations/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.memoryHits", is(8)))
                .andExpect(jsonPath("$.durableHits", is(2)))
                .andExpect(jsonPath("$.misses", is(5)))
                .andExpect(jsonPath("$.durableErrors", is(1)))
                .andExpect(jsonPath("$.activeEntries", is(6)));
    }
}
