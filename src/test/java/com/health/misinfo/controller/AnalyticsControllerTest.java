package com.health.misinfo.controller;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.*;
import com.health.misinfo.service.AnalyticsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalyticsService analyticsService;

    @MockBean
    private GraphConfig graphConfig;

    @Test
    void getSummary_success() throws Exception {
        PostSummaryReport report = PostSummaryReport.builder()
                .generatedAt(1_739_886_764_000L)
                .totalPosts(12)
                .postsByRiskLevel(Map.of(RiskLevel.HIGH, 4, RiskLevel.MEDIUM, 5, RiskLevel.LOW, 3))
                .highRiskPosts(2)
                .archivedPosts(6)
                .activeSpreaders(8)
                .postsByPlatform(Map.of("Twitter", 12))
                .postsByCategory(Map.of("Vaccine", 12))
                .postsByStatus(Map.of("Debunked", 12))
                .topSpreaders(List.of())
                .build();
        when(analyticsService.summary(any())).thenReturn(report);

        mockMvc.perform(get("/api/v1/analytics/summary").param("platform", "Twitter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalPosts").value(12))
                .andExpect(jsonPath("$.postsByRiskLevel.HIGH").value(4))
                .andExpect(jsonPath("$.highRiskPosts").value(2))
                .andExpect(jsonPath("$.activeSpreaders").value(8))
                .andExpect(jsonPath("$.postsByPlatform.Twitter").value(12));
    }

    @Test
    void getTimeline_success() throws Exception {
        when(analyticsService.timeline(any()))
                .thenReturn(List.of(new TimelinePoint(LocalDate.of(2025, 2, 18), 3)));

        mockMvc.perform(get("/api/v1/analytics/timeline"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].date").value("2025-02-18"))
                .andExpect(jsonPath("$[0].posts").value(3));
    }

    @Test
    void getTopTopics_defaultLimit() throws Exception {
        when(analyticsService.topTopics(any(), eq(7)))
                .thenReturn(List.of(new TopicCount("Garlic cures flu", 4)));

        mockMvc.perform(get("/api/v1/analytics/topics").param("platform", "Twitter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].content").value("Garlic cures flu"))
                .andExpect(jsonPath("$[0].posts").value(4));
    }

    @Test
    void getScoreHistogram_invalidWidth_returns400() throws Exception {
        when(analyticsService.scoreHistogram(any(), anyDouble()))
                .thenThrow(new InvalidParameterException("bucketWidth must be in (0, 100], got 0.0"));

        mockMvc.perform(get("/api/v1/analytics/score-histogram").param("bucketWidth", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }

    @Test
    void getNetwork_defaultsFromConfig() throws Exception {
        when(graphConfig.getLayout()).thenReturn(new GraphConfig.Layout());
        NetworkGraph network = NetworkGraph.builder()
                .algorithm("FORCE_DIRECTED")
                .minConnections(2)
                .nodes(List.of(NetworkGraph.NetworkNode.builder()
                        .id("user_15").label("U15").x(0.1).y(0.2).degree(3).size(29).riskLevel(RiskLevel.HIGH).build()))
                .edges(List.of())
                .statistics(NetworkStatistics.builder().nodeCount(1).build())
                .build();
        when(analyticsService.getNetwork(eq(LayoutAlgorithm.FORCE_DIRECTED), isNull(), eq(2))).thenReturn(network);

        mockMvc.perform(get("/api/v1/analytics/network"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.algorithm").value("FORCE_DIRECTED"))
                .andExpect(jsonPath("$.nodes[0].label").value("U15"))
                .andExpect(jsonPath("$.nodes[0].size").value(29.0))
                .andExpect(jsonPath("$.statistics.nodeCount").value(1));
    }

    @Test
    void getNetwork_unknownAlgorithm_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/analytics/network").param("algorithm", "hyperbolic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_LAYOUT"));
    }
}
