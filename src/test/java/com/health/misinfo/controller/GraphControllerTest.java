package com.health.misinfo.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.engine.filter.NetworkFilter;
import com.health.misinfo.exception.InvalidEdgeException;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.*;
import com.health.misinfo.service.ContextGraphService;
import com.health.misinfo.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.health.misinfo.testutil.TestDataFactory.edge;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GraphController.class)
class GraphControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ContextGraphService graphService;

    @MockBean
    private GraphConfig graphConfig;

    @BeforeEach
    void setUp() {
        when(graphConfig.getRanking()).thenReturn(new GraphConfig.Ranking());
        when(graphConfig.getLayout()).thenReturn(new GraphConfig.Layout());
    }

    @Test
    void ingestEdges_success() throws Exception {
        when(graphService.ingestEdges(anyList()))
                .thenReturn(TestDataFactory.graph(edge("A", "B", 5), edge("A", "C", 1)));

        mockMvc.perform(post("/api/v1/graph/edges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(List.of(edge("A", "B", 5), edge("A", "C", 1)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(2))
                .andExpect(jsonPath("$.nodeCount").value(3))
                .andExpect(jsonPath("$.edgeCount").value(2));
    }

    @Test
    void ingestEdges_selfLoop_returns400() throws Exception {
        when(graphService.ingestEdges(anyList()))
                .thenThrow(new InvalidEdgeException("Self-loop on A is not an interaction"));

        mockMvc.perform(post("/api/v1/graph/edges")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"sourceId\":\"A\",\"targetId\":\"A\",\"weight\":1}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_EDGE"))
                .andExpect(jsonPath("$.message").value("Self-loop on A is not an interaction"));
    }

    @Test
    void getGraphStatus_success() throws Exception {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("isReady", true);
        status.put("nodeCount", 20);
        status.put("edgeCount", 31);
        when(graphService.status()).thenReturn(status);

        mockMvc.perform(get("/api/v1/graph/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isReady").value(true))
                .andExpect(jsonPath("$.nodeCount").value(20))
                .andExpect(jsonPath("$.edgeCount").value(31));
    }

    @Test
    void getTopSpreaders_defaultTopN() throws Exception {
        when(graphService.rank(10)).thenReturn(List.of(
                TestDataFactory.createRankingEntry(1, "user_1", 8, 21.0, RiskLevel.HIGH)));

        mockMvc.perform(get("/api/v1/graph/spreaders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].nodeId").value("user_1"))
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[0].weightedDegree").value(21.0))
                .andExpect(jsonPath("$[0].riskLevel").value("HIGH"));
    }

    @Test
    void getTopSpreaders_invalidTopN_returns400() throws Exception {
        when(graphService.rank(0)).thenThrow(new InvalidParameterException("topN must be >= 1, got 0"));

        mockMvc.perform(get("/api/v1/graph/spreaders").param("topN", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_PARAMETER"));
    }

    @Test
    void filter_returnsKeptGraphAndStatistics() throws Exception {
        when(graphService.filter(2)).thenReturn(new NetworkFilter().filter(TestDataFactory.fourNodeGraph(), 2));

        mockMvc.perform(get("/api/v1/graph/filter"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.minConnections").value(2))
                .andExpect(jsonPath("$.nodes.length()").value(3))
                .andExpect(jsonPath("$.edges.length()").value(3))
                .andExpect(jsonPath("$.statistics.density").value(1.0))
                .andExpect(jsonPath("$.statistics.avgDegree").value(2.0));
    }

    @Test
    void layout_aliasResolved() throws Exception {
        when(graphService.layout(LayoutAlgorithm.STRESS_MAJORIZATION, null))
                .thenReturn(Map.of("A", new NodePosition(0.5, -0.25)));

        mockMvc.perform(get("/api/v1/graph/layout").param("algorithm", "kamada-kawai"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.A.x").value(0.5))
                .andExpect(jsonPath("$.A.y").value(-0.25));
    }

    @Test
    void layout_unknownAlgorithm_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/graph/layout").param("algorithm", "spectral"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("UNSUPPORTED_LAYOUT"))
                .andExpect(jsonPath("$.message").value("Unsupported layout algorithm: spectral"));
    }

    @Test
    void getUpdates_afterSequence() throws Exception {
        NetworkUpdateEvent event = NetworkUpdateEvent.builder()
                .sequence(3)
                .occurredAt(1_739_886_764_000L)
                .addedNodes(List.of("user_7"))
                .removedNodes(List.of())
                .addedEdges(List.of(edge("user_1", "user_7", 2)))
                .removedEdges(List.of())
                .reweightedEdges(List.of())
                .nodeCount(7)
                .edgeCount(9)
                .build();
        when(graphService.updatesAfter(2)).thenReturn(List.of(event));

        mockMvc.perform(get("/api/v1/graph/updates").param("after", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].sequence").value(3))
                .andExpect(jsonPath("$[0].addedNodes[0]").value("user_7"))
                .andExpect(jsonPath("$[0].addedEdges[0].weight").value(2.0))
                .andExpect(jsonPath("$[0].empty").doesNotExist());
    }
}
