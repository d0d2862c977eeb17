package com.health.misinfo.engine.filter;

import com.health.misinfo.engine.graph.GraphBuilder;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.FilteredNetwork;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NetworkStatistics;
import com.health.misinfo.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class NetworkFilterTest {

    private final NetworkFilter filter = new NetworkFilter();

    @Test
    void filter_minTwo_dropsLeafAndItsEdge() {
        FilteredNetwork result = filter.filter(TestDataFactory.fourNodeGraph(), 2);

        assertThat(result.graph().getNodes()).containsExactly("A", "B", "C");
        assertThat(result.graph().edgeCount()).isEqualTo(3);
        assertThat(result.statistics().getDensity()).isCloseTo(1.0, within(1e-9));
        assertThat(result.statistics().getAvgDegree()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void filter_minZero_keepsWholeGraph() {
        InteractionGraph g = TestDataFactory.fourNodeGraph();

        FilteredNetwork result = filter.filter(g, 0);

        assertThat(result.graph()).isEqualTo(g);
        assertThat(result.statistics().getDensity()).isCloseTo(4.0 / 6.0, within(1e-9));
    }

    @Test
    void filter_higherThreshold_neverGrowsNodesOrEdges() {
        InteractionGraph g = TestDataFactory.fourNodeGraph();

        for (int m = 1; m < 5; m++) {
            FilteredNetwork looser = filter.filter(g, m - 1);
            FilteredNetwork stricter = filter.filter(g, m);
            assertThat(stricter.graph().getNodes()).isSubsetOf(looser.graph().getNodes());
            assertThat(stricter.statistics().getNodeCount()).isLessThanOrEqualTo(looser.statistics().getNodeCount());
            assertThat(stricter.statistics().getEdgeCount()).isLessThanOrEqualTo(looser.statistics().getEdgeCount());
        }
    }

    @Test
    void filter_minTwo_onlyConnectedPairSurvives() {
        // A and B are the only nodes with degree 2
        InteractionGraph g = TestDataFactory.graph(
                TestDataFactory.edge("A", "B", 1),
                TestDataFactory.edge("A", "C", 1),
                TestDataFactory.edge("B", "D", 1));

        FilteredNetwork result = filter.filter(g, 2);

        assertThat(result.graph().getNodes()).containsExactly("A", "B");
        assertThat(result.statistics().getNodeCount()).isEqualTo(2);
        assertThat(result.statistics().getEdgeCount()).isEqualTo(1);
        assertThat(result.statistics().getDensity()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void filter_thresholdAboveMaxDegree_emptyWithZeroStats() {
        FilteredNetwork result = filter.filter(TestDataFactory.fourNodeGraph(), 4);

        assertThat(result.graph().isEmpty()).isTrue();
        assertThat(result.statistics().getDensity()).isZero();
        assertThat(result.statistics().getAvgDegree()).isZero();
    }

    @Test
    void filter_negativeThreshold_throws() {
        assertThatThrownBy(() -> filter.filter(TestDataFactory.fourNodeGraph(), -1))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void statistics_singleNode_zeroDensity() {
        NetworkStatistics stats = filter.statistics(
                new GraphBuilder().build(List.of(), List.of("A")));

        assertThat(stats.getNodeCount()).isEqualTo(1);
        assertThat(stats.getDensity()).isZero();
        assertThat(stats.getAvgDegree()).isZero();
    }

    @Test
    void statistics_densityWithinUnitInterval() {
        NetworkStatistics stats = filter.statistics(TestDataFactory.fourNodeGraph());

        assertThat(stats.getDensity()).isBetween(0.0, 1.0);
        assertThat(stats.getEdgeCount()).isEqualTo(4);
        assertThat(stats.getAvgDegree()).isCloseTo(2.0, within(1e-9));
    }
}
