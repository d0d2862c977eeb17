package com.health.misinfo.engine.layout;

import com.health.misinfo.config.GraphConfig;
import com.health.misinfo.exception.InvalidParameterException;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.LayoutAlgorithm;
import com.health.misinfo.model.NodePosition;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;

/**
 * Computes 2D node positions for the interaction graph.
 *
 * Coordinates are unnormalized. Seeded algorithms reproduce identical output for the
 * same graph and seed; the others are deterministic on their own.
 */
@Component
public class LayoutEngine {

    private final GraphConfig graphConfig;

    public LayoutEngine(GraphConfig graphConfig) {
        this.graphConfig = graphConfig;
    }

    /**
     * @param seed required for {@link LayoutAlgorithm#isSeeded() seeded} algorithms, ignored otherwise
     * @return positions keyed by node id, in node-id order; empty for an empty graph
     * @throws InvalidParameterException if the algorithm is null, or seeded and {@code seed} is null
     */
    public Map<String, NodePosition> layout(InteractionGraph graph, LayoutAlgorithm algorithm, Long seed) {
        if (algorithm == null) {
            throw new InvalidParameterException("algorithm is required");
        }
        if (algorithm.isSeeded() && seed == null) {
            throw new InvalidParameterException("seed is required for " + algorithm + " layout");
        }
        if (graph.isEmpty()) {
            return Collections.emptyMap();
        }

        GraphConfig.Layout cfg = graphConfig.getLayout();
        Map<String, NodePosition> positions = switch (algorithm) {
            case FORCE_DIRECTED -> ForceDirectedLayout.compute(graph, cfg.getSpringK(), cfg.getSpringIterations(), seed);
            case CIRCULAR -> CircularLayout.compute(graph);
            case RANDOM -> RandomLayout.compute(graph, seed);
            case STRESS_MAJORIZATION -> StressMajorizationLayout.compute(graph, cfg.getStressMaxIterations(), cfg.getStressTolerance());
        };
        return Collections.unmodifiableMap(positions);
    }
}
