package com.health.misinfo.engine.layout;

import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodePosition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Uniform positions in the unit square, drawn in node-id order from {@code new Random(seed)}.
 */
final class RandomLayout {

    private RandomLayout() {}

    static Map<String, NodePosition> compute(InteractionGraph graph, long seed) {
        Random random = new Random(seed);
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        for (String node : graph.getNodes()) {
            double x = random.nextDouble();
            double y = random.nextDouble();
            positions.put(node, new NodePosition(x, y));
        }
        return positions;
    }
}
