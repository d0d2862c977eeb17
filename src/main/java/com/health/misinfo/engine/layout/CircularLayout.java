package com.health.misinfo.engine.layout;

import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodePosition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Nodes evenly spaced on the unit circle in node-id order, starting at angle 0.
 */
final class CircularLayout {

    private CircularLayout() {}

    static Map<String, NodePosition> compute(InteractionGraph graph) {
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        int n = graph.nodeCount();
        if (n == 1) {
            positions.put(graph.getNodes().first(), NodePosition.ORIGIN);
            return positions;
        }
        int i = 0;
        for (String node : graph.getNodes()) {
            double theta = 2.0 * Math.PI * i / n;
            positions.put(node, new NodePosition(Math.cos(theta), Math.sin(theta)));
            i++;
        }
        return positions;
    }
}
