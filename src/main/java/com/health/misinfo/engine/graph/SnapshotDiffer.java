package com.health.misinfo.engine.graph;

import com.health.misinfo.model.InteractionEdge;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NetworkUpdateEvent;
import com.health.misinfo.model.NodePair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Computes the node and edge changes between two graph snapshots.
 */
@Component
public class SnapshotDiffer {

    /**
     * Diff {@code previous} to {@code current}. Sequence and timestamp are left at zero for
     * the publisher to assign. All lists are in node-id / pair order.
     */
    public NetworkUpdateEvent diff(InteractionGraph previous, InteractionGraph current) {
        List<String> addedNodes = new ArrayList<>();
        List<String> removedNodes = new ArrayList<>();
        for (String node : current.getNodes()) {
            if (!previous.containsNode(node)) addedNodes.add(node);
        }
        for (String node : previous.getNodes()) {
            if (!current.containsNode(node)) removedNodes.add(node);
        }

        List<InteractionEdge> addedEdges = new ArrayList<>();
        List<InteractionEdge> reweightedEdges = new ArrayList<>();
        List<InteractionEdge> removedEdges = new ArrayList<>();
        Map<NodePair, Double> before = previous.getWeights();
        Map<NodePair, Double> after = current.getWeights();

        for (Map.Entry<NodePair, Double> entry : after.entrySet()) {
            NodePair pair = entry.getKey();
            Double old = before.get(pair);
            if (old == null) {
                addedEdges.add(InteractionEdge.of(pair.a(), pair.b(), entry.getValue()));
            } else if (Double.compare(old, entry.getValue()) != 0) {
                reweightedEdges.add(InteractionEdge.of(pair.a(), pair.b(), entry.getValue()));
            }
        }
        for (Map.Entry<NodePair, Double> entry : before.entrySet()) {
            if (!after.containsKey(entry.getKey())) {
                removedEdges.add(InteractionEdge.of(entry.getKey().a(), entry.getKey().b(), entry.getValue()));
            }
        }

        return NetworkUpdateEvent.builder()
                .addedNodes(addedNodes)
                .removedNodes(removedNodes)
                .addedEdges(addedEdges)
                .removedEdges(removedEdges)
                .reweightedEdges(reweightedEdges)
                .nodeCount(current.nodeCount())
                .edgeCount(current.edgeCount())
                .build();
    }
}
