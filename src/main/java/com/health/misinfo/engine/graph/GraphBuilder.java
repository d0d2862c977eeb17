package com.health.misinfo.engine.graph;

import com.health.misinfo.exception.InvalidEdgeException;
import com.health.misinfo.model.InteractionEdge;
import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodePair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds an immutable {@link InteractionGraph} from raw interaction records.
 *
 * Records are undirected: (A,B) and (B,A) describe the same relation, and all records of
 * one unordered pair collapse into a single edge whose weight is the sum of theirs.
 * The result does not depend on the order of the input records.
 */
@Component
public class GraphBuilder {

    public InteractionGraph build(Collection<InteractionEdge> edges) {
        return build(edges, Collections.emptyList());
    }

    /**
     * Build a graph from edge records plus extra node ids (e.g. post authors). Extra nodes
     * without edges become isolated nodes with zero degree.
     *
     * @throws InvalidEdgeException if any record is invalid; nothing is built in that case
     */
    public InteractionGraph build(Collection<InteractionEdge> edges, Collection<String> extraNodes) {
        Map<NodePair, List<Double>> contributions = new HashMap<>();
        for (InteractionEdge edge : edges) {
            validate(edge);
            contributions
                    .computeIfAbsent(NodePair.of(edge.getSourceId(), edge.getTargetId()), k -> new ArrayList<>())
                    .add(edge.getWeight());
        }

        SortedMap<NodePair, Double> weights = new TreeMap<>();
        for (Map.Entry<NodePair, List<Double>> entry : contributions.entrySet()) {
            weights.put(entry.getKey(), sumAscending(entry.getValue()));
        }

        SortedSet<String> nodes = new TreeSet<>();
        for (String node : extraNodes) {
            if (node != null && !node.isBlank()) {
                nodes.add(node);
            }
        }
        return InteractionGraph.of(nodes, weights);
    }

    /**
     * Reject records that cannot describe sharing between two distinct accounts.
     */
    public void validate(InteractionEdge edge) {
        if (edge == null) {
            throw new InvalidEdgeException("Edge must not be null");
        }
        if (edge.getSourceId() == null || edge.getSourceId().isBlank()
                || edge.getTargetId() == null || edge.getTargetId().isBlank()) {
            throw new InvalidEdgeException("Edge endpoints must be non-blank: " + edge);
        }
        if (edge.getSourceId().equals(edge.getTargetId())) {
            throw new InvalidEdgeException("Self-loop on " + edge.getSourceId() + " is not an interaction");
        }
        double w = edge.getWeight();
        if (Double.isNaN(w) || Double.isInfinite(w) || w < 1.0) {
            throw new InvalidEdgeException("Edge weight must be a finite value >= 1, got " + w
                    + " for " + edge.getSourceId() + "--" + edge.getTargetId());
        }
    }

    // Summing in sorted order keeps real-valued merges independent of input order
    private static double sumAscending(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        return sum;
    }
}
