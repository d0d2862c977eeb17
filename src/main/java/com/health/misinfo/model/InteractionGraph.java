package com.health.misinfo.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable undirected weighted simple graph snapshot.
 *
 * Nodes are kept in id order and edges in canonical pair order, so iteration is
 * reproducible across rebuilds from the same edge records. Every edge endpoint is a
 * node; nodes without edges are allowed and have zero degree.
 */
public final class InteractionGraph {

    private static final InteractionGraph EMPTY = new InteractionGraph(new TreeSet<>(), new TreeMap<>());

    private final SortedSet<String> nodes;
    private final SortedMap<NodePair, Double> weights;
    private final Map<String, SortedMap<String, Double>> adjacency;

    private InteractionGraph(SortedSet<String> nodes, SortedMap<NodePair, Double> weights) {
        this.nodes = Collections.unmodifiableSortedSet(nodes);
        this.weights = Collections.unmodifiableSortedMap(weights);

        Map<String, SortedMap<String, Double>> adj = new TreeMap<>();
        for (String node : nodes) {
            adj.put(node, new TreeMap<>());
        }
        for (Map.Entry<NodePair, Double> entry : weights.entrySet()) {
            NodePair pair = entry.getKey();
            adj.get(pair.a()).put(pair.b(), entry.getValue());
            adj.get(pair.b()).put(pair.a(), entry.getValue());
        }
        adj.replaceAll((k, v) -> Collections.unmodifiableSortedMap(v));
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    /**
     * Creates a snapshot from already-merged weights. Endpoints missing from
     * {@code nodes} are added.
     */
    public static InteractionGraph of(SortedSet<String> nodes, SortedMap<NodePair, Double> weights) {
        SortedSet<String> allNodes = new TreeSet<>(nodes);
        for (NodePair pair : weights.keySet()) {
            allNodes.add(pair.a());
            allNodes.add(pair.b());
        }
        return new InteractionGraph(allNodes, new TreeMap<>(weights));
    }

    public static InteractionGraph empty() {
        return EMPTY;
    }

    public SortedSet<String> getNodes() {
        return nodes;
    }

    public SortedMap<NodePair, Double> getWeights() {
        return weights;
    }

    public List<InteractionEdge> getEdges() {
        List<InteractionEdge> edges = new ArrayList<>(weights.size());
        weights.forEach((pair, w) -> edges.add(InteractionEdge.of(pair.a(), pair.b(), w)));
        return edges;
    }

    public boolean containsNode(String nodeId) {
        return nodes.contains(nodeId);
    }

    /** Merged weight between two nodes, 0 when they are not adjacent. */
    public double weight(String first, String second) {
        if (first.equals(second)) return 0.0;
        return weights.getOrDefault(NodePair.of(first, second), 0.0);
    }

    public SortedMap<String, Double> neighbors(String nodeId) {
        SortedMap<String, Double> n = adjacency.get(nodeId);
        return n != null ? n : Collections.emptySortedMap();
    }

    /** Count of distinct neighbors. */
    public int degree(String nodeId) {
        return neighbors(nodeId).size();
    }

    /** Sum of incident edge weights. */
    public double weightedDegree(String nodeId) {
        double sum = 0.0;
        for (double w : neighbors(nodeId).values()) {
            sum += w;
        }
        return sum;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return weights.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InteractionGraph that)) return false;
        return nodes.equals(that.nodes) && weights.equals(that.weights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, weights);
    }

    @Override
    public String toString() {
        return "InteractionGraph{nodes=" + nodes.size() + ", edges=" + weights.size() + "}";
    }
}
