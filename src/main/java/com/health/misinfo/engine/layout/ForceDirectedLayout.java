package com.health.misinfo.engine.layout;

import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodePosition;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Fruchterman-Reingold spring embedding.
 *
 * Every pair repels with k²/d, adjacent pairs attract with w·d²/k, where w is the merged
 * edge weight. Displacement per step is capped by a temperature that cools linearly to
 * zero over the iterations. Initial positions are uniform in the unit square from the seed.
 */
final class ForceDirectedLayout {

    private static final double MIN_DISTANCE = 0.01;

    private ForceDirectedLayout() {}

    static Map<String, NodePosition> compute(InteractionGraph graph, double k, int iterations, long seed) {
        List<String> nodes = new ArrayList<>(graph.getNodes());
        int n = nodes.size();
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        if (n == 1) {
            positions.put(nodes.get(0), NodePosition.ORIGIN);
            return positions;
        }

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }

        Random random = new Random(seed);
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = random.nextDouble();
            y[i] = random.nextDouble();
        }

        // weighted adjacency as index triples
        List<int[]> edgeIndex = new ArrayList<>();
        List<Double> edgeWeight = new ArrayList<>();
        graph.getWeights().forEach((pair, w) -> {
            edgeIndex.add(new int[]{index.get(pair.a()), index.get(pair.b())});
            edgeWeight.add(w);
        });

        double temperature = 0.1 * Math.max(span(x), span(y));
        if (temperature <= 0.0) temperature = 0.1;
        double cooling = temperature / (iterations + 1);

        double[] dx = new double[n];
        double[] dy = new double[n];
        for (int iter = 0; iter < iterations; iter++) {
            Arrays.fill(dx, 0.0);
            Arrays.fill(dy, 0.0);

            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double ddx = x[i] - x[j];
                    double ddy = y[i] - y[j];
                    double dist = Math.max(MIN_DISTANCE, Math.hypot(ddx, ddy));
                    double force = (k * k) / dist;
                    double fx = ddx / dist * force;
                    double fy = ddy / dist * force;
                    dx[i] += fx;
                    dy[i] += fy;
                    dx[j] -= fx;
                    dy[j] -= fy;
                }
            }

            for (int e = 0; e < edgeIndex.size(); e++) {
                int i = edgeIndex.get(e)[0];
                int j = edgeIndex.get(e)[1];
                double ddx = x[i] - x[j];
                double ddy = y[i] - y[j];
                double dist = Math.max(MIN_DISTANCE, Math.hypot(ddx, ddy));
                double force = edgeWeight.get(e) * dist * dist / k;
                double fx = ddx / dist * force;
                double fy = ddy / dist * force;
                dx[i] -= fx;
                dy[i] -= fy;
                dx[j] += fx;
                dy[j] += fy;
            }

            for (int i = 0; i < n; i++) {
                double length = Math.max(MIN_DISTANCE, Math.hypot(dx[i], dy[i]));
                double step = Math.min(length, temperature);
                x[i] += dx[i] / length * step;
                y[i] += dy[i] / length * step;
            }
            temperature -= cooling;
        }

        for (int i = 0; i < n; i++) {
            positions.put(nodes.get(i), new NodePosition(x[i], y[i]));
        }
        return positions;
    }

    private static double span(double[] values) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (double v : values) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        return max - min;
    }
}
