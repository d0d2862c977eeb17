package com.health.misinfo.engine.layout;

import com.health.misinfo.model.InteractionGraph;
import com.health.misinfo.model.NodePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stress majorization over hop-count graph distances.
 *
 * Target distance d_ij is the unweighted shortest path length; pairs in different
 * components get the largest finite distance plus one. Pair weights are d_ij^-2.
 * Starting from the circular layout, every node moves to the weighted average
 * x_i = Σ w_ij (x_j + d_ij (x_i - x_j) / |x_i - x_j|) / Σ w_ij, all nodes updated from
 * the previous positions, until the relative stress change drops below the tolerance.
 * No randomness is involved.
 */
final class StressMajorizationLayout {

    private static final double EPSILON = 1e-9;

    private StressMajorizationLayout() {}

    static Map<String, NodePosition> compute(InteractionGraph graph, int maxIterations, double tolerance) {
        List<String> nodes = new ArrayList<>(graph.getNodes());
        int n = nodes.size();
        Map<String, NodePosition> positions = new LinkedHashMap<>();
        if (n == 1) {
            positions.put(nodes.get(0), NodePosition.ORIGIN);
            return positions;
        }

        double[][] dist = hopDistances(graph, nodes);
        double[][] weight = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i != j) weight[i][j] = 1.0 / (dist[i][j] * dist[i][j]);
            }
        }

        Map<String, NodePosition> initial = CircularLayout.compute(graph);
        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            NodePosition p = initial.get(nodes.get(i));
            x[i] = p.x();
            y[i] = p.y();
        }

        double stress = stress(x, y, dist, weight);
        for (int iter = 0; iter < maxIterations; iter++) {
            double[] nx = new double[n];
            double[] ny = new double[n];
            for (int i = 0; i < n; i++) {
                double sumW = 0.0;
                double sx = 0.0;
                double sy = 0.0;
                for (int j = 0; j < n; j++) {
                    if (i == j) continue;
                    double w = weight[i][j];
                    double ddx = x[i] - x[j];
                    double ddy = y[i] - y[j];
                    double len = Math.hypot(ddx, ddy);
                    sx += w * x[j];
                    sy += w * y[j];
                    if (len > EPSILON) {
                        sx += w * dist[i][j] * ddx / len;
                        sy += w * dist[i][j] * ddy / len;
                    }
                    sumW += w;
                }
                nx[i] = sx / sumW;
                ny[i] = sy / sumW;
            }
            x = nx;
            y = ny;

            double next = stress(x, y, dist, weight);
            double change = stress > EPSILON ? (stress - next) / stress : 0.0;
            stress = next;
            if (Math.abs(change) < tolerance) break;
        }

        for (int i = 0; i < n; i++) {
            positions.put(nodes.get(i), new NodePosition(x[i], y[i]));
        }
        return positions;
    }

    /** BFS from every node; unreachable pairs get (max finite distance + 1). */
    static double[][] hopDistances(InteractionGraph graph, List<String> nodes) {
        int n = nodes.size();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < n; i++) {
            index.put(nodes.get(i), i);
        }

        double[][] dist = new double[n][n];
        double maxFinite = 1.0;
        for (int s = 0; s < n; s++) {
            Arrays.fill(dist[s], -1.0);
            dist[s][s] = 0.0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int u = queue.poll();
                for (String neighbor : graph.neighbors(nodes.get(u)).keySet()) {
                    int v = index.get(neighbor);
                    if (dist[s][v] < 0) {
                        dist[s][v] = dist[s][u] + 1.0;
                        maxFinite = Math.max(maxFinite, dist[s][v]);
                        queue.add(v);
                    }
                }
            }
        }
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (dist[i][j] < 0) dist[i][j] = maxFinite + 1.0;
            }
        }
        return dist;
    }

    private static double stress(double[] x, double[] y, double[][] dist, double[][] weight) {
        double total = 0.0;
        for (int i = 0; i < x.length; i++) {
            for (int j = i + 1; j < x.length; j++) {
                double diff = Math.hypot(x[i] - x[j], y[i] - y[j]) - dist[i][j];
                total += weight[i][j] * diff * diff;
            }
        }
        return total;
    }
}
