package org.arenamap.graph;

import java.util.Arrays;
import java.util.Map;
import java.util.PriorityQueue;

public final class GraphMetrics {
    private GraphMetrics() {}

    /**
     * Dijkstra from source. Unreachable nodes keep {@link Double#POSITIVE_INFINITY}.
     */
    public static double[] shortestPaths(WeightedGraph g, int source) {
        double[] dist = new double[g.nodeCount()];
        Arrays.fill(dist, Double.POSITIVE_INFINITY);
        dist[source] = 0.0;

        PriorityQueue<double[]> q = new PriorityQueue<>((a, b) -> Double.compare(a[0], b[0]));
        q.add(new double[]{0.0, source});

        while (!q.isEmpty()) {
            double[] cur = q.poll();
            int u = (int) cur[1];
            if (cur[0] > dist[u]) continue;

            for (Map.Entry<Integer, Double> e : g.neighbours(u).entrySet()) {
                int v = e.getKey();
                double nd = dist[u] + e.getValue();
                if (nd < dist[v]) {
                    dist[v] = nd;
                    q.add(new double[]{nd, v});
                }
            }
        }
        return dist;
    }

    /**
     * Longest weighted shortest path between any two mutually reachable nodes. On a
     * disconnected graph this is the largest diameter among its components.
     */
    public static double diameter(WeightedGraph g) {
        double max = 0.0;
        for (int s = 0; s < g.nodeCount(); s++) {
            for (double d : shortestPaths(g, s)) {
                if (d != Double.POSITIVE_INFINITY && d > max) max = d;
            }
        }
        return max;
    }

    /**
     * Degree of each node over (max degree + min degree). The sum in the denominator is
     * what the placement targets are tuned against; it is not the usual range.
     */
    public static double[] normalizedDegree(WeightedGraph g) {
        int n = g.nodeCount();
        double[] out = new double[n];
        if (n == 0) return out;

        int min = Integer.MAX_VALUE, max = Integer.MIN_VALUE;
        for (int i = 0; i < n; i++) {
            int d = g.degree(i);
            min = Math.min(min, d);
            max = Math.max(max, d);
        }

        int denominator = max + min;
        if (denominator == 0) return out;   // no edges at all

        for (int i = 0; i < n; i++) out[i] = (double) g.degree(i) / denominator;
        return out;
    }

    /** How far value sits from the interval ends; smaller is closer. */
    public static double intervalDistance(double lo, double hi, double value) {
        return Math.abs(Math.abs(lo) - Math.abs(value)) + Math.abs(Math.abs(hi) - Math.abs(value));
    }

    /**
     * Rescales the interval distance of every value to [0,1]: the closest value scores 1,
     * the farthest 0. When all distances are equal every value scores 1.
     */
    public static double[] intervalFit(double[] values, double lo, double hi) {
        double[] fit = new double[values.length];
        if (values.length == 0) return fit;

        double[] distance = new double[values.length];
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < values.length; i++) {
            distance[i] = intervalDistance(lo, hi, values[i]);
            min = Math.min(min, distance[i]);
            max = Math.max(max, distance[i]);
        }

        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            fit[i] = range == 0.0 ? 1.0 : 1.0 - (distance[i] - min) / range;
        }
        return fit;
    }
}
