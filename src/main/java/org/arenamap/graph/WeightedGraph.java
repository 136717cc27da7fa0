package org.arenamap.graph;

import java.util.Map;

/** Minimal undirected weighted graph over dense node indices. */
public interface WeightedGraph {
    int nodeCount();

    /** Neighbour index to edge weight, in insertion order. */
    Map<Integer, Double> neighbours(int node);

    default int degree(int node) {
        return neighbours(node).size();
    }

    default int edgeCount() {
        int twice = 0;
        for (int i = 0; i < nodeCount(); i++) twice += degree(i);
        return twice / 2;
    }
}
