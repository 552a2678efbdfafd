package com.match.lp.models;

import java.util.List;

/**
 * Read-only undirected graph over vertices {@code 1..n}.
 */
public interface Graph {

    int vertexCount();

    /**
     * Edges in canonical form, always enumerated in the same order.
     */
    List<Edge> edges();

    /**
     * Vertices adjacent to {@code vertex}, ascending.
     */
    List<Integer> neighbors(int vertex);

    boolean hasEdge(int u, int v);

    boolean isBipartite();
}
