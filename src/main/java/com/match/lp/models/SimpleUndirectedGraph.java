package com.match.lp.models;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import org.jgrapht.GraphTests;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * {@link Graph} backed by a jgrapht {@link SimpleGraph}. Parallel edges collapse into one,
 * self-loops are rejected.
 */
@Slf4j
public class SimpleUndirectedGraph implements Graph {

    private final int vertexCount;
    private final org.jgrapht.Graph<Integer, DefaultEdge> delegate;
    private final NavigableSet<Edge> edges = new TreeSet<>();

    public SimpleUndirectedGraph(int vertexCount) {
        Preconditions.checkArgument(vertexCount >= 0, "Vertex count must be non-negative: %s", vertexCount);
        this.vertexCount = vertexCount;
        this.delegate = new SimpleGraph<>(DefaultEdge.class);
        for (int v = 1; v <= vertexCount; v++) {
            delegate.addVertex(v);
        }
    }

    /**
     * Builds a graph from {@code {u, v}} pairs.
     */
    public static SimpleUndirectedGraph of(int vertexCount, int[]... edgePairs) {
        SimpleUndirectedGraph graph = new SimpleUndirectedGraph(vertexCount);
        for (int[] pair : edgePairs) {
            Preconditions.checkArgument(pair.length == 2, "Edge must have exactly two endpoints");
            graph.addEdge(pair[0], pair[1]);
        }
        return graph;
    }

    public SimpleUndirectedGraph addEdge(int u, int v) {
        checkVertex(u);
        checkVertex(v);
        Edge edge = Edge.of(u, v);
        if (delegate.addEdge(edge.getSrc(), edge.getDst()) == null) {
            log.debug("Ignoring duplicate edge {}", edge);
            return this;
        }
        edges.add(edge);
        return this;
    }

    @Override
    public int vertexCount() {
        return vertexCount;
    }

    @Override
    public List<Edge> edges() {
        return ImmutableList.copyOf(edges);
    }

    @Override
    public List<Integer> neighbors(int vertex) {
        checkVertex(vertex);
        List<Integer> neighbors = Graphs.neighborListOf(delegate, vertex);
        neighbors.sort(Integer::compare);
        return ImmutableList.copyOf(neighbors);
    }

    @Override
    public boolean hasEdge(int u, int v) {
        return u != v && delegate.containsVertex(u) && delegate.containsVertex(v) && delegate.containsEdge(u, v);
    }

    @Override
    public boolean isBipartite() {
        return GraphTests.isBipartite(delegate);
    }

    private void checkVertex(int vertex) {
        if (vertex < 1 || vertex > vertexCount) {
            throw new IllegalArgumentException("Vertex " + vertex + " outside 1.." + vertexCount);
        }
    }
}
