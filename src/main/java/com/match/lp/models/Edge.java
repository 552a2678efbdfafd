package com.match.lp.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Comparator;

/**
 * Undirected edge in canonical form: {@code src < dst}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Edge implements Comparable<Edge> {

    private static final Comparator<Edge> ORDER =
            Comparator.comparingInt(Edge::getSrc).thenComparingInt(Edge::getDst);

    int src;
    int dst;

    public static Edge of(int u, int v) {
        if (u == v) {
            throw new IllegalArgumentException("Self-loop on vertex " + u + " is not a valid edge");
        }
        return u < v ? new Edge(u, v) : new Edge(v, u);
    }

    public boolean isIncidentTo(int vertex) {
        return src == vertex || dst == vertex;
    }

    @Override
    public int compareTo(Edge other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + src + "," + dst + ")";
    }
}
