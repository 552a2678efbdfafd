package com.match.lp.models;

import com.google.common.base.Preconditions;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import java.util.Map;
import java.util.Set;

/**
 * Sparse {@code n x n} weight matrix indexed by ordered vertex pairs {@code (i, j)}, both in {@code 1..n}.
 * Entries that were never set, or were set to zero, are not stored.
 */
public class WeightMatrix {

    private final int size;
    private final Table<Integer, Integer, Double> entries = HashBasedTable.create();

    public WeightMatrix(int size) {
        Preconditions.checkArgument(size >= 0, "Matrix size must be non-negative: %s", size);
        this.size = size;
    }

    /**
     * Unit weight at {@code (src(e), dst(e))} for every edge: the max-cardinality weighting.
     */
    public static WeightMatrix defaultWeights(Graph graph) {
        WeightMatrix weights = new WeightMatrix(graph.vertexCount());
        for (Edge edge : graph.edges()) {
            weights.set(edge.getSrc(), edge.getDst(), 1.0);
        }
        return weights;
    }

    /**
     * Copies a dense, zero-based square array; {@code rows[i][j]} becomes entry {@code (i + 1, j + 1)}.
     */
    public static WeightMatrix fromDense(double[][] rows) {
        WeightMatrix weights = new WeightMatrix(rows.length);
        for (int i = 0; i < rows.length; i++) {
            Preconditions.checkArgument(rows[i].length == rows.length,
                    "Row %s has %s columns, expected %s", i + 1, rows[i].length, rows.length);
            for (int j = 0; j < rows.length; j++) {
                weights.set(i + 1, j + 1, rows[i][j]);
            }
        }
        return weights;
    }

    /**
     * Builds a matrix from an edge to weight mapping, each weight stored at {@code (src, dst)}.
     */
    public static WeightMatrix fromEdgeWeights(int size, Map<Edge, ? extends Number> edgeWeights) {
        WeightMatrix weights = new WeightMatrix(size);
        edgeWeights.forEach((edge, weight) -> weights.set(edge.getSrc(), edge.getDst(), weight.doubleValue()));
        return weights;
    }

    public int size() {
        return size;
    }

    public double get(int row, int column) {
        checkIndex(row, column);
        Double value = entries.get(row, column);
        return value == null ? 0.0 : value;
    }

    public void set(int row, int column, double value) {
        checkIndex(row, column);
        if (value == 0.0) {
            entries.remove(row, column);
        } else {
            entries.put(row, column, value);
        }
    }

    /**
     * Snapshot of the stored entries, safe to iterate while the matrix is modified.
     */
    public Set<Table.Cell<Integer, Integer, Double>> nonZeroEntries() {
        return ImmutableTable.copyOf(entries).cellSet();
    }

    public int nonZeroCount() {
        return entries.size();
    }

    public WeightMatrix copy() {
        WeightMatrix copy = new WeightMatrix(size);
        copy.entries.putAll(entries);
        return copy;
    }

    private void checkIndex(int row, int column) {
        if (row < 1 || row > size || column < 1 || column > size) {
            throw new IndexOutOfBoundsException("Entry (" + row + "," + column + ") outside 1.." + size);
        }
    }

    @Override
    public String toString() {
        return "WeightMatrix{size=" + size + ", entries=" + entries + "}";
    }
}
