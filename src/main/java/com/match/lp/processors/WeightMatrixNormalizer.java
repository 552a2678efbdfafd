package com.match.lp.processors;

import com.google.common.collect.Table;
import com.match.lp.exceptions.DimensionMismatchException;
import com.match.lp.models.Edge;
import com.match.lp.models.Graph;
import com.match.lp.models.WeightMatrix;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reconciles a user supplied weight matrix with the graph's edge set, in place.
 * <p>
 * A positive lower-triangle entry replaces its smaller counterpart {@code (dst, src)}. Every edge then
 * carries the weight stored at {@code (src, dst)} in both directions, and every pair that is not an
 * edge, diagonal included, is cleared.
 * </p>
 */
@Slf4j
@Component
public class WeightMatrixNormalizer {

    public WeightMatrix normalize(Graph graph, WeightMatrix weights) {
        if (weights.size() != graph.vertexCount()) {
            throw new DimensionMismatchException(weights.size(), graph.vertexCount());
        }

        int promoted = 0;
        for (Table.Cell<Integer, Integer, Double> cell : weights.nonZeroEntries()) {
            int i = cell.getRowKey();
            int j = cell.getColumnKey();
            double value = cell.getValue();
            if (i > j && value > 0 && weights.get(j, i) < value) {
                weights.set(j, i, value);
                promoted++;
            }
        }

        for (Edge edge : graph.edges()) {
            weights.set(edge.getDst(), edge.getSrc(), weights.get(edge.getSrc(), edge.getDst()));
        }

        int cleared = 0;
        for (Table.Cell<Integer, Integer, Double> cell : weights.nonZeroEntries()) {
            if (!graph.hasEdge(cell.getRowKey(), cell.getColumnKey())) {
                weights.set(cell.getRowKey(), cell.getColumnKey(), 0.0);
                cleared++;
            }
        }

        log.debug("Normalized weights for {} vertices: promoted={}, cleared={}, nonZero={}",
                graph.vertexCount(), promoted, cleared, weights.nonZeroCount());
        return weights;
    }
}
