/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.esda.weights;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// In-memory [SpatialWeights] backed by sorted neighbor index lists.
///
/// Every row carries a single weight value under each transform (1 for
/// binary, `1 / cardinality` for row-standardized), so only the neighbor
/// structure is stored. The aggregates `s0`, `s1`, `s2` are computed lazily
/// and cached per transform.
///
/// ```java
/// SparseSpatialWeights w = SparseSpatialWeights.builder()
///     .neighbors("a", "b", "c")
///     .neighbors("b", "a")
///     .neighbors("c", "a")
///     .build();
/// ```
public final class SparseSpatialWeights implements SpatialWeights {

    private final List<String> ids;
    private final int[][] neighbors;
    private final Map<WeightsTransform, double[]> aggregates = new EnumMap<>(WeightsTransform.class);
    private WeightsTransform transform;

    private SparseSpatialWeights(List<String> ids, int[][] neighbors, WeightsTransform transform) {
        this.ids = ids;
        this.neighbors = neighbors;
        this.transform = transform;
    }

    /// @return a builder keyed by location id
    public static Builder builder() {
        return new Builder();
    }

    /// Creates a binary weights graph from neighbor index lists.
    /// Location ids are the decimal indices `"0"`, `"1"`, ...
    ///
    /// @param neighborIndices for each location, the indices of its neighbors
    /// @return the weights graph
    /// @throws IllegalArgumentException on self-neighbors, duplicates or out-of-range indices
    public static SparseSpatialWeights fromNeighborIndices(int[][] neighborIndices) {
        Objects.requireNonNull(neighborIndices, "neighborIndices cannot be null");
        Builder builder = builder();
        for (int i = 0; i < neighborIndices.length; i++) {
            String[] ids = new String[neighborIndices[i].length];
            for (int j = 0; j < ids.length; j++) {
                ids[j] = Integer.toString(neighborIndices[i][j]);
            }
            builder.neighbors(Integer.toString(i), ids);
        }
        return builder.build();
    }

    @Override
    public int size() {
        return ids.size();
    }

    @Override
    public List<String> locationOrder() {
        return ids;
    }

    @Override
    public WeightsTransform transform() {
        return transform;
    }

    @Override
    public void setTransform(WeightsTransform transform) {
        this.transform = Objects.requireNonNull(transform, "transform cannot be null");
    }

    @Override
    public int[] neighbors(int index) {
        return neighbors[index].clone();
    }

    @Override
    public double[] weights(int index) {
        double[] weights = new double[neighbors[index].length];
        Arrays.fill(weights, rowWeight(index, transform));
        return weights;
    }

    @Override
    public int cardinality(int index) {
        return neighbors[index].length;
    }

    @Override
    public double s0() {
        return aggregates()[0];
    }

    @Override
    public double s1() {
        return aggregates()[1];
    }

    @Override
    public double s2() {
        return aggregates()[2];
    }

    @Override
    public SparseSpatialWeights copy() {
        return new SparseSpatialWeights(ids, neighbors, transform);
    }

    private double rowWeight(int index, WeightsTransform t) {
        int cardinality = neighbors[index].length;
        if (cardinality == 0) {
            return 0.0;
        }
        return t == WeightsTransform.BINARY ? 1.0 : 1.0 / cardinality;
    }

    private boolean hasEdge(int from, int to) {
        return Arrays.binarySearch(neighbors[from], to) >= 0;
    }

    private double[] aggregates() {
        return aggregates.computeIfAbsent(transform, this::computeAggregates);
    }

    private double[] computeAggregates(WeightsTransform t) {
        int n = neighbors.length;
        double[] rowSums = new double[n];
        double[] colSums = new double[n];
        double s0 = 0.0;
        double s1Twice = 0.0;

        for (int i = 0; i < n; i++) {
            double wi = rowWeight(i, t);
            for (int j : neighbors[i]) {
                rowSums[i] += wi;
                colSums[j] += wi;
                s0 += wi;
                if (hasEdge(j, i)) {
                    double pair = wi + rowWeight(j, t);
                    s1Twice += pair * pair;
                } else {
                    // (j,i) has no edge of its own, so it is counted here
                    s1Twice += 2.0 * wi * wi;
                }
            }
        }

        double s2 = 0.0;
        for (int i = 0; i < n; i++) {
            double total = rowSums[i] + colSums[i];
            s2 += total * total;
        }
        return new double[]{s0, 0.5 * s1Twice, s2};
    }

    @Override
    public String toString() {
        return String.format("SparseSpatialWeights{n=%d, transform=%s, maxCardinality=%d}",
            size(), transform, maxCardinality());
    }

    /// Collects neighbor lists keyed by location id.
    ///
    /// Location order is the order in which ids are first declared with
    /// [#neighbors(String, String...)] or [#location(String)].
    public static final class Builder {

        private final Map<String, List<String>> adjacency = new LinkedHashMap<>();
        private WeightsTransform transform = WeightsTransform.BINARY;

        private Builder() {
        }

        /// Declares a location without adding neighbors.
        ///
        /// @param id the location id
        /// @return this builder
        public Builder location(String id) {
            adjacency.computeIfAbsent(Objects.requireNonNull(id, "id cannot be null"), k -> new ArrayList<>());
            return this;
        }

        /// Declares a location and appends neighbors to it.
        ///
        /// @param id the location id
        /// @param neighborIds ids of its neighbors; they must be declared before [#build()]
        /// @return this builder
        public Builder neighbors(String id, String... neighborIds) {
            location(id);
            Collections.addAll(adjacency.get(id), neighborIds);
            return this;
        }

        /// @param transform the initial transform, binary by default
        /// @return this builder
        public Builder transform(WeightsTransform transform) {
            this.transform = Objects.requireNonNull(transform, "transform cannot be null");
            return this;
        }

        /// @return the weights graph
        /// @throws IllegalArgumentException on unknown ids, self-neighbors or duplicates
        public SparseSpatialWeights build() {
            List<String> ids = List.copyOf(adjacency.keySet());
            Map<String, Integer> index = new LinkedHashMap<>();
            for (int i = 0; i < ids.size(); i++) {
                index.put(ids.get(i), i);
            }

            int[][] neighbors = new int[ids.size()][];
            for (int i = 0; i < ids.size(); i++) {
                String id = ids.get(i);
                List<String> declared = adjacency.get(id);
                int[] row = new int[declared.size()];
                for (int j = 0; j < row.length; j++) {
                    Integer target = index.get(declared.get(j));
                    if (target == null) {
                        throw new IllegalArgumentException(
                            "Location '" + id + "' references unknown neighbor '" + declared.get(j) + "'");
                    }
                    if (target == i) {
                        throw new IllegalArgumentException("Location '" + id + "' cannot neighbor itself");
                    }
                    row[j] = target;
                }
                Arrays.sort(row);
                for (int j = 1; j < row.length; j++) {
                    if (row[j] == row[j - 1]) {
                        throw new IllegalArgumentException(
                            "Location '" + id + "' lists neighbor '" + ids.get(row[j]) + "' more than once");
                    }
                }
                neighbors[i] = row;
            }
            return new SparseSpatialWeights(ids, neighbors, transform);
        }
    }
}
