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

import java.util.List;

/// # SpatialWeights
///
/// Read access to a spatial weights graph over a fixed, ordered set of locations.
///
/// ## Purpose
/// This is the only view of the spatial structure that the Getis-Ord engines
/// need. Building the graph (neighbor search, distance bands) happens elsewhere;
/// implementations only have to expose neighbors, weights and the aggregate
/// sums used by the analytic moments.
///
/// ## Aggregates
/// For the weight matrix `W` under the current transform:
///
/// ```text
///   s0 = Σ_i Σ_j w_ij
///   s1 = ½ Σ_i Σ_j (w_ij + w_ji)²
///   s2 = Σ_i (Σ_j w_ij + Σ_j w_ji)²
/// ```
///
/// ## Transform
/// The transform is the one piece of mutable state. Setting it must be
/// idempotent and must not change the neighbor sets. Callers that change it
/// temporarily should do so through [TransformScope] so it is always restored.
///
/// ## Thread Safety
/// Implementations are not required to be thread-safe. Concurrent statistic
/// computations over one graph should each use their own [#copy()].
public interface SpatialWeights {

    /// @return the number of locations
    int size();

    /// @return location ids in the order the attribute vector must follow
    List<String> locationOrder();

    /// @return the current transform
    WeightsTransform transform();

    /// Changes the current transform.
    ///
    /// @param transform the transform to apply
    void setTransform(WeightsTransform transform);

    /// @param index location index in [#locationOrder()]
    /// @return indices of the neighbors of that location
    int[] neighbors(int index);

    /// @param index location index in [#locationOrder()]
    /// @return weights aligned with [#neighbors(int)] under the current transform
    double[] weights(int index);

    /// @param index location index in [#locationOrder()]
    /// @return the number of neighbors of that location
    int cardinality(int index);

    /// @return neighbor counts for every location, in location order
    default int[] cardinalities() {
        int[] cardinalities = new int[size()];
        for (int i = 0; i < cardinalities.length; i++) {
            cardinalities[i] = cardinality(i);
        }
        return cardinalities;
    }

    /// @return the largest neighbor count over all locations
    default int maxCardinality() {
        int max = 0;
        for (int i = 0; i < size(); i++) {
            max = Math.max(max, cardinality(i));
        }
        return max;
    }

    /// @return sum of all weights under the current transform
    double s0();

    /// @return `½ Σ_i Σ_j (w_ij + w_ji)²` under the current transform
    double s1();

    /// @return `Σ_i (row_i + col_i)²` under the current transform
    double s2();

    /// @return an independent graph with the same neighbors and transform
    SpatialWeights copy();
}
