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

import java.util.Objects;

/// Spatial lag: the weighted sum of each location's neighbor values under the
/// graph's current transform.
///
/// ```text
///   lag[i] = Σ_j w_ij · y[j]
/// ```
public final class SpatialLag {

    private SpatialLag() {
        // Utility class
    }

    /// @param weights the weights graph, read under its current transform
    /// @param values one value per location, in location order
    /// @return the spatial lag of `values`
    /// @throws IllegalArgumentException if the lengths disagree
    public static double[] lag(SpatialWeights weights, double[] values) {
        Objects.requireNonNull(weights, "weights cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        int n = weights.size();
        if (values.length != n) {
            throw new IllegalArgumentException(
                "Vector length " + values.length + " does not match " + n + " weights locations");
        }

        double[] lag = new double[n];
        for (int i = 0; i < n; i++) {
            int[] neighbors = weights.neighbors(i);
            double[] w = weights.weights(i);
            double sum = 0.0;
            for (int k = 0; k < neighbors.length; k++) {
                sum += w[k] * values[neighbors[k]];
            }
            lag[i] = sum;
        }
        return lag;
    }
}
