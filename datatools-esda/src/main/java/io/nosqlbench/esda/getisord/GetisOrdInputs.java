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

package io.nosqlbench.esda.getisord;

import io.nosqlbench.esda.weights.SpatialWeights;

import java.util.Objects;

/// Argument checks shared by the global and local engines. Every check runs
/// before any weights mutation or random draw.
final class GetisOrdInputs {

    /// The fourth-moment formulas divide by n(n-1)(n-2)(n-3).
    static final int MIN_LOCATIONS = 4;

    private GetisOrdInputs() {
    }

    /// @return a private copy of `y`
    static double[] validate(double[] y, SpatialWeights w, int permutations) {
        Objects.requireNonNull(y, "attribute vector cannot be null");
        Objects.requireNonNull(w, "weights cannot be null");
        int n = y.length;
        if (w.size() != n) {
            throw new IllegalArgumentException(
                "Attribute vector has " + n + " values but weights have " + w.size() + " locations");
        }
        if (n < MIN_LOCATIONS) {
            throw new IllegalArgumentException(
                "At least " + MIN_LOCATIONS + " locations are required, got " + n);
        }
        if (permutations < 0) {
            throw new IllegalArgumentException("permutations must be >= 0, got " + permutations);
        }
        for (int i = 0; i < n; i++) {
            if (!Double.isFinite(y[i])) {
                throw new IllegalArgumentException("Attribute value at index " + i + " is not finite: " + y[i]);
            }
            if (w.cardinality(i) > n - 1) {
                throw new IllegalArgumentException(
                    "Location " + w.locationOrder().get(i) + " has " + w.cardinality(i)
                        + " neighbors, more than n-1 = " + (n - 1));
            }
        }
        return y.clone();
    }
}
