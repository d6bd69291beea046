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

package io.nosqlbench.esda.stats;

import java.util.Objects;

/// Power sums of an attribute vector and the moments derived from them.
///
/// @param n number of values
/// @param sum Σy
/// @param sum2 Σy²
/// @param sum3 Σy³
/// @param sum4 Σy⁴
public record MomentSums(int n, double sum, double sum2, double sum3, double sum4) {

    /// Computes the power sums in one pass.
    ///
    /// @param values the attribute vector
    /// @return the sums
    public static MomentSums of(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        double s1 = 0.0;
        double s2 = 0.0;
        double s3 = 0.0;
        double s4 = 0.0;
        for (double v : values) {
            double v2 = v * v;
            s1 += v;
            s2 += v2;
            s3 += v2 * v;
            s4 += v2 * v2;
        }
        return new MomentSums(values.length, s1, s2, s3, s4);
    }

    /// @return arithmetic mean
    public double mean() {
        return sum / n;
    }

    /// @return population variance (divisor n)
    public double variance() {
        double mean = mean();
        return sum2 / n - mean * mean;
    }

    /// Sum of `y_i · y_j` over all ordered pairs with `i != j`, from the sums
    /// rather than by enumerating pairs.
    ///
    /// @return `(Σy)² - Σy²`
    public double distinctPairProductSum() {
        return sum * sum - sum2;
    }
}
