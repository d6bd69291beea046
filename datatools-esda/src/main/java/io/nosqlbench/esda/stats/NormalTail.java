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

/// Upper tail of the standard normal distribution.
@FunctionalInterface
public interface NormalTail {

    /// @param z a standard normal quantile
    /// @return `1 - Φ(z)`
    double survival(double z);

    /// One-sided p-value of a standardized statistic: the survival function at `|z|`.
    ///
    /// @param z a standardized statistic, possibly non-finite
    /// @return `1 - Φ(|z|)`, NaN when `z` is NaN
    default double oneSidedPValue(double z) {
        return survival(Math.abs(z));
    }
}
