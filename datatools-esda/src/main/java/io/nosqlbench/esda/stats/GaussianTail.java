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

import org.apache.commons.math3.special.Erf;

/// Standard normal survival function via the complementary error function.
///
/// ```text
///   1 - Φ(z) = ½ · erfc(z / √2)
///
///   z = 0   → 0.5
///   z = 1   → 0.15866
///   z = 2   → 0.02275
///   z = 3   → 0.00135
/// ```
///
/// Using `erfc` directly keeps relative precision deep in the upper tail,
/// where `1 - Φ(z)` computed from the CDF would round to zero.
public final class GaussianTail implements NormalTail {

    /// Shared stateless instance.
    public static final GaussianTail INSTANCE = new GaussianTail();

    private static final double SQRT2 = Math.sqrt(2.0);

    private GaussianTail() {
    }

    @Override
    public double survival(double z) {
        if (Double.isNaN(z)) {
            return Double.NaN;
        }
        return 0.5 * Erf.erfc(z / SQRT2);
    }
}
