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

/// Raised when a [TransformScope] closes and finds that the graph's transform
/// was changed by someone else while the scope was open.
///
/// This indicates that a single [SpatialWeights] instance was shared between
/// concurrent computations, which is a caller contract violation.
public class TransformRestoreException extends IllegalStateException {

    private final WeightsTransform expected;
    private final WeightsTransform found;

    /// @param expected the transform the scope applied
    /// @param found the transform present at close
    /// @param restored the transform the scope restored
    public TransformRestoreException(WeightsTransform expected, WeightsTransform found, WeightsTransform restored) {
        super("Weights transform changed while in use: expected " + expected + " but found " + found
            + " (restored " + restored + ")");
        this.expected = expected;
        this.found = found;
    }

    /// @return the transform the scope applied
    public WeightsTransform getExpected() {
        return expected;
    }

    /// @return the transform present at close
    public WeightsTransform getFound() {
        return found;
    }
}
