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

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/// Weight transform applied to the edges of a [SpatialWeights] graph.
///
/// A transform rescales edge weights without changing the neighbor set:
///
/// | Transform | Code | Edge weight w_ij |
/// |-----------|------|------------------|
/// | [#BINARY] | `B` | 1 |
/// | [#ROW_STANDARDIZED] | `R` | 1 / cardinality_i |
///
/// Rows without neighbors stay all-zero under either transform. JSON output
/// uses the code, the same form [#fromCode(String)] accepts.
public enum WeightsTransform {

    /// Every edge has weight 1.
    @SerializedName("B")
    BINARY("B"),

    /// Each row's weights sum to 1.
    @SerializedName("R")
    ROW_STANDARDIZED("R");

    private final String code;

    WeightsTransform(String code) {
        this.code = code;
    }

    /// @return the single-letter code for this transform
    public String code() {
        return code;
    }

    /// Resolves a transform from its single-letter code, ignoring case.
    ///
    /// @param code `B` or `R`
    /// @return the matching transform
    /// @throws IllegalArgumentException if the code is not recognized
    public static WeightsTransform fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toUpperCase(Locale.ROOT);
            for (WeightsTransform transform : values()) {
                if (transform.code.equals(normalized)) {
                    return transform;
                }
            }
        }
        throw new IllegalArgumentException("Unknown weights transform '" + code + "', expected B or R");
    }
}
