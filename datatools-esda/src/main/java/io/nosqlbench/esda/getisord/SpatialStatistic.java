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

/// Uniform read access to a computed statistic, for collaborators that attach
/// results to tabular data by name.
public interface SpatialStatistic {

    /// @return short name used to label derived columns, e.g. `g` or `g_local`
    String name();

    /// @return the primary statistic: a `Double` for global statistics, a
    ///     `double[]` for local ones
    Object statistic();

    /// Reads a p-value field by name.
    ///
    /// | Name | Field |
    /// |------|-------|
    /// | `sim` | permutation pseudo p-value |
    /// | `z_sim` | normal approximation fitted to the permutations |
    /// | `norm` | analytic normal p-value |
    ///
    /// @param field the p-value name
    /// @return a `Double` or `double[]` matching [#statistic()]
    /// @throws IllegalArgumentException if the name is unknown
    /// @throws IllegalStateException if a permutation field is requested but no
    ///     permutations were run
    Object pValue(String field);
}
