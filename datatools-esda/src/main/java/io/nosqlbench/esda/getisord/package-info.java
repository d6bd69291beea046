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

/// Getis-Ord global and local spatial association statistics.
///
/// ## Key Components
///
/// - {@link io.nosqlbench.esda.getisord.GlobalG}: global G with analytic moments and permutation inference
/// - {@link io.nosqlbench.esda.getisord.LocalG}: local G and G* with conditional permutation inference
/// - {@link io.nosqlbench.esda.getisord.GetisOrdConfig}: JSON options shared by both statistics
///
/// ## Usage Example
///
/// ```java
/// SparseSpatialWeights w = SparseSpatialWeights.builder()
///     .neighbors("a", "b", "c")
///     ...
///     .build();
/// GetisOrdConfig config = GetisOrdConfig.defaults().withSeed(12345L).withStar(true);
/// LocalGResult hotSpots = LocalG.compute(values, w, config);
/// double[] p = hotSpots.simulation().orElseThrow().pSim();
/// ```
package io.nosqlbench.esda.getisord;
