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

import io.nosqlbench.esda.stats.Cancellation;
import io.nosqlbench.esda.stats.RandomStreams;
import org.apache.commons.rng.UniformRandomProvider;

import java.util.Arrays;
import java.util.Objects;

/// Two-stage sampler for conditional permutation of local statistics.
///
/// Under the conditional null, location `i` keeps its own value and its
/// `cardinality_i` neighbor slots are filled with values drawn without
/// replacement from the other `n − 1` locations.
///
/// ```text
///   stage 1 (once per run)        stage 2 (once per location)
///   ┌───────────────────────┐     ┌───────────────────────────┐
///   │ rounds × k positions  │     │ pool_i = shuffle(others)  │
///   │ row r = first k of a  │ ──► │ sum_r = Σ y[pool_i[p]]    │
///   │ permutation of [0,n-1)│     │ for p in row r[0..card_i) │
///   └───────────────────────┘     └───────────────────────────┘
/// ```
///
/// The position matrix is shared by every location and composed with a
/// per-location shuffled pool, so one location's draws cost O(cardinality)
/// per round. Both stages draw from the same stream in this order, which
/// makes the simulated sums reproducible for a fixed seed. Simulated
/// distributions of different locations are correlated through the shared
/// matrix.
public final class ConditionalPermutation {

    private ConditionalPermutation() {
    }

    /// Draws the shared position matrix (stage 1).
    ///
    /// Each row holds the first `k = min(maxCardinality + 1, n − 1)` entries of
    /// a random permutation of `[0, n − 1)`. Cancellation is checked before each
    /// row; the returned matrix has one row per completed round.
    ///
    /// @param rng random source
    /// @param n number of locations
    /// @param maxCardinality largest neighbor count in the graph
    /// @param permutations rounds requested
    /// @param cancellation polled before each round
    /// @return position rows, at most `permutations` of them
    public static int[][] positions(UniformRandomProvider rng, int n, int maxCardinality, int permutations,
                                    Cancellation cancellation) {
        Objects.requireNonNull(rng, "rng cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");
        int candidates = n - 1;
        int k = Math.min(maxCardinality + 1, candidates);
        int[][] rows = new int[permutations][];
        int completed = 0;
        while (completed < permutations && !cancellation.isCancelled()) {
            rows[completed++] = RandomStreams.partialPermutation(rng, candidates, k);
        }
        return completed == permutations ? rows : Arrays.copyOf(rows, completed);
    }

    /// Randomized neighbor sums for one location (stage 2).
    ///
    /// @param rng random source, used once to shuffle this location's pool
    /// @param y attribute values
    /// @param location the focal location, excluded from its own pool
    /// @param cardinality number of neighbor slots to fill
    /// @param positions the shared position matrix
    /// @return one neighbor sum per position row
    public static double[] neighborSums(UniformRandomProvider rng, double[] y, int location, int cardinality,
                                        int[][] positions) {
        int[] pool = new int[y.length - 1];
        for (int j = 0, p = 0; j < y.length; j++) {
            if (j != location) {
                pool[p++] = j;
            }
        }
        RandomStreams.shuffle(rng, pool);

        double[] sums = new double[positions.length];
        for (int r = 0; r < positions.length; r++) {
            int[] row = positions[r];
            double sum = 0.0;
            for (int slot = 0; slot < cardinality; slot++) {
                sum += y[pool[row[slot]]];
            }
            sums[r] = sum;
        }
        return sums;
    }
}
