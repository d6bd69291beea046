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
import io.nosqlbench.esda.stats.GaussianTail;
import io.nosqlbench.esda.stats.MomentSums;
import io.nosqlbench.esda.stats.NormalTail;
import io.nosqlbench.esda.stats.PermutationInference;
import io.nosqlbench.esda.stats.RandomStreams;
import io.nosqlbench.esda.weights.SpatialLag;
import io.nosqlbench.esda.weights.SpatialWeights;
import io.nosqlbench.esda.weights.TransformScope;
import io.nosqlbench.esda.weights.WeightsTransform;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;

/// # Global Getis-Ord G
///
/// Measures whether high or low attribute values cluster across the whole
/// weights graph.
///
/// ```text
///          Σ_i Σ_j w_ij · y_i · y_j
///   G = ───────────────────────────      (binary weights, i ≠ j)
///            (Σy)² − Σy²
/// ```
///
/// ## Inference
/// - **Normality**: `EG = s0 / (n(n−1))`, `VG = EG2 − EG²` with `EG2` from the
///   fourth-moment polynomial below; `z_norm = (G − EG)/√VG`.
/// - **Permutation**: G recomputed for random full permutations of `y` over
///   the fixed graph.
///
/// ```text
///   b0 = (n² − 3n + 3)s1 − n·s2 + 3s0²
///   b1 = −[(n² − n)s1 − 2n·s2 + 6s0²]
///   b2 = −[2n·s1 − (n + 3)s2 + 6s0²]
///   b3 = 4(n − 1)s1 − 2(n + 1)s2 + 8s0²
///   b4 = s1 − s2 + s0²
///
///         b0(Σy²)² + b1Σy⁴ + b2(Σy)²Σy² + b3ΣyΣy³ + b4(Σy)⁴
///   EG2 = ──────────────────────────────────────────────────
///              ((Σy)² − Σy²)² · n(n−1)(n−2)(n−3)
/// ```
///
/// The statistic is defined over binary adjacency, so the weights are forced
/// to [WeightsTransform#BINARY] for the duration of the call and the caller's
/// transform is restored afterwards.
///
/// ## Usage
/// ```java
/// GlobalGResult g = GlobalG.compute(y, w, GetisOrdConfig.defaults().withSeed(10));
/// double p = g.simulation().map(GlobalGResult.Simulation::pSim).orElse(g.getPNorm());
/// ```
public final class GlobalG {

    private static final Logger logger = LogManager.getLogger(GlobalG.class);

    private GlobalG() {
        // Static entry points only
    }

    /// Computes G with entropy-seeded permutations.
    ///
    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param permutations permutation rounds, 0 to skip permutation inference
    /// @return the result
    public static GlobalGResult compute(double[] y, SpatialWeights w, int permutations) {
        return compute(y, w, GetisOrdConfig.defaults().withPermutations(permutations));
    }

    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param config permutation count, seed and RNG algorithm; transform and star are ignored
    /// @return the result
    public static GlobalGResult compute(double[] y, SpatialWeights w, GetisOrdConfig config) {
        return compute(y, w, config, Cancellation.never());
    }

    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param config permutation count, seed and RNG algorithm
    /// @param cancellation polled between permutation rounds
    /// @return the result
    public static GlobalGResult compute(double[] y, SpatialWeights w, GetisOrdConfig config,
                                        Cancellation cancellation) {
        Objects.requireNonNull(config, "config cannot be null");
        return compute(y, w, config.getPermutations(), config.newRandom(), cancellation, GaussianTail.INSTANCE);
    }

    /// Computes G with caller-supplied randomness and normal tail.
    ///
    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param permutations permutation rounds, 0 to skip permutation inference
    /// @param rng source of the permutations
    /// @param cancellation polled between permutation rounds
    /// @param normalTail normal survival function
    /// @return the result
    /// @throws IllegalArgumentException on invalid input, before any work
    /// @throws io.nosqlbench.esda.weights.TransformRestoreException if the
    ///     weights transform was changed concurrently
    public static GlobalGResult compute(double[] y, SpatialWeights w, int permutations,
                                        UniformRandomProvider rng, Cancellation cancellation,
                                        NormalTail normalTail) {
        double[] values = GetisOrdInputs.validate(y, w, permutations);
        Objects.requireNonNull(rng, "rng cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");
        Objects.requireNonNull(normalTail, "normalTail cannot be null");

        long start = System.nanoTime();
        try (TransformScope ignored = TransformScope.force(w, WeightsTransform.BINARY)) {
            GlobalGResult result = computeBinary(values, w, permutations, rng, cancellation, normalTail);
            logger.debug("Global G over {} locations with {}/{} permutations in {} ms: {}",
                values.length, result.getCompletedPermutations(), permutations,
                (System.nanoTime() - start) / 1_000_000, result);
            return result;
        }
    }

    private static GlobalGResult computeBinary(double[] y, SpatialWeights w, int permutations,
                                               UniformRandomProvider rng, Cancellation cancellation,
                                               NormalTail normalTail) {
        int n = y.length;
        MomentSums sums = MomentSums.of(y);
        double denominator = sums.distinctPairProductSum();

        double g = statistic(w, y, denominator);

        double s0 = w.s0();
        double s1 = w.s1();
        double s2 = w.s2();
        GlobalGResult.VarianceCoefficients b = coefficients(n, s0, s1, s2);

        double eg = s0 / ((double) n * (n - 1));
        double eg2 = secondMoment(n, sums, b);
        double vg = eg2 - eg * eg;
        double zNorm = (g - eg) / Math.sqrt(vg);
        double pNorm = normalTail.oneSidedPValue(zNorm);
        if (!(vg > 0.0) || !Double.isFinite(zNorm)) {
            logger.warn("Global G variance under normality is degenerate (VG={}); z_norm and p_norm are undefined",
                vg);
        }

        GlobalGResult.Simulation simulation = null;
        int completed = 0;
        if (permutations > 0) {
            double[] sim = new double[permutations];
            while (completed < permutations && !cancellation.isCancelled()) {
                sim[completed++] = statistic(w, RandomStreams.permute(rng, y), denominator);
            }
            if (completed < permutations) {
                logger.info("Global G permutations cancelled after {} of {} rounds", completed, permutations);
            }
            if (completed > 0) {
                simulation = simulate(g, Arrays.copyOf(sim, completed), normalTail);
            }
        }

        return new GlobalGResult(n, g, eg, eg2, vg, zNorm, pNorm, b, permutations,
            completed < permutations, simulation);
    }

    static double statistic(SpatialWeights w, double[] y, double denominator) {
        double[] lag = SpatialLag.lag(w, y);
        double numerator = 0.0;
        for (int i = 0; i < y.length; i++) {
            numerator += y[i] * lag[i];
        }
        return numerator / denominator;
    }

    static GlobalGResult.VarianceCoefficients coefficients(int n, double s0, double s1, double s2) {
        double nd = n;
        double n2 = nd * nd;
        double s02 = s0 * s0;
        double b0 = (n2 - 3 * nd + 3) * s1 - nd * s2 + 3 * s02;
        double b1 = -((n2 - nd) * s1 - 2 * nd * s2 + 6 * s02);
        double b2 = -(2 * nd * s1 - (nd + 3) * s2 + 6 * s02);
        double b3 = 4 * (nd - 1) * s1 - 2 * (nd + 1) * s2 + 8 * s02;
        double b4 = s1 - s2 + s02;
        return new GlobalGResult.VarianceCoefficients(s0, s1, s2, b0, b1, b2, b3, b4);
    }

    static double secondMoment(int n, MomentSums sums, GlobalGResult.VarianceCoefficients b) {
        double sy = sums.sum();
        double sy2 = sums.sum2();
        double numerator = b.b0() * sy2 * sy2
            + b.b1() * sums.sum4()
            + b.b2() * sy * sy * sy2
            + b.b3() * sy * sums.sum3()
            + b.b4() * sy * sy * sy * sy;
        double pairs = sums.distinctPairProductSum();
        double nd = n;
        double denominator = pairs * pairs * nd * (nd - 1) * (nd - 2) * (nd - 3);
        return numerator / denominator;
    }

    private static GlobalGResult.Simulation simulate(double g, double[] sim, NormalTail normalTail) {
        double pSim = PermutationInference.pseudoPValue(sim, g);
        PermutationInference.SimulationSummary summary = PermutationInference.summarize(sim);
        double zSim = summary.zScore(g);
        if (!(summary.stdDev() > 0.0)) {
            logger.warn("Global G permutation distribution has zero spread; z_sim and p_z_sim are undefined");
        }
        return new GlobalGResult.Simulation(sim, pSim, summary.mean(), summary.stdDev(), summary.variance(),
            zSim, normalTail.oneSidedPValue(zSim));
    }
}
