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
import io.nosqlbench.esda.weights.SpatialLag;
import io.nosqlbench.esda.weights.SpatialWeights;
import io.nosqlbench.esda.weights.TransformScope;
import io.nosqlbench.esda.weights.WeightsTransform;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// # Local Getis-Ord G and G*
///
/// One statistic per location measuring whether the values around it are
/// unusually high or low.
///
/// ## Variants
///
/// | | G | G* |
/// |---|---|---|
/// | neighbor sum `yl_i` | `lag_i` under the requested transform | `(lag_i(binary) + y_i)`, divided by `cardinality_i + 1` when row-standardized |
/// | `Gs_i` | `yl_i / (Σy − y_i)` | `yl_i / Σy` |
/// | `N` | `n − 1` | `n` |
/// | mean `ȳ_i` | `(Σy − y_i) / N` | `mean(y)` |
/// | variance `s²_i` | `(Σy² − y_i²) / N − ȳ_i²` | population `var(y)` |
///
/// ## Moments under normality
///
/// ```text
///   W_i = cardinality_i + (star ? 1 : 0)
///
///   binary:            EGs_num = W_i,  VGs_num = W_i(N − W_i)/(N − 1)
///   row-standardized:  EGs_num = 1,    VGs_num = 1
///
///   EGs_i = EGs_num / N
///   VGs_i = VGs_num · (1/N²) · (s²_i / ȳ_i²)
///   Zs_i  = (Gs_i − EGs_i) / √VGs_i
/// ```
///
/// ## Conditional permutation
/// Each location keeps its own value while its neighbor slots are refilled
/// from the other locations, see [ConditionalPermutation]. The simulated
/// neighbor sums go through the same self-inclusion and scaling as the
/// observed statistic.
///
/// The weights' transform is changed for the duration of the call and
/// restored before returning.
public final class LocalG {

    private static final Logger logger = LogManager.getLogger(LocalG.class);

    private LocalG() {
        // Static entry points only
    }

    /// Computes local G or G* with entropy-seeded permutations.
    ///
    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param transform binary or row-standardized
    /// @param permutations permutation rounds, 0 to skip permutation inference
    /// @param star true for G*
    /// @return the result
    public static LocalGResult compute(double[] y, SpatialWeights w, WeightsTransform transform,
                                       int permutations, boolean star) {
        Objects.requireNonNull(transform, "transform cannot be null");
        return compute(y, w, GetisOrdConfig.defaults()
            .withTransform(transform)
            .withPermutations(permutations)
            .withStar(star));
    }

    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param config transform, star, permutation count, seed and RNG algorithm
    /// @return the result
    public static LocalGResult compute(double[] y, SpatialWeights w, GetisOrdConfig config) {
        return compute(y, w, config, Cancellation.never());
    }

    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param config transform, star, permutation count, seed and RNG algorithm
    /// @param cancellation polled between permutation rounds
    /// @return the result
    public static LocalGResult compute(double[] y, SpatialWeights w, GetisOrdConfig config,
                                       Cancellation cancellation) {
        Objects.requireNonNull(config, "config cannot be null");
        return compute(y, w, config.getTransform(), config.getPermutations(), config.isStar(),
            config.newRandom(), cancellation, GaussianTail.INSTANCE);
    }

    /// Computes local G or G* with caller-supplied randomness and normal tail.
    ///
    /// @param y attribute values in location order
    /// @param w weights graph
    /// @param transform binary or row-standardized
    /// @param permutations permutation rounds, 0 to skip permutation inference
    /// @param star true for G*
    /// @param rng source of the conditional permutations
    /// @param cancellation polled while drawing the shared position matrix
    /// @param normalTail normal survival function
    /// @return the result
    /// @throws IllegalArgumentException on invalid input, before any work
    /// @throws io.nosqlbench.esda.weights.TransformRestoreException if the
    ///     weights transform was changed concurrently
    public static LocalGResult compute(double[] y, SpatialWeights w, WeightsTransform transform,
                                       int permutations, boolean star, UniformRandomProvider rng,
                                       Cancellation cancellation, NormalTail normalTail) {
        double[] values = GetisOrdInputs.validate(y, w, permutations);
        Objects.requireNonNull(transform, "transform cannot be null");
        Objects.requireNonNull(rng, "rng cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");
        Objects.requireNonNull(normalTail, "normalTail cannot be null");

        long start = System.nanoTime();
        int n = values.length;
        int[] cardinalities = w.cardinalities();
        MomentSums sums = MomentSums.of(values);

        double[] neighborSum;
        try (TransformScope scope = TransformScope.force(w, transform)) {
            if (star) {
                scope.apply(WeightsTransform.BINARY);
            }
            neighborSum = SpatialLag.lag(w, values);
        }

        double[] gs = new double[n];
        double[] localMean = new double[n];
        double[] localVariance = new double[n];
        double bigN = star ? n : n - 1;
        for (int i = 0; i < n; i++) {
            if (star) {
                double yl = neighborSum[i] + values[i];
                if (transform == WeightsTransform.ROW_STANDARDIZED) {
                    yl /= cardinalities[i] + 1.0;
                }
                gs[i] = yl / sums.sum();
                localMean[i] = sums.mean();
                localVariance[i] = sums.variance();
            } else {
                double others = sums.sum() - values[i];
                gs[i] = neighborSum[i] / others;
                localMean[i] = others / bigN;
                localVariance[i] = (sums.sum2() - values[i] * values[i]) / bigN - localMean[i] * localMean[i];
            }
        }

        double[] egs = new double[n];
        double[] vgs = new double[n];
        double[] zs = new double[n];
        double[] pNorm = new double[n];
        boolean degenerate = false;
        for (int i = 0; i < n; i++) {
            double egsNum = 1.0;
            double vgsNum = 1.0;
            if (transform == WeightsTransform.BINARY) {
                double wi = cardinalities[i] + (star ? 1 : 0);
                egsNum = wi;
                vgsNum = wi * (bigN - wi) / (bigN - 1);
            }
            egs[i] = egsNum / bigN;
            vgs[i] = vgsNum * (1.0 / (bigN * bigN)) * (localVariance[i] / (localMean[i] * localMean[i]));
            zs[i] = (gs[i] - egs[i]) / Math.sqrt(vgs[i]);
            pNorm[i] = normalTail.oneSidedPValue(zs[i]);
            degenerate |= !Double.isFinite(zs[i]);
        }
        if (degenerate) {
            logger.warn("Local G{} variance under normality is degenerate for some locations; "
                + "their Zs and p_norm are undefined", star ? "*" : "");
        }

        LocalGResult.Simulation simulation = null;
        int completed = 0;
        if (permutations > 0) {
            int[][] positions = ConditionalPermutation.positions(rng, n, w.maxCardinality(), permutations,
                cancellation);
            completed = positions.length;
            if (completed < permutations) {
                logger.info("Local G{} permutations cancelled after {} of {} rounds",
                    star ? "*" : "", completed, permutations);
            }
            if (completed > 0) {
                simulation = simulate(values, sums, cardinalities, gs, positions, transform, star, rng, normalTail);
            }
        }

        LocalGResult result = new LocalGResult(star, transform, cardinalities, gs, egs, vgs, zs, pNorm,
            permutations, completed < permutations, simulation);
        logger.debug("Local G{} ({}) over {} locations with {}/{} permutations in {} ms",
            star ? "*" : "", transform.code(), n, completed, permutations,
            (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    private static LocalGResult.Simulation simulate(double[] y, MomentSums sums, int[] cardinalities, double[] gs,
                                                    int[][] positions, WeightsTransform transform, boolean star,
                                                    UniformRandomProvider rng, NormalTail normalTail) {
        int n = y.length;
        double self = star ? 1.0 : 0.0;
        double[][] sim = new double[n][];
        double[] pSim = new double[n];
        for (int i = 0; i < n; i++) {
            double[] rounds = ConditionalPermutation.neighborSums(rng, y, i, cardinalities[i], positions);
            double scale = transform == WeightsTransform.ROW_STANDARDIZED && cardinalities[i] + self > 0
                ? cardinalities[i] + self : 1.0;
            double denominator = sums.sum() - (1.0 - self) * y[i];
            for (int r = 0; r < rounds.length; r++) {
                rounds[r] = ((rounds[r] + y[i] * self) / scale) / denominator;
            }
            sim[i] = rounds;
            pSim[i] = PermutationInference.pseudoPValue(rounds, gs[i]);
        }

        // pooled over all locations and rounds
        PermutationInference.SimulationSummary summary = PermutationInference.summarize(sim);
        double[] zSim = new double[n];
        double[] pZSim = new double[n];
        for (int i = 0; i < n; i++) {
            zSim[i] = summary.zScore(gs[i]);
            pZSim[i] = normalTail.oneSidedPValue(zSim[i]);
        }
        return new LocalGResult.Simulation(sim, pSim, summary.mean(), summary.stdDev(), summary.variance(),
            zSim, pZSim);
    }
}
