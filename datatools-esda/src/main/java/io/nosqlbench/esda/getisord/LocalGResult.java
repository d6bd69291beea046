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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.esda.weights.WeightsTransform;

import java.util.Objects;
import java.util.Optional;

/// Result of a local Getis-Ord G or G* computation: one value per location,
/// in the weights' location order.
///
/// Permutation fields live in [#simulation()]. Its spread summaries
/// (`egSim`, `seGSim`, `vgSim`) are pooled over every location's simulated
/// values, so `zSim` standardizes each location against the pooled
/// distribution rather than its own.
public final class LocalGResult implements SpatialStatistic {

    @SerializedName("star")
    private final boolean star;
    @SerializedName("transform")
    private final WeightsTransform transform;
    @SerializedName("cardinalities")
    private final int[] cardinalities;
    @SerializedName("Gs")
    private final double[] gs;
    @SerializedName("EGs")
    private final double[] egs;
    @SerializedName("VGs")
    private final double[] vgs;
    @SerializedName("Zs")
    private final double[] zs;
    @SerializedName("p_norm")
    private final double[] pNorm;
    @SerializedName("permutations")
    private final int requestedPermutations;
    @SerializedName("cancelled")
    private final boolean cancelled;
    @SerializedName("simulation")
    private final Simulation simulation;

    LocalGResult(boolean star, WeightsTransform transform, int[] cardinalities, double[] gs, double[] egs,
                 double[] vgs, double[] zs, double[] pNorm, int requestedPermutations, boolean cancelled,
                 Simulation simulation) {
        this.star = star;
        this.transform = Objects.requireNonNull(transform);
        this.cardinalities = cardinalities.clone();
        this.gs = gs.clone();
        this.egs = egs.clone();
        this.vgs = vgs.clone();
        this.zs = zs.clone();
        this.pNorm = pNorm.clone();
        this.requestedPermutations = requestedPermutations;
        this.cancelled = cancelled;
        this.simulation = simulation;
    }

    /// Conditional permutation inference for the local statistic.
    ///
    /// @param sim simulated statistics, `sim[i][r]` for location `i`, round `r`
    /// @param pSim per-location pseudo p-values
    /// @param egSim mean over all simulated values
    /// @param seGSim population standard deviation over all simulated values
    /// @param vgSim `seGSim²`
    /// @param zSim per-location `(Gs_i − egSim) / seGSim`
    /// @param pZSim per-location one-sided normal p-values of `zSim`
    public record Simulation(@SerializedName("sim") double[][] sim,
                             @SerializedName("p_sim") double[] pSim,
                             @SerializedName("EG_sim") double egSim,
                             @SerializedName("seG_sim") double seGSim,
                             @SerializedName("VG_sim") double vgSim,
                             @SerializedName("z_sim") double[] zSim,
                             @SerializedName("p_z_sim") double[] pZSim) {

        public Simulation {
            sim = deepCopy(sim);
            pSim = pSim.clone();
            zSim = zSim.clone();
            pZSim = pZSim.clone();
        }

        @Override
        public double[][] sim() {
            return deepCopy(sim);
        }

        /// @param location location index
        /// @return simulated statistics of one location
        public double[] sim(int location) {
            return sim[location].clone();
        }

        @Override
        public double[] pSim() {
            return pSim.clone();
        }

        @Override
        public double[] zSim() {
            return zSim.clone();
        }

        @Override
        public double[] pZSim() {
            return pZSim.clone();
        }

        /// @return number of completed permutation rounds, equal for every location
        public int completedPermutations() {
            return sim.length == 0 ? 0 : sim[0].length;
        }

        private static double[][] deepCopy(double[][] values) {
            double[][] copy = new double[values.length][];
            for (int i = 0; i < values.length; i++) {
                copy[i] = values[i].clone();
            }
            return copy;
        }

        @Override
        public String toString() {
            return String.format("Simulation{locations=%d, rounds=%d, egSim=%.6f, seGSim=%.6f}",
                sim.length, completedPermutations(), egSim, seGSim);
        }
    }

    /// @return number of locations
    public int getN() {
        return gs.length;
    }

    /// @return true for G*, which counts each location in its own neighborhood
    public boolean isStar() {
        return star;
    }

    /// @return the transform the statistic was computed under
    public WeightsTransform getTransform() {
        return transform;
    }

    public int[] getCardinalities() {
        return cardinalities.clone();
    }

    /// @return observed statistic per location
    public double[] getGs() {
        return gs.clone();
    }

    /// @return expected value per location under normality
    public double[] getEGs() {
        return egs.clone();
    }

    /// @return variance per location under normality
    public double[] getVGs() {
        return vgs.clone();
    }

    /// @return standardized statistic per location
    public double[] getZs() {
        return zs.clone();
    }

    /// @return one-sided normal p-value per location
    public double[] getPNorm() {
        return pNorm.clone();
    }

    public int getRequestedPermutations() {
        return requestedPermutations;
    }

    public int getCompletedPermutations() {
        return simulation != null ? simulation.completedPermutations() : 0;
    }

    /// @return true if the permutation run stopped early on cancellation
    public boolean isCancelled() {
        return cancelled;
    }

    /// @return permutation inference, if any rounds completed
    public Optional<Simulation> simulation() {
        return Optional.ofNullable(simulation);
    }

    @Override
    public String name() {
        return "g_local";
    }

    @Override
    public Object statistic() {
        return getGs();
    }

    @Override
    public Object pValue(String field) {
        switch (Objects.requireNonNull(field, "field cannot be null")) {
            case "norm":
                return getPNorm();
            case "sim":
                return requireSimulation(field).pSim();
            case "z_sim":
                return requireSimulation(field).pZSim();
            default:
                throw new IllegalArgumentException("Unknown p-value field '" + field + "', expected sim, z_sim or norm");
        }
    }

    private Simulation requireSimulation(String field) {
        if (simulation == null) {
            throw new IllegalStateException("p-value '" + field + "' requires permutations, none were run");
        }
        return simulation;
    }

    @Override
    public String toString() {
        return String.format("LocalGResult{n=%d, star=%s, transform=%s, %s}",
            gs.length, star, transform.code(), simulation != null ? simulation : "no simulation");
    }
}
