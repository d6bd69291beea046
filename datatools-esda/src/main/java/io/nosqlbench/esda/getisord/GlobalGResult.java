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

import java.util.Objects;
import java.util.Optional;

/// Result of a global Getis-Ord G computation.
///
/// Analytic fields are always present. Permutation fields live in
/// [#simulation()], which is empty when no permutations were requested or
/// when the run was cancelled before the first round completed.
///
/// Non-finite `VG`, `z_norm` or `p_norm` mean the analytic variance is
/// degenerate and normality inference is unavailable for this input.
public final class GlobalGResult implements SpatialStatistic {

    @SerializedName("n")
    private final int n;
    @SerializedName("G")
    private final double g;
    @SerializedName("EG")
    private final double eg;
    @SerializedName("EG2")
    private final double eg2;
    @SerializedName("VG")
    private final double vg;
    @SerializedName("z_norm")
    private final double zNorm;
    @SerializedName("p_norm")
    private final double pNorm;
    @SerializedName("coefficients")
    private final VarianceCoefficients coefficients;
    @SerializedName("permutations")
    private final int requestedPermutations;
    @SerializedName("cancelled")
    private final boolean cancelled;
    @SerializedName("simulation")
    private final Simulation simulation;

    GlobalGResult(int n, double g, double eg, double eg2, double vg, double zNorm, double pNorm,
                  VarianceCoefficients coefficients, int requestedPermutations, boolean cancelled,
                  Simulation simulation) {
        this.n = n;
        this.g = g;
        this.eg = eg;
        this.eg2 = eg2;
        this.vg = vg;
        this.zNorm = zNorm;
        this.pNorm = pNorm;
        this.coefficients = Objects.requireNonNull(coefficients);
        this.requestedPermutations = requestedPermutations;
        this.cancelled = cancelled;
        this.simulation = simulation;
    }

    /// Polynomials in `n, s0, s1, s2` used by the second moment of G.
    ///
    /// @param s0 sum of binary weights
    /// @param s1 `½ Σ (w_ij + w_ji)²`
    /// @param s2 `Σ (row_i + col_i)²`
    /// @param b0 coefficient of `(Σy²)²`
    /// @param b1 coefficient of `Σy⁴`
    /// @param b2 coefficient of `(Σy)²·Σy²`
    /// @param b3 coefficient of `Σy·Σy³`
    /// @param b4 coefficient of `(Σy)⁴`
    public record VarianceCoefficients(double s0, double s1, double s2,
                                       double b0, double b1, double b2, double b3, double b4) {
    }

    /// Permutation inference for the global statistic.
    ///
    /// @param sim G for each completed permutation round
    /// @param pSim pseudo p-value from the folded tail count
    /// @param egSim mean of `sim`
    /// @param seGSim population standard deviation of `sim`
    /// @param vgSim `seGSim²`
    /// @param zSim `(G - egSim) / seGSim`
    /// @param pZSim one-sided normal p-value of `zSim`
    public record Simulation(@SerializedName("sim") double[] sim,
                             @SerializedName("p_sim") double pSim,
                             @SerializedName("EG_sim") double egSim,
                             @SerializedName("seG_sim") double seGSim,
                             @SerializedName("VG_sim") double vgSim,
                             @SerializedName("z_sim") double zSim,
                             @SerializedName("p_z_sim") double pZSim) {

        public Simulation {
            sim = sim.clone();
        }

        @Override
        public double[] sim() {
            return sim.clone();
        }

        /// @return number of completed permutation rounds
        public int completedPermutations() {
            return sim.length;
        }

        @Override
        public String toString() {
            return String.format("Simulation{rounds=%d, pSim=%.6f, egSim=%.6f, seGSim=%.6f, zSim=%.6f, pZSim=%.6f}",
                sim.length, pSim, egSim, seGSim, zSim, pZSim);
        }
    }

    /// @return number of locations
    public int getN() {
        return n;
    }

    /// @return the observed statistic
    public double getG() {
        return g;
    }

    /// @return expected G under the null, `s0 / (n(n-1))`
    public double getEG() {
        return eg;
    }

    /// @return second raw moment of G under normality
    public double getEG2() {
        return eg2;
    }

    /// @return variance of G under normality
    public double getVG() {
        return vg;
    }

    /// @return standardized G under normality
    public double getZNorm() {
        return zNorm;
    }

    /// @return one-sided normal p-value of [#getZNorm()]
    public double getPNorm() {
        return pNorm;
    }

    public VarianceCoefficients getCoefficients() {
        return coefficients;
    }

    /// @return permutation rounds the caller asked for
    public int getRequestedPermutations() {
        return requestedPermutations;
    }

    /// @return permutation rounds actually completed
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
        return "g";
    }

    @Override
    public Object statistic() {
        return g;
    }

    @Override
    public Object pValue(String field) {
        switch (Objects.requireNonNull(field, "field cannot be null")) {
            case "norm":
                return pNorm;
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
        return String.format("GlobalGResult{n=%d, G=%.6f, EG=%.6f, VG=%.6g, z_norm=%.6f, p_norm=%.6f, %s}",
            n, g, eg, vg, zNorm, pNorm, simulation != null ? simulation : "no simulation");
    }
}
