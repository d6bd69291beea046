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

import java.util.Objects;

/**
 * Permutation (Monte Carlo) inference shared by the global and local statistics.
 *
 * <p>Both statistics reduce a simulated null distribution the same way:
 * <ul>
 *   <li>a tail count of simulated values at least as large as the observed value,
 *       folded onto the smaller tail</li>
 *   <li>a pseudo p-value {@code (larger + 1) / (permutations + 1)}</li>
 *   <li>a normal approximation fitted to the simulated sample</li>
 * </ul>
 */
public final class PermutationInference {

    private PermutationInference() {
        // Utility class
    }

    /**
     * Mean and spread of a simulated sample.
     *
     * @param count number of simulated values
     * @param mean sample mean
     * @param stdDev population standard deviation (divisor {@code count})
     * @param variance {@code stdDev²}
     */
    public record SimulationSummary(long count, double mean, double stdDev, double variance) {

        /**
         * Standardizes an observed value against this summary.
         *
         * @param observed the observed statistic
         * @return {@code (observed - mean) / stdDev}, non-finite when the spread is zero
         */
        public double zScore(double observed) {
            return (observed - mean) / stdDev;
        }
    }

    /**
     * Counts simulated values {@code >= observed} and folds the count onto the
     * smaller tail.
     *
     * @param simulated simulated statistics, one per round
     * @param observed the observed statistic
     * @return {@code min(larger, rounds - larger)}
     */
    public static int tailCount(double[] simulated, double observed) {
        Objects.requireNonNull(simulated, "simulated cannot be null");
        int larger = 0;
        for (double value : simulated) {
            if (value >= observed) {
                larger++;
            }
        }
        int rounds = simulated.length;
        if (rounds - larger < larger) {
            larger = rounds - larger;
        }
        return larger;
    }

    /**
     * Pseudo p-value from a folded tail count.
     *
     * @param tailCount result of {@link #tailCount(double[], double)}
     * @param rounds number of simulated rounds
     * @return {@code (tailCount + 1) / (rounds + 1)}, within {@code [1/(rounds+1), 1]}
     */
    public static double pseudoPValue(int tailCount, int rounds) {
        return (tailCount + 1.0) / (rounds + 1.0);
    }

    /**
     * Pseudo p-value of an observed statistic against its simulated sample.
     *
     * @param simulated simulated statistics
     * @param observed the observed statistic
     * @return the pseudo p-value
     */
    public static double pseudoPValue(double[] simulated, double observed) {
        return pseudoPValue(tailCount(simulated, observed), simulated.length);
    }

    /**
     * Summarizes one simulated sample.
     *
     * @param simulated simulated statistics
     * @return mean and population spread
     */
    public static SimulationSummary summarize(double[] simulated) {
        return summarize(new double[][]{simulated});
    }

    /**
     * Summarizes several simulated samples as one pooled sample.
     *
     * @param samples simulated statistics, one row per sample
     * @return mean and population spread over every value in every row
     */
    public static SimulationSummary summarize(double[][] samples) {
        Objects.requireNonNull(samples, "samples cannot be null");
        long count = 0;
        double sum = 0.0;
        for (double[] row : samples) {
            for (double v : row) {
                sum += v;
            }
            count += row.length;
        }
        if (count == 0) {
            return new SimulationSummary(0, Double.NaN, Double.NaN, Double.NaN);
        }
        double mean = sum / count;
        double squares = 0.0;
        for (double[] row : samples) {
            for (double v : row) {
                double d = v - mean;
                squares += d * d;
            }
        }
        double stdDev = Math.sqrt(squares / count);
        return new SimulationSummary(count, mean, stdDev, stdDev * stdDev);
    }
}
