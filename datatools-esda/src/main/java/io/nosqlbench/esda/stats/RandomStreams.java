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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.PermutationSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.Locale;

/**
 * Seeded random streams for permutation inference.
 * Based on Apache Commons RNG, so a given algorithm and seed always
 * reproduce the same draws regardless of JDK version.
 */
public final class RandomStreams {

    private RandomStreams() {
        // Utility class
    }

    /**
     * Available PRNG algorithms.
     * XO_SHI_RO_256_PP is the default for its speed and statistical quality.
     */
    public enum Algorithm {
        /** XorShiRo256++, 256-bit state, period 2^256 - 1. */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP),

        /** XorShiRo128++, 128-bit state, period 2^128 - 1. */
        XO_SHI_RO_128_PP(RandomSource.XO_SHI_RO_128_PP),

        /** SplitMix64, 64-bit state, period 2^64. */
        SPLIT_MIX_64(RandomSource.SPLIT_MIX_64),

        /** Mersenne Twister, 19937-bit state. */
        MT(RandomSource.MT);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }

        /**
         * Resolves an algorithm by name, ignoring case.
         *
         * @param name the enum constant name
         * @return the algorithm
         * @throws IllegalArgumentException if no algorithm has that name
         */
        public static Algorithm fromName(String name) {
            if (name == null) {
                throw new IllegalArgumentException("Random algorithm name cannot be null");
            }
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Creates a seeded generator with the given algorithm.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm, long seed) {
        return algorithm.getSource().create(seed);
    }

    /**
     * Creates a seeded generator with the default algorithm.
     *
     * @param seed the seed
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(long seed) {
        return create(Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /**
     * Creates a generator seeded from system entropy.
     *
     * @param algorithm the PRNG algorithm
     * @return a uniform random provider
     */
    public static UniformRandomProvider create(Algorithm algorithm) {
        return algorithm.getSource().create();
    }

    /**
     * Returns the first {@code k} entries of a uniformly random permutation of {@code [0, n)}.
     *
     * @param rng the random source
     * @param n size of the index range
     * @param k number of entries to keep, 1 &le; k &le; n
     * @return k distinct indices in random order
     */
    public static int[] partialPermutation(UniformRandomProvider rng, int n, int k) {
        return new PermutationSampler(rng, n, k).sample();
    }

    /**
     * Shuffles an index array in place (Fisher-Yates).
     *
     * @param rng the random source
     * @param indices the array to shuffle
     */
    public static void shuffle(UniformRandomProvider rng, int[] indices) {
        PermutationSampler.shuffle(rng, indices);
    }

    /**
     * Returns a copy of {@code values} with its entries permuted uniformly at random.
     *
     * @param rng the random source
     * @param values the values to permute
     * @return the permuted copy
     */
    public static double[] permute(UniformRandomProvider rng, double[] values) {
        int[] order = PermutationSampler.natural(values.length);
        PermutationSampler.shuffle(rng, order);
        double[] permuted = new double[values.length];
        for (int i = 0; i < order.length; i++) {
            permuted[i] = values[order[i]];
        }
        return permuted;
    }
}
