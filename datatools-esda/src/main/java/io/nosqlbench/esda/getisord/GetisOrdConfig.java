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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.esda.stats.RandomStreams;
import io.nosqlbench.esda.weights.WeightsTransform;
import org.apache.commons.rng.UniformRandomProvider;

import java.io.Reader;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON-serializable options for a Getis-Ord computation.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "permutations": 999,
 *   "seed": 12345,                  // optional, entropy seeded when absent
 *   "transform": "R",               // local statistic only: "R" or "B"
 *   "star": false,                  // local statistic only: G* when true
 *   "algorithm": "XO_SHI_RO_256_PP" // optional RNG algorithm
 * }
 * }</pre>
 *
 * <p>Absent fields take their defaults. Instances are immutable; the
 * {@code withX} methods return modified copies.
 */
public final class GetisOrdConfig {

    /** Default number of permutation rounds. */
    public static final int DEFAULT_PERMUTATIONS = 999;

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    @SerializedName("permutations")
    private Integer permutations;

    @SerializedName("seed")
    private Long seed;

    @SerializedName("transform")
    private String transform;

    @SerializedName("star")
    private Boolean star;

    @SerializedName("algorithm")
    private String algorithm;

    private GetisOrdConfig() {
    }

    private GetisOrdConfig(GetisOrdConfig other) {
        this.permutations = other.permutations;
        this.seed = other.seed;
        this.transform = other.transform;
        this.star = other.star;
        this.algorithm = other.algorithm;
    }

    /**
     * @return a configuration with every default applied
     */
    public static GetisOrdConfig defaults() {
        return new GetisOrdConfig();
    }

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON object text
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static GetisOrdConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return validated(GSON.fromJson(json, GetisOrdConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid Getis-Ord configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a configuration from a JSON reader.
     *
     * @param reader source of the JSON object text
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or a value is invalid
     */
    public static GetisOrdConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        try {
            return validated(GSON.fromJson(reader, GetisOrdConfig.class));
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid Getis-Ord configuration: " + e.getMessage(), e);
        }
    }

    private static GetisOrdConfig validated(GetisOrdConfig config) {
        if (config == null) {
            return defaults();
        }
        if (config.permutations != null && config.permutations < 0) {
            throw new IllegalArgumentException("permutations must be >= 0, got " + config.permutations);
        }
        config.getTransform();
        config.getAlgorithm();
        return config;
    }

    /**
     * @return this configuration as pretty-printed JSON
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * @return number of permutation rounds, {@value #DEFAULT_PERMUTATIONS} by default
     */
    public int getPermutations() {
        return permutations != null ? permutations : DEFAULT_PERMUTATIONS;
    }

    /**
     * @return the seed, if one was configured
     */
    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    /**
     * @return the local weights transform, row-standardized by default
     */
    public WeightsTransform getTransform() {
        return transform != null ? WeightsTransform.fromCode(transform) : WeightsTransform.ROW_STANDARDIZED;
    }

    /**
     * @return true for G*, false by default
     */
    public boolean isStar() {
        return star != null && star;
    }

    /**
     * @return the RNG algorithm, XO_SHI_RO_256_PP by default
     */
    public RandomStreams.Algorithm getAlgorithm() {
        if (algorithm == null) {
            return RandomStreams.Algorithm.XO_SHI_RO_256_PP;
        }
        try {
            return RandomStreams.Algorithm.fromName(algorithm);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown random algorithm '" + algorithm + "'", e);
        }
    }

    /**
     * Creates the random stream this configuration describes.
     *
     * @return a generator seeded with {@link #getSeed()} or from entropy
     */
    public UniformRandomProvider newRandom() {
        RandomStreams.Algorithm algo = getAlgorithm();
        return seed != null ? RandomStreams.create(algo, seed) : RandomStreams.create(algo);
    }

    public GetisOrdConfig withPermutations(int permutations) {
        if (permutations < 0) {
            throw new IllegalArgumentException("permutations must be >= 0, got " + permutations);
        }
        GetisOrdConfig copy = new GetisOrdConfig(this);
        copy.permutations = permutations;
        return copy;
    }

    public GetisOrdConfig withSeed(long seed) {
        GetisOrdConfig copy = new GetisOrdConfig(this);
        copy.seed = seed;
        return copy;
    }

    public GetisOrdConfig withTransform(WeightsTransform transform) {
        GetisOrdConfig copy = new GetisOrdConfig(this);
        copy.transform = Objects.requireNonNull(transform, "transform cannot be null").code();
        return copy;
    }

    public GetisOrdConfig withStar(boolean star) {
        GetisOrdConfig copy = new GetisOrdConfig(this);
        copy.star = star;
        return copy;
    }

    public GetisOrdConfig withAlgorithm(RandomStreams.Algorithm algorithm) {
        GetisOrdConfig copy = new GetisOrdConfig(this);
        copy.algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null").name();
        return copy;
    }

    @Override
    public String toString() {
        return String.format("GetisOrdConfig{permutations=%d, seed=%s, transform=%s, star=%s, algorithm=%s}",
            getPermutations(), seed, getTransform().code(), isStar(), getAlgorithm());
    }
}
