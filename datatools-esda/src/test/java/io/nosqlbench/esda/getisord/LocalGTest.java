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
import io.nosqlbench.esda.stats.PermutationInference;
import io.nosqlbench.esda.stats.RandomStreams;
import io.nosqlbench.esda.weights.SixPointFixture;
import io.nosqlbench.esda.weights.SparseSpatialWeights;
import io.nosqlbench.esda.weights.TransformFlippingWeights;
import io.nosqlbench.esda.weights.TransformRestoreException;
import io.nosqlbench.esda.weights.WeightsTransform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class LocalGTest {

    private static final double[] ZS_BINARY =
        {-1.0136729, -0.04361589, 1.31558703, -0.31412676, 1.15373986, 1.77833941};
    private static final double[] ZS_BINARY_STAR =
        {-1.39727626, -0.28917762, 0.65064964, -0.28917762, 1.23452088, 2.02424331};
    private static final double[] ZS_ROW =
        {-0.62074534, -0.01780611, 1.31558703, -0.12824171, 0.28843496, 1.77833941};
    private static final double[] ZS_ROW_STAR =
        {-0.62488094, -0.09144599, 0.41150696, -0.09144599, 0.24690418, 1.28024388};

    static Stream<Arguments> variants() {
        return Stream.of(
            Arguments.of(WeightsTransform.BINARY, false, 10L, ZS_BINARY),
            Arguments.of(WeightsTransform.BINARY, true, 10L, ZS_BINARY_STAR),
            Arguments.of(WeightsTransform.ROW_STANDARDIZED, false, 12345L, ZS_ROW),
            Arguments.of(WeightsTransform.ROW_STANDARDIZED, true, 10L, ZS_ROW_STAR)
        );
    }

    private static GetisOrdConfig config(WeightsTransform transform, boolean star, long seed) {
        return GetisOrdConfig.defaults().withTransform(transform).withStar(star).withSeed(seed);
    }

    @ParameterizedTest
    @MethodSource("variants")
    void testStandardizedStatistics(WeightsTransform transform, boolean star, long seed, double[] expectedZs) {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            config(transform, star, seed).withPermutations(0));

        assertThat(lg.getZs()).containsExactly(expectedZs, within(1e-7));
        assertThat(lg.isStar()).isEqualTo(star);
        assertThat(lg.getTransform()).isEqualTo(transform);
        assertThat(Arrays.stream(lg.getPNorm()).boxed().toList()).allSatisfy(p -> assertThat(p).isGreaterThan(0.0).isLessThanOrEqualTo(0.5));
    }

    @ParameterizedTest
    @MethodSource("variants")
    void testFirstLocationPseudoPValue(WeightsTransform transform, boolean star, long seed, double[] ignored) {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), config(transform, star, seed));

        // location 0 sees neighbor values 3 and 5; one of the ten pairs drawn from
        // the other five values has a smaller sum, so p_sim centers on 0.1
        double p0 = lg.simulation().orElseThrow().pSim()[0];
        assertThat(p0).isBetween(0.08, 0.125);
    }

    @ParameterizedTest
    @MethodSource("variants")
    void testRestoresCallerTransform(WeightsTransform transform, boolean star, long seed, double[] ignored) {
        for (WeightsTransform callerTransform : WeightsTransform.values()) {
            SparseSpatialWeights w = SixPointFixture.weights();
            w.setTransform(callerTransform);

            LocalG.compute(SixPointFixture.Y, w, config(transform, star, seed).withPermutations(19));

            assertThat(w.transform()).isEqualTo(callerTransform);
        }
    }

    @Test
    void testSurfacesTransformChangedDuringComputation() {
        SparseSpatialWeights base = SixPointFixture.weights();
        base.setTransform(WeightsTransform.BINARY);
        TransformFlippingWeights w = new TransformFlippingWeights(base);

        assertThatThrownBy(() -> LocalG.compute(SixPointFixture.Y, w, config(WeightsTransform.ROW_STANDARDIZED, false, 10L)))
            .isInstanceOfSatisfying(TransformRestoreException.class, e -> {
                assertThat(e.getExpected()).isEqualTo(WeightsTransform.ROW_STANDARDIZED);
                assertThat(e.getFound()).isEqualTo(WeightsTransform.BINARY);
            });
        assertThat(w.hasFlipped()).isTrue();
        assertThat(base.transform()).isEqualTo(WeightsTransform.BINARY);
    }

    @Test
    void testSurfacesTransformChangedDuringStarComputation() {
        SparseSpatialWeights base = SixPointFixture.weights();
        base.setTransform(WeightsTransform.ROW_STANDARDIZED);
        TransformFlippingWeights w = new TransformFlippingWeights(base);

        assertThatThrownBy(() -> LocalG.compute(SixPointFixture.Y, w, WeightsTransform.BINARY, 0, true))
            .isInstanceOfSatisfying(TransformRestoreException.class, e -> {
                assertThat(e.getExpected()).isEqualTo(WeightsTransform.BINARY);
                assertThat(e.getFound()).isEqualTo(WeightsTransform.ROW_STANDARDIZED);
            });
        assertThat(base.transform()).isEqualTo(WeightsTransform.ROW_STANDARDIZED);
    }

    @Test
    void testObservedValues() {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            WeightsTransform.BINARY, 0, false);

        assertThat(lg.getGs()[0]).isCloseTo(8.0 / 26.2, within(1e-12));
        assertThat(lg.getEGs()[0]).isCloseTo(2.0 / 5.0, within(1e-12));
        assertThat(lg.getCardinalities()).containsExactly(2, 3, 1, 3, 4, 1);

        LocalGResult star = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            WeightsTransform.ROW_STANDARDIZED, 0, true);
        assertThat(star.getGs()[0]).isCloseTo((10.0 / 3.0) / 28.2, within(1e-12));
        assertThat(Arrays.stream(star.getEGs()).boxed().toList()).allSatisfy(e -> assertThat(e).isCloseTo(1.0 / 6.0, within(1e-12)));
    }

    @Test
    void testNoPermutationsLeavesSimulationEmpty() {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            WeightsTransform.ROW_STANDARDIZED, 0, false);

        assertThat(lg.simulation()).isEmpty();
        assertThat(lg.getCompletedPermutations()).isZero();
        assertThat(lg.isCancelled()).isFalse();
        assertThat(Arrays.stream(lg.getZs()).boxed().toList()).allSatisfy(z -> assertThat(Double.isFinite(z)).isTrue());
        assertThat(Arrays.stream(lg.getVGs()).boxed().toList()).allSatisfy(v -> assertThat(v).isPositive());
    }

    @Test
    void testPseudoPValuesFollowTailCounts() {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            config(WeightsTransform.BINARY, false, 77L).withPermutations(499));
        LocalGResult.Simulation sim = lg.simulation().orElseThrow();

        double[] gs = lg.getGs();
        for (int i = 0; i < gs.length; i++) {
            double[] rounds = sim.sim(i);
            assertThat(rounds).hasSize(499);
            int larger = PermutationInference.tailCount(rounds, gs[i]);
            assertThat(sim.pSim()[i]).isEqualTo((larger + 1.0) / 500.0);
            assertThat(sim.pSim()[i]).isBetween(1.0 / 500.0, 1.0);
            assertThat(sim.pZSim()[i]).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    void testSimulationSummariesArePooledAcrossLocations() {
        // EG_sim and seG_sim describe all locations' simulated values together,
        // so z_sim standardizes every location against one pooled distribution
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            config(WeightsTransform.BINARY, false, 10L).withPermutations(999));
        LocalGResult.Simulation sim = lg.simulation().orElseThrow();

        double[] flattened = Arrays.stream(sim.sim()).flatMapToDouble(Arrays::stream).toArray();
        assertThat(flattened).hasSize(6 * 999);
        double pooledMean = Arrays.stream(flattened).average().orElseThrow();
        double pooledVariance = Arrays.stream(flattened).map(v -> (v - pooledMean) * (v - pooledMean))
            .average().orElseThrow();

        assertThat(sim.egSim()).isCloseTo(pooledMean, within(1e-12));
        assertThat(sim.vgSim()).isCloseTo(pooledVariance, within(1e-12));
        assertThat(sim.seGSim()).isCloseTo(Math.sqrt(pooledVariance), within(1e-12));

        double[] gs = lg.getGs();
        for (int i = 0; i < gs.length; i++) {
            assertThat(sim.zSim()[i]).isCloseTo((gs[i] - pooledMean) / Math.sqrt(pooledVariance), within(1e-9));
        }

        // location 4 has four neighbor slots, location 2 has one; their own
        // simulated means differ from the pooled one
        double mean4 = Arrays.stream(sim.sim(4)).average().orElseThrow();
        double mean2 = Arrays.stream(sim.sim(2)).average().orElseThrow();
        assertThat(Math.abs(mean4 - sim.egSim())).isGreaterThan(0.05);
        assertThat(Math.abs(mean2 - sim.egSim())).isGreaterThan(0.05);
    }

    @Test
    void testStarIsScaleInvariant() {
        double[] scaled = Arrays.stream(SixPointFixture.Y).map(v -> v * 3.5).toArray();
        for (WeightsTransform transform : WeightsTransform.values()) {
            LocalGResult base = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), transform, 0, true);
            LocalGResult big = LocalG.compute(scaled, SixPointFixture.weights(), transform, 0, true);

            assertThat(big.getGs()).containsExactly(base.getGs(), within(1e-12));
            assertThat(big.getZs()).containsExactly(base.getZs(), within(1e-9));
        }
    }

    @Test
    void testSeededRunsAreReproducible() {
        GetisOrdConfig config = config(WeightsTransform.ROW_STANDARDIZED, true, 4242L).withPermutations(199);
        LocalGResult first = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), config);
        LocalGResult second = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), config);

        LocalGResult.Simulation a = first.simulation().orElseThrow();
        LocalGResult.Simulation b = second.simulation().orElseThrow();
        for (int i = 0; i < 6; i++) {
            assertThat(b.sim(i)).containsExactly(a.sim(i));
        }
        assertThat(b.pSim()).containsExactly(a.pSim());
    }

    @Test
    void testDegenerateVarianceIsNotFatal() {
        // mean zero: the normal approximation divides by ȳ² = 0
        SparseSpatialWeights ring = SparseSpatialWeights.fromNeighborIndices(
            new int[][]{{1, 3}, {0, 2}, {1, 3}, {2, 0}});
        double[] y = {1, -1, 2, -2};

        LocalGResult lg = LocalG.compute(y, ring, WeightsTransform.BINARY, 0, true);

        assertThat(Arrays.stream(lg.getZs()).boxed().toList()).allSatisfy(z -> assertThat(Double.isFinite(z)).isFalse());
        assertThat(Arrays.stream(lg.getPNorm()).boxed().toList()).allSatisfy(p -> assertThat(Double.isFinite(p)).isFalse());
    }

    @Test
    void testIsolatedLocationUnderRowStandardization() {
        SparseSpatialWeights w = SparseSpatialWeights.fromNeighborIndices(
            new int[][]{{1, 2}, {0, 2}, {0, 1}, {}, {}});
        double[] y = {1, 2, 3, 4, 5};

        LocalGResult lg = LocalG.compute(y, w, GetisOrdConfig.defaults().withSeed(9L).withPermutations(49));

        assertThat(lg.getGs()[3]).isZero();
        assertThat(lg.simulation().orElseThrow().sim(3)).containsOnly(0.0);
    }

    @Test
    void testCancellationTruncatesEveryLocation() {
        AtomicInteger polls = new AtomicInteger();
        Cancellation afterTen = () -> polls.incrementAndGet() > 10;

        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), WeightsTransform.BINARY,
            999, false, RandomStreams.create(5L), afterTen, GaussianTail.INSTANCE);

        assertThat(lg.isCancelled()).isTrue();
        assertThat(lg.getRequestedPermutations()).isEqualTo(999);
        assertThat(lg.getCompletedPermutations()).isEqualTo(10);
        for (int i = 0; i < 6; i++) {
            assertThat(lg.simulation().orElseThrow().sim(i)).hasSize(10);
        }
        assertThat(Arrays.stream(lg.simulation().orElseThrow().pSim()).boxed().toList()).allSatisfy(p -> assertThat(p).isBetween(1.0 / 11.0, 1.0));
    }

    @Test
    void testRejectsInvalidInput() {
        SparseSpatialWeights w = SixPointFixture.weights();

        assertThatThrownBy(() -> LocalG.compute(new double[]{1, 2}, w, WeightsTransform.BINARY, 0, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LocalG.compute(SixPointFixture.Y, w, WeightsTransform.BINARY, -5, false))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LocalG.compute(SixPointFixture.Y, w, null, 0, false))
            .isInstanceOf(NullPointerException.class);
        assertThat(w.transform()).isEqualTo(WeightsTransform.BINARY);
    }

    @Test
    void testStatisticAccessor() {
        SpatialStatistic stat = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            config(WeightsTransform.ROW_STANDARDIZED, false, 1L).withPermutations(99));

        assertThat(stat.name()).isEqualTo("g_local");
        assertThat((double[]) stat.statistic()).hasSize(6);
        assertThat((double[]) stat.pValue("sim")).hasSize(6);
        assertThat((double[]) stat.pValue("z_sim")).hasSize(6);
        assertThat((double[]) stat.pValue("norm")).hasSize(6);
        assertThatThrownBy(() -> stat.pValue("p_sim")).isInstanceOf(IllegalArgumentException.class);
    }
}
