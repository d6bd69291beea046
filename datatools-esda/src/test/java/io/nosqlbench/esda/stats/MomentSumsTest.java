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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MomentSumsTest {

    @Test
    void testPowerSums() {
        MomentSums sums = MomentSums.of(new double[]{1, 2, 3, 4});

        assertEquals(4, sums.n());
        assertEquals(10.0, sums.sum(), 0.0);
        assertEquals(30.0, sums.sum2(), 0.0);
        assertEquals(100.0, sums.sum3(), 0.0);
        assertEquals(354.0, sums.sum4(), 0.0);
    }

    @Test
    void testMeanAndPopulationVariance() {
        MomentSums sums = MomentSums.of(new double[]{2, 4, 4, 4, 5, 5, 7, 9});

        assertEquals(5.0, sums.mean(), 1e-12);
        assertEquals(4.0, sums.variance(), 1e-12);
    }

    @Test
    void testDistinctPairProductSumMatchesEnumeration() {
        double[] y = {2, 3, 3.2, 5, 8, 7};
        double enumerated = 0.0;
        for (int i = 0; i < y.length; i++) {
            for (int j = 0; j < y.length; j++) {
                if (i != j) {
                    enumerated += y[i] * y[j];
                }
            }
        }

        assertEquals(enumerated, MomentSums.of(y).distinctPairProductSum(), 1e-9);
        assertEquals(634.0, MomentSums.of(y).distinctPairProductSum(), 1e-9);
    }

    @Test
    void testNullThrows() {
        assertThrows(NullPointerException.class, () -> MomentSums.of(null));
    }
}
