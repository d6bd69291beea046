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

import org.apache.commons.math3.distribution.NormalDistribution;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GaussianTailTest {

    private final NormalTail tail = GaussianTail.INSTANCE;

    @Test
    void testKnownValues() {
        assertEquals(0.5, tail.survival(0.0), 1e-15);
        assertEquals(0.15865525393145707, tail.survival(1.0), 1e-12);
        assertEquals(0.022750131948179195, tail.survival(2.0), 1e-12);
        assertEquals(0.0013498980316300933, tail.survival(3.0), 1e-12);
    }

    @Test
    void testAgreesWithNormalDistribution() {
        NormalDistribution normal = new NormalDistribution(null, 0.0, 1.0);
        for (double z = -4.0; z <= 4.0; z += 0.25) {
            assertEquals(1.0 - normal.cumulativeProbability(z), tail.survival(z), 1e-12, "z=" + z);
        }
    }

    @Test
    void testDeepTailKeepsPrecision() {
        double p = tail.survival(10.0);
        assertTrue(p > 0.0);
        assertEquals(7.619853024160527e-24, p, 1e-30);
    }

    @Test
    void testOneSidedIsSymmetric() {
        assertEquals(tail.oneSidedPValue(1.5), tail.oneSidedPValue(-1.5), 0.0);
        assertTrue(tail.oneSidedPValue(-0.2) <= 0.5);
    }

    @Test
    void testNonFiniteInputs() {
        assertTrue(Double.isNaN(tail.survival(Double.NaN)));
        assertTrue(Double.isNaN(tail.oneSidedPValue(Double.NaN)));
        assertEquals(0.0, tail.oneSidedPValue(Double.NEGATIVE_INFINITY), 0.0);
    }
}
