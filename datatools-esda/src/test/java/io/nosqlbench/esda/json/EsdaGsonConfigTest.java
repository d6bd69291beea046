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

package io.nosqlbench.esda.json;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.esda.getisord.GetisOrdConfig;
import io.nosqlbench.esda.getisord.GlobalG;
import io.nosqlbench.esda.getisord.GlobalGResult;
import io.nosqlbench.esda.getisord.LocalG;
import io.nosqlbench.esda.getisord.LocalGResult;
import io.nosqlbench.esda.weights.SixPointFixture;
import io.nosqlbench.esda.weights.SparseSpatialWeights;
import io.nosqlbench.esda.weights.WeightsTransform;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class EsdaGsonConfigTest {

    @Test
    void testGlobalResultWithoutSimulation() {
        GlobalGResult g = GlobalG.compute(SixPointFixture.Y, SixPointFixture.weights(), 0);

        JsonObject json = JsonParser.parseString(EsdaGsonConfig.gson().toJson(g)).getAsJsonObject();

        assertThat(json.get("G").getAsDouble()).isCloseTo(g.getG(), within(1e-15));
        assertThat(json.get("p_norm").getAsDouble()).isCloseTo(g.getPNorm(), within(1e-15));
        assertThat(json.getAsJsonObject("coefficients").get("b4").getAsDouble()).isEqualTo(64.0);
        assertThat(json.has("simulation")).isFalse();
    }

    @Test
    void testLocalResultFieldNames() {
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(),
            GetisOrdConfig.defaults().withSeed(10L).withPermutations(9));

        String line = EsdaGsonConfig.compactGson().toJson(lg);
        assertThat(line).doesNotContain("\n");

        JsonObject json = JsonParser.parseString(line).getAsJsonObject();
        assertThat(json.getAsJsonArray("Zs")).hasSize(6);
        assertThat(json.get("transform").getAsString()).isEqualTo("R");
        JsonObject simulation = json.getAsJsonObject("simulation");
        assertThat(simulation.getAsJsonArray("p_sim")).hasSize(6);
        assertThat(simulation.getAsJsonArray("sim").get(0).getAsJsonArray()).hasSize(9);
        assertThat(simulation.has("EG_sim")).isTrue();
    }

    @Test
    void testTransformMatchesConfigVocabulary() {
        GetisOrdConfig config = GetisOrdConfig.defaults().withTransform(WeightsTransform.BINARY).withPermutations(0);
        LocalGResult lg = LocalG.compute(SixPointFixture.Y, SixPointFixture.weights(), config);

        JsonObject resultJson = JsonParser.parseString(EsdaGsonConfig.gson().toJson(lg)).getAsJsonObject();
        JsonObject configJson = JsonParser.parseString(config.toJson()).getAsJsonObject();

        assertThat(resultJson.get("transform").getAsString())
            .isEqualTo("B")
            .isEqualTo(configJson.get("transform").getAsString());
        assertThat(WeightsTransform.fromCode(resultJson.get("transform").getAsString()))
            .isEqualTo(WeightsTransform.BINARY);
    }

    @Test
    void testDegenerateValuesSerialize() {
        SparseSpatialWeights ring = SparseSpatialWeights.fromNeighborIndices(
            new int[][]{{1, 3}, {0, 2}, {1, 3}, {2, 0}});
        LocalGResult lg = LocalG.compute(new double[]{1, -1, 2, -2}, ring, WeightsTransform.BINARY, 0, true);

        String json = EsdaGsonConfig.gson().toJson(lg);

        assertThat(json).contains("NaN");
        assertThat(Arrays.stream(lg.getZs()).noneMatch(Double::isFinite)).isTrue();
    }
}
