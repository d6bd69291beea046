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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for esda results and configuration.
///
/// ## Purpose
///
/// Provides configured [Gson] instances for turning
/// [io.nosqlbench.esda.getisord.GlobalGResult],
/// [io.nosqlbench.esda.getisord.LocalGResult] and
/// [io.nosqlbench.esda.getisord.GetisOrdConfig] into JSON text. Writing that
/// text anywhere is left to the caller.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()]) / disabled ([#compactGson()]) | Reports vs NDJSON lines |
/// | Serialize nulls | Disabled | Results without permutations omit the simulation block |
/// | Special floating point | Enabled | Degenerate variances serialize as `NaN` / `Infinity` |
/// | HTML escaping | Disabled | Cleaner output |
///
/// ## Thread Safety
///
/// [Gson] instances are thread-safe and shared.
public final class EsdaGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private EsdaGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return the shared single-line instance, for NDJSON output
    public static Gson compactGson() {
        return COMPACT;
    }

    /// @return a new builder with esda defaults, for further customization
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
