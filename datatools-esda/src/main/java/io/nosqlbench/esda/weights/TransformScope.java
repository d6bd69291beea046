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

package io.nosqlbench.esda.weights;

import java.util.Objects;

/// Temporarily forces a transform onto a [SpatialWeights] graph and restores
/// the caller's transform on close.
///
/// ```java
/// try (TransformScope scope = TransformScope.force(w, WeightsTransform.BINARY)) {
///     double[] lag = SpatialLag.lag(w, y);
/// }
/// ```
///
/// A scope may be re-pointed at another transform with [#apply(WeightsTransform)];
/// close always restores the transform captured when the scope opened. If the
/// graph no longer carries the transform the scope last applied, close still
/// restores the original and then throws [TransformRestoreException].
public final class TransformScope implements AutoCloseable {

    private final SpatialWeights weights;
    private final WeightsTransform original;
    private WeightsTransform applied;
    private boolean closed;

    private TransformScope(SpatialWeights weights, WeightsTransform transform) {
        this.weights = weights;
        this.original = weights.transform();
        apply(transform);
    }

    /// Opens a scope over `weights` with `transform` applied.
    ///
    /// @param weights the graph to mutate
    /// @param transform the transform to apply for the scope's lifetime
    /// @return the open scope
    public static TransformScope force(SpatialWeights weights, WeightsTransform transform) {
        Objects.requireNonNull(weights, "weights cannot be null");
        Objects.requireNonNull(transform, "transform cannot be null");
        return new TransformScope(weights, transform);
    }

    /// Switches the graph to another transform within this scope.
    ///
    /// @param transform the transform to apply
    public void apply(WeightsTransform transform) {
        if (closed) {
            throw new IllegalStateException("Transform scope already closed");
        }
        weights.setTransform(transform);
        this.applied = transform;
    }

    /// @return the transform in effect before the scope opened
    public WeightsTransform original() {
        return original;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        WeightsTransform found = weights.transform();
        weights.setTransform(original);
        if (found != applied) {
            throw new TransformRestoreException(applied, found, original);
        }
    }
}
