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

import java.util.concurrent.atomic.AtomicBoolean;

/// Cooperative cancellation for long permutation runs.
///
/// Engines poll [#isCancelled()] between permutation rounds and stop drawing
/// once it returns true; the rounds completed so far are still summarized and
/// reported with their count.
@FunctionalInterface
public interface Cancellation {

    /// @return true once the caller has asked the computation to stop
    boolean isCancelled();

    /// @return a cancellation that never fires
    static Cancellation never() {
        return () -> false;
    }

    /// @return a new flag that can be cancelled from any thread
    static Flag flag() {
        return new Flag();
    }

    /// Thread-safe cancellation flag.
    final class Flag implements Cancellation {

        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Flag() {
        }

        /// Requests cancellation. Idempotent.
        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
