/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.memo;

import java.util.concurrent.atomic.LongAdder;

/**
 * Contention-free counters behind {@link MemoStats}.
 */
final class StatsCounter {

    private final LongAdder hitCount = new LongAdder();

    private final LongAdder coalescedCount = new LongAdder();

    private final LongAdder missCount = new LongAdder();

    private final LongAdder failureCount = new LongAdder();

    void recordHit() {
        hitCount.increment();
    }

    void recordCoalesced() {
        coalescedCount.increment();
    }

    void recordMiss() {
        missCount.increment();
    }

    void recordFailure() {
        failureCount.increment();
    }

    MemoStats snapshot(final int shardCount, final int size) {
        final long hits = hitCount.sum();
        final long coalesced = coalescedCount.sum();
        final long misses = missCount.sum();
        final long failures = failureCount.sum();

        return new MemoStats(shardCount, size, hits + coalesced + misses + failures, hits, coalesced, misses, failures);
    }
}
