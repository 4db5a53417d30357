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

/**
 * Maps keys to shard indexes using the low bits of a 64-bit {@link KeyHasher}.
 * The shard count is always a power of two, so the index is {@code hash & (shardCount - 1)}.
 * Routing is pure: the same key always routes to the same shard. Distinct keys routing to the
 * same shard is expected and only costs concurrency between them.
 *
 * @param <K> the type of keys routed
 */
public final class ShardRouter<K> {

    private final KeyHasher<? super K> hasher;

    private final int shardCount;

    private final long mask;

    /**
     * Creates a router for the specified hasher and shard count.
     * The shard count is rounded up to a power of two, see {@link #shardCountFor(int)}.
     *
     * @param hasher the hash function (must not be null)
     * @param shardCount the requested number of shards (must be positive)
     * @throws IllegalArgumentException if hasher is null or shardCount is not positive
     */
    public ShardRouter(final KeyHasher<? super K> hasher, final int shardCount) {
        if (hasher == null) {
            throw new IllegalArgumentException("Hasher cannot be null");
        }

        this.hasher = hasher;
        this.shardCount = shardCountFor(shardCount);
        this.mask = this.shardCount - 1L;
    }

    /**
     * Returns the shard index for the specified key.
     *
     * @param key the key to route (must not be null)
     * @return an index in {@code [0, shardCount())}
     */
    public int route(final K key) {
        return (int) (hasher.hash(key) & mask);
    }

    /**
     * Returns the number of shards keys are routed to.
     *
     * @return the shard count, a power of two
     */
    public int shardCount() {
        return shardCount;
    }

    /**
     * Returns the hash function used by this router.
     *
     * @return the hasher
     */
    public KeyHasher<? super K> hasher() {
        return hasher;
    }

    /**
     * Rounds the requested shard count up to the next power of two, capped at {@link Memoizer#MAX_SHARD_COUNT}.
     *
     * <pre>{@code
     * ShardRouter.shardCountFor(1);    // 1
     * ShardRouter.shardCountFor(48);   // 64
     * ShardRouter.shardCountFor(64);   // 64
     * }</pre>
     *
     * @param requested the requested shard count (must be positive)
     * @return the effective shard count
     * @throws IllegalArgumentException if requested is not positive
     */
    public static int shardCountFor(final int requested) {
        if (requested <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + requested);
        }

        if (requested >= Memoizer.MAX_SHARD_COUNT) {
            return Memoizer.MAX_SHARD_COUNT;
        }

        final int highest = Integer.highestOneBit(requested);

        return highest == requested ? requested : highest << 1;
    }
}
