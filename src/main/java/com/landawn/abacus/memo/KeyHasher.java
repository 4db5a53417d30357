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
 * A pluggable 64-bit hash function used to route keys to shards.
 * Implementations must be pure and deterministic: equal keys must always produce the same hash
 * for the lifetime of a {@link Memoizer}. Different keys are allowed to produce the same hash,
 * in which case they share a shard and are computed one after the other.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // Default hasher, based on hashCode()
 * Memoizer<String, Quote, IOException> quotes = Memoizer.withHasher(KeyHasher.defaultHasher(), client::fetchQuote);
 *
 * // FNV-1a, reproducible across JVMs for string keys
 * Memoizer<String, Integer, RuntimeException> lengths = Memoizer.withHasher(KeyHasher.fnv1a(), String::length);
 *
 * // Everything in one shard
 * Memoizer<String, Integer, RuntimeException> serial = Memoizer.withHasher(key -> 0L, String::length);
 * }</pre>
 *
 * @param <K> the type of keys this hasher accepts
 * @see ShardRouter
 */
@FunctionalInterface
public interface KeyHasher<K> {

    /**
     * Returns the 64-bit hash of the specified key.
     *
     * @param key the key to hash, never {@code null}
     * @return the hash of the key
     */
    long hash(K key);

    /**
     * Returns the default hasher: the murmur3 64-bit finalizer applied to {@link Object#hashCode()}.
     * It is fast and spreads poor {@code hashCode()} implementations over the low bits used for routing.
     *
     * @param <K> the key type
     * @return the default hasher
     */
    @SuppressWarnings("unchecked")
    static <K> KeyHasher<K> defaultHasher() {
        return (KeyHasher<K>) Hashers.DEFAULT;
    }

    /**
     * Returns the 64-bit FNV-1a hasher.
     * {@code CharSequence} keys are hashed over their UTF-8 bytes and {@code byte[]} keys over their
     * contents. Any other key is hashed over the four big-endian bytes of its {@code hashCode()}.
     *
     * <p>The hash only selects the shard. Keys are still matched with {@code equals}, so two
     * {@code byte[]} keys with the same contents land in the same shard but are distinct keys,
     * each computed once.
     *
     * @param <K> the key type
     * @return the FNV-1a hasher
     */
    @SuppressWarnings("unchecked")
    static <K> KeyHasher<K> fnv1a() {
        return (KeyHasher<K>) Hashers.FNV_1A;
    }
}
