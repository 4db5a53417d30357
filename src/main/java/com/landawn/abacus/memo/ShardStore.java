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

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Supplier;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.Throwables;

/**
 * A fixed-size array of independently locked key/value maps.
 * Each shard's map is only ever read under that shard's read lock and only ever written under
 * its write lock; there is no other access path. No operation holds more than one shard's lock
 * at a time, so shards cannot deadlock against each other.
 *
 * <p>{@link #getOrCreate(int, Object, Throwables.Function)} holds the write lock for the whole
 * factory call. Keys sharing a shard are therefore computed one at a time, which is what
 * guarantees that a key is never computed twice.</p>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
final class ShardStore<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(ShardStore.class);

    private static final int INITIAL_SHARD_CAPACITY = 16;

    private final Shard<K, V>[] shards;

    private final StatsCounter stats = new StatsCounter();

    @SuppressWarnings("unchecked")
    ShardStore(final int shardCount, final Supplier<? extends ReadWriteLock> lockSupplier) {
        if (shardCount <= 0) {
            throw new IllegalArgumentException("Shard count must be positive: " + shardCount);
        }

        if (lockSupplier == null) {
            throw new IllegalArgumentException("Lock supplier cannot be null");
        }

        shards = new Shard[shardCount];

        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard<>(lockSupplier.get());
        }
    }

    /**
     * Returns the value stored for the key in the given shard, invoking the factory under the
     * shard's write lock if it is absent.
     *
     * @param index the shard index the key routes to
     * @param key the key
     * @param factory computes the value on a miss
     * @return the stored value
     * @throws E if the factory fails; nothing is stored and a later call computes again
     */
    <E extends Exception> V getOrCreate(final int index, final K key, final Throwables.Function<? super K, ? extends V, E> factory) throws E {
        final Shard<K, V> shard = shards[index];

        final Lock readLock = shard.lock.readLock();
        readLock.lock();

        try {
            final V value = shard.entries.get(key);

            if (value != null) {
                stats.recordHit();
                return value;
            }
        } finally {
            readLock.unlock();
        }

        final Lock writeLock = shard.lock.writeLock();
        writeLock.lock();

        try {
            // another caller may have stored the value between the two locks
            final V existing = shard.entries.get(key);

            if (existing != null) {
                stats.recordCoalesced();
                return existing;
            }

            boolean stored = false;

            try {
                final V value = factory.apply(key);

                if (value == null) {
                    throw new IllegalStateException("Factory returned null for key: " + key);
                }

                shard.entries.put(key, value);
                stored = true;
                stats.recordMiss();

                return value;
            } finally {
                if (!stored) {
                    stats.recordFailure();

                    if (logger.isWarnEnabled()) {
                        logger.warn("Failed to compute value for key: " + key + " in shard " + index + ". The key stays absent");
                    }
                }
            }
        } finally {
            writeLock.unlock();
        }
    }

    boolean contains(final int index, final K key) {
        final Shard<K, V> shard = shards[index];
        final Lock readLock = shard.lock.readLock();
        readLock.lock();

        try {
            return shard.entries.containsKey(key);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Stores the value unless the key is already present. Only used to populate a new store.
     */
    boolean seed(final int index, final K key, final V value) {
        final Shard<K, V> shard = shards[index];
        final Lock writeLock = shard.lock.writeLock();
        writeLock.lock();

        try {
            return shard.entries.putIfAbsent(key, value) == null;
        } finally {
            writeLock.unlock();
        }
    }

    int size() {
        int size = 0;

        for (final Shard<K, V> shard : shards) {
            final Lock readLock = shard.lock.readLock();
            readLock.lock();

            try {
                size += shard.entries.size();
            } finally {
                readLock.unlock();
            }
        }

        return size;
    }

    /**
     * Copies all entries, one shard at a time. Entries stored concurrently may or may not be included.
     */
    Map<K, V> snapshot() {
        final Map<K, V> result = new HashMap<>();

        for (final Shard<K, V> shard : shards) {
            final Lock readLock = shard.lock.readLock();
            readLock.lock();

            try {
                result.putAll(shard.entries);
            } finally {
                readLock.unlock();
            }
        }

        return result;
    }

    int shardCount() {
        return shards.length;
    }

    MemoStats stats() {
        return stats.snapshot(shards.length, size());
    }

    private static final class Shard<K, V> {
        private final ReadWriteLock lock;

        private final Map<K, V> entries = new HashMap<>(INITIAL_SHARD_CAPACITY);

        Shard(final ReadWriteLock lock) {
            this.lock = lock;
        }
    }
}
