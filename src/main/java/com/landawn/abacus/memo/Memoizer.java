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

import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.Throwables;

/**
 * A thread-safe, in-memory memoizing map with lazy value construction.
 * Values are produced by a single factory function supplied at construction. The factory runs
 * at most once per key: concurrent callers asking for the same key wait for the first caller's
 * computation and then all observe the same value. Entries are never updated or removed.
 *
 * <br><br>
 * Key features:
 * <ul>
 * <li>Lock striping: keys are routed to a fixed number of shards, each guarded by its own read/write lock</li>
 * <li>Lock-shared fast path for keys that are already present</li>
 * <li>Single-flight computation: the factory runs under the shard's write lock</li>
 * <li>Failed computations store nothing and are retried by the next caller</li>
 * <li>Pluggable hashing via {@link KeyHasher}</li>
 * </ul>
 *
 * <p><b>Limitations:</b></p>
 * <ul>
 * <li>The factory must be memoizable: always producing an equivalent value for a given key.</li>
 * <li>Keys that share a shard are computed one after the other. A factory that never returns blocks every
 * key of its shard forever; this is the only way a memoizer can deadlock.</li>
 * <li>The number of shards is fixed for the lifetime of the memoizer. Use {@link #rehash(int, KeyHasher)}
 * to redistribute the entries into a new one.</li>
 * </ul>
 *
 * <br>
 * Example usage:
 * <pre>{@code
 * // An infallible factory
 * Memoizer<Integer, Integer, RuntimeException> plusOne = Memoizer.create(x -> x + 1);
 * plusOne.get(3);   // 4, computed
 * plusOne.get(3);   // 4, cached
 *
 * // A fallible factory: get() declares the factory's exception
 * Memoizer<Path, String, IOException> files = Memoizer.create(Files::readString);
 *
 * try {
 *     String content = files.get(Paths.get("/tmp/some_file"));
 * } catch (IOException e) {
 *     // nothing was cached, the next get() reads the file again
 * }
 * }</pre>
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 * @param <E> the type of exception the factory may throw
 * @see KeyHasher
 * @see MemoizerFactory
 */
public class Memoizer<K, V, E extends Exception> {

    private static final Logger logger = LoggerFactory.getLogger(Memoizer.class);

    /**
     * Default number of shards: 64.
     */
    public static final int DEFAULT_SHARD_COUNT = 64;

    /**
     * Maximum number of shards: 65,536.
     */
    public static final int MAX_SHARD_COUNT = 1 << 16;

    private final Throwables.Function<? super K, ? extends V, ? extends E> factory;

    private final ShardRouter<K> router;

    private final ShardStore<K, V> store;

    /**
     * Creates a new memoizer with the default hasher and {@link #DEFAULT_SHARD_COUNT} shards.
     *
     * @param factory computes the value for a key on its first access (must not be null)
     * @throws IllegalArgumentException if factory is null
     */
    public Memoizer(final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        this(DEFAULT_SHARD_COUNT, KeyHasher.defaultHasher(), factory);
    }

    /**
     * Creates a new memoizer with the specified shard count and hasher.
     * The shard count is rounded up to the next power of two.
     *
     * @param shardCount the requested number of shards (must be positive)
     * @param hasher the hash function routing keys to shards (must not be null)
     * @param factory computes the value for a key on its first access (must not be null)
     * @throws IllegalArgumentException if shardCount is not positive, or hasher or factory is null
     */
    public Memoizer(final int shardCount, final KeyHasher<? super K> hasher, final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        this(shardCount, hasher, factory, ReentrantReadWriteLock::new);
    }

    Memoizer(final int shardCount, final KeyHasher<? super K> hasher, final Throwables.Function<? super K, ? extends V, ? extends E> factory,
            final Supplier<? extends ReadWriteLock> lockSupplier) {
        if (factory == null) {
            throw new IllegalArgumentException("Factory cannot be null");
        }

        this.factory = factory;
        this.router = new ShardRouter<>(hasher, shardCount);
        this.store = new ShardStore<>(router.shardCount(), lockSupplier);

        if (logger.isDebugEnabled()) {
            logger.debug("Created Memoizer with " + router.shardCount() + " shards (requested " + shardCount + ")");
        }
    }

    /**
     * Creates a new memoizer with the default hasher and {@link #DEFAULT_SHARD_COUNT} shards.
     *
     * <pre>{@code
     * Memoizer<String, Integer, RuntimeException> lengths = Memoizer.create(String::length);
     * }</pre>
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if factory is null
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> create(final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(factory);
    }

    /**
     * Creates a new memoizer with the specified hasher and {@link #DEFAULT_SHARD_COUNT} shards.
     * An explicit hasher makes it possible to control which keys share a shard.
     *
     * <pre>{@code
     * // "7mohtcOFVz" and "c1E51sSEyx" have the same FNV-1a hash and always share a shard
     * Memoizer<String, Integer, RuntimeException> memo = Memoizer.withHasher(KeyHasher.fnv1a(), String::length);
     * }</pre>
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param hasher the hash function routing keys to shards (must not be null)
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if hasher or factory is null
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> withHasher(final KeyHasher<? super K> hasher,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(DEFAULT_SHARD_COUNT, hasher, factory);
    }

    /**
     * Creates a new memoizer with the default hasher and the specified number of shards.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param shardCount the requested number of shards, rounded up to a power of two (must be positive)
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if shardCount is not positive or factory is null
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> withShardCount(final int shardCount,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(shardCount, KeyHasher.defaultHasher(), factory);
    }

    /**
     * Creates a new memoizer with the specified number of shards and hasher.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param shardCount the requested number of shards, rounded up to a power of two (must be positive)
     * @param hasher the hash function routing keys to shards (must not be null)
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if shardCount is not positive, or hasher or factory is null
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> withShardCountAndHasher(final int shardCount, final KeyHasher<? super K> hasher,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(shardCount, hasher, factory);
    }

    /**
     * Creates a memoizer pre-populated with existing entries, using the default hasher and shard count.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param entries the entries to store (must not be null, must not contain null keys or values)
     * @param factory computes the value for keys not in {@code entries} (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if entries or factory is null, or an entry has a null key or value
     * @see #from(Map, int, KeyHasher, Throwables.Function)
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> from(final Map<? extends K, ? extends V> entries,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return from(entries, DEFAULT_SHARD_COUNT, KeyHasher.defaultHasher(), factory);
    }

    /**
     * Creates a memoizer pre-populated with existing entries.
     * The entries are stored as if the factory had produced them. Entries that differ from what
     * the factory would have produced are a logic error of the caller: {@link #get(Object)} will
     * return them as they are.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * // Warm start from values computed by a previous run
     * Map<String, BigDecimal> saved = loadRates();
     * Memoizer<String, BigDecimal, IOException> rates = Memoizer.from(saved, 128, KeyHasher.defaultHasher(), client::fetchRate);
     * }</pre>
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param entries the entries to store (must not be null, must not contain null keys or values)
     * @param shardCount the requested number of shards, rounded up to a power of two (must be positive)
     * @param hasher the hash function routing keys to shards (must not be null)
     * @param factory computes the value for keys not in {@code entries} (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if an argument is invalid, or an entry has a null key or value
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> from(final Map<? extends K, ? extends V> entries, final int shardCount,
            final KeyHasher<? super K> hasher, final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        if (entries == null) {
            throw new IllegalArgumentException("Entries cannot be null");
        }

        final Memoizer<K, V, E> memoizer = new Memoizer<>(shardCount, hasher, factory);

        for (final Map.Entry<? extends K, ? extends V> entry : entries.entrySet()) {
            final K key = entry.getKey();

            if (key == null) {
                throw new IllegalArgumentException("Key cannot be null");
            }

            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Value cannot be null for key: " + key);
            }

            memoizer.store.seed(memoizer.router.route(key), key, entry.getValue());
        }

        return memoizer;
    }

    /**
     * Returns the value for the specified key, invoking the factory first if no value is present.
     * The caller may block while another caller computes a value in the same shard.
     *
     * <p><b>Behavior:</b></p>
     * <ul>
     * <li>Present keys are served under the shard's read lock and never block other readers</li>
     * <li>On a miss the factory is invoked at most once, while holding the shard's write lock</li>
     * <li>Callers that were waiting for the same key receive the value the first caller stored</li>
     * <li>If the factory throws, the exception is propagated unchanged and nothing is stored</li>
     * </ul>
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * Memoizer<String, Quote, IOException> quotes = Memoizer.create(client::fetchQuote);
     *
     * Quote first = quotes.get("BTC-USD");    // invokes client.fetchQuote("BTC-USD")
     * Quote second = quotes.get("BTC-USD");   // same instance, no request
     * }</pre>
     *
     * @param key the key whose value is to be returned (must not be null)
     * @return the value associated with the key, never null
     * @throws E if the factory fails for this key
     * @throws IllegalArgumentException if key is null
     * @throws IllegalStateException if the factory returns null
     */
    public V get(final K key) throws E {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }

        return store.getOrCreate(router.route(key), key, factory);
    }

    /**
     * Checks whether a value is present for the specified key. Never invokes the factory.
     *
     * @param key the key whose presence is to be tested (must not be null)
     * @return true if a value has been stored for the key
     * @throws IllegalArgumentException if key is null
     */
    public boolean contains(final K key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }

        return store.contains(router.route(key), key);
    }

    /**
     * Returns the number of stored values.
     * Shards are counted one at a time, so the result may miss values stored concurrently.
     *
     * @return the number of stored values
     */
    public int size() {
        return store.size();
    }

    /**
     * Returns the fixed number of shards.
     *
     * @return the shard count, a power of two
     */
    public int shardCount() {
        return router.shardCount();
    }

    /**
     * Returns a snapshot of all stored entries. Changes to the returned map do not affect this memoizer.
     *
     * @return a new mutable map containing the stored entries
     */
    public Map<K, V> entries() {
        return store.snapshot();
    }

    /**
     * Returns a new memoizer with the same factory and a copy of the stored entries, redistributed
     * over a new number of shards with a new hasher. This memoizer is not modified.
     *
     * <pre>{@code
     * // Grow a hot memoizer without recomputing anything
     * Memoizer<String, Quote, IOException> bigger = quotes.rehash(1024, KeyHasher.defaultHasher());
     * }</pre>
     *
     * @param shardCount the requested number of shards of the new memoizer (must be positive)
     * @param hasher the hash function of the new memoizer (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if shardCount is not positive or hasher is null
     */
    public Memoizer<K, V, E> rehash(final int shardCount, final KeyHasher<? super K> hasher) {
        return from(store.snapshot(), shardCount, hasher, factory);
    }

    /**
     * Returns statistics about the outcomes of {@link #get(Object)} calls.
     *
     * @return a snapshot of the current statistics
     * @see MemoStats
     */
    public MemoStats stats() {
        return store.stats();
    }

    @Override
    public String toString() {
        return "Memoizer{shardCount=" + router.shardCount() + ", size=" + store.size() + "}";
    }
}
