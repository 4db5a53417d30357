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

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Numbers;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.Throwables;
import com.landawn.abacus.util.TypeAttrParser;

/**
 * Factory class for creating memoizers, either programmatically or from a configuration string.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * // Defaults: 64 shards, default hasher
 * Memoizer<String, Quote, IOException> quotes = MemoizerFactory.createMemoizer(client::fetchQuote);
 *
 * // From configuration
 * String spec = System.getProperty("quotes.memoizer", "Memoizer(256, fnv1a)");
 * Memoizer<String, Quote, IOException> configured = MemoizerFactory.createMemoizer(spec, client::fetchQuote);
 * }</pre>
 *
 * @see Memoizer
 */
public final class MemoizerFactory {

    /**
     * Name of the memoizer type in configuration strings.
     */
    public static final String MEMOIZER = "Memoizer";

    /**
     * Configuration name of {@link KeyHasher#defaultHasher()}.
     */
    public static final String DEFAULT_HASHER = "default";

    /**
     * Configuration name of {@link KeyHasher#fnv1a()}.
     */
    public static final String FNV1A_HASHER = "fnv1a";

    private MemoizerFactory() {
    }

    /**
     * Creates a new memoizer with the default hasher and {@link Memoizer#DEFAULT_SHARD_COUNT} shards.
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer
     * @throws IllegalArgumentException if factory is null
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> createMemoizer(final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(factory);
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
    public static <K, V, E extends Exception> Memoizer<K, V, E> createMemoizer(final int shardCount,
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
    public static <K, V, E extends Exception> Memoizer<K, V, E> createMemoizer(final int shardCount, final KeyHasher<? super K> hasher,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        return new Memoizer<>(shardCount, hasher, factory);
    }

    /**
     * Creates a memoizer from a string specification.
     *
     * <p><b>Supported formats:</b>
     * <ul>
     * <li>{@code Memoizer()} - default shard count and hasher</li>
     * <li>{@code Memoizer(shardCount)} - custom shard count, default hasher</li>
     * <li>{@code Memoizer(shardCount,hasher)} - custom shard count and hasher, where hasher is
     * {@code default} or {@code fnv1a} (case-insensitive)</li>
     * </ul>
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * Memoizer<String, Integer, RuntimeException> m1 = MemoizerFactory.createMemoizer("Memoizer(128)", String::length);
     * Memoizer<String, Integer, RuntimeException> m2 = MemoizerFactory.createMemoizer("Memoizer(16, fnv1a)", String::length);
     * }</pre>
     *
     * @param <K> the type of keys
     * @param <V> the type of values
     * @param <E> the type of exception the factory may throw
     * @param spec the memoizer specification (must not be null or empty)
     * @param factory computes the value for a key on its first access (must not be null)
     * @return a new memoizer configured according to the specification
     * @throws IllegalArgumentException if the specification is empty, names another type, has more than two
     *         parameters, has a non-numeric shard count or names an unknown hasher
     */
    public static <K, V, E extends Exception> Memoizer<K, V, E> createMemoizer(final String spec,
            final Throwables.Function<? super K, ? extends V, ? extends E> factory) {
        if (Strings.isEmpty(spec)) {
            throw new IllegalArgumentException("Memoizer specification cannot be null or empty");
        }

        final TypeAttrParser attrResult = TypeAttrParser.parse(spec);

        if (!MEMOIZER.equalsIgnoreCase(attrResult.getClassName())) {
            throw new IllegalArgumentException("Unsupported memoizer type: " + attrResult.getClassName());
        }

        final String[] parameters = attrResult.getParameters();

        // "Memoizer()" parses to a single empty parameter
        if (N.isEmpty(parameters) || (parameters.length == 1 && Strings.isBlank(parameters[0]))) {
            return createMemoizer(factory);
        } else if (parameters.length > 2) {
            throw new IllegalArgumentException("Unsupported parameters: " + Strings.join(parameters));
        }

        if (Strings.isBlank(parameters[0])) {
            throw new IllegalArgumentException("Shard count parameter cannot be blank: " + spec);
        }

        final int shardCount;

        try {
            shardCount = Numbers.toInt(parameters[0].trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid shard count parameter: " + parameters[0], e);
        }

        if (parameters.length == 1) {
            return createMemoizer(shardCount, factory);
        }

        if (Strings.isBlank(parameters[1])) {
            throw new IllegalArgumentException("Hasher parameter cannot be blank: " + spec);
        }

        return createMemoizer(shardCount, hasherFor(parameters[1].trim()), factory);
    }

    /**
     * Returns the built-in hasher with the specified configuration name.
     *
     * @param <K> the type of keys
     * @param name {@code default} or {@code fnv1a}, case-insensitive
     * @return the hasher
     * @throws IllegalArgumentException if the name is unknown
     */
    public static <K> KeyHasher<K> hasherFor(final String name) {
        if (DEFAULT_HASHER.equalsIgnoreCase(name)) {
            return KeyHasher.defaultHasher();
        } else if (FNV1A_HASHER.equalsIgnoreCase(name)) {
            return KeyHasher.fnv1a();
        } else {
            throw new IllegalArgumentException("Unknown hasher: " + name + ". Supported: " + DEFAULT_HASHER + ", " + FNV1A_HASHER);
        }
    }
}
