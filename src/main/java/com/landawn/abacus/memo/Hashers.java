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

import java.nio.charset.StandardCharsets;

/**
 * Built-in hash functions.
 */
final class Hashers {
    static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long FNV_PRIME = 0x100000001b3L;

    static final KeyHasher<Object> DEFAULT = key -> mix64(key.hashCode());

    static final KeyHasher<Object> FNV_1A = Hashers::fnv1a64;

    private Hashers() {
    }

    static long mix64(long h) {
        h ^= h >>> 33;
        h *= 0xff51afd7ed558ccdL;
        h ^= h >>> 33;
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= h >>> 33;

        return h;
    }

    // byte[] contents pick the shard only; arrays are still matched by identity inside it
    static long fnv1a64(final Object key) {
        if (key instanceof CharSequence) {
            return fnv1a64(key.toString().getBytes(StandardCharsets.UTF_8));
        } else if (key instanceof byte[]) {
            return fnv1a64((byte[]) key);
        }

        final int h = key.hashCode();

        return fnv1a64(new byte[] { (byte) (h >>> 24), (byte) (h >>> 16), (byte) (h >>> 8), (byte) h });
    }

    static long fnv1a64(final byte[] bytes) {
        long hash = FNV_OFFSET_BASIS;

        for (final byte b : bytes) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }

        return hash;
    }
}
