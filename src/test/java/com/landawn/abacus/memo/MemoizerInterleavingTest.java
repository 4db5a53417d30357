/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.memo;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import com.landawn.abacus.memo.interleave.Execution;
import com.landawn.abacus.memo.interleave.InterleavingExplorer;
import com.landawn.abacus.memo.interleave.ModelBarrier;
import com.landawn.abacus.memo.interleave.ModelCounter;
import com.landawn.abacus.memo.interleave.ModelThread;
import com.landawn.abacus.util.Throwables;

/**
 * Checks the locking protocol of {@link Memoizer} under every schedule of two callers.
 * Each memoizer is built on model locks, so lock acquisitions are where callers may interleave.
 */
public class MemoizerInterleavingTest {

    // Known 64-bit FNV-1a collisions
    static final String KEY1 = "7mohtcOFVz";
    static final String KEY2 = "c1E51sSEyx";

    static int valueOf(final String key) {
        switch (key) {
            case "a":
            case KEY1:
                return 0;
            case "b":
            case KEY2:
                return 1;
            default:
                throw new IllegalArgumentException("Unexpected key: " + key);
        }
    }

    static <V, E extends Exception> Memoizer<String, V, E> modelMemoizer(final Execution execution,
            final Throwables.Function<? super String, ? extends V, ? extends E> factory) {
        return new Memoizer<>(Memoizer.DEFAULT_SHARD_COUNT, KeyHasher.fnv1a(), factory, execution::newReadWriteLock);
    }

    @Test
    public void test_keys_route_as_expected() {
        final ShardRouter<String> router = new ShardRouter<>(KeyHasher.fnv1a(), Memoizer.DEFAULT_SHARD_COUNT);

        assertNotEquals(router.route("a"), router.route("b"));
        assertEquals(KeyHasher.<String> fnv1a().hash(KEY1), KeyHasher.<String> fnv1a().hash(KEY2));
        assertEquals(router.route(KEY1), router.route(KEY2));
    }

    @Test
    public void test_different_shards_compute_concurrently() {
        // The factories only return once both are running, so every schedule must overlap them.
        final int executions = InterleavingExplorer.create().explore(execution -> {
            final ModelCounter counter = execution.newCounter();
            final ModelBarrier bothComputing = execution.newBarrier(2);

            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                counter.getAndIncrement();
                bothComputing.await();

                return valueOf(key);
            });

            final ModelThread b = execution.spawn(() -> assertEquals(Integer.valueOf(1), memo.get("b")));

            assertEquals(Integer.valueOf(0), memo.get("a"));
            execution.join(b);

            assertEquals(2, counter.peek());
        });

        assertTrue(executions > 1, "executions: " + executions);
    }

    @Test
    public void test_same_key_computes_once() {
        final AtomicBoolean coalesced = new AtomicBoolean();

        InterleavingExplorer.create().explore(execution -> {
            final ModelCounter counter = execution.newCounter();

            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                counter.getAndIncrement();

                return 0;
            });

            final ModelThread other = execution.spawn(() -> assertEquals(Integer.valueOf(0), memo.get("a")));

            assertEquals(Integer.valueOf(0), memo.get("a"));
            execution.join(other);

            assertEquals(1, counter.peek());

            final MemoStats stats = memo.stats();
            assertEquals(2, stats.getCount());
            assertEquals(1, stats.missCount());
            assertEquals(1, stats.hitCount() + stats.coalescedCount());

            if (stats.coalescedCount() == 1) {
                coalesced.set(true);
            }
        });

        // Some schedule lets both callers miss under the read lock; the re-check under the write lock catches it.
        assertTrue(coalesced.get());
    }

    @Test
    public void test_colliding_keys_never_overlap() {
        InterleavingExplorer.create().explore(execution -> {
            final ModelCounter counter = execution.newCounter();
            final boolean[] observedConcurrency = new boolean[1];

            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                final int old = counter.get();

                execution.yieldNow();

                if (counter.getAndIncrement() > old) {
                    observedConcurrency[0] = true;
                }

                return valueOf(key);
            });

            final ModelThread first = execution.spawn(() -> assertEquals(Integer.valueOf(0), memo.get(KEY1)));

            assertEquals(Integer.valueOf(1), memo.get(KEY2));
            execution.join(first);

            assertEquals(2, counter.peek());
            assertFalse(observedConcurrency[0]);
            assertEquals(Integer.valueOf(0), memo.get(KEY1));
            assertEquals(Integer.valueOf(1), memo.get(KEY2));
            assertEquals(2, memo.size());
        });
    }

    @Test
    public void test_non_colliding_keys_can_overlap() {
        final AtomicBoolean observedConcurrency = new AtomicBoolean();

        InterleavingExplorer.create().explore(execution -> {
            final ModelCounter counter = execution.newCounter();

            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                final int old = counter.get();

                execution.yieldNow();

                if (counter.getAndIncrement() > old) {
                    observedConcurrency.set(true);
                }

                return valueOf(key);
            });

            final ModelThread b = execution.spawn(() -> memo.get("b"));

            memo.get("a");
            execution.join(b);

            assertEquals(2, counter.peek());
        });

        assertTrue(observedConcurrency.get());
    }

    @Test
    public void test_colliding_keys_are_serialized() {
        // Same rendezvous as test_different_shards_compute_concurrently, but the keys share a shard.
        final AssertionError error = assertThrows(AssertionError.class, () -> InterleavingExplorer.create().explore(execution -> {
            final ModelBarrier bothComputing = execution.newBarrier(2);

            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                bothComputing.await();

                return valueOf(key);
            });

            final ModelThread first = execution.spawn(() -> memo.get(KEY1));

            memo.get(KEY2);
            execution.join(first);
        }));

        assertTrue(error.getMessage().contains("Deadlock"), error.getMessage());
    }

    @Test
    public void test_failed_computation_is_retried() {
        InterleavingExplorer.create().explore(execution -> {
            final ModelCounter counter = execution.newCounter();
            final int[] failures = new int[1];

            final Memoizer<String, Integer, Exception> memo = modelMemoizer(execution, key -> {
                if (counter.getAndIncrement() == 0) {
                    throw new Exception("First computation fails");
                }

                return 7;
            });

            final Throwables.Runnable<RuntimeException> caller = () -> {
                try {
                    assertEquals(Integer.valueOf(7), memo.get("a"));
                } catch (final Exception e) {
                    assertEquals("First computation fails", e.getMessage());
                    failures[0]++;
                }
            };

            final ModelThread other = execution.spawn(caller);

            caller.run();
            execution.join(other);

            assertEquals(2, counter.peek());
            assertEquals(1, failures[0]);
            assertTrue(memo.contains("a"));
            assertEquals(Integer.valueOf(7), memo.get("a"));
            assertEquals(2, counter.peek());
            assertEquals(1, memo.stats().failureCount());
        });
    }

    @Test
    public void test_failure_does_not_block_colliding_key() {
        InterleavingExplorer.create().explore(execution -> {
            final Memoizer<String, Integer, RuntimeException> memo = modelMemoizer(execution, key -> {
                if (KEY1.equals(key)) {
                    throw new IllegalStateException("Cannot compute " + key);
                }

                return valueOf(key);
            });

            final boolean[] failed = new boolean[1];

            final ModelThread first = execution.spawn(() -> {
                try {
                    memo.get(KEY1);
                } catch (final IllegalStateException e) {
                    failed[0] = true;
                }
            });

            assertEquals(Integer.valueOf(1), memo.get(KEY2));
            execution.join(first);

            assertTrue(failed[0]);
            assertFalse(memo.contains(KEY1));
            assertEquals(1, memo.size());
        });
    }
}
