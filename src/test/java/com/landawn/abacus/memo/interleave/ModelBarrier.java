/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.memo.interleave;

/**
 * A cyclic rendezvous for model threads. {@link #await()} returns only once {@code parties}
 * threads have arrived, so code that reaches it from two threads proves the two were in flight at
 * the same time. If the callers are serialized instead, the execution fails with a deadlock.
 */
public final class ModelBarrier {

    private final Execution execution;

    private final int parties;

    private int arrived;

    private int generation;

    ModelBarrier(final Execution execution, final int parties) {
        if (parties <= 0) {
            throw new IllegalArgumentException("Parties must be positive: " + parties);
        }

        this.execution = execution;
        this.parties = parties;
    }

    public void await() {
        execution.schedule();

        final int arrivedGeneration = generation;

        if (++arrived == parties) {
            arrived = 0;
            generation++;
        } else {
            execution.blockUntil(() -> generation != arrivedGeneration, "barrier (" + arrived + "/" + parties + " arrived)");
        }
    }
}
