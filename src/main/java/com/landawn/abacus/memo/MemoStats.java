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
 * An immutable snapshot of memoizer statistics at a specific point in time.
 *
 * <p>Every call to {@link Memoizer#get(Object)} ends in exactly one of four outcomes, so
 * {@code getCount == hitCount + coalescedCount + missCount + failureCount} once no call is in flight:
 * <ul>
 *   <li><b>hit</b> - the value was found under the shard's read lock</li>
 *   <li><b>coalesced</b> - the value was absent under the read lock but present once the write lock was
 *       acquired, because another caller computed it in between</li>
 *   <li><b>miss</b> - the factory was invoked and its value stored</li>
 *   <li><b>failure</b> - the factory was invoked and threw; nothing was stored</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * MemoStats stats = memoizer.stats();
 *
 * // Every miss is one factory invocation
 * System.out.println("Computed " + stats.missCount() + " of " + stats.size() + " entries");
 *
 * // Callers that waited on another caller's computation
 * if (stats.coalescedCount() > 0) {
 *     System.out.println("Coalesced requests: " + stats.coalescedCount());
 * }
 * }</pre>
 *
 * @param shardCount the fixed number of shards
 * @param size the number of entries stored at the time of the snapshot
 * @param getCount the total number of completed get operations
 * @param hitCount the number of gets served from the read-locked fast path
 * @param coalescedCount the number of gets served after waiting on the write lock without computing
 * @param missCount the number of factory invocations that produced a stored value
 * @param failureCount the number of factory invocations that threw
 * @see Memoizer#stats()
 */
public record MemoStats(int shardCount, int size, long getCount, long hitCount, long coalescedCount, long missCount, long failureCount) {

}
