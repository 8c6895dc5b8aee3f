/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.workpool.concurrent;

import com.google.common.base.MoreObjects;

/**
 * A point-in-time snapshot of a {@link ThreadPool}'s counters.
 *
 * {@code completed} counts every task that ran, whether it completed normally or failed; {@code failed}
 * is the subset that failed. Once a pool has shut down and drained, {@code submitted == completed + cancelled}.
 */
public final class PoolStats
{
    public final long submitted;
    public final long completed;
    public final long cancelled;
    public final long failed;
    public final int pending;

    public PoolStats(long submitted, long completed, long cancelled, long failed, int pending)
    {
        this.submitted = submitted;
        this.completed = completed;
        this.cancelled = cancelled;
        this.failed = failed;
        this.pending = pending;
    }

    /**
     * @return the number of submitted tasks that have not yet been run or discarded, including those executing
     */
    public long outstanding()
    {
        return submitted - completed - cancelled;
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("submitted", submitted)
                          .add("completed", completed)
                          .add("cancelled", cancelled)
                          .add("failed", failed)
                          .add("pending", pending)
                          .toString();
    }
}
