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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * What a single {@link TaskFuture#await()} call observed: the terminal state of the future, or
 * {@link Kind#TIMEOUT} if a timed wait ran out first. A timeout belongs to the call that saw it,
 * never to the future.
 */
public final class Outcome<V>
{
    public enum Kind { COMPLETED, CANCELLED, TIMEOUT, ERROR }

    public static final int COMPLETED_CODE = 0;
    public static final int CANCELLED_CODE = -1;
    public static final int TIMEOUT_CODE = -2;

    private static final Outcome<?> CANCELLED = new Outcome<>(Kind.CANCELLED, null, 0, null);
    private static final Outcome<?> TIMEOUT = new Outcome<>(Kind.TIMEOUT, null, 0, null);

    private final Kind kind;
    private final V value;
    private final int errorCode;
    private final Throwable cause;

    private Outcome(Kind kind, V value, int errorCode, Throwable cause)
    {
        this.kind = kind;
        this.value = value;
        this.errorCode = errorCode;
        this.cause = cause;
    }

    public static <V> Outcome<V> completed(@Nullable V value)
    {
        return new Outcome<>(Kind.COMPLETED, value, 0, null);
    }

    public static <V> Outcome<V> error(int errorCode, @Nullable Throwable cause)
    {
        Preconditions.checkArgument(errorCode > 0, "error codes must be positive, got %s", errorCode);
        return new Outcome<>(Kind.ERROR, null, errorCode, cause);
    }

    @SuppressWarnings("unchecked")
    public static <V> Outcome<V> cancelled()
    {
        return (Outcome<V>) CANCELLED;
    }

    @SuppressWarnings("unchecked")
    public static <V> Outcome<V> timeout()
    {
        return (Outcome<V>) TIMEOUT;
    }

    public Kind kind()
    {
        return kind;
    }

    public boolean isCompleted()
    {
        return kind == Kind.COMPLETED;
    }

    public boolean isCancelled()
    {
        return kind == Kind.CANCELLED;
    }

    public boolean isTimeout()
    {
        return kind == Kind.TIMEOUT;
    }

    public boolean isError()
    {
        return kind == Kind.ERROR;
    }

    /**
     * @return the task's result
     * @throws IllegalStateException unless {@link #isCompleted()}
     */
    @Nullable
    public V value()
    {
        Preconditions.checkState(kind == Kind.COMPLETED, "no value for a %s outcome", kind);
        return value;
    }

    /**
     * @return the error code of a failed task
     * @throws IllegalStateException unless {@link #isError()}
     */
    public int errorCode()
    {
        Preconditions.checkState(kind == Kind.ERROR, "no error code for a %s outcome", kind);
        return errorCode;
    }

    @Nullable
    public Throwable cause()
    {
        return cause;
    }

    /**
     * Flattens the outcome into a single return code: 0 on completion, -1 if cancelled,
     * -2 on timeout, and the (positive) error code on failure.
     */
    public int code()
    {
        switch (kind)
        {
            case COMPLETED:
                return COMPLETED_CODE;
            case CANCELLED:
                return CANCELLED_CODE;
            case TIMEOUT:
                return TIMEOUT_CODE;
            default:
                return errorCode;
        }
    }

    @Override
    public String toString()
    {
        MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).add("kind", kind);
        if (kind == Kind.COMPLETED)
            helper.add("value", value);
        if (kind == Kind.ERROR)
            helper.add("errorCode", errorCode).add("cause", cause);
        return helper.toString();
    }
}
