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

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.workpool.exceptions.TaskFailedException;

import static org.apache.workpool.concurrent.FutureState.CANCELLED;
import static org.apache.workpool.concurrent.FutureState.COMPLETED;
import static org.apache.workpool.concurrent.FutureState.ERROR;
import static org.apache.workpool.concurrent.FutureState.PENDING;
import static org.apache.workpool.concurrent.FutureState.RUNNING;

/**
 * The handle for one task submitted to a {@link ThreadPool}.
 *
 * Each future has its own lock and condition, so that workers publishing results never contend on the
 * pool-wide queue lock, and waiters on one future are never woken by another.
 *
 * Cancellation is best-effort: {@link #cancel()} only succeeds while the task is {@link FutureState#PENDING}.
 * The worker that dequeues the task re-checks the state under this future's lock before running it, so
 * exactly one of the canceller and the worker wins.
 *
 * A future is reference counted. The submitter owns the reference it is handed, and the pool owns a second one
 * while the task is queued or running. When the last reference is dropped via {@link #unref()} the payload
 * (function, argument and result) is released; the state remains observable.
 */
@ThreadSafe
public class TaskFuture<V> implements java.util.concurrent.Future<V>
{
    private static final Logger logger = LoggerFactory.getLogger(TaskFuture.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition terminated = lock.newCondition();
    private final AtomicInteger refCount = new AtomicInteger(1);

    @GuardedBy("lock")
    private FutureState state = PENDING;
    @GuardedBy("lock")
    private V value;
    @GuardedBy("lock")
    private int errorCode;
    @GuardedBy("lock")
    private Throwable cause;
    @GuardedBy("lock")
    private boolean released;

    // consumed exactly once, by the worker that claims this future
    @GuardedBy("lock")
    private TaskFunction<Object, ? extends V> function;
    @GuardedBy("lock")
    private Object argument;

    @SuppressWarnings("unchecked")
    private TaskFuture(TaskFunction<?, ? extends V> function, @Nullable Object argument)
    {
        this.function = (TaskFunction<Object, ? extends V>) function;
        this.argument = argument;
    }

    static <A, V> TaskFuture<V> create(TaskFunction<? super A, ? extends V> function, @Nullable A argument)
    {
        Preconditions.checkNotNull(function, "function");
        return new TaskFuture<>(function, argument);
    }

    public FutureState state()
    {
        lock.lock();
        try
        {
            return state;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * @return true iff the task has reached a terminal state: completed, cancelled or failed
     */
    @Override
    public boolean isDone()
    {
        return state().isTerminal();
    }

    @Override
    public boolean isCancelled()
    {
        return state() == CANCELLED;
    }

    /**
     * Attempts to stop the task from ever starting.
     *
     * @return true if the task was still pending and is now cancelled; false, with no change of state,
     * if it is already running or has terminated
     */
    public boolean cancel()
    {
        lock.lock();
        try
        {
            if (state != PENDING)
                return false;

            state = CANCELLED;
            terminated.signalAll();
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Running tasks are never interrupted, so {@code mayInterruptIfRunning} is ignored.
     */
    @Override
    public boolean cancel(boolean mayInterruptIfRunning)
    {
        return cancel();
    }

    /**
     * Wait for the task to terminate.
     *
     * This never returns for a task whose function never returns; pair it with a timeout if that matters.
     */
    public Outcome<V> await() throws InterruptedException
    {
        lock.lock();
        try
        {
            while (!state.isTerminal())
                terminated.await();
            return outcome();
        }
        finally
        {
            lock.unlock();
        }
    }

    public Outcome<V> awaitUninterruptibly()
    {
        lock.lock();
        try
        {
            while (!state.isTerminal())
                terminated.awaitUninterruptibly();
            return outcome();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Wait at most {@code timeout} for the task to terminate.
     *
     * @return the terminal outcome, or {@link Outcome#timeout()} if the task was still pending or running
     * at the deadline. Timing out does not affect the future: a later call may still see the real outcome.
     */
    public Outcome<V> await(long timeout, TimeUnit unit) throws InterruptedException
    {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try
        {
            while (!state.isTerminal())
            {
                if (remaining <= 0)
                    return Outcome.timeout();
                remaining = terminated.awaitNanos(remaining);
            }
            return outcome();
        }
        finally
        {
            lock.unlock();
        }
    }

    @Override
    public V get() throws InterruptedException, ExecutionException
    {
        return report(await());
    }

    @Override
    public V get(long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException
    {
        Outcome<V> outcome = await(timeout, unit);
        if (outcome.isTimeout())
            throw new TimeoutException("Task did not terminate within " + timeout + ' ' + unit);
        return report(outcome);
    }

    private static <T> T report(Outcome<T> outcome) throws ExecutionException
    {
        switch (outcome.kind())
        {
            case COMPLETED:
                return outcome.value();
            case CANCELLED:
                throw new CancellationException();
            case ERROR:
                throw new ExecutionException("Task failed with error code " + outcome.errorCode(), outcome.cause());
            default:
                throw new AssertionError(outcome.kind());
        }
    }

    @GuardedBy("lock")
    private Outcome<V> outcome()
    {
        Preconditions.checkState(!released, "Future has already been released");
        switch (state)
        {
            case COMPLETED:
                return Outcome.completed(value);
            case CANCELLED:
                return Outcome.cancelled();
            case ERROR:
                return Outcome.error(errorCode, cause);
            default:
                throw new AssertionError(state);
        }
    }

    /**
     * Claim the task for execution: PENDING -> RUNNING.
     *
     * @return false if the task was cancelled before it could be claimed, in which case its function is discarded
     */
    boolean start()
    {
        lock.lock();
        try
        {
            if (state == CANCELLED)
            {
                function = null;
                argument = null;
                return false;
            }
            Preconditions.checkState(state == PENDING, "Cannot start a task that is %s", state);
            state = RUNNING;
            return true;
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Run the function against its argument. Must follow a successful {@link #start()}, and is only invoked once.
     */
    V invoke() throws Exception
    {
        TaskFunction<Object, ? extends V> function;
        Object argument;
        lock.lock();
        try
        {
            Preconditions.checkState(state == RUNNING && this.function != null, "Task is %s, and cannot be invoked", state);
            function = this.function;
            argument = this.argument;
            this.function = null;
            this.argument = null;
        }
        finally
        {
            lock.unlock();
        }
        return function.apply(argument);
    }

    void complete(@Nullable V result)
    {
        lock.lock();
        try
        {
            Preconditions.checkState(state == RUNNING, "Cannot complete a task that is %s", state);
            value = result;
            state = COMPLETED;
            terminated.signalAll();
        }
        finally
        {
            lock.unlock();
        }
    }

    void fail(Throwable t)
    {
        lock.lock();
        try
        {
            Preconditions.checkState(state == RUNNING, "Cannot fail a task that is %s", state);
            errorCode = TaskFailedException.errorCodeOf(t);
            cause = t;
            state = ERROR;
            terminated.signalAll();
        }
        finally
        {
            lock.unlock();
        }
    }

    /**
     * Take an additional reference to this future.
     *
     * @throws IllegalStateException if the last reference has already been dropped
     */
    public TaskFuture<V> ref()
    {
        while (true)
        {
            int cur = refCount.get();
            Preconditions.checkState(cur > 0, "Cannot reference a released future");
            if (refCount.compareAndSet(cur, cur + 1))
                return this;
        }
    }

    /**
     * Drop a reference to this future, releasing its payload if it was the last one.
     *
     * @return true if this call released the future
     * @throws IllegalStateException if every reference has already been dropped
     */
    public boolean unref()
    {
        while (true)
        {
            int cur = refCount.get();
            Preconditions.checkState(cur > 0, "Future released more times than it was referenced");
            if (refCount.compareAndSet(cur, cur - 1))
            {
                if (cur > 1)
                    return false;

                release();
                return true;
            }
        }
    }

    private void release()
    {
        lock.lock();
        try
        {
            released = true;
            function = null;
            argument = null;
            value = null;
            cause = null;
        }
        finally
        {
            lock.unlock();
        }
        logger.trace("Released {}", this);
    }

    @VisibleForTesting
    int referenceCount()
    {
        return refCount.get();
    }

    public boolean isReleased()
    {
        lock.lock();
        try
        {
            return released;
        }
        finally
        {
            lock.unlock();
        }
    }

    @Override
    public String toString()
    {
        return MoreObjects.toStringHelper(this)
                          .add("state", state())
                          .add("refs", refCount.get())
                          .toString();
    }
}
