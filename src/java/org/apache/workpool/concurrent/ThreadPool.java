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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Uninterruptibles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.workpool.config.WorkPoolProperties;
import org.apache.workpool.exceptions.PoolCreationException;
import org.apache.workpool.utils.concurrent.UncheckedInterruptedException;

/**
 * A fixed set of worker threads consuming a bounded FIFO of tasks, each of which is observed through a
 * {@link TaskFuture}.
 *
 * <li>All workers are started on construction, and run until the pool is shut down
 * <li>Submissions to a full queue block the submitting thread until a worker frees a slot
 * <li>Submissions after shutdown are rejected with {@link RejectedExecutionException}
 * <li>{@link #shutdown()} runs everything already queued; {@link #shutdownNow()} cancels everything queued.
 *     Neither interrupts a task that is already running, and both block until every worker has exited.
 *
 * The queue is protected by a single pool-wide lock; each future is protected by its own.
 * The only place both are held is {@link #shutdownNow()}, which always takes the queue lock first.
 */
@ThreadSafe
public class ThreadPool implements Shutdownable, AutoCloseable
{
    private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

    private final String name;
    private final Thread[] workers;

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition notEmpty = queueLock.newCondition();
    private final Condition notFull = queueLock.newCondition();
    @GuardedBy("queueLock")
    private final TaskQueue queue;

    // only written while holding queueLock
    private volatile boolean shutdown;
    private volatile boolean immediateShutdown;
    private volatile boolean destroyed;

    private final AtomicLong submitted = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    ThreadPool(ThreadPoolBuilder builder)
    {
        this.name = builder.name();
        this.queue = new TaskQueue(builder.queueLimit());
        this.workers = new Thread[builder.threads()];

        ThreadFactory threadFactory = builder.newThreadFactory();
        for (int i = 0; i < workers.length; i++)
        {
            try
            {
                Thread thread = threadFactory.newThread(new Worker(this));
                if (thread == null)
                    throw new IllegalStateException(threadFactory + " declined to create a thread");
                workers[i] = thread;
                thread.start();
            }
            catch (Throwable t)
            {
                workers[i] = null;
                logger.error("Failed to start worker {} of {} for {}, stopping the workers already started", i + 1, workers.length, name, t);
                abortStartup();
                throw new PoolCreationException(String.format("Could not start worker %d of %d for %s", i + 1, workers.length, name), i, t);
            }
        }
        logger.debug("Started {} with {} workers and a queue limit of {}", name, workers.length, queue.capacity());
    }

    /**
     * Create a pool with the default name.
     *
     * @param threads the number of workers, or 0 for {@link WorkPoolProperties#DEFAULT_THREADS}
     * @param maxQueueSize the queue limit, or 0 for {@link WorkPoolProperties#DEFAULT_QUEUE_SIZE}
     * @throws PoolCreationException if any worker could not be started
     */
    public static ThreadPool create(int threads, int maxQueueSize)
    {
        return builder(WorkPoolProperties.DEFAULT_POOL_NAME.getString())
               .withThreads(threads)
               .withQueueLimit(maxQueueSize)
               .build();
    }

    public static ThreadPoolBuilder builder(String name)
    {
        return new ThreadPoolBuilder(name);
    }

    /**
     * Queue {@code function} to be applied to {@code argument} by one of the workers, blocking while the queue is full.
     *
     * @return a future for the result, owned by the caller, who may {@link TaskFuture#unref()} it once done with it
     * @throws RejectedExecutionException if the pool is shut down, or is shut down while this call waits for space
     * @throws UncheckedInterruptedException if interrupted while waiting for space
     */
    public <A, V> TaskFuture<V> submit(TaskFunction<? super A, ? extends V> function, @Nullable A argument)
    {
        if (shutdown)
            throw new RejectedExecutionException(this + " has shut down");

        TaskFuture<V> future = TaskFuture.create(function, argument);
        Task task = new Task(future.ref());

        queueLock.lock();
        try
        {
            while (queue.isFull() && !shutdown)
                notFull.await();

            if (shutdown)
            {
                discard(future);
                throw new RejectedExecutionException(this + " has shut down");
            }

            queue.addLast(task);
            submitted.incrementAndGet();
            notEmpty.signal();
        }
        catch (InterruptedException e)
        {
            discard(future);
            throw new UncheckedInterruptedException(e);
        }
        finally
        {
            queueLock.unlock();
        }

        logger.trace("Queued {} on {}", future, name);
        return future;
    }

    public <V> TaskFuture<V> submit(Callable<? extends V> task)
    {
        Preconditions.checkNotNull(task, "task");
        TaskFunction<Object, V> function = ignored -> task.call();
        return submit(function, null);
    }

    // drop both the caller's and the queue's reference to a future that was never queued
    private static void discard(TaskFuture<?> future)
    {
        future.cancel();
        future.unref();
        future.unref();
    }

    /**
     * Block until there is a task to run, or the calling worker should exit.
     *
     * @return the next task in submission order, or null once the pool is shut down immediately,
     * or shut down with an empty queue
     */
    @Nullable
    Task awaitTask()
    {
        queueLock.lock();
        try
        {
            while (queue.isEmpty() && !shutdown)
                notEmpty.awaitUninterruptibly();

            if (immediateShutdown || (shutdown && queue.isEmpty()))
                return null;

            Task task = queue.pollFirst();
            notFull.signal();
            return task;
        }
        finally
        {
            queueLock.unlock();
        }
    }

    void onCancelledTaskDiscarded()
    {
        cancelled.incrementAndGet();
    }

    void onTaskRan(boolean successfully)
    {
        if (!successfully)
            failed.incrementAndGet();
        completed.incrementAndGet();
    }

    /**
     * Stop accepting new tasks, let the workers run everything already queued, and wait for them to exit.
     *
     * @throws IllegalStateException if called from one of this pool's workers
     */
    @Override
    public void shutdown()
    {
        checkNotWorker();
        queueLock.lock();
        try
        {
            if (!shutdown)
                logger.debug("Shutting down {} with {} tasks queued", name, queue.size());
            shutdown = true;
            notEmpty.signalAll();
            notFull.signalAll();
        }
        finally
        {
            queueLock.unlock();
        }
        joinWorkers();
    }

    /**
     * Stop accepting new tasks, cancel every queued task, and wait for the workers to finish whatever they are
     * running and exit. Running tasks are not interrupted.
     *
     * @return the futures this call cancelled; tasks already cancelled by their submitter are discarded without
     * being returned
     * @throws IllegalStateException if called from one of this pool's workers
     */
    @Override
    public List<TaskFuture<?>> shutdownNow()
    {
        checkNotWorker();
        List<TaskFuture<?>> cancelledNow = new ArrayList<>();
        int discarded;
        queueLock.lock();
        try
        {
            shutdown = true;
            immediateShutdown = true;

            List<Task> tasks = queue.drain();
            discarded = tasks.size();
            for (Task task : tasks)
            {
                if (task.future.cancel())
                    cancelledNow.add(task.future);
                cancelled.incrementAndGet();
                task.future.unref();
            }

            notEmpty.signalAll();
            notFull.signalAll();
        }
        finally
        {
            queueLock.unlock();
        }

        if (discarded > 0)
            logger.info("Shutting down {} immediately, discarded {} queued tasks", name, discarded);
        joinWorkers();
        return cancelledNow;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit units) throws InterruptedException
    {
        long deadline = System.nanoTime() + units.toNanos(timeout);
        for (Thread worker : workers)
        {
            if (worker == null)
                continue;

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0)
                break;
            TimeUnit.NANOSECONDS.timedJoin(worker, remaining);
        }
        return isTerminated();
    }

    public boolean isShutdown()
    {
        return shutdown;
    }

    @Override
    public boolean isTerminated()
    {
        if (!shutdown)
            return false;

        for (Thread worker : workers)
        {
            if (worker != null && worker.isAlive())
                return false;
        }
        return true;
    }

    /**
     * Release the pool's resources. The pool must already have been shut down, by either method, and terminated.
     */
    public void destroy()
    {
        Preconditions.checkState(shutdown, "%s must be shut down before it is destroyed", this);
        Preconditions.checkState(isTerminated(), "%s still has live workers", this);
        if (destroyed)
            return;

        queueLock.lock();
        try
        {
            Preconditions.checkState(queue.isEmpty(), "%s terminated with %s tasks queued", this, queue.size());
            destroyed = true;
        }
        finally
        {
            queueLock.unlock();
        }
        logger.debug("Destroyed {}: {}", name, stats());
    }

    /**
     * Shut down gracefully, if not already shut down, and destroy the pool.
     */
    @Override
    public void close()
    {
        shutdown();
        destroy();
    }

    public boolean isDestroyed()
    {
        return destroyed;
    }

    public PoolStats stats()
    {
        // completions are read before submissions, so a snapshot never shows more finished than submitted
        long completed = this.completed.get();
        long cancelled = this.cancelled.get();
        long failed = this.failed.get();
        long submitted = this.submitted.get();
        return new PoolStats(submitted, completed, cancelled, failed, pendingTasks());
    }

    public int pendingTasks()
    {
        queueLock.lock();
        try
        {
            return queue.size();
        }
        finally
        {
            queueLock.unlock();
        }
    }

    public int threads()
    {
        return workers.length;
    }

    public int queueLimit()
    {
        return queue.capacity();
    }

    public String name()
    {
        return name;
    }

    private void abortStartup()
    {
        queueLock.lock();
        try
        {
            shutdown = true;
            immediateShutdown = true;
            notEmpty.signalAll();
        }
        finally
        {
            queueLock.unlock();
        }
        joinWorkers();
    }

    private void joinWorkers()
    {
        for (Thread worker : workers)
        {
            if (worker != null)
                Uninterruptibles.joinUninterruptibly(worker);
        }
    }

    private void checkNotWorker()
    {
        Thread current = Thread.currentThread();
        for (Thread worker : workers)
            Preconditions.checkState(worker != current, "%s cannot be shut down by one of its own workers", this);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
