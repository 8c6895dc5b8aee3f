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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The loop run by each of a {@link ThreadPool}'s threads.
 *
 * Waits for a task, claims its future, runs it and publishes the outcome, until the pool tells it to exit.
 * Nothing thrown by a task escapes the loop: failures are published to the task's future instead.
 */
final class Worker implements Runnable
{
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final ThreadPool pool;

    Worker(ThreadPool pool)
    {
        this.pool = pool;
    }

    @Override
    public void run()
    {
        logger.trace("Worker of {} started", pool);
        Task task;
        while ((task = pool.awaitTask()) != null)
            execute(task.future);
        logger.trace("Worker of {} exiting", pool);
    }

    private <V> void execute(TaskFuture<V> future)
    {
        try
        {
            // the cancellation race is decided here, under the future's lock, not at dequeue
            if (!future.start())
            {
                logger.trace("Discarding cancelled {}", future);
                pool.onCancelledTaskDiscarded();
                return;
            }

            if (Thread.interrupted())
                logger.debug("Cleared stray interrupt of a worker of {} before running a task", pool);

            V result;
            try
            {
                result = future.invoke();
            }
            catch (Throwable t)
            {
                if (t instanceof Exception)
                    logger.debug("Task on {} failed", pool, t);
                else
                    ExecutionFailure.handle(t);

                pool.onTaskRan(false);
                future.fail(t);
                return;
            }

            pool.onTaskRan(true);
            future.complete(result);
        }
        finally
        {
            future.unref();
        }
    }
}
