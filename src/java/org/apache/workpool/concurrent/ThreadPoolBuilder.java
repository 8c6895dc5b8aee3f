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

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.apache.workpool.config.WorkPoolProperties;
import org.apache.workpool.exceptions.ConfigurationException;

import static java.lang.Thread.NORM_PRIORITY;

/**
 * Configure a {@link ThreadPool}.
 * <li>A thread or queue size of zero selects the default from {@link WorkPoolProperties}
 * <li>Worker threads are named after the pool, and are daemons only if {@link WorkPoolProperties#WORKER_DAEMON} says so
 * <li>The default {@link UncaughtExceptionHandler} logs via {@link ExecutionFailure}
 * <li>A custom {@link ThreadFactory} replaces all of the thread settings above
 */
public class ThreadPoolBuilder
{
    private static final Logger logger = LoggerFactory.getLogger(ThreadPoolBuilder.class);

    private final String name;
    private int threads;
    private int queueLimit;
    private int threadPriority = NORM_PRIORITY;
    private Boolean daemon;
    private UncaughtExceptionHandler uncaughtExceptionHandler = ExecutionFailure::uncaughtException;
    private ThreadFactory threadFactory;

    ThreadPoolBuilder(String name)
    {
        this.name = Preconditions.checkNotNull(name, "name");
    }

    public ThreadPoolBuilder withThreads(int threads)
    {
        Preconditions.checkArgument(threads >= 0, "thread count must not be negative, got %s", threads);
        this.threads = threads;
        return this;
    }

    public ThreadPoolBuilder withQueueLimit(int queueLimit)
    {
        Preconditions.checkArgument(queueLimit >= 0, "queue limit must not be negative, got %s", queueLimit);
        this.queueLimit = queueLimit;
        return this;
    }

    public ThreadPoolBuilder withThreadPriority(int threadPriority)
    {
        Preconditions.checkArgument(threadPriority >= Thread.MIN_PRIORITY && threadPriority <= Thread.MAX_PRIORITY,
                                    "invalid thread priority %s", threadPriority);
        this.threadPriority = threadPriority;
        return this;
    }

    public ThreadPoolBuilder withDaemonThreads(boolean daemon)
    {
        this.daemon = daemon;
        return this;
    }

    public ThreadPoolBuilder withUncaughtExceptionHandler(UncaughtExceptionHandler uncaughtExceptionHandler)
    {
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
        return this;
    }

    public ThreadPoolBuilder withThreadFactory(ThreadFactory threadFactory)
    {
        this.threadFactory = threadFactory;
        return this;
    }

    /**
     * @throws ConfigurationException if a default this pool needs is invalid; no worker has been started
     * @throws org.apache.workpool.exceptions.PoolCreationException if a worker could not be started
     */
    public ThreadPool build()
    {
        try
        {
            return new ThreadPool(this);
        }
        catch (ConfigurationException e)
        {
            if (e.logStackTrace)
                logger.error("Cannot create {}: invalid configuration", name, e);
            else
                logger.error("Cannot create {}: {}", name, e.getMessage());
            throw e;
        }
    }

    String name()
    {
        return name;
    }

    int threads()
    {
        return threads == 0 ? WorkPoolProperties.DEFAULT_THREADS.getPositiveInt() : threads;
    }

    int queueLimit()
    {
        return queueLimit == 0 ? WorkPoolProperties.DEFAULT_QUEUE_SIZE.getPositiveInt() : queueLimit;
    }

    ThreadFactory newThreadFactory()
    {
        if (threadFactory != null)
            return threadFactory;

        boolean daemon = this.daemon != null ? this.daemon : WorkPoolProperties.WORKER_DAEMON.getBoolean();
        return new NamedThreadFactory(name, threadPriority, daemon, uncaughtExceptionHandler);
    }
}
