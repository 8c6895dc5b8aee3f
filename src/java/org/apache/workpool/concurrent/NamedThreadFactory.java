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

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.annotations.VisibleForTesting;

/**
 * Creates the worker threads of a pool, named {@code id:n} for the n'th thread, with the
 * configured priority, daemon status and {@link Thread.UncaughtExceptionHandler}.
 */
public class NamedThreadFactory implements ThreadFactory
{
    private static volatile String globalPrefix;

    public static void setGlobalPrefix(String prefix) { globalPrefix = prefix; }
    public static String globalPrefix()
    {
        String prefix = globalPrefix;
        return prefix == null ? "" : prefix;
    }

    public final String id;
    private final int priority;
    private final boolean daemon;
    protected final AtomicInteger n = new AtomicInteger(1);
    private final Thread.UncaughtExceptionHandler uncaughtExceptionHandler;

    public NamedThreadFactory(String id)
    {
        this(id, Thread.NORM_PRIORITY, false);
    }

    public NamedThreadFactory(String id, int priority, boolean daemon)
    {
        this(id, priority, daemon, ExecutionFailure::uncaughtException);
    }

    public NamedThreadFactory(String id, int priority, boolean daemon, Thread.UncaughtExceptionHandler uncaughtExceptionHandler)
    {
        this.id = id;
        this.priority = priority;
        this.daemon = daemon;
        this.uncaughtExceptionHandler = uncaughtExceptionHandler;
    }

    @Override
    public Thread newThread(Runnable runnable)
    {
        String name = id + ':' + n.getAndIncrement();
        return setupThread(createThread(runnable, name, daemon), priority, uncaughtExceptionHandler);
    }

    public static Thread createThread(Runnable runnable, String name, boolean daemon)
    {
        String prefix = globalPrefix;
        Thread thread = new Thread(runnable, prefix != null ? prefix + name : name);
        thread.setDaemon(daemon);
        return thread;
    }

    public static <T extends Thread> T setupThread(T thread, int priority, Thread.UncaughtExceptionHandler uncaughtExceptionHandler)
    {
        thread.setPriority(priority);
        if (uncaughtExceptionHandler != null)
            thread.setUncaughtExceptionHandler(uncaughtExceptionHandler);
        return thread;
    }

    @VisibleForTesting
    public int threadsCreated()
    {
        return n.get() - 1;
    }

    @Override
    public String toString()
    {
        return id;
    }
}
