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

public class ExecutionFailure
{
    private static final Logger logger = LoggerFactory.getLogger(ExecutionFailure.class);

    /**
     * Invoke the relevant {@link java.lang.Thread.UncaughtExceptionHandler}, falling back to
     * {@link #uncaughtException(Thread, Throwable)} if the thread has none.
     */
    public static void handle(Throwable t)
    {
        try
        {
            Thread thread = Thread.currentThread();
            Thread.UncaughtExceptionHandler handler = thread.getUncaughtExceptionHandler();
            if (handler == null)
                handler = ExecutionFailure::uncaughtException;
            handler.uncaughtException(thread, t);
        }
        catch (Throwable shouldNeverHappen)
        {
            logger.error("Unexpected error while handling unexpected error", shouldNeverHappen);
        }
    }

    /**
     * The default handler for worker threads: log, and leave the decision to die to the JVM.
     */
    public static void uncaughtException(Thread thread, Throwable t)
    {
        logger.error("Exception in thread {}", thread, t);
    }
}
