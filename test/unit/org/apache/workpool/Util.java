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

package org.apache.workpool;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.google.common.base.Objects;
import com.google.common.util.concurrent.Uninterruptibles;

import static org.junit.Assert.assertEquals;

public class Util
{
    /**
     * Repeatedly evaluate {@code actual} until it equals {@code expected}, failing if it still does not after
     * {@code timeoutInSeconds}.
     */
    public static <T> void spinAssertEquals(T expected, Supplier<T> actual, int timeoutInSeconds)
    {
        spinAssertEquals(null, expected, actual, timeoutInSeconds);
    }

    public static <T> void spinAssertEquals(String message, T expected, Supplier<T> actual, int timeoutInSeconds)
    {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutInSeconds);
        T result = actual.get();
        while (!Objects.equal(expected, result) && System.nanoTime() < deadline)
        {
            Uninterruptibles.sleepUninterruptibly(10, TimeUnit.MILLISECONDS);
            result = actual.get();
        }
        assertEquals(message, expected, result);
    }

    public static Thread startThread(String name, Runnable runnable)
    {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    public static void joinUninterruptibly(Thread thread, int timeoutInSeconds)
    {
        Uninterruptibles.joinUninterruptibly(thread, timeoutInSeconds, TimeUnit.SECONDS);
        assertEquals(thread + " did not terminate", false, thread.isAlive());
    }
}
