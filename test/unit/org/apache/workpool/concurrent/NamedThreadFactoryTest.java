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

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class NamedThreadFactoryTest
{
    @After
    public void clearPrefix()
    {
        NamedThreadFactory.setGlobalPrefix(null);
    }

    @Test
    public void testThreadsAreNumbered()
    {
        NamedThreadFactory factory = new NamedThreadFactory("pool");
        Runnable noop = () -> {};
        assertEquals("pool:1", factory.newThread(noop).getName());
        assertEquals("pool:2", factory.newThread(noop).getName());
        assertEquals(2, factory.threadsCreated());
        assertEquals("", NamedThreadFactory.globalPrefix());
    }

    @Test
    public void testThreadSettings()
    {
        Thread.UncaughtExceptionHandler handler = (t, e) -> {};
        NamedThreadFactory factory = new NamedThreadFactory("pool", Thread.MIN_PRIORITY, true, handler);
        Thread thread = factory.newThread(() -> {});
        assertTrue(thread.isDaemon());
        assertEquals(Thread.MIN_PRIORITY, thread.getPriority());
        assertSame(handler, thread.getUncaughtExceptionHandler());
        assertFalse(new NamedThreadFactory("other").newThread(() -> {}).isDaemon());
    }

    @Test
    public void testGlobalPrefix()
    {
        NamedThreadFactory.setGlobalPrefix("node1/");
        assertEquals("node1/pool:1", new NamedThreadFactory("pool").newThread(() -> {}).getName());
    }
}
