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

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TaskQueueTest
{
    private static Task task(int i)
    {
        return new Task(TaskFuture.create(ignored -> i, null));
    }

    @Test
    public void testFifoOrder()
    {
        TaskQueue queue = new TaskQueue(4);
        Task a = task(1), b = task(2), c = task(3);
        queue.addLast(a);
        queue.addLast(b);
        queue.addLast(c);
        assertEquals(3, queue.size());

        assertSame(a, queue.pollFirst());
        assertSame(b, queue.pollFirst());
        queue.addLast(a);
        assertSame(c, queue.pollFirst());
        assertSame(a, queue.pollFirst());
        assertNull(queue.pollFirst());
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    public void testCapacity()
    {
        TaskQueue queue = new TaskQueue(2);
        assertEquals(2, queue.capacity());
        queue.addLast(task(1));
        assertFalse(queue.isFull());
        queue.addLast(task(2));
        assertTrue(queue.isFull());
        queue.pollFirst();
        assertFalse(queue.isFull());
    }

    @Test(expected = IllegalStateException.class)
    public void testAddToFullQueue()
    {
        TaskQueue queue = new TaskQueue(1);
        queue.addLast(task(1));
        queue.addLast(task(2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroCapacity()
    {
        new TaskQueue(0);
    }

    @Test
    public void testDrain()
    {
        TaskQueue queue = new TaskQueue(3);
        Task a = task(1), b = task(2);
        queue.addLast(a);
        queue.addLast(b);

        List<Task> drained = queue.drain();
        assertEquals(2, drained.size());
        assertSame(a, drained.get(0));
        assertSame(b, drained.get(1));
        assertTrue(queue.isEmpty());
        assertNull(a.next);

        // still usable once drained
        queue.addLast(b);
        assertSame(b, queue.pollFirst());
    }
}
