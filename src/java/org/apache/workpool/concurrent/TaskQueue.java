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

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import com.google.common.base.Preconditions;

/**
 * A bounded FIFO of {@link Task}s, linked through the tasks themselves.
 *
 * Not synchronized: every access happens under the owning {@link ThreadPool}'s queue lock, which also
 * owns the conditions used to wait for this queue to become non-empty or non-full.
 */
@NotThreadSafe
final class TaskQueue
{
    private final int capacity;
    private Task head;
    private Task tail;
    private int size;

    TaskQueue(int capacity)
    {
        Preconditions.checkArgument(capacity > 0, "queue capacity must be positive, got %s", capacity);
        this.capacity = capacity;
    }

    int capacity()
    {
        return capacity;
    }

    int size()
    {
        return size;
    }

    boolean isEmpty()
    {
        return head == null;
    }

    boolean isFull()
    {
        return size >= capacity;
    }

    void addLast(Task task)
    {
        Preconditions.checkState(!isFull(), "queue is full");
        task.next = null;
        if (tail == null)
            head = task;
        else
            tail.next = task;
        tail = task;
        size++;
    }

    @Nullable
    Task pollFirst()
    {
        Task task = head;
        if (task == null)
            return null;

        head = task.next;
        if (head == null)
            tail = null;
        task.next = null;
        size--;
        return task;
    }

    /**
     * Remove every task, oldest first.
     */
    List<Task> drain()
    {
        List<Task> drained = new ArrayList<>(size);
        Task task;
        while ((task = pollFirst()) != null)
            drained.add(task);
        return drained;
    }
}
