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

package org.apache.workpool.config;

import java.util.HashSet;
import java.util.Set;

import com.google.common.annotations.VisibleForTesting;

import org.apache.workpool.exceptions.ConfigurationException;

/**
 * The system properties a pool falls back on for whatever its builder leaves unset.
 * Sizes are validated when they are read, so a bad value fails the pool that needs it, not class loading.
 */
public enum WorkPoolProperties
{
    /** Name given to pools (and their worker threads) that are not explicitly named. */
    DEFAULT_POOL_NAME("workpool.default_pool_name", "WorkPool"),
    /** Queue capacity used when a pool is created with a queue size of zero. */
    DEFAULT_QUEUE_SIZE("workpool.default_queue_size", "64"),
    /** Worker count used when a pool is created with zero threads. */
    DEFAULT_THREADS("workpool.default_threads", "4"),
    /**
     * Whether worker threads are daemon threads. Non-daemon by default, so a pool that is never
     * shut down keeps the JVM alive the same way an unjoined thread would.
     */
    WORKER_DAEMON("workpool.worker_daemon", "false");

    static
    {
        Set<String> keys = new HashSet<>();
        WorkPoolProperties prev = null;
        for (WorkPoolProperties property : values())
        {
            if (!keys.add(property.key))
                throw new IllegalStateException("Duplicate system property " + property.key);
            if (prev != null && property.name().compareTo(prev.name()) < 0)
                throw new IllegalStateException(prev.name() + " should be declared after " + property.name());
            prev = property;
        }
    }

    private final String key;
    private final String defaultValue;

    WorkPoolProperties(String key, String defaultValue)
    {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public String getKey()
    {
        return key;
    }

    /**
     * @return the property's value, or its default if unset
     */
    public String getString()
    {
        return System.getProperty(key, defaultValue);
    }

    public boolean getBoolean()
    {
        return Boolean.parseBoolean(getString());
    }

    /**
     * Read a pool size. Decimal, hex and octal forms are accepted, as by {@link Integer#decode(String)}.
     *
     * @throws ConfigurationException if the value is not an integer, or is not positive
     */
    public int getPositiveInt()
    {
        String value = getString();
        int size;
        try
        {
            size = Integer.decode(value.trim());
        }
        catch (NumberFormatException e)
        {
            throw new ConfigurationException(String.format("Invalid value for system property %s: " +
                                                           "expected an integer but got '%s'", key, value), e);
        }

        if (size <= 0)
            throw new ConfigurationException(String.format("Invalid value for system property %s: " +
                                                           "expected a positive integer but got %d", key, size), false);
        return size;
    }

    @VisibleForTesting
    public void setString(String value)
    {
        System.setProperty(key, value);
    }

    @VisibleForTesting
    public void clearValue()
    {
        System.clearProperty(key);
    }
}
