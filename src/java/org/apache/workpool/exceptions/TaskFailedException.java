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

package org.apache.workpool.exceptions;

import com.google.common.base.Preconditions;

/**
 * The way a task reports a failure with a specific error code. Any other throwable escaping a task
 * is reported with {@link #DEFAULT_ERROR_CODE}.
 */
public class TaskFailedException extends Exception
{
    public static final int DEFAULT_ERROR_CODE = 1;

    private final int errorCode;

    public TaskFailedException(int errorCode, String msg)
    {
        this(errorCode, msg, null);
    }

    public TaskFailedException(int errorCode, String msg, Throwable cause)
    {
        super(msg, cause);
        Preconditions.checkArgument(errorCode > 0, "error codes must be positive, got %s", errorCode);
        this.errorCode = errorCode;
    }

    public int errorCode()
    {
        return errorCode;
    }

    public static int errorCodeOf(Throwable t)
    {
        return t instanceof TaskFailedException ? ((TaskFailedException) t).errorCode : DEFAULT_ERROR_CODE;
    }
}
