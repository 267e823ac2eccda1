// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

import java.util.IdentityHashMap;

/**
 * Base class for exceptions thrown throughout this library.  Failures of
 * external collaborators (for example a {@link RuntimeException} raised by a
 * transform function) are not propagated directly but are wrapped in one or
 * more {@link ScoreDomException}s.
 * <p>
 * This library does not promise that such an "external cause" will be the
 * direct {@link ScoreDomException#getCause() cause} of the thrown exception:
 * there may be a chain of multiple {@link ScoreDomException}s before getting
 * to the external cause.  Use {@link #causeOfType(Class)} to find it.
 */
public class ScoreDomException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public ScoreDomException() { super(); }
    public ScoreDomException(String message) { super(message); }
    public ScoreDomException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the given cause, copying the message
     * from the cause into this instance.
     * @param cause
     *     the root cause of the exception; must not be null.
     */
    public ScoreDomException(Throwable cause) { super(cause.getMessage(), cause); }


    /**
     * Finds the first exception in the {@link #getCause()} chain that is
     * an instance of the given type.
     *
     * @return null if there's no cause of the given type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Throwable> T causeOfType(Class<T> type)
    {
        IdentityHashMap<Throwable, Throwable> seen =
            new IdentityHashMap<Throwable, Throwable>();

        Throwable cause = getCause();
        while (cause != null && ! type.isInstance(cause))
        {
            if (seen.put(cause, cause) != null)  // cycle check
            {
                return null;
            }
            cause = cause.getCause();
        }
        return (T) cause;
    }
}
