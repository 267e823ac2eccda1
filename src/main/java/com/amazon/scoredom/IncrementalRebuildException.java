// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * Signals that an incremental update could not be localized and the element
 * tree must be rebuilt from scratch.  A full rebuild from the current token
 * tree is always well defined, so callers (and the transformer itself, when
 * configured to do so) recover by falling back to it.
 */
public class IncrementalRebuildException
    extends ScoreDomException
{
    private static final long serialVersionUID = 1L;

    public IncrementalRebuildException(String message)
    {
        super(message);
    }

    public IncrementalRebuildException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
