// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * Signals that the origin recorded on an element no longer resolves against
 * the token tree it is being compared with: the offsets fall outside the text
 * or the text at those offsets has changed.
 * <p>
 * This is recoverable: transform the current token tree again and compute
 * the edits against the fresh element tree.
 */
public class StaleOriginException
    extends ScoreDomException
{
    private static final long serialVersionUID = 1L;

    private final int myOffset;

    public StaleOriginException(String message, int offset)
    {
        super(message);
        myOffset = offset;
    }

    /**
     * The source offset at which the stale origin was detected.
     */
    public int getOffset()
    {
        return myOffset;
    }
}
