// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * An error caused by adding a node to a parent when it's already a child
 * elsewhere.  Detach the node first, or add a copy.
 */
public class AlreadyAttachedException
    extends ScoreDomException
{
    private static final long serialVersionUID = 1L;

    public AlreadyAttachedException()
    {
        super();
    }

    /**
     * @param message
     */
    public AlreadyAttachedException(String message)
    {
        super(message);
    }
}
