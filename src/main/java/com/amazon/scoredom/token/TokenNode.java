// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

/**
 * A node of an externally built token tree: either a {@link Token} or a
 * nested {@link TokenContext}.
 * <p>
 * Offsets count UTF-16 code units from the start of the source text.  The
 * start is inclusive and the end exclusive.
 */
public interface TokenNode
{
    /**
     * Returns the offset of the first character covered by this node.
     */
    public int getStart();

    /**
     * Returns the offset just past the last character covered by this node.
     */
    public int getEnd();
}
