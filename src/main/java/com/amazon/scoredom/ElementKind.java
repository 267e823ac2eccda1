// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * Enumeration of the closed set of element variants.
 */
public enum ElementKind
{
    /** No own text; only structural children. */
    CONTAINER,

    /** A fixed head text written before the children. */
    HEAD,

    /** A fixed head text and a fixed tail text around the children. */
    BLOCK,

    /** A mutable, typed head value written before the children. */
    TEXT;


    /**
     * Determines whether elements of this kind write a head.
     */
    public boolean hasHead()
    {
        return this != CONTAINER;
    }

    /**
     * Determines whether elements of this kind write a tail.
     */
    public boolean hasTail()
    {
        return this == BLOCK;
    }
}
