// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.token.TokenContext;

/**
 * Identifies a token context across two versions of a token tree by its
 * kind, its source range and its nesting depth.
 */
final class ContextKey
{
    private final String myKind;
    private final int    myStart;
    private final int    myEnd;
    private final int    myDepth;

    ContextKey(String kind, int start, int end, int depth)
    {
        myKind = kind;
        myStart = start;
        myEnd = end;
        myDepth = depth;
    }

    static ContextKey of(TokenContext context, int depth)
    {
        return new ContextKey(context.getKind(), context.getStart(),
                              context.getEnd(), depth);
    }

    /**
     * Returns the key the same context had before the text was changed by
     * {@code delta} characters in front of it.
     */
    ContextKey shift(int delta)
    {
        if (delta == 0) return this;
        return new ContextKey(myKind, myStart - delta, myEnd - delta, myDepth);
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof ContextKey)) return false;
        ContextKey that = (ContextKey) other;
        return myStart == that.myStart
            && myEnd == that.myEnd
            && myDepth == that.myDepth
            && myKind.equals(that.myKind);
    }

    @Override
    public int hashCode()
    {
        int result = myKind.hashCode();
        result = 31 * result + myStart;
        result = 31 * result + myEnd;
        return 31 * result + myDepth;
    }

    @Override
    public String toString()
    {
        return myKind + "[" + myStart + ":" + myEnd + "]@" + myDepth;
    }
}
