// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * An immutable range of zero-based UTF-16 offsets within source text.  The
 * start is inclusive and the end exclusive; when they are equal the range is
 * <em>empty</em>.
 */
public final class OffsetRange
{
    private final int myStart;
    private final int myEnd;

    public OffsetRange(int start, int end)
    {
        if (start < 0 || end < start)
        {
            throw new IllegalArgumentException("invalid range: " + start + ".." + end);
        }
        myStart = start;
        myEnd = end;
    }

    public int getStart()
    {
        return myStart;
    }

    public int getEnd()
    {
        return myEnd;
    }

    public int length()
    {
        return myEnd - myStart;
    }

    public boolean isEmpty()
    {
        return myStart == myEnd;
    }

    /**
     * Determines whether the offset lies in this range.  The end offset is
     * included, so a cursor right behind the last character is "in" it.
     */
    public boolean contains(int offset)
    {
        return myStart <= offset && offset <= myEnd;
    }

    /**
     * Determines whether this range shares text with {@code [start, end)}.
     * An empty argument range intersects when it touches this range.
     */
    public boolean intersects(int start, int end)
    {
        if (start == end) return contains(start);
        return myStart < end && start < myEnd;
    }

    /**
     * Returns this range moved by {@code delta} offsets.
     */
    public OffsetRange shift(int delta)
    {
        if (delta == 0) return this;
        return new OffsetRange(myStart + delta, myEnd + delta);
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof OffsetRange)) return false;
        OffsetRange that = (OffsetRange) other;
        return myStart == that.myStart && myEnd == that.myEnd;
    }

    @Override
    public int hashCode()
    {
        return 31 * myStart + myEnd;
    }

    @Override
    public String toString()
    {
        return "[" + myStart + ":" + myEnd + "]";
    }
}
