// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

/**
 * Describes a change of the source text: the text in
 * {@code [start, oldEnd)} of the old text was replaced, and now occupies
 * {@code [start, newEnd)} of the new text.
 */
public final class ChangeRegion
{
    private final int myStart;
    private final int myOldEnd;
    private final int myNewEnd;

    public ChangeRegion(int start, int oldEnd, int newEnd)
    {
        if (start < 0 || oldEnd < start || newEnd < start)
        {
            throw new IllegalArgumentException("invalid change region: "
                + start + ", " + oldEnd + ", " + newEnd);
        }
        myStart = start;
        myOldEnd = oldEnd;
        myNewEnd = newEnd;
    }

    /**
     * Computes the change region between two texts by stripping their
     * common prefix and suffix.
     */
    public static ChangeRegion between(String oldText, String newText)
    {
        int max = Math.min(oldText.length(), newText.length());
        int start = 0;
        while (start < max && oldText.charAt(start) == newText.charAt(start))
        {
            start++;
        }
        int oldEnd = oldText.length();
        int newEnd = newText.length();
        while (oldEnd > start && newEnd > start
               && oldText.charAt(oldEnd - 1) == newText.charAt(newEnd - 1))
        {
            oldEnd--;
            newEnd--;
        }
        return new ChangeRegion(start, oldEnd, newEnd);
    }

    public int getStart()
    {
        return myStart;
    }

    public int getOldEnd()
    {
        return myOldEnd;
    }

    public int getNewEnd()
    {
        return myNewEnd;
    }

    /**
     * Returns the change in text length.
     */
    public int getDelta()
    {
        return myNewEnd - myOldEnd;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof ChangeRegion)) return false;
        ChangeRegion that = (ChangeRegion) other;
        return myStart == that.myStart
            && myOldEnd == that.myOldEnd
            && myNewEnd == that.myNewEnd;
    }

    @Override
    public int hashCode()
    {
        return (31 * myStart + myOldEnd) * 31 + myNewEnd;
    }

    @Override
    public String toString()
    {
        return "ChangeRegion(" + myStart + ", " + myOldEnd + ", " + myNewEnd + ")";
    }
}
