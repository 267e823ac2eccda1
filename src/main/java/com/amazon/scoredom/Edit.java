// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * A single text replacement: the source text in {@code [start, end)} is
 * replaced by {@code text}.  A zero-width edit is an insertion, an edit with
 * empty text is a deletion.
 * <p>
 * Edits are ordered by start offset.
 */
public final class Edit
    implements Comparable<Edit>
{
    private final int    myStart;
    private final int    myEnd;
    private final String myText;

    public Edit(int start, int end, String text)
    {
        if (start < 0 || end < start)
        {
            throw new IllegalArgumentException("invalid edit range: " + start + ".." + end);
        }
        if (text == null) throw new NullPointerException("text");
        myStart = start;
        myEnd = end;
        myText = text;
    }

    public int getStart()
    {
        return myStart;
    }

    public int getEnd()
    {
        return myEnd;
    }

    /**
     * Returns the replacement text; not null.
     */
    public String getText()
    {
        return myText;
    }

    /**
     * Returns the change in text length caused by applying this edit.
     */
    public int getDelta()
    {
        return myText.length() - (myEnd - myStart);
    }

    public int compareTo(Edit other)
    {
        if (myStart != other.myStart)
        {
            return (myStart < other.myStart ? -1 : 1);
        }
        return (myEnd < other.myEnd ? -1 : (myEnd == other.myEnd ? 0 : 1));
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof Edit)) return false;
        Edit that = (Edit) other;
        return myStart == that.myStart
            && myEnd == that.myEnd
            && myText.equals(that.myText);
    }

    @Override
    public int hashCode()
    {
        int result = 31 * myStart + myEnd;
        return 31 * result + myText.hashCode();
    }

    @Override
    public String toString()
    {
        return "Edit(" + myStart + ", " + myEnd + ", \"" + myText + "\")";
    }
}
