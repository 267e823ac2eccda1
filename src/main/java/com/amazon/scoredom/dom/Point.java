// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Whitespace;

/**
 * A piece of output text in document order, with the whitespace wanted
 * before and after it.
 * <p>
 * A point is the head or tail of one element, or the text of a whole
 * unchanged subtree.  Points of elements that were read from the source
 * carry the source offsets of that text; new points have none.
 */
public final class Point
{
    private final Element    myElement;
    private final int        myPos;
    private final int        myEnd;
    private final String     myText;
    private final boolean    myModified;
    private final boolean    mySubtree;
    private final boolean    mySpacingModified;
    private final Whitespace mySpaceBefore;
    private final Whitespace mySpaceAfter;

    Point(Element element,
          int pos,
          int end,
          String text,
          boolean modified,
          boolean subtree,
          boolean spacingModified,
          Whitespace spaceBefore,
          Whitespace spaceAfter)
    {
        myElement = element;
        myPos = pos;
        myEnd = end;
        myText = text;
        myModified = modified;
        mySubtree = subtree;
        mySpacingModified = spacingModified;
        mySpaceBefore = spaceBefore;
        mySpaceAfter = spaceAfter;
    }

    /**
     * Returns the element this point belongs to.
     */
    public Element getElement()
    {
        return myElement;
    }

    /**
     * Returns the source offset of the text.
     *
     * @return -1 for text that was not read from the source.
     */
    public int getPos()
    {
        return myPos;
    }

    /**
     * Returns the source offset just past the text.
     *
     * @return -1 for text that was not read from the source.
     */
    public int getEnd()
    {
        return myEnd;
    }

    public boolean hasOrigin()
    {
        return myPos >= 0;
    }

    public String getText()
    {
        return myText;
    }

    /**
     * Determines whether the text differs from the source text at the
     * point's offsets.
     */
    public boolean isModified()
    {
        return myModified;
    }

    /**
     * Determines whether this point stands for a complete unchanged subtree.
     */
    public boolean isSubtree()
    {
        return mySubtree;
    }

    /**
     * Determines whether the whitespace wishes of this point were changed
     * after the element was read.
     */
    public boolean isSpacingModified()
    {
        return mySpacingModified;
    }

    public Whitespace getSpaceBefore()
    {
        return mySpaceBefore;
    }

    public Whitespace getSpaceAfter()
    {
        return mySpaceAfter;
    }

    Point withSpaceBefore(Whitespace spaceBefore, boolean spacingModified)
    {
        return new Point(myElement, myPos, myEnd, myText, myModified, mySubtree,
                         mySpacingModified || spacingModified,
                         spaceBefore, mySpaceAfter);
    }

    Point withSpaceAfter(Whitespace spaceAfter, boolean spacingModified)
    {
        return new Point(myElement, myPos, myEnd, myText, myModified, mySubtree,
                         mySpacingModified || spacingModified,
                         mySpaceBefore, spaceAfter);
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder("Point(");
        if (myPos >= 0)
        {
            buf.append(myPos).append(':').append(myEnd).append(' ');
        }
        buf.append('"').append(myText).append('"');
        if (myModified) buf.append(" modified");
        buf.append(' ').append(mySpaceBefore).append('/').append(mySpaceAfter);
        return buf.append(')').toString();
    }
}
