// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.edit;

import com.amazon.scoredom.Edit;
import com.amazon.scoredom.token.ChangeRegion;
import java.util.List;

/**
 * Utility methods for applying lists of {@link Edit}s.
 * <p>
 * The methods expect the edits to be in ascending order and not to
 * overlap, as returned by {@link EditGenerator}.  Every offset refers to the
 * text before any of the edits is applied.
 */
public final class Edits
{
    private Edits() { }

    /**
     * Applies the edits to the buffer.
     *
     * @return the number of edits applied.
     *
     * @throws IllegalArgumentException if the edits are not ordered, overlap,
     * or lie outside the buffer.
     */
    public static int apply(List<Edit> edits, StringBuilder buffer)
    {
        checkOrder(edits, buffer.length());
        for (int i = edits.size() - 1; i >= 0; i--)
        {
            Edit e = edits.get(i);
            buffer.replace(e.getStart(), e.getEnd(), e.getText());
        }
        return edits.size();
    }

    /**
     * Returns the text with the edits applied.
     */
    public static String apply(List<Edit> edits, String text)
    {
        StringBuilder buffer = new StringBuilder(text);
        apply(edits, buffer);
        return buffer.toString();
    }

    /**
     * Returns the smallest region covering all edits, suitable for an
     * incremental update of the tree.
     *
     * @return null if the list is empty.
     */
    public static ChangeRegion changeRegion(List<Edit> edits)
    {
        if (edits.isEmpty()) return null;
        int delta = 0;
        for (Edit e : edits)
        {
            delta += e.getDelta();
        }
        int start = edits.get(0).getStart();
        int oldEnd = edits.get(edits.size() - 1).getEnd();
        return new ChangeRegion(start, oldEnd, oldEnd + delta);
    }

    private static void checkOrder(List<Edit> edits, int length)
    {
        int pos = 0;
        for (Edit e : edits)
        {
            if (e.getStart() < pos)
            {
                throw new IllegalArgumentException("edits overlap or are out of order at " + e);
            }
            pos = e.getEnd();
        }
        if (pos > length)
        {
            throw new IllegalArgumentException("edit beyond end of text: " + pos);
        }
    }
}
