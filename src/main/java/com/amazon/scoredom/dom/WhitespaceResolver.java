// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Whitespace;
import java.util.List;

/**
 * Resolves conflicting whitespace wishes and joins text pieces.
 * <p>
 * At every junction between two pieces of text, the whitespace wishes of
 * both sides are combined and the strongest wins, in the order
 * {@code NONE < SPACE < NEWLINE < BLANK_LINE}.  The order is total, so the
 * result does not depend on which side expressed a wish first.
 */
public final class WhitespaceResolver
{
    private WhitespaceResolver() { }

    /**
     * Returns the strongest of the wishes; null wishes are ignored.
     *
     * @return {@link Whitespace#NONE} if there are no wishes.
     */
    public static Whitespace resolve(Whitespace... wishes)
    {
        Whitespace result = Whitespace.NONE;
        for (Whitespace ws : wishes)
        {
            result = Whitespace.strongest(result, ws);
        }
        return result;
    }

    /**
     * Concatenates the text of the points, writing the resolved whitespace
     * between every two pieces of text.  The wishes of points without text
     * carry over to the next junction.  Whitespace before the first and
     * after the last piece of text is not written.
     */
    public static String combine(List<Point> points)
    {
        StringBuilder buf = new StringBuilder();
        Whitespace pending = Whitespace.NONE;
        boolean started = false;
        for (Point p : points)
        {
            pending = Whitespace.strongest(pending, p.getSpaceBefore());
            String text = p.getText();
            if (text != null && !text.isEmpty())
            {
                if (started)
                {
                    buf.append(pending.getText());
                }
                buf.append(text);
                started = true;
                pending = Whitespace.NONE;
            }
            pending = Whitespace.strongest(pending, p.getSpaceAfter());
        }
        return buf.toString();
    }
}
