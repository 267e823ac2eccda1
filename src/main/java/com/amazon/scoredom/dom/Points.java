// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.Whitespace;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the {@link Point}s of an element tree in document order.
 * <p>
 * The whitespace wishes of an element are attached to the points next to
 * the junction they apply to: space-before and space-after-head to the head
 * point, space-between to the last point of every child but the last, and
 * space-after to the tail point, or to the last point of the last child if
 * the element has no tail.
 */
public final class Points
{
    private Points() { }

    /**
     * Returns the points of every head and tail in the subtree.
     */
    public static List<Point> of(Element element)
    {
        List<Point> points = new ArrayList<Point>();
        collect(element, false, points);
        return points;
    }

    /**
     * Returns the points of the subtree, where each
     * {@linkplain Element#isUnchanged() unchanged} subtree is a single point
     * covering its whole source range.
     */
    public static List<Point> collapsed(Element element)
    {
        List<Point> points = new ArrayList<Point>();
        collect(element, true, points);
        return points;
    }

    private static void collect(Element element, boolean collapse, List<Point> out)
    {
        if (collapse && element.isUnchanged())
        {
            List<Point> inner = new ArrayList<Point>();
            collect(element, false, inner);
            Point subtree = subtreePoint(element, inner);
            if (subtree != null)
            {
                out.add(subtree);
                return;
            }
        }

        int first = out.size();
        Spacing spacing = element.getSpacing();
        boolean spacingModified = element.isSpacingModified();

        Point head = element.headPoint();
        Point tail = element.tailPoint();
        if (head != null) out.add(head);

        int count = element.size();
        for (int i = 0; i < count; i++)
        {
            int before = out.size();
            collect(element.get(i), collapse, out);
            if (out.size() == before) continue;

            Whitespace last;
            if (i < count - 1)
            {
                last = spacing.spaceBetween();
            }
            else if (tail == null)
            {
                last = spacing.spaceAfter();
            }
            else
            {
                continue;
            }
            int index = out.size() - 1;
            Point p = out.get(index);
            out.set(index, p.withSpaceAfter(Whitespace.strongest(p.getSpaceAfter(), last),
                                            spacingModified));
        }

        if (tail != null) out.add(tail);

        // A container has no head point to carry its space-before.
        if (head == null && out.size() > first)
        {
            Point p = out.get(first);
            out.set(first, p.withSpaceBefore(
                Whitespace.strongest(p.getSpaceBefore(), spacing.spaceBefore()),
                spacingModified));
        }
    }

    private static Point subtreePoint(Element element, List<Point> inner)
    {
        if (inner.isEmpty()) return null;
        Point first = inner.get(0);
        Point last = inner.get(inner.size() - 1);
        if (!first.hasOrigin() || !last.hasOrigin()) return null;
        return new Point(element,
                         first.getPos(),
                         last.getEnd(),
                         WhitespaceResolver.combine(inner),
                         false,
                         true,
                         false,
                         first.getSpaceBefore(),
                         last.getSpaceAfter());
    }
}
