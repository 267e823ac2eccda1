// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.edit;

import com.amazon.scoredom.Edit;
import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.StaleOriginException;
import com.amazon.scoredom.Whitespace;
import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.dom.Origin;
import com.amazon.scoredom.dom.Point;
import com.amazon.scoredom.dom.Points;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.TokenTree;
import com.amazon.scoredom.token.Tokens;
import java.util.List;

/**
 * Computes the text edits that bring a source text in line with an element
 * tree that was built from it and then changed.
 * <p>
 * The tree is walked as a sequence of {@link Point}s, with every unchanged
 * subtree collapsed into a single point.  The source tokens between two
 * points that were read from the source are deleted; points without origin
 * are inserted; modified heads replace their head tokens.  A point whose
 * source offset lies before the text already passed was moved, and is
 * inserted as well.
 * <p>
 * Whitespace in the source is left alone, except where new text is
 * inserted, where text is deleted, and where whitespace wishes were changed;
 * there the whitespace is made to satisfy the resolved wish.
 * <p>
 * Instances are immutable and can be reused for several trees built from
 * the same token tree.
 */
public final class EditGenerator
{
    private final TokenTree myTree;

    public EditGenerator(TokenTree tree)
    {
        if (tree == null) throw new NullPointerException("tree");
        myTree = tree;
    }

    /**
     * Computes the edits for the whole source range of the tree: the origin
     * range of {@code root}, or the range of the token tree when the root
     * has no origin.
     */
    public List<Edit> edits(Element root)
    {
        OffsetRange range = root.getOriginRange();
        if (range == null)
        {
            range = new OffsetRange(myTree.getRoot().getStart(),
                                    myTree.getRoot().getEnd());
        }
        return edits(root, range.getStart(), range.getEnd());
    }

    /**
     * Computes the edits within {@code [start, end)}.  Added or modified
     * text is written even when it lies outside the range, but no text
     * outside the range is deleted.
     *
     * @return the edits in ascending order; touching edits are merged.
     *
     * @throws StaleOriginException if a token the tree was built from no
     * longer matches the text.
     */
    public List<Edit> edits(Element root, int start, int end)
    {
        String text = myTree.getText();
        if (start < 0 || end < start || end > text.length())
        {
            throw new IndexOutOfBoundsException("range " + start + ".." + end
                                                + " outside text of length " + text.length());
        }
        checkOrigins(root, text);

        List<Token> tokens = Tokens.flatten(myTree.getRoot());
        int ti = 0;
        while (ti < tokens.size() && tokens.get(ti).getStart() < start)
        {
            ti++;
        }

        EditList edits = new EditList();
        int pos = start;
        Whitespace insertAfter = Whitespace.NONE;
        boolean dirty = false;
        // whether text is kept or written before pos
        boolean hasText = false;

        for (Point point : Points.collapsed(root))
        {
            Whitespace space = Whitespace.strongest(insertAfter, point.getSpaceBefore());
            dirty |= point.isSpacingModified();

            if (point.hasOrigin() && point.getEnd() <= start && pos == start)
            {
                // Before the range: only write changes of the text itself.
                replaceModified(edits, text, point);
                hasText = true;
                continue;
            }

            if (!point.hasOrigin() || point.getPos() < pos)
            {
                String insert = insertionText(point, text);
                if (!insert.isEmpty())
                {
                    edits.add(pos, pos, (hasText ? space.getText() : "") + insert);
                    insertAfter = point.getSpaceAfter();
                    dirty = true;
                    hasText = true;
                }
                continue;
            }

            if (point.getPos() > pos)
            {
                int delStart = pos;
                int delEnd = pos;
                while (ti < tokens.size()
                       && tokens.get(ti).getStart() < point.getPos()
                       && tokens.get(ti).getStart() < end)
                {
                    delEnd = Math.max(delEnd, Math.min(tokens.get(ti).getEnd(), end));
                    ti++;
                }
                if (delEnd > delStart)
                {
                    // whitespace up to the point goes as well
                    if (delEnd < point.getPos() && point.getPos() <= end
                        && isWhitespace(text.substring(delEnd, point.getPos())))
                    {
                        delEnd = point.getPos();
                    }
                    edits.addMinimal(text, delStart, delEnd,
                                     hasText ? space.getText() : "");
                }
                else if (dirty && point.getPos() <= end)
                {
                    normalizeGap(edits, text, pos, point.getPos(), space);
                }
            }
            else if (dirty && space != Whitespace.NONE)
            {
                edits.add(pos, pos, space.getText());
            }

            while (ti < tokens.size() && tokens.get(ti).getStart() < point.getEnd())
            {
                ti++;
            }
            replaceModified(edits, text, point);
            pos = point.getEnd();
            insertAfter = point.getSpaceAfter();
            dirty = point.isSpacingModified();
            hasText = true;
        }

        if (pos < end)
        {
            int delEnd = pos;
            while (ti < tokens.size() && tokens.get(ti).getStart() < end)
            {
                delEnd = Math.max(delEnd, Math.min(tokens.get(ti).getEnd(), end));
                ti++;
            }
            if (delEnd > pos)
            {
                edits.add(pos, delEnd, "");
            }
        }
        return edits.toList();
    }

    /**
     * Returns the text to insert for a point.  A moved, unchanged subtree is
     * copied from the source so its formatting is kept.
     */
    private static String insertionText(Point point, String text)
    {
        if (point.isSubtree() && point.hasOrigin())
        {
            return text.substring(point.getPos(), point.getEnd());
        }
        return point.getText();
    }

    /**
     * Replaces the head tokens of a modified point, unless the new text
     * equals the source.
     */
    private static void replaceModified(EditList edits, String text, Point point)
    {
        if (!point.isModified()) return;
        String written = point.getText();
        int length = point.getEnd() - point.getPos();
        if (written.length() == length
            && text.regionMatches(point.getPos(), written, 0, length))
        {
            return;
        }
        edits.add(point.getPos(), point.getEnd(), written);
    }

    /**
     * Replaces whitespace between two kept pieces of text when it is weaker
     * than wanted.
     */
    private static void normalizeGap(EditList edits, String text,
                                     int start, int end, Whitespace wanted)
    {
        String gap = text.substring(start, end);
        if (!isWhitespace(gap)) return;
        if (Whitespace.classify(gap).compareTo(wanted) < 0)
        {
            edits.addMinimal(text, start, end, wanted.getText());
        }
    }

    private static boolean isWhitespace(String s)
    {
        for (int i = 0; i < s.length(); i++)
        {
            if (!Character.isWhitespace(s.charAt(i))) return false;
        }
        return true;
    }

    /**
     * Verifies that every token referenced by the tree still matches the
     * text.
     */
    private static void checkOrigins(Element root, String text)
    {
        checkOrigin(root, text);
        for (Element e : root.descendants())
        {
            checkOrigin(e, text);
        }
    }

    private static void checkOrigin(Element e, String text)
    {
        Origin origin = e.getOrigin();
        if (origin == null) return;
        checkTokens(origin.getHeadTokens(), text, e);
        checkTokens(origin.getTailTokens(), text, e);
    }

    private static void checkTokens(List<Token> tokens, String text, Element e)
    {
        for (Token t : tokens)
        {
            if (!Tokens.matches(t, text))
            {
                throw new StaleOriginException(
                    "origin of " + e.getType() + " no longer matches the text: "
                    + t.getKind() + " \"" + t.getText() + "\" at " + t.getStart(),
                    t.getStart());
            }
        }
    }
}
