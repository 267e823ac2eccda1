// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Edit;
import com.amazon.scoredom.ElementKind;
import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.TypeMismatchException;
import com.amazon.scoredom.Whitespace;
import com.amazon.scoredom.edit.EditGenerator;
import com.amazon.scoredom.edit.Edits;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.TokenTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * A node of the semantic document tree.
 * <p>
 * Every element has an {@link ElementType} that determines its
 * {@linkplain ElementKind kind}, its head and tail text, and its default
 * whitespace.  The set of variants is closed: {@link ContainerElement},
 * {@link HeadElement}, {@link BlockElement} and {@link TextElement}.
 * Elements are created with {@link ElementType#newElement(Element...)} or by
 * a {@link com.amazon.scoredom.transform.Transformer}; only the latter gives
 * them an {@linkplain #getOrigin() origin}.
 * <p>
 * An element remembers whether its head, its children or its whitespace
 * changed since it was read from the source.  {@link #edits(TokenTree)} uses
 * that to compute the smallest text changes that bring the source in line
 * with the tree.
 * <p>
 * Instances are not thread-safe.
 */
public abstract class Element
    extends Node<Element>
{
    static final int HEAD_MODIFIED     = 0x01;
    static final int CHILDREN_MODIFIED = 0x02;
    static final int SPACING_MODIFIED  = 0x04;

    private final ElementType _type;
    private Spacing           _spacing = Spacing.UNSET;
    private Origin            _origin;
    private int               _flags;


    Element(ElementType type)
    {
        _type = type;
    }


    public final ElementType getType()
    {
        return _type;
    }

    public final ElementKind getKind()
    {
        return _type.getKind();
    }

    public abstract void accept(ElementVisitor visitor);


    //=========================================================================
    // Head and tail

    /**
     * Returns the head value.  For HEAD and BLOCK elements this is the fixed
     * head text.
     *
     * @return null for containers.
     */
    public Object getHead()
    {
        return null;
    }

    /**
     * Returns the head value as an instance of the given class.
     *
     * @throws TypeMismatchException if the head value is not an instance of
     * {@code type}.
     */
    public final <T> T getHead(Class<T> type)
    {
        Object head = getHead();
        if (!type.isInstance(head))
        {
            throw new TypeMismatchException(
                _type + " head is not a " + type.getSimpleName() + ": " + head,
                type, head);
        }
        return type.cast(head);
    }

    /**
     * Changes the head value.
     *
     * @throws UnsupportedOperationException if this element has no mutable
     * head.
     * @throws TypeMismatchException if the value is not accepted by the
     * element type's head format.
     */
    public void setHead(Object head)
    {
        throw new UnsupportedOperationException(
            _type + " elements have no mutable head");
    }

    /**
     * Returns the text written for the head.
     *
     * @return null if this element writes no head.
     */
    public String getHeadText()
    {
        return null;
    }

    /**
     * Returns the text written for the tail.
     *
     * @return null if this element writes no tail.
     */
    public String getTailText()
    {
        return null;
    }


    //=========================================================================
    // Modification state

    /**
     * Determines whether this element itself changed since it was created or
     * read from the source.  Changes of descendants don't count.
     */
    public final boolean isModified()
    {
        return _flags != 0;
    }

    public final boolean isHeadModified()
    {
        return (_flags & HEAD_MODIFIED) != 0;
    }

    public final boolean isChildrenModified()
    {
        return (_flags & CHILDREN_MODIFIED) != 0;
    }

    public final boolean isSpacingModified()
    {
        return (_flags & SPACING_MODIFIED) != 0;
    }

    /**
     * Determines whether this element was read from the source and neither
     * it nor any of its descendants changed since.  The text of an unchanged
     * element can be copied from the source verbatim.
     */
    public final boolean isUnchanged()
    {
        if (_origin == null || _flags != 0) return false;
        for (Element child : this)
        {
            if (!child.isUnchanged()) return false;
        }
        return true;
    }

    final void markModified(int flag)
    {
        _flags |= flag;
    }

    final void clearModified()
    {
        _flags = 0;
    }

    @Override
    protected final void childrenChanged()
    {
        _flags |= CHILDREN_MODIFIED;
    }


    //=========================================================================
    // Whitespace

    /**
     * Returns the effective whitespace policy: the element type's defaults
     * overridden by the attributes set on this element.
     */
    public final Spacing getSpacing()
    {
        return _type.getSpacing().overriddenBy(_spacing);
    }

    /**
     * Returns only the attributes set on this element.
     */
    public final Spacing getSpacingOverrides()
    {
        return _spacing;
    }

    /**
     * Replaces the attributes set on this element.  Unset attributes fall
     * back to the element type's defaults.
     */
    public final void setSpacingOverrides(Spacing overrides)
    {
        if (overrides == null) overrides = Spacing.UNSET;
        if (!overrides.equals(_spacing))
        {
            _spacing = overrides;
            _flags |= SPACING_MODIFIED;
        }
    }

    public final Whitespace getSpaceBefore()     { return getSpacing().spaceBefore(); }
    public final Whitespace getSpaceAfterHead()  { return getSpacing().spaceAfterHead(); }
    public final Whitespace getSpaceBetween()    { return getSpacing().spaceBetween(); }
    public final Whitespace getSpaceBeforeTail() { return getSpacing().spaceBeforeTail(); }
    public final Whitespace getSpaceAfter()      { return getSpacing().spaceAfter(); }

    /**
     * Sets the whitespace wanted before this element; null reverts to the
     * element type's default.
     */
    public final void setSpaceBefore(Whitespace ws)
    {
        setSpacingOverrides(_spacing.withSpaceBefore(ws));
    }

    public final void setSpaceAfterHead(Whitespace ws)
    {
        setSpacingOverrides(_spacing.withSpaceAfterHead(ws));
    }

    public final void setSpaceBetween(Whitespace ws)
    {
        setSpacingOverrides(_spacing.withSpaceBetween(ws));
    }

    public final void setSpaceBeforeTail(Whitespace ws)
    {
        setSpacingOverrides(_spacing.withSpaceBeforeTail(ws));
    }

    public final void setSpaceAfter(Whitespace ws)
    {
        setSpacingOverrides(_spacing.withSpaceAfter(ws));
    }


    //=========================================================================
    // Origin

    /**
     * Returns where this element was read from.
     *
     * @return null if this element was not created by a transform.
     */
    public final Origin getOrigin()
    {
        return _origin;
    }

    public final boolean hasOrigin()
    {
        return _origin != null;
    }

    final void setOrigin(Origin origin)
    {
        _origin = origin;
    }

    /**
     * Returns the source range of the context this element was built from.
     *
     * @return null if this element has no origin.
     */
    public final OffsetRange getOriginRange()
    {
        return _origin == null ? null : _origin.getRange();
    }

    /**
     * Determines whether the offset lies within the origin range, end
     * inclusive.
     */
    public final boolean containsOffset(int offset)
    {
        return _origin != null && _origin.getRange().contains(offset);
    }

    /**
     * Returns the source offset of this element: the start of its head
     * tokens or, lacking those, of the first descendant's head tokens.
     * <p>
     * This follows changes of the children, so it may be an expensive call
     * on a heavily modified tree.
     *
     * @return -1 if neither this element nor a descendant has head tokens.
     */
    public final int getPos()
    {
        int pos = headStart();
        if (pos >= 0) return pos;
        for (Element e : descendants())
        {
            pos = e.headStart();
            if (pos >= 0) return pos;
        }
        return -1;
    }

    /**
     * Returns the source offset just past this element: the end of its tail
     * tokens, of its last positioned child, or of its head tokens.
     *
     * @return -1 if neither this element nor a descendant has an origin.
     */
    public final int getEnd()
    {
        if (_origin != null)
        {
            int end = Origin.endOf(_origin.getTailTokens());
            if (end >= 0) return end;
        }
        for (Element child : reversed())
        {
            int end = child.getEnd();
            if (end >= 0) return end;
        }
        return _origin == null ? -1 : Origin.endOf(_origin.getHeadTokens());
    }

    private int headStart()
    {
        return _origin == null ? -1 : Origin.startOf(_origin.getHeadTokens());
    }


    //=========================================================================
    // Output

    abstract Point headPoint();

    Point tailPoint()
    {
        return null;
    }

    final Point newPoint(List<? extends Token> tokens,
                         String text,
                         boolean modified,
                         Whitespace spaceBefore,
                         Whitespace spaceAfter)
    {
        int pos = -1;
        int end = -1;
        if (tokens != null && !tokens.isEmpty())
        {
            pos = tokens.get(0).getStart();
            end = tokens.get(tokens.size() - 1).getEnd();
        }
        return new Point(this, pos, end, text, modified, false,
                         isSpacingModified(), spaceBefore, spaceAfter);
    }

    /**
     * Returns the text pieces of this element and its descendants in
     * document order.
     */
    public final List<Point> points()
    {
        return Points.of(this);
    }

    /**
     * Returns the source text of this subtree.  Whitespace wanted before the
     * first and after the last piece of text is not included.
     */
    public final String serialize()
    {
        return WhitespaceResolver.combine(points());
    }

    /**
     * Computes the text changes needed to bring the source text in line
     * with this element, which must be the root of the tree built from
     * {@code tree}.
     *
     * @throws com.amazon.scoredom.StaleOriginException if the tokens this
     * tree was built from no longer match the text.
     */
    public final List<Edit> edits(TokenTree tree)
    {
        return new EditGenerator(tree).edits(this);
    }

    /**
     * Applies the changes computed by {@link #edits(TokenTree)} to a buffer
     * holding the text of {@code tree}.
     *
     * @return the number of changes made.
     */
    public final int edit(TokenTree tree, StringBuilder buffer)
    {
        return Edits.apply(edits(tree), buffer);
    }


    //=========================================================================
    // Copying

    /**
     * Creates an element with the same type, head and whitespace, but
     * without children, origin and modification state.
     */
    abstract Element newInstance();

    /**
     * Copies this element and its descendants, without origin.
     */
    public final Element copy()
    {
        return copy(true);
    }

    public final Element copy(boolean withChildren)
    {
        Element copy = newInstance();
        if (withChildren)
        {
            for (Element child : this)
            {
                copy.add(child.copy(true));
            }
        }
        copy.clearModified();
        return copy;
    }

    /**
     * Copies this element and its descendants including their origins and
     * modification state.  The copy is detached.
     */
    public final Element copyWithOrigin()
    {
        return copyWithOrigin(true);
    }

    public final Element copyWithOrigin(boolean withChildren)
    {
        Element copy = newInstance();
        if (withChildren)
        {
            for (Element child : this)
            {
                copy.add(child.copyWithOrigin(true));
            }
        }
        copy._origin = _origin;
        copy._flags = _flags;
        if (!withChildren && size() != 0 && _origin != null)
        {
            copy._flags |= CHILDREN_MODIFIED;
        }
        return copy;
    }

    final void copySpacingTo(Element copy)
    {
        copy._spacing = _spacing;
    }


    //=========================================================================
    // Queries by position

    /**
     * Returns the child touching the position.  Of two children touching
     * it, the right one is chosen.  Children without a position are
     * skipped.
     *
     * @return null if no child touches the position.
     */
    public final Element findChild(int position)
    {
        Element prev = null;
        for (Element n : this)
        {
            int pos = n.getPos();
            if (pos < 0) continue;
            if (pos == position) return n;
            if (pos > position) return prev;
            int end = n.getEnd();
            if (end > position) return n;
            prev = (end == position) ? n : null;
        }
        return prev;
    }

    /**
     * Returns the child containing the position, then the grandchild, and
     * so on, down to the youngest descendant that contains the range
     * {@code [position, end]}.
     */
    public final List<Element> findDescendantsAt(int position, int end)
    {
        if (end < position) end = position;
        List<Element> result = new ArrayList<Element>();
        Element n = findChild(position);
        while (n != null && n.getPos() <= position && end <= n.getEnd())
        {
            result.add(n);
            n = n.findChild(position);
        }
        return result;
    }

    /**
     * Returns the youngest descendant containing the position.
     *
     * @return null if no descendant contains it.
     */
    public final Element findDescendantAt(int position)
    {
        return findDescendantAt(position, position);
    }

    /**
     * Returns the youngest descendant containing the range
     * {@code [position, end]}.
     *
     * @return null if no descendant contains it.
     */
    public final Element findDescendantAt(int position, int end)
    {
        List<Element> found = findDescendantsAt(position, end);
        return found.isEmpty() ? null : found.get(found.size() - 1);
    }

    /**
     * Returns the first descendant that starts at or to the right of the
     * position.
     *
     * @return null if there is none.
     */
    public final Element findDescendantRight(int position)
    {
        Deque<Iterator<Element>> stack = new ArrayDeque<Iterator<Element>>();
        Iterator<Element> it = iterator();
        while (true)
        {
            boolean entered = false;
            while (it.hasNext())
            {
                Element n = it.next();
                int end = n.getEnd();
                if (end >= 0 && end > position)
                {
                    if (n.getPos() >= position) return n;
                    stack.push(it);
                    it = n.iterator();
                    entered = true;
                    break;
                }
            }
            if (!entered)
            {
                if (stack.isEmpty()) return null;
                it = stack.pop();
            }
        }
    }

    /**
     * Returns the last descendant that ends at or to the left of the
     * position.
     *
     * @return null if there is none.
     */
    public final Element findDescendantLeft(int position)
    {
        Deque<Iterator<Element>> stack = new ArrayDeque<Iterator<Element>>();
        Iterator<Element> it = reversed().iterator();
        while (true)
        {
            boolean entered = false;
            while (it.hasNext())
            {
                Element n = it.next();
                int pos = n.getPos();
                if (pos >= 0 && pos < position)
                {
                    if (n.getEnd() <= position) return n;
                    stack.push(it);
                    it = n.reversed().iterator();
                    entered = true;
                    break;
                }
            }
            if (!entered)
            {
                if (stack.isEmpty()) return null;
                it = stack.pop();
            }
        }
    }

    /**
     * Iterates the descendants for which the predicate holds and whose
     * source range intersects {@code [start, end)}, in document order.  An
     * empty range selects the descendants containing {@code start}.
     * Descendants without a position are skipped, and subtrees outside the
     * range are not entered.  The sequence is lazy and can be restarted.
     */
    public final Iterable<Element> findDescendants(final Predicate<? super Element> predicate,
                                                   final int start, final int end)
    {
        return new Iterable<Element>()
        {
            public Iterator<Element> iterator()
            {
                return new RangeIterator(Element.this, predicate, start, end);
            }
        };
    }

    private static final class RangeIterator
        implements Iterator<Element>
    {
        private final Predicate<? super Element> myPredicate;
        private final int myStart;
        private final int myEnd;
        private final Deque<Iterator<Element>> myStack = new ArrayDeque<Iterator<Element>>();
        private Element myNext;

        RangeIterator(Element parent, Predicate<? super Element> predicate,
                      int start, int end)
        {
            myPredicate = predicate;
            myStart = start;
            myEnd = end;
            myStack.push(parent.iterator());
        }

        private boolean beyond(int pos)
        {
            return myStart == myEnd ? pos > myStart : pos >= myEnd;
        }

        public boolean hasNext()
        {
            while (myNext == null && !myStack.isEmpty())
            {
                Iterator<Element> it = myStack.peek();
                if (!it.hasNext())
                {
                    myStack.pop();
                    continue;
                }
                Element n = it.next();
                int pos = n.getPos();
                if (pos < 0) continue;
                if (beyond(pos))
                {
                    myStack.pop();
                    continue;
                }
                if (n.getEnd() <= myStart) continue;
                myStack.push(n.iterator());
                if (myPredicate.test(n)) myNext = n;
            }
            return myNext != null;
        }

        public Element next()
        {
            if (!hasNext()) throw new NoSuchElementException();
            Element result = myNext;
            myNext = null;
            return result;
        }
    }


    //=========================================================================

    /**
     * Compares the element type and the head value.
     */
    @Override
    protected boolean bodyEquals(Element other)
    {
        if (_type != other._type) return false;
        Object head = getHead();
        Object otherHead = other.getHead();
        return head == null ? otherHead == null : head.equals(otherHead);
    }

    @Override
    public String toString()
    {
        StringBuilder buf = new StringBuilder("<");
        buf.append(_type.getName());
        String head = getHeadText();
        if (head != null)
        {
            buf.append(' ').append(head);
        }
        String tail = getTailText();
        if (tail != null)
        {
            buf.append(" ... ").append(tail);
        }
        int size = size();
        if (size != 0)
        {
            buf.append(" (").append(size).append(size == 1 ? " child)" : " children)");
        }
        if (_origin != null)
        {
            int pos = getPos();
            if (pos >= 0)
            {
                buf.append(" [").append(pos).append(':').append(getEnd()).append(']');
            }
        }
        return buf.append('>').toString();
    }
}
