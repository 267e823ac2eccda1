// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.token.Token;
import java.util.Collections;

/**
 * An element with a mutable head value, written before its children by the
 * element type's {@link HeadFormat}.
 * <p>
 * Changing the head of an element that was read from the source marks the
 * head as modified, so that {@link Element#edits} replaces exactly the head
 * tokens.
 */
public final class TextElement
    extends Element
{
    private Object _head;

    TextElement(ElementType type, Object head)
    {
        super(type);
        _head = head;
    }

    @Override
    public void accept(ElementVisitor visitor)
    {
        visitor.visit(this);
    }

    @Override
    public Object getHead()
    {
        return _head;
    }

    /**
     * Changes the head value.  Setting an equal value changes nothing.
     *
     * @throws com.amazon.scoredom.TypeMismatchException if the value is not
     * accepted by the element type's head format.
     */
    @Override
    public void setHead(Object head)
    {
        Object value = getType().checkHead(head);
        if (!value.equals(_head))
        {
            _head = value;
            markModified(HEAD_MODIFIED);
        }
    }

    @Override
    public String getHeadText()
    {
        return getType().getHeadFormat().writeValue(_head);
    }

    @Override
    Point headPoint()
    {
        Origin origin = getOrigin();
        Spacing s = getSpacing();
        return newPoint(origin == null ? Collections.<Token>emptyList() : origin.getHeadTokens(),
                        getHeadText(),
                        isHeadModified(),
                        s.spaceBefore(),
                        size() != 0 ? s.spaceAfterHead() : s.spaceAfter());
    }

    @Override
    Element newInstance()
    {
        Element copy = new TextElement(getType(), _head);
        copySpacingTo(copy);
        return copy;
    }
}
