// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.token.Token;
import java.util.Collections;

/**
 * An element with a fixed head and tail text around its children, such as
 * a braced or bracketed group.
 */
public final class BlockElement
    extends Element
{
    BlockElement(ElementType type)
    {
        super(type);
    }

    @Override
    public void accept(ElementVisitor visitor)
    {
        visitor.visit(this);
    }

    @Override
    public Object getHead()
    {
        return getType().getHead();
    }

    @Override
    public String getHeadText()
    {
        return getType().getHead();
    }

    @Override
    public String getTailText()
    {
        return getType().getTail();
    }

    @Override
    Point headPoint()
    {
        Origin origin = getOrigin();
        Spacing s = getSpacing();
        return newPoint(origin == null ? Collections.<Token>emptyList() : origin.getHeadTokens(),
                        getHeadText(),
                        false,
                        s.spaceBefore(),
                        size() != 0 ? s.spaceAfterHead() : s.spaceAfter());
    }

    // A tail that was missing in the source has no tokens, and is written
    // as new text.
    @Override
    Point tailPoint()
    {
        Origin origin = getOrigin();
        Spacing s = getSpacing();
        return newPoint(origin == null ? Collections.<Token>emptyList() : origin.getTailTokens(),
                        getTailText(),
                        false,
                        s.spaceBeforeTail(),
                        s.spaceAfter());
    }

    @Override
    Element newInstance()
    {
        Element copy = new BlockElement(getType());
        copySpacingTo(copy);
        return copy;
    }
}
