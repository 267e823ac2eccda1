// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.token.Token;
import java.util.Collections;

/**
 * An element with a fixed head text, written before its children.
 */
public final class HeadElement
    extends Element
{
    HeadElement(ElementType type)
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

    @Override
    Element newInstance()
    {
        Element copy = new HeadElement(getType());
        copySpacingTo(copy);
        return copy;
    }
}
