// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

/**
 * An element that writes no text of its own, only its children.
 */
public final class ContainerElement
    extends Element
{
    ContainerElement(ElementType type)
    {
        super(type);
    }

    @Override
    public void accept(ElementVisitor visitor)
    {
        visitor.visit(this);
    }

    @Override
    Point headPoint()
    {
        return null;
    }

    @Override
    Element newInstance()
    {
        Element copy = new ContainerElement(getType());
        copySpacingTo(copy);
        return copy;
    }
}
