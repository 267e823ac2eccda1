// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

/**
 * A base class for element visitors, where each visit method delegates to
 * {@link #defaultVisit(Element)}.
 */
public abstract class AbstractElementVisitor
    implements ElementVisitor
{
    /**
     * Called by the visit methods that are not overridden.  This
     * implementation does nothing.
     */
    protected void defaultVisit(Element element)
    {
    }

    public void visit(ContainerElement element)
    {
        defaultVisit(element);
    }

    public void visit(HeadElement element)
    {
        defaultVisit(element);
    }

    public void visit(BlockElement element)
    {
        defaultVisit(element);
    }

    public void visit(TextElement element)
    {
        defaultVisit(element);
    }
}
