// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

/**
 * A visitor over the element variants.
 *
 * @see Element#accept(ElementVisitor)
 * @see AbstractElementVisitor
 */
public interface ElementVisitor
{
    public void visit(ContainerElement element);

    public void visit(HeadElement element);

    public void visit(BlockElement element);

    public void visit(TextElement element);
}
