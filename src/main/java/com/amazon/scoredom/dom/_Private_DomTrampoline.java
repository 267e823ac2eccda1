// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.token.Token;
import java.util.List;

/**
 * <b>NOT FOR APPLICATION USE!</b>
 * <p>
 * Gives the transform access to the parts of elements that applications
 * must not change.
 */
public final class _Private_DomTrampoline
{
    private _Private_DomTrampoline() { }

    public static Origin newOrigin(List<? extends Token> headTokens,
                                   List<? extends Token> tailTokens,
                                   OffsetRange range)
    {
        return new Origin(headTokens, tailTokens, range);
    }

    /**
     * Reads the head value of a TEXT element type from its head tokens.
     */
    public static Object readHead(ElementType type, List<? extends Token> headTokens)
    {
        return type.readHead(headTokens);
    }

    /**
     * Gives a freshly built element its origin and marks it unmodified.
     */
    public static void bindOrigin(Element element, Origin origin)
    {
        element.setOrigin(origin);
        element.clearModified();
    }

    /**
     * Replaces the source range of the element's origin.
     */
    public static void setOriginRange(Element element, OffsetRange range)
    {
        Origin origin = element.getOrigin();
        if (origin != null)
        {
            element.setOrigin(origin.withRange(range));
        }
    }
}
