// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.ElementKind;
import java.util.function.Predicate;

/**
 * Predicates for finding elements.
 *
 * @see Node#findDescendants(Predicate)
 */
public final class Elements
{
    private Elements() { }

    public static Predicate<Element> ofType(final ElementType type)
    {
        return new Predicate<Element>()
        {
            public boolean test(Element e)
            {
                return e.getType() == type;
            }
        };
    }

    public static Predicate<Element> ofKind(final ElementKind kind)
    {
        return new Predicate<Element>()
        {
            public boolean test(Element e)
            {
                return e.getKind() == kind;
            }
        };
    }

    /**
     * Matches elements whose head value equals the given value.
     */
    public static Predicate<Element> withHead(final Object head)
    {
        return new Predicate<Element>()
        {
            public boolean test(Element e)
            {
                return head.equals(e.getHead());
            }
        };
    }

    /**
     * Matches elements that were not read from the source, or that changed
     * since.
     */
    public static Predicate<Element> changed()
    {
        return new Predicate<Element>()
        {
            public boolean test(Element e)
            {
                return !e.hasOrigin() || e.isModified();
            }
        };
    }
}
