// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.ElementKind;
import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.ScoreDomException;
import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.dom.ElementType;
import com.amazon.scoredom.dom._Private_DomTrampoline;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.TokenContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The input of a {@link Transform}: a token context and its items, being
 * the tokens of the context and the elements built from its child contexts,
 * in source order.
 */
public final class TransformItems
{
    private final TokenContext myContext;
    private final List<Object> myItems;

    TransformItems(TokenContext context, List<Object> items)
    {
        myContext = context;
        myItems = Collections.unmodifiableList(items);
    }

    public TokenContext getContext()
    {
        return myContext;
    }

    /**
     * Returns the items: {@link Token}s and {@link Element}s.
     */
    public List<Object> getItems()
    {
        return myItems;
    }

    public int size()
    {
        return myItems.size();
    }

    public Object get(int index)
    {
        return myItems.get(index);
    }

    public boolean isToken(int index)
    {
        return myItems.get(index) instanceof Token;
    }

    public boolean isElement(int index)
    {
        return myItems.get(index) instanceof Element;
    }

    /**
     * Returns the tokens among the items.
     */
    public List<Token> tokens()
    {
        List<Token> tokens = new ArrayList<Token>();
        for (Object item : myItems)
        {
            if (item instanceof Token) tokens.add((Token) item);
        }
        return tokens;
    }

    /**
     * Returns the elements among the items.
     */
    public List<Element> elements()
    {
        List<Element> elements = new ArrayList<Element>();
        for (Object item : myItems)
        {
            if (item instanceof Element) elements.add((Element) item);
        }
        return elements;
    }


    /**
     * Creates an element with origin.  The head value of a TEXT element is
     * read from the head tokens.
     *
     * @param headTokens the tokens the head was read from; required for HEAD,
     * BLOCK and TEXT elements.
     * @param tailTokens the tokens the tail was read from; may be empty when
     * the tail is missing from the source.
     * @param children the child elements, which must not have a parent.
     *
     * @throws ScoreDomException if head tokens are missing or can't be read.
     */
    public Element create(ElementType type,
                          List<? extends Token> headTokens,
                          List<? extends Token> tailTokens,
                          List<? extends Element> children)
    {
        if (headTokens == null) headTokens = Collections.<Token>emptyList();
        if (tailTokens == null) tailTokens = Collections.<Token>emptyList();
        if (type.getKind().hasHead() && headTokens.isEmpty())
        {
            throw new ScoreDomException(type + " element needs head tokens in "
                                        + myContext.getKind());
        }

        Element element;
        if (type.getKind() == ElementKind.TEXT)
        {
            element = type.newElement(_Private_DomTrampoline.readHead(type, headTokens));
        }
        else
        {
            element = type.newElement();
        }
        if (children != null && !children.isEmpty())
        {
            element.addAll(children);
        }

        OffsetRange range = span(headTokens, tailTokens, children);
        _Private_DomTrampoline.bindOrigin(
            element, _Private_DomTrampoline.newOrigin(headTokens, tailTokens, range));
        return element;
    }

    /**
     * Creates an element with origin, without tail tokens.
     */
    public Element create(ElementType type,
                          List<? extends Token> headTokens,
                          List<? extends Element> children)
    {
        return create(type, headTokens, null, children);
    }

    /**
     * Creates an element read from a single head token.
     */
    public Element create(ElementType type, Token head, Element... children)
    {
        return create(type, Collections.singletonList(head), null,
                      Arrays.asList(children));
    }

    private OffsetRange span(List<? extends Token> headTokens,
                             List<? extends Token> tailTokens,
                             List<? extends Element> children)
    {
        int start = Integer.MAX_VALUE;
        int end = -1;
        if (!headTokens.isEmpty())
        {
            start = headTokens.get(0).getStart();
            end = headTokens.get(headTokens.size() - 1).getEnd();
        }
        if (!tailTokens.isEmpty())
        {
            start = Math.min(start, tailTokens.get(0).getStart());
            end = Math.max(end, tailTokens.get(tailTokens.size() - 1).getEnd());
        }
        if (children != null)
        {
            for (Element child : children)
            {
                OffsetRange r = child.getOriginRange();
                if (r != null)
                {
                    start = Math.min(start, r.getStart());
                    end = Math.max(end, r.getEnd());
                }
            }
        }
        if (end < 0)
        {
            return new OffsetRange(myContext.getStart(), myContext.getEnd());
        }
        return new OffsetRange(start, end);
    }
}
