// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.dom.Origin;
import com.amazon.scoredom.dom._Private_DomTrampoline;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.TokenContext;
import com.amazon.scoredom.token.Tokens;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves the origins of a reused element subtree over to the tokens of the
 * new token tree.
 * <p>
 * Every old origin token must have a counterpart in the new context: a token
 * of the same kind and text at the old offset shifted by the text delta.
 * Nothing is changed unless all tokens are found.
 */
final class OriginRebinder
{
    private final Map<Integer, Token> myTokens = new HashMap<Integer, Token>();
    private final int myDelta;
    private final Map<Element, Origin> myOrigins = new IdentityHashMap<Element, Origin>();

    OriginRebinder(TokenContext context, int delta)
    {
        for (Token t : Tokens.flatten(context))
        {
            myTokens.put(t.getStart(), t);
        }
        myDelta = delta;
    }

    /**
     * Finds the new origins of the element and its descendants.
     *
     * @return false if some token has no counterpart.
     */
    boolean prepare(Element element)
    {
        if (!prepareOne(element)) return false;
        for (Element e : element.descendants())
        {
            if (!prepareOne(e)) return false;
        }
        return true;
    }

    private boolean prepareOne(Element element)
    {
        Origin origin = element.getOrigin();
        if (origin == null) return false;
        List<Token> head = rebind(origin.getHeadTokens());
        List<Token> tail = rebind(origin.getTailTokens());
        if (head == null || tail == null) return false;
        OffsetRange range = origin.getRange().shift(myDelta);
        myOrigins.put(element, _Private_DomTrampoline.newOrigin(head, tail, range));
        return true;
    }

    private List<Token> rebind(List<Token> tokens)
    {
        List<Token> result = new ArrayList<Token>(tokens.size());
        for (Token old : tokens)
        {
            Token t = myTokens.get(old.getStart() + myDelta);
            if (t == null
                || t.getEnd() != old.getEnd() + myDelta
                || !t.getKind().equals(old.getKind())
                || !t.getText().equals(old.getText()))
            {
                return null;
            }
            result.add(t);
        }
        return result;
    }

    /**
     * Applies the origins found by {@link #prepare(Element)}.
     */
    void apply()
    {
        for (Map.Entry<Element, Origin> entry : myOrigins.entrySet())
        {
            _Private_DomTrampoline.bindOrigin(entry.getKey(), entry.getValue());
        }
    }
}
