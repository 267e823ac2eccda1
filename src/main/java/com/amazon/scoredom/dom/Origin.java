// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.token.Token;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records where an element was read from: the tokens its head and tail were
 * read from, and the source range of the token context it was built from.
 * <p>
 * Origins are created by the transform and are replaced on the next
 * transform pass.  Token references are only valid as long as the token
 * tree they belong to describes the current text.
 */
public final class Origin
{
    private final List<Token> myHeadTokens;
    private final List<Token> myTailTokens;
    private final OffsetRange myRange;

    Origin(List<? extends Token> headTokens,
           List<? extends Token> tailTokens,
           OffsetRange range)
    {
        if (range == null) throw new NullPointerException("range");
        myHeadTokens = freeze(headTokens);
        myTailTokens = freeze(tailTokens);
        myRange = range;
    }

    private static List<Token> freeze(List<? extends Token> tokens)
    {
        if (tokens == null || tokens.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<Token>(tokens));
    }

    /**
     * Returns the tokens the head was read from; empty for containers.
     */
    public List<Token> getHeadTokens()
    {
        return myHeadTokens;
    }

    /**
     * Returns the tokens the tail was read from; empty if the element has no
     * tail, or if the tail was missing in the source.
     */
    public List<Token> getTailTokens()
    {
        return myTailTokens;
    }

    /**
     * Returns the source range of the context the element was built from.
     * Unlike {@link Element#getPos()} this range does not follow changes of
     * the element's children.
     */
    public OffsetRange getRange()
    {
        return myRange;
    }

    Origin withRange(OffsetRange range)
    {
        return new Origin(myHeadTokens, myTailTokens, range);
    }

    static int startOf(List<Token> tokens)
    {
        return tokens.isEmpty() ? -1 : tokens.get(0).getStart();
    }

    static int endOf(List<Token> tokens)
    {
        return tokens.isEmpty() ? -1 : tokens.get(tokens.size() - 1).getEnd();
    }

    @Override
    public String toString()
    {
        return "Origin" + myRange;
    }
}
