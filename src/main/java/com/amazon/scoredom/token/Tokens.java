// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for working with token trees.
 */
public final class Tokens
{
    private Tokens() { }

    /**
     * Returns all tokens below the context, in source order.
     */
    public static List<Token> flatten(TokenContext context)
    {
        List<Token> tokens = new ArrayList<Token>();
        collect(context, tokens);
        return tokens;
    }

    private static void collect(TokenContext context, List<Token> tokens)
    {
        for (TokenNode child : context.getChildren())
        {
            if (child instanceof Token)
            {
                tokens.add((Token) child);
            }
            else if (child instanceof TokenContext)
            {
                collect((TokenContext) child, tokens);
            }
        }
    }

    /**
     * Returns the first token below the context.
     *
     * @return null if the context holds no tokens at all.
     */
    public static Token firstToken(TokenContext context)
    {
        for (TokenNode child : context.getChildren())
        {
            if (child instanceof Token) return (Token) child;
            if (child instanceof TokenContext)
            {
                Token t = firstToken((TokenContext) child);
                if (t != null) return t;
            }
        }
        return null;
    }

    /**
     * Returns the last token below the context.
     *
     * @return null if the context holds no tokens at all.
     */
    public static Token lastToken(TokenContext context)
    {
        List<? extends TokenNode> children = context.getChildren();
        for (int i = children.size() - 1; i >= 0; i--)
        {
            TokenNode child = children.get(i);
            if (child instanceof Token) return (Token) child;
            if (child instanceof TokenContext)
            {
                Token t = lastToken((TokenContext) child);
                if (t != null) return t;
            }
        }
        return null;
    }

    /**
     * Concatenates the text of the tokens.
     */
    public static String text(List<? extends Token> tokens)
    {
        if (tokens.size() == 1) return tokens.get(0).getText();
        StringBuilder buf = new StringBuilder();
        for (Token t : tokens)
        {
            buf.append(t.getText());
        }
        return buf.toString();
    }

    /**
     * Determines whether the token's text still appears at its offsets in
     * the given source text.
     */
    public static boolean matches(Token token, String text)
    {
        int start = token.getStart();
        int end = token.getEnd();
        if (start < 0 || end < start || end > text.length()) return false;
        String tokenText = token.getText();
        return tokenText.length() == end - start
            && text.regionMatches(start, tokenText, 0, tokenText.length());
    }
}
