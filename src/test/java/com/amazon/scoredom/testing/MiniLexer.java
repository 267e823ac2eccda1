// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.testing;

import com.amazon.scoredom.token.TokenNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tokenizes a small subset of LilyPond music into a token tree.
 * <p>
 * Contexts: {@code document} (the root, spanning the whole text),
 * {@code musiclist} ({@code { ... }}), {@code simultaneous}
 * ({@code << ... >>}), {@code note} (a pitch like {@code cis} with an
 * optional duration like {@code 4.}), {@code rest} ({@code r} with an
 * optional duration), {@code comment} ({@code %} to the end of the line) and
 * {@code command} ({@code \word}).  Anything else becomes an
 * {@code error} token.
 */
public final class MiniLexer
{
    public static final String DOCUMENT     = "document";
    public static final String MUSIC_LIST   = "musiclist";
    public static final String SIMULTANEOUS = "simultaneous";
    public static final String NOTE         = "note";
    public static final String REST         = "rest";
    public static final String COMMENT      = "comment";
    public static final String COMMAND      = "command";

    public static final String DELIMITER = "delimiter";
    public static final String PITCH     = "pitch";
    public static final String DURATION  = "duration";
    public static final String ERROR     = "error";

    private static final String[] NAMED_DURATIONS = { "\\breve", "\\longa", "\\maxima" };

    private final String myText;
    private int myPos;

    private MiniLexer(String text)
    {
        myText = text;
    }

    public static SimpleTokenTree tokenize(String text)
    {
        return tokenize(text, null);
    }

    public static SimpleTokenTree tokenize(String text, Object version)
    {
        MiniLexer lexer = new MiniLexer(text);
        List<TokenNode> children = lexer.items(null);
        SimpleContext root = new SimpleContext(DOCUMENT, children, 0, text.length());
        return new SimpleTokenTree(root, text, version);
    }

    private List<TokenNode> items(String close)
    {
        List<TokenNode> out = new ArrayList<TokenNode>();
        while (myPos < myText.length())
        {
            char c = myText.charAt(myPos);
            if (Character.isWhitespace(c))
            {
                myPos++;
            }
            else if (close != null && myText.startsWith(close, myPos))
            {
                break;
            }
            else if (c == '{')
            {
                out.add(block(MUSIC_LIST, "{", "}"));
            }
            else if (myText.startsWith("<<", myPos))
            {
                out.add(block(SIMULTANEOUS, "<<", ">>"));
            }
            else if (c == '%')
            {
                int end = myText.indexOf('\n', myPos);
                if (end < 0) end = myText.length();
                out.add(single(COMMENT, token(COMMENT, end)));
            }
            else if (c == '\\' && isLetter(myPos + 1))
            {
                int end = myPos + 1;
                while (isLetter(end)) end++;
                out.add(single(COMMAND, token(COMMAND, end)));
            }
            else if (c >= 'a' && c <= 'g')
            {
                int end = myPos + 1;
                while (myText.startsWith("is", end) || myText.startsWith("es", end))
                {
                    end += 2;
                }
                out.add(withDuration(NOTE, token(PITCH, end)));
            }
            else if (c == 'r')
            {
                out.add(withDuration(REST, token(REST, myPos + 1)));
            }
            else
            {
                out.add(token(ERROR, myPos + 1));
            }
        }
        return out;
    }

    private SimpleContext block(String kind, String open, String close)
    {
        List<TokenNode> children = new ArrayList<TokenNode>();
        children.add(token(DELIMITER, myPos + open.length()));
        children.addAll(items(close));
        if (myText.startsWith(close, myPos))
        {
            children.add(token(DELIMITER, myPos + close.length()));
        }
        return new SimpleContext(kind, children);
    }

    private SimpleContext withDuration(String kind, SimpleToken first)
    {
        List<TokenNode> children = new ArrayList<TokenNode>();
        children.add(first);
        int end = myPos;
        while (end < myText.length() && Character.isDigit(myText.charAt(end))) end++;
        if (end == myPos)
        {
            for (String name : NAMED_DURATIONS)
            {
                if (myText.startsWith(name, myPos))
                {
                    end = myPos + name.length();
                    break;
                }
            }
        }
        if (end > myPos)
        {
            while (end < myText.length() && myText.charAt(end) == '.') end++;
            children.add(token(DURATION, end));
        }
        return new SimpleContext(kind, children);
    }

    private static SimpleContext single(String kind, SimpleToken token)
    {
        return new SimpleContext(kind, Collections.singletonList(token));
    }

    private SimpleToken token(String kind, int end)
    {
        SimpleToken t = new SimpleToken(kind, myPos, myText.substring(myPos, end));
        myPos = end;
        return t;
    }

    private boolean isLetter(int index)
    {
        return index < myText.length() && Character.isLetter(myText.charAt(index));
    }
}
