// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * The whitespace strengths that can separate two pieces of output text.
 * <p>
 * The constants are declared in ascending strength, and that declaration
 * order is the total order used to combine requirements: when two adjacent
 * elements want different whitespace at the same junction, the stronger one
 * is written.
 */
public enum Whitespace
{
    NONE(""),
    SPACE(" "),
    NEWLINE("\n"),
    BLANK_LINE("\n\n");

    private final String myText;

    private Whitespace(String text)
    {
        myText = text;
    }

    /**
     * Returns the text written for this whitespace.
     */
    public String getText()
    {
        return myText;
    }

    /**
     * Returns the stronger of two whitespace requirements.  Either argument
     * may be null, meaning "no opinion".
     *
     * @return null only when both arguments are null.
     */
    public static Whitespace strongest(Whitespace a, Whitespace b)
    {
        if (a == null) return b;
        if (b == null) return a;
        return (a.compareTo(b) >= 0 ? a : b);
    }

    /**
     * Classifies existing whitespace text: two or more newlines are a
     * {@link #BLANK_LINE}, one newline a {@link #NEWLINE}, any other
     * non-empty text a {@link #SPACE}.
     */
    public static Whitespace classify(CharSequence text)
    {
        int newlines = 0;
        for (int i = 0; i < text.length(); i++)
        {
            if (text.charAt(i) == '\n') newlines++;
        }
        if (newlines >= 2) return BLANK_LINE;
        if (newlines == 1) return NEWLINE;
        return (text.length() > 0 ? SPACE : NONE);
    }
}
