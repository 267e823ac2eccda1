// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.testing;

import com.amazon.scoredom.token.Token;

/**
 * A plain token for tests.
 */
public final class SimpleToken
    implements Token
{
    private final String myKind;
    private final int    myStart;
    private final String myText;

    public SimpleToken(String kind, int start, String text)
    {
        myKind = kind;
        myStart = start;
        myText = text;
    }

    public String getKind()
    {
        return myKind;
    }

    public int getStart()
    {
        return myStart;
    }

    public int getEnd()
    {
        return myStart + myText.length();
    }

    public String getText()
    {
        return myText;
    }

    @Override
    public String toString()
    {
        return myKind + "(" + myStart + ", \"" + myText + "\")";
    }
}
