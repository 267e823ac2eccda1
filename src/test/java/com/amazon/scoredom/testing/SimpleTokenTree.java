// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.testing;

import com.amazon.scoredom.token.TokenContext;
import com.amazon.scoredom.token.TokenTree;

/**
 * A plain token tree for tests.
 */
public final class SimpleTokenTree
    implements TokenTree
{
    private final TokenContext myRoot;
    private final String       myText;
    private final Object       myVersion;

    public SimpleTokenTree(TokenContext root, String text, Object version)
    {
        myRoot = root;
        myText = text;
        myVersion = version;
    }

    public TokenContext getRoot()
    {
        return myRoot;
    }

    public String getText()
    {
        return myText;
    }

    public Object getVersion()
    {
        return myVersion;
    }
}
