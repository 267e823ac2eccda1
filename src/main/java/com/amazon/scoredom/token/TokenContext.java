// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

import java.util.List;

/**
 * A nested context of a token tree: an ordered, non-empty sequence of tokens
 * and sub-contexts produced by one lexicon of the tokenizer.
 */
public interface TokenContext
    extends TokenNode
{
    /**
     * Returns the kind of this context (for example the lexicon name).  The
     * transform table dispatches on this value.
     */
    public String getKind();

    /**
     * Returns the children in source order; not null.
     */
    public List<? extends TokenNode> getChildren();
}
