// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

/**
 * A lexical token.  Elements keep references to the tokens they were built
 * from (their <em>origin</em>); this library only relies on a token's
 * offsets, text, kind and identity.
 * <p>
 * Token references are valid for one transform or edit pass only: after the
 * source text changes and is tokenized again they must be replaced.
 */
public interface Token
    extends TokenNode
{
    /**
     * Returns the lexical kind of this token, as named by the tokenizer.
     */
    public String getKind();

    /**
     * Returns the source text this token covers; its length equals
     * {@code getEnd() - getStart()}.
     */
    public String getText();
}
