// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.token;

/**
 * A tokenized source text, owned by an external tokenizer.  It is treated as
 * read-only for the duration of a transform or edit pass and may be
 * invalidated by the next edit to the text.
 */
public interface TokenTree
{
    /**
     * Returns the root context covering the tokenized text.
     */
    public TokenContext getRoot();

    /**
     * Returns the full source text the tokens refer to.
     */
    public String getText();

    /**
     * Returns a marker identifying the content this tree was built from,
     * such as a revision number or a content hash.  Trees with equal version
     * markers are assumed to have equal content.
     *
     * @return null if the tree has no version, in which case transforms of
     * it are not cached.
     */
    public Object getVersion();
}
