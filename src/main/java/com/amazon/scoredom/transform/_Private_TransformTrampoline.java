// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

/**
 * <b>NOT FOR APPLICATION USE!</b>
 * <p>
 * Lets the builders in {@code com.amazon.scoredom.system} create
 * {@link Transformer}s.
 */
public final class _Private_TransformTrampoline
{
    private _Private_TransformTrampoline() { }

    public static Transformer newTransformer(TransformTable table,
                                             int cacheSize,
                                             boolean incrementalReuse,
                                             boolean fullRebuildFallback)
    {
        return new Transformer(table, cacheSize, incrementalReuse,
                               fullRebuildFallback);
    }
}
