// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.system;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.scoredom.testing.Lily;
import com.amazon.scoredom.transform.Transformer;
import org.junit.jupiter.api.Test;

public class TransformerBuilderTest
{
    @Test
    public void standardIsImmutable()
    {
        TransformerBuilder b = TransformerBuilder.standard();
        assertThat(b.immutable(), sameInstance(b));
        assertThrows(UnsupportedOperationException.class,
                     () -> b.setTransformTable(Lily.table()));
        assertThrows(UnsupportedOperationException.class, () -> b.setCacheSize(1));
        assertThat(b.getTransformTable(), nullValue());
    }

    @Test
    public void withCreatesMutableCopy()
    {
        TransformerBuilder std = TransformerBuilder.standard();
        TransformerBuilder b = std.withCacheSize(7);
        assertThat(b, not(sameInstance(std)));
        assertThat(b.mutable(), sameInstance(b));
        assertThat(b.withFullRebuildFallback(false), sameInstance(b));
        assertThat(std.getCacheSize(), is(TransformerBuilder.DEFAULT_CACHE_SIZE));

        TransformerBuilder frozen = b.immutable();
        assertThat(frozen.getCacheSize(), is(7));
        assertFalse(frozen.isFullRebuildFallback());
        assertThrows(UnsupportedOperationException.class, () -> frozen.setCacheSize(2));
    }

    @Test
    public void copyIsIndependent()
    {
        TransformerBuilder b = TransformerBuilder.standard().copy();
        TransformerBuilder c = b.copy();
        c.setIncrementalReuse(false);
        assertTrue(b.isIncrementalReuse());
        assertFalse(c.isIncrementalReuse());
    }

    @Test
    public void buildPassesConfiguration()
    {
        Transformer t = TransformerBuilder.standard()
                                          .withTransformTable(Lily.table())
                                          .withCacheSize(0)
                                          .withIncrementalReuse(false)
                                          .withFullRebuildFallback(false)
                                          .build();
        assertThat(t.getTransformTable(), sameInstance(Lily.table()));
        assertThat(t.getCacheSize(), is(0));
        assertFalse(t.isIncrementalReuse());
        assertFalse(t.isFullRebuildFallback());
    }

    @Test
    public void buildNeedsTable()
    {
        assertThrows(IllegalStateException.class,
                     () -> TransformerBuilder.standard().build());
    }

    @Test
    public void negativeCacheSizeRejected()
    {
        assertThrows(IllegalArgumentException.class,
                     () -> TransformerBuilder.standard().withCacheSize(-1));
    }
}
