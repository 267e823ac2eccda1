// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.system;

import static com.amazon.scoredom.transform._Private_TransformTrampoline.newTransformer;

import com.amazon.scoredom.transform.TransformTable;
import com.amazon.scoredom.transform.Transformer;

/**
 * The bootstrap builder for creating a {@link Transformer}.
 * Most applications will only have one or two transform tables, and will
 * create one transformer per document.
 * <p>
 * Each builder is either mutable or immutable.  The {@link #standard()}
 * builder is immutable; {@link #copy()} or {@link #mutable()} give a mutable
 * one.  The {@code withX} methods return a new mutable builder (or this
 * builder, if it is mutable) with the property changed; the {@code setX}
 * methods throw {@link UnsupportedOperationException} on an immutable
 * builder.
 * <p>
 * Typical use:
 * <pre>
 *    Transformer t = TransformerBuilder.standard()
 *                                      .withTransformTable(table)
 *                                      .build();
 * </pre>
 * <p>
 * Configuration properties follow the standard JavaBeans idiom in order to
 * be friendly to dependency injection systems.
 *
 * <h2>Properties</h2>
 * <ul>
 *   <li>{@code transformTable}: required.</li>
 *   <li>{@code cacheSize}: the number of transformations kept by version;
 *       0 disables the cache.  Default {@value #DEFAULT_CACHE_SIZE}.</li>
 *   <li>{@code incrementalReuse}: whether updates reuse elements of the
 *       previous tree.  Default true, unless the system property
 *       {@value #DISABLE_INCREMENTAL_PROPERTY} is true.</li>
 *   <li>{@code fullRebuildFallback}: whether a failed incremental update
 *       falls back to a full build.  Default true.</li>
 * </ul>
 */
public class TransformerBuilder
{
    /**
     * Set this system property to {@code true} to make every update a full
     * build, for example to rule out the incremental update when tracking
     * down a problem.
     */
    public static final String DISABLE_INCREMENTAL_PROPERTY =
        "com.amazon.scoredom.system.TransformerBuilder.disableIncremental";

    public static final int DEFAULT_CACHE_SIZE = 4;

    private static final TransformerBuilder STANDARD = new TransformerBuilder();

    /**
     * The standard, immutable builder instance.
     */
    public static TransformerBuilder standard()
    {
        return STANDARD;
    }


    //=========================================================================

    TransformTable myTransformTable;
    int            myCacheSize = DEFAULT_CACHE_SIZE;
    boolean        myIncrementalReuse = true;
    boolean        myFullRebuildFallback = true;


    private TransformerBuilder()
    {
        try
        {
            myIncrementalReuse = !Boolean.getBoolean(DISABLE_INCREMENTAL_PROPERTY);
        }
        catch (final SecurityException e)
        {
            // NO-OP in the case where system properties are not accessible.
        }
    }

    private TransformerBuilder(TransformerBuilder that)
    {
        this.myTransformTable      = that.myTransformTable;
        this.myCacheSize           = that.myCacheSize;
        this.myIncrementalReuse    = that.myIncrementalReuse;
        this.myFullRebuildFallback = that.myFullRebuildFallback;
    }


    //=========================================================================

    /**
     * Creates a mutable copy of this builder.
     */
    public final TransformerBuilder copy()
    {
        return new Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this instance, if immutable;
     * otherwise an immutable copy of this instance.
     */
    public TransformerBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public TransformerBuilder mutable()
    {
        return copy();
    }

    void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    //=========================================================================
    // Properties

    public final TransformTable getTransformTable()
    {
        return myTransformTable;
    }

    public final void setTransformTable(TransformTable table)
    {
        mutationCheck();
        myTransformTable = table;
    }

    public final TransformerBuilder withTransformTable(TransformTable table)
    {
        TransformerBuilder b = mutable();
        b.setTransformTable(table);
        return b;
    }


    public final int getCacheSize()
    {
        return myCacheSize;
    }

    /**
     * @throws IllegalArgumentException if the size is negative.
     */
    public final void setCacheSize(int size)
    {
        mutationCheck();
        if (size < 0)
        {
            throw new IllegalArgumentException("cache size must not be negative: " + size);
        }
        myCacheSize = size;
    }

    public final TransformerBuilder withCacheSize(int size)
    {
        TransformerBuilder b = mutable();
        b.setCacheSize(size);
        return b;
    }


    public final boolean isIncrementalReuse()
    {
        return myIncrementalReuse;
    }

    public final void setIncrementalReuse(boolean reuse)
    {
        mutationCheck();
        myIncrementalReuse = reuse;
    }

    public final TransformerBuilder withIncrementalReuse(boolean reuse)
    {
        TransformerBuilder b = mutable();
        b.setIncrementalReuse(reuse);
        return b;
    }


    public final boolean isFullRebuildFallback()
    {
        return myFullRebuildFallback;
    }

    public final void setFullRebuildFallback(boolean fallback)
    {
        mutationCheck();
        myFullRebuildFallback = fallback;
    }

    public final TransformerBuilder withFullRebuildFallback(boolean fallback)
    {
        TransformerBuilder b = mutable();
        b.setFullRebuildFallback(fallback);
        return b;
    }


    //=========================================================================

    /**
     * Builds a new transformer based on this builder's configuration
     * properties.
     *
     * @throws IllegalStateException if no transform table is set.
     */
    public final Transformer build()
    {
        if (myTransformTable == null)
        {
            throw new IllegalStateException("transformTable must be set");
        }
        return newTransformer(myTransformTable,
                              myCacheSize,
                              myIncrementalReuse,
                              myFullRebuildFallback);
    }


    //=========================================================================

    private static final class Mutable
        extends TransformerBuilder
    {
        private Mutable(TransformerBuilder that)
        {
            super(that);
        }

        @Override
        public TransformerBuilder immutable()
        {
            return new TransformerBuilder(this);
        }

        @Override
        public TransformerBuilder mutable()
        {
            return this;
        }

        @Override
        void mutationCheck()
        {
        }
    }
}
