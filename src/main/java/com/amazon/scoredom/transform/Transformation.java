// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.dom.Element;
import java.util.Map;

/**
 * The result of transforming a token tree: the root element and what is
 * needed to update it incrementally after the text changes.
 * <p>
 * A transformation can be the base of one incremental update only.  The
 * update moves unchanged elements into the new tree, after which this
 * transformation is <em>consumed</em> and its tree must no longer be used.
 */
public final class Transformation
{
    private final Element                  myRoot;
    private final Object                   myVersion;
    private final String                   myText;
    private final TransformTable           myTable;
    private final Map<ContextKey, Element> myIndex;
    private final boolean                  myIncremental;
    private final int                      myReusedCount;
    private boolean                        myConsumed;

    Transformation(Element root,
                   Object version,
                   String text,
                   TransformTable table,
                   Map<ContextKey, Element> index,
                   boolean incremental,
                   int reusedCount)
    {
        myRoot = root;
        myVersion = version;
        myText = text;
        myTable = table;
        myIndex = index;
        myIncremental = incremental;
        myReusedCount = reusedCount;
    }

    public Element getRoot()
    {
        return myRoot;
    }

    /**
     * Returns the version marker of the token tree this was built from.
     *
     * @return may be null.
     */
    public Object getVersion()
    {
        return myVersion;
    }

    /**
     * Determines whether this transformation was built by an incremental
     * update rather than a full build.
     */
    public boolean isIncremental()
    {
        return myIncremental;
    }

    /**
     * Returns the number of elements taken over from the previous tree by
     * the incremental update.  Their descendants are not counted.
     */
    public int getReusedCount()
    {
        return myReusedCount;
    }

    /**
     * Determines whether an incremental update has taken elements from this
     * transformation.
     */
    public boolean isConsumed()
    {
        return myConsumed;
    }

    String getText()
    {
        return myText;
    }

    TransformTable getTable()
    {
        return myTable;
    }

    Map<ContextKey, Element> getIndex()
    {
        return myIndex;
    }

    void consume()
    {
        myConsumed = true;
    }

    @Override
    public String toString()
    {
        return "Transformation(" + myVersion
            + (myIncremental ? ", incremental, reused " + myReusedCount : "")
            + (myConsumed ? ", consumed" : "") + ")";
    }
}
