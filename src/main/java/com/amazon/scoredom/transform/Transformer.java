// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.IncrementalRebuildException;
import com.amazon.scoredom.OffsetRange;
import com.amazon.scoredom.ScoreDomException;
import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.dom._Private_DomTrampoline;
import com.amazon.scoredom.token.ChangeRegion;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.TokenContext;
import com.amazon.scoredom.token.TokenNode;
import com.amazon.scoredom.token.TokenTree;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds element trees from token trees, bottom-up, using the
 * {@link Transform}s of a {@link TransformTable}.
 * <p>
 * Results are cached by the {@linkplain TokenTree#getVersion() version} of
 * the token tree: transforming a tree with a cached version returns the very
 * same {@link Transformation}, including any changes made to its elements
 * since.
 * <p>
 * After a change of the text, {@link #transform(TokenTree, Transformation,
 * ChangeRegion)} builds the new tree incrementally: the elements of contexts
 * that lie wholly outside the changed region, and that were not modified,
 * are moved over from the previous tree instead of being built again.  The
 * result has the same content as a full build.
 * <p>
 * Instances are created by
 * {@link com.amazon.scoredom.system.TransformerBuilder}.  They are not
 * thread-safe.
 */
public final class Transformer
{
    private final TransformTable myTable;
    private final int            myCacheSize;
    private final boolean        myIncrementalReuse;
    private final boolean        myFullRebuildFallback;
    private final Map<Object, Transformation> myCache;

    Transformer(TransformTable table,
                int cacheSize,
                boolean incrementalReuse,
                boolean fullRebuildFallback)
    {
        if (table == null) throw new NullPointerException("table");
        myTable = table;
        myCacheSize = cacheSize;
        myIncrementalReuse = incrementalReuse;
        myFullRebuildFallback = fullRebuildFallback;
        myCache = new LinkedHashMap<Object, Transformation>(16, 0.75f, true)
        {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Object, Transformation> eldest)
            {
                return size() > myCacheSize;
            }
        };
    }

    public TransformTable getTransformTable()
    {
        return myTable;
    }

    public int getCacheSize()
    {
        return myCacheSize;
    }

    public boolean isIncrementalReuse()
    {
        return myIncrementalReuse;
    }

    public boolean isFullRebuildFallback()
    {
        return myFullRebuildFallback;
    }


    /**
     * Returns the transformation of the tree, from the cache if a tree with
     * the same version was transformed before.
     *
     * @throws ScoreDomException if the root context is dropped by the
     * transform table.
     */
    public Transformation transform(TokenTree tree)
    {
        Transformation cached = lookup(tree);
        if (cached != null) return cached;
        return remember(build(tree));
    }

    /**
     * Transforms the tree, reusing elements of {@code previous} where the
     * text did not change.  Falls back to a full build when the change can't
     * be localized, unless full rebuild fallback is disabled.
     *
     * @param previous the transformation of the text before the change.
     * @param change the changed region between the previous text and the
     * text of {@code tree}.
     *
     * @throws IncrementalRebuildException if the update failed and full
     * rebuild fallback is disabled.
     */
    public Transformation transform(TokenTree tree,
                                    Transformation previous,
                                    ChangeRegion change)
    {
        Transformation cached = lookup(tree);
        if (cached != null) return cached;
        if (!myIncrementalReuse || previous == null || change == null)
        {
            return remember(build(tree));
        }
        try
        {
            return remember(update(previous, tree, change));
        }
        catch (IncrementalRebuildException e)
        {
            if (!myFullRebuildFallback) throw e;
            return remember(build(tree));
        }
    }

    /**
     * Builds a new tree from scratch, bypassing the cache.
     */
    public Transformation build(TokenTree tree)
    {
        Build build = new Build(tree, null, null);
        return build.run();
    }

    /**
     * Builds a new tree, reusing unchanged elements of {@code previous}.
     * This bypasses the cache, but removes the previous transformation from
     * it, since its tree is consumed.
     *
     * @throws IncrementalRebuildException if {@code previous} was already
     * consumed or built by another transform table, or if the change region
     * does not describe the difference between the two texts.
     */
    public Transformation update(Transformation previous,
                                 TokenTree tree,
                                 ChangeRegion change)
    {
        if (previous.isConsumed())
        {
            throw new IncrementalRebuildException(
                "previous transformation was already used for an update");
        }
        if (previous.getTable() != myTable)
        {
            throw new IncrementalRebuildException(
                "previous transformation was built with another transform table");
        }
        checkChange(previous.getText(), tree.getText(), change);

        Build build = new Build(tree, previous, change);
        Transformation result = build.run();

        previous.consume();
        if (previous.getVersion() != null)
        {
            myCache.remove(previous.getVersion());
        }
        return result;
    }

    /**
     * Removes all transformations from the cache.
     */
    public void clearCache()
    {
        myCache.clear();
    }


    private Transformation lookup(TokenTree tree)
    {
        Object version = tree.getVersion();
        if (version == null || myCacheSize == 0) return null;
        return myCache.get(version);
    }

    private Transformation remember(Transformation t)
    {
        if (t.getVersion() != null && myCacheSize > 0)
        {
            myCache.put(t.getVersion(), t);
        }
        return t;
    }

    private static void checkChange(String oldText, String newText, ChangeRegion change)
    {
        int start = change.getStart();
        int oldEnd = change.getOldEnd();
        int newEnd = change.getNewEnd();
        if (oldEnd > oldText.length() || newEnd > newText.length())
        {
            throw new IncrementalRebuildException(change + " lies outside the text");
        }
        if (newText.length() - oldText.length() != change.getDelta())
        {
            throw new IncrementalRebuildException(
                change + " does not match the change of the text length");
        }
        if (!oldText.regionMatches(0, newText, 0, start)
            || !oldText.regionMatches(oldEnd, newText, newEnd, oldText.length() - oldEnd))
        {
            throw new IncrementalRebuildException(
                "text outside " + change + " differs");
        }
    }


    /**
     * One bottom-up pass over a token tree.
     */
    private final class Build
    {
        private final TokenTree      myTree;
        private final Transformation myPrevious;
        private final ChangeRegion   myChange;
        private final Map<ContextKey, Element> myIndex = new HashMap<ContextKey, Element>();
        private int myReused;

        Build(TokenTree tree, Transformation previous, ChangeRegion change)
        {
            myTree = tree;
            myPrevious = previous;
            myChange = change;
        }

        Transformation run()
        {
            Element root = context(myTree.getRoot(), 0);
            if (root == null)
            {
                throw new ScoreDomException(
                    "no element for root context " + myTree.getRoot().getKind());
            }
            return new Transformation(root,
                                      myTree.getVersion(),
                                      myTree.getText(),
                                      myTable,
                                      myIndex,
                                      myPrevious != null,
                                      myReused);
        }

        private Element context(TokenContext context, int depth)
        {
            ContextKey key = ContextKey.of(context, depth);
            Element element = reuse(context, key, depth);
            if (element == null)
            {
                element = transform(context, depth);
            }
            if (element != null)
            {
                myIndex.put(key, element);
            }
            return element;
        }

        private Element transform(TokenContext context, int depth)
        {
            List<Object> items = new ArrayList<Object>();
            for (TokenNode child : context.getChildren())
            {
                if (child instanceof Token)
                {
                    items.add(child);
                }
                else if (child instanceof TokenContext)
                {
                    Element e = context((TokenContext) child, depth + 1);
                    if (e != null) items.add(e);
                }
            }
            Transform transform = myTable.get(context.getKind());
            if (transform == null) return null;

            Element element = transform.transform(new TransformItems(context, items));
            if (element != null && element.hasOrigin())
            {
                _Private_DomTrampoline.setOriginRange(
                    element, new OffsetRange(context.getStart(), context.getEnd()));
            }
            return element;
        }

        /**
         * Returns the element of the previous tree built from the same
         * context, moved over to the new tokens; null if it can't be reused.
         */
        private Element reuse(TokenContext context, ContextKey key, int depth)
        {
            if (myPrevious == null) return null;

            int delta;
            if (context.getEnd() <= myChange.getStart())
            {
                delta = 0;
            }
            else if (context.getStart() >= myChange.getNewEnd())
            {
                delta = myChange.getDelta();
            }
            else
            {
                return null;
            }

            Element candidate = myPrevious.getIndex().get(key.shift(delta));
            if (candidate == null || !candidate.isUnchanged()) return null;

            OriginRebinder rebinder = new OriginRebinder(context, delta);
            if (!rebinder.prepare(candidate)) return null;

            candidate.detach();
            rebinder.apply();
            indexReused(context, depth, delta, candidate);
            myReused++;
            return candidate;
        }

        /**
         * Carries the index entries of the contexts inside a reused element
         * over, so a later update can still reuse parts of it.
         */
        private void indexReused(TokenContext context, int depth, int delta, Element reused)
        {
            for (TokenNode child : context.getChildren())
            {
                if (!(child instanceof TokenContext)) continue;
                TokenContext c = (TokenContext) child;
                ContextKey key = ContextKey.of(c, depth + 1);
                Element e = myPrevious.getIndex().get(key.shift(delta));
                if (e != null && e.isDescendantOrSelf(reused))
                {
                    myIndex.put(key, e);
                }
                indexReused(c, depth + 1, delta, reused);
            }
        }
    }
}
