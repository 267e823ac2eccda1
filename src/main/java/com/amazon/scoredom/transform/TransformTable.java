// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps token context kinds to the {@link Transform}s that build elements
 * from them.
 * <p>
 * Contexts of a kind the table has no transform for are handled by the
 * <em>missing</em> transform, if one is set, and are dropped otherwise.
 * <p>
 * Instances are immutable and safe for use by multiple threads.
 */
public final class TransformTable
{
    private final Map<String, Transform> myTransforms;
    private final Transform myMissing;

    private TransformTable(Builder builder)
    {
        myTransforms = Collections.unmodifiableMap(
            new LinkedHashMap<String, Transform>(builder.myTransforms));
        myMissing = builder.myMissing;
    }

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Returns the transform for the context kind.
     *
     * @return the missing transform if there is no transform for the kind;
     * null if there is no missing transform either.
     */
    public Transform get(String kind)
    {
        Transform t = myTransforms.get(kind);
        return t != null ? t : myMissing;
    }

    /**
     * Determines whether the table has its own transform for the kind.
     */
    public boolean handles(String kind)
    {
        return myTransforms.containsKey(kind);
    }

    public Set<String> getKinds()
    {
        return myTransforms.keySet();
    }

    public Transform getMissing()
    {
        return myMissing;
    }


    /**
     * A mutable builder of {@link TransformTable}s.
     */
    public static final class Builder
    {
        private final Map<String, Transform> myTransforms =
            new LinkedHashMap<String, Transform>();
        private Transform myMissing;

        private Builder() { }

        /**
         * Adds or replaces the transform for a context kind.
         *
         * @return this builder.
         */
        public Builder with(String kind, Transform transform)
        {
            if (kind == null) throw new NullPointerException("kind");
            if (transform == null) throw new NullPointerException("transform");
            myTransforms.put(kind, transform);
            return this;
        }

        /**
         * Sets the transform for context kinds without their own transform.
         *
         * @param transform may be null to drop such contexts.
         *
         * @return this builder.
         */
        public Builder withMissing(Transform transform)
        {
            myMissing = transform;
            return this;
        }

        public TransformTable build()
        {
            return new TransformTable(this);
        }
    }
}
