// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import com.amazon.scoredom.dom.Element;

/**
 * Builds an element from one token context.
 * <p>
 * A transform is called bottom-up: the child contexts of the context have
 * already been transformed, and their elements appear among the items.
 * Transforms must create their elements with
 * {@link TransformItems#create}, so that the elements get an origin, and
 * must not depend on anything but the items, so that elements of unchanged
 * contexts can be reused by an incremental update.
 */
public interface Transform
{
    /**
     * Builds the element for the context of the items.
     *
     * @return the element, or null to drop the context and the elements of
     * its child contexts.
     */
    public Element transform(TransformItems items);
}
