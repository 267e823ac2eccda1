// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.testing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.edit.Edits;
import com.amazon.scoredom.token.TokenTree;

public final class DomAssert
{
    private DomAssert() { }


    //========================================================================
    // Tree assertions

    public static void assertContentEquals(Element expected, Element actual)
    {
        if (!expected.contentEquals(actual))
        {
            fail("trees differ\nexpected:\n" + expected.dump()
                 + "\nactual:\n" + actual.dump());
        }
    }

    /**
     * Checks the parent links and child indexes of the whole subtree.
     */
    public static void assertWellFormed(Element root)
    {
        int i = 0;
        for (Element child : root)
        {
            assertSame(root, child.getParent(), "parent of " + child);
            assertEquals(i, child.indexInParent(), "index of " + child);
            assertWellFormed(child);
            i++;
        }
        assertEquals(i, root.size(), "size of " + root);
    }

    public static void assertDetached(Element e)
    {
        assertNull(e.getParent(), "parent of " + e);
        assertTrue(e.isRoot(), "isRoot");
    }


    //========================================================================
    // Source assertions

    /**
     * Applies the edits of the tree to the text it was built from, and
     * checks the result.
     */
    public static void assertEditsProduce(String expected, Element root, TokenTree tree)
    {
        assertNotNull(tree.getText(), "tree text");
        String actual = Edits.apply(root.edits(tree), tree.getText());
        assertEquals(expected, actual, "edited text");
    }

    public static void assertNoEdits(Element root, TokenTree tree)
    {
        assertTrue(root.edits(tree).isEmpty(), "no edits expected");
    }
}
