// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.edit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazon.scoredom.Edit;
import org.junit.jupiter.api.Test;

public class EditListTest
{
    @Test
    public void noOpsAreDropped()
    {
        EditList list = new EditList();
        list.add(3, 3, "");
        assertThat(list.toList(), empty());
    }

    @Test
    public void touchingEditsMerge()
    {
        EditList list = new EditList();
        list.add(1, 1, " r");
        list.add(1, 1, "2");
        list.add(1, 3, "");
        list.add(5, 6, "x");
        assertThat(list.toList(), contains(new Edit(1, 3, " r2"), new Edit(5, 6, "x")));
    }

    @Test
    public void overlapIsAnError()
    {
        EditList list = new EditList();
        list.add(2, 5, "");
        assertThrows(IllegalStateException.class, () -> list.add(4, 6, "y"));
    }

    @Test
    public void minimalReplacement()
    {
        EditList list = new EditList();
        String source = "{ c d }";
        list.addMinimal(source, 1, 4, " ");
        list.addMinimal(source, 4, 6, "d\n");
        assertThat(list.toList(), contains(new Edit(2, 4, ""), new Edit(5, 6, "\n")));
    }
}
