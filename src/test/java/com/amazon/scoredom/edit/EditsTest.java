// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.edit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.amazon.scoredom.Edit;
import com.amazon.scoredom.token.ChangeRegion;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

public class EditsTest
{
    @Test
    public void applyInReverse()
    {
        List<Edit> edits = Arrays.asList(new Edit(0, 1, "<<"),
                                         new Edit(5, 5, " e"),
                                         new Edit(6, 7, ">>"));
        StringBuilder buffer = new StringBuilder("{ c d }");
        assertThat(Edits.apply(edits, buffer), is(3));
        assertThat(buffer.toString(), is("<< c d e >>"));
    }

    @Test
    public void applyRejectsBadEdits()
    {
        assertThrows(IllegalArgumentException.class,
                     () -> Edits.apply(Arrays.asList(new Edit(2, 4, ""), new Edit(3, 5, "")),
                                       "abcdef"));
        assertThrows(IllegalArgumentException.class,
                     () -> Edits.apply(Arrays.asList(new Edit(3, 4, ""), new Edit(1, 2, "")),
                                       "abcdef"));
        assertThrows(IllegalArgumentException.class,
                     () -> Edits.apply(Collections.singletonList(new Edit(5, 9, "")),
                                       "abcdef"));
    }

    @Test
    public void changeRegion()
    {
        assertThat(Edits.changeRegion(Collections.<Edit>emptyList()), nullValue());
        List<Edit> edits = Arrays.asList(new Edit(2, 3, "cis"), new Edit(6, 8, ""));
        assertThat(Edits.changeRegion(edits), equalTo(new ChangeRegion(2, 8, 8)));

        String before = "{ c d e }";
        String after = Edits.apply(edits, before);
        assertThat(Edits.changeRegion(edits).getDelta(), is(after.length() - before.length()));
    }

    @Test
    public void editValue()
    {
        Edit e = new Edit(2, 5, "x");
        assertThat(e.getDelta(), is(-2));
        assertThat(e.compareTo(new Edit(2, 6, "")), is(-1));
        assertThat(e, equalTo(new Edit(2, 5, "x")));
        assertThat(e.toString(), is("Edit(2, 5, \"x\")"));
        assertThrows(IllegalArgumentException.class, () -> new Edit(3, 2, ""));
        assertThrows(NullPointerException.class, () -> new Edit(0, 0, null));
    }
}
