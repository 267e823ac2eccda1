// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import static com.amazon.scoredom.Whitespace.BLANK_LINE;
import static com.amazon.scoredom.Whitespace.NEWLINE;
import static com.amazon.scoredom.Whitespace.NONE;
import static com.amazon.scoredom.Whitespace.SPACE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import com.amazon.scoredom.Whitespace;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.Test;

public class WhitespaceResolverTest
{
    private static Point point(String text, Whitespace before, Whitespace after)
    {
        return new Point(null, -1, -1, text, false, false, false, before, after);
    }

    @Test
    public void strongestWishWins()
    {
        assertThat(WhitespaceResolver.resolve(), is(NONE));
        assertThat(WhitespaceResolver.resolve(SPACE, NONE), is(SPACE));
        assertThat(WhitespaceResolver.resolve(SPACE, BLANK_LINE, NEWLINE), is(BLANK_LINE));
        assertThat(WhitespaceResolver.resolve(null, NEWLINE), is(NEWLINE));
        assertThat(WhitespaceResolver.resolve(NEWLINE, null), is(NEWLINE));
    }

    @Test
    public void resolveIgnoresOrder()
    {
        for (Whitespace a : Whitespace.values())
        {
            for (Whitespace b : Whitespace.values())
            {
                Whitespace ab = WhitespaceResolver.resolve(a, b);
                assertThat(a + "," + b, WhitespaceResolver.resolve(b, a), is(ab));
                for (Whitespace c : Whitespace.values())
                {
                    Whitespace left = WhitespaceResolver.resolve(ab, c);
                    assertThat(WhitespaceResolver.resolve(a, WhitespaceResolver.resolve(b, c)),
                               is(left));
                    assertThat(WhitespaceResolver.resolve(c, b, a), is(left));
                }
            }
        }
    }

    @Test
    public void combineJoinsWithResolvedWhitespace()
    {
        String s = WhitespaceResolver.combine(Arrays.asList(
            point("a", NONE, SPACE),
            point("b", NEWLINE, NONE),
            point("c", NONE, NONE)));
        assertThat(s, is("a\nbc"));
    }

    @Test
    public void combineIgnoresWhichNeighbourWishes()
    {
        String s1 = WhitespaceResolver.combine(Arrays.asList(
            point("a", NONE, SPACE),
            point("b", NEWLINE, NONE)));
        String s2 = WhitespaceResolver.combine(Arrays.asList(
            point("a", NONE, NEWLINE),
            point("b", SPACE, NONE)));
        assertThat(s1, is("a\nb"));
        assertThat(s2, is(s1));
    }

    @Test
    public void combineDropsOuterWhitespace()
    {
        String s = WhitespaceResolver.combine(Arrays.asList(
            point("a", BLANK_LINE, SPACE),
            point("b", SPACE, NEWLINE)));
        assertThat(s, is("a b"));
        assertThat(WhitespaceResolver.combine(Collections.<Point>emptyList()), is(""));
    }

    @Test
    public void emptyTextCarriesWishes()
    {
        String s = WhitespaceResolver.combine(Arrays.asList(
            point("a", NONE, NONE),
            point("", NEWLINE, SPACE),
            point("b", NONE, NONE)));
        assertThat(s, is("a\nb"));
    }

    @Test
    public void classify()
    {
        assertThat(Whitespace.classify(""), is(NONE));
        assertThat(Whitespace.classify("  \t"), is(SPACE));
        assertThat(Whitespace.classify(" \n  "), is(NEWLINE));
        assertThat(Whitespace.classify("\n \n"), is(BLANK_LINE));
    }
}
