// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.util;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Test;

public class DurationsTest
{
    @Test
    public void durationFromLogAndDots()
    {
        assertThat(Durations.duration(0, 0), equalTo(Fraction.ONE));
        assertThat(Durations.duration(2, 0), equalTo(Fraction.ONE_QUARTER));
        assertThat(Durations.duration(2, 1), equalTo(Fraction.getFraction(3, 8)));
        assertThat(Durations.duration(3, 2), equalTo(Fraction.getFraction(7, 32)));
        assertThat(Durations.duration(-1, 0), equalTo(Fraction.getFraction(2, 1)));
        assertThat(Durations.duration(-3, 0), equalTo(Fraction.getFraction(8, 1)));
        assertThrows(IllegalArgumentException.class, () -> Durations.duration(-4, 0));
        assertThrows(IllegalArgumentException.class, () -> Durations.duration(2, -1));
    }

    @Test
    public void logDotCountInvertsDuration()
    {
        for (int log = Durations.MIN_LOG; log <= 8; log++)
        {
            for (int dots = 0; dots <= 3; dots++)
            {
                int[] ld = Durations.logDotCount(Durations.duration(log, dots));
                assertArrayEquals(new int[] { log, dots }, ld, log + "/" + dots);
            }
        }
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.logDotCount(Fraction.ZERO));
    }

    @Test
    public void validity()
    {
        assertTrue(Durations.isValid(Fraction.getFraction(3, 16)));
        assertTrue(Durations.isValid(Fraction.getFraction(12, 1)));
        assertFalse(Durations.isValid(Fraction.ONE_THIRD));
        assertFalse(Durations.isValid(Fraction.getFraction(5, 8)));
        assertFalse(Durations.isValid(Fraction.getFraction(16, 1)));
        assertFalse(Durations.isValid(Fraction.ZERO));
        assertFalse(Durations.isValid(null));
    }

    @Test
    public void toText()
    {
        assertThat(Durations.toString(Fraction.ONE_QUARTER), is("4"));
        assertThat(Durations.toString(Fraction.getFraction(7, 16)), is("4.."));
        assertThat(Durations.toString(Fraction.ONE), is("1"));
        assertThat(Durations.toString(Fraction.getFraction(3, 1)), is("\\breve."));
        assertThat(Durations.toString(Fraction.getFraction(4, 1)), is("\\longa"));
        assertThat(Durations.toString(Fraction.getFraction(8, 1)), is("\\maxima"));
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.toString(Fraction.getFraction(16, 1)));
    }

    @Test
    public void fromText()
    {
        assertThat(Durations.fromString("16."), equalTo(Fraction.getFraction(3, 32)));
        assertThat(Durations.fromString("\\breve"), equalTo(Fraction.getFraction(2, 1)));
        assertThat(Durations.fromString("longa"), equalTo(Fraction.getFraction(4, 1)));
        assertThat(Durations.fromString("2048"), equalTo(Fraction.getFraction(1, 2048)));
        assertThrows(IllegalArgumentException.class, () -> Durations.fromString("3"));
        assertThrows(IllegalArgumentException.class, () -> Durations.fromString("0"));
        assertThrows(IllegalArgumentException.class, () -> Durations.fromString("4096"));
        assertThrows(IllegalArgumentException.class, () -> Durations.fromString("."));
        assertThrows(IllegalArgumentException.class, () -> Durations.fromString("\\semibreve"));
    }

    @Test
    public void tooManyDotsAreRejected()
    {
        assertThat(Durations.duration(Durations.MAX_LOG, 16),
                   equalTo(Fraction.getFraction(131071, 134217728)));
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.duration(Durations.MAX_LOG, 17));
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.duration(Durations.MIN_LOG, 27));
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.fromString("2048" + StringUtils.repeat('.', 18)));
        assertThrows(IllegalArgumentException.class,
                     () -> Durations.fromString("4" + StringUtils.repeat('.', 26)));
        assertFalse(Durations.isValid(Fraction.getFraction(1, 4096)));
    }
}
