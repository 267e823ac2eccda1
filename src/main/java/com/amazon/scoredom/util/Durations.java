// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.util;

import java.math.BigInteger;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;

/**
 * Utility methods for musical durations.
 * <p>
 * A duration is a {@link Fraction} where a whole note is 1.  A duration
 * splits into a <em>log</em> and a <em>dot count</em>: the log is 0 for a
 * whole note, 1 for a half note, 2 for a quarter note, and -1, -2, -3 for
 * {@code \breve}, {@code \longa} and {@code \maxima}.
 */
public final class Durations
{
    private static final String[] NAMED_DURATIONS = { "breve", "longa", "maxima" };

    /** The longest base duration that has a notation. */
    public static final int MIN_LOG = -NAMED_DURATIONS.length;

    /** The shortest base duration we accept, a 1/2048 note. */
    public static final int MAX_LOG = 11;

    /** Numerator and denominator of a duration must fit in an int. */
    private static final int MAX_SHIFT = 30;

    private Durations() { }


    /**
     * Returns the duration for the given log and dot count.
     *
     * @throws IllegalArgumentException if the log is smaller than
     * {@link #MIN_LOG}, the dot count is negative, or the value does not fit
     * in a {@link Fraction}.
     */
    public static Fraction duration(int log, int dotCount)
    {
        if (log < MIN_LOG)
        {
            throw new IllegalArgumentException("log too small: " + log);
        }
        if (dotCount < 0)
        {
            throw new IllegalArgumentException("negative dot count: " + dotCount);
        }
        if (!fits(log, dotCount))
        {
            throw new IllegalArgumentException(
                "too many dots: log " + log + ", " + dotCount + " dots");
        }
        int numerator = ((2 << dotCount) - 1) << 3;
        int denominator = 1 << (dotCount + log + 3);
        return Fraction.getReducedFraction(numerator, denominator);
    }

    /**
     * Splits a duration into its log and dot count.  Values that can't be
     * written with a base length and dots are truncated to one that can.
     *
     * @return a two-element array: {@code {log, dotCount}}.
     *
     * @throws IllegalArgumentException if the value is not positive.
     */
    public static int[] logDotCount(Fraction value)
    {
        if (value.getNumerator() <= 0 || value.getDenominator() <= 0)
        {
            throw new IllegalArgumentException("duration must be positive: " + value);
        }
        BigInteger num = BigInteger.valueOf(value.getNumerator());
        BigInteger den = BigInteger.valueOf(value.getDenominator());

        // value = m * 2^e with 1/2 <= m < 1
        int exponent = floorLog2(num, den) + 1;
        int log = 1 - exponent;

        // rest = 1 - m = 1 - value / 2^exponent
        BigInteger mDen = exponent >= 0 ? den.shiftLeft(exponent) : den;
        BigInteger mNum = exponent >= 0 ? num : num.shiftLeft(-exponent);
        BigInteger restNum = mDen.subtract(mNum);
        BigInteger restDen = mDen;

        int restExponent = floorLog2(restNum, restDen) + 1;
        // m2 = rest / 2^restExponent, dots are one less if m2 > 1/2
        BigInteger twiceNum = restNum.shiftLeft(1);
        BigInteger scaledDen = restExponent >= 0
            ? restDen.shiftLeft(restExponent) : restDen;
        BigInteger scaledNum = restExponent >= 0
            ? twiceNum : twiceNum.shiftLeft(-restExponent);
        int dotCount = -restExponent - (scaledNum.compareTo(scaledDen) > 0 ? 1 : 0);
        return new int[] { log, dotCount };
    }

    private static boolean fits(int log, int dotCount)
    {
        return dotCount + 4 <= MAX_SHIFT && dotCount + log + 3 <= MAX_SHIFT;
    }

    private static int floorLog2(BigInteger num, BigInteger den)
    {
        int k = num.bitLength() - den.bitLength();
        boolean below = k >= 0
            ? num.compareTo(den.shiftLeft(k)) < 0
            : num.shiftLeft(-k).compareTo(den) < 0;
        return below ? k - 1 : k;
    }

    /**
     * Determines whether the value can be written as a base length with
     * dots.
     */
    public static boolean isValid(Fraction value)
    {
        if (value == null || value.getNumerator() <= 0) return false;
        int[] ld = logDotCount(value);
        if (ld[0] < MIN_LOG || ld[0] > MAX_LOG || !fits(ld[0], ld[1])) return false;
        return duration(ld[0], ld[1]).compareTo(value) == 0;
    }

    /**
     * Writes the duration in music notation, e.g. {@code "4."} or
     * {@code "\breve"}.  The value is truncated as described at
     * {@link #logDotCount(Fraction)}.
     *
     * @throws IllegalArgumentException if the base length is longer than
     * {@code \maxima}.
     */
    public static String toString(Fraction value)
    {
        int[] ld = logDotCount(value);
        int log = ld[0];
        String base;
        if (log < 0)
        {
            if (log < MIN_LOG)
            {
                throw new IllegalArgumentException("duration too long: " + value);
            }
            base = "\\" + NAMED_DURATIONS[-1 - log];
        }
        else
        {
            base = Integer.toString(1 << log);
        }
        return base + StringUtils.repeat('.', ld[1]);
    }

    /**
     * Reads a duration written in music notation, e.g. {@code "8.."}.  The
     * named durations may be written with or without backslash.
     *
     * @throws IllegalArgumentException if the text is not a duration.
     */
    public static Fraction fromString(String text)
    {
        String base = StringUtils.stripEnd(text, ".");
        if (StringUtils.isEmpty(base))
        {
            throw new IllegalArgumentException("not a duration: " + text);
        }
        int dotCount = text.length() - base.length();
        base = StringUtils.removeStart(base, "\\");

        int log;
        int named = indexOf(NAMED_DURATIONS, base);
        if (named >= 0)
        {
            log = -1 - named;
        }
        else
        {
            if (!StringUtils.isNumeric(base) || base.length() > 4)
            {
                throw new IllegalArgumentException("not a duration: " + text);
            }
            int length = Integer.parseInt(base);
            if (length == 0 || Integer.bitCount(length) != 1)
            {
                throw new IllegalArgumentException("not a duration: " + text);
            }
            log = Integer.numberOfTrailingZeros(length);
            if (log > MAX_LOG)
            {
                throw new IllegalArgumentException("duration too short: " + text);
            }
        }
        return duration(log, dotCount);
    }

    private static int indexOf(String[] names, String name)
    {
        for (int i = 0; i < names.length; i++)
        {
            if (names[i].equals(name)) return i;
        }
        return -1;
    }
}
