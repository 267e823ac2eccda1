// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * An immutable whitespace policy with five independent, optional attributes:
 * <ul>
 *   <li>{@code spaceBefore}: before the element;</li>
 *   <li>{@code spaceAfterHead}: between the head and the first child;</li>
 *   <li>{@code spaceBetween}: between consecutive children;</li>
 *   <li>{@code spaceBeforeTail}: between the last child and the tail;</li>
 *   <li>{@code spaceAfter}: after the element.</li>
 * </ul>
 * A null attribute is <em>unset</em>: the value is taken from the policy it
 * is {@linkplain #overriddenBy(Spacing) layered on}, and in the end defaults
 * to {@link Whitespace#NONE}.
 */
public final class Spacing
{
    /** The policy with every attribute unset. */
    public static final Spacing UNSET = new Spacing(null, null, null, null, null);

    private final Whitespace mySpaceBefore;
    private final Whitespace mySpaceAfterHead;
    private final Whitespace mySpaceBetween;
    private final Whitespace mySpaceBeforeTail;
    private final Whitespace mySpaceAfter;

    private Spacing(Whitespace before,
                    Whitespace afterHead,
                    Whitespace between,
                    Whitespace beforeTail,
                    Whitespace after)
    {
        mySpaceBefore     = before;
        mySpaceAfterHead  = afterHead;
        mySpaceBetween    = between;
        mySpaceBeforeTail = beforeTail;
        mySpaceAfter      = after;
    }

    public static Spacing of(Whitespace before,
                             Whitespace afterHead,
                             Whitespace between,
                             Whitespace beforeTail,
                             Whitespace after)
    {
        if (before == null && afterHead == null && between == null
            && beforeTail == null && after == null)
        {
            return UNSET;
        }
        return new Spacing(before, afterHead, between, beforeTail, after);
    }

    /**
     * Returns a policy with the same whitespace at all five junctions.
     */
    public static Spacing all(Whitespace ws)
    {
        return of(ws, ws, ws, ws, ws);
    }

    //=========================================================================
    // Raw (possibly unset) attributes

    public Whitespace getSpaceBefore()     { return mySpaceBefore; }
    public Whitespace getSpaceAfterHead()  { return mySpaceAfterHead; }
    public Whitespace getSpaceBetween()    { return mySpaceBetween; }
    public Whitespace getSpaceBeforeTail() { return mySpaceBeforeTail; }
    public Whitespace getSpaceAfter()      { return mySpaceAfter; }

    //=========================================================================
    // Resolved attributes: unset reads as NONE

    public Whitespace spaceBefore()     { return orNone(mySpaceBefore); }
    public Whitespace spaceAfterHead()  { return orNone(mySpaceAfterHead); }
    public Whitespace spaceBetween()    { return orNone(mySpaceBetween); }
    public Whitespace spaceBeforeTail() { return orNone(mySpaceBeforeTail); }
    public Whitespace spaceAfter()      { return orNone(mySpaceAfter); }

    private static Whitespace orNone(Whitespace ws)
    {
        return (ws == null ? Whitespace.NONE : ws);
    }

    //=========================================================================

    public Spacing withSpaceBefore(Whitespace ws)
    {
        return of(ws, mySpaceAfterHead, mySpaceBetween, mySpaceBeforeTail, mySpaceAfter);
    }

    public Spacing withSpaceAfterHead(Whitespace ws)
    {
        return of(mySpaceBefore, ws, mySpaceBetween, mySpaceBeforeTail, mySpaceAfter);
    }

    public Spacing withSpaceBetween(Whitespace ws)
    {
        return of(mySpaceBefore, mySpaceAfterHead, ws, mySpaceBeforeTail, mySpaceAfter);
    }

    public Spacing withSpaceBeforeTail(Whitespace ws)
    {
        return of(mySpaceBefore, mySpaceAfterHead, mySpaceBetween, ws, mySpaceAfter);
    }

    public Spacing withSpaceAfter(Whitespace ws)
    {
        return of(mySpaceBefore, mySpaceAfterHead, mySpaceBetween, mySpaceBeforeTail, ws);
    }

    /**
     * Returns a policy where every attribute set in {@code overrides} replaces
     * the value of this policy.
     */
    public Spacing overriddenBy(Spacing overrides)
    {
        if (overrides == null || overrides == UNSET) return this;
        if (this == UNSET) return overrides;
        return of(pick(overrides.mySpaceBefore, mySpaceBefore),
                  pick(overrides.mySpaceAfterHead, mySpaceAfterHead),
                  pick(overrides.mySpaceBetween, mySpaceBetween),
                  pick(overrides.mySpaceBeforeTail, mySpaceBeforeTail),
                  pick(overrides.mySpaceAfter, mySpaceAfter));
    }

    private static Whitespace pick(Whitespace preferred, Whitespace fallback)
    {
        return (preferred != null ? preferred : fallback);
    }

    public boolean isUnset()
    {
        return this == UNSET;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof Spacing)) return false;
        Spacing that = (Spacing) other;
        return mySpaceBefore == that.mySpaceBefore
            && mySpaceAfterHead == that.mySpaceAfterHead
            && mySpaceBetween == that.mySpaceBetween
            && mySpaceBeforeTail == that.mySpaceBeforeTail
            && mySpaceAfter == that.mySpaceAfter;
    }

    @Override
    public int hashCode()
    {
        int result = hash(mySpaceBefore);
        result = 31 * result + hash(mySpaceAfterHead);
        result = 31 * result + hash(mySpaceBetween);
        result = 31 * result + hash(mySpaceBeforeTail);
        return 31 * result + hash(mySpaceAfter);
    }

    private static int hash(Whitespace ws)
    {
        return (ws == null ? 0 : ws.ordinal() + 1);
    }

    @Override
    public String toString()
    {
        return "Spacing(before=" + mySpaceBefore
            + ", afterHead=" + mySpaceAfterHead
            + ", between=" + mySpaceBetween
            + ", beforeTail=" + mySpaceBeforeTail
            + ", after=" + mySpaceAfter + ")";
    }
}
