// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom;

/**
 * An error caused by giving an element a head value that its element type
 * does not accept, or by asking for the head value as the wrong Java type.
 */
public class TypeMismatchException
    extends ScoreDomException
{
    private static final long serialVersionUID = 1L;

    private final Class<?> myExpectedType;
    private final Object   myValue;

    public TypeMismatchException(String message,
                                 Class<?> expectedType,
                                 Object value)
    {
        super(message);
        myExpectedType = expectedType;
        myValue = value;
    }

    /**
     * The Java type the head value was required to have.
     */
    public Class<?> getExpectedType()
    {
        return myExpectedType;
    }

    /**
     * The offending value; may be null.
     */
    public Object getValue()
    {
        return myValue;
    }
}
