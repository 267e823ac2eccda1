// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.ElementKind;
import com.amazon.scoredom.Spacing;
import com.amazon.scoredom.TypeMismatchException;
import com.amazon.scoredom.token.Token;
import com.amazon.scoredom.token.Tokens;
import java.util.Arrays;
import java.util.List;

/**
 * Describes one type of element: its kind, its fixed head and tail text or
 * its head format, and its default whitespace policy.
 * <p>
 * Element types are compared by identity; two elements only have equal
 * content when they are of the very same type.  Instances are immutable and
 * may be shared freely.
 *
 * @see #newElement(Element...)
 */
public final class ElementType
{
    private final String        myName;
    private final ElementKind   myKind;
    private final String        myHead;
    private final String        myTail;
    private final HeadFormat<?> myHeadFormat;
    private final Spacing       mySpacing;

    private ElementType(String name,
                        ElementKind kind,
                        String head,
                        String tail,
                        HeadFormat<?> headFormat,
                        Spacing spacing)
    {
        if (name == null) throw new NullPointerException("name");
        myName = name;
        myKind = kind;
        myHead = head;
        myTail = tail;
        myHeadFormat = headFormat;
        mySpacing = (spacing == null ? Spacing.UNSET : spacing);
    }


    /**
     * Creates a type of element that has no text of its own.
     */
    public static ElementType container(String name, Spacing spacing)
    {
        return new ElementType(name, ElementKind.CONTAINER, null, null, null, spacing);
    }

    public static ElementType container(String name)
    {
        return container(name, Spacing.UNSET);
    }

    /**
     * Creates a type of element with a fixed head text.
     */
    public static ElementType head(String name, String head, Spacing spacing)
    {
        checkText("head", head);
        return new ElementType(name, ElementKind.HEAD, head, null, null, spacing);
    }

    public static ElementType head(String name, String head)
    {
        return head(name, head, Spacing.UNSET);
    }

    /**
     * Creates a type of element with a fixed head and tail text.
     */
    public static ElementType block(String name, String head, String tail,
                                    Spacing spacing)
    {
        checkText("head", head);
        checkText("tail", tail);
        return new ElementType(name, ElementKind.BLOCK, head, tail, null, spacing);
    }

    public static ElementType block(String name, String head, String tail)
    {
        return block(name, head, tail, Spacing.UNSET);
    }

    /**
     * Creates a type of element with a mutable head value.
     */
    public static ElementType text(String name, HeadFormat<?> headFormat,
                                   Spacing spacing)
    {
        if (headFormat == null) throw new NullPointerException("headFormat");
        return new ElementType(name, ElementKind.TEXT, null, null, headFormat, spacing);
    }

    public static ElementType text(String name, HeadFormat<?> headFormat)
    {
        return text(name, headFormat, Spacing.UNSET);
    }

    private static void checkText(String what, String text)
    {
        if (text == null || text.isEmpty())
        {
            throw new IllegalArgumentException(what + " text must not be empty");
        }
    }


    public String getName()
    {
        return myName;
    }

    public ElementKind getKind()
    {
        return myKind;
    }

    /**
     * Returns the fixed head text.
     *
     * @return null unless this type is of kind HEAD or BLOCK.
     */
    public String getHead()
    {
        return myHead;
    }

    /**
     * Returns the fixed tail text.
     *
     * @return null unless this type is of kind BLOCK.
     */
    public String getTail()
    {
        return myTail;
    }

    /**
     * Returns the head format.
     *
     * @return null unless this type is of kind TEXT.
     */
    public HeadFormat<?> getHeadFormat()
    {
        return myHeadFormat;
    }

    /**
     * Returns the default whitespace policy of elements of this type.
     */
    public Spacing getSpacing()
    {
        return mySpacing;
    }


    /**
     * Creates an element of this type without origin.
     *
     * @throws UnsupportedOperationException if this type is of kind TEXT;
     * use {@link #newElement(Object, Element...)}.
     * @throws com.amazon.scoredom.AlreadyAttachedException if one of the
     * children already has a parent.
     */
    public Element newElement(Element... children)
    {
        Element element;
        switch (myKind)
        {
            case CONTAINER:
                element = new ContainerElement(this);
                break;
            case HEAD:
                element = new HeadElement(this);
                break;
            case BLOCK:
                element = new BlockElement(this);
                break;
            default:
                throw new UnsupportedOperationException(
                    myName + " elements need a head value");
        }
        addChildren(element, children);
        return element;
    }

    /**
     * Creates an element of this TEXT type without origin.
     *
     * @throws UnsupportedOperationException if this type is not of kind TEXT.
     * @throws TypeMismatchException if the head is not accepted by the head
     * format.
     */
    public Element newElement(Object head, Element... children)
    {
        if (myKind != ElementKind.TEXT)
        {
            throw new UnsupportedOperationException(
                myName + " elements have no head value");
        }
        Element element = new TextElement(this, checkHead(head));
        addChildren(element, children);
        return element;
    }

    /**
     * Reads the head value from the head tokens of a TEXT element.
     */
    Object readHead(List<? extends Token> headTokens)
    {
        return myHeadFormat.read(Tokens.text(headTokens));
    }

    /**
     * Returns the normalized head value.
     */
    Object checkHead(Object head)
    {
        if (!myHeadFormat.accepts(head))
        {
            throw new TypeMismatchException(
                "invalid head for " + myName + " (" + myHeadFormat + "): " + head,
                myHeadFormat.getValueType(), head);
        }
        return myHeadFormat.normalizeValue(head);
    }

    private static void addChildren(Element element, Element[] children)
    {
        if (children != null && children.length != 0)
        {
            element.addAll(Arrays.asList(children));
        }
        element.clearModified();
    }

    @Override
    public String toString()
    {
        return myName;
    }
}
