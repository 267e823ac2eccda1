// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.dom;

import com.amazon.scoredom.ScoreDomException;
import com.amazon.scoredom.util.Durations;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.math.Fraction;

/**
 * Converts the mutable head value of a {@link ElementKind#TEXT} element from
 * and to its source text.
 *
 * @param <T> the type of head value.
 */
public abstract class HeadFormat<T>
{
    private final Class<T> myValueType;

    protected HeadFormat(Class<T> valueType)
    {
        myValueType = valueType;
    }

    /**
     * Returns the type every head value of this format is an instance of.
     */
    public final Class<T> getValueType()
    {
        return myValueType;
    }

    /**
     * Reads a head value from the text of the head tokens.
     *
     * @throws ScoreDomException if the text can't be read.
     */
    public abstract T read(String text);

    /**
     * Writes the head value as source text.
     */
    public abstract String write(T value);

    /**
     * Determines whether the value is a valid head value.  The default
     * implementation only checks the value type.
     */
    public boolean accepts(Object value)
    {
        return myValueType.isInstance(value);
    }

    /**
     * Returns the canonical form of an accepted value; values with the same
     * text have equal canonical forms.  The default implementation returns
     * the value itself.
     */
    public T normalize(T value)
    {
        return value;
    }

    final Object normalizeValue(Object value)
    {
        return normalize(myValueType.cast(value));
    }

    final String writeValue(Object value)
    {
        return write(myValueType.cast(value));
    }


    //=========================================================================
    // Standard formats

    private static final HeadFormat<String> STRING =
        new HeadFormat<String>(String.class)
        {
            @Override
            public String read(String text)
            {
                return text;
            }

            @Override
            public String write(String value)
            {
                return value;
            }

            @Override
            public String toString()
            {
                return "string";
            }
        };

    private static final HeadFormat<Integer> INTEGER =
        new HeadFormat<Integer>(Integer.class)
        {
            @Override
            public Integer read(String text)
            {
                try
                {
                    return Integer.valueOf(text);
                }
                catch (NumberFormatException e)
                {
                    throw new ScoreDomException("not an integer: " + text, e);
                }
            }

            @Override
            public String write(Integer value)
            {
                return value.toString();
            }

            @Override
            public String toString()
            {
                return "integer";
            }
        };

    private static final HeadFormat<Fraction> DURATION =
        new HeadFormat<Fraction>(Fraction.class)
        {
            @Override
            public Fraction read(String text)
            {
                try
                {
                    return Durations.fromString(text);
                }
                catch (IllegalArgumentException e)
                {
                    throw new ScoreDomException(e.getMessage(), e);
                }
            }

            @Override
            public String write(Fraction value)
            {
                return Durations.toString(value);
            }

            @Override
            public boolean accepts(Object value)
            {
                return value instanceof Fraction
                    && Durations.isValid((Fraction) value);
            }

            @Override
            public Fraction normalize(Fraction value)
            {
                return value.reduce();
            }

            @Override
            public String toString()
            {
                return "duration";
            }
        };

    /**
     * The head is the text itself.
     */
    public static HeadFormat<String> string()
    {
        return STRING;
    }

    /**
     * The head is a decimal integer.
     */
    public static HeadFormat<Integer> integer()
    {
        return INTEGER;
    }

    /**
     * The head is a musical duration such as {@code 4.} or
     * {@code \breve}.  Only durations that can be written with a base length
     * and dots are accepted.
     *
     * @see Durations
     */
    public static HeadFormat<Fraction> duration()
    {
        return DURATION;
    }

    /**
     * The head is one of a fixed set of values, each written as a distinct
     * text.
     *
     * @param valueType the type of the values.
     * @param mapping maps each value to its text; texts must be unique.
     *
     * @throws IllegalArgumentException if two values map to the same text.
     */
    public static <T> HeadFormat<T> mapping(Class<T> valueType,
                                            Map<? extends T, String> mapping)
    {
        return new MappingFormat<T>(valueType, mapping);
    }

    /**
     * The head is a boolean, written as one of two texts.
     */
    public static HeadFormat<Boolean> toggle(String onText, String offText)
    {
        Map<Boolean, String> mapping = new LinkedHashMap<Boolean, String>();
        mapping.put(Boolean.TRUE, onText);
        mapping.put(Boolean.FALSE, offText);
        return new MappingFormat<Boolean>(Boolean.class, mapping);
    }


    private static final class MappingFormat<T>
        extends HeadFormat<T>
    {
        private final Map<T, String> myTexts;
        private final Map<String, T> myValues;

        MappingFormat(Class<T> valueType, Map<? extends T, String> mapping)
        {
            super(valueType);
            Map<T, String> texts = new LinkedHashMap<T, String>();
            Map<String, T> values = new LinkedHashMap<String, T>();
            for (Map.Entry<? extends T, String> entry : mapping.entrySet())
            {
                T value = valueType.cast(entry.getKey());
                String text = entry.getValue();
                if (values.put(text, value) != null)
                {
                    throw new IllegalArgumentException("duplicate head text: " + text);
                }
                texts.put(value, text);
            }
            myTexts = Collections.unmodifiableMap(texts);
            myValues = Collections.unmodifiableMap(values);
        }

        @Override
        public T read(String text)
        {
            T value = myValues.get(text);
            if (value == null)
            {
                throw new ScoreDomException("unknown head text: " + text);
            }
            return value;
        }

        @Override
        public String write(T value)
        {
            return myTexts.get(value);
        }

        @Override
        public boolean accepts(Object value)
        {
            return super.accepts(value) && myTexts.containsKey(value);
        }

        @Override
        public String toString()
        {
            return "mapping" + myValues.keySet();
        }
    }
}
