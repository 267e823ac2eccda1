// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.edit;

import com.amazon.scoredom.Edit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates edits in ascending order, merging edits that touch.
 */
final class EditList
{
    private final List<Edit> myEdits = new ArrayList<Edit>();

    /**
     * Appends an edit.  An edit that starts where the previous one ends is
     * merged with it.  Edits that change nothing are dropped.
     *
     * @throws IllegalStateException if the edit overlaps the previous one.
     */
    void add(int start, int end, String text)
    {
        if (start == end && text.isEmpty()) return;
        int last = myEdits.size() - 1;
        if (last >= 0)
        {
            Edit prev = myEdits.get(last);
            if (start < prev.getEnd())
            {
                throw new IllegalStateException(
                    "edit [" + start + ":" + end + "] overlaps " + prev);
            }
            if (start == prev.getEnd())
            {
                myEdits.set(last, new Edit(prev.getStart(), end, prev.getText() + text));
                return;
            }
        }
        myEdits.add(new Edit(start, end, text));
    }

    /**
     * Appends an edit replacing {@code [start, end)} of the source text,
     * after stripping the prefix and suffix the replacement has in common
     * with the replaced text.
     */
    void addMinimal(String source, int start, int end, String text)
    {
        int prefix = 0;
        int max = Math.min(end - start, text.length());
        while (prefix < max && source.charAt(start + prefix) == text.charAt(prefix))
        {
            prefix++;
        }
        int suffix = 0;
        max -= prefix;
        while (suffix < max
               && source.charAt(end - 1 - suffix) == text.charAt(text.length() - 1 - suffix))
        {
            suffix++;
        }
        add(start + prefix, end - suffix,
            text.substring(prefix, text.length() - suffix));
    }

    List<Edit> toList()
    {
        return Collections.unmodifiableList(new ArrayList<Edit>(myEdits));
    }
}
