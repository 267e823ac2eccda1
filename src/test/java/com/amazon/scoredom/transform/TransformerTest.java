// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.scoredom.transform;

import static com.amazon.scoredom.testing.DomAssert.assertWellFormed;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.scoredom.ScoreDomException;
import com.amazon.scoredom.dom.Element;
import com.amazon.scoredom.dom.Elements;
import com.amazon.scoredom.system.TransformerBuilder;
import com.amazon.scoredom.testing.Lily;
import com.amazon.scoredom.testing.MiniLexer;
import com.amazon.scoredom.testing.SimpleTokenTree;
import com.amazon.scoredom.token.Token;
import java.util.Collections;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TransformerTest
{
    private static Transformer transformer(TransformTable table)
    {
        return TransformerBuilder.standard().withTransformTable(table).build();
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "{ }",
        "{ c d e }",
        "{ cis4 des8. e\\breve r2 }",
        "<< { c } { e } >>",
        "% intro\n{ c \\break d }",
        "{ { c } << d e >> }\n{ f }",
    })
    public void canonicalSourceRoundTrips(String text)
    {
        Element root = Lily.parse(text);
        assertWellFormed(root);
        assertThat(root.serialize(), is(text));
    }

    @Test
    public void buildsTypedElements()
    {
        Element doc = Lily.parse("{ c4. r }");
        Element list = doc.get(0);
        assertThat(list.getType(), sameInstance(Lily.MUSIC_LIST));
        Element c = list.get(0);
        assertThat(c.getHead(), equalTo((Object) "c"));
        assertThat(c.get(0).getHead(), equalTo((Object) Fraction.getFraction(3, 8)));
        assertThat(list.get(1).getType(), sameInstance(Lily.REST));
        assertTrue(doc.isUnchanged());
    }

    @Test
    public void originsPointAtTokens()
    {
        Element list = Lily.parse("{ c }").get(0);
        Token open = list.getOrigin().getHeadTokens().get(0);
        Token close = list.getOrigin().getTailTokens().get(0);
        assertThat(open.getText(), is("{"));
        assertThat(open.getStart(), is(0));
        assertThat(close.getStart(), is(4));
    }

    @Test
    public void unreadableHeadFails()
    {
        ScoreDomException e =
            assertThrows(ScoreDomException.class, () -> Lily.parse("{ c3 }"));
        assertThat(e.causeOfType(IllegalArgumentException.class), notNullValue());
    }

    @Test
    public void unhandledContextsAreDropped()
    {
        TransformTable table = TransformTable.builder()
            .with(MiniLexer.DOCUMENT, Lily.table().get(MiniLexer.DOCUMENT))
            .with(MiniLexer.MUSIC_LIST, Lily.table().get(MiniLexer.MUSIC_LIST))
            .with(MiniLexer.NOTE, Lily.table().get(MiniLexer.NOTE))
            .build();
        Element doc = transformer(table).build(MiniLexer.tokenize("% x\n{ c }")).getRoot();
        assertThat(doc.size(), is(1));
        assertThat(doc.get(0).getType(), sameInstance(Lily.MUSIC_LIST));
        assertFalse(table.handles(MiniLexer.COMMENT));
    }

    @Test
    public void missingTransformHandlesUnknownKinds()
    {
        TransformTable table = TransformTable.builder()
            .with(MiniLexer.DOCUMENT, Lily.table().get(MiniLexer.DOCUMENT))
            .withMissing(new Transform()
            {
                public Element transform(TransformItems items)
                {
                    return items.create(Lily.COMMAND,
                                        Collections.singletonList(items.tokens().get(0)),
                                        null);
                }
            })
            .build();
        Element doc = transformer(table).build(MiniLexer.tokenize("% x\n\\break")).getRoot();
        assertThat(doc.size(), is(2));
        assertThat(doc.get(0).getHead(), equalTo((Object) "% x"));
        assertThat(doc.get(1).getHead(), equalTo((Object) "\\break"));
    }

    @Test
    public void droppedRootFails()
    {
        TransformTable table = TransformTable.builder()
            .with(MiniLexer.NOTE, Lily.table().get(MiniLexer.NOTE))
            .build();
        ScoreDomException e = assertThrows(ScoreDomException.class,
            () -> transformer(table).build(MiniLexer.tokenize("c")));
        assertThat(e.getMessage(), containsString(MiniLexer.DOCUMENT));
    }

    @Test
    public void missingHeadTokensFail()
    {
        TransformTable table = TransformTable.builder()
            .with(MiniLexer.DOCUMENT, Lily.table().get(MiniLexer.DOCUMENT))
            .with(MiniLexer.NOTE, new Transform()
            {
                public Element transform(TransformItems items)
                {
                    return items.create(Lily.NOTE, Collections.<Token>emptyList(), null);
                }
            })
            .build();
        assertThrows(ScoreDomException.class,
                     () -> transformer(table).build(MiniLexer.tokenize("c")));
    }

    @Test
    public void transformItems()
    {
        final TransformItems[] seen = new TransformItems[1];
        TransformTable table = TransformTable.builder()
            .with(MiniLexer.DOCUMENT, Lily.table().get(MiniLexer.DOCUMENT))
            .with(MiniLexer.NOTE, Lily.table().get(MiniLexer.NOTE))
            .with(MiniLexer.MUSIC_LIST, new Transform()
            {
                public Element transform(TransformItems items)
                {
                    seen[0] = items;
                    return Lily.table().get(MiniLexer.MUSIC_LIST).transform(items);
                }
            })
            .build();
        transformer(table).build(MiniLexer.tokenize("{ c d }"));
        TransformItems items = seen[0];
        assertThat(items.size(), is(4));
        assertTrue(items.isToken(0));
        assertTrue(items.isElement(1));
        assertTrue(items.isElement(2));
        assertTrue(items.isToken(3));
        assertThat(items.tokens().size(), is(2));
        assertThat(items.elements().size(), is(2));
        assertThat(items.getContext().getKind(), is(MiniLexer.MUSIC_LIST));
    }


    //=========================================================================
    // Cache

    @Test
    public void cachedByVersion()
    {
        Transformer t = Lily.transformer();
        SimpleTokenTree tree = MiniLexer.tokenize("{ c }", "v1");
        Transformation first = t.transform(tree);
        assertThat(t.transform(tree), sameInstance(first));
        assertThat(t.transform(MiniLexer.tokenize("{ c }", "v1")), sameInstance(first));

        // the cached tree is returned as is, changes included
        first.getRoot().get(0).get(0).setHead("d");
        assertThat(t.transform(tree).getRoot().serialize(), is("{ d }"));

        assertThat(t.transform(MiniLexer.tokenize("{ c }", "v2")), not(sameInstance(first)));
        t.clearCache();
        assertThat(t.transform(tree), not(sameInstance(first)));
    }

    @Test
    public void treesWithoutVersionAreNotCached()
    {
        Transformer t = Lily.transformer();
        SimpleTokenTree tree = MiniLexer.tokenize("{ c }");
        assertThat(t.transform(tree), not(sameInstance(t.transform(tree))));
    }

    @Test
    public void buildBypassesCache()
    {
        Transformer t = Lily.transformer();
        SimpleTokenTree tree = MiniLexer.tokenize("{ c }", 1);
        Transformation cached = t.transform(tree);
        assertThat(t.build(tree), not(sameInstance(cached)));
        assertThat(t.transform(tree), sameInstance(cached));
    }

    @Test
    public void leastRecentlyUsedIsEvicted()
    {
        Transformer t = TransformerBuilder.standard()
                                          .withTransformTable(Lily.table())
                                          .withCacheSize(2)
                                          .build();
        SimpleTokenTree one = MiniLexer.tokenize("c", 1);
        SimpleTokenTree two = MiniLexer.tokenize("d", 2);
        SimpleTokenTree three = MiniLexer.tokenize("e", 3);
        Transformation t1 = t.transform(one);
        Transformation t2 = t.transform(two);
        assertThat(t.transform(one), sameInstance(t1));
        t.transform(three);
        assertThat(t.transform(one), sameInstance(t1));
        assertThat(t.transform(two), not(sameInstance(t2)));
    }

    @Test
    public void zeroCacheSizeDisablesCache()
    {
        Transformer t = TransformerBuilder.standard()
                                          .withTransformTable(Lily.table())
                                          .withCacheSize(0)
                                          .build();
        SimpleTokenTree tree = MiniLexer.tokenize("c", 1);
        assertThat(t.transform(tree), not(sameInstance(t.transform(tree))));
    }

    @Test
    public void findByHeadAfterBuild()
    {
        Element doc = Lily.parse("{ c d c }");
        int count = 0;
        for (Element e : doc.findDescendants(Elements.withHead("c")))
        {
            assertThat(e.getType(), sameInstance(Lily.NOTE));
            count++;
        }
        assertThat(count, is(2));
    }
}
