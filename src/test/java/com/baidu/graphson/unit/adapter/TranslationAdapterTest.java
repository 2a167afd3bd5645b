/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with this
 * work for additional information regarding copyright ownership. The ASF
 * licenses this file to You under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.baidu.graphson.unit.adapter;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.mockito.Mockito;

import com.baidu.graphson.adapter.Fixup;
import com.baidu.graphson.adapter.FixupRegistry;
import com.baidu.graphson.adapter.TranslateOptions;
import com.baidu.graphson.adapter.TranslationAdapter;
import com.baidu.graphson.adapter.TranslationResult;
import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.EncodeError;
import com.baidu.graphson.exception.TranslationException;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.io.GraphSONVersion;
import com.baidu.graphson.io.NumericWidthPolicy;
import com.baidu.graphson.io.NumericWidthPolicy.FloatPreference;
import com.baidu.graphson.io.NumericWidthPolicy.IntegerPreference;
import com.baidu.graphson.legacy.ExtensionPolicy;
import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.Scalar;
import com.baidu.graphson.testutil.Assert;
import com.baidu.graphson.unit.BaseUnitTest;
import com.baidu.graphson.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

public class TranslationAdapterTest extends BaseUnitTest {

    private static final String VERTEX =
            "{'id':3,'label':'person','properties':{'name':" +
            "[{'id':11,'label':'name','value':'John'}]}}";

    private final TranslationAdapter adapter = new TranslationAdapter();

    @Test
    public void testTranslateVertex() {
        JsonNode translated = this.adapter.translate(json(VERTEX),
                                                     TranslateOptions.DEFAULT);
        Assert.assertEquals("g:Vertex", translated.get("@type").asText());

        JsonNode name = translated.get("@value").get("properties")
                                  .get("name").get(0);
        Assert.assertEquals("g:VertexProperty", name.get("@type").asText());
        Assert.assertEquals("John", name.get("@value").get("value").asText());
        Assert.assertJsonEquals(text("{'@type':'g:Int64','@value':11}"),
                                name.get("@value").get("id"));

        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':3}," +
                "'label':'person'," +
                "'properties':{'name':[{'@type':'g:VertexProperty'," +
                "'@value':{'id':{'@type':'g:Int64','@value':11}," +
                "'value':'John','label':'name'}}]}}}"),
                translated);
    }

    @Test
    public void testTranslateEdge() {
        JsonNode edge = json("{'id':7,'label':'knows','inV':2,'outV':1," +
                             "'inVLabel':'person','outVLabel':'person'," +
                             "'properties':{'weight':0.5}}");
        Assert.assertJsonEquals(text(
                "{'@type':'g:Edge','@value':{" +
                "'id':{'@type':'g:Int64','@value':7}," +
                "'label':'knows','inVLabel':'person','outVLabel':'person'," +
                "'inV':{'@type':'g:Int64','@value':2}," +
                "'outV':{'@type':'g:Int64','@value':1}," +
                "'properties':{'weight':{'@type':'g:Property','@value':" +
                "{'key':'weight','value':{'@type':'g:Double'," +
                "'@value':0.5}}}}}}"),
                this.adapter.translate(edge, TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateEdgeShapeWinsOverMap() {
        // A row that happens to hold both endpoints reads as an edge
        JsonNode row = json("{'id':'e1','label':'link','inV':'a','outV':'b'}");
        JsonNode translated = this.adapter.translate(row,
                                                     TranslateOptions.DEFAULT);
        Assert.assertEquals("g:Edge", translated.get("@type").asText());
    }

    @Test
    public void testTranslateRows() {
        JsonNode rows = json("[{'name':['marko'],'age':[29]},1.5,null]");
        Assert.assertJsonEquals(text(
                "{'@type':'g:List','@value':[" +
                "{'@type':'g:Map','@value':[" +
                "'name',{'@type':'g:List','@value':['marko']}," +
                "'age',{'@type':'g:List','@value':[" +
                "{'@type':'g:Int64','@value':29}]}]}," +
                "{'@type':'g:Double','@value':1.5},null]}"),
                this.adapter.translate(rows, TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateRowsToV2() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .version(
                                                    GraphSONVersion.V2_0)
                                                   .build();
        JsonNode rows = json("[{'name':['marko']},2]");
        Assert.assertJsonEquals(text(
                "[{'name':['marko']},{'@type':'g:Int64','@value':2}]"),
                this.adapter.translate(rows, options));
    }

    @Test
    public void testTranslateKeepsLegacyTypedWidth() {
        JsonNode doc = json("[{'@type':'g:Int32','@value':5}," +
                            "{'@type':'g:Float','@value':0.5},5]");
        Assert.assertJsonEquals(text(
                "{'@type':'g:List','@value':[" +
                "{'@type':'g:Int32','@value':5}," +
                "{'@type':'g:Float','@value':0.5}," +
                "{'@type':'g:Int64','@value':5}]}"),
                this.adapter.translate(doc, TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateWithWidthPolicy() {
        NumericWidthPolicy policy = NumericWidthPolicy.of(
                                    IntegerPreference.PREFER_INT32,
                                    FloatPreference.PREFER_FLOAT);
        TranslateOptions options = TranslateOptions.builder()
                                                   .policy(policy)
                                                   .build();
        Assert.assertJsonEquals(text(
                "{'@type':'g:List','@value':[" +
                "{'@type':'g:Int32','@value':1}," +
                "{'@type':'g:Int64','@value':3000000000}," +
                "{'@type':'g:Float','@value':0.5}]}"),
                this.adapter.translate(json("[1,3000000000,0.5]"), options));
    }

    @Test
    public void testTranslateText() {
        String translated = this.adapter.translate(text(VERTEX),
                                                   TranslateOptions.DEFAULT);
        Assert.assertTrue(translated.startsWith("{\"@type\":\"g:Vertex\""));
        Assert.assertEquals(translated,
                            this.adapter.translate(text(VERTEX),
                                                   TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateIsIdempotent() {
        String document = text("[{'id':1,'label':'person','properties':{" +
                               "'age':[{'id':2,'value':29}]}," +
                               "'partition':'p1'},{'b':[1,2],'a':{'c':1}}]");
        String first = this.adapter.translate(document,
                                              TranslateOptions.DEFAULT);
        for (int i = 0; i < 10; i++) {
            Assert.assertEquals(first, this.adapter.translate(
                                       document, TranslateOptions.DEFAULT));
        }
    }

    @Test
    public void testTranslateConcurrently() {
        String expected = this.adapter.translate(text(VERTEX),
                                                 TranslateOptions.DEFAULT);
        AtomicInteger translated = new AtomicInteger();
        runWithThreads(8, () -> {
            for (int i = 0; i < 100; i++) {
                String actual = this.adapter.translate(
                                text(VERTEX), TranslateOptions.DEFAULT);
                Assert.assertEquals(expected, actual);
                translated.incrementAndGet();
            }
        });
        Assert.assertEquals(800, translated.get());
    }

    @Test
    public void testTranslateWithMissingId() {
        JsonNode doc = json("{'label':'person','properties':{'name':" +
                            "[{'id':11,'value':'John'}]}}");
        Assert.assertThrows(TranslationException.class, () -> {
            this.adapter.translate(doc, TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertTrue(e.isDecodeFailure());
            Assert.assertFalse(e.isEncodeFailure());
            Assert.assertEquals(DecodeError.MISSING_FIELD,
                                e.decodeFailure().reason());
            Assert.assertEquals("$", e.decodeFailure().path().toString());
            Assert.assertContains("'id'", e.getMessage());
            Assert.assertContains("version=v3.0", e.getMessage());
            Assert.assertEquals(TranslateOptions.DEFAULT.toString(),
                                e.options());
            Assert.assertContains("person", e.document());
        });
    }

    @Test
    public void testTranslateInvalidText() {
        Assert.assertThrows(TranslationException.class, () -> {
            this.adapter.translate("{'id':", TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.TYPE_MISMATCH,
                                e.decodeFailure().reason());
            Assert.assertEquals("$", e.decodeFailure().path().toString());
            Assert.assertContains("invalid json text", e.getMessage());
        });
    }

    @Test
    public void testTranslateWithIncompletePolicy() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .policy(null)
                                                   .build();
        Assert.assertThrows(TranslationException.class, () -> {
            this.adapter.translate(json("[1]"), options);
        }, e -> {
            Assert.assertTrue(e.isEncodeFailure());
            Assert.assertEquals(EncodeError.UNSUPPORTED_WIDTH_POLICY,
                                e.encodeFailure().reason());
        });
    }

    @Test
    public void testTranslateWithDefaultLabel() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .defaultLabel("vertex")
                                                   .build();
        JsonNode doc = json("[{'id':1,'properties':{'age':" +
                            "[{'id':2,'value':29}]}}," +
                            "{'id':3,'label':'person','properties':{}}]");
        JsonNode translated = this.adapter.translate(doc, options);
        JsonNode first = translated.get("@value").get(0).get("@value");
        Assert.assertEquals("vertex", first.get("label").asText());
        // The property label falls back to its key while decoding
        Assert.assertEquals("age", first.get("properties").get("age").get(0)
                                        .get("@value").get("label")
                                        .asText());
        JsonNode second = translated.get("@value").get(1).get("@value");
        Assert.assertEquals("person", second.get("label").asText());
    }

    @Test
    public void testTranslateMissingLabelWithoutDefault() {
        JsonNode doc = json("{'id':1,'inV':2,'outV':3}");
        Assert.assertThrows(TranslationException.class, () -> {
            this.adapter.translate(doc, TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.MISSING_FIELD,
                                e.decodeFailure().reason());
        });
    }

    @Test
    public void testTranslateUnlabeledWithoutFixup() {
        TranslationAdapter bare = new TranslationAdapter(
                                  FixupRegistry.emptyBuilder().build());
        TranslateOptions options = TranslateOptions.builder()
                                                   .defaultLabel("vertex")
                                                   .build();
        Assert.assertThrows(TranslationException.class, () -> {
            bare.translate(json("{'id':1,'properties':{}}"), options);
        }, e -> {
            Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                e.encodeFailure().reason());
            Assert.assertEquals("$", e.encodeFailure().path().toString());
        });
    }

    @Test
    public void testTranslateWithCollapseSingletons() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .collapseSingletons(true)
                                                   .build();
        JsonNode rows = json("[{'name':['marko'],'langs':['java','go']}]");
        Assert.assertJsonEquals(text(
                "{'@type':'g:List','@value':[" +
                "{'@type':'g:Map','@value':['name','marko','langs'," +
                "{'@type':'g:List','@value':['java','go']}]}]}"),
                this.adapter.translate(rows, options));
    }

    @Test
    public void testTranslateDropsExtensions() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .extensionPolicy(
                                                    ExtensionPolicy.DROP)
                                                   .build();
        JsonNode doc = json("{'id':1,'label':'person','properties':{}," +
                            "'partition':'p1'}");
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':1},'label':'person'}}"),
                this.adapter.translate(doc, options));

        JsonNode kept = this.adapter.translate(doc, TranslateOptions.DEFAULT);
        Assert.assertJsonEquals(text("{'partition':'p1'}"),
                                kept.get("@value").get("@extensions"));
    }

    @Test
    public void testTranslateWithCustomFixup() {
        Fixup fixup = Mockito.mock(Fixup.class);
        Mockito.when(fixup.apply(Mockito.any()))
               .thenReturn(Scalar.of("replaced"));
        FixupRegistry registry = FixupRegistry.builder()
                                              .register("custom",
                                                        options -> fixup)
                                              .build();
        TranslationAdapter custom = new TranslationAdapter(registry);
        Assert.assertSame(registry, custom.registry());

        custom.translate(json("[1]"), TranslateOptions.DEFAULT);
        Mockito.verifyNoInteractions(fixup);

        TranslateOptions options = TranslateOptions.builder()
                                                   .enableFixup("custom")
                                                   .build();
        Assert.assertJsonEquals(text("'replaced'"),
                                custom.translate(json("[1]"), options));
        Mockito.verify(fixup).apply(ListValue.of(Scalar.ofInteger(1L)));
    }

    @Test
    public void testTryTranslate() {
        TranslationResult result = this.adapter.tryTranslate(
                                   json(VERTEX), TranslateOptions.DEFAULT);
        Assert.assertTrue(result.isSuccess());
        Assert.assertNull(result.error());
        Assert.assertEquals(JsonUtil.toJson(result.document()),
                            result.text());

        TranslationResult failure = this.adapter.tryTranslate(
                                    "[1,", TranslateOptions.DEFAULT);
        Assert.assertFalse(failure.isSuccess());
        Assert.assertNull(failure.document());
        Assert.assertTrue(failure.error().isDecodeFailure());
        Assert.assertThrows(TranslationException.class, failure::text,
                            e -> Assert.assertSame(failure.error(), e));

        TranslationResult decodeFailure = this.adapter.tryTranslate(
                                          json("{'id':1,'inV':2,'outV':3}"),
                                          TranslateOptions.DEFAULT);
        Assert.assertFalse(decodeFailure.isSuccess());
        Assert.assertContains("failure(", decodeFailure.toString());
    }

    @Test
    public void testTranslateVeryDeepNesting() {
        String deep = nestedListsText(20000);
        TranslationResult result = this.adapter.tryTranslate(
                                   deep, TranslateOptions.DEFAULT);
        Assert.assertFalse(result.isSuccess());
        Assert.assertTrue(result.error().isDecodeFailure());
        Assert.assertEquals(DecodeError.UNRECOGNIZED_SHAPE,
                            result.error().decodeFailure().reason());
        Assert.assertTrue(result.error().document().length() <= 128);

        Assert.assertThrows(TranslationException.class, () -> {
            this.adapter.translate(json(deep), TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertContains("max depth", e.getMessage());
        });
    }

    @Test
    public void testTranslateWithMaxDepth() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .maxDepth(3)
                                                   .build();
        Assert.assertEquals(3, options.maxDepth());
        Assert.assertContains("maxDepth=3", options.toString());
        Assert.assertNotEquals(TranslateOptions.DEFAULT, options);

        Assert.assertJsonEquals(text("{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[]}]}]}]}"),
                                this.adapter.translate(nestedLists(4),
                                                       options));

        TranslationResult result = this.adapter.tryTranslate(
                                   nestedLists(5), options);
        Assert.assertFalse(result.isSuccess());
        Assert.assertEquals("$[0][0][0][0]",
                            result.error().decodeFailure().path().toString());

        Assert.assertThrows(IllegalArgumentException.class, () -> {
            TranslateOptions.builder().maxDepth(0);
        }, e -> {
            Assert.assertContains("max depth", e.getMessage());
        });
    }

    @Test
    public void testExtensionKeyCannotBeElementField() {
        for (String field : GraphSONTokens.ELEMENT_FIELDS) {
            Assert.assertThrows(IllegalArgumentException.class, () -> {
                TranslateOptions.builder().extensionKey(field);
            }, e -> {
                Assert.assertContains(field, e.getMessage());
            });
        }

        TranslateOptions options = TranslateOptions.builder()
                                                   .extensionKey("_ext")
                                                   .build();
        JsonNode translated = this.adapter.translate(
                              json("{'id':1,'label':'person'," +
                                   "'properties':{},'ttl':3}"), options);
        Assert.assertEquals(3, translated.get("@value").get("_ext")
                                         .get("ttl").get("@value").asInt());
        Assert.assertEquals(1, translated.get("@value").get("id")
                                         .get("@value").asInt());
    }
}
