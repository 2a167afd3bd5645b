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

package com.baidu.graphson.unit.io;

import java.math.BigInteger;

import org.junit.Test;

import com.baidu.graphson.exception.EncodeError;
import com.baidu.graphson.exception.EncodeException;
import com.baidu.graphson.io.CurrentEncoder;
import com.baidu.graphson.io.GraphSONTokens;
import com.baidu.graphson.io.GraphSONVersion;
import com.baidu.graphson.io.NumericWidthPolicy;
import com.baidu.graphson.io.NumericWidthPolicy.FloatPreference;
import com.baidu.graphson.io.NumericWidthPolicy.IntegerPreference;
import com.baidu.graphson.structure.EdgeRef;
import com.baidu.graphson.structure.KeyValue;
import com.baidu.graphson.structure.ListValue;
import com.baidu.graphson.structure.MapValue;
import com.baidu.graphson.structure.PropertyEntry;
import com.baidu.graphson.structure.Scalar;
import com.baidu.graphson.structure.VertexPropertyRef;
import com.baidu.graphson.structure.VertexRef;
import com.baidu.graphson.testutil.Assert;
import com.baidu.graphson.unit.BaseUnitTest;
import com.google.common.collect.ImmutableList;

public class CurrentEncoderTest extends BaseUnitTest {

    private static final NumericWidthPolicy INT32_FLOAT =
            NumericWidthPolicy.of(IntegerPreference.PREFER_INT32,
                                  FloatPreference.PREFER_FLOAT);

    private final CurrentEncoder v3 = new CurrentEncoder(
                                      GraphSONVersion.V3_0,
                                      NumericWidthPolicy.DEFAULT);
    private final CurrentEncoder v2 = new CurrentEncoder(
                                      GraphSONVersion.V2_0,
                                      NumericWidthPolicy.DEFAULT);

    @Test
    public void testEncodeBareScalars() {
        Assert.assertJsonEquals(text("'marko'"),
                                this.v3.encode(Scalar.of("marko")));
        Assert.assertJsonEquals("true", this.v3.encode(Scalar.TRUE));
        Assert.assertJsonEquals("null", this.v3.encode(Scalar.NULL));
    }

    @Test
    public void testEncodeIntegerWithPolicy() {
        Assert.assertJsonEquals(text("{'@type':'g:Int64','@value':42}"),
                                this.v3.encode(Scalar.ofInteger(42L)));

        CurrentEncoder int32 = new CurrentEncoder(GraphSONVersion.V3_0,
                                                  INT32_FLOAT);
        Assert.assertJsonEquals(text("{'@type':'g:Int32','@value':42}"),
                                int32.encode(Scalar.ofInteger(42L)));
    }

    @Test
    public void testEncodeInt32PreferenceWidens() {
        CurrentEncoder int32 = new CurrentEncoder(GraphSONVersion.V3_0,
                                                  INT32_FLOAT);
        Assert.assertJsonEquals(text("{'@type':'g:Int64'," +
                                     "'@value':3000000000}"),
                                int32.encode(Scalar.ofInteger(3000000000L)));
    }

    @Test
    public void testEncodeFloatWithPolicy() {
        Assert.assertJsonEquals(text("{'@type':'g:Double','@value':1.5}"),
                                this.v3.encode(Scalar.ofFloat(1.5)));

        CurrentEncoder floats = new CurrentEncoder(GraphSONVersion.V3_0,
                                                   INT32_FLOAT);
        Assert.assertJsonEquals(text("{'@type':'g:Float','@value':1.5}"),
                                floats.encode(Scalar.ofFloat(1.5)));
        // 0.1 has no exact float representation
        Assert.assertJsonEquals(text("{'@type':'g:Double','@value':0.1}"),
                                floats.encode(Scalar.ofFloat(0.1)));
    }

    @Test
    public void testEncodeExplicitWidthWinsOverPolicy() {
        Assert.assertJsonEquals(text("{'@type':'g:Int32','@value':7}"),
                                this.v3.encode(Scalar.int32(7)));
        Assert.assertJsonEquals(text("{'@type':'g:Float','@value':2.5}"),
                                this.v3.encode(Scalar.float32(2.5f)));
        Assert.assertJsonEquals(text("{'@type':'gx:BigInteger','@value':7}"),
                                this.v3.encode(Scalar.bigInteger(
                                               BigInteger.valueOf(7L))));
    }

    @Test
    public void testEncodeBigInteger() {
        BigInteger big = new BigInteger("123456789012345678901234567890");
        Assert.assertThrows(EncodeException.class, () -> {
            this.v3.encode(ListValue.of(Scalar.ofInteger(big)));
        }, e -> {
            Assert.assertEquals(EncodeError.UNSUPPORTED_WIDTH_POLICY,
                                e.reason());
            Assert.assertEquals("$[0]", e.path().toString());
        });

        CurrentEncoder extended = new CurrentEncoder(
                                  GraphSONVersion.V3_0,
                                  NumericWidthPolicy.DEFAULT, true,
                                  CurrentEncoder.DEFAULT_EXTENSION_KEY);
        Assert.assertJsonEquals(text("{'@type':'gx:BigInteger'," +
                                     "'@value':" + big + "}"),
                                extended.encode(Scalar.ofInteger(big)));
    }

    @Test
    public void testEncodeWithIncompletePolicy() {
        CurrentEncoder noPolicy = new CurrentEncoder(GraphSONVersion.V3_0,
                                                     null);
        Assert.assertThrows(EncodeException.class, () -> {
            noPolicy.encode(Scalar.of("a"));
        }, e -> {
            Assert.assertEquals(EncodeError.UNSUPPORTED_WIDTH_POLICY,
                                e.reason());
        });

        CurrentEncoder halfPolicy = new CurrentEncoder(
                                    GraphSONVersion.V3_0,
                                    NumericWidthPolicy.of(
                                    IntegerPreference.PREFER_INT32, null));
        Assert.assertThrows(EncodeException.class, () -> {
            halfPolicy.encode(Scalar.ofInteger(1L));
        }, e -> {
            Assert.assertEquals(EncodeError.UNSUPPORTED_WIDTH_POLICY,
                                e.reason());
            Assert.assertEquals("$", e.path().toString());
        });
    }

    @Test
    public void testEncodeVertex() {
        VertexPropertyRef name = new VertexPropertyRef(
                                 Scalar.ofInteger(11L), "name",
                                 Scalar.of("John"));
        VertexRef vertex = new VertexRef(Scalar.ofInteger(3L), "person",
                                         ImmutableList.of(new PropertyEntry(
                                         "name", ImmutableList.of(name))));
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':3}," +
                "'label':'person'," +
                "'properties':{'name':[{'@type':'g:VertexProperty'," +
                "'@value':{'id':{'@type':'g:Int64','@value':11}," +
                "'value':'John','label':'name'}}]}}}"),
                this.v3.encode(vertex));
    }

    @Test
    public void testEncodeVertexWithoutProperties() {
        VertexRef vertex = new VertexRef(Scalar.of("v1"), "software",
                                         ImmutableList.of());
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{'id':'v1'," +
                "'label':'software'}}"),
                this.v3.encode(vertex));
    }

    @Test
    public void testEncodeVertexPropertyWithMetaProperties() {
        VertexPropertyRef prop = new VertexPropertyRef(
                                 Scalar.ofInteger(5L), "city",
                                 Scalar.of("beijing"),
                                 ImmutableList.of(new KeyValue(
                                 "since", Scalar.int32(2004))),
                                 ImmutableList.of());
        Assert.assertJsonEquals(text(
                "{'@type':'g:VertexProperty','@value':{" +
                "'id':{'@type':'g:Int64','@value':5}," +
                "'value':'beijing','label':'city'," +
                "'properties':{'since':{'@type':'g:Int32'," +
                "'@value':2004}}}}"),
                this.v3.encode(prop));
    }

    @Test
    public void testEncodeEdge() {
        EdgeRef edge = new EdgeRef(Scalar.ofInteger(7L), "knows",
                                   Scalar.ofInteger(2L), Scalar.ofInteger(1L),
                                   "person", "person",
                                   ImmutableList.of(new KeyValue(
                                   "weight", Scalar.ofFloat(0.5))),
                                   ImmutableList.of());
        Assert.assertJsonEquals(text(
                "{'@type':'g:Edge','@value':{" +
                "'id':{'@type':'g:Int64','@value':7}," +
                "'label':'knows','inVLabel':'person','outVLabel':'person'," +
                "'inV':{'@type':'g:Int64','@value':2}," +
                "'outV':{'@type':'g:Int64','@value':1}," +
                "'properties':{'weight':{'@type':'g:Property','@value':" +
                "{'key':'weight','value':{'@type':'g:Double'," +
                "'@value':0.5}}}}}}"),
                this.v3.encode(edge));
    }

    @Test
    public void testEncodeCollectionsV3() {
        MapValue map = MapValue.builder()
                               .put("name", ListValue.of(Scalar.of("marko")))
                               .put(Scalar.ofInteger(1L), Scalar.TRUE)
                               .build();
        Assert.assertJsonEquals(text(
                "{'@type':'g:Map','@value':[" +
                "'name',{'@type':'g:List','@value':['marko']}," +
                "{'@type':'g:Int64','@value':1},true]}"),
                this.v3.encode(map));
    }

    @Test
    public void testEncodeCollectionsV2() {
        MapValue map = MapValue.builder()
                               .put("name", ListValue.of(Scalar.of("marko")))
                               .put("age", Scalar.ofInteger(29L))
                               .build();
        Assert.assertJsonEquals(text(
                "{'name':['marko'],'age':{'@type':'g:Int64','@value':29}}"),
                this.v2.encode(map));
    }

    @Test
    public void testEncodeNonStringKeyV2() {
        MapValue map = MapValue.builder()
                               .put(Scalar.ofInteger(1L), Scalar.of("one"))
                               .build();
        Assert.assertThrows(EncodeException.class, () -> {
            this.v2.encode(ListValue.of(map));
        }, e -> {
            Assert.assertEquals(EncodeError.UNSUPPORTED_KEY, e.reason());
            Assert.assertEquals("$[0]", e.path().toString());
            Assert.assertContains("v2.0", e.getMessage());
        });
    }

    @Test
    public void testEncodeElementWithoutLabel() {
        VertexRef vertex = new VertexRef(Scalar.ofInteger(1L), null,
                                         ImmutableList.of());
        Assert.assertThrows(EncodeException.class, () -> {
            this.v3.encode(ListValue.of(Scalar.of("x"), vertex));
        }, e -> {
            Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                e.reason());
            Assert.assertEquals("$[1]", e.path().toString());
        });
    }

    @Test
    public void testEncodeDuplicateExtensionKey() {
        VertexRef vertex = new VertexRef(Scalar.ofInteger(1L), "person",
                                         ImmutableList.of(),
                                         ImmutableList.of(
                                         new KeyValue("a", Scalar.of("x")),
                                         new KeyValue("a", Scalar.of("y"))));
        Assert.assertThrows(EncodeException.class, () -> {
            this.v3.encode(vertex);
        }, e -> {
            Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                e.reason());
            Assert.assertEquals("$.@extensions.a", e.path().toString());
        });
    }

    @Test
    public void testEncodeExtensions() {
        VertexRef vertex = new VertexRef(Scalar.ofInteger(1L), "person",
                                         ImmutableList.of(),
                                         ImmutableList.of(new KeyValue(
                                         "partition", Scalar.of("p1"))));
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':1},'label':'person'," +
                "'@extensions':{'partition':'p1'}}}"),
                this.v3.encode(vertex));

        CurrentEncoder custom = new CurrentEncoder(
                                GraphSONVersion.V3_0,
                                NumericWidthPolicy.DEFAULT, false, "_ext");
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':1},'label':'person'," +
                "'_ext':{'partition':'p1'}}}"),
                custom.encode(vertex));
    }

    @Test
    public void testEncodeExtensionsUnderElementField() {
        VertexRef vertex = new VertexRef(Scalar.ofInteger(1L), "person",
                                         ImmutableList.of(),
                                         ImmutableList.of(new KeyValue(
                                         "partition", Scalar.of("p1"))));
        for (String field : GraphSONTokens.ELEMENT_FIELDS) {
            CurrentEncoder clashing = new CurrentEncoder(
                                      GraphSONVersion.V3_0,
                                      NumericWidthPolicy.DEFAULT,
                                      false, field);
            Assert.assertThrows(EncodeException.class, () -> {
                clashing.encode(vertex);
            }, e -> {
                Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                    e.reason());
                Assert.assertEquals("$." + field, e.path().toString());
            });
        }

        // Nothing to write, nothing to clash with
        VertexRef plain = new VertexRef(Scalar.ofInteger(1L), "person",
                                        ImmutableList.of());
        CurrentEncoder idKey = new CurrentEncoder(GraphSONVersion.V3_0,
                                                  NumericWidthPolicy.DEFAULT,
                                                  false, GraphSONTokens.ID);
        Assert.assertJsonEquals(text(
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':1},'label':'person'}}"),
                idKey.encode(plain));
    }

    @Test
    public void testEncodeWithMaxDepth() {
        CurrentEncoder shallow = new CurrentEncoder(GraphSONVersion.V3_0,
                                                    NumericWidthPolicy.DEFAULT,
                                                    false, "@extensions", 4);
        Assert.assertJsonEquals(text("{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[" +
                                     "{'@type':'g:List','@value':[]}]}]}]}]}"),
                                shallow.encode(nested(5)));

        Assert.assertThrows(EncodeException.class, () -> {
            shallow.encode(nested(6));
        }, e -> {
            Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                e.reason());
            Assert.assertEquals("$[0][0][0][0][0]", e.path().toString());
        });

        Assert.assertThrows(EncodeException.class, () -> {
            this.v3.encode(nested(1000));
        }, e -> {
            Assert.assertEquals(EncodeError.INTERNAL_INVARIANT_VIOLATION,
                                e.reason());
            Assert.assertContains("max depth", e.getMessage());
        });
    }

    private static ListValue nested(int depth) {
        ListValue list = ListValue.EMPTY;
        for (int i = 1; i < depth; i++) {
            list = ListValue.of(list);
        }
        return list;
    }

    @Test
    public void testEncodeIsDeterministic() {
        MapValue map = MapValue.builder()
                               .put("b", Scalar.ofFloat(0.25))
                               .put("a", ListValue.of(Scalar.ofInteger(1L)))
                               .build();
        Assert.assertEquals(this.v3.encode(map), this.v3.encode(map));
    }
}
