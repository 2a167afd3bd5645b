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

package com.baidu.graphson.unit.legacy;

import org.junit.Test;

import com.baidu.graphson.legacy.Shape;
import com.baidu.graphson.legacy.ShapeClassifier;
import com.baidu.graphson.legacy.ShapeClassifier.ShapeRule;
import com.baidu.graphson.testutil.Assert;
import com.baidu.graphson.unit.BaseUnitTest;
import com.google.common.collect.ImmutableList;

public class ShapeClassifierTest extends BaseUnitTest {

    private static final ShapeClassifier CLASSIFIER = ShapeClassifier.DEFAULT;

    @Test
    public void testClassifyVertex() {
        Assert.assertEquals(Shape.VERTEX, CLASSIFIER.classify(json(
                            "{'id':1,'label':'person','properties':" +
                            "{'name':[{'id':2,'value':'marko'}]}}")));
        Assert.assertEquals(Shape.VERTEX, CLASSIFIER.classify(json(
                            "{'id':1,'label':'person','properties':{}}")));
        Assert.assertEquals(Shape.VERTEX, CLASSIFIER.classify(json(
                            "{'id':1,'type':'vertex'}")));
        // Missing id is left to the decoder to report
        Assert.assertEquals(Shape.VERTEX, CLASSIFIER.classify(json(
                            "{'label':'person','properties':{}}")));
    }

    @Test
    public void testClassifyEdge() {
        Assert.assertEquals(Shape.EDGE, CLASSIFIER.classify(json(
                            "{'id':7,'label':'knows','inV':2,'outV':1}")));
        Assert.assertEquals(Shape.EDGE, CLASSIFIER.classify(json(
                            "{'id':7,'type':'edge'}")));
    }

    @Test
    public void testClassifyEdgeBeforeMap() {
        // A map that happens to hold edge fields is read as an edge
        Assert.assertEquals(Shape.EDGE, CLASSIFIER.classify(json(
                            "{'inV':'a','outV':'b','note':'not an edge'}")));
    }

    @Test
    public void testClassifyEdgeBeforeVertex() {
        Assert.assertEquals(Shape.EDGE, CLASSIFIER.classify(json(
                            "{'id':7,'label':'knows','inV':2,'outV':1," +
                            "'properties':{'since':[2010]}}")));
    }

    @Test
    public void testClassifyVertexProperty() {
        Assert.assertEquals(Shape.VERTEX_PROPERTY, CLASSIFIER.classify(json(
                            "{'id':2,'label':'name','value':'marko'}")));
        Assert.assertEquals(Shape.VERTEX_PROPERTY, CLASSIFIER.classify(json(
                            "{'id':2,'label':'name','value':'marko'," +
                            "'properties':{'since':[2010]}}")));
        // A free-standing property needs its label
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'id':2,'value':'marko','properties':" +
                            "{'since':[2010]}}")));
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'id':1,'value':'x'}")));
    }

    @Test
    public void testClassifyTypedScalar() {
        Assert.assertEquals(Shape.TYPED_SCALAR, CLASSIFIER.classify(json(
                            "{'@type':'g:Int32','@value':1}")));
        Assert.assertEquals(Shape.TYPED_SCALAR, CLASSIFIER.classify(json(
                            "{'@type':'g:Int32','id':1,'inV':2,'outV':3}")));
    }

    @Test
    public void testClassifyMap() {
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json("{}")));
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'name':['marko'],'age':[29]}")));
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'id':1,'label':'person'}")));
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'id':1,'properties':{'name':'marko'}}")));
        Assert.assertEquals(Shape.MAP, CLASSIFIER.classify(json(
                            "{'inV':2}")));
    }

    @Test
    public void testClassifyNonObject() {
        Assert.assertThrows(IllegalArgumentException.class, () -> {
            CLASSIFIER.classify(json("[1,2]"));
        }, e -> {
            Assert.assertContains("ARRAY", e.getMessage());
        });
    }

    @Test
    public void testCustomRules() {
        ShapeClassifier classifier = new ShapeClassifier(ImmutableList.of(
                new ShapeRule(Shape.VERTEX, node -> node.has("vid"))
        ));
        Assert.assertEquals(Shape.VERTEX,
                            classifier.classify(json("{'vid':1}")));
        Assert.assertEquals(Shape.MAP,
                            classifier.classify(json("{'inV':1,'outV':2}")));
        Assert.assertEquals(4, CLASSIFIER.rules().size());
        Assert.assertEquals(Shape.TYPED_SCALAR,
                            CLASSIFIER.rules().get(0).shape());
        Assert.assertEquals(Shape.EDGE, CLASSIFIER.rules().get(1).shape());
    }
}
