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

import org.junit.Test;

import com.baidu.graphson.adapter.ResponseTranslator;
import com.baidu.graphson.adapter.TranslateOptions;
import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.TranslationException;
import com.baidu.graphson.io.GraphSONVersion;
import com.baidu.graphson.testutil.Assert;
import com.baidu.graphson.unit.BaseUnitTest;
import com.fasterxml.jackson.databind.JsonNode;

public class ResponseTranslatorTest extends BaseUnitTest {

    private final ResponseTranslator translator = new ResponseTranslator();

    @Test
    public void testTranslateResponse() {
        JsonNode response = json(
                "{'requestId':'41d2e28a','status':{'code':200," +
                "'message':'','attributes':{'host':'h1'}}," +
                "'result':{'data':[{'id':1,'label':'person'," +
                "'properties':{}}],'meta':{'count':1}}}");
        Assert.assertJsonEquals(text(
                "{'requestId':'41d2e28a','status':{'code':200," +
                "'message':'','attributes':{'@type':'g:Map'," +
                "'@value':['host','h1']}}," +
                "'result':{'data':{'@type':'g:List','@value':[" +
                "{'@type':'g:Vertex','@value':{" +
                "'id':{'@type':'g:Int64','@value':1}," +
                "'label':'person'}}]}," +
                "'meta':{'@type':'g:Map','@value':['count'," +
                "{'@type':'g:Int64','@value':1}]}}}"),
                this.translator.translate(response,
                                          TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateResponseWithoutMeta() {
        JsonNode response = json("{'requestId':'r1','status':{'code':204}," +
                                 "'result':{'data':null}}");
        Assert.assertJsonEquals(text(
                "{'requestId':'r1','status':{'code':204}," +
                "'result':{'data':null}}"),
                this.translator.translate(response,
                                          TranslateOptions.DEFAULT));
    }

    @Test
    public void testTranslateResponseToV2() {
        TranslateOptions options = TranslateOptions.builder()
                                                   .version(
                                                    GraphSONVersion.V2_0)
                                                   .build();
        String response = text("{'result':{'data':['a',1]," +
                               "'meta':{'k':'v'}}}");
        Assert.assertEquals(text("{'result':{'data':['a'," +
                                 "{'@type':'g:Int64','@value':1}]," +
                                 "'meta':{'k':'v'}}}"),
                            this.translator.translate(response, options));
    }

    @Test
    public void testTranslateResponseWithoutResult() {
        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate(json("{'requestId':'r1'}"),
                                      TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.MISSING_FIELD,
                                e.decodeFailure().reason());
            Assert.assertEquals("$", e.decodeFailure().path().toString());
            Assert.assertContains("'result'", e.getMessage());
        });

        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate(json("{'result':[1]}"),
                                      TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.TYPE_MISMATCH,
                                e.decodeFailure().reason());
            Assert.assertEquals("$.result",
                                e.decodeFailure().path().toString());
        });

        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate(json("[1]"), TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.TYPE_MISMATCH,
                                e.decodeFailure().reason());
        });
    }

    @Test
    public void testTranslateResponseWithBadData() {
        JsonNode response = json("{'result':{'data':[{'label':'knows'," +
                                 "'inV':1,'outV':2}]}}");
        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate(response, TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.MISSING_FIELD,
                                e.decodeFailure().reason());
            Assert.assertEquals("$.result.data[0]",
                                e.decodeFailure().path().toString());
        });

        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate(json("{'result':{'data':1," +
                                           "'meta':'none'}}"),
                                      TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals("$.result.meta",
                                e.decodeFailure().path().toString());
        });
    }

    @Test
    public void testTranslateResponseText() {
        Assert.assertThrows(TranslationException.class, () -> {
            this.translator.translate("{'result'", TranslateOptions.DEFAULT);
        }, e -> {
            Assert.assertEquals(DecodeError.TYPE_MISMATCH,
                                e.decodeFailure().reason());
        });
    }
}
