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

package com.baidu.graphson.adapter;

import javax.annotation.Nullable;

import com.baidu.graphson.exception.TranslationException;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The outcome of a translate call as a value: either the translated
 * document or the failure that prevented it, never both.
 */
public final class TranslationResult {

    private final JsonNode document;
    private final TranslationException error;

    private TranslationResult(JsonNode document, TranslationException error) {
        this.document = document;
        this.error = error;
    }

    public static TranslationResult success(JsonNode document) {
        E.checkNotNull(document, "document");
        return new TranslationResult(document, null);
    }

    public static TranslationResult failure(TranslationException error) {
        E.checkNotNull(error, "error");
        return new TranslationResult(null, error);
    }

    public boolean isSuccess() {
        return this.error == null;
    }

    @Nullable
    public JsonNode document() {
        return this.document;
    }

    @Nullable
    public TranslationException error() {
        return this.error;
    }

    /**
     * The translated document as text, or throws the failure.
     */
    public String text() {
        if (this.error != null) {
            throw this.error;
        }
        return JsonUtil.toJson(this.document);
    }

    @Override
    public String toString() {
        if (this.isSuccess()) {
            return String.format("success(%s)", this.document);
        }
        return String.format("failure(%s)", this.error.getMessage());
    }
}
