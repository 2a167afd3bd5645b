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

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import com.baidu.graphson.exception.DecodeError;
import com.baidu.graphson.exception.DecodeException;
import com.baidu.graphson.exception.EncodeException;
import com.baidu.graphson.exception.SerializeException;
import com.baidu.graphson.exception.TranslationException;
import com.baidu.graphson.structure.NodePath;
import com.baidu.graphson.structure.TypedValue;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.JsonUtil;
import com.baidu.graphson.util.Log;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Translates documents from the untagged legacy encoding to the tagged
 * encoding of the configured version.
 *
 * A call decodes the whole document, runs the fixups its options enable
 * and encodes the result. Nothing is kept between calls, so the same input
 * and options always give the same output and any number of calls may run
 * at once.
 */
public class TranslationAdapter {

    private static final Logger LOG = Log.logger(TranslationAdapter.class);

    private static final int DIGEST_LENGTH = 128;

    private final FixupRegistry registry;

    public TranslationAdapter() {
        this(FixupRegistry.DEFAULT);
    }

    public TranslationAdapter(FixupRegistry registry) {
        E.checkNotNull(registry, "fixup registry");
        this.registry = registry;
    }

    public FixupRegistry registry() {
        return this.registry;
    }

    public JsonNode translate(JsonNode document, TranslateOptions options) {
        E.checkNotNull(document, "document");
        E.checkNotNull(options, "options");
        try {
            return this.convert(document, NodePath.ROOT, options);
        } catch (DecodeException e) {
            throw new TranslationException(e, digest(document),
                                           options.toString());
        } catch (EncodeException e) {
            throw new TranslationException(e, digest(document),
                                           options.toString());
        }
    }

    public String translate(String document, TranslateOptions options) {
        return JsonUtil.toJson(this.translate(parse(document, options),
                                              options));
    }

    public TranslationResult tryTranslate(JsonNode document,
                                          TranslateOptions options) {
        try {
            return TranslationResult.success(this.translate(document,
                                                            options));
        } catch (TranslationException e) {
            return TranslationResult.failure(e);
        }
    }

    public TranslationResult tryTranslate(String document,
                                          TranslateOptions options) {
        try {
            return this.tryTranslate(parse(document, options), options);
        } catch (TranslationException e) {
            return TranslationResult.failure(e);
        }
    }

    /**
     * Translate a value found at the path of a larger document. Failures
     * are raised unwrapped so the caller can add its own context.
     */
    JsonNode convert(JsonNode node, NodePath path, TranslateOptions options) {
        TypedValue value = options.decoder().decode(node, path);
        List<Fixup> fixups = this.registry.fixups(options);
        for (Fixup fixup : fixups) {
            value = fixup.apply(value);
        }
        LOG.debug("Encode value at '{}' after {} fixups with options {}",
                  path, fixups.size(), options);
        return options.encoder().encode(value, path);
    }

    static JsonNode parse(String document, TranslateOptions options) {
        E.checkNotNull(document, "document");
        E.checkNotNull(options, "options");
        try {
            return JsonUtil.fromJson(document);
        } catch (SerializeException e) {
            DecodeException error = new DecodeException(
                                    DecodeError.TYPE_MISMATCH, NodePath.ROOT,
                                    e, "invalid json text");
            throw new TranslationException(error,
                                           StringUtils.abbreviate(
                                           document, DIGEST_LENGTH),
                                           options.toString());
        }
    }

    static String digest(JsonNode document) {
        return JsonUtil.abbreviate(document, DIGEST_LENGTH);
    }
}
