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

package com.baidu.graphson.config;

import java.io.File;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;

import com.baidu.graphson.exception.ConfigException;
import com.baidu.graphson.util.E;
import com.baidu.graphson.util.Log;

/**
 * Translation settings loaded from a properties or xml file, or copied
 * from an existing {@link Configuration}. Each registered key is parsed and
 * checked when it is added, so a config that was built without error holds
 * only valid values.
 */
public class GraphSONConfig extends PropertiesConfiguration {

    private static final Logger LOG = Log.logger(GraphSONConfig.class);

    static {
        OptionSpace.register("graphson", GraphSONOptions.instance());
    }

    public GraphSONConfig() {
        super();
    }

    public GraphSONConfig(Configuration config) {
        this.loadConfig(config);
    }

    public GraphSONConfig(String configFile) {
        this.loadConfig(loadConfigFile(configFile));
    }

    private void loadConfig(Configuration config) {
        if (config == null) {
            throw new ConfigException("The config object is null");
        }
        this.append(config);
    }

    @SuppressWarnings("unchecked")
    public <T, R> R get(TypedOption<T, R> option) {
        Object value = this.getProperty(option.name());
        if (value == null) {
            return option.defaultValue();
        }
        return (R) value;
    }

    @Override
    public void addPropertyDirect(String key, Object value) {
        TypedOption<?, ?> option = OptionSpace.get(key);
        if (option == null) {
            LOG.warn("The config option '{}' is redundant, " +
                     "please ensure it has been registered", key);
        } else {
            // The input value is String(parsed by PropertiesConfiguration)
            value = validateOption(option, value);
        }
        super.addPropertyDirect(key, value);
    }

    @Override
    protected void addPropertyInternal(String key, Object value) {
        this.addPropertyDirect(key, value);
    }

    private static Object validateOption(TypedOption<?, ?> option,
                                         Object value) {
        if (value instanceof String) {
            return option.parseConvert((String) value);
        }
        if (option.dataType().isInstance(value)) {
            return option.parseConvert(String.valueOf(value));
        }
        throw new ConfigException("Invalid value for key '%s': '%s'",
                                  option.name(), value);
    }

    private static Configuration loadConfigFile(String path) {
        E.checkNotNull(path, "config path");
        E.checkArgument(!path.isEmpty(),
                        "The config path can't be empty");

        File file = new File(path);
        E.checkArgument(file.exists() && file.isFile() && file.canRead(),
                        "Please specify a proper config file rather than: " +
                        "'%s'", file.toString());
        try {
            Configurations configs = new Configurations();
            String extension = FilenameUtils.getExtension(file.getName());
            if ("xml".equals(extension)) {
                return configs.xml(file);
            }
            return configs.properties(file);
        } catch (ConfigurationException e) {
            throw new ConfigException("Unable to load config: '%s'", e, path);
        }
    }
}
