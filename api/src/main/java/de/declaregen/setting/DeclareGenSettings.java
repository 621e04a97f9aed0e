/* Copyright (C) 2024 The DeclareGen Authors
 * This file is part of DeclareGen.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.declaregen.setting;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global default settings. Values are read once from a {@code declaregen.properties} resource on the classpath (if
 * present) and can be overridden by system properties of the same name.
 */
public final class DeclareGenSettings {

    public static final String PROPERTIES_RESOURCE = "/declaregen.properties";

    private static final Logger LOGGER = LoggerFactory.getLogger(DeclareGenSettings.class);

    private static final DeclareGenSettings INSTANCE = new DeclareGenSettings();

    private final Properties properties;

    private DeclareGenSettings() {
        this(loadResource());
    }

    DeclareGenSettings(Properties properties) {
        this.properties = properties;
    }

    public static DeclareGenSettings getInstance() {
        return INSTANCE;
    }

    private static Properties loadResource() {
        Properties props = new Properties();
        try (InputStream is = DeclareGenSettings.class.getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (is != null) {
                props.load(is);
                LOGGER.debug("Loaded {} setting(s) from {}", props.size(), PROPERTIES_RESOURCE);
            }
        } catch (IOException ex) {
            LOGGER.warn("Could not read " + PROPERTIES_RESOURCE + ", falling back to built-in defaults", ex);
        }
        return props;
    }

    public @Nullable String getProperty(DeclareGenProperty property) {
        String key = property.getPropertyKey();
        String value = System.getProperty(key);
        return value != null ? value : properties.getProperty(key);
    }

    public int getInt(DeclareGenProperty property, int defaultValue) {
        long value = getLong(property, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            LOGGER.warn("Ignoring out-of-range value {} for {}, using {}", value, property.getPropertyKey(),
                        defaultValue);
            return defaultValue;
        }
        return (int) value;
    }

    public long getLong(DeclareGenProperty property, long defaultValue) {
        String value = getProperty(property);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            LOGGER.warn("Ignoring malformed value '{}' for {}, using {}", value, property.getPropertyKey(),
                        defaultValue);
            return defaultValue;
        }
    }
}
