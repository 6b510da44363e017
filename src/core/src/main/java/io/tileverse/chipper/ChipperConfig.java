/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.chipper;

import static java.util.Objects.requireNonNull;

import io.tileverse.chipper.backend.BackendPolicy;
import java.util.Locale;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Process wide defaults for chippers and writers.
 * <p>
 * Values are looked up as system properties first, then as environment variables of the same name:
 * <ul>
 * <li>{@value #BACKEND_KEY}: {@code auto}, {@code mapped} or {@code manual}, the default {@link BackendPolicy};
 * <li>{@value #MMAP_ENABLED_KEY}: {@code false} disables memory mapping altogether, forcing
 *     {@link BackendPolicy#MANUAL}.
 * </ul>
 * Builders of {@link BipChipper} and {@link BipWriter} start from {@link #fromEnvironment()}; an explicit policy set
 * on a builder takes precedence.
 */
public class ChipperConfig {

    /** Key of the default backend policy. */
    public static final String BACKEND_KEY = "io.tileverse.chipper.backend";

    /** Key of the memory mapping kill switch. */
    public static final String MMAP_ENABLED_KEY = "io.tileverse.chipper.mmap.enabled";

    private BackendPolicy backendPolicy = BackendPolicy.AUTO;

    private boolean mmapEnabled = true;

    /**
     * Creates a configuration with default values: {@link BackendPolicy#AUTO}, memory mapping enabled.
     */
    public ChipperConfig() {
        // Default constructor
    }

    /**
     * @return the policy to use, {@link BackendPolicy#MANUAL} whenever memory mapping is disabled
     */
    public BackendPolicy backendPolicy() {
        return mmapEnabled ? backendPolicy : BackendPolicy.MANUAL;
    }

    public ChipperConfig backendPolicy(BackendPolicy policy) {
        this.backendPolicy = requireNonNull(policy, "policy");
        return this;
    }

    public boolean mmapEnabled() {
        return mmapEnabled;
    }

    public ChipperConfig mmapEnabled(boolean enabled) {
        this.mmapEnabled = enabled;
        return this;
    }

    /**
     * @return the configuration resolved from system properties and environment variables
     */
    public static ChipperConfig fromEnvironment() {
        return resolve(ChipperConfig::lookup);
    }

    /**
     * @param properties properties holding {@link #BACKEND_KEY} and/or {@link #MMAP_ENABLED_KEY}; missing keys keep
     *     their default value
     * @return the configuration described by {@code properties}
     * @throws IllegalArgumentException if a value can't be parsed
     */
    public static ChipperConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        return resolve(properties::getProperty);
    }

    public Properties toProperties() {
        Properties properties = new Properties();
        properties.setProperty(BACKEND_KEY, backendPolicy.name().toLowerCase(Locale.ROOT));
        properties.setProperty(MMAP_ENABLED_KEY, String.valueOf(mmapEnabled));
        return properties;
    }

    static BackendPolicy parsePolicy(String value) {
        try {
            return BackendPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value for %s: '%s', expected auto, mapped or manual".formatted(BACKEND_KEY, value), e);
        }
    }

    static boolean parseMmapEnabled(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!"true".equals(normalized) && !"false".equals(normalized)) {
            throw new IllegalArgumentException(
                    "Invalid value for %s: '%s', expected true or false".formatted(MMAP_ENABLED_KEY, value));
        }
        return Boolean.parseBoolean(normalized);
    }

    private static ChipperConfig resolve(UnaryOperator<String> source) {
        ChipperConfig config = new ChipperConfig();
        String policy = source.apply(BACKEND_KEY);
        if (policy != null) {
            config.backendPolicy(parsePolicy(policy));
        }
        String mmap = source.apply(MMAP_ENABLED_KEY);
        if (mmap != null) {
            config.mmapEnabled(parseMmapEnabled(mmap));
        }
        return config;
    }

    private static String lookup(String key) {
        String value = System.getProperty(key);
        if (value == null) {
            value = System.getenv(key);
        }
        return value;
    }

    @Override
    public String toString() {
        return "ChipperConfig[backendPolicy=%s, mmapEnabled=%s]".formatted(backendPolicy, mmapEnabled);
    }
}
