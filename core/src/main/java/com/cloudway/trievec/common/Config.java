/**
 * Cloudway Trievec
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.trievec.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.io.ByteSource;
import com.google.common.io.MoreFiles;
import com.google.common.io.Resources;
import com.google.common.primitives.Ints;

/**
 * Immutable key/value configuration. Values set as JVM system properties
 * take precedence over the values loaded from the property source.
 */
public class Config
{
    private static final Logger logger = Logger.getLogger(Config.class.getName());

    /**
     * The classpath resource consulted by {@link #getDefault()}.
     */
    public static final String DEFAULT_RESOURCE = "trievec.properties";

    private static final class DefaultHolder {
        static final Config INSTANCE = fromResource(DEFAULT_RESOURCE);
    }

    private final ImmutableMap<String, String> conf;

    private Config(ImmutableMap<String, String> conf) {
        this.conf = conf;
    }

    /**
     * Loads the configuration from the given property file.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public Config(Path path) {
        requireNonNull(path);
        try {
            this.conf = load(MoreFiles.asByteSource(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to load configuration from " + path, ex);
        }
        logger.fine(() -> "loaded configuration from " + path);
    }

    /**
     * Returns the configuration loaded from {@value #DEFAULT_RESOURCE}.
     */
    public static Config getDefault() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Loads the configuration from a classpath resource. A missing resource
     * yields an empty configuration.
     *
     * @throws UncheckedIOException if the resource exists but cannot be read
     */
    public static Config fromResource(String name) {
        requireNonNull(name);
        URL url = Config.class.getClassLoader().getResource(name);
        if (url == null) {
            logger.fine(() -> name + " not found on classpath, using defaults");
            return new Config(ImmutableMap.of());
        }

        try {
            return new Config(load(Resources.asByteSource(url)));
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to load configuration from " + url, ex);
        }
    }

    /**
     * Creates a configuration from an in-memory map.
     */
    public static Config of(Map<String, String> values) {
        return new Config(ImmutableMap.copyOf(values));
    }

    private static ImmutableMap<String, String> load(ByteSource source) throws IOException {
        Properties props = new Properties();
        try (InputStream in = source.openBufferedStream()) {
            props.load(in);
        }
        return Maps.fromProperties(props);
    }

    public Optional<String> get(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(conf.get(name));
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(String::trim).map(Boolean::valueOf).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).map(String::trim).map(Ints::tryParse).orElse(deflt);
    }

    public ImmutableMap<String, String> asMap() {
        return conf;
    }

    @Override
    public String toString() {
        return conf.toString();
    }
}
