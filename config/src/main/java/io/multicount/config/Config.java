/*
 * Copyright (C) 2015-2018 SoftIndex LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.multicount.config;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Hierarchical string configuration. Every node may carry a value and named children,
 * paths are dot-separated, the empty path addresses the node itself.
 * <p>
 * Instances are immutable, {@link #with(String, String)} and {@link #override(Config)} return new trees.
 */
public interface Config {
	Logger logger = LoggerFactory.getLogger(Config.class);

	Config EMPTY = ConfigNode.empty();

	String DELIMITER = ".";
	CharMatcher KEY_CHARS = CharMatcher.inRange('a', 'z')
			.or(CharMatcher.inRange('A', 'Z'))
			.or(CharMatcher.inRange('0', '9'))
			.or(CharMatcher.anyOf("_-"));

	/**
	 * Splits a path into its keys, rejecting empty segments and unsupported characters.
	 */
	static List<String> keysOf(String path) {
		checkNotNull(path);
		if (path.isEmpty()) return Collections.emptyList();
		List<String> keys = Splitter.on(DELIMITER).splitToList(path);
		for (String key : keys) {
			checkArgument(!key.isEmpty() && KEY_CHARS.matchesAllOf(key), "Invalid path %s", path);
		}
		return keys;
	}

	@Nullable
	String getValue(@Nullable String defaultValue);

	Map<String, Config> getChildren();

	default boolean hasValue() {
		return getValue(null) != null;
	}

	default boolean isEmpty() {
		return !hasValue() && getChildren().isEmpty();
	}

	default Config getChild(String path) {
		Config node = this;
		for (String key : keysOf(path)) {
			Config child = node.getChildren().get(key);
			if (child == null) return EMPTY;
			node = child;
		}
		return node;
	}

	default boolean hasChild(String path) {
		Config node = this;
		for (String key : keysOf(path)) {
			node = node.getChildren().get(key);
			if (node == null) return false;
		}
		return true;
	}

	default String get(String path) throws NoSuchElementException {
		String value = getChild(path).getValue(null);
		if (value == null) {
			throw new NoSuchElementException("No value at path '" + path + "'");
		}
		return value;
	}

	@Nullable
	default String get(String path, @Nullable String defaultValue) {
		return getChild(path).getValue(defaultValue);
	}

	default <T> T get(ConfigConverter<T> converter, String path) throws NoSuchElementException {
		return converter.get(getChild(path));
	}

	@Nullable
	default <T> T get(ConfigConverter<T> converter, String path, @Nullable T defaultValue) {
		return converter.get(getChild(path), defaultValue);
	}

	default Config with(String path, String value) {
		checkNotNull(value);
		return override(ConfigNode.at(keysOf(path), ConfigNode.ofValue(value)));
	}

	/**
	 * Merges {@code other} on top of this config: values of {@code other} win, children are merged recursively.
	 */
	default Config override(Config other) {
		return ConfigNode.merge(this, checkNotNull(other));
	}

	/**
	 * Flattens the tree into path/value pairs.
	 */
	default Map<String, String> toMap() {
		Map<String, String> result = new LinkedHashMap<>();
		ConfigNode.flatten("", this, result);
		return result;
	}

	static Config create() {
		return EMPTY;
	}

	static Config ofValue(String value) {
		return ConfigNode.ofValue(checkNotNull(value));
	}

	static Config ofMap(Map<String, String> map) {
		Config config = EMPTY;
		for (Map.Entry<String, String> entry : map.entrySet()) {
			config = config.with(entry.getKey(), entry.getValue());
		}
		return config;
	}

	static Config ofProperties(Properties properties) {
		Map<String, String> map = new TreeMap<>();
		for (String name : properties.stringPropertyNames()) {
			map.put(name, properties.getProperty(name));
		}
		return ofMap(map);
	}

	/**
	 * Loads a properties file. A missing optional file yields an empty config.
	 *
	 * @throws IllegalArgumentException if a required file can not be read
	 */
	static Config ofProperties(Path file, boolean optional) {
		Properties properties = new Properties();
		try (InputStream stream = Files.newInputStream(file)) {
			properties.load(stream);
		} catch (IOException e) {
			if (!optional) {
				throw new IllegalArgumentException("Could not read required config file " + file, e);
			}
			logger.warn("Config file {} is not readable, skipping", file);
			return EMPTY;
		}
		return ofProperties(properties);
	}

	static Config ofClassPathProperties(String resource, boolean optional) {
		Properties properties = new Properties();
		ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
		try (InputStream stream = classLoader.getResourceAsStream(resource)) {
			if (stream == null) {
				checkArgument(optional, "Required config resource %s not found", resource);
				logger.warn("Config resource {} not found, skipping", resource);
				return EMPTY;
			}
			properties.load(stream);
		} catch (IOException e) {
			if (!optional) {
				throw new IllegalArgumentException("Could not read required config resource " + resource, e);
			}
			logger.warn("Config resource {} is not readable, skipping", resource);
			return EMPTY;
		}
		return ofProperties(properties);
	}
}
