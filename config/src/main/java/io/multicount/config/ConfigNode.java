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

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyMap;
import static java.util.Collections.singletonMap;
import static java.util.Collections.unmodifiableMap;

final class ConfigNode implements Config {
	@Nullable
	private final String value;
	private final Map<String, Config> children;

	private ConfigNode(@Nullable String value, Map<String, Config> children) {
		this.value = value;
		this.children = children;
	}

	static ConfigNode empty() {
		return new ConfigNode(null, emptyMap());
	}

	static ConfigNode ofValue(String value) {
		return new ConfigNode(value, emptyMap());
	}

	/**
	 * Wraps {@code leaf} into parents so that it is reachable by {@code keys}.
	 */
	static Config at(List<String> keys, Config leaf) {
		Config node = leaf;
		for (int i = keys.size() - 1; i >= 0; i--) {
			node = new ConfigNode(null, singletonMap(keys.get(i), node));
		}
		return node;
	}

	static Config merge(Config base, Config top) {
		if (top.isEmpty()) return base;
		if (base.isEmpty()) return top;
		Map<String, Config> children = new LinkedHashMap<>(base.getChildren());
		for (Map.Entry<String, Config> entry : top.getChildren().entrySet()) {
			children.merge(entry.getKey(), entry.getValue(), ConfigNode::merge);
		}
		return new ConfigNode(top.getValue(base.getValue(null)), unmodifiableMap(children));
	}

	static void flatten(String prefix, Config config, Map<String, String> target) {
		String value = config.getValue(null);
		if (value != null) {
			target.put(prefix, value);
		}
		for (Map.Entry<String, Config> entry : config.getChildren().entrySet()) {
			String path = prefix.isEmpty() ? entry.getKey() : prefix + DELIMITER + entry.getKey();
			flatten(path, entry.getValue(), target);
		}
	}

	@Nullable
	@Override
	public String getValue(@Nullable String defaultValue) {
		return value != null ? value : defaultValue;
	}

	@Override
	public Map<String, Config> getChildren() {
		return children;
	}

	@Override
	public String toString() {
		return toMap().toString();
	}
}
