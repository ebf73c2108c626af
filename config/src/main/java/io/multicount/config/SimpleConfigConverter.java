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

import java.util.NoSuchElementException;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Converter of single string values. Values are trimmed before parsing.
 */
public final class SimpleConfigConverter<T> implements ConfigConverter<T> {
	private final Function<String, T> parser;

	private SimpleConfigConverter(Function<String, T> parser) {
		this.parser = parser;
	}

	public static <T> SimpleConfigConverter<T> of(Function<String, T> parser) {
		return new SimpleConfigConverter<>(checkNotNull(parser));
	}

	@Override
	public T get(Config config) {
		String value = config.getValue(null);
		if (value == null) {
			throw new NoSuchElementException("No value in config " + config.toMap());
		}
		return parse(value);
	}

	@Nullable
	@Override
	public T get(Config config, @Nullable T defaultValue) {
		String value = config.getValue(null);
		return value != null ? parse(value) : defaultValue;
	}

	private T parse(String value) {
		try {
			return parser.apply(value.trim());
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Malformed config value '" + value + "'", e);
		}
	}
}
