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

import java.util.function.Function;

public final class ConfigConverters {
	private static final SimpleConfigConverter<String> STRING = SimpleConfigConverter.of(Function.identity());
	private static final SimpleConfigConverter<Integer> INTEGER = SimpleConfigConverter.of(Integer::valueOf);
	private static final SimpleConfigConverter<Long> LONG = SimpleConfigConverter.of(Long::valueOf);
	private static final SimpleConfigConverter<Boolean> BOOLEAN = SimpleConfigConverter.of(ConfigConverters::parseBoolean);

	private ConfigConverters() {
	}

	public static SimpleConfigConverter<String> ofString() {
		return STRING;
	}

	public static SimpleConfigConverter<Integer> ofInteger() {
		return INTEGER;
	}

	public static SimpleConfigConverter<Long> ofLong() {
		return LONG;
	}

	/**
	 * Accepts {@code true} and {@code false} in any case, anything else is an error.
	 */
	public static SimpleConfigConverter<Boolean> ofBoolean() {
		return BOOLEAN;
	}

	private static Boolean parseBoolean(String string) {
		if ("true".equalsIgnoreCase(string)) return Boolean.TRUE;
		if ("false".equalsIgnoreCase(string)) return Boolean.FALSE;
		throw new IllegalArgumentException("Not a boolean: " + string);
	}
}
