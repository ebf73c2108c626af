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

package io.multicount;

/**
 * Thrown when two keys of named measures normalize to the same name.
 */
public final class KeyCollisionException extends IllegalArgumentException {
	private final String key;

	public KeyCollisionException(String key, Object first, Object second) {
		super("Measure keys " + describe(first) + " and " + describe(second) + " both normalize to '" + key + "'");
		this.key = key;
	}

	private static String describe(Object key) {
		return key.getClass().getSimpleName() + " " + key;
	}

	public String getKey() {
		return key;
	}
}
