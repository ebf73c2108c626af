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

package io.multicount.record;

import com.google.common.base.Joiner;
import org.jetbrains.annotations.Nullable;

import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableMap;

public final class Records {
	private static final Joiner.MapJoiner JOINER = Joiner.on(", ").withKeyValueSeparator("=").useForNull("null");

	private Records() {
	}

	private static final class MapRecord implements Record {
		private final Map<String, Object> values;

		private MapRecord(Map<String, Object> values) {
			this.values = values;
		}

		@Nullable
		@Override
		public Object get(String field) {
			return values.get(field);
		}

		@Override
		public Set<String> getFields() {
			return values.keySet();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			MapRecord that = (MapRecord) o;

			return values.equals(that.values);
		}

		@Override
		public int hashCode() {
			return values.hashCode();
		}

		@Override
		public String toString() {
			return "{" + JOINER.join(values) + "}";
		}
	}

	public static Record ofMap(Map<String, ?> values) {
		return new MapRecord(unmodifiableMap(new LinkedHashMap<>(values)));
	}

	/**
	 * Creates a record from alternating field names and values, {@code of("status", "sold_out", "mfg", 1)}.
	 */
	public static Record of(Object... fieldsAndValues) {
		checkArgument(fieldsAndValues.length % 2 == 0, "Odd number of arguments: %s", fieldsAndValues.length);
		Map<String, Object> values = new LinkedHashMap<>();
		for (int i = 0; i < fieldsAndValues.length; i += 2) {
			checkArgument(fieldsAndValues[i] instanceof String, "Field name expected at position %s", i);
			values.put((String) fieldsAndValues[i], fieldsAndValues[i + 1]);
		}
		return new MapRecord(unmodifiableMap(values));
	}

	public static List<Record> ofMaps(List<? extends Map<String, ?>> maps) {
		List<Record> records = new ArrayList<>(maps.size());
		for (Map<String, ?> map : maps) {
			records.add(ofMap(map));
		}
		return records;
	}
}
