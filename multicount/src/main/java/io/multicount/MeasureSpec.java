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

import io.multicount.measure.Measure;

import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * Caller supplied measures together with the shape their results come back in:
 * positional measures give a list in the same order, named measures give a map in key order.
 *
 * @param <R> type of the per-measure result structure
 */
public abstract class MeasureSpec<R> {
	private final List<Measure> measures;

	private MeasureSpec(List<Measure> measures) {
		this.measures = unmodifiableList(measures);
	}

	public final List<Measure> getMeasures() {
		return measures;
	}

	public final int size() {
		return measures.size();
	}

	/**
	 * Arranges decoded results, one per measure in {@link #getMeasures()} order, into the caller's shape.
	 */
	public abstract R toResult(List<MeasureResult> results);

	private static final class Positional extends MeasureSpec<List<MeasureResult>> {
		private Positional(List<Measure> measures) {
			super(measures);
		}

		@Override
		public List<MeasureResult> toResult(List<MeasureResult> results) {
			checkArgument(results.size() == size(), "Expected %s results, got %s", size(), results.size());
			return unmodifiableList(new ArrayList<>(results));
		}

		@Override
		public String toString() {
			return "Positional" + getMeasures();
		}
	}

	private static final class Named extends MeasureSpec<Map<String, MeasureResult>> {
		private final List<String> keys;

		private Named(List<String> keys, List<Measure> measures) {
			super(measures);
			this.keys = unmodifiableList(keys);
		}

		@Override
		public Map<String, MeasureResult> toResult(List<MeasureResult> results) {
			checkArgument(results.size() == size(), "Expected %s results, got %s", size(), results.size());
			Map<String, MeasureResult> map = new LinkedHashMap<>();
			for (int i = 0; i < keys.size(); i++) {
				map.put(keys.get(i), results.get(i));
			}
			return unmodifiableMap(map);
		}

		@Override
		public String toString() {
			return "Named" + keys;
		}
	}

	public static MeasureSpec<List<MeasureResult>> positional(List<Measure> measures) {
		List<Measure> list = new ArrayList<>(measures.size());
		for (Measure measure : measures) {
			list.add(checkNotNull(measure, "Null measure in %s", measures));
		}
		return new Positional(list);
	}

	public static MeasureSpec<List<MeasureResult>> positional(Measure... measures) {
		return positional(Arrays.asList(measures));
	}

	/**
	 * Named measures keyed by {@code String.valueOf(key)}, iteration order of the map is kept.
	 *
	 * @throws KeyCollisionException if two keys normalize to the same name
	 */
	public static MeasureSpec<Map<String, MeasureResult>> named(Map<?, Measure> measures) {
		Map<String, Object> originalKeys = new HashMap<>();
		List<String> keys = new ArrayList<>(measures.size());
		List<Measure> list = new ArrayList<>(measures.size());
		for (Map.Entry<?, Measure> entry : measures.entrySet()) {
			Object originalKey = checkNotNull(entry.getKey(), "Null measure key");
			String key = String.valueOf(originalKey);
			Object previous = originalKeys.put(key, originalKey);
			if (previous != null) {
				throw new KeyCollisionException(key, previous, originalKey);
			}
			keys.add(key);
			list.add(checkNotNull(entry.getValue(), "Null measure for key %s", key));
		}
		return new Named(keys, list);
	}

	/**
	 * Named measures keyed by their own {@link Measure#getName() names}.
	 *
	 * @throws KeyCollisionException if two measures share a name
	 */
	public static MeasureSpec<Map<String, MeasureResult>> named(List<Measure> measures) {
		Map<String, Measure> map = new LinkedHashMap<>();
		for (Measure measure : measures) {
			String name = measure.getName();
			checkArgument(name != null, "Measure %s has no name", measure);
			Measure previous = map.put(name, measure);
			if (previous != null) {
				throw new KeyCollisionException(name, previous, measure);
			}
		}
		return named(map);
	}

	public static MeasureSpec<Map<String, MeasureResult>> named(Measure... measures) {
		return named(Arrays.asList(measures));
	}
}
