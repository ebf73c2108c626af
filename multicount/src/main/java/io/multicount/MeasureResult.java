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

import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Collections.unmodifiableMap;

/**
 * Decoded result of a single measure: either a count of rows where it holds,
 * or a histogram of the values it produced. A {@code null} value is a regular histogram key.
 */
public final class MeasureResult {
	private final long count;
	@Nullable
	private final Map<Object, Long> histogram;

	private MeasureResult(long count, @Nullable Map<Object, Long> histogram) {
		this.count = count;
		this.histogram = histogram;
	}

	public static MeasureResult ofCount(long count) {
		checkArgument(count >= 0, "Negative count %s", count);
		return new MeasureResult(count, null);
	}

	public static MeasureResult ofHistogram(Map<?, Long> histogram) {
		return new MeasureResult(0, unmodifiableMap(new LinkedHashMap<Object, Long>(histogram)));
	}

	public boolean isCount() {
		return histogram == null;
	}

	public boolean isHistogram() {
		return histogram != null;
	}

	public long getCount() {
		checkState(isCount(), "Histogram result: %s", this);
		return count;
	}

	public Map<Object, Long> getHistogram() {
		checkState(isHistogram(), "Count result: %s", this);
		return histogram;
	}

	/**
	 * Number of rows that produced {@code value}, zero if it was never observed.
	 */
	public long getCount(@Nullable Object value) {
		Long result = getHistogram().get(value);
		return result != null ? result : 0L;
	}

	public long getTotal() {
		if (isCount())
			return count;
		long total = 0;
		for (Long value : histogram.values()) {
			total += value;
		}
		return total;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		MeasureResult that = (MeasureResult) o;

		if (count != that.count) return false;
		return histogram != null ? histogram.equals(that.histogram) : that.histogram == null;
	}

	@Override
	public int hashCode() {
		int result = Long.hashCode(count);
		result = 31 * result + (histogram != null ? histogram.hashCode() : 0);
		return result;
	}

	@Override
	public String toString() {
		return isCount() ? Long.toString(count) : histogram.toString();
	}
}
