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

package io.multicount.scan;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableList;

/**
 * One result row of a grouped scan: the column values in request order and the number of
 * source rows sharing them.
 */
public final class ScanRow {
	private final List<Object> values;
	private final long count;

	private ScanRow(List<Object> values, long count) {
		this.values = values;
		this.count = count;
	}

	public static ScanRow create(List<?> values, long count) {
		checkArgument(count >= 0, "Negative row count %s", count);
		return new ScanRow(unmodifiableList(new ArrayList<>(values)), count);
	}

	public static ScanRow of(long count, Object... values) {
		return create(Arrays.asList(values), count);
	}

	public List<Object> getValues() {
		return values;
	}

	@Nullable
	public Object getValue(int index) {
		return values.get(index);
	}

	public int size() {
		return values.size();
	}

	public long getCount() {
		return count;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ScanRow that = (ScanRow) o;

		if (count != that.count) return false;
		return values.equals(that.values);
	}

	@Override
	public int hashCode() {
		int result = values.hashCode();
		result = 31 * result + Long.hashCode(count);
		return result;
	}

	@Override
	public String toString() {
		return values + "=" + count;
	}
}
