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

import com.google.common.base.Joiner;
import io.multicount.predicate.RecordPredicate;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Collections.unmodifiableList;

/**
 * A single grouped scan: rows matching the predicate are partitioned by the values of all columns,
 * the executor returns one {@link ScanRow} per distinct combination with its row count.
 * The group key column, if any, is always the last one.
 */
public final class ScanRequest {
	public static final String ROW_COUNT_COLUMN = "row_count";
	private static final Joiner JOINER = Joiner.on(", ");

	private final RecordPredicate predicate;
	private final List<ScanColumn> columns;

	private ScanRequest(RecordPredicate predicate, List<ScanColumn> columns) {
		this.predicate = predicate;
		this.columns = columns;
	}

	public static ScanRequest create(RecordPredicate predicate, List<ScanColumn> columns) {
		checkNotNull(predicate);
		for (int i = 0; i < columns.size(); i++) {
			checkArgument(!columns.get(i).isGroupKey() || i == columns.size() - 1,
					"Group key column must be the last one: %s", columns);
		}
		return new ScanRequest(predicate, unmodifiableList(new ArrayList<>(columns)));
	}

	public RecordPredicate getPredicate() {
		return predicate;
	}

	public List<ScanColumn> getColumns() {
		return columns;
	}

	public List<ScanColumn> getMeasureColumns() {
		return isGrouped() ? columns.subList(0, columns.size() - 1) : columns;
	}

	public boolean isGrouped() {
		return !columns.isEmpty() && columns.get(columns.size() - 1).isGroupKey();
	}

	@Nullable
	public ScanColumn getGroupKeyColumn() {
		return isGrouped() ? columns.get(columns.size() - 1) : null;
	}

	public String getRowCountColumn() {
		return ROW_COUNT_COLUMN;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ScanRequest that = (ScanRequest) o;

		if (!predicate.equals(that.predicate)) return false;
		return columns.equals(that.columns);
	}

	@Override
	public int hashCode() {
		int result = predicate.hashCode();
		result = 31 * result + columns.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return "SELECT " + JOINER.join(columns) + ", COUNT(*) AS " + ROW_COUNT_COLUMN +
				" WHERE " + predicate +
				" GROUP BY " + columns.size() + " columns";
	}
}
