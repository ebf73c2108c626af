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
import io.multicount.measure.ResultShape;
import io.multicount.scan.ScanRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Collections.nCopies;
import static java.util.Collections.singletonList;

/**
 * Turns the rows of a single grouped scan back into one result per measure.
 * <p>
 * Every row carries one value per measure, and the group key last when grouping.
 * Each measure is marginalized independently: the row count is added to that measure's
 * value-to-count map, summing out all other columns. With {@code N} boolean measures
 * the scan may return up to {@code 2^N} rows per group, the decoder refuses more than
 * {@link #withMaxResultRows(int) maxResultRows}.
 */
public final class ResultDecoder {
	private static final Logger logger = LoggerFactory.getLogger(ResultDecoder.class);

	public static final int DEFAULT_MAX_RESULT_ROWS = 1 << 16;

	private final List<ResultShape> shapes;
	private final boolean grouped;
	private int maxResultRows = DEFAULT_MAX_RESULT_ROWS;

	private ResultDecoder(List<ResultShape> shapes, boolean grouped) {
		this.shapes = shapes;
		this.grouped = grouped;
	}

	public static ResultDecoder create(List<Measure> measures, boolean grouped) {
		List<ResultShape> shapes = new ArrayList<>(measures.size());
		for (Measure measure : measures) {
			shapes.add(measure.getShape());
		}
		return new ResultDecoder(shapes, grouped);
	}

	public static ResultDecoder ofShapes(List<ResultShape> shapes, boolean grouped) {
		return new ResultDecoder(new ArrayList<>(shapes), grouped);
	}

	public ResultDecoder withMaxResultRows(int maxResultRows) {
		checkArgument(maxResultRows > 0, "Max result rows must be positive");
		this.maxResultRows = maxResultRows;
		return this;
	}

	/**
	 * Decodes scan rows into per-group measure results. Without grouping the only key is {@code null}.
	 * An empty scan decodes as a single zero-count row with all values {@code null}.
	 */
	public Map<Object, List<MeasureResult>> decode(List<ScanRow> rows) throws CardinalityOverflowException {
		if (rows.size() > maxResultRows) {
			throw new CardinalityOverflowException(rows.size(), maxResultRows, shapes.size());
		}
		int width = shapes.size() + (grouped ? 1 : 0);
		if (rows.isEmpty()) {
			rows = singletonList(ScanRow.create(nCopies(width, null), 0));
		}

		Map<Object, List<Map<Object, Long>>> accumulators = new LinkedHashMap<>();
		for (ScanRow row : rows) {
			checkArgument(row.size() == width, "Expected %s values in row %s", width, row);
			Object groupKey = grouped ? row.getValue(width - 1) : null;
			List<Map<Object, Long>> accumulator = accumulators.get(groupKey);
			if (accumulator == null) {
				accumulator = new ArrayList<>(shapes.size());
				for (int i = 0; i < shapes.size(); i++) {
					accumulator.add(new LinkedHashMap<>());
				}
				accumulators.put(groupKey, accumulator);
			}
			for (int i = 0; i < shapes.size(); i++) {
				accumulator.get(i).merge(row.getValue(i), row.getCount(), Long::sum);
			}
		}

		Map<Object, List<MeasureResult>> result = new LinkedHashMap<>();
		for (Map.Entry<Object, List<Map<Object, Long>>> entry : accumulators.entrySet()) {
			List<MeasureResult> results = new ArrayList<>(shapes.size());
			for (int i = 0; i < shapes.size(); i++) {
				results.add(collapse(entry.getValue().get(i), shapes.get(i)));
			}
			result.put(entry.getKey(), results);
		}
		logger.trace("Decoded {} rows into {} groups of {} measures", rows.size(), result.size(), shapes.size());
		return result;
	}

	/**
	 * Reduces one measure's value-to-count map to its reported form.
	 * <p>
	 * {@link ResultShape#AUTO} reports a count when all keys are {@code TRUE}, {@code FALSE} or {@code null}.
	 * Such a measure can not be told apart from an expression that only happened to produce boolean-like
	 * values, so an expression that matched nothing is reported as {@code 0} rather than an empty histogram;
	 * use {@link ResultShape#HISTOGRAM} where that matters.
	 */
	static MeasureResult collapse(Map<Object, Long> counts, ResultShape shape) {
		switch (shape) {
			case COUNT:
				return MeasureResult.ofCount(trueCount(counts));
			case HISTOGRAM:
				Map<Object, Long> histogram = new LinkedHashMap<>();
				for (Map.Entry<Object, Long> entry : counts.entrySet()) {
					if (entry.getValue() != 0) {
						histogram.put(entry.getKey(), entry.getValue());
					}
				}
				return MeasureResult.ofHistogram(histogram);
			case AUTO:
				return isBooleanLike(counts.keySet()) ?
						MeasureResult.ofCount(trueCount(counts)) :
						MeasureResult.ofHistogram(counts);
			default:
				throw new IllegalArgumentException("Unknown result shape " + shape);
		}
	}

	static boolean isBooleanLike(Set<Object> values) {
		for (Object value : values) {
			if (value != null && !(value instanceof Boolean))
				return false;
		}
		return true;
	}

	private static long trueCount(Map<Object, Long> counts) {
		Long count = counts.get(Boolean.TRUE);
		return count != null ? count : 0L;
	}
}
