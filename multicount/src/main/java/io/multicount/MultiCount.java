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

import io.multicount.config.Config;
import io.multicount.expression.RecordExpression;
import io.multicount.measure.Measure;
import io.multicount.measure.ScopeResolver;
import io.multicount.predicate.RecordPredicate;
import io.multicount.scan.ScanExecutor;
import io.multicount.scan.ScanRequest;
import io.multicount.scan.ScanRow;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static io.multicount.config.ConfigConverters.ofInteger;
import static java.util.Collections.unmodifiableMap;

/**
 * Counts several independent measures over the same rows with a single grouped scan.
 * <p>
 * Boolean measures come back as the number of rows where they hold, expression measures
 * as a histogram of their values. Positional measures give a list of results, named
 * measures a map, and a group key adds one more level keyed by its values:
 * <pre>{@code
 * MultiCount multiCount = MultiCount.create(executor);
 * Map<String, MeasureResult> counts = multiCount.count(eq("store", 7), MeasureSpec.named(
 *         bool("sold_out", eq("status", "sold_out")),
 *         field("mfg")));
 * }</pre>
 * Configure an instance before sharing it, counting calls keep no state between invocations.
 */
public final class MultiCount {
	private static final Logger logger = LoggerFactory.getLogger(MultiCount.class);

	public static final int DEFAULT_WARN_MEASURES = 10;

	private final ScanExecutor executor;
	private ScopeResolver scopeResolver;
	private int maxResultRows = ResultDecoder.DEFAULT_MAX_RESULT_ROWS;
	private int warnMeasures = DEFAULT_WARN_MEASURES;

	private MultiCount(ScanExecutor executor, ScopeResolver scopeResolver) {
		this.executor = executor;
		this.scopeResolver = scopeResolver;
	}

	/**
	 * Creates a multi-count over the given executor. If the executor also resolves scopes,
	 * it is used as the scope resolver.
	 */
	public static MultiCount create(ScanExecutor executor) {
		checkNotNull(executor);
		return new MultiCount(executor, executor instanceof ScopeResolver ? (ScopeResolver) executor : ScopeResolver.NONE);
	}

	public MultiCount withScopeResolver(ScopeResolver scopeResolver) {
		this.scopeResolver = checkNotNull(scopeResolver);
		return this;
	}

	public MultiCount withMaxResultRows(int maxResultRows) {
		checkArgument(maxResultRows > 0, "Max result rows must be positive");
		this.maxResultRows = maxResultRows;
		return this;
	}

	public MultiCount withWarnMeasures(int warnMeasures) {
		this.warnMeasures = warnMeasures;
		return this;
	}

	public MultiCount withConfig(Config config) {
		return withMaxResultRows(config.get(ofInteger(), "maxResultRows", maxResultRows))
				.withWarnMeasures(config.get(ofInteger(), "warnMeasures", warnMeasures));
	}

	public int getMaxResultRows() {
		return maxResultRows;
	}

	public int getWarnMeasures() {
		return warnMeasures;
	}

	// region counting
	public <R> R count(RecordPredicate predicate, MeasureSpec<R> spec) throws MultiCountException {
		Map<Object, List<MeasureResult>> decoded = execute(predicate, null, spec.getMeasures());
		return spec.toResult(decoded.get(null));
	}

	public <R> Map<Object, R> countGrouped(RecordPredicate predicate, RecordExpression groupBy, MeasureSpec<R> spec)
			throws MultiCountException {
		checkNotNull(groupBy);
		Map<Object, List<MeasureResult>> decoded = execute(predicate, groupBy, spec.getMeasures());
		Map<Object, R> result = new LinkedHashMap<>();
		for (Map.Entry<Object, List<MeasureResult>> entry : decoded.entrySet()) {
			result.put(entry.getKey(), spec.toResult(entry.getValue()));
		}
		return unmodifiableMap(result);
	}

	public List<MeasureResult> count(RecordPredicate predicate, Measure... measures) throws MultiCountException {
		return count(predicate, MeasureSpec.positional(measures));
	}

	public List<MeasureResult> count(RecordPredicate predicate, List<Measure> measures) throws MultiCountException {
		return count(predicate, MeasureSpec.positional(measures));
	}

	public Map<String, MeasureResult> count(RecordPredicate predicate, Map<?, Measure> measures) throws MultiCountException {
		return count(predicate, MeasureSpec.named(measures));
	}

	public Map<Object, List<MeasureResult>> countGrouped(RecordPredicate predicate, RecordExpression groupBy,
			List<Measure> measures) throws MultiCountException {
		return countGrouped(predicate, groupBy, MeasureSpec.positional(measures));
	}

	public Map<Object, Map<String, MeasureResult>> countGrouped(RecordPredicate predicate, RecordExpression groupBy,
			Map<?, Measure> measures) throws MultiCountException {
		return countGrouped(predicate, groupBy, MeasureSpec.named(measures));
	}
	// endregion

	private Map<Object, List<MeasureResult>> execute(RecordPredicate predicate, @Nullable RecordExpression groupBy,
			List<Measure> measures) throws MultiCountException {
		checkNotNull(predicate);
		if (measures.size() > warnMeasures) {
			logger.warn("{} measures in a single scan, result rows grow with every combination of their values",
					measures.size());
		}

		ScanRequest request = ScanRequestBuilder.create(scopeResolver).build(measures, predicate, groupBy);
		List<ScanRow> rows = executor.execute(request);
		logger.debug("Scan returned {} rows for {} measures", rows.size(), measures.size());

		return ResultDecoder.create(measures, groupBy != null)
				.withMaxResultRows(maxResultRows)
				.decode(rows);
	}

	@Override
	public String toString() {
		return "MultiCount{" +
				"executor=" + executor +
				", maxResultRows=" + maxResultRows +
				'}';
	}
}
