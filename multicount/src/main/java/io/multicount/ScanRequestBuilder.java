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

import io.multicount.expression.RecordExpression;
import io.multicount.measure.Measure;
import io.multicount.measure.ScopeResolver;
import io.multicount.predicate.RecordPredicate;
import io.multicount.scan.ScanColumn;
import io.multicount.scan.ScanRequest;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static io.multicount.expression.RecordExpressions.ofPredicate;

/**
 * Composes a single grouped scan out of independent measures.
 * <p>
 * Column aliases depend only on the measure position ({@code measure_0}, {@code measure_1}, ...),
 * so measures with similar definitions always land in distinct columns.
 */
public final class ScanRequestBuilder {
	private static final Logger logger = LoggerFactory.getLogger(ScanRequestBuilder.class);

	public static final String MEASURE_ALIAS_PREFIX = "measure_";
	public static final String GROUP_KEY_ALIAS = "group_key";

	private final ScopeResolver scopeResolver;

	private ScanRequestBuilder(ScopeResolver scopeResolver) {
		this.scopeResolver = scopeResolver;
	}

	public static ScanRequestBuilder create() {
		return new ScanRequestBuilder(ScopeResolver.NONE);
	}

	public static ScanRequestBuilder create(ScopeResolver scopeResolver) {
		return new ScanRequestBuilder(checkNotNull(scopeResolver));
	}

	public static String measureAlias(int position) {
		return MEASURE_ALIAS_PREFIX + position;
	}

	public ScanRequest build(List<Measure> measures, RecordPredicate predicate, @Nullable RecordExpression groupBy)
			throws MalformedMeasureException {
		List<ScanColumn> columns = new ArrayList<>(measures.size() + 1);
		for (int i = 0; i < measures.size(); i++) {
			columns.add(ScanColumn.measure(measureAlias(i), toExpression(i, measures.get(i))));
		}
		if (groupBy != null) {
			columns.add(ScanColumn.groupKey(GROUP_KEY_ALIAS, groupBy));
		}
		ScanRequest request = ScanRequest.create(predicate, columns);
		logger.debug("Built scan request for {} measures: {}", measures.size(), request);
		return request;
	}

	RecordExpression toExpression(int position, Measure measure) throws MalformedMeasureException {
		switch (measure.getKind()) {
			case BOOLEAN:
				return ofPredicate(measure.getPredicate());
			case EXPRESSION:
				return measure.getExpression();
			case SCOPE:
				RecordPredicate scope = scopeResolver.resolveScope(measure.getScope());
				if (scope == null) {
					throw new MalformedMeasureException(position, measure, "unknown scope '" + measure.getScope() + "'");
				}
				return ofPredicate(scope);
			default:
				throw new MalformedMeasureException(position, measure, "unsupported kind " + measure.getKind());
		}
	}
}
