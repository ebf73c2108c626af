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

package io.multicount.measure;

import io.multicount.expression.RecordExpression;
import io.multicount.expression.RecordExpressions;
import io.multicount.predicate.RecordPredicate;

import static com.google.common.base.Preconditions.checkArgument;

public class Measures {
	private Measures() {
	}

	public static Measure bool(RecordPredicate predicate) {
		return new Measure(null, MeasureKind.BOOLEAN, predicate, ResultShape.COUNT);
	}

	public static Measure bool(String name, RecordPredicate predicate) {
		return bool(predicate).withName(name);
	}

	public static Measure expression(RecordExpression expression) {
		return new Measure(null, MeasureKind.EXPRESSION, expression, ResultShape.AUTO);
	}

	public static Measure expression(String name, RecordExpression expression) {
		return expression(expression).withName(name);
	}

	/**
	 * Tabulates the values of a single field, {@code expression(field(name))} named after the field.
	 */
	public static Measure field(String field) {
		return expression(RecordExpressions.field(field)).withName(field);
	}

	public static Measure histogram(RecordExpression expression) {
		return new Measure(null, MeasureKind.EXPRESSION, expression, ResultShape.HISTOGRAM);
	}

	public static Measure histogram(String field) {
		return histogram(RecordExpressions.field(field)).withName(field);
	}

	public static Measure scope(String scope) {
		checkArgument(!scope.isEmpty(), "Empty scope name");
		return new Measure(null, MeasureKind.SCOPE, scope, ResultShape.COUNT).withName(scope);
	}
}
