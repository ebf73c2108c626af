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

package io.multicount.expression;

import io.multicount.predicate.RecordPredicate;
import io.multicount.record.Record;
import org.jetbrains.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;
import static java.util.Collections.emptySet;
import static java.util.Collections.singleton;

public final class RecordExpressions {
	private RecordExpressions() {
	}

	public static final class ExpressionField implements RecordExpression {
		private final String field;

		private ExpressionField(String field) {
			this.field = field;
		}

		public String getField() {
			return field;
		}

		@Nullable
		@Override
		public Object evaluate(Record record) {
			return record.get(field);
		}

		@Override
		public Set<String> getFields() {
			return singleton(field);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			ExpressionField that = (ExpressionField) o;

			return field.equals(that.field);
		}

		@Override
		public int hashCode() {
			return field.hashCode();
		}

		@Override
		public String toString() {
			return field;
		}
	}

	public static final class ExpressionValue implements RecordExpression {
		@Nullable
		private final Object value;

		private ExpressionValue(@Nullable Object value) {
			this.value = value;
		}

		@Nullable
		public Object getValue() {
			return value;
		}

		@Nullable
		@Override
		public Object evaluate(Record record) {
			return value;
		}

		@Override
		public Set<String> getFields() {
			return emptySet();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			ExpressionValue that = (ExpressionValue) o;

			return Objects.equals(value, that.value);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(value);
		}

		@Override
		public String toString() {
			return value instanceof CharSequence ? "'" + value + "'" : String.valueOf(value);
		}
	}

	/**
	 * Boolean valued expression: {@code TRUE}, {@code FALSE} or {@code null} per record.
	 */
	public static final class ExpressionOfPredicate implements RecordExpression {
		private final RecordPredicate predicate;

		private ExpressionOfPredicate(RecordPredicate predicate) {
			this.predicate = predicate;
		}

		public RecordPredicate getPredicate() {
			return predicate;
		}

		@Nullable
		@Override
		public Boolean evaluate(Record record) {
			return predicate.test(record);
		}

		@Override
		public Set<String> getFields() {
			return predicate.getFields();
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;

			ExpressionOfPredicate that = (ExpressionOfPredicate) o;

			return predicate.equals(that.predicate);
		}

		@Override
		public int hashCode() {
			return predicate.hashCode();
		}

		@Override
		public String toString() {
			return "(" + predicate + ")";
		}
	}

	public static final class ExpressionMap implements RecordExpression {
		private final String name;
		private final RecordExpression expression;
		private final Function<Object, ?> function;

		private ExpressionMap(String name, RecordExpression expression, Function<Object, ?> function) {
			this.name = name;
			this.expression = expression;
			this.function = function;
		}

		@Nullable
		@Override
		public Object evaluate(Record record) {
			Object value = expression.evaluate(record);
			return value == null ? null : function.apply(value);
		}

		@Override
		public Set<String> getFields() {
			return expression.getFields();
		}

		@Override
		public String toString() {
			return name + "(" + expression + ")";
		}
	}

	public static final class ExpressionCoalesce implements RecordExpression {
		private final RecordExpression expression;
		private final Object defaultValue;

		private ExpressionCoalesce(RecordExpression expression, Object defaultValue) {
			this.expression = expression;
			this.defaultValue = defaultValue;
		}

		@Override
		public Object evaluate(Record record) {
			Object value = expression.evaluate(record);
			return value != null ? value : defaultValue;
		}

		@Override
		public Set<String> getFields() {
			return new LinkedHashSet<>(expression.getFields());
		}

		@Override
		public String toString() {
			return "COALESCE(" + expression + ", " + defaultValue + ")";
		}
	}

	public static RecordExpression field(String field) {
		return new ExpressionField(checkNotNull(field));
	}

	public static RecordExpression value(@Nullable Object value) {
		return new ExpressionValue(value);
	}

	public static RecordExpression ofPredicate(RecordPredicate predicate) {
		return new ExpressionOfPredicate(checkNotNull(predicate));
	}

	/**
	 * Applies {@code function} to non-null values of {@code expression}, null stays null.
	 * The {@code name} is only used for display.
	 */
	public static RecordExpression map(String name, RecordExpression expression, Function<Object, ?> function) {
		return new ExpressionMap(checkNotNull(name), checkNotNull(expression), checkNotNull(function));
	}

	public static RecordExpression coalesce(RecordExpression expression, Object defaultValue) {
		return new ExpressionCoalesce(checkNotNull(expression), checkNotNull(defaultValue));
	}
}
