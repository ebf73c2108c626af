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
import io.multicount.predicate.RecordPredicate;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * One named thing to count: a filter, a value expression or a named scope.
 * Instances are created with {@link Measures}.
 */
public final class Measure {
	@Nullable
	private final String name;
	private final MeasureKind kind;
	private final Object definition;
	private final ResultShape shape;

	Measure(@Nullable String name, MeasureKind kind, Object definition, ResultShape shape) {
		this.name = name;
		this.kind = checkNotNull(kind);
		this.definition = checkNotNull(definition);
		this.shape = checkNotNull(shape);
	}

	public Measure withName(String name) {
		checkArgument(!name.isEmpty(), "Empty measure name");
		return new Measure(name, kind, definition, shape);
	}

	public Measure withShape(ResultShape shape) {
		checkArgument(kind == MeasureKind.EXPRESSION || shape != ResultShape.HISTOGRAM,
				"Only expression measures can be reported as histograms");
		return new Measure(name, kind, definition, shape);
	}

	@Nullable
	public String getName() {
		return name;
	}

	public MeasureKind getKind() {
		return kind;
	}

	public ResultShape getShape() {
		return shape;
	}

	public RecordPredicate getPredicate() {
		checkState(kind == MeasureKind.BOOLEAN, "Not a boolean measure: %s", this);
		return (RecordPredicate) definition;
	}

	public RecordExpression getExpression() {
		checkState(kind == MeasureKind.EXPRESSION, "Not an expression measure: %s", this);
		return (RecordExpression) definition;
	}

	public String getScope() {
		checkState(kind == MeasureKind.SCOPE, "Not a scope measure: %s", this);
		return (String) definition;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Measure that = (Measure) o;

		if (!Objects.equals(name, that.name)) return false;
		if (kind != that.kind) return false;
		if (shape != that.shape) return false;
		return definition.equals(that.definition);
	}

	@Override
	public int hashCode() {
		int result = Objects.hashCode(name);
		result = 31 * result + kind.hashCode();
		result = 31 * result + definition.hashCode();
		result = 31 * result + shape.hashCode();
		return result;
	}

	@Override
	public String toString() {
		return (name != null ? name + ": " : "") + kind + " " + definition;
	}
}
