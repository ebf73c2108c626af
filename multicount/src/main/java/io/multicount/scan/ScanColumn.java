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

import io.multicount.expression.RecordExpression;

import static com.google.common.base.Preconditions.checkNotNull;

public final class ScanColumn {
	private final String alias;
	private final RecordExpression expression;
	private final boolean groupKey;

	private ScanColumn(String alias, RecordExpression expression, boolean groupKey) {
		this.alias = checkNotNull(alias);
		this.expression = checkNotNull(expression);
		this.groupKey = groupKey;
	}

	public static ScanColumn measure(String alias, RecordExpression expression) {
		return new ScanColumn(alias, expression, false);
	}

	public static ScanColumn groupKey(String alias, RecordExpression expression) {
		return new ScanColumn(alias, expression, true);
	}

	public String getAlias() {
		return alias;
	}

	public RecordExpression getExpression() {
		return expression;
	}

	public boolean isGroupKey() {
		return groupKey;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		ScanColumn that = (ScanColumn) o;

		if (groupKey != that.groupKey) return false;
		if (!alias.equals(that.alias)) return false;
		return expression.equals(that.expression);
	}

	@Override
	public int hashCode() {
		int result = alias.hashCode();
		result = 31 * result + expression.hashCode();
		result = 31 * result + (groupKey ? 1 : 0);
		return result;
	}

	@Override
	public String toString() {
		return expression + " AS " + alias;
	}
}
