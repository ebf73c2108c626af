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

import io.multicount.measure.ScopeResolver;
import io.multicount.predicate.RecordPredicate;
import io.multicount.record.Record;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Executes grouped scans over records held in memory. Scopes registered with
 * {@link #withScope(String, RecordPredicate)} are resolvable by name.
 */
public final class InMemoryScanExecutor implements ScanExecutor, ScopeResolver {
	private static final Logger logger = LoggerFactory.getLogger(InMemoryScanExecutor.class);

	private final Iterable<Record> records;
	private final Map<String, RecordPredicate> scopes = new LinkedHashMap<>();

	private InMemoryScanExecutor(Iterable<Record> records) {
		this.records = records;
	}

	public static InMemoryScanExecutor create(Iterable<Record> records) {
		return new InMemoryScanExecutor(checkNotNull(records));
	}

	public InMemoryScanExecutor withScope(String name, RecordPredicate predicate) {
		checkArgument(!scopes.containsKey(name), "Scope %s is already defined", name);
		scopes.put(name, checkNotNull(predicate));
		return this;
	}

	@Nullable
	@Override
	public RecordPredicate resolveScope(String name) {
		return scopes.get(name);
	}

	@Override
	public List<ScanRow> execute(ScanRequest request) throws ScanException {
		RecordPredicate predicate = simplify(request.getPredicate());
		List<ScanColumn> columns = request.getColumns();

		Map<List<Object>, long[]> groups = new LinkedHashMap<>();
		int scanned = 0;
		int matched = 0;
		for (Record record : records) {
			scanned++;
			if (!Boolean.TRUE.equals(test(predicate, record)))
				continue;
			matched++;
			List<Object> key = new ArrayList<>(columns.size());
			for (ScanColumn column : columns) {
				key.add(evaluate(column, record));
			}
			long[] count = groups.get(key);
			if (count == null) {
				groups.put(key, new long[]{1});
			} else {
				count[0]++;
			}
		}

		List<ScanRow> rows = new ArrayList<>(groups.size());
		for (Map.Entry<List<Object>, long[]> entry : groups.entrySet()) {
			rows.add(ScanRow.create(entry.getKey(), entry.getValue()[0]));
		}
		logger.trace("Scanned {} records, {} matched {}, {} distinct rows", scanned, matched, predicate, rows.size());
		return rows;
	}

	private static RecordPredicate simplify(RecordPredicate predicate) throws ScanException {
		try {
			return predicate.simplify();
		} catch (RuntimeException e) {
			throw new ScanException("Could not simplify filter " + predicate, e);
		}
	}

	@Nullable
	private static Boolean test(RecordPredicate predicate, Record record) throws ScanException {
		try {
			return predicate.test(record);
		} catch (RuntimeException e) {
			throw new ScanException("Could not evaluate filter " + predicate + " on " + record, e);
		}
	}

	@Nullable
	private static Object evaluate(ScanColumn column, Record record) throws ScanException {
		try {
			return column.getExpression().evaluate(record);
		} catch (RuntimeException e) {
			throw new ScanException("Could not evaluate column " + column + " on " + record, e);
		}
	}

	@Override
	public String toString() {
		return "InMemoryScanExecutor{scopes=" + scopes.keySet() + '}';
	}
}
