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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.google.common.collect.ImmutableMap;
import io.multicount.config.Config;
import io.multicount.expression.RecordExpressions;
import io.multicount.measure.Measure;
import io.multicount.predicate.RecordPredicate;
import io.multicount.record.Record;
import io.multicount.scan.InMemoryScanExecutor;
import io.multicount.scan.ScanException;
import io.multicount.scan.ScanExecutor;
import org.junit.Before;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static io.multicount.measure.Measures.*;
import static io.multicount.predicate.RecordPredicates.*;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public class MultiCountTest {
	private List<Record> records;
	private List<Measure> measures;

	@Before
	public void before() {
		records = TestRecords.randomProducts(200, 42);
		measures = asList(
				bool(eq("status", "sold_out")),
				bool(between("price", 10, 49)),
				histogram("region"),
				histogram("mfg"),
				bool(isNull("status")),
				bool(and(eq("on_sale", true), in("mfg", 1, 2))));
	}

	@Test
	public void testProductsScenario() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(TestRecords.products()));
		Map<String, Measure> spec = new LinkedHashMap<>();
		spec.put("sold_out", bool(eq("sold_out", true)));
		spec.put("mfg", field("mfg"));

		Map<String, MeasureResult> result = multiCount.count(alwaysTrue(), spec);

		assertEquals(asList("sold_out", "mfg"), new ArrayList<>(result.keySet()));
		assertEquals(MeasureResult.ofCount(2), result.get("sold_out"));
		assertEquals(MeasureResult.ofHistogram(ImmutableMap.of(1, 2L, 2, 1L)), result.get("mfg"));
	}

	@Test
	public void testSameAsSeparateScans() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		RecordPredicate base = notEq("region", "west");

		List<MeasureResult> combined = multiCount.count(base, measures);

		assertEquals(measures.size(), combined.size());
		for (int i = 0; i < measures.size(); i++) {
			assertEquals(measures.get(i).toString(), multiCount.count(base, measures.get(i)).get(0), combined.get(i));
		}

		long soldOut = 0;
		for (Record record : records) {
			if (!"west".equals(record.get("region")) && "sold_out".equals(record.get("status"))) soldOut++;
		}
		assertEquals(soldOut, combined.get(0).getCount());
	}

	@Test
	public void testSingleScanPerCall() throws MultiCountException {
		InMemoryScanExecutor delegate = InMemoryScanExecutor.create(records);
		AtomicInteger scans = new AtomicInteger();
		ScanExecutor executor = request -> {
			scans.incrementAndGet();
			return delegate.execute(request);
		};
		MultiCount multiCount = MultiCount.create(executor);

		multiCount.count(alwaysTrue(), measures);
		assertEquals(1, scans.get());
		multiCount.countGrouped(alwaysTrue(), RecordExpressions.field("region"), measures);
		assertEquals(2, scans.get());
	}

	@Test
	public void testNothingMatches() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		List<Measure> measures = asList(bool(eq("status", "sold_out")), histogram("mfg"), field("mfg"));
		List<MeasureResult> expected = asList(
				MeasureResult.ofCount(0), MeasureResult.ofHistogram(Collections.<Object, Long>emptyMap()), MeasureResult.ofCount(0));

		assertEquals(expected, multiCount.count(alwaysFalse(), measures));

		Map<Object, List<MeasureResult>> grouped = multiCount.countGrouped(alwaysFalse(), RecordExpressions.field("region"), measures);
		assertEquals(Collections.singletonMap(null, expected), grouped);
	}

	@Test
	public void testEmptySource() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(Collections.<Record>emptyList()));

		Map<String, MeasureResult> result = multiCount.count(alwaysTrue(),
				MeasureSpec.named(bool("sold_out", eq("status", "sold_out")), histogram("region")));

		assertEquals(MeasureResult.ofCount(0), result.get("sold_out"));
		assertTrue(result.get("region").getHistogram().isEmpty());
	}

	@Test
	public void testPositionalOrder() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		List<Measure> reversed = new ArrayList<>(measures);
		Collections.reverse(reversed);

		List<MeasureResult> forward = multiCount.count(alwaysTrue(), measures);
		List<MeasureResult> backward = new ArrayList<>(multiCount.count(alwaysTrue(), reversed));
		Collections.reverse(backward);

		assertEquals(forward, backward);
	}

	@Test
	public void testIdenticalFiltersGetIndependentColumns() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));

		List<MeasureResult> result = multiCount.count(alwaysTrue(),
				bool(eq("status", "sold_out")), bool(eq("status", "sold_out")), bool(eq("status", "sold_out ")));

		assertEquals(result.get(0), result.get(1));
		assertTrue(result.get(0).getCount() > 0);
		assertEquals(MeasureResult.ofCount(0), result.get(2));
	}

	@Test
	public void testFilterAndNarrowerFilter() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		RecordPredicate soldOut = eq("status", "sold_out");
		RecordPredicate soldOutWest = and(eq("status", "sold_out"), eq("region", "west"));

		List<MeasureResult> result = multiCount.count(alwaysTrue(), bool(soldOut), bool(soldOutWest));

		long soldOutCount = 0;
		long soldOutWestCount = 0;
		for (Record record : records) {
			if (!"sold_out".equals(record.get("status"))) continue;
			soldOutCount++;
			if ("west".equals(record.get("region"))) soldOutWestCount++;
		}
		assertEquals(MeasureResult.ofCount(soldOutCount), result.get(0));
		assertEquals(MeasureResult.ofCount(soldOutWestCount), result.get(1));
		assertTrue(soldOutWestCount < soldOutCount);
		assertEquals(multiCount.count(alwaysTrue(), bool(soldOutWest)), asList(result.get(1)));
	}

	@Test
	public void testWideRequestWarning() throws MultiCountException {
		Logger logger = (Logger) LoggerFactory.getLogger(MultiCount.class);
		ListAppender<ILoggingEvent> appender = new ListAppender<>();
		appender.start();
		logger.addAppender(appender);
		try {
			MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records)).withWarnMeasures(2);

			multiCount.count(alwaysTrue(), histogram("region"), bool(isNull("status")));
			assertTrue(warnings(appender).isEmpty());

			multiCount.count(alwaysTrue(), histogram("region"), histogram("mfg"), field("status"));
			List<String> warnings = warnings(appender);
			assertEquals(1, warnings.size());
			assertTrue(warnings.get(0), warnings.get(0).startsWith("3 measures"));
		} finally {
			logger.detachAppender(appender);
		}
	}

	private static List<String> warnings(ListAppender<ILoggingEvent> appender) {
		List<String> warnings = new ArrayList<>();
		for (ILoggingEvent event : appender.list) {
			if (event.getLevel() == Level.WARN) {
				warnings.add(event.getFormattedMessage());
			}
		}
		return warnings;
	}

	@Test
	public void testCrossTabSumsToTotal() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		RecordPredicate base = between("price", 5, 80);

		List<MeasureResult> total = multiCount.count(base, measures);
		Map<Object, List<MeasureResult>> grouped = multiCount.countGrouped(base, RecordExpressions.field("status"), measures);

		assertTrue(grouped.containsKey(null));
		for (int i = 0; i < measures.size(); i++) {
			long count = 0;
			Map<Object, Long> histogram = new HashMap<>();
			for (List<MeasureResult> results : grouped.values()) {
				MeasureResult result = results.get(i);
				if (result.isCount()) {
					count += result.getCount();
				} else {
					for (Map.Entry<Object, Long> entry : result.getHistogram().entrySet()) {
						histogram.merge(entry.getKey(), entry.getValue(), Long::sum);
					}
				}
			}
			if (total.get(i).isCount()) {
				assertEquals(total.get(i).getCount(), count);
			} else {
				assertEquals(total.get(i).getHistogram(), histogram);
			}
		}
	}

	@Test
	public void testNamedGrouped() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(TestRecords.products()));
		Map<Object, Measure> spec = new LinkedHashMap<>();
		spec.put("sold_out", bool(eq("sold_out", true)));

		Map<Object, Map<String, MeasureResult>> result = multiCount.countGrouped(alwaysTrue(), RecordExpressions.field("mfg"), spec);

		assertEquals(asList(1, 2), new ArrayList<>(result.keySet()));
		assertEquals(MeasureResult.ofCount(1), result.get(1).get("sold_out"));
		assertEquals(MeasureResult.ofCount(1), result.get(2).get("sold_out"));
	}

	@Test
	public void testScopes() throws MultiCountException {
		RecordPredicate cheap = between("price", 0, 19);
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records).withScope("cheap", cheap));

		Map<String, MeasureResult> result = multiCount.count(alwaysTrue(), MeasureSpec.named(scope("cheap"), bool("cheap_too", cheap)));

		assertEquals(result.get("cheap_too"), result.get("cheap"));
	}

	@Test
	public void testUnknownScope() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records));
		try {
			multiCount.count(alwaysTrue(), scope("cheap"));
			fail();
		} catch (MalformedMeasureException e) {
			assertEquals(0, e.getPosition());
		}
	}

	@Test
	public void testExecutorFailurePropagates() throws MultiCountException {
		ScanException failure = new ScanException("Source is unavailable");
		MultiCount multiCount = MultiCount.create(request -> {
			throw failure;
		});
		try {
			multiCount.count(alwaysTrue(), measures);
			fail();
		} catch (ScanException e) {
			assertSame(failure, e);
		}
	}

	@Test
	public void testCardinalityLimit() throws MultiCountException {
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records)).withMaxResultRows(3);

		assertEquals(MeasureResult.ofCount(records.size()), multiCount.count(alwaysTrue(), bool(alwaysTrue())).get(0));
		try {
			multiCount.count(alwaysTrue(), field("mfg"));
			fail();
		} catch (CardinalityOverflowException e) {
			assertEquals(4, e.getRows());
			assertEquals(3, e.getMaxRows());
		}
	}

	@Test
	public void testConfig() {
		Config config = Config.ofClassPathProperties("multicount.properties", false);
		MultiCount multiCount = MultiCount.create(InMemoryScanExecutor.create(records)).withConfig(config);

		assertEquals(1000, multiCount.getMaxResultRows());
		assertEquals(3, multiCount.getWarnMeasures());

		MultiCount defaults = MultiCount.create(InMemoryScanExecutor.create(records)).withConfig(Config.create());
		assertEquals(ResultDecoder.DEFAULT_MAX_RESULT_ROWS, defaults.getMaxResultRows());
		assertEquals(MultiCount.DEFAULT_WARN_MEASURES, defaults.getWarnMeasures());
	}
}
