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

import com.google.common.collect.ImmutableMap;
import io.multicount.measure.ResultShape;
import io.multicount.scan.ScanRow;
import org.junit.Test;

import java.util.*;

import static io.multicount.measure.ResultShape.*;
import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.junit.Assert.*;

public class ResultDecoderTest {
	@Test
	public void testMarginalizesEachMeasure() throws CardinalityOverflowException {
		List<ScanRow> rows = asList(
				ScanRow.of(5, true, true, "a"),
				ScanRow.of(3, true, false, "b"),
				ScanRow.of(2, false, true, "a"),
				ScanRow.of(1, null, null, "c"));

		Map<Object, List<MeasureResult>> decoded = ResultDecoder.ofShapes(asList(AUTO, AUTO, AUTO), false).decode(rows);

		assertEquals(Collections.singleton(null), decoded.keySet());
		List<MeasureResult> results = decoded.get(null);
		assertEquals(MeasureResult.ofCount(8), results.get(0));
		assertEquals(MeasureResult.ofCount(7), results.get(1));
		assertEquals(MeasureResult.ofHistogram(ImmutableMap.of("a", 7L, "b", 3L, "c", 1L)), results.get(2));
	}

	@Test
	public void testEmptyScanIsZero() throws CardinalityOverflowException {
		Map<Object, List<MeasureResult>> decoded = ResultDecoder.ofShapes(asList(COUNT, AUTO, HISTOGRAM), false)
				.decode(emptyList());

		assertEquals(asList(MeasureResult.ofCount(0), MeasureResult.ofCount(0), MeasureResult.ofHistogram(ImmutableMap.of())),
				decoded.get(null));
	}

	@Test
	public void testEmptyGroupedScanHasNullGroup() throws CardinalityOverflowException {
		Map<Object, List<MeasureResult>> decoded = ResultDecoder.ofShapes(asList(COUNT, HISTOGRAM), true)
				.decode(emptyList());

		assertEquals(1, decoded.size());
		assertEquals(asList(MeasureResult.ofCount(0), MeasureResult.ofHistogram(ImmutableMap.of())), decoded.get(null));
	}

	@Test
	public void testGroupsInFirstSeenOrder() throws CardinalityOverflowException {
		List<ScanRow> rows = asList(
				ScanRow.of(4, true, "west"),
				ScanRow.of(1, false, "east"),
				ScanRow.of(2, true, "east"),
				ScanRow.of(3, false, "west"),
				ScanRow.of(6, true, null));

		Map<Object, List<MeasureResult>> decoded = ResultDecoder.ofShapes(asList(COUNT), true).decode(rows);

		assertEquals(asList("west", "east", null), new ArrayList<>(decoded.keySet()));
		assertEquals(MeasureResult.ofCount(4), decoded.get("west").get(0));
		assertEquals(MeasureResult.ofCount(2), decoded.get("east").get(0));
		assertEquals(MeasureResult.ofCount(6), decoded.get(null).get(0));
	}

	@Test
	public void testCollapse() {
		Map<Object, Long> booleans = new LinkedHashMap<>();
		booleans.put(false, 3L);
		booleans.put(null, 2L);
		assertEquals(MeasureResult.ofCount(0), ResultDecoder.collapse(booleans, AUTO));
		assertEquals(MeasureResult.ofCount(0), ResultDecoder.collapse(booleans, COUNT));
		assertEquals(MeasureResult.ofHistogram(booleans), ResultDecoder.collapse(booleans, HISTOGRAM));

		Map<Object, Long> values = new LinkedHashMap<>();
		values.put(true, 3L);
		values.put(1, 2L);
		values.put(null, 0L);
		assertEquals(MeasureResult.ofHistogram(values), ResultDecoder.collapse(values, AUTO));
		assertEquals(MeasureResult.ofCount(3), ResultDecoder.collapse(values, COUNT));
		assertEquals(MeasureResult.ofHistogram(ImmutableMap.of(true, 3L, 1, 2L)), ResultDecoder.collapse(values, HISTOGRAM));
	}

	@Test
	public void testNullIsHistogramKey() throws CardinalityOverflowException {
		List<ScanRow> rows = asList(ScanRow.of(2, "x"), ScanRow.of(5, (Object) null));

		MeasureResult result = ResultDecoder.ofShapes(asList(ResultShape.AUTO), false).decode(rows).get(null).get(0);

		assertTrue(result.isHistogram());
		assertEquals(5L, result.getCount(null));
		assertEquals(2L, result.getCount("x"));
		assertEquals(0L, result.getCount("y"));
		assertEquals(7L, result.getTotal());
	}

	@Test
	public void testCardinalityLimit() {
		List<ScanRow> rows = asList(ScanRow.of(1, true), ScanRow.of(1, false), ScanRow.of(1, (Object) null));
		try {
			ResultDecoder.ofShapes(asList(COUNT), false).withMaxResultRows(2).decode(rows);
			fail();
		} catch (CardinalityOverflowException e) {
			assertEquals(3, e.getRows());
			assertEquals(2, e.getMaxRows());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRowWidthMismatch() throws CardinalityOverflowException {
		ResultDecoder.ofShapes(asList(COUNT, COUNT), false).decode(asList(ScanRow.of(1, true)));
	}
}
