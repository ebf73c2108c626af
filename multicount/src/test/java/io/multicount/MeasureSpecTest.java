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
import io.multicount.measure.MeasureKind;
import org.junit.Test;

import java.util.*;

import static io.multicount.measure.Measures.*;
import static io.multicount.predicate.RecordPredicates.eq;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public class MeasureSpecTest {
	private enum Key {mfg, region}

	@Test
	public void testPositional() {
		MeasureSpec<List<MeasureResult>> spec = MeasureSpec.positional(field("mfg"), bool(eq("status", "sold_out")));

		assertEquals(2, spec.size());
		assertEquals(MeasureKind.EXPRESSION, spec.getMeasures().get(0).getKind());
		assertEquals(asList(MeasureResult.ofCount(1), MeasureResult.ofCount(2)),
				spec.toResult(asList(MeasureResult.ofCount(1), MeasureResult.ofCount(2))));
	}

	@Test
	public void testNamedKeepsKeyOrder() {
		Map<Object, Measure> measures = new LinkedHashMap<>();
		measures.put("z", field("mfg"));
		measures.put(Key.region, field("region"));
		measures.put(1, bool(eq("status", "sold_out")));

		MeasureSpec<Map<String, MeasureResult>> spec = MeasureSpec.named(measures);
		Map<String, MeasureResult> result = spec.toResult(asList(
				MeasureResult.ofCount(1), MeasureResult.ofCount(2), MeasureResult.ofCount(3)));

		assertEquals(asList("z", "region", "1"), new ArrayList<>(result.keySet()));
		assertEquals(MeasureResult.ofCount(2), result.get("region"));
		assertEquals(MeasureResult.ofCount(3), result.get("1"));
	}

	@Test
	public void testNormalizedKeysCollide() {
		Map<Object, Measure> measures = new LinkedHashMap<>();
		measures.put(Key.mfg, field("mfg"));
		measures.put("mfg", histogram("mfg"));
		try {
			MeasureSpec.named(measures);
			fail();
		} catch (KeyCollisionException e) {
			assertEquals("mfg", e.getKey());
		}
	}

	@Test
	public void testNamedFromMeasureNames() {
		MeasureSpec<Map<String, MeasureResult>> spec = MeasureSpec.named(field("mfg"), scope("cheap"),
				bool("sold_out", eq("status", "sold_out")));
		Map<String, MeasureResult> result = spec.toResult(asList(
				MeasureResult.ofCount(0), MeasureResult.ofCount(1), MeasureResult.ofCount(2)));

		assertEquals(asList("mfg", "cheap", "sold_out"), new ArrayList<>(result.keySet()));
	}

	@Test(expected = KeyCollisionException.class)
	public void testDuplicateMeasureNames() {
		MeasureSpec.named(field("mfg"), histogram("mfg"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnnamedMeasure() {
		MeasureSpec.named(field("mfg"), bool(eq("status", "sold_out")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testResultCountMismatch() {
		MeasureSpec.positional(field("mfg")).toResult(Collections.<MeasureResult>emptyList());
	}
}
