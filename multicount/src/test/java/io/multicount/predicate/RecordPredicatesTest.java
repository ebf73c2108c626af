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

package io.multicount.predicate;

import io.multicount.record.Record;
import org.junit.Test;

import java.util.ArrayList;

import static io.multicount.predicate.RecordPredicates.*;
import static io.multicount.record.Records.of;
import static java.util.Arrays.asList;
import static org.junit.Assert.*;

public class RecordPredicatesTest {
	@Test
	public void testSimplify() {
		assertEquals(alwaysFalse(), and(eq("publisher", 10), eq("publisher", 20)).simplify());
		assertEquals(eq("publisher", 10), and(eq("publisher", 10), not(not(eq("publisher", 10)))).simplify());
		assertEquals(eq("publisher", 20), and(alwaysTrue(), eq("publisher", 20)).simplify());
		assertEquals(alwaysFalse(), and(alwaysFalse(), eq("publisher", 20)).simplify());
		assertEquals(and(eq("date", 20160101), eq("publisher", 20)), and(eq("date", 20160101), eq("publisher", 20)).simplify());

		assertEquals(and(eq("date", 20160101), eq("publisher", 20)),
				and(not(not(and(not(not(eq("date", 20160101))), eq("publisher", 20)))), not(not(eq("publisher", 20)))).simplify());
		assertEquals(and(eq("date", 20160101), eq("publisher", 20)),
				and(and(not(not(eq("publisher", 20))), not(not(eq("date", 20160101)))), and(eq("date", 20160101), eq("publisher", 20))).simplify());
	}

	@Test
	public void testSimplifyRanges() {
		assertEquals(between("price", 20, 50), and(between("price", 10, 50), between("price", 20, 80)).simplify());
		assertEquals(eq("price", 30), and(eq("price", 30), between("price", 10, 50)).simplify());
		assertEquals(alwaysFalse(), and(eq("price", 60), between("price", 10, 50)).simplify());
		assertEquals(alwaysFalse(), between("price", 50, 10).simplify());
		assertEquals(eq("price", 10), between("price", 10, 10).simplify());
	}

	@Test
	public void testSimplifyInAndOr() {
		assertEquals(eq("region", "east"), in("region", "east").simplify());
		assertEquals(alwaysFalse(), in("region", asList()).simplify());
		assertEquals(eq("region", "east"), and(eq("region", "east"), in("region", "east", "west")).simplify());
		assertEquals(alwaysFalse(), and(eq("region", "north"), in("region", "east", "west")).simplify());
		assertEquals(alwaysFalse(), and(eq("region", "east"), notEq("region", "east")).simplify());
		assertEquals(eq("region", "east"), or(alwaysFalse(), eq("region", "east")).simplify());
		assertEquals(alwaysTrue(), or(eq("region", "east"), alwaysTrue()).simplify());
		assertEquals(alwaysFalse(), not(alwaysTrue()).simplify());
	}

	@Test
	public void testThreeValuedLogic() {
		Record record = of("status", "sold_out", "region", null);

		assertEquals(Boolean.TRUE, eq("status", "sold_out").test(record));
		assertEquals(Boolean.FALSE, eq("status", "available").test(record));
		assertNull(eq("region", "west").test(record));
		assertNull(eq("missing", "west").test(record));
		assertNull(not(eq("region", "west")).test(record));
		assertNull(notEq("region", "west").test(record));
		assertEquals(Boolean.TRUE, isNull("region").test(record));
		assertEquals(Boolean.FALSE, isNull("status").test(record));

		assertEquals(Boolean.FALSE, and(eq("status", "available"), eq("region", "west")).test(record));
		assertNull(and(eq("status", "sold_out"), eq("region", "west")).test(record));
		assertEquals(Boolean.TRUE, or(eq("status", "sold_out"), eq("region", "west")).test(record));
		assertNull(or(eq("status", "available"), eq("region", "west")).test(record));
	}

	@Test
	public void testComparisons() {
		Record record = of("price", 25, "mfg", 3L, "name", "Blue widget");

		assertEquals(Boolean.TRUE, between("price", 10, 30).test(record));
		assertEquals(Boolean.FALSE, between("price", 26, 30).test(record));
		assertEquals(Boolean.TRUE, eq("mfg", 3).test(record));
		assertEquals(Boolean.TRUE, in("mfg", 1, 2, 3).test(record));
		assertEquals(Boolean.FALSE, in("price", 1, 2, 3).test(record));
		assertEquals(Boolean.TRUE, regexp("name", ".*widget").test(record));
		assertEquals(Boolean.FALSE, regexp("name", "widget").test(record));
	}

	@Test(expected = ClassCastException.class)
	public void testIncomparableValues() {
		between("name", 1, 5).test(of("name", "Blue widget"));
	}

	@Test
	public void testFields() {
		RecordPredicate predicate = and(eq("status", "sold_out"), or(between("price", 1, 5), not(isNull("region"))));
		assertEquals(asList("status", "price", "region"), new ArrayList<>(predicate.getFields()));
	}

	@Test
	public void testToString() {
		assertEquals("(status='sold_out' AND price BETWEEN 10 AND 20)",
				and(eq("status", "sold_out"), between("price", 10, 20)).toString());
		assertEquals("region IN ('east', 'west')", in("region", "east", "west").toString());
		assertEquals("NOT name='O''Brien'", not(eq("name", "O'Brien")).toString());
	}
}
