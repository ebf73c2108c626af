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

package io.multicount.json;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.multicount.predicate.RecordPredicate;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.Lists.newArrayList;
import static com.google.common.collect.Maps.newLinkedHashMap;
import static io.multicount.predicate.RecordPredicates.*;

/**
 * JSON form of {@link RecordPredicate}s. An object is a conjunction of equalities,
 * {@code {"status": "sold_out"}}, any other predicate is an array headed by its type,
 * {@code ["between", "price", 10, 20]}. Field values are read with the adapter of the field type.
 */
public final class RecordPredicateGsonAdapter extends TypeAdapter<RecordPredicate> {
	public static final String EQ = "eq";
	public static final String NOT_EQ = "notEq";
	public static final String IN = "in";
	public static final String IS_NULL = "isNull";
	public static final String BETWEEN = "between";
	public static final String REGEXP = "regexp";
	public static final String AND = "and";
	public static final String OR = "or";
	public static final String NOT = "not";
	public static final String TRUE = "true";
	public static final String FALSE = "false";

	private final Map<String, TypeAdapter<?>> fieldAdapters;

	private RecordPredicateGsonAdapter(Map<String, TypeAdapter<?>> fieldAdapters) {
		this.fieldAdapters = fieldAdapters;
	}

	public static RecordPredicateGsonAdapter create(Gson gson, Map<String, Type> fieldTypes) {
		Map<String, TypeAdapter<?>> fieldAdapters = newLinkedHashMap();
		for (Map.Entry<String, Type> entry : fieldTypes.entrySet()) {
			TypeToken<?> typeToken = TypeToken.get(entry.getValue());
			fieldAdapters.put(entry.getKey(), gson.getAdapter(typeToken));
		}
		return new RecordPredicateGsonAdapter(fieldAdapters);
	}

	@SuppressWarnings("unchecked")
	private TypeAdapter<Object> getAdapter(String field) {
		TypeAdapter<?> typeAdapter = fieldAdapters.get(field);
		if (typeAdapter == null)
			throw new JsonParseException("Unknown field " + field);
		return (TypeAdapter<Object>) typeAdapter;
	}

	private void writeValue(JsonWriter writer, String field, Object value) throws IOException {
		getAdapter(field).write(writer, value);
	}

	private void writeEq(JsonWriter writer, PredicateEq predicate) throws IOException {
		writer.name(predicate.getKey());
		writeValue(writer, predicate.getKey(), predicate.getValue());
	}

	private void writeAll(JsonWriter writer, List<RecordPredicate> predicates) throws IOException {
		for (RecordPredicate p : predicates) {
			write(writer, p);
		}
	}

	@Override
	public void write(JsonWriter writer, RecordPredicate predicate) throws IOException {
		if (predicate instanceof PredicateEq) {
			writer.beginObject();
			writeEq(writer, (PredicateEq) predicate);
			writer.endObject();
		} else {
			writer.beginArray();
			if (predicate instanceof PredicateNotEq) {
				PredicateNotEq notEq = (PredicateNotEq) predicate;
				writer.value(NOT_EQ);
				writer.value(notEq.getKey());
				writeValue(writer, notEq.getKey(), notEq.getValue());
			} else if (predicate instanceof PredicateIn) {
				PredicateIn in = (PredicateIn) predicate;
				writer.value(IN);
				writer.value(in.getKey());
				for (Object value : in.getValues()) {
					writeValue(writer, in.getKey(), value);
				}
			} else if (predicate instanceof PredicateIsNull) {
				writer.value(IS_NULL);
				writer.value(((PredicateIsNull) predicate).getKey());
			} else if (predicate instanceof PredicateBetween) {
				PredicateBetween between = (PredicateBetween) predicate;
				writer.value(BETWEEN);
				writer.value(between.getKey());
				writeValue(writer, between.getKey(), between.getFrom());
				writeValue(writer, between.getKey(), between.getTo());
			} else if (predicate instanceof PredicateRegexp) {
				PredicateRegexp regexp = (PredicateRegexp) predicate;
				writer.value(REGEXP);
				writer.value(regexp.getKey());
				writer.value(regexp.getRegexp());
			} else if (predicate instanceof PredicateAnd) {
				writer.value(AND);
				writeAll(writer, ((PredicateAnd) predicate).getPredicates());
			} else if (predicate instanceof PredicateOr) {
				writer.value(OR);
				writeAll(writer, ((PredicateOr) predicate).getPredicates());
			} else if (predicate instanceof PredicateNot) {
				writer.value(NOT);
				write(writer, ((PredicateNot) predicate).getPredicate());
			} else if (predicate instanceof PredicateAlwaysTrue) {
				writer.value(TRUE);
			} else if (predicate instanceof PredicateAlwaysFalse) {
				writer.value(FALSE);
			} else
				throw new IllegalArgumentException("Unsupported predicate " + predicate);
			writer.endArray();
		}
	}

	private RecordPredicate readEqOfObject(JsonReader reader) throws IOException {
		List<RecordPredicate> predicates = newArrayList();
		while (reader.hasNext()) {
			String field = reader.nextName();
			predicates.add(eq(field, getAdapter(field).read(reader)));
		}
		return predicates.size() == 1 ? predicates.get(0) : and(predicates);
	}

	private RecordPredicate readEq(JsonReader reader) throws IOException {
		String field = reader.nextString();
		return eq(field, getAdapter(field).read(reader));
	}

	private RecordPredicate readNotEq(JsonReader reader) throws IOException {
		String field = reader.nextString();
		return notEq(field, getAdapter(field).read(reader));
	}

	private RecordPredicate readIn(JsonReader reader) throws IOException {
		String field = reader.nextString();
		TypeAdapter<Object> typeAdapter = getAdapter(field);
		List<Object> values = newArrayList();
		while (reader.hasNext()) {
			values.add(typeAdapter.read(reader));
		}
		return in(field, values);
	}

	private RecordPredicate readBetween(JsonReader reader) throws IOException {
		String field = reader.nextString();
		TypeAdapter<Object> typeAdapter = getAdapter(field);
		Comparable<?> from = (Comparable<?>) typeAdapter.read(reader);
		Comparable<?> to = (Comparable<?>) typeAdapter.read(reader);
		return between(field, from, to);
	}

	private RecordPredicate readRegexp(JsonReader reader) throws IOException {
		String field = reader.nextString();
		String regexp = reader.nextString();
		return regexp(field, regexp);
	}

	private List<RecordPredicate> readAll(JsonReader reader) throws IOException {
		List<RecordPredicate> predicates = newArrayList();
		while (reader.hasNext()) {
			predicates.add(read(reader));
		}
		return predicates;
	}

	@Override
	public RecordPredicate read(JsonReader reader) throws IOException {
		RecordPredicate predicate;
		if (reader.peek() == JsonToken.BEGIN_OBJECT) {
			reader.beginObject();
			predicate = readEqOfObject(reader);
			reader.endObject();
		} else {
			reader.beginArray();
			String type = reader.nextString();
			switch (type) {
				case EQ:
					predicate = readEq(reader);
					break;
				case NOT_EQ:
					predicate = readNotEq(reader);
					break;
				case IN:
					predicate = readIn(reader);
					break;
				case IS_NULL:
					predicate = isNull(reader.nextString());
					break;
				case BETWEEN:
					predicate = readBetween(reader);
					break;
				case REGEXP:
					predicate = readRegexp(reader);
					break;
				case AND:
					predicate = and(readAll(reader));
					break;
				case OR:
					predicate = or(readAll(reader));
					break;
				case NOT:
					predicate = not(read(reader));
					break;
				case TRUE:
					predicate = alwaysTrue();
					break;
				case FALSE:
					predicate = alwaysFalse();
					break;
				default:
					throw new JsonParseException("Unknown predicate type " + type);
			}
			reader.endArray();
		}
		return predicate;
	}
}
