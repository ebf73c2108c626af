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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.multicount.expression.RecordExpression;
import io.multicount.expression.RecordExpressions.ExpressionField;
import io.multicount.measure.Measure;
import io.multicount.measure.MeasureKind;
import io.multicount.measure.Measures;
import io.multicount.measure.ResultShape;
import io.multicount.predicate.RecordPredicate;

import java.io.IOException;

/**
 * JSON form of {@link Measure}s: {@code ["bool", predicate]}, {@code ["field", "mfg"]},
 * {@code ["histogram", "mfg"]} or {@code ["scope", "on_sale"]}.
 * Only field expressions have a JSON form.
 */
public final class MeasureGsonAdapter extends TypeAdapter<Measure> {
	public static final String BOOL = "bool";
	public static final String FIELD = "field";
	public static final String HISTOGRAM = "histogram";
	public static final String SCOPE = "scope";

	private final TypeAdapter<RecordPredicate> predicateAdapter;

	private MeasureGsonAdapter(TypeAdapter<RecordPredicate> predicateAdapter) {
		this.predicateAdapter = predicateAdapter;
	}

	public static MeasureGsonAdapter create(TypeAdapter<RecordPredicate> predicateAdapter) {
		return new MeasureGsonAdapter(predicateAdapter);
	}

	@Override
	public void write(JsonWriter writer, Measure measure) throws IOException {
		if (measure.getShape() != ResultShape.HISTOGRAM && measure.getShape() != defaultShape(measure.getKind()))
			throw new IllegalArgumentException("Result shape " + measure.getShape() + " can not be written as JSON: " + measure);
		writer.beginArray();
		switch (measure.getKind()) {
			case BOOLEAN:
				writer.value(BOOL);
				predicateAdapter.write(writer, measure.getPredicate());
				break;
			case EXPRESSION:
				RecordExpression expression = measure.getExpression();
				if (!(expression instanceof ExpressionField))
					throw new IllegalArgumentException("Only field expressions can be written as JSON: " + measure);
				writer.value(measure.getShape() == ResultShape.HISTOGRAM ? HISTOGRAM : FIELD);
				writer.value(((ExpressionField) expression).getField());
				break;
			case SCOPE:
				writer.value(SCOPE);
				writer.value(measure.getScope());
				break;
			default:
				throw new IllegalArgumentException("Unsupported measure " + measure);
		}
		writer.endArray();
	}

	private static ResultShape defaultShape(MeasureKind kind) {
		return kind == MeasureKind.EXPRESSION ? ResultShape.AUTO : ResultShape.COUNT;
	}

	@Override
	public Measure read(JsonReader reader) throws IOException {
		reader.beginArray();
		String type = reader.nextString();
		Measure measure;
		switch (type) {
			case BOOL:
				measure = Measures.bool(predicateAdapter.read(reader));
				break;
			case FIELD:
				measure = Measures.field(reader.nextString());
				break;
			case HISTOGRAM:
				measure = Measures.histogram(reader.nextString());
				break;
			case SCOPE:
				measure = Measures.scope(reader.nextString());
				break;
			default:
				throw new JsonParseException("Unknown measure type " + type);
		}
		reader.endArray();
		return measure;
	}
}
