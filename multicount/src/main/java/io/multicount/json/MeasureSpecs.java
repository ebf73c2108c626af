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

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.multicount.KeyCollisionException;
import io.multicount.MeasureResult;
import io.multicount.MeasureSpec;
import io.multicount.measure.Measure;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

public final class MeasureSpecs {
	private MeasureSpecs() {
	}

	/**
	 * Reads named measures from a JSON object, {@code {"sold_out": ["bool", {"status": "sold_out"}], "mfg": ["field", "mfg"]}}.
	 * Keys keep their order.
	 *
	 * @throws KeyCollisionException if a name occurs twice
	 */
	public static MeasureSpec<Map<String, MeasureResult>> namedFromJson(TypeAdapter<Measure> measureAdapter, String json)
			throws IOException {
		Map<String, Measure> measures = new LinkedHashMap<>();
		try (JsonReader reader = new JsonReader(new StringReader(json))) {
			reader.beginObject();
			while (reader.hasNext()) {
				String name = reader.nextName();
				Measure measure = measureAdapter.read(reader).withName(name);
				Measure previous = measures.put(name, measure);
				if (previous != null) {
					throw new KeyCollisionException(name, previous, measure);
				}
			}
			reader.endObject();
		}
		return MeasureSpec.named(measures);
	}

	public static String namedToJson(TypeAdapter<Measure> measureAdapter, Map<String, Measure> measures) throws IOException {
		StringWriter stringWriter = new StringWriter();
		try (JsonWriter writer = new JsonWriter(stringWriter)) {
			writer.beginObject();
			for (Map.Entry<String, Measure> entry : measures.entrySet()) {
				writer.name(entry.getKey());
				measureAdapter.write(writer, entry.getValue());
			}
			writer.endObject();
		}
		return stringWriter.toString();
	}
}
