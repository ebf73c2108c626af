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

/**
 * Thrown when a measure can not be turned into a scan column, e.g. it names an unknown scope.
 */
public final class MalformedMeasureException extends MultiCountException {
	private final int position;

	public MalformedMeasureException(int position, Measure measure, String reason) {
		super("Malformed measure #" + position + " (" + measure + "): " + reason);
		this.position = position;
	}

	public int getPosition() {
		return position;
	}
}
