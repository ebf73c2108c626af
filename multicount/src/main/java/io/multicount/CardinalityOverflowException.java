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

/**
 * Thrown when a scan yields more distinct value combinations than the decoder is allowed to accept.
 */
public final class CardinalityOverflowException extends MultiCountException {
	private final int rows;
	private final int maxRows;

	public CardinalityOverflowException(int rows, int maxRows, int measures) {
		super("Scan returned " + rows + " distinct rows for " + measures + " measures, limit is " + maxRows);
		this.rows = rows;
		this.maxRows = maxRows;
	}

	public int getRows() {
		return rows;
	}

	public int getMaxRows() {
		return maxRows;
	}
}
