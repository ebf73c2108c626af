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

package io.multicount.measure;

public enum MeasureKind {
	/**
	 * A filter, counted where it holds.
	 */
	BOOLEAN,
	/**
	 * An arbitrary value expression, tabulated per distinct value.
	 */
	EXPRESSION,
	/**
	 * A filter registered with the data source under a name.
	 */
	SCOPE
}
