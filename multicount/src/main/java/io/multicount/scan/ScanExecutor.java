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

package io.multicount.scan;

import java.util.List;

/**
 * Data source side of a multi-count: executes one grouped scan.
 * <p>
 * Implementations must return at most one row per distinct combination of column values,
 * with the number of matching source rows as its count. Malformed expressions are reported
 * with {@link ScanException}.
 */
public interface ScanExecutor {
	List<ScanRow> execute(ScanRequest request) throws ScanException;
}
