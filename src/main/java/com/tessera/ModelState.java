/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
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

package com.tessera;

/**
 * Where a {@link Model} instance stands relative to the table row it maps to.
 *
 * @since 1.0.0
 */
public enum ModelState {
	/**
	 * Constructed in memory, never saved.
	 */
	TRANSIENT,
	/**
	 * Saved, or loaded from a row.
	 */
	PERSISTED,
	/**
	 * Deleted. Still usable in memory, no longer backed by a row; saving it again inserts a new row.
	 */
	DETACHED
}
