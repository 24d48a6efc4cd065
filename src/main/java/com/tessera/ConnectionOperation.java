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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.sql.Connection;

/**
 * Unit of work performed on a borrowed {@link Connection}.
 *
 * @param <R> the result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionOperation<R> {
	/**
	 * Executes the unit of work.
	 *
	 * @param connection the connection, valid only for the duration of this call
	 * @return the result of the operation
	 * @throws Exception if an error occurs while performing the operation
	 */
	@Nullable
	R perform(@NonNull Connection connection) throws Exception;
}
