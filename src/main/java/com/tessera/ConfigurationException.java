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

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown when a model declaration cannot be turned into a {@link Schema}, or when a {@link Statement} cannot be
 * built from one, for example duplicate column keys or an {@code UPDATE} against a model without a primary key.
 * <p>
 * These failures are never retried.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ConfigurationException extends RuntimeException {
	/**
	 * Creates a {@code ConfigurationException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public ConfigurationException(@NonNull String message) {
		super(message);
	}

	/**
	 * Creates a {@code ConfigurationException} with the given {@code message} and {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public ConfigurationException(@NonNull String message,
																@Nullable Throwable cause) {
		super(message, cause);
	}
}
