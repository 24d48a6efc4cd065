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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

import static java.util.Objects.requireNonNull;

/**
 * Opens new physical connections for a {@link SingleConnectionManager}.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConnectionFactory {
	@NonNull
	Connection openConnection() throws SQLException;

	/**
	 * Opens connections through {@link DriverManager}.
	 */
	@NonNull
	static ConnectionFactory forJdbcUrl(@NonNull String jdbcUrl,
																			@NonNull String username,
																			@NonNull String password) {
		requireNonNull(jdbcUrl);
		requireNonNull(username);
		requireNonNull(password);

		return () -> DriverManager.getConnection(jdbcUrl, username, password);
	}
}
