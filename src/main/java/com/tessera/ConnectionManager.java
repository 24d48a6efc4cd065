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

import static java.util.Objects.requireNonNull;

/**
 * Hands out connections and takes them back.
 * <p>
 * Callers should prefer the scoped forms, {@link #withConnection(ConnectionOperation)} and
 * {@link #transaction(ConnectionOperation)}, which release the connection on every exit path.
 *
 * @since 1.0.0
 */
public interface ConnectionManager extends AutoCloseable {
	/**
	 * Obtains a connection. Every successful call must be paired with {@link #release(Connection)} on the same
	 * thread.
	 *
	 * @return a usable connection
	 * @throws DatabaseException if no connection can be obtained
	 */
	@NonNull
	Connection acquire();

	/**
	 * Gives back a connection obtained from {@link #acquire()}.
	 *
	 * @param connection the connection to release
	 */
	void release(@NonNull Connection connection);

	/**
	 * Releases any resources held by this manager.
	 */
	@Override
	void close();

	/**
	 * Runs {@code connectionOperation} on a borrowed connection and releases it afterwards.
	 *
	 * @throws DatabaseException wrapping any checked exception thrown by the operation
	 */
	@Nullable
	default <R> R withConnection(@NonNull ConnectionOperation<R> connectionOperation) {
		requireNonNull(connectionOperation);

		Connection connection = acquire();
		Throwable thrown = null;

		try {
			return connectionOperation.perform(connection);
		} catch (RuntimeException | Error e) {
			thrown = e;
			throw e;
		} catch (Exception e) {
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			try {
				release(connection);
			} catch (RuntimeException cleanupException) {
				if (thrown == null)
					throw cleanupException;

				thrown.addSuppressed(cleanupException);
			}
		}
	}

	/**
	 * Runs {@code connectionOperation} in a transaction on a borrowed connection.
	 * <p>
	 * Auto-commit is switched off for the duration. The transaction commits if the operation returns normally and
	 * rolls back if it throws; the connection's auto-commit setting is then restored and the connection released.
	 *
	 * @throws DatabaseException wrapping any checked exception thrown by the operation
	 */
	@Nullable
	default <R> R transaction(@NonNull ConnectionOperation<R> connectionOperation) {
		requireNonNull(connectionOperation);
		return withConnection((connection) -> Transaction.perform(connection, connectionOperation));
	}
}
