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
import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Commit/rollback handling for a single connection.
 * <p>
 * Commit and rollback are driven by {@link ConnectionManager#transaction(ConnectionOperation)}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class Transaction {
	@NonNull
	private static final Logger LOGGER;

	static {
		LOGGER = Logger.getLogger(Transaction.class.getName());
	}

	@NonNull
	private final Connection connection;
	private final boolean initialAutoCommit;

	private Transaction(@NonNull Connection connection) {
		requireNonNull(connection);

		this.connection = connection;

		try {
			this.initialAutoCommit = connection.getAutoCommit();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to determine database connection autocommit setting", e);
		}

		if (this.initialAutoCommit)
			setAutoCommit(false);
	}

	@Nullable
	static <R> R perform(@NonNull Connection connection,
											 @NonNull ConnectionOperation<R> connectionOperation) {
		requireNonNull(connection);
		requireNonNull(connectionOperation);

		Transaction transaction = new Transaction(connection);
		Throwable thrown = null;

		try {
			R result = connectionOperation.perform(connection);
			transaction.commit();
			return result;
		} catch (RuntimeException | Error e) {
			thrown = e;
			transaction.rollbackAfter(e);
			throw e;
		} catch (Exception e) {
			transaction.rollbackAfter(e);
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			if (transaction.initialAutoCommit) {
				try {
					// Autocommit was true initially, so restoring to true now that transaction has completed
					transaction.setAutoCommit(true);
				} catch (RuntimeException cleanupException) {
					if (thrown == null)
						throw cleanupException;

					thrown.addSuppressed(cleanupException);
				}
			}
		}
	}

	private void commit() {
		LOGGER.finer("Committing transaction...");

		try {
			this.connection.commit();
			LOGGER.finer("Transaction committed.");
		} catch (SQLException e) {
			throw new DatabaseException("Unable to commit transaction", e);
		}
	}

	private void rollbackAfter(@NonNull Throwable cause) {
		requireNonNull(cause);

		LOGGER.finer("Rolling back transaction...");

		try {
			this.connection.rollback();
			LOGGER.finer("Transaction rolled back.");
		} catch (SQLException rollbackException) {
			LOGGER.log(WARNING, "Unable to roll back transaction", rollbackException);
			cause.addSuppressed(rollbackException);
		}

		restoreInterruptIfNeeded(cause);
	}

	private void setAutoCommit(boolean autoCommit) {
		try {
			this.connection.setAutoCommit(autoCommit);
		} catch (SQLException e) {
			throw new DatabaseException(format("Unable to set database connection autocommit value to '%s'", autoCommit), e);
		}
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				return;
			}

			current = current.getCause();
		}
	}
}
