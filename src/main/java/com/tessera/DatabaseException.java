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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when a statement fails at the database driver.
 * <p>
 * The driver's exception is kept, unmodified, as the {@code cause}. If it is a {@link SQLException}, the
 * {@link #getErrorCode()} and {@link #getSqlState()} accessors are shorthand for the corresponding
 * {@link SQLException} values. PostgreSQL server errors additionally expose the offending constraint, table,
 * column and so on.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;
	@Nullable
	private final String column;
	@Nullable
	private final String constraint;
	@Nullable
	private final String detail;
	@Nullable
	private final String hint;
	@Nullable
	private final String schema;
	@Nullable
	private final String severity;
	@Nullable
	private final String table;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DatabaseException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public DatabaseException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DatabaseException(@Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		Integer errorCode = null;
		String sqlState = null;
		String column = null;
		String constraint = null;
		String detail = null;
		String hint = null;
		String schema = null;
		String severity = null;
		String table = null;

		SQLException sqlException = findSqlException(cause);

		if (sqlException != null) {
			errorCode = sqlException.getErrorCode();
			sqlState = sqlException.getSQLState();

			// Postgres reports structured server details
			if ("org.postgresql.util.PSQLException".equals(sqlException.getClass().getName())) {
				org.postgresql.util.ServerErrorMessage serverErrorMessage =
						((org.postgresql.util.PSQLException) sqlException).getServerErrorMessage();

				if (serverErrorMessage != null) {
					column = serverErrorMessage.getColumn();
					constraint = serverErrorMessage.getConstraint();
					detail = serverErrorMessage.getDetail();
					hint = serverErrorMessage.getHint();
					schema = serverErrorMessage.getSchema();
					severity = serverErrorMessage.getSeverity();
					table = serverErrorMessage.getTable();

					if (serverErrorMessage.getSQLState() != null)
						sqlState = serverErrorMessage.getSQLState();
				}
			}
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
		this.column = column;
		this.constraint = constraint;
		this.detail = detail;
		this.hint = hint;
		this.schema = schema;
		this.severity = severity;
		this.table = table;
	}

	@Nullable
	private static SQLException findSqlException(@Nullable Throwable cause) {
		Throwable current = cause;

		while (current != null) {
			if (current instanceof SQLException)
				return (SQLException) current;

			if (current.getCause() == current)
				return null;

			current = current.getCause();
		}

		return null;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(10);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		getErrorCode().ifPresent(errorCode -> components.add(format("errorCode=%s", errorCode)));
		getSqlState().ifPresent(sqlState -> components.add(format("sqlState=%s", sqlState)));
		getSchema().ifPresent(schema -> components.add(format("schema=%s", schema)));
		getTable().ifPresent(table -> components.add(format("table=%s", table)));
		getColumn().ifPresent(column -> components.add(format("column=%s", column)));
		getConstraint().ifPresent(constraint -> components.add(format("constraint=%s", constraint)));
		getDetail().ifPresent(detail -> components.add(format("detail=%s", detail)));
		getHint().ifPresent(hint -> components.add(format("hint=%s", hint)));
		getSeverity().ifPresent(severity -> components.add(format("severity=%s", severity)));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}

	/**
	 * @return the offending {@code column}, or empty if not available
	 */
	@NonNull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}

	/**
	 * @return the violated {@code constraint}, or empty if not available
	 */
	@NonNull
	public Optional<String> getConstraint() {
		return Optional.ofNullable(this.constraint);
	}

	@NonNull
	public Optional<String> getDetail() {
		return Optional.ofNullable(this.detail);
	}

	@NonNull
	public Optional<String> getHint() {
		return Optional.ofNullable(this.hint);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@NonNull
	public Optional<String> getSeverity() {
		return Optional.ofNullable(this.severity);
	}

	/**
	 * @return the offending {@code table}, or empty if not available
	 */
	@NonNull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}
}
