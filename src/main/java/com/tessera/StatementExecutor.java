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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Runs {@link Statement}s on a JDBC {@link Connection}.
 * <p>
 * The caller owns the connection; it is never closed here. Every execution, successful or not, is reported to
 * the configured {@link StatementLogger}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementExecutor {
	@NonNull
	private final StatementLogger statementLogger;

	public StatementExecutor() {
		this(new DefaultStatementLogger());
	}

	public StatementExecutor(@NonNull StatementLogger statementLogger) {
		requireNonNull(statementLogger);
		this.statementLogger = statementLogger;
	}

	/**
	 * Executes a statement that returns no rows.
	 *
	 * @return the number of rows affected
	 * @throws DatabaseException if the driver fails
	 */
	public int execute(@NonNull Connection connection,
										 @NonNull Statement statement) {
		requireNonNull(connection);
		requireNonNull(statement);

		Integer[] updateCount = new Integer[1];

		performStatementOperation(connection, statement, (preparedStatement, timings) -> {
			long startTime = nanoTime();
			updateCount[0] = preparedStatement.executeUpdate();
			timings.executionDuration = Duration.ofNanos(nanoTime() - startTime);
		});

		return updateCount[0];
	}

	/**
	 * Executes a query and reads every row.
	 *
	 * @throws DatabaseException if the driver fails
	 */
	@NonNull
	public List<@NonNull Record> fetch(@NonNull Connection connection,
																		 @NonNull Statement statement) {
		return fetch(connection, statement, null);
	}

	/**
	 * Executes a query and reads the first row, if any.
	 */
	@NonNull
	public Optional<Record> fetchRow(@NonNull Connection connection,
																	 @NonNull Statement statement) {
		return fetchRow(connection, statement, null);
	}

	/**
	 * Like {@link #fetchRow(Connection, Statement)}, with columns of {@code schema} read as their attribute's Java type.
	 * Rows past the first are never read.
	 */
	@NonNull
	Optional<Record> fetchRow(@NonNull Connection connection,
														@NonNull Statement statement,
														@Nullable Schema<?> schema) {
		List<Record> records = query(connection, statement, schema, 1);
		return records.size() == 0 ? Optional.empty() : Optional.of(records.get(0));
	}

	/**
	 * Like {@link #fetch(Connection, Statement)}, but columns of {@code schema} are read as their attribute's Java
	 * type when the driver can convert to it.
	 */
	@NonNull
	List<@NonNull Record> fetch(@NonNull Connection connection,
															@NonNull Statement statement,
															@Nullable Schema<?> schema) {
		return query(connection, statement, schema, 0);
	}

	/**
	 * @param maxRows the most rows to read, or {@code 0} for all of them
	 */
	@NonNull
	private List<@NonNull Record> query(@NonNull Connection connection,
																			@NonNull Statement statement,
																			@Nullable Schema<?> schema,
																			int maxRows) {
		requireNonNull(connection);
		requireNonNull(statement);

		Map<String, Class<?>> valueTypesByNormalizedKey = new HashMap<>();

		if (schema != null)
			for (Column column : schema.getColumns())
				valueTypesByNormalizedKey.put(column.getKey().toLowerCase(Locale.ROOT), column.getValueType());

		List<Record> records = new ArrayList<>();

		performStatementOperation(connection, statement, (preparedStatement, timings) -> {
			if (maxRows > 0)
				preparedStatement.setMaxRows(maxRows);

			long startTime = nanoTime();

			try (ResultSet resultSet = preparedStatement.executeQuery()) {
				timings.executionDuration = Duration.ofNanos(nanoTime() - startTime);
				startTime = nanoTime();

				ResultSetMetaData resultSetMetaData = resultSet.getMetaData();
				List<String> keys = new ArrayList<>(resultSetMetaData.getColumnCount());

				for (int i = 1; i <= resultSetMetaData.getColumnCount(); ++i)
					keys.add(resultSetMetaData.getColumnLabel(i));

				while ((maxRows == 0 || records.size() < maxRows) && resultSet.next()) {
					List<Object> values = new ArrayList<>(keys.size());

					for (int i = 0; i < keys.size(); ++i)
						values.add(readValue(resultSet, i + 1, valueTypesByNormalizedKey.get(keys.get(i).toLowerCase(Locale.ROOT))));

					records.add(new Record(keys, values));
				}

				timings.resultSetMappingDuration = Duration.ofNanos(nanoTime() - startTime);
			}
		});

		return records;
	}

	@Nullable
	private Object readValue(@NonNull ResultSet resultSet,
													 int columnIndex,
													 @Nullable Class<?> valueType) throws SQLException {
		requireNonNull(resultSet);

		if (valueType == null || valueType == Object.class)
			return resultSet.getObject(columnIndex);

		try {
			return resultSet.getObject(columnIndex, valueType);
		} catch (SQLException | AbstractMethodError e) {
			// No driver conversion to the attribute type: hand over the natural value and let mapping decide
			return resultSet.getObject(columnIndex);
		}
	}

	private void performStatementOperation(@NonNull Connection connection,
																				 @NonNull Statement statement,
																				 @NonNull StatementOperation statementOperation) {
		requireNonNull(connection);
		requireNonNull(statement);
		requireNonNull(statementOperation);

		long startTime = nanoTime();
		Timings timings = new Timings();
		Exception exception = null;
		Throwable thrown = null;

		try {
			PositionalSql positionalSql = PositionalSql.parse(statement.getSql(), statement.getParameters());

			try (PreparedStatement preparedStatement = connection.prepareStatement(positionalSql.getSql())) {
				bindParameters(preparedStatement, positionalSql.getParameters());
				timings.preparationDuration = Duration.ofNanos(nanoTime() - startTime);

				statementOperation.perform(preparedStatement, timings);
			}
		} catch (DatabaseException | IllegalArgumentException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new DatabaseException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			DatabaseException wrapped = new DatabaseException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			StatementLog statementLog = StatementLog.withStatement(statement)
					.preparationDuration(timings.preparationDuration)
					.executionDuration(timings.executionDuration)
					.resultSetMappingDuration(timings.resultSetMappingDuration)
					.exception(exception)
					.build();

			try {
				getStatementLogger().log(statementLog);
			} catch (RuntimeException loggerFailure) {
				if (thrown != null)
					thrown.addSuppressed(loggerFailure);
				else
					throw loggerFailure;
			}
		}
	}

	private void bindParameters(@NonNull PreparedStatement preparedStatement,
															@NonNull List<@Nullable Object> parameters) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameters);

		for (int i = 0; i < parameters.size(); ++i) {
			Object parameter = parameters.get(i);

			if (parameter != null) {
				preparedStatement.setObject(i + 1, parameter);
			} else {
				try {
					ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

					if (parameterMetaData != null)
						preparedStatement.setNull(i + 1, parameterMetaData.getParameterType(i + 1));
					else
						preparedStatement.setNull(i + 1, Types.NULL);
				} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
					preparedStatement.setNull(i + 1, Types.NULL);
				}
			}
		}
	}

	@NonNull
	public StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@FunctionalInterface
	private interface StatementOperation {
		void perform(@NonNull PreparedStatement preparedStatement,
								 @NonNull Timings timings) throws Exception;
	}

	private static final class Timings {
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
	}
}
