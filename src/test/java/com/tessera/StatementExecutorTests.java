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

import org.hsqldb.jdbc.JDBCDataSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StatementExecutorTests {
	@Test
	public void testExecuteAndFetch() throws Exception {
		DataSource dataSource = createInMemoryDataSource("statement_executor_fetch");
		StatementExecutor statementExecutor = new StatementExecutor();

		try (Connection connection = dataSource.getConnection()) {
			statementExecutor.execute(connection, Statement.of("CREATE TABLE car (car_id INTEGER PRIMARY KEY, color VARCHAR(40))"));

			Assertions.assertEquals(1, statementExecutor.execute(connection, Statement.of("INSERT INTO car VALUES ($1, $2)", 1, "red")));
			Assertions.assertEquals(1, statementExecutor.execute(connection, Statement.of("INSERT INTO car VALUES ($1, $2)", 2, null)));

			List<Record> records = statementExecutor.fetch(connection, Statement.of("SELECT car_id, color FROM car ORDER BY car_id"));

			Assertions.assertEquals(2, records.size());
			Assertions.assertEquals(1, records.get(0).get("car_id"));
			Assertions.assertEquals("red", records.get(0).get("COLOR"), "Lookups should ignore case");
			Assertions.assertEquals("red", records.get(0).get(1));
			Assertions.assertNull(records.get(1).get("color"));

			Optional<Record> record = statementExecutor.fetchRow(connection, Statement.of("SELECT color FROM car WHERE car_id = $1", 1));

			Assertions.assertEquals("red", record.get().get("color"));
			Assertions.assertFalse(statementExecutor.fetchRow(connection, Statement.of("SELECT color FROM car WHERE car_id = $1", 3)).isPresent());
		}
	}

	@Test
	public void testRepeatedPlaceholders() throws Exception {
		DataSource dataSource = createInMemoryDataSource("statement_executor_repeated");
		StatementExecutor statementExecutor = new StatementExecutor();

		try (Connection connection = dataSource.getConnection()) {
			statementExecutor.execute(connection, Statement.of("CREATE TABLE pair (a INTEGER, b INTEGER)"));
			statementExecutor.execute(connection, Statement.of("INSERT INTO pair VALUES ($1, $1)", 7));

			Record record = statementExecutor.fetchRow(connection, Statement.of("SELECT a, b FROM pair WHERE a = $1 AND b = $1", 7)).get();

			Assertions.assertEquals(Arrays.asList(7, 7), record.getValues());
		}
	}

	@Test
	public void testFetchRowReadsOnlyTheFirstRow() throws Exception {
		DataSource dataSource = createInMemoryDataSource("statement_executor_fetch_row");
		StatementExecutor statementExecutor = new StatementExecutor();

		try (Connection connection = dataSource.getConnection()) {
			statementExecutor.execute(connection, Statement.of("CREATE TABLE car (car_id INTEGER PRIMARY KEY, color VARCHAR(40))"));

			for (int i = 1; i <= 250; ++i)
				statementExecutor.execute(connection, Statement.of("INSERT INTO car VALUES ($1, $2)", i, "blue"));

			AtomicInteger rowsRead = new AtomicInteger();
			List<Integer> maxRows = new ArrayList<>();
			Connection countingConnection = countingConnection(connection, rowsRead, maxRows);

			Record record = statementExecutor.fetchRow(countingConnection, Statement.of("SELECT car_id, color FROM car ORDER BY car_id")).get();

			Assertions.assertEquals(1, record.get("car_id"));
			Assertions.assertEquals(1, rowsRead.get(), "Only the first row should be read");
			Assertions.assertEquals(List.of(1), maxRows);

			rowsRead.set(0);
			maxRows.clear();

			List<Record> records = statementExecutor.fetch(countingConnection, Statement.of("SELECT car_id FROM car"));

			Assertions.assertEquals(250, records.size());
			Assertions.assertEquals(251, rowsRead.get());
			Assertions.assertEquals(List.of(), maxRows, "Full fetches should not cap the row count");
		}
	}

	@Nonnull
	protected Connection countingConnection(@Nonnull Connection connection,
																					@Nonnull AtomicInteger rowsRead,
																					@Nonnull List<Integer> maxRows) {
		requireNonNull(connection);
		requireNonNull(rowsRead);
		requireNonNull(maxRows);

		return (Connection) Proxy.newProxyInstance(Connection.class.getClassLoader(), new Class<?>[]{Connection.class},
				(proxy, method, args) -> {
					Object result = invoke(method, connection, args);

					if (!(result instanceof PreparedStatement))
						return result;

					PreparedStatement preparedStatement = (PreparedStatement) result;

					return Proxy.newProxyInstance(PreparedStatement.class.getClassLoader(), new Class<?>[]{PreparedStatement.class},
							(statementProxy, statementMethod, statementArgs) -> {
								if ("setMaxRows".equals(statementMethod.getName()))
									maxRows.add((Integer) statementArgs[0]);

								Object statementResult = invoke(statementMethod, preparedStatement, statementArgs);

								if (!(statementResult instanceof ResultSet))
									return statementResult;

								ResultSet resultSet = (ResultSet) statementResult;

								return Proxy.newProxyInstance(ResultSet.class.getClassLoader(), new Class<?>[]{ResultSet.class},
										(resultSetProxy, resultSetMethod, resultSetArgs) -> {
											if ("next".equals(resultSetMethod.getName()))
												rowsRead.incrementAndGet();

											return invoke(resultSetMethod, resultSet, resultSetArgs);
										});
							});
				});
	}

	private static Object invoke(@Nonnull Method method,
															 @Nonnull Object target,
															 Object[] args) throws Throwable {
		try {
			return method.invoke(target, args);
		} catch (InvocationTargetException e) {
			throw e.getCause();
		}
	}

	@Test
	public void testStatementLogging() throws Exception {
		DataSource dataSource = createInMemoryDataSource("statement_executor_logging");
		List<StatementLog> statementLogs = new ArrayList<>();
		StatementExecutor statementExecutor = new StatementExecutor(statementLogs::add);

		try (Connection connection = dataSource.getConnection()) {
			statementExecutor.execute(connection, Statement.of("CREATE TABLE logged (id INTEGER)"));
			statementExecutor.fetch(connection, Statement.of("SELECT id FROM logged WHERE id = $1", 1));

			Assertions.assertThrows(DatabaseException.class, () -> statementExecutor.fetch(connection, Statement.of("SELECT nope FROM logged")));
		}

		Assertions.assertEquals(3, statementLogs.size());
		Assertions.assertEquals("SELECT id FROM logged WHERE id = $1", statementLogs.get(1).getStatement().getSql());
		Assertions.assertTrue(statementLogs.get(1).getResultSetMappingDuration().isPresent());
		Assertions.assertFalse(statementLogs.get(1).getException().isPresent());
		Assertions.assertTrue(statementLogs.get(2).getException().isPresent(), "Failed statements should be logged with their exception");
	}

	@Test
	public void testDefaultStatementLoggerFormatting() {
		StatementLog statementLog = StatementLog.withStatement(Statement.of("SELECT * FROM car WHERE color = $1 AND car_id = $2", "red", 1))
				.executionDuration(Duration.ofMillis(2))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertTrue(formatted.startsWith("SELECT * FROM car WHERE color = $1 AND car_id = $2\n"), formatted);
		Assertions.assertTrue(formatted.contains("Parameters: 'red', 1"), formatted);
		Assertions.assertTrue(formatted.contains("executing statement"), formatted);
	}

	@Nonnull
	protected DataSource createInMemoryDataSource(@Nonnull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
