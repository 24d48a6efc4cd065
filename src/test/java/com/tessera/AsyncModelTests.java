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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class AsyncModelTests {
	public static class FourWheels implements Supplier<Integer> {
		@Override
		public Integer get() {
			return 4;
		}
	}

	public static class Car extends Model {
		@DatabaseColumn(value = "car_id", type = "integer", primaryKey = true)
		private Integer id;
		@DatabaseColumn(type = "varchar(40)")
		private String color;
		@DatabaseColumn(type = "integer", defaultValue = FourWheels.class)
		private Integer wheels;
	}

	@DatabaseTable(value = "garage_car", returnRecords = false)
	public static class GarageCar extends Model {
		@DatabaseColumn(value = "car_id", type = "integer", primaryKey = true)
		private Integer id;
		@DatabaseColumn(type = "varchar(40)")
		private String color;
	}

	@Test
	public void testRoundTripWithSingleConnectionManager() throws Exception {
		DataSource dataSource = createInMemoryDataSource("async_model_single");

		try (SingleConnectionManager connectionManager = new SingleConnectionManager(dataSource::getConnection)) {
			exerciseRoundTrip(AsyncModel.forType(Car.class).connectionManager(connectionManager).build());
		}
	}

	@Test
	public void testRoundTripWithKeptConnection() throws Exception {
		DataSource dataSource = createInMemoryDataSource("async_model_kept");

		try (SingleConnectionManager connectionManager = new SingleConnectionManager(dataSource::getConnection, true)) {
			exerciseRoundTrip(AsyncModel.forType(Car.class).connectionManager(connectionManager).build());
		}
	}

	@Test
	public void testRoundTripWithPoolManager() throws Exception {
		try (PoolManager poolManager = PoolManager.withJdbcUrl("jdbc:hsqldb:mem:async_model_pool", "sa", "")) {
			exerciseRoundTrip(AsyncModel.forType(Car.class).connectionManager(poolManager).build());
		}
	}

	protected void exerciseRoundTrip(@Nonnull AsyncModel<Car> cars) throws Exception {
		requireNonNull(cars);

		cars.createTable().get();

		Car car = cars.create(Map.of("id", 1, "color", "red"));

		Assertions.assertEquals(4, car.wheels, "Column default should be applied");
		Assertions.assertEquals(ModelState.TRANSIENT, car.getModelState());

		Assertions.assertSame(car, cars.save(car).get());
		Assertions.assertEquals(ModelState.PERSISTED, car.getModelState());

		List<Car> redCars = cars.getInstances(Map.of("color", "red")).get();

		Assertions.assertEquals(1, redCars.size());
		Assertions.assertEquals(1, redCars.get(0).id);
		Assertions.assertEquals("red", redCars.get(0).color);
		Assertions.assertEquals(4, redCars.get(0).wheels);
		Assertions.assertEquals(ModelState.PERSISTED, redCars.get(0).getModelState());

		car.color = "blue";
		cars.save(car).get();

		Car blueCar = cars.getOneInstance(Map.of("id", 1)).get().get();

		Assertions.assertEquals("blue", blueCar.color, "Second save should update the existing row");
		Assertions.assertEquals(1, cars.getRecords(Map.of()).get().size());

		Record record = cars.getOneRecord(Map.of("car_id", 1)).get().get();

		Assertions.assertEquals("blue", record.get("color"));

		List<?> defaultRows = cars.get(Map.of(), null).get();
		List<?> instanceRows = cars.get(Map.of(), false).get();

		Assertions.assertTrue(defaultRows.get(0) instanceof Record, "Records should be returned by default");
		Assertions.assertTrue(instanceRows.get(0) instanceof Car);
		Assertions.assertTrue(cars.getOne(Map.of("color", "blue"), false).get().get() instanceof Car);

		Assertions.assertEquals(1, cars.execute("UPDATE car SET wheels = $1 WHERE car_id = $2", 3, 1).get());
		Assertions.assertEquals(3, cars.getOneInstance(Map.of("id", 1)).get().get().wheels);

		Assertions.assertSame(car, cars.delete(car).get());
		Assertions.assertEquals(ModelState.DETACHED, car.getModelState());
		Assertions.assertFalse(cars.getOneInstance(Map.of("id", 1)).get().isPresent());

		ExecutionException deleteFailure = Assertions.assertThrows(ExecutionException.class, () -> cars.delete(car).get());

		Assertions.assertTrue(deleteFailure.getCause() instanceof ExecutionFailureException, "Deleting a missing row should fail");

		cars.save(car).get();

		Assertions.assertTrue(cars.getOneInstance(Map.of("id", 1)).get().isPresent(), "Saving a deleted instance should insert it again");

		cars.truncateTable(false).get();

		Assertions.assertEquals(0, cars.getRecords(Map.of()).get().size());

		cars.dropTable(false).get();
	}

	@Test
	public void testReturnRecordsFollowsTableAndBuilder() throws Exception {
		DataSource dataSource = createInMemoryDataSource("async_model_return_records");

		try (SingleConnectionManager connectionManager = new SingleConnectionManager(dataSource::getConnection)) {
			AsyncModel<GarageCar> garageCars = AsyncModel.forType(GarageCar.class).connectionManager(connectionManager).build();
			garageCars.createTable().get();

			GarageCar garageCar = garageCars.create(Map.of("id", 7, "color", "green"));
			garageCars.save(garageCar).get();

			Assertions.assertTrue(garageCars.get(Map.of(), null).get().get(0) instanceof GarageCar);

			AsyncModel<GarageCar> garageRecords = AsyncModel.forType(GarageCar.class)
					.connectionManager(connectionManager)
					.returnRecords(true)
					.build();

			Optional<?> row = garageRecords.getOne(Map.of("id", 7), null).get();

			Assertions.assertTrue(row.get() instanceof Record);
			Assertions.assertEquals(garageCar.color, ((Record) row.get()).get("color"));
		}
	}

	@Test
	public void testFailuresCompleteFutureWithOriginalException() throws Exception {
		DataSource dataSource = createInMemoryDataSource("async_model_failures");

		try (SingleConnectionManager connectionManager = new SingleConnectionManager(dataSource::getConnection)) {
			AsyncModel<Car> cars = AsyncModel.forType(Car.class).connectionManager(connectionManager).build();

			CompletableFuture<Integer> failed = cars.execute("SELECT * FROM missing_table");
			ExecutionException failure = Assertions.assertThrows(ExecutionException.class, failed::get);

			Assertions.assertTrue(failure.getCause() instanceof DatabaseException);

			ExecutionException filterFailure = Assertions.assertThrows(ExecutionException.class,
					() -> cars.getRecords(Map.of("nickname", "x")).get());

			Assertions.assertTrue(filterFailure.getCause() instanceof ConfigurationException);
		}
	}

	@Test
	public void testMissingConnectionManager() {
		Assertions.assertThrows(IllegalStateException.class, () -> AsyncModel.forType(Car.class).build());
	}

	@Test
	public void testOperationsRunOnExecutor() throws Exception {
		DataSource dataSource = createInMemoryDataSource("async_model_executor");
		ExecutorService executorService = Executors.newFixedThreadPool(2);
		AtomicInteger executions = new AtomicInteger();
		List<StatementLog> statementLogs = new ArrayList<>();

		try (SingleConnectionManager connectionManager = new SingleConnectionManager(dataSource::getConnection)) {
			AsyncModel<Car> cars = AsyncModel.forType(Car.class)
					.connectionManager(connectionManager)
					.executor((runnable) -> {
						executions.incrementAndGet();
						executorService.execute(runnable);
					})
					.statementLogger((statementLog) -> {
						synchronized (statementLogs) {
							statementLogs.add(statementLog);
						}
					})
					.build();

			cars.createTable().get(5, TimeUnit.SECONDS);

			Car car = new Car();
			car.id = 9;
			car.color = "black";

			cars.save(car).get(5, TimeUnit.SECONDS);

			Assertions.assertEquals("black", cars.getOneInstance(Map.of("id", 9)).get(5, TimeUnit.SECONDS).get().color);
			Assertions.assertEquals(3, executions.get());

			synchronized (statementLogs) {
				Assertions.assertEquals(3, statementLogs.size());
				Assertions.assertEquals("INSERT INTO car (car_id, color, wheels) VALUES ($1, $2, $3)", statementLogs.get(1).getStatement().getSql());
			}
		} finally {
			executorService.shutdownNow();
		}
	}

	@Test
	public void testFromRecord() {
		AsyncModel<Car> cars = AsyncModel.forType(Car.class)
				.connectionManager(new SingleConnectionManager(() -> {
					throw new IllegalStateException("No connection expected");
				}))
				.build();

		Car car = cars.fromRecord(new Record(List.of("CAR_ID", "COLOR", "WHEELS"), List.of(5, "white", 3)));

		Assertions.assertEquals(5, car.id);
		Assertions.assertEquals("white", car.color);
		Assertions.assertEquals(3, car.wheels);
		Assertions.assertEquals(ModelState.PERSISTED, car.getModelState());
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
