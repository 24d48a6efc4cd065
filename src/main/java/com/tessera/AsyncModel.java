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
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persistence operations for one model type, bound to a {@link ConnectionManager}.
 * <p>
 * Every operation runs on the configured {@link Executor} (by default, the calling thread) and reports through the
 * returned {@link CompletableFuture}. A failed operation completes its future exceptionally with the exception
 * that caused the failure, unwrapped.
 *
 * @param <M> the model type
 * @since 1.0.0
 */
@ThreadSafe
public final class AsyncModel<M extends Model> {
	@NonNull
	private static final Executor DIRECT_EXECUTOR;

	static {
		DIRECT_EXECUTOR = Runnable::run;
	}

	@NonNull
	private final Schema<M> schema;
	@NonNull
	private final ConnectionManager connectionManager;
	private final boolean returnRecords;
	@NonNull
	private final Executor executor;
	@NonNull
	private final StatementExecutor statementExecutor;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final Logger logger;

	private AsyncModel(@NonNull Builder<M> builder) {
		requireNonNull(builder);

		if (builder.connectionManager == null)
			throw new IllegalStateException(format("No connection manager was configured for %s", builder.modelType.getSimpleName()));

		this.schema = Schema.of(builder.modelType);
		this.connectionManager = builder.connectionManager;
		this.returnRecords = builder.returnRecords == null ? this.schema.isReturnRecords() : builder.returnRecords;
		this.executor = builder.executor == null ? DIRECT_EXECUTOR : builder.executor;
		this.statementExecutor = new StatementExecutor(builder.statementLogger == null ? new DefaultStatementLogger() : builder.statementLogger);
		this.instanceProvider = builder.instanceProvider == null ? InstanceProvider.DEFAULT : builder.instanceProvider;
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Starts configuring operations for the given model type.
	 *
	 * @param modelType the model type
	 * @param <M>       the model type
	 * @return a builder
	 * @throws ConfigurationException if the model type's declaration is invalid
	 */
	@NonNull
	public static <M extends Model> Builder<M> forType(@NonNull Class<M> modelType) {
		requireNonNull(modelType);
		return new Builder<>(modelType);
	}

	/**
	 * Inserts the instance if it is not backed by a row yet, otherwise updates its row.
	 *
	 * @param instance the instance to save
	 * @return the saved instance, now {@link ModelState#PERSISTED}
	 */
	@NonNull
	public CompletableFuture<M> save(@NonNull M instance) {
		requireNonNull(instance);

		return perform(() -> {
			boolean insert = instance.getModelState() != ModelState.PERSISTED;
			Statement statement = insert ? Statements.insert(instance) : Statements.update(instance);

			Integer updateCount = getConnectionManager().transaction((connection) -> getStatementExecutor().execute(connection, statement));

			if (!insert && updateCount == 0)
				logger.fine(format("Update of %s matched no row", instance));

			instance.setModelState(ModelState.PERSISTED);
			return instance;
		});
	}

	/**
	 * Fetches every row matching {@code filters}.
	 *
	 * @param filters column keys or attribute names mapped to the values they must equal
	 * @param records {@code true} for {@link Record}s, {@code false} for instances, {@code null} for this handle's
	 *                default
	 * @return the matching rows
	 */
	@NonNull
	public CompletableFuture<List<?>> get(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters,
																				@Nullable Boolean records) {
		requireNonNull(filters);

		if (records == null ? isReturnRecords() : records)
			return getRecords(filters).thenApply((rows) -> rows);

		return getInstances(filters).thenApply((instances) -> instances);
	}

	@NonNull
	public CompletableFuture<List<Record>> getRecords(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters) {
		requireNonNull(filters);

		return perform(() -> {
			Statement statement = Statements.select(getSchema().getModelType(), filters);
			return getConnectionManager().transaction((connection) -> getStatementExecutor().fetch(connection, statement));
		});
	}

	@NonNull
	public CompletableFuture<List<M>> getInstances(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters) {
		requireNonNull(filters);

		return perform(() -> {
			Statement statement = Statements.select(getSchema().getModelType(), filters);
			List<Record> records = getConnectionManager().transaction((connection) ->
					getStatementExecutor().fetch(connection, statement, getSchema()));

			List<M> instances = new ArrayList<>(records.size());

			for (Record record : records)
				instances.add(fromRecord(record));

			return instances;
		});
	}

	/**
	 * Fetches the first row matching {@code filters}, if any.
	 *
	 * @param filters column keys or attribute names mapped to the values they must equal
	 * @param record  {@code true} for a {@link Record}, {@code false} for an instance, {@code null} for this handle's
	 *                default
	 * @return the first matching row
	 */
	@NonNull
	public CompletableFuture<Optional<?>> getOne(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters,
																							 @Nullable Boolean record) {
		requireNonNull(filters);

		if (record == null ? isReturnRecords() : record)
			return getOneRecord(filters).thenApply((row) -> row);

		return getOneInstance(filters).thenApply((instance) -> instance);
	}

	@NonNull
	public CompletableFuture<Optional<Record>> getOneRecord(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters) {
		requireNonNull(filters);

		return perform(() -> {
			Statement statement = Statements.select(getSchema().getModelType(), filters);
			return getConnectionManager().transaction((connection) -> getStatementExecutor().fetchRow(connection, statement));
		});
	}

	@NonNull
	public CompletableFuture<Optional<M>> getOneInstance(@NonNull Map<@NonNull String, ? extends @Nullable Object> filters) {
		requireNonNull(filters);

		return perform(() -> {
			Statement statement = Statements.select(getSchema().getModelType(), filters);
			Optional<Record> record = getConnectionManager().transaction((connection) ->
					getStatementExecutor().fetchRow(connection, statement, getSchema()));

			return record.map(this::fromRecord);
		});
	}

	/**
	 * Deletes the instance's row.
	 *
	 * @param instance the instance to delete
	 * @return the instance, now {@link ModelState#DETACHED}
	 * @throws ExecutionFailureException (via the future) if no row was deleted
	 */
	@NonNull
	public CompletableFuture<M> delete(@NonNull M instance) {
		requireNonNull(instance);

		return perform(() -> {
			Statement statement = Statements.delete(instance);
			Integer updateCount = getConnectionManager().transaction((connection) -> getStatementExecutor().execute(connection, statement));

			if (updateCount == 0)
				throw new ExecutionFailureException(format("Delete of %s matched no row in table '%s'", instance, getSchema().getTableName()));

			instance.setModelState(ModelState.DETACHED);
			return instance;
		});
	}

	/**
	 * Executes arbitrary SQL with {@code $n} placeholders in a transaction.
	 *
	 * @return the number of rows affected
	 */
	@NonNull
	public CompletableFuture<Integer> execute(@NonNull String sql,
																						@Nullable Object... parameters) {
		requireNonNull(sql);
		return execute(Statement.of(sql, parameters));
	}

	@NonNull
	public CompletableFuture<Integer> execute(@NonNull Statement statement) {
		requireNonNull(statement);
		return perform(() -> getConnectionManager().transaction((connection) -> getStatementExecutor().execute(connection, statement)));
	}

	@NonNull
	public CompletableFuture<Integer> createTable() {
		return execute(TableStatements.createTable(getSchema().getModelType()));
	}

	@NonNull
	public CompletableFuture<Integer> dropTable(boolean cascade) {
		return execute(TableStatements.dropTable(getSchema().getModelType(), cascade));
	}

	@NonNull
	public CompletableFuture<Integer> truncateTable(boolean cascade) {
		return execute(TableStatements.truncateTable(getSchema().getModelType(), cascade));
	}

	/**
	 * Creates a transient instance from attribute values. Names that match no column land in the instance's extras.
	 */
	@NonNull
	public M create(@NonNull Map<@NonNull String, ? extends @Nullable Object> attributes) {
		requireNonNull(attributes);
		return getSchema().instantiate(attributes, getInstanceProvider());
	}

	/**
	 * Maps a row into a {@link ModelState#PERSISTED} instance.
	 *
	 * @throws MappingException if the row does not fit this model type
	 */
	@NonNull
	public M fromRecord(@NonNull Record record) {
		requireNonNull(record);
		return getSchema().fromRecord(record, getInstanceProvider());
	}

	@NonNull
	private <T> CompletableFuture<T> perform(@NonNull Supplier<T> operation) {
		requireNonNull(operation);

		CompletableFuture<T> future = new CompletableFuture<>();

		try {
			getExecutor().execute(() -> {
				try {
					future.complete(operation.get());
				} catch (Throwable t) {
					future.completeExceptionally(t);
				}
			});
		} catch (RuntimeException e) {
			future.completeExceptionally(e);
		}

		return future;
	}

	@NonNull
	public Schema<M> getSchema() {
		return this.schema;
	}

	@NonNull
	public ConnectionManager getConnectionManager() {
		return this.connectionManager;
	}

	public boolean isReturnRecords() {
		return this.returnRecords;
	}

	@NonNull
	public Executor getExecutor() {
		return this.executor;
	}

	@NonNull
	public StatementExecutor getStatementExecutor() {
		return this.statementExecutor;
	}

	@NonNull
	public InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{schema=%s, connectionManager=%s, returnRecords=%s}", getClass().getSimpleName(),
				getSchema(), getConnectionManager(), isReturnRecords());
	}

	/**
	 * Builder used to construct instances of {@link AsyncModel}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @param <M> the model type
	 */
	@NotThreadSafe
	public static final class Builder<M extends Model> {
		@NonNull
		private final Class<M> modelType;
		@Nullable
		private ConnectionManager connectionManager;
		@Nullable
		private Boolean returnRecords;
		@Nullable
		private Executor executor;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private InstanceProvider instanceProvider;

		private Builder(@NonNull Class<M> modelType) {
			requireNonNull(modelType);
			this.modelType = modelType;
		}

		@NonNull
		public Builder<M> connectionManager(@Nullable ConnectionManager connectionManager) {
			this.connectionManager = connectionManager;
			return this;
		}

		/**
		 * Whether reads return {@link Record}s rather than instances when not told otherwise. Defaults to the
		 * model type's {@link DatabaseTable#returnRecords()}.
		 */
		@NonNull
		public Builder<M> returnRecords(@Nullable Boolean returnRecords) {
			this.returnRecords = returnRecords;
			return this;
		}

		@NonNull
		public Builder<M> executor(@Nullable Executor executor) {
			this.executor = executor;
			return this;
		}

		@NonNull
		public Builder<M> statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder<M> instanceProvider(@Nullable InstanceProvider instanceProvider) {
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public AsyncModel<M> build() {
			return new AsyncModel<>(this);
		}
	}
}
