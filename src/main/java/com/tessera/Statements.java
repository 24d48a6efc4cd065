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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Builds the SELECT, INSERT, UPDATE and DELETE statements for a model type.
 * <p>
 * Placeholders are numbered from {@code $1} in the order values are appended, so the parameter list of every
 * statement lines up with its placeholders.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statements {
	private Statements() {
		// Non-instantiable
	}

	/**
	 * {@code SELECT <keys> FROM <table>}.
	 */
	@NonNull
	public static <M extends Model> Statement select(@NonNull Class<M> modelType) {
		return select(modelType, Map.of());
	}

	/**
	 * {@code SELECT <keys> FROM <table> WHERE <k1> = $1 AND <k2> = $2...}, one equality per filter entry.
	 *
	 * @param modelType the model type to select
	 * @param filters   column keys or attribute names mapped to the values they must equal
	 * @return the statement
	 * @throws ConfigurationException if a filter names no column of {@code modelType}
	 */
	@NonNull
	public static <M extends Model> Statement select(@NonNull Class<M> modelType,
																									 @NonNull Map<@NonNull String, ? extends @Nullable Object> filters) {
		requireNonNull(modelType);
		requireNonNull(filters);

		Schema<M> schema = Schema.of(modelType);
		Placeholders placeholders = new Placeholders();
		List<String> conditions = new ArrayList<>(filters.size());

		for (Map.Entry<String, ? extends Object> filter : filters.entrySet())
			conditions.add(format("%s = %s", schema.resolveColumn(filter.getKey()).getKey(), placeholders.add(filter.getValue())));

		String sql = format("SELECT %s FROM %s", String.join(", ", schema.getColumnKeys()), schema.getTableName());

		if (conditions.size() > 0)
			sql = format("%s WHERE %s", sql, String.join(" AND ", conditions));

		return placeholders.toStatement(sql);
	}

	/**
	 * {@code INSERT INTO <table> (<keys>) VALUES ($1, ..., $n)} with the instance's current values.
	 */
	@NonNull
	public static <M extends Model> Statement insert(@NonNull M instance) {
		requireNonNull(instance);

		Schema<?> schema = Schema.of(instance.getClass());
		Placeholders placeholders = new Placeholders();

		String values = schema.getColumns().stream()
				.map(column -> placeholders.add(column.get(instance)))
				.collect(joining(", "));

		return placeholders.toStatement(format("INSERT INTO %s (%s) VALUES (%s)", schema.getTableName(),
				String.join(", ", schema.getColumnKeys()), values));
	}

	/**
	 * {@code UPDATE <table> SET (<keys>) = ($1, ..., $n) WHERE <table>.<pk> = $(n+1)}.
	 * <p>
	 * Every column is written, the primary key included. A schema with a single column renders
	 * {@code SET <key> = $1}, since PostgreSQL rejects a parenthesized list of one target.
	 *
	 * @throws ConfigurationException if the model type has no primary key
	 */
	@NonNull
	public static <M extends Model> Statement update(@NonNull M instance) {
		requireNonNull(instance);

		Schema<?> schema = Schema.of(instance.getClass());
		Column primaryKey = schema.requirePrimaryKey();
		Placeholders placeholders = new Placeholders();

		String values = schema.getColumns().stream()
				.map(column -> placeholders.add(column.get(instance)))
				.collect(joining(", "));

		String assignment = schema.getColumns().size() == 1
				? format("%s = %s", primaryKey.getKey(), values)
				: format("(%s) = (%s)", String.join(", ", schema.getColumnKeys()), values);

		return placeholders.toStatement(format("UPDATE %s SET %s WHERE %s.%s = %s", schema.getTableName(), assignment,
				schema.getTableName(), primaryKey.getKey(), placeholders.add(primaryKey.get(instance))));
	}

	/**
	 * {@code DELETE FROM <table> WHERE <table>.<pk> = $1}.
	 *
	 * @throws ConfigurationException if the model type has no primary key
	 */
	@NonNull
	public static <M extends Model> Statement delete(@NonNull M instance) {
		requireNonNull(instance);

		Schema<?> schema = Schema.of(instance.getClass());
		Column primaryKey = schema.requirePrimaryKey();
		Placeholders placeholders = new Placeholders();

		return placeholders.toStatement(format("DELETE FROM %s WHERE %s.%s = %s", schema.getTableName(),
				schema.getTableName(), primaryKey.getKey(), placeholders.add(primaryKey.get(instance))));
	}

	/**
	 * Hands out {@code $n} placeholders and collects the values they stand for.
	 */
	@NotThreadSafe
	private static final class Placeholders {
		@NonNull
		private final List<@Nullable Object> parameters = new ArrayList<>();

		@NonNull
		String add(@Nullable Object value) {
			this.parameters.add(value);
			return format("$%d", this.parameters.size());
		}

		@NonNull
		Statement toStatement(@NonNull String sql) {
			requireNonNull(sql);
			return Statement.of(sql, this.parameters);
		}
	}
}
