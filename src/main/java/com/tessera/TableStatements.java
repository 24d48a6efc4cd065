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

import javax.annotation.concurrent.ThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * DDL helpers for the table behind a model type.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TableStatements {
	private TableStatements() {
		// Non-instantiable
	}

	/**
	 * {@code CREATE TABLE IF NOT EXISTS <table> (<column ddl>, ...)}.
	 *
	 * @throws ConfigurationException if a column has no {@link ColumnType}
	 */
	@NonNull
	public static <M extends Model> Statement createTable(@NonNull Class<M> modelType) {
		requireNonNull(modelType);

		Schema<M> schema = Schema.of(modelType);

		if (schema.getColumns().size() == 0)
			throw new ConfigurationException(format("%s declares no columns", modelType.getName()));

		return Statement.of(format("CREATE TABLE IF NOT EXISTS %s (%s)", schema.getTableName(),
				schema.getColumns().stream().map(Column::getDdl).collect(joining(", "))));
	}

	@NonNull
	public static <M extends Model> Statement dropTable(@NonNull Class<M> modelType,
																											boolean cascade) {
		requireNonNull(modelType);
		return Statement.of(format("DROP TABLE IF EXISTS %s%s", Schema.of(modelType).getTableName(), cascade ? " CASCADE" : ""));
	}

	@NonNull
	public static <M extends Model> Statement truncateTable(@NonNull Class<M> modelType,
																													boolean cascade) {
		requireNonNull(modelType);
		return Statement.of(format("TRUNCATE TABLE %s%s", Schema.of(modelType).getTableName(), cascade ? " CASCADE" : ""));
	}
}
