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

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A SQL string using PostgreSQL-style {@code $1, $2...} placeholders together with its parameters.
 * <p>
 * {@code getParameters().get(i)} is bound to placeholder {@code $(i+1)}.
 *
 * @since 1.0.0
 */
@Immutable
public final class Statement {
	@NonNull
	private final String sql;
	@NonNull
	private final List<@Nullable Object> parameters;

	private Statement(@NonNull String sql,
										@NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		this.sql = sql;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
	}

	@NonNull
	public static Statement of(@NonNull String sql,
														 @Nullable Object... parameters) {
		requireNonNull(sql);
		return new Statement(sql, parameters == null ? List.of() : Arrays.asList(parameters));
	}

	@NonNull
	public static Statement of(@NonNull String sql,
														 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);
		return new Statement(sql, parameters);
	}

	/**
	 * The statement in driver-call form: the SQL first, then each parameter in placeholder order.
	 *
	 * @return an unmodifiable list of {@code 1 + getParameters().size()} elements
	 */
	@NonNull
	public List<@Nullable Object> query() {
		List<Object> query = new ArrayList<>(getParameters().size() + 1);
		query.add(getSql());
		query.addAll(getParameters());
		return Collections.unmodifiableList(query);
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(getSql(), statement.getSql())
				&& Objects.equals(getParameters(), statement.getParameters());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameters=%s}", getClass().getSimpleName(), getSql(), getParameters());
	}
}
