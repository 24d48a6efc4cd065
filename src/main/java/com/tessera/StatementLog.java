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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Timings and outcome of one statement execution.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final Statement statement;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration resultSetMappingDuration;
	@Nullable
	private final Exception exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.statement = requireNonNull(builder.statement);
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.resultSetMappingDuration = builder.resultSetMappingDuration;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.resultSetMappingDuration != null)
			totalDuration = totalDuration.plus(this.resultSetMappingDuration);

		this.totalDuration = totalDuration;
	}

	@NonNull
	public static Builder withStatement(@NonNull Statement statement) {
		requireNonNull(statement);
		return new Builder(statement);
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("statement=%s", getStatement()));
		components.add(format("totalDuration=%s", getTotalDuration()));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getResultSetMappingDuration().ifPresent(duration -> components.add(format("resultSetMappingDuration=%s", duration)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	/**
	 * How long did it take to prepare the statement and bind its parameters?
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to turn the {@link java.sql.ResultSet} into records?
	 */
	@NonNull
	public Optional<Duration> getResultSetMappingDuration() {
		return Optional.ofNullable(this.resultSetMappingDuration);
	}

	/**
	 * Sum of the preparation, execution and result set mapping durations.
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Statement getStatement() {
		return this.statement;
	}

	@NonNull
	public Optional<Exception> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final Statement statement;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration resultSetMappingDuration;
		@Nullable
		private Exception exception;

		private Builder(@NonNull Statement statement) {
			requireNonNull(statement);
			this.statement = statement;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder resultSetMappingDuration(@Nullable Duration resultSetMappingDuration) {
			this.resultSetMappingDuration = resultSetMappingDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Exception exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}
