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
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * {@link StatementLogger} which writes through {@code java.util.logging}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.tessera.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * Parameters longer than this are ellipsized.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a statement logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatStatementLog(statementLog));
	}

	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		List<String> timingEntries = new ArrayList<>(3);

		statementLog.getPreparationDuration().ifPresent(duration -> timingEntries.add(format("%s preparing statement", duration)));
		statementLog.getExecutionDuration().ifPresent(duration -> timingEntries.add(format("%s executing statement", duration)));
		statementLog.getResultSetMappingDuration().ifPresent(duration -> timingEntries.add(format("%s processing resultset", duration)));

		List<String> lines = new ArrayList<>(4);

		lines.add(statementLog.getStatement().getSql());

		if (statementLog.getStatement().getParameters().size() > 0)
			lines.add(format("Parameters: %s", statementLog.getStatement().getParameters().stream().map(parameter -> {
				if (parameter == null)
					return "null";

				if (parameter instanceof Number || parameter instanceof Boolean)
					return parameter.toString();

				if (parameter instanceof byte[])
					return format("[byte array of length %d]", ((byte[]) parameter).length);

				return format("'%s'", ellipsize(parameter.toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));
			}).collect(joining(", "))));

		if (timingEntries.size() > 0)
			lines.add(String.join(", ", timingEntries));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null) {
			if (exception instanceof DatabaseException && exception.getCause() != null)
				exception = exception.getCause();

			lines.add(format("Failed due to %s", exception));
		}

		return String.join("\n", lines);
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}
