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
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL with {@code $n} placeholders rewritten into the {@code ?} form JDBC binds, along with the parameters
 * reordered to match.
 * <p>
 * Placeholders inside string literals, quoted identifiers, comments and dollar-quoted bodies are left alone.
 * A placeholder may appear more than once, in which case its parameter is bound once per occurrence.
 *
 * @since 1.0.0
 */
@Immutable
final class PositionalSql {
	@NonNull
	private final String sql;
	@NonNull
	private final List<@Nullable Object> parameters;

	private PositionalSql(@NonNull String sql,
												@NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		this.sql = sql;
		this.parameters = Collections.unmodifiableList(parameters);
	}

	/**
	 * Rewrites {@code sql} for JDBC.
	 *
	 * @param sql        SQL using {@code $1}, {@code $2}... placeholders
	 * @param parameters the parameters, {@code $1} being the first
	 * @return the rewritten SQL and the parameters in occurrence order
	 * @throws IllegalArgumentException if a placeholder has no parameter, a parameter has no placeholder or the SQL
	 *                                  contains a bare {@code ?}
	 */
	@NonNull
	static PositionalSql parse(@NonNull String sql,
														 @NonNull List<@Nullable Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		StringBuilder jdbcSql = new StringBuilder(sql.length());
		List<Object> jdbcParameters = new ArrayList<>(parameters.size());
		boolean[] referencedParameters = new boolean[parameters.size()];

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inLineComment = false;
		boolean inBlockComment = false;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					jdbcSql.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					jdbcSql.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				jdbcSql.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (inBlockComment) {
				jdbcSql.append(c);

				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					jdbcSql.append('/');
					i += 2;
					inBlockComment = false;
				} else {
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				jdbcSql.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					jdbcSql.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						jdbcSql.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				jdbcSql.append(c);

				if (c == '"') {
					// Escaped quote: ""
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						jdbcSql.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				jdbcSql.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				jdbcSql.append("/*");
				i += 2;
				inBlockComment = true;
				continue;
			}

			if ((c == 'U' || c == 'u') && i + 2 < sql.length() && sql.charAt(i + 1) == '&' && sql.charAt(i + 2) == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				jdbcSql.append(c).append("&'");
				i += 3;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\''
					&& (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				jdbcSql.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				jdbcSql.append(c);
				++i;
				continue;
			}

			if (c == '$' && i + 1 < sql.length() && Character.isDigit(sql.charAt(i + 1))) {
				int indexEnd = i + 1;

				while (indexEnd < sql.length() && Character.isDigit(sql.charAt(indexEnd)))
					++indexEnd;

				int placeholderIndex = Integer.parseInt(sql.substring(i + 1, indexEnd));

				if (placeholderIndex < 1 || placeholderIndex > parameters.size())
					throw new IllegalArgumentException(format("Placeholder $%d has no matching parameter (%d parameter[s] supplied). SQL: %s",
							placeholderIndex, parameters.size(), sql));

				jdbcSql.append('?');
				jdbcParameters.add(parameters.get(placeholderIndex - 1));
				referencedParameters[placeholderIndex - 1] = true;
				i = indexEnd;
				continue;
			}

			if (c == '$' && (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					jdbcSql.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			if (c == '?')
				throw new IllegalArgumentException(format("JDBC-style '?' placeholders are not supported. Use $1, $2... instead. SQL: %s", sql));

			jdbcSql.append(c);
			++i;
		}

		List<String> unreferencedPlaceholders = new ArrayList<>();

		for (int i = 0; i < referencedParameters.length; ++i)
			if (!referencedParameters[i])
				unreferencedPlaceholders.add(format("$%d", i + 1));

		if (unreferencedPlaceholders.size() > 0)
			throw new IllegalArgumentException(format("%d parameter[s] supplied but SQL never references %s. SQL: %s",
					parameters.size(), String.join(", ", unreferencedPlaceholders), sql));

		return new PositionalSql(jdbcSql.toString(), jdbcParameters);
	}

	/**
	 * A dollar-quote delimiter is {@code $$} or {@code $tag$}, where the tag does not start with a digit.
	 */
	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		int i = startIndex + 1;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!Character.isJavaIdentifierPart(c) || (i == startIndex + 1 && Character.isDigit(c)))
				return null;

			++i;
		}

		return null;
	}

	@NonNull
	String getSql() {
		return this.sql;
	}

	@NonNull
	List<@Nullable Object> getParameters() {
		return this.parameters;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameters=%s}", getClass().getSimpleName(), getSql(), getParameters());
	}
}
