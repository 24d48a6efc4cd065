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

import javax.annotation.concurrent.Immutable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * The storage type of a database column, e.g. {@code uuid} or {@code varchar(40)}.
 * <p>
 * Column types only feed DDL generation (see {@link TableStatements}); statement builders never look at them and
 * no value is ever validated against one.
 *
 * @since 1.0.0
 */
@Immutable
public final class ColumnType {
	@NonNull
	private static final Pattern DECLARATION_PATTERN;

	@NonNull
	public static final ColumnType TEXT;
	@NonNull
	public static final ColumnType UUID;
	@NonNull
	public static final ColumnType BOOLEAN;
	@NonNull
	public static final ColumnType SMALL_INTEGER;
	@NonNull
	public static final ColumnType INTEGER;
	@NonNull
	public static final ColumnType BIG_INTEGER;
	@NonNull
	public static final ColumnType SERIAL;
	@NonNull
	public static final ColumnType BIG_SERIAL;
	@NonNull
	public static final ColumnType NUMERIC;
	@NonNull
	public static final ColumnType REAL;
	@NonNull
	public static final ColumnType DOUBLE;
	@NonNull
	public static final ColumnType MONEY;
	@NonNull
	public static final ColumnType DATE;
	@NonNull
	public static final ColumnType TIME;
	@NonNull
	public static final ColumnType TIMESTAMP;
	@NonNull
	public static final ColumnType TIMESTAMP_WITH_TIME_ZONE;
	@NonNull
	public static final ColumnType INTERVAL;
	@NonNull
	public static final ColumnType BINARY;
	@NonNull
	public static final ColumnType JSON;
	@NonNull
	public static final ColumnType JSONB;
	@NonNull
	public static final ColumnType INET;
	@NonNull
	public static final ColumnType CIDR;
	@NonNull
	public static final ColumnType XML;

	static {
		DECLARATION_PATTERN = Pattern.compile("^\\s*([^()]+?)\\s*(?:\\(\\s*([0-9\\s,]*)\\s*\\))?\\s*$");

		TEXT = new ColumnType("text", List.of());
		UUID = new ColumnType("uuid", List.of());
		BOOLEAN = new ColumnType("bool", List.of());
		SMALL_INTEGER = new ColumnType("int2", List.of());
		INTEGER = new ColumnType("integer", List.of());
		BIG_INTEGER = new ColumnType("int8", List.of());
		SERIAL = new ColumnType("serial4", List.of());
		BIG_SERIAL = new ColumnType("serial8", List.of());
		NUMERIC = new ColumnType("numeric", List.of());
		REAL = new ColumnType("float4", List.of());
		DOUBLE = new ColumnType("float8", List.of());
		MONEY = new ColumnType("money", List.of());
		DATE = new ColumnType("date", List.of());
		TIME = new ColumnType("time", List.of());
		TIMESTAMP = new ColumnType("timestamp", List.of());
		TIMESTAMP_WITH_TIME_ZONE = new ColumnType("timestamptz", List.of());
		INTERVAL = new ColumnType("interval", List.of());
		BINARY = new ColumnType("bytea", List.of());
		JSON = new ColumnType("json", List.of());
		JSONB = new ColumnType("jsonb", List.of());
		INET = new ColumnType("inet", List.of());
		CIDR = new ColumnType("cidr", List.of());
		XML = new ColumnType("xml", List.of());
	}

	@NonNull
	private final String sqlName;
	@NonNull
	private final List<@NonNull Integer> parameters;

	private ColumnType(@NonNull String sqlName,
										 @NonNull List<@NonNull Integer> parameters) {
		requireNonNull(sqlName);
		requireNonNull(parameters);

		if (sqlName.trim().length() == 0)
			throw new IllegalArgumentException("Column type name must not be blank");

		this.sqlName = sqlName.trim();
		this.parameters = List.copyOf(parameters);
	}

	/**
	 * Creates a column type with the given SQL name and optional parameters, e.g. {@code of("varchar", 40)}.
	 *
	 * @param sqlName    the type name as the database knows it
	 * @param parameters length, precision, scale and so on
	 * @return a column type
	 */
	@NonNull
	public static ColumnType of(@NonNull String sqlName,
															@NonNull Integer... parameters) {
		requireNonNull(sqlName);
		requireNonNull(parameters);

		return new ColumnType(sqlName, List.of(parameters));
	}

	@NonNull
	public static ColumnType varchar(int length) {
		return of("varchar", length);
	}

	@NonNull
	public static ColumnType character(int length) {
		return of("char", length);
	}

	@NonNull
	public static ColumnType numeric(int precision,
																	 int scale) {
		return of("numeric", precision, scale);
	}

	/**
	 * An array whose elements are of the given type, rendered as {@code <type>[]}.
	 *
	 * @param elementType the type of each array element
	 * @return an array column type
	 */
	@NonNull
	public static ColumnType arrayOf(@NonNull ColumnType elementType) {
		requireNonNull(elementType);
		return new ColumnType(format("%s[]", elementType.render()), List.of());
	}

	/**
	 * Parses a declaration such as {@code varchar(40)} or {@code numeric(10, 2)}.
	 *
	 * @param declaration the type as it would appear in DDL
	 * @return the parsed column type
	 * @throws ConfigurationException if the declaration is blank or its parameters are not integers
	 */
	@NonNull
	public static ColumnType parse(@NonNull String declaration) {
		requireNonNull(declaration);

		Matcher matcher = DECLARATION_PATTERN.matcher(declaration);

		if (declaration.trim().length() == 0 || !matcher.matches())
			throw new ConfigurationException(format("Unable to parse column type '%s'", declaration));

		String sqlName = matcher.group(1);
		String rawParameters = matcher.group(2);
		List<Integer> parameters = new ArrayList<>();

		if (rawParameters != null && rawParameters.trim().length() > 0) {
			for (String rawParameter : rawParameters.split(",")) {
				try {
					parameters.add(Integer.valueOf(rawParameter.trim()));
				} catch (NumberFormatException e) {
					throw new ConfigurationException(format("Unable to parse column type '%s'", declaration), e);
				}
			}
		}

		return new ColumnType(sqlName, parameters);
	}

	/**
	 * @return the DDL rendering of this type, e.g. {@code varchar(40)}
	 */
	@NonNull
	public String render() {
		if (getParameters().isEmpty())
			return getSqlName();

		return format("%s(%s)", getSqlName(), getParameters().stream().map(String::valueOf).collect(joining(", ")));
	}

	@NonNull
	public String getSqlName() {
		return this.sqlName;
	}

	@NonNull
	public List<@NonNull Integer> getParameters() {
		return this.parameters;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnType))
			return false;

		return Objects.equals(render(), ((ColumnType) object).render());
	}

	@Override
	public int hashCode() {
		return Objects.hash(render());
	}

	@Override
	@NonNull
	public String toString() {
		return render();
	}
}
