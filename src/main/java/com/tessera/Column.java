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

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Metadata for one table column, bound to one field of a {@link Model} subclass.
 * <p>
 * A column is reached two ways, never confused with each other:
 * <ul>
 *   <li>at the class level, via {@link Schema#column(String)}, it is the metadata itself ({@link #getKey()},
 *   {@link #isPrimaryKey()}, {@link #getDefaultValue()}...);</li>
 *   <li>at the instance level, {@link #get(Model)} and {@link #set(Model, Object)} read and write the value held by
 *   that instance's field. Values are never shared between instances.</li>
 * </ul>
 * Values are neither coerced nor validated here. A value of the wrong type surfaces when the driver rejects it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Column {
	@Nullable
	private final String declaredKey;
	@Nullable
	private final ColumnType columnType;
	@Nullable
	private final ColumnDefault defaultValue;
	private final boolean primaryKey;

	@Nullable
	private volatile Field field;

	private Column(@NonNull Builder builder) {
		requireNonNull(builder);

		this.declaredKey = builder.key;
		this.columnType = builder.columnType;
		this.defaultValue = builder.defaultValue;
		this.primaryKey = builder.primaryKey;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builds an unbound column from its annotation.
	 */
	@NonNull
	static Column fromAnnotation(@NonNull DatabaseColumn databaseColumn) {
		requireNonNull(databaseColumn);

		Builder builder = builder()
				.primaryKey(databaseColumn.primaryKey());

		if (databaseColumn.value().trim().length() > 0)
			builder.key(databaseColumn.value().trim());

		if (databaseColumn.type().trim().length() > 0)
			builder.columnType(ColumnType.parse(databaseColumn.type()));

		if (databaseColumn.defaultValue() != DatabaseColumn.NoDefault.class) {
			try {
				Constructor<? extends Supplier<?>> constructor = databaseColumn.defaultValue().getDeclaredConstructor();
				constructor.setAccessible(true);
				builder.defaultValue(ColumnDefault.supplier(constructor.newInstance()));
			} catch (ReflectiveOperationException e) {
				throw new ConfigurationException(format("Unable to create default value supplier %s. Please verify that it has a public no-argument constructor",
						databaseColumn.defaultValue().getName()), e);
			}
		}

		return builder.build();
	}

	/**
	 * Binds this column to the field whose value it manages. The field's name becomes the attribute name.
	 * <p>
	 * Binding again with a field of the same name is a no-op.
	 *
	 * @param field the field declared on the model class
	 * @throws ConfigurationException if this column is already bound to a differently-named field
	 */
	synchronized void bind(@NonNull Field field) {
		requireNonNull(field);

		Field boundField = this.field;

		if (boundField != null) {
			if (!boundField.getName().equals(field.getName()))
				throw new ConfigurationException(format("Column '%s' is already bound to attribute '%s', cannot rebind it to '%s'",
						getKey(), boundField.getName(), field.getName()));
			return;
		}

		try {
			field.setAccessible(true);
		} catch (RuntimeException e) {
			throw new ConfigurationException(format("Unable to access field %s.%s", field.getDeclaringClass().getName(), field.getName()), e);
		}

		this.field = field;
	}

	/**
	 * Reads this column's value from the given instance.
	 *
	 * @param instance the model instance
	 * @return the value held by {@code instance}, which may be {@code null}
	 */
	@Nullable
	public Object get(@NonNull Model instance) {
		requireNonNull(instance);

		try {
			return boundField().get(instance);
		} catch (IllegalAccessException e) {
			throw new ConfigurationException(format("Unable to read attribute '%s'", getAttributeName()), e);
		}
	}

	/**
	 * Writes this column's value on the given instance.
	 *
	 * @param instance the model instance
	 * @param value    the value to store
	 * @throws IllegalArgumentException if {@code value} cannot be stored in the attribute's Java type
	 */
	public void set(@NonNull Model instance,
									@Nullable Object value) {
		requireNonNull(instance);

		Field field = boundField();

		if (value == null && field.getType().isPrimitive())
			throw new IllegalArgumentException(format("Cannot assign null to primitive attribute '%s'", getAttributeName()));

		try {
			field.set(instance, value);
		} catch (IllegalAccessException e) {
			throw new ConfigurationException(format("Unable to write attribute '%s'", getAttributeName()), e);
		}
	}

	/**
	 * Produces this column's default value for a new instance; supplier defaults are invoked on every call.
	 *
	 * @return the default value, or empty if the column has no default or its default is {@code null}
	 */
	@NonNull
	public Optional<Object> newDefaultValue() {
		return this.defaultValue == null ? Optional.empty() : Optional.ofNullable(this.defaultValue.newValue());
	}

	/**
	 * Renders this column as it appears inside {@code CREATE TABLE}, e.g. {@code _id uuid PRIMARY KEY}.
	 *
	 * @return the column's DDL fragment
	 * @throws ConfigurationException if the column has no {@link ColumnType}
	 */
	@NonNull
	public String getDdl() {
		ColumnType columnType = getColumnType().orElse(null);

		if (columnType == null)
			throw new ConfigurationException(format("Column '%s' has no column type, so no DDL can be generated for it", getKey()));

		return isPrimaryKey() ? format("%s %s PRIMARY KEY", getKey(), columnType.render()) : format("%s %s", getKey(), columnType.render());
	}

	public boolean isBound() {
		return this.field != null;
	}

	/**
	 * @return the name of the field this column is bound to
	 * @throws IllegalStateException if the column is not bound yet
	 */
	@NonNull
	public String getAttributeName() {
		return boundField().getName();
	}

	/**
	 * @return the database column name; the attribute name unless one was declared
	 */
	@NonNull
	public String getKey() {
		if (this.declaredKey != null)
			return this.declaredKey;

		Field field = this.field;

		if (field == null)
			throw new IllegalStateException("Column has neither a declared key nor a bound attribute");

		return field.getName();
	}

	@NonNull
	public Optional<ColumnType> getColumnType() {
		return Optional.ofNullable(this.columnType);
	}

	@NonNull
	public Optional<ColumnDefault> getDefaultValue() {
		return Optional.ofNullable(this.defaultValue);
	}

	public boolean isPrimaryKey() {
		return this.primaryKey;
	}

	/**
	 * @return the Java type of the bound attribute, boxed if primitive
	 */
	@NonNull
	public Class<?> getValueType() {
		return box(boundField().getType());
	}

	@NonNull
	private Field boundField() {
		Field field = this.field;

		if (field == null)
			throw new IllegalStateException(format("Column '%s' is not bound to an attribute", this.declaredKey));

		return field;
	}

	@NonNull
	private static Class<?> box(@NonNull Class<?> type) {
		requireNonNull(type);

		if (!type.isPrimitive())
			return type;
		if (type == int.class)
			return Integer.class;
		if (type == long.class)
			return Long.class;
		if (type == boolean.class)
			return Boolean.class;
		if (type == double.class)
			return Double.class;
		if (type == float.class)
			return Float.class;
		if (type == short.class)
			return Short.class;
		if (type == byte.class)
			return Byte.class;
		if (type == char.class)
			return Character.class;

		return type;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("key=%s", this.declaredKey == null && this.field == null ? null : getKey()));

		if (this.field != null)
			components.add(format("attributeName=%s", getAttributeName()));

		getDefaultValue().ifPresent(defaultValue -> components.add(format("defaultValue=%s", defaultValue)));
		components.add(format("primaryKey=%s", isPrimaryKey()));
		getColumnType().ifPresent(columnType -> components.add(format("columnType=%s", columnType)));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	/**
	 * Builder for programmatically declared columns.
	 */
	public static final class Builder {
		@Nullable
		private String key;
		@Nullable
		private ColumnType columnType;
		@Nullable
		private ColumnDefault defaultValue;
		private boolean primaryKey;

		private Builder() {}

		@NonNull
		public Builder key(@Nullable String key) {
			this.key = key;
			return this;
		}

		@NonNull
		public Builder columnType(@Nullable ColumnType columnType) {
			this.columnType = columnType;
			return this;
		}

		@NonNull
		public Builder defaultValue(@Nullable ColumnDefault defaultValue) {
			this.defaultValue = defaultValue;
			return this;
		}

		@NonNull
		public Builder primaryKey(boolean primaryKey) {
			this.primaryKey = primaryKey;
			return this;
		}

		@NonNull
		public Column build() {
			return new Column(this);
		}
	}
}
