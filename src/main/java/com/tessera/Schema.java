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
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.toList;

/**
 * Table metadata derived from a {@link Model} subclass: table name, ordered columns and primary key.
 * <p>
 * A schema is built the first time it is requested for a class and cached for the life of the class loader.
 * Columns are ordered with inherited ones first, then by field declaration order. Columns added to a class after its
 * schema was built are never picked up.
 *
 * @param <M> the model type
 * @since 1.0.0
 */
@ThreadSafe
public final class Schema<M extends Model> {
	@NonNull
	private static final Map<@NonNull Class<?>, @NonNull Schema<?>> SCHEMAS_BY_MODEL_TYPE;
	@NonNull
	private static final ThreadLocal<@Nullable Class<?>> MODEL_TYPE_BEING_MAPPED;

	static {
		SCHEMAS_BY_MODEL_TYPE = new ConcurrentHashMap<>();
		MODEL_TYPE_BEING_MAPPED = new ThreadLocal<>();
	}

	@NonNull
	private final Class<M> modelType;
	@NonNull
	private final String tableName;
	@NonNull
	private final List<@NonNull Column> columns;
	@NonNull
	private final Map<@NonNull String, @NonNull Column> columnsByAttributeName;
	@NonNull
	private final Map<@NonNull String, @NonNull Column> columnsByKey;
	@Nullable
	private final Column primaryKey;
	private final boolean returnRecords;

	private Schema(@NonNull Class<M> modelType) {
		requireNonNull(modelType);

		if (Modifier.isAbstract(modelType.getModifiers()))
			throw new ConfigurationException(format("%s is abstract and cannot be mapped to a table", modelType.getName()));

		try {
			modelType.getDeclaredConstructor();
		} catch (NoSuchMethodException e) {
			throw new ConfigurationException(format("%s must declare a no-argument constructor", modelType.getName()), e);
		}

		DatabaseTable databaseTable = modelType.getAnnotation(DatabaseTable.class);

		this.modelType = modelType;
		this.tableName = databaseTable != null && databaseTable.value().trim().length() > 0
				? databaseTable.value().trim()
				: modelType.getSimpleName().toLowerCase(Locale.ROOT);
		this.returnRecords = databaseTable == null || databaseTable.returnRecords();

		Map<String, Column> columnsByAttributeName = new LinkedHashMap<>();
		Map<String, Column> columnsByKey = new LinkedHashMap<>();
		Column primaryKey = null;

		for (Field field : columnFields(modelType)) {
			Column column = Column.fromAnnotation(field.getAnnotation(DatabaseColumn.class));
			column.bind(field);

			Column existingColumn = columnsByKey.get(column.getKey());

			if (existingColumn != null)
				throw new ConfigurationException(format("%s declares column key '%s' twice (attributes '%s' and '%s')",
						modelType.getName(), column.getKey(), existingColumn.getAttributeName(), column.getAttributeName()));

			if (column.isPrimaryKey()) {
				if (primaryKey != null)
					throw new ConfigurationException(format("%s declares more than one primary key ('%s' and '%s')",
							modelType.getName(), primaryKey.getKey(), column.getKey()));

				primaryKey = column;
			}

			columnsByAttributeName.put(column.getAttributeName(), column);
			columnsByKey.put(column.getKey(), column);
		}

		this.columnsByAttributeName = Collections.unmodifiableMap(columnsByAttributeName);
		this.columnsByKey = Collections.unmodifiableMap(columnsByKey);
		this.columns = List.copyOf(columnsByKey.values());
		this.primaryKey = primaryKey;
	}

	/**
	 * Gets the schema for the given model type, building and caching it on first use.
	 *
	 * @param modelType the model class
	 * @param <M>       the model type
	 * @return the model type's schema
	 * @throws ConfigurationException if the model declaration is invalid
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public static <M extends Model> Schema<M> of(@NonNull Class<M> modelType) {
		requireNonNull(modelType);
		return (Schema<M>) SCHEMAS_BY_MODEL_TYPE.computeIfAbsent(modelType, (ignored) -> new Schema<>(modelType));
	}

	@NonNull
	private static List<@NonNull Field> columnFields(@NonNull Class<?> modelType) {
		requireNonNull(modelType);

		Deque<Class<?>> hierarchy = new ArrayDeque<>();

		for (Class<?> type = modelType; type != null && type != Model.class && type != Object.class; type = type.getSuperclass())
			hierarchy.push(type);

		List<Field> fields = new ArrayList<>();

		for (Class<?> type : hierarchy)
			for (Field field : type.getDeclaredFields())
				if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic() && field.isAnnotationPresent(DatabaseColumn.class))
					fields.add(field);

		return fields;
	}

	/**
	 * Called from the {@link Model} constructor. Returns {@code true}, at most once, when the instance under construction
	 * is the one {@link #fromRecord(Record, InstanceProvider)} is about to populate, whose defaults would be overwritten
	 * by row values anyway.
	 */
	static boolean claimRecordMapping(@NonNull Class<?> modelType) {
		requireNonNull(modelType);

		if (MODEL_TYPE_BEING_MAPPED.get() != modelType)
			return false;

		MODEL_TYPE_BEING_MAPPED.remove();
		return true;
	}

	/**
	 * Evaluates every column default into the given instance.
	 *
	 * @param instance the instance to populate
	 */
	void applyDefaults(@NonNull Model instance) {
		requireNonNull(instance);

		for (Column column : getColumns()) {
			Object defaultValue = column.newDefaultValue().orElse(null);

			if (defaultValue != null)
				column.set(instance, defaultValue);
		}
	}

	@NonNull
	public M instantiate(@NonNull Map<@NonNull String, ? extends @Nullable Object> attributes) {
		return instantiate(attributes, InstanceProvider.DEFAULT);
	}

	/**
	 * Creates an instance from a map of attributes.
	 * <p>
	 * Entries naming a column, by attribute name or key, set that column; every other entry is kept in the instance's
	 * extras. Columns not named keep their default.
	 *
	 * @param attributes       the attribute values
	 * @param instanceProvider creates the empty instance
	 * @return the new, transient instance
	 */
	@NonNull
	public M instantiate(@NonNull Map<@NonNull String, ? extends @Nullable Object> attributes,
											 @NonNull InstanceProvider instanceProvider) {
		requireNonNull(attributes);
		requireNonNull(instanceProvider);

		M instance = instanceProvider.provide(getModelType());

		for (Map.Entry<String, ? extends Object> attribute : attributes.entrySet()) {
			Column column = findColumn(attribute.getKey()).orElse(null);

			if (column == null)
				instance.putExtra(attribute.getKey(), attribute.getValue());
			else
				column.set(instance, attribute.getValue());
		}

		return instance;
	}

	@NonNull
	public M fromRecord(@NonNull Record record) {
		return fromRecord(record, InstanceProvider.DEFAULT);
	}

	/**
	 * Maps a row into a new instance. Every column of this schema must be present in the row, and column defaults are
	 * not evaluated.
	 *
	 * @param record           the row
	 * @param instanceProvider creates the empty instance
	 * @return the new instance, in the {@link ModelState#PERSISTED} state
	 * @throws MappingException if the row lacks a column or holds a value the attribute cannot store
	 */
	@NonNull
	public M fromRecord(@NonNull Record record,
											@NonNull InstanceProvider instanceProvider) {
		requireNonNull(record);
		requireNonNull(instanceProvider);

		M instance;

		// Every column is set from the row, so the constructor skips default evaluation
		MODEL_TYPE_BEING_MAPPED.set(getModelType());

		try {
			instance = instanceProvider.provide(getModelType());
		} finally {
			MODEL_TYPE_BEING_MAPPED.remove();
		}

		for (Column column : getColumns()) {
			if (!record.containsKey(column.getKey()))
				throw new MappingException(format("Row from table '%s' has no column '%s' (row columns are %s)",
						getTableName(), column.getKey(), record.getKeys()));

			try {
				column.set(instance, record.get(column.getKey()));
			} catch (IllegalArgumentException e) {
				throw new MappingException(format("Unable to map column '%s' of table '%s' to attribute %s.%s",
						column.getKey(), getTableName(), getModelType().getSimpleName(), column.getAttributeName()), e);
			}
		}

		instance.setModelState(ModelState.PERSISTED);
		return instance;
	}

	/**
	 * Finds a column by key, falling back to attribute name.
	 *
	 * @param name a column key or attribute name
	 * @return the column, or empty if none matches
	 */
	@NonNull
	public Optional<Column> findColumn(@NonNull String name) {
		requireNonNull(name);

		Column column = this.columnsByKey.get(name);
		return Optional.ofNullable(column == null ? this.columnsByAttributeName.get(name) : column);
	}

	/**
	 * Like {@link #findColumn(String)}, but failing for unknown names.
	 *
	 * @param name a column key or attribute name
	 * @return the matching column
	 * @throws ConfigurationException if no column matches
	 */
	@NonNull
	public Column resolveColumn(@NonNull String name) {
		requireNonNull(name);

		return findColumn(name).orElseThrow(() -> new ConfigurationException(format("%s has no column or attribute named '%s'. Known columns are %s",
				getModelType().getSimpleName(), name, getColumnKeys())));
	}

	@NonNull
	public Optional<Column> column(@NonNull String attributeName) {
		requireNonNull(attributeName);
		return Optional.ofNullable(this.columnsByAttributeName.get(attributeName));
	}

	@NonNull
	public Optional<Column> columnForKey(@NonNull String key) {
		requireNonNull(key);
		return Optional.ofNullable(this.columnsByKey.get(key));
	}

	/**
	 * The primary key column, required by update and delete statements.
	 *
	 * @return the primary key column
	 * @throws ConfigurationException if no primary key is declared
	 */
	@NonNull
	Column requirePrimaryKey() {
		if (this.primaryKey == null)
			throw new ConfigurationException(format("%s declares no primary key, so rows cannot be identified for update or delete",
					getModelType().getSimpleName()));

		return this.primaryKey;
	}

	@NonNull
	public Class<M> getModelType() {
		return this.modelType;
	}

	@NonNull
	public String getTableName() {
		return this.tableName;
	}

	@NonNull
	public List<@NonNull Column> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull String> getColumnKeys() {
		return getColumns().stream().map(Column::getKey).collect(toList());
	}

	@NonNull
	public Optional<Column> getPrimaryKey() {
		return Optional.ofNullable(this.primaryKey);
	}

	public boolean isReturnRecords() {
		return this.returnRecords;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{modelType=%s, tableName=%s, columns=%s}", getClass().getSimpleName(),
				getModelType().getName(), getTableName(), getColumnKeys());
	}
}
