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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One row as returned by the driver: values in column order, addressable by index or by column label.
 * <p>
 * Label lookups ignore case, since databases differ on how they fold unquoted identifiers.
 *
 * @since 1.0.0
 */
@Immutable
public final class Record {
	@NonNull
	private final List<@NonNull String> keys;
	@NonNull
	private final List<@Nullable Object> values;
	@NonNull
	private final Map<@NonNull String, @NonNull Integer> indicesByNormalizedKey;

	/**
	 * @param keys   column labels, in row order
	 * @param values column values, index-aligned with {@code keys}
	 */
	public Record(@NonNull List<@NonNull String> keys,
								@NonNull List<@Nullable Object> values) {
		requireNonNull(keys);
		requireNonNull(values);

		if (keys.size() != values.size())
			throw new IllegalArgumentException(format("Row has %d column label[s] but %d value[s]", keys.size(), values.size()));

		Map<String, Integer> indicesByNormalizedKey = new LinkedHashMap<>(keys.size());

		// First occurrence wins for duplicate labels, e.g. from joins
		for (int i = 0; i < keys.size(); ++i)
			indicesByNormalizedKey.putIfAbsent(normalizeKey(keys.get(i)), i);

		this.keys = List.copyOf(keys);
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
		this.indicesByNormalizedKey = Collections.unmodifiableMap(indicesByNormalizedKey);
	}

	@NonNull
	private static String normalizeKey(@NonNull String key) {
		requireNonNull(key);
		return key.toLowerCase(Locale.ROOT);
	}

	public boolean containsKey(@NonNull String key) {
		requireNonNull(key);
		return this.indicesByNormalizedKey.containsKey(normalizeKey(key));
	}

	/**
	 * @throws IllegalArgumentException if the row has no column with this label
	 */
	@Nullable
	public Object get(@NonNull String key) {
		requireNonNull(key);

		Integer index = this.indicesByNormalizedKey.get(normalizeKey(key));

		if (index == null)
			throw new IllegalArgumentException(format("Row has no column '%s'. Columns are %s", key, getKeys()));

		return this.values.get(index);
	}

	@Nullable
	public Object get(int index) {
		return this.values.get(index);
	}

	public int size() {
		return this.values.size();
	}

	@NonNull
	public List<@NonNull String> getKeys() {
		return this.keys;
	}

	@NonNull
	public List<@Nullable Object> getValues() {
		return this.values;
	}

	/**
	 * @return the row as an ordered map of label to value
	 */
	@NonNull
	public Map<@NonNull String, @Nullable Object> asMap() {
		Map<String, Object> map = new LinkedHashMap<>(this.keys.size());

		for (int i = 0; i < this.keys.size(); ++i)
			map.putIfAbsent(this.keys.get(i), this.values.get(i));

		return Collections.unmodifiableMap(map);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Record))
			return false;

		Record record = (Record) object;

		return Objects.equals(getKeys(), record.getKeys())
				&& Objects.equals(getValues(), record.getValues());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKeys(), getValues());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), asMap());
	}
}
