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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Base class for types mapped to a table.
 * <p>
 * Columns are fields annotated with {@link DatabaseColumn}; their metadata lives in the class's {@link Schema}.
 * Constructing an instance evaluates every column default into it, so supplier defaults such as identifier
 * generators yield a fresh value per instance. Instances mapped from a row skip this step. A field initializer in the
 * subclass runs after this constructor and therefore takes precedence over the annotation default.
 * <p>
 * Attributes that are not columns can be carried in the extras container; they are never persisted.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public abstract class Model {
	@NonNull
	private final Map<@NonNull String, @Nullable Object> extras;
	@NonNull
	private ModelState modelState;

	protected Model() {
		this.extras = new LinkedHashMap<>();
		this.modelState = ModelState.TRANSIENT;

		if (!Schema.claimRecordMapping(getClass()))
			Schema.of(getClass()).applyDefaults(this);
	}

	@NonNull
	public ModelState getModelState() {
		return this.modelState;
	}

	void setModelState(@NonNull ModelState modelState) {
		requireNonNull(modelState);
		this.modelState = modelState;
	}

	/**
	 * @return an unmodifiable view of the non-column attributes carried by this instance
	 */
	@NonNull
	public Map<@NonNull String, @Nullable Object> getExtras() {
		return Collections.unmodifiableMap(this.extras);
	}

	@NonNull
	public Optional<Object> getExtra(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.extras.get(name));
	}

	public void putExtra(@NonNull String name,
											 @Nullable Object value) {
		requireNonNull(name);
		this.extras.put(name, value);
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>();

		for (Column column : Schema.of(getClass()).getColumns())
			components.add(format("%s=%s", column.getAttributeName(), quoteIfString(column.get(this))));

		for (Map.Entry<String, Object> extra : this.extras.entrySet())
			components.add(format("%s=%s", extra.getKey(), quoteIfString(extra.getValue())));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}

	@Nullable
	private static Object quoteIfString(@Nullable Object value) {
		return value instanceof CharSequence ? format("'%s'", value) : value;
	}
}
