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
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The default value of a {@link Column}: either a constant shared by every instance, or a supplier invoked once
 * per instance (identifier generation, timestamps...).
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnDefault {
	@Nullable
	private final Object constant;
	@Nullable
	private final Supplier<?> supplier;

	private ColumnDefault(@Nullable Object constant,
												@Nullable Supplier<?> supplier) {
		this.constant = constant;
		this.supplier = supplier;
	}

	@NonNull
	public static ColumnDefault constant(@Nullable Object value) {
		return new ColumnDefault(value, null);
	}

	@NonNull
	public static ColumnDefault supplier(@NonNull Supplier<?> supplier) {
		requireNonNull(supplier);
		return new ColumnDefault(null, supplier);
	}

	/**
	 * Produces a value. Supplier defaults are invoked on every call.
	 *
	 * @return the default value, possibly {@code null}
	 */
	@Nullable
	public Object newValue() {
		return this.supplier == null ? this.constant : this.supplier.get();
	}

	public boolean isSupplied() {
		return this.supplier != null;
	}

	@Override
	@NonNull
	public String toString() {
		if (this.supplier != null)
			return format("%s{supplier=%s}", getClass().getSimpleName(), this.supplier.getClass().getName());

		return format("%s{constant=%s}", getClass().getSimpleName(), this.constant);
	}
}
