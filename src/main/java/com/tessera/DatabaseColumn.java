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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.function.Supplier;

/**
 * Declares that a field of a {@link Model} subclass is a table column.
 * <p>
 * Example:
 * <pre>{@code
 * @DatabaseTable("users")
 * public class User extends Model {
 *   @DatabaseColumn(value = "_id", type = "uuid", primaryKey = true, defaultValue = RandomUuid.class)
 *   private UUID id;
 *   @DatabaseColumn(type = "varchar(40)")
 *   private String name;
 * }}</pre>
 *
 * @since 1.0.0
 */
@Documented
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DatabaseColumn {
	/**
	 * @return the database column name; the field name is used if blank
	 */
	String value() default "";

	/**
	 * @return the column type declaration used for DDL, e.g. {@code varchar(40)}; none if blank
	 */
	String type() default "";

	boolean primaryKey() default false;

	/**
	 * A {@link Supplier} with a no-argument constructor, invoked once per constructed instance.
	 *
	 * @return the default value supplier type
	 */
	Class<? extends Supplier<?>> defaultValue() default NoDefault.class;

	/**
	 * Marker for "no default value".
	 */
	final class NoDefault implements Supplier<Object> {
		private NoDefault() {}

		@Override
		public Object get() {
			throw new UnsupportedOperationException();
		}
	}
}
