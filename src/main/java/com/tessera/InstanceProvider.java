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
import java.lang.reflect.Constructor;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contract for a factory that creates model instances given a type.
 * <p>
 * Used when building instances from attribute maps and when mapping rows, where each row requires a new
 * instance. Implementors might hand instance creation to a DI container.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface InstanceProvider {
	/**
	 * Reflective provider which calls the no-argument constructor.
	 */
	@NonNull
	InstanceProvider DEFAULT = new InstanceProvider() {
		@Override
		@NonNull
		public <M extends Model> M provide(@NonNull Class<M> modelType) {
			requireNonNull(modelType);

			try {
				Constructor<M> constructor = modelType.getDeclaredConstructor();
				constructor.setAccessible(true);
				return constructor.newInstance();
			} catch (ReflectiveOperationException e) {
				throw new ConfigurationException(format(
						"Unable to create an instance of %s. Please verify that %s has a no-argument constructor",
						modelType, modelType.getSimpleName()), e);
			}
		}
	};

	/**
	 * Provides a new instance of the given {@code modelType}.
	 *
	 * @param <M>       model type token
	 * @param modelType the type of instance to create
	 * @return a new instance of {@code modelType}
	 */
	@NonNull
	<M extends Model> M provide(@NonNull Class<M> modelType);
}
