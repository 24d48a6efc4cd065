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

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ConnectionManager} backed by a pooled {@link DataSource}.
 * <p>
 * {@link #acquire()} checks a connection out of the pool, blocking as the pool's policy dictates, and
 * {@link #release(Connection)} always returns it. {@link #close()} shuts the pool down only when this manager created
 * it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class PoolManager implements ConnectionManager {
	@NonNull
	private final DataSource dataSource;
	private final boolean ownsDataSource;

	private PoolManager(@NonNull DataSource dataSource,
											boolean ownsDataSource) {
		requireNonNull(dataSource);

		this.dataSource = dataSource;
		this.ownsDataSource = ownsDataSource;
	}

	/**
	 * Wraps a pool owned by the caller, who remains responsible for closing it.
	 */
	@NonNull
	public static PoolManager withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new PoolManager(dataSource, false);
	}

	/**
	 * Creates a HikariCP pool for the given JDBC URL. The pool is closed along with this manager.
	 */
	@NonNull
	public static PoolManager withJdbcUrl(@NonNull String jdbcUrl,
																				@NonNull String username,
																				@NonNull String password) {
		requireNonNull(jdbcUrl);
		requireNonNull(username);
		requireNonNull(password);

		HikariConfig hikariConfig = new HikariConfig();
		hikariConfig.setJdbcUrl(jdbcUrl);
		hikariConfig.setUsername(username);
		hikariConfig.setPassword(password);
		hikariConfig.setPoolName("tessera");

		return withHikariConfig(hikariConfig);
	}

	/**
	 * Creates a HikariCP pool from a full configuration. The pool is closed along with this manager.
	 */
	@NonNull
	public static PoolManager withHikariConfig(@NonNull HikariConfig hikariConfig) {
		requireNonNull(hikariConfig);

		try {
			return new PoolManager(new HikariDataSource(hikariConfig), true);
		} catch (RuntimeException e) {
			throw new DatabaseException(format("Unable to create connection pool for %s", hikariConfig.getJdbcUrl()), e);
		}
	}

	@Override
	@NonNull
	public Connection acquire() {
		try {
			return getDataSource().getConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	@Override
	public void release(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to return database connection to the pool", e);
		}
	}

	@Override
	public void close() {
		if (isOwnsDataSource() && getDataSource() instanceof AutoCloseable) {
			try {
				((AutoCloseable) getDataSource()).close();
			} catch (Exception e) {
				throw new DatabaseException("Unable to close connection pool", e);
			}
		}
	}

	@NonNull
	public DataSource getDataSource() {
		return this.dataSource;
	}

	public boolean isOwnsDataSource() {
		return this.ownsDataSource;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{dataSource=%s, ownsDataSource=%s}", getClass().getSimpleName(), getDataSource(), isOwnsDataSource());
	}
}
