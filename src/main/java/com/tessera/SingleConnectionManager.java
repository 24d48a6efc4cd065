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

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ConnectionManager} that works with one physical connection at a time.
 * <p>
 * Without keep-alive, every {@link #acquire()} opens a new connection and {@link #release(Connection)} closes it.
 * With keep-alive, one lazily-opened connection is shared: {@link #release(Connection)} leaves it open, and
 * acquire/release pairs are serialized on a lock so the connection is never used by two threads at once. A kept
 * connection found closed is replaced on the next acquire.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SingleConnectionManager implements ConnectionManager {
	@NonNull
	private final ConnectionFactory connectionFactory;
	private final boolean keepAlive;
	@NonNull
	private final ReentrantLock connectionLock;
	@NonNull
	private final Logger logger;

	@Nullable
	@GuardedBy("connectionLock")
	private Connection keptConnection;

	public SingleConnectionManager(@NonNull ConnectionFactory connectionFactory) {
		this(connectionFactory, false);
	}

	public SingleConnectionManager(@NonNull ConnectionFactory connectionFactory,
																 boolean keepAlive) {
		requireNonNull(connectionFactory);

		this.connectionFactory = connectionFactory;
		this.keepAlive = keepAlive;
		this.connectionLock = new ReentrantLock();
		this.logger = Logger.getLogger(getClass().getName());
	}

	@Override
	@NonNull
	public Connection acquire() {
		if (!isKeepAlive())
			return openConnection();

		getConnectionLock().lock();

		try {
			if (this.keptConnection == null || isClosed(this.keptConnection)) {
				if (this.keptConnection != null)
					logger.finer("Kept connection was closed, opening a replacement");

				this.keptConnection = openConnection();
			}

			return this.keptConnection;
		} catch (RuntimeException | Error e) {
			getConnectionLock().unlock();
			throw e;
		}
	}

	@Override
	public void release(@NonNull Connection connection) {
		requireNonNull(connection);

		if (!isKeepAlive()) {
			closeConnection(connection);
			return;
		}

		if (getConnectionLock().isHeldByCurrentThread())
			getConnectionLock().unlock();
	}

	@Override
	public void close() {
		if (!isKeepAlive())
			return;

		getConnectionLock().lock();

		try {
			if (this.keptConnection != null) {
				Connection connection = this.keptConnection;
				this.keptConnection = null;
				closeConnection(connection);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	@NonNull
	private Connection openConnection() {
		try {
			return getConnectionFactory().openConnection();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to acquire database connection", e);
		}
	}

	private void closeConnection(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			connection.close();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to close database connection", e);
		}
	}

	private boolean isClosed(@NonNull Connection connection) {
		requireNonNull(connection);

		try {
			return connection.isClosed();
		} catch (SQLException e) {
			throw new DatabaseException("Unable to determine whether database connection is closed", e);
		}
	}

	@NonNull
	public ConnectionFactory getConnectionFactory() {
		return this.connectionFactory;
	}

	public boolean isKeepAlive() {
		return this.keepAlive;
	}

	@NonNull
	private ReentrantLock getConnectionLock() {
		return this.connectionLock;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{keepAlive=%s}", getClass().getSimpleName(), isKeepAlive());
	}
}
