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

/**
 * Tessera maps annotated classes onto PostgreSQL tables and runs their persistence operations over JDBC.
 *
 * <pre>
 * &#64;DatabaseTable("users")
 * public class User extends Model {
 *   &#64;DatabaseColumn(value = "_id", type = "uuid", primaryKey = true, defaultValue = RandomUuid.class)
 *   private UUID id;
 *   &#64;DatabaseColumn(type = "text")
 *   private String name;
 * }
 *
 * ConnectionManager connectionManager = PoolManager.withJdbcUrl("jdbc:postgresql://localhost/app", "app", "secret");
 * AsyncModel&lt;User&gt; users = AsyncModel.forType(User.class).connectionManager(connectionManager).build();
 *
 * User user = users.create(Map.of("name", "foo"));
 * users.save(user).join();
 * Optional&lt;User&gt; sameUser = users.getOneInstance(Map.of("name", "foo")).join();
 * users.delete(user).join();</pre>
 *
 * @since 1.0.0
 */
package com.tessera;
