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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class StatementsTests {
	@DatabaseTable("users")
	public static class User extends Model {
		@DatabaseColumn(value = "_id", type = "integer", primaryKey = true)
		private Integer id;
		@DatabaseColumn(type = "text")
		private String name;
		@DatabaseColumn(type = "text")
		private String email;

		public User() {}

		public User(Integer id, String name, String email) {
			this.id = id;
			this.name = name;
			this.email = email;
		}
	}

	public static class NextUserId implements Supplier<Integer> {
		private static final AtomicInteger NEXT_ID = new AtomicInteger();

		@Override
		public Integer get() {
			return NEXT_ID.incrementAndGet();
		}
	}

	@DatabaseTable("users")
	public static class GeneratedIdUser extends Model {
		@DatabaseColumn(value = "_id", type = "integer", primaryKey = true, defaultValue = NextUserId.class)
		private Integer id;
		@DatabaseColumn(type = "text")
		private String name;
		@DatabaseColumn(type = "text")
		private String email;
	}

	public static class Tag extends Model {
		@DatabaseColumn(primaryKey = true)
		private String label;

		public Tag() {}

		public Tag(String label) {
			this.label = label;
		}
	}

	public static class AuditEntry extends Model {
		@DatabaseColumn
		private String message;
	}

	@Test
	public void testSelectWithoutFilters() {
		Statement statement = Statements.select(User.class);

		Assertions.assertEquals("SELECT _id, name, email FROM users", statement.getSql());
		Assertions.assertEquals(List.of(), statement.getParameters());
	}

	@Test
	public void testSelectWithFilters() {
		Map<String, Object> filters = new LinkedHashMap<>();
		filters.put("name", "foo");
		filters.put("email", "foo@example.com");

		Statement statement = Statements.select(User.class, filters);

		Assertions.assertEquals("SELECT _id, name, email FROM users WHERE name = $1 AND email = $2", statement.getSql());
		Assertions.assertEquals(List.of("foo", "foo@example.com"), statement.getParameters());
		Assertions.assertEquals(List.of(statement.getSql(), "foo", "foo@example.com"), statement.query(),
				"Driver-call form should lead with the SQL");
	}

	@Test
	public void testSelectFilterByAttributeNameUsesColumnKey() {
		Statement statement = Statements.select(User.class, Map.of("id", 123));

		Assertions.assertEquals("SELECT _id, name, email FROM users WHERE _id = $1", statement.getSql());
		Assertions.assertEquals(List.of(123), statement.getParameters());
	}

	@Test
	public void testSelectWithUnknownFilterFails() {
		Assertions.assertThrows(ConfigurationException.class, () -> Statements.select(User.class, Map.of("nickname", "foo")));
	}

	@Test
	public void testInsertCarriesGeneratedPrimaryKey() {
		GeneratedIdUser first = new GeneratedIdUser();
		first.name = "foo";
		GeneratedIdUser second = new GeneratedIdUser();

		Statement statement = Statements.insert(first);

		Assertions.assertNotNull(first.id);
		Assertions.assertEquals(first.id + 1, second.id, "Each instance should draw the next generated id");
		Assertions.assertEquals("INSERT INTO users (_id, name, email) VALUES ($1, $2, $3)", statement.getSql());
		Assertions.assertEquals(Arrays.asList(first.id, "foo", null), statement.getParameters());
		Assertions.assertEquals(Arrays.asList(second.id, null, null), Statements.insert(second).getParameters());
	}

	@Test
	public void testInsert() {
		Statement statement = Statements.insert(new User(123, "foo", "foo@example.com"));

		Assertions.assertEquals("INSERT INTO users (_id, name, email) VALUES ($1, $2, $3)", statement.getSql());
		Assertions.assertEquals(List.of(123, "foo", "foo@example.com"), statement.getParameters());
	}

	@Test
	public void testInsertBindsNulls() {
		Statement statement = Statements.insert(new User(123, null, null));

		Assertions.assertEquals(Arrays.asList(123, null, null), statement.getParameters());
	}

	@Test
	public void testUpdate() {
		Statement statement = Statements.update(new User(123, "foo", "foo@example.com"));

		Assertions.assertEquals("UPDATE users SET (_id, name, email) = ($1, $2, $3) WHERE users._id = $4", statement.getSql());
		Assertions.assertEquals(List.of(123, "foo", "foo@example.com", 123), statement.getParameters());
	}

	@Test
	public void testUpdateWithSingleColumn() {
		Statement statement = Statements.update(new Tag("red"));

		Assertions.assertEquals("UPDATE tag SET label = $1 WHERE tag.label = $2", statement.getSql());
		Assertions.assertEquals(List.of("red", "red"), statement.getParameters());
	}

	@Test
	public void testDelete() {
		Statement statement = Statements.delete(new User(123, "foo", "foo@example.com"));

		Assertions.assertEquals("DELETE FROM users WHERE users._id = $1", statement.getSql());
		Assertions.assertEquals(List.of(123), statement.getParameters());
	}

	@Test
	public void testUpdateAndDeleteRequirePrimaryKey() {
		Assertions.assertThrows(ConfigurationException.class, () -> Statements.update(new AuditEntry()));
		Assertions.assertThrows(ConfigurationException.class, () -> Statements.delete(new AuditEntry()));
	}

	@Test
	public void testPlaceholdersMatchParameterCount() {
		User user = new User(1, "a", "b");

		for (Statement statement : List.of(Statements.insert(user), Statements.update(user), Statements.delete(user))) {
			int parameterCount = statement.getParameters().size();

			Assertions.assertTrue(statement.getSql().contains("$" + parameterCount), statement.getSql());
			Assertions.assertFalse(statement.getSql().contains("$" + (parameterCount + 1)), statement.getSql());
		}
	}

	@Test
	public void testTableStatements() {
		Assertions.assertEquals("CREATE TABLE IF NOT EXISTS users (_id integer PRIMARY KEY, name text, email text)",
				TableStatements.createTable(User.class).getSql());
		Assertions.assertEquals("DROP TABLE IF EXISTS users", TableStatements.dropTable(User.class, false).getSql());
		Assertions.assertEquals("DROP TABLE IF EXISTS users CASCADE", TableStatements.dropTable(User.class, true).getSql());
		Assertions.assertEquals("TRUNCATE TABLE users CASCADE", TableStatements.truncateTable(User.class, true).getSql());
	}

	@Test
	public void testCreateTableRequiresColumnTypes() {
		Assertions.assertThrows(ConfigurationException.class, () -> TableStatements.createTable(Tag.class));
	}

	@Test
	public void testStatementEquality() {
		Assertions.assertEquals(Statement.of("SELECT 1 FROM t WHERE a = $1", 1), Statement.of("SELECT 1 FROM t WHERE a = $1", List.of(1)));
		Assertions.assertNotEquals(Statement.of("SELECT 1 FROM t WHERE a = $1", 1), Statement.of("SELECT 1 FROM t WHERE a = $1", 2));
	}
}
