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
import java.util.List;

/**
 * @since 1.0.0
 */
@ThreadSafe
public class PositionalSqlTests {
	@Test
	public void testPlaceholdersBecomeQuestionMarks() {
		PositionalSql positionalSql = PositionalSql.parse("SELECT a FROM t WHERE b = $1 AND c = $2", List.of("x", 2));

		Assertions.assertEquals("SELECT a FROM t WHERE b = ? AND c = ?", positionalSql.getSql());
		Assertions.assertEquals(List.of("x", 2), positionalSql.getParameters());
	}

	@Test
	public void testParametersFollowPlaceholderOccurrence() {
		PositionalSql positionalSql = PositionalSql.parse("UPDATE t SET a = $2 WHERE b = $1 OR c = $2", List.of("first", "second"));

		Assertions.assertEquals("UPDATE t SET a = ? WHERE b = ? OR c = ?", positionalSql.getSql());
		Assertions.assertEquals(List.of("second", "first", "second"), positionalSql.getParameters());
	}

	@Test
	public void testMultiDigitPlaceholders() {
		List<Object> parameters = Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11);
		PositionalSql positionalSql = PositionalSql.parse("SELECT $11, $1, $10, $2, $3, $4, $5, $6, $7, $8, $9", parameters);

		Assertions.assertEquals("SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?", positionalSql.getSql());
		Assertions.assertEquals(List.of(11, 1, 10, 2, 3, 4, 5, 6, 7, 8, 9), positionalSql.getParameters());
	}

	@Test
	public void testPlaceholdersInLiteralsAndCommentsAreIgnored() {
		String sql = "SELECT '$1', \"$1\", E'\\'$1' -- $1\n/* $1 */ FROM t WHERE a = $1";
		PositionalSql positionalSql = PositionalSql.parse(sql, List.of("x"));

		Assertions.assertEquals("SELECT '$1', \"$1\", E'\\'$1' -- $1\n/* $1 */ FROM t WHERE a = ?", positionalSql.getSql());
		Assertions.assertEquals(List.of("x"), positionalSql.getParameters());
	}

	@Test
	public void testDollarQuotedBodiesAreIgnored() {
		String sql = "SELECT $body$ $1 ? $body$, $$ $2 $$, $1";
		PositionalSql positionalSql = PositionalSql.parse(sql, List.of("x"));

		Assertions.assertEquals("SELECT $body$ $1 ? $body$, $$ $2 $$, ?", positionalSql.getSql());
		Assertions.assertEquals(List.of("x"), positionalSql.getParameters());
	}

	@Test
	public void testNullParametersAreKept() {
		PositionalSql positionalSql = PositionalSql.parse("INSERT INTO t (a, b) VALUES ($1, $2)", Arrays.asList(null, 1));

		Assertions.assertEquals(Arrays.asList(null, 1), positionalSql.getParameters());
	}

	@Test
	public void testPlaceholderWithoutParameterFails() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> PositionalSql.parse("SELECT $2", List.of("x")));
		Assertions.assertThrows(IllegalArgumentException.class, () -> PositionalSql.parse("SELECT $0", List.of("x")));
	}

	@Test
	public void testParameterWithoutPlaceholderFails() {
		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
				() -> PositionalSql.parse("DELETE FROM t WHERE name = $1", List.of("a", "unused", 42)));

		Assertions.assertTrue(e.getMessage().contains("$2, $3"), e.getMessage());

		// A placeholder that only appears inside a comment does not count
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> PositionalSql.parse("SELECT a FROM t WHERE b = $1 -- and c = $2", List.of("x", "y")));
	}

	@Test
	public void testQuestionMarkPlaceholdersAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> PositionalSql.parse("SELECT a FROM t WHERE b = ?", List.of("x")));
	}
}
