/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.mesos.resources;

import org.apache.flink.util.TestLogger;

import org.junit.Test;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Tests for parsing the textual form of {@link Resources}.
 */
public class ResourcesParseTest extends TestLogger {

	@Test
	public void testParseAllValueTypes() {
		final Resources resources = Resources.parse("cpus:2;mem(prod):1024;ports:[31000-32000];disks:{sda,sdb}");

		assertThat(resources, is(Resources.of(
			Resource.scalar("cpus", 2.0),
			Resource.scalar("mem", "prod", 1024.0),
			Resource.ranges("ports", new RangesValue.Range(31000, 32000)),
			Resource.set("disks", "sda", "sdb"))));
	}

	@Test
	public void testParseToleratesWhitespaceAndEmptyTokens() {
		assertThat(
			Resources.parse(" cpus : 2 ; ; mem:512 ;"),
			is(Resources.of(Resource.scalar("cpus", 2.0), Resource.scalar("mem", 512.0))));
		assertTrue(Resources.parse("").isEmpty());
	}

	@Test
	public void testParseMergesRepeatedResources() {
		assertThat(Resources.parse("cpus:1;cpus:2"), is(Resources.parse("cpus:3")));
		assertThat(Resources.parse("ports:[1-5];ports:[6-10]"), is(Resources.parse("ports:[1-10]")));
	}

	@Test
	public void testParseWithDefaultRole() {
		assertThat(
			Resources.parse("cpus:2;mem(*):512", "prod"),
			is(Resources.of(Resource.scalar("cpus", "prod", 2.0), Resource.scalar("mem", 512.0))));
	}

	@Test
	public void testParseDropsZeroQuantities() {
		assertTrue(Resources.parse("cpus:0;ports:[];disks:{}").isEmpty());
	}

	@Test
	public void testMalformedResourcesAreRejected() {
		assertRejected("cpus", "cpus");
		assertRejected("cpus:", "cpus:");
		assertRejected(":2", ":2");
		assertRejected("cpus:two", "two");
		assertRejected("cpus(prod:2", "cpus(prod");
		assertRejected("ports:[1-2", "ports:[1-2");
		assertRejected("ports:[5-1]", "5-1");
		assertRejected("ports:[a-b]", "a-b");
		assertRejected("disks:{sda", "disks:{sda");
	}

	@Test
	public void testOutOfRangeScalarsAreRejected() {
		assertRejected("cpus:1e20", "cpus:1e20");
		assertRejected("cpus:-1", "cpus:-1");
	}

	private static void assertRejected(String text, String expectedToken) {
		try {
			Resources.parse(text);
			fail("Expected that '" + text + "' is rejected.");
		} catch (IllegalArgumentException e) {
			assertThat(e.getMessage(), containsString(expectedToken));
		}
	}
}
