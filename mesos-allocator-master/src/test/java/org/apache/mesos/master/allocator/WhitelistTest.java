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

package org.apache.mesos.master.allocator;

import org.apache.flink.util.TestLogger;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * Tests for the {@link Whitelist}.
 */
public class WhitelistTest extends TestLogger {

	@Test
	public void testAllowAll() throws Exception {
		assertTrue(Whitelist.allowAll().isWhitelisted("any-host"));
		assertTrue(Whitelist.of(null).isWhitelisted("any-host"));
		assertFalse(Whitelist.allowAll().getHostnames().isPresent());
	}

	@Test
	public void testOnlyListedHostnamesAreAdmitted() throws Exception {
		final Whitelist whitelist = Whitelist.of(Arrays.asList("host-1", "host-2"));

		assertTrue(whitelist.isWhitelisted("host-1"));
		assertTrue(whitelist.isWhitelisted("host-2"));
		assertFalse(whitelist.isWhitelisted("host-3"));
	}

	@Test
	public void testEmptyWhitelistAdmitsNothing() throws Exception {
		assertFalse(Whitelist.of(Collections.emptyList()).isWhitelisted("host-1"));
	}

	@Test(expected = AllocatorException.class)
	public void testBlankHostnameIsRejected() throws Exception {
		Whitelist.of(Arrays.asList("host-1", " "));
	}

	@Test(expected = AllocatorException.class)
	public void testHostnameWithWhitespaceIsRejected() throws Exception {
		Whitelist.of(Collections.singletonList("host 1"));
	}
}
