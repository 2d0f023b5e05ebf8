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

package org.apache.mesos.types;

import org.apache.mesos.resources.Resource;

import org.apache.flink.util.TestLogger;

import org.junit.Test;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertThat;

/**
 * Tests for {@link FrameworkInfo}.
 */
public class FrameworkInfoTest extends TestLogger {

	@Test
	public void testDefaults() {
		final FrameworkInfo frameworkInfo = FrameworkInfo.newBuilder().setName("framework").setUser("user").build();

		assertThat(frameworkInfo.getRole(), is(Resource.UNRESERVED_ROLE));
		assertThat(frameworkInfo.getWeight(), is(FrameworkInfo.DEFAULT_WEIGHT));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveWeightIsRejected() {
		FrameworkInfo.newBuilder().setWeight(-1.0).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testBlankRoleIsRejected() {
		FrameworkInfo.newBuilder().setRole(" ").build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyIdIsRejected() {
		new FrameworkID("");
	}

	@Test
	public void testGeneratedIdsAreUnique() {
		assertThat(FrameworkID.generate(), not(FrameworkID.generate()));
		assertThat(new SlaveID("slave-1"), is(new SlaveID("slave-1")));
	}
}
