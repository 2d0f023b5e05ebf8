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

package org.apache.mesos.master.allocator.sorter;

import org.apache.mesos.resources.Resources;

import org.apache.flink.util.TestLogger;

import org.junit.Test;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

/**
 * Tests for the {@link DRFSorter}.
 */
public class DRFSorterTest extends TestLogger {

	private static final double EPSILON = 1e-9;

	@Test
	public void testClientsAreSortedByDominantShare() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10;mem:100"));

		sorter.add("a", 1.0);
		sorter.add("b", 1.0);
		sorter.add("c", 1.0);

		sorter.allocated("a", Resources.parse("cpus:5;mem:10"));
		sorter.allocated("b", Resources.parse("cpus:1;mem:20"));

		assertThat(sorter.sort(), contains("c", "b", "a"));
		assertThat(sorter.getShare("a"), closeTo(0.5, EPSILON));
		assertThat(sorter.getShare("b"), closeTo(0.2, EPSILON));
	}

	@Test
	public void testEqualSharesAreOrderedByRegistration() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10;mem:100"));

		sorter.add("b", 1.0);
		sorter.add("a", 1.0);
		sorter.add("c", 1.0);

		assertThat(sorter.sort(), contains("b", "a", "c"));

		sorter.allocated("b", Resources.parse("cpus:1"));
		sorter.allocated("a", Resources.parse("mem:10"));

		assertThat(sorter.sort(), contains("c", "b", "a"));
	}

	@Test
	public void testWeightDividesShare() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10"));

		sorter.add("heavy", 2.0);
		sorter.add("light", 1.0);

		sorter.allocated("heavy", Resources.parse("cpus:4"));
		sorter.allocated("light", Resources.parse("cpus:3"));

		assertThat(sorter.getShare("heavy"), closeTo(0.2, EPSILON));
		assertThat(sorter.sort(), contains("heavy", "light"));
	}

	@Test
	public void testSharesFollowThePool() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:4"));
		sorter.add("a", 1.0);
		sorter.allocated("a", Resources.parse("cpus:2"));

		assertThat(sorter.getShare("a"), closeTo(0.5, EPSILON));

		sorter.add(Resources.parse("cpus:4"));
		assertThat(sorter.getShare("a"), closeTo(0.25, EPSILON));

		sorter.remove(Resources.parse("cpus:6"));
		assertThat(sorter.getShare("a"), closeTo(1.0, EPSILON));
	}

	@Test
	public void testNonScalarResourcesDoNotContributeToShares() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10;ports:[1-10]"));
		sorter.add("a", 1.0);

		sorter.allocated("a", Resources.parse("cpus:1;ports:[1-10]"));

		assertThat(sorter.getShare("a"), closeTo(0.1, EPSILON));
	}

	@Test
	public void testDeactivatedClientsAreNotSorted() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10"));
		sorter.add("a", 1.0);
		sorter.add("b", 1.0);
		sorter.allocated("a", Resources.parse("cpus:1"));

		sorter.deactivate("a");
		assertThat(sorter.sort(), contains("b"));
		assertThat(sorter.allocation("a"), is(Resources.parse("cpus:1")));

		sorter.activate("a");
		assertThat(sorter.sort(), contains("b", "a"));
	}

	@Test
	public void testUnallocatingMoreThanAllocatedIsClipped() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add(Resources.parse("cpus:10"));
		sorter.add("a", 1.0);
		sorter.allocated("a", Resources.parse("cpus:1"));

		sorter.unallocated("a", Resources.parse("cpus:2;mem:5"));

		assertTrue(sorter.allocation("a").isEmpty());
	}

	@Test
	public void testRemovalIsIdempotent() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add("a", 1.0);
		sorter.add("b", 1.0);

		sorter.remove("a");
		sorter.remove("a");
		sorter.unallocated("a", Resources.parse("cpus:1"));

		assertFalse(sorter.contains("a"));
		assertThat(sorter.count(), is(1));
		assertThat(sorter.sort(), contains("b"));
	}

	@Test(expected = IllegalStateException.class)
	public void testDuplicateClientIsRejected() {
		final DRFSorter sorter = new DRFSorter();
		sorter.add("a", 1.0);
		sorter.add("a", 2.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNonPositiveWeightIsRejected() {
		new DRFSorter().add("a", 0.0);
	}
}
