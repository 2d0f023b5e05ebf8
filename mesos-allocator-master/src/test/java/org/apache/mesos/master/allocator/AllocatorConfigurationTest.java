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

import org.apache.mesos.configuration.AllocatorOptions;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;
import org.apache.flink.util.TestLogger;

import org.junit.Test;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

/**
 * Tests for the {@link AllocatorConfiguration}.
 */
public class AllocatorConfigurationTest extends TestLogger {

	@Test
	public void testDefaultConfiguration() {
		final AllocatorConfiguration configuration = AllocatorConfiguration.defaultConfiguration();

		assertThat(configuration.getAllocationInterval(), is(Duration.ofSeconds(1L)));
		assertThat(configuration.getDefaultFilterTimeout(), is(Duration.ofSeconds(5L)));
		assertThat(configuration.getWhitelistWatchInterval(), is(Duration.ofSeconds(5L)));
		assertThat(configuration.getMinAllocatableCpus(), is(0.01));
		assertThat(configuration.getMinAllocatableMem(), is(32.0));
		assertThat(configuration.getRoleWeight("any"), is(1.0));
		assertFalse(configuration.getWhitelistPath().isPresent());
	}

	@Test
	public void testFromConfiguration() {
		final Map<String, String> roleWeights = new HashMap<>();
		roleWeights.put("prod", "2.5");
		roleWeights.put("test", "0.5");

		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.set(AllocatorOptions.ALLOCATION_INTERVAL, Duration.ofMillis(200L));
		flinkConfiguration.set(AllocatorOptions.DEFAULT_FILTER_TIMEOUT, Duration.ofSeconds(10L));
		flinkConfiguration.set(AllocatorOptions.WHITELIST, "file:///etc/mesos/whitelist");
		flinkConfiguration.set(AllocatorOptions.MIN_ALLOCATABLE_MEM, 64.0);
		flinkConfiguration.set(AllocatorOptions.ROLE_WEIGHTS, roleWeights);

		final AllocatorConfiguration configuration = AllocatorConfiguration.fromConfiguration(flinkConfiguration);

		assertThat(configuration.getAllocationInterval(), is(Duration.ofMillis(200L)));
		assertThat(configuration.getDefaultFilterTimeout(), is(Duration.ofSeconds(10L)));
		assertThat(configuration.getWhitelistPath().get(), is(Paths.get("/etc/mesos/whitelist")));
		assertThat(configuration.getMinAllocatableMem(), is(64.0));
		assertThat(configuration.getRoleWeight("prod"), is(2.5));
		assertThat(configuration.getRoleWeight("test"), is(0.5));
	}

	@Test
	public void testResolveFilterTimeout() {
		final AllocatorConfiguration configuration = AllocatorConfiguration.defaultConfiguration();

		assertThat(configuration.resolveFilterTimeout(null), is(Duration.ofSeconds(5L)));
		assertThat(configuration.resolveFilterTimeout(Duration.ofSeconds(-1L)), is(Duration.ofSeconds(5L)));
		assertThat(configuration.resolveFilterTimeout(Duration.ZERO), is(Duration.ZERO));
		assertThat(configuration.resolveFilterTimeout(Duration.ofMinutes(1L)), is(Duration.ofMinutes(1L)));
		assertThat(
			configuration.resolveFilterTimeout(Duration.ofSeconds(Long.MAX_VALUE)),
			is(AllocatorConfiguration.MAX_FILTER_TIMEOUT));
	}

	@Test(expected = IllegalConfigurationException.class)
	public void testNonPositiveAllocationIntervalIsRejected() {
		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.set(AllocatorOptions.ALLOCATION_INTERVAL, Duration.ZERO);

		AllocatorConfiguration.fromConfiguration(flinkConfiguration);
	}

	@Test(expected = IllegalConfigurationException.class)
	public void testNegativeThresholdIsRejected() {
		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.set(AllocatorOptions.MIN_ALLOCATABLE_CPUS, -1.0);

		AllocatorConfiguration.fromConfiguration(flinkConfiguration);
	}

	@Test(expected = IllegalConfigurationException.class)
	public void testUnparsableDurationIsRejected() {
		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.setString(AllocatorOptions.DEFAULT_FILTER_TIMEOUT.key(), "five seconds");

		AllocatorConfiguration.fromConfiguration(flinkConfiguration);
	}

	@Test(expected = IllegalConfigurationException.class)
	public void testInvalidRoleWeightIsRejected() {
		final Map<String, String> roleWeights = new HashMap<>();
		roleWeights.put("prod", "heavy");

		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.set(AllocatorOptions.ROLE_WEIGHTS, roleWeights);

		AllocatorConfiguration.fromConfiguration(flinkConfiguration);
	}

	@Test(expected = IllegalConfigurationException.class)
	public void testNonPositiveRoleWeightIsRejected() {
		final Map<String, String> roleWeights = new HashMap<>();
		roleWeights.put("prod", "0");

		final Configuration flinkConfiguration = new Configuration();
		flinkConfiguration.set(AllocatorOptions.ROLE_WEIGHTS, roleWeights);

		AllocatorConfiguration.fromConfiguration(flinkConfiguration);
	}
}
