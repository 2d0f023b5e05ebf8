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
import org.apache.flink.util.Preconditions;

import javax.annotation.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.apache.flink.util.Preconditions.checkArgument;

/** Configuration of the allocator, fixed at initialization. */
public class AllocatorConfiguration {

	/** Longest filter timeout, so that filter expirations fit into milliseconds. */
	public static final Duration MAX_FILTER_TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

	private static final String FILE_URI_PREFIX = "file://";

	private final Duration allocationInterval;

	private final Duration defaultFilterTimeout;

	private final String whitelist;

	private final Duration whitelistWatchInterval;

	private final double minAllocatableCpus;

	private final double minAllocatableMem;

	private final Map<String, Double> roleWeights;

	public AllocatorConfiguration(
			Duration allocationInterval,
			Duration defaultFilterTimeout,
			String whitelist,
			Duration whitelistWatchInterval,
			double minAllocatableCpus,
			double minAllocatableMem,
			Map<String, Double> roleWeights) {
		Preconditions.checkNotNull(allocationInterval);
		Preconditions.checkNotNull(defaultFilterTimeout);
		Preconditions.checkNotNull(whitelistWatchInterval);
		Preconditions.checkNotNull(roleWeights);
		checkArgument(!allocationInterval.isNegative() && !allocationInterval.isZero(), "allocation interval must be greater than zero");
		checkArgument(!defaultFilterTimeout.isNegative(), "default filter timeout must be non-negative");
		checkArgument(!whitelistWatchInterval.isNegative() && !whitelistWatchInterval.isZero(), "whitelist watch interval must be greater than zero");
		checkArgument(minAllocatableCpus >= 0.0, "minimum allocatable cpus must be non-negative");
		checkArgument(minAllocatableMem >= 0.0, "minimum allocatable memory must be non-negative");
		for (Map.Entry<String, Double> roleWeight : roleWeights.entrySet()) {
			checkArgument(roleWeight.getValue() > 0.0, "weight of role %s must be greater than zero", roleWeight.getKey());
		}

		this.allocationInterval = allocationInterval;
		this.defaultFilterTimeout = defaultFilterTimeout;
		this.whitelist = Preconditions.checkNotNull(whitelist);
		this.whitelistWatchInterval = whitelistWatchInterval;
		this.minAllocatableCpus = minAllocatableCpus;
		this.minAllocatableMem = minAllocatableMem;
		this.roleWeights = Collections.unmodifiableMap(new HashMap<>(roleWeights));
	}

	public Duration getAllocationInterval() {
		return allocationInterval;
	}

	public Duration getDefaultFilterTimeout() {
		return defaultFilterTimeout;
	}

	/**
	 * Returns the whitelist file to watch, or nothing if all slaves are admitted.
	 */
	public Optional<Path> getWhitelistPath() {
		if (AllocatorOptions.WHITELIST_ALLOW_ALL.equals(whitelist.trim())) {
			return Optional.empty();
		}

		final String path = whitelist.startsWith(FILE_URI_PREFIX)
			? whitelist.substring(FILE_URI_PREFIX.length())
			: whitelist;
		return Optional.of(Paths.get(path));
	}

	public Duration getWhitelistWatchInterval() {
		return whitelistWatchInterval;
	}

	public double getMinAllocatableCpus() {
		return minAllocatableCpus;
	}

	public double getMinAllocatableMem() {
		return minAllocatableMem;
	}

	public double getRoleWeight(String role) {
		return roleWeights.getOrDefault(role, 1.0);
	}

	/**
	 * Resolves the timeout of the filter installed for unused resources.
	 *
	 * @param requestedTimeout timeout requested by the framework, or null if it did not request one
	 * @return the requested timeout capped at {@link #MAX_FILTER_TIMEOUT}, or the default filter
	 * timeout if none or a negative one was requested
	 */
	public Duration resolveFilterTimeout(@Nullable Duration requestedTimeout) {
		final Duration timeout = requestedTimeout == null || requestedTimeout.isNegative()
			? defaultFilterTimeout
			: requestedTimeout;
		return timeout.compareTo(MAX_FILTER_TIMEOUT) > 0 ? MAX_FILTER_TIMEOUT : timeout;
	}

	public static AllocatorConfiguration fromConfiguration(Configuration configuration) {
		try {
			return new AllocatorConfiguration(
				configuration.get(AllocatorOptions.ALLOCATION_INTERVAL),
				configuration.get(AllocatorOptions.DEFAULT_FILTER_TIMEOUT),
				configuration.get(AllocatorOptions.WHITELIST),
				configuration.get(AllocatorOptions.WHITELIST_WATCH_INTERVAL),
				configuration.get(AllocatorOptions.MIN_ALLOCATABLE_CPUS),
				configuration.get(AllocatorOptions.MIN_ALLOCATABLE_MEM),
				parseRoleWeights(configuration.get(AllocatorOptions.ROLE_WEIGHTS)));
		} catch (IllegalArgumentException e) {
			throw new IllegalConfigurationException("Invalid allocator configuration: " + e.getMessage(), e);
		}
	}

	private static Map<String, Double> parseRoleWeights(Map<String, String> roleWeights) {
		final Map<String, Double> parsedWeights = new HashMap<>(roleWeights.size());

		for (Map.Entry<String, String> roleWeight : roleWeights.entrySet()) {
			try {
				parsedWeights.put(roleWeight.getKey().trim(), Double.parseDouble(roleWeight.getValue().trim()));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException(
					String.format("weight '%s' of role %s is not a number", roleWeight.getValue(), roleWeight.getKey()), e);
			}
		}

		return parsedWeights;
	}

	public static AllocatorConfiguration defaultConfiguration() {
		return fromConfiguration(new Configuration());
	}

	@Override
	public String toString() {
		return "AllocatorConfiguration{" +
			"allocationInterval=" + allocationInterval +
			", defaultFilterTimeout=" + defaultFilterTimeout +
			", whitelist='" + whitelist + '\'' +
			", whitelistWatchInterval=" + whitelistWatchInterval +
			", minAllocatableCpus=" + minAllocatableCpus +
			", minAllocatableMem=" + minAllocatableMem +
			", roleWeights=" + roleWeights +
			'}';
	}
}
