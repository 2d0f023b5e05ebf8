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

package org.apache.mesos.configuration;

import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

/** The set of configuration options relating to the resource allocator of the master. */
public class AllocatorOptions {

	/** Value of {@link #WHITELIST} which admits every slave. */
	public static final String WHITELIST_ALLOW_ALL = "*";

	public static final ConfigOption<Duration> ALLOCATION_INTERVAL =
		ConfigOptions.key("allocator.allocation-interval")
			.durationType()
			.defaultValue(Duration.ofSeconds(1))
			.withDescription("Amount of time to wait between two periodic allocation passes.");

	/**
	 * Timeout of the filter installed for declined resources if the framework did not request
	 * a timeout of its own.
	 */
	public static final ConfigOption<Duration> DEFAULT_FILTER_TIMEOUT =
		ConfigOptions.key("allocator.default-filter-timeout")
			.durationType()
			.defaultValue(Duration.ofSeconds(5))
			.withDescription("How long declined resources are withheld from the declining framework if it"
				+ " did not specify a filter timeout itself.");

	public static final ConfigOption<String> WHITELIST =
		ConfigOptions.key("allocator.whitelist")
			.stringType()
			.defaultValue(WHITELIST_ALLOW_ALL)
			.withDescription("Path of a file listing the hostnames of the slaves which take part in the allocation,"
				+ " one per line. The file is watched for changes. '" + WHITELIST_ALLOW_ALL + "' admits all slaves.");

	public static final ConfigOption<Duration> WHITELIST_WATCH_INTERVAL =
		ConfigOptions.key("allocator.whitelist-watch-interval")
			.durationType()
			.defaultValue(Duration.ofSeconds(5))
			.withDescription("How often the whitelist file is read for changes.");

	public static final ConfigOption<Double> MIN_ALLOCATABLE_CPUS =
		ConfigOptions.key("allocator.min-allocatable-cpus")
			.doubleType()
			.defaultValue(0.01)
			.withDescription("Free resources of a slave are only offered if they contain at least this many cpus"
				+ " or at least '" + "allocator.min-allocatable-mem" + "' of memory.");

	public static final ConfigOption<Double> MIN_ALLOCATABLE_MEM =
		ConfigOptions.key("allocator.min-allocatable-mem")
			.doubleType()
			.defaultValue(32.0)
			.withDescription("Minimum amount of memory in MB which makes free resources of a slave offerable.");

	/** Weights of the roles, e.g. {@code prod:2,dev:1}. Roles which are not listed have weight 1. */
	public static final ConfigOption<Map<String, String>> ROLE_WEIGHTS =
		ConfigOptions.key("allocator.role-weights")
			.mapType()
			.defaultValue(Collections.emptyMap())
			.withDescription("Weights of the roles as a list of 'role:weight' pairs. A role's dominant share is"
				+ " divided by its weight.");

	// ------------------------------------------------------------------------

	/** Not intended to be instantiated. */
	private AllocatorOptions() {}
}
