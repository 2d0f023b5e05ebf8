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

import org.apache.flink.annotation.VisibleForTesting;

import javax.annotation.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Hostnames of the slaves which take part in the allocation. A whitelist without hostnames
 * admits every slave.
 */
final class Whitelist {

	private static final Whitelist ALLOW_ALL = new Whitelist(null);

	@Nullable
	private final Set<String> hostnames;

	private Whitelist(@Nullable Set<String> hostnames) {
		this.hostnames = hostnames;
	}

	static Whitelist allowAll() {
		return ALLOW_ALL;
	}

	/**
	 * Creates a whitelist admitting exactly the given hostnames.
	 *
	 * @param hostnames to admit, or null to admit every slave
	 * @return the whitelist
	 * @throws AllocatorException if one of the hostnames is blank or contains whitespace
	 */
	static Whitelist of(@Nullable Collection<String> hostnames) throws AllocatorException {
		if (hostnames == null) {
			return ALLOW_ALL;
		}

		final Set<String> validatedHostnames = new LinkedHashSet<>(hostnames.size());
		for (String hostname : hostnames) {
			if (hostname == null || hostname.trim().isEmpty()) {
				throw new AllocatorException("Whitelist contains a blank hostname.");
			}
			if (!hostname.equals(hostname.trim()) || hostname.chars().anyMatch(Character::isWhitespace)) {
				throw new AllocatorException("Whitelist entry '" + hostname + "' is not a valid hostname.");
			}
			validatedHostnames.add(hostname);
		}

		return new Whitelist(Collections.unmodifiableSet(validatedHostnames));
	}

	boolean isWhitelisted(String hostname) {
		return hostnames == null || hostnames.contains(hostname);
	}

	@VisibleForTesting
	Optional<Set<String>> getHostnames() {
		return Optional.ofNullable(hostnames);
	}

	@Override
	public String toString() {
		return hostnames == null ? "Whitelist{*}" : "Whitelist" + hostnames;
	}
}
