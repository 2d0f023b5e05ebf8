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

import org.apache.mesos.resources.Resources;
import org.apache.mesos.types.SlaveID;

import org.apache.flink.util.Preconditions;

/**
 * Suppresses offers of a slave's resources to one framework until the filter expires. Created
 * when a framework declines resources, so that it is not offered the same resources again right
 * away.
 */
final class Filter {

	private final SlaveID slaveId;

	/** Offers contained in these resources are filtered. */
	private final Resources resources;

	/** Relative time of the allocator's clock at which the filter expires. */
	private final long expirationTimeMillis;

	Filter(SlaveID slaveId, Resources resources, long expirationTimeMillis) {
		this.slaveId = Preconditions.checkNotNull(slaveId);
		this.resources = Preconditions.checkNotNull(resources);
		this.expirationTimeMillis = expirationTimeMillis;
	}

	SlaveID getSlaveId() {
		return slaveId;
	}

	boolean isExpired(long currentTimeMillis) {
		return currentTimeMillis >= expirationTimeMillis;
	}

	/**
	 * Checks whether offering the given resources of the given slave is suppressed by this filter.
	 */
	boolean filters(SlaveID candidateSlaveId, Resources offer, long currentTimeMillis) {
		return !isExpired(currentTimeMillis) && slaveId.equals(candidateSlaveId) && resources.contains(offer);
	}

	@Override
	public String toString() {
		return "Filter{" +
			"slaveId=" + slaveId +
			", resources=" + resources +
			", expirationTimeMillis=" + expirationTimeMillis +
			'}';
	}
}
