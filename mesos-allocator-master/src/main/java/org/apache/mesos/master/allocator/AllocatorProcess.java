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
import org.apache.mesos.types.FrameworkID;
import org.apache.mesos.types.FrameworkInfo;
import org.apache.mesos.types.SlaveID;
import org.apache.mesos.types.SlaveInfo;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;

/**
 * Handlers of the allocator. An allocator process decides which free resources are offered to
 * which framework.
 *
 * <p>Implementations are not thread-safe: all handlers have to be called from the same thread,
 * one at a time. The {@link Allocator} takes care of that.
 */
public interface AllocatorProcess {

	/**
	 * Initializes the allocator. Has to be called before any other handler.
	 *
	 * @param configuration of the allocator
	 * @param offerListener receiving the computed offers
	 */
	void initialize(AllocatorConfiguration configuration, ResourceOfferListener offerListener);

	/**
	 * Registers a framework and makes it eligible for offers.
	 *
	 * @param frameworkId of the framework
	 * @param frameworkInfo of the framework
	 * @param used resources the framework already holds, per slave
	 */
	void frameworkAdded(FrameworkID frameworkId, FrameworkInfo frameworkInfo, Map<SlaveID, Resources> used);

	/**
	 * Removes a framework and returns all its resources to the slaves. Removing an unknown
	 * framework is a no-op.
	 */
	void frameworkRemoved(FrameworkID frameworkId);

	void frameworkActivated(FrameworkID frameworkId);

	/**
	 * Stops offering resources to the framework without touching what it holds.
	 */
	void frameworkDeactivated(FrameworkID frameworkId);

	/**
	 * Registers a slave and offers its free resources.
	 *
	 * @param slaveId of the slave
	 * @param slaveInfo of the slave
	 * @param total resources of the slave
	 * @param used resources which are already in use on the slave, per framework
	 */
	void slaveAdded(SlaveID slaveId, SlaveInfo slaveInfo, Resources total, Map<FrameworkID, Resources> used);

	/**
	 * Removes a slave. Its resources are never offered again.
	 */
	void slaveRemoved(SlaveID slaveId);

	/**
	 * Replaces the whitelist. The new whitelist applies from the next allocation pass on.
	 *
	 * @param hostnames of the admitted slaves, or null to admit all slaves
	 * @throws AllocatorException if the whitelist is malformed; the previous whitelist stays in place
	 */
	void updateWhitelist(@Nullable Collection<String> hostnames) throws AllocatorException;

	/**
	 * Returns resources of an offer which the framework did not use, and withholds them from the
	 * framework for the given filter timeout.
	 *
	 * @param frameworkId framework which received the offer
	 * @param slaveId slave of the offer
	 * @param resources unused resources
	 * @param filterTimeout how long to withhold the resources; null to use the default filter timeout
	 */
	void resourcesUnused(FrameworkID frameworkId, SlaveID slaveId, Resources resources, @Nullable Duration filterTimeout);

	/**
	 * Returns resources, e.g. of a finished task, to the slave.
	 */
	void resourcesRecovered(FrameworkID frameworkId, SlaveID slaveId, Resources resources);

	/**
	 * Drops all filters of the framework and offers it resources again.
	 */
	void offersRevived(FrameworkID frameworkId);

	/**
	 * Runs an allocation pass over all slaves.
	 */
	void batch();
}
