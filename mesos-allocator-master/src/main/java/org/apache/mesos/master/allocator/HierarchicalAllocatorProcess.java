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

import org.apache.mesos.master.allocator.sorter.Sorter;
import org.apache.mesos.master.allocator.sorter.SorterFactory;
import org.apache.mesos.resources.Resources;
import org.apache.mesos.types.FrameworkID;
import org.apache.mesos.types.FrameworkInfo;
import org.apache.mesos.types.SlaveID;
import org.apache.mesos.types.SlaveInfo;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.clock.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Allocator process which shares the cluster's resources hierarchically: a role sorter ranks the
 * roles against each other and one sorter per role ranks the frameworks of that role.
 *
 * <p>An allocation pass walks the roles in the order of the role sorter and, within every role,
 * the active frameworks in the order of the role's framework sorter. Each framework is offered the
 * free resources of every whitelisted slave which it may use and which are not filtered for it.
 *
 * <p>The process is not thread-safe. See {@link AllocatorProcess}.
 */
public class HierarchicalAllocatorProcess implements AllocatorProcess {
	private static final Logger LOG = LoggerFactory.getLogger(HierarchicalAllocatorProcess.class);

	private final SorterFactory roleSorterFactory;

	private final SorterFactory frameworkSorterFactory;

	/** Clock against which filters expire. */
	private final Clock clock;

	/** All registered frameworks. */
	private final HashMap<FrameworkID, Framework> frameworks = new HashMap<>(16);

	/** All registered slaves, in registration order. */
	private final LinkedHashMap<SlaveID, Slave> slaves = new LinkedHashMap<>(16);

	/** Framework sorter of every role with at least one registered framework. */
	private final HashMap<String, Sorter> frameworkSorters = new HashMap<>(4);

	/** Total resources of all registered slaves. */
	private Resources clusterResources = Resources.empty();

	private Whitelist whitelist = Whitelist.allowAll();

	private Sorter roleSorter;

	private AllocatorConfiguration configuration;

	private ResourceOfferListener offerListener;

	/** True iff the process has been initialized. */
	private boolean initialized;

	public HierarchicalAllocatorProcess(
			SorterFactory roleSorterFactory,
			SorterFactory frameworkSorterFactory,
			Clock clock) {
		this.roleSorterFactory = Preconditions.checkNotNull(roleSorterFactory);
		this.frameworkSorterFactory = Preconditions.checkNotNull(frameworkSorterFactory);
		this.clock = Preconditions.checkNotNull(clock);

		roleSorter = null;
		configuration = null;
		offerListener = null;
		initialized = false;
	}

	// ---------------------------------------------------------------------------------------------
	// Component lifecycle methods
	// ---------------------------------------------------------------------------------------------

	@Override
	public void initialize(AllocatorConfiguration newConfiguration, ResourceOfferListener newOfferListener) {
		Preconditions.checkState(!initialized, "The allocator has already been initialized.");
		LOG.info("Initializing the hierarchical allocator with {}.", newConfiguration);

		configuration = Preconditions.checkNotNull(newConfiguration);
		offerListener = Preconditions.checkNotNull(newOfferListener);
		roleSorter = roleSorterFactory.createSorter();

		initialized = true;
	}

	private void checkInit() {
		Preconditions.checkState(initialized, "The allocator has not been initialized.");
	}

	// ---------------------------------------------------------------------------------------------
	// Frameworks
	// ---------------------------------------------------------------------------------------------

	@Override
	public void frameworkAdded(FrameworkID frameworkId, FrameworkInfo frameworkInfo, Map<SlaveID, Resources> used) {
		checkInit();
		Preconditions.checkNotNull(frameworkInfo);
		Preconditions.checkNotNull(used);

		if (frameworks.containsKey(frameworkId)) {
			LOG.error("Framework {} has already been added. Ignoring the repeated registration.", frameworkId);
			return;
		}

		final String role = frameworkInfo.getRole();
		final Sorter frameworkSorter = frameworkSorters.computeIfAbsent(role, this::createFrameworkSorter);
		final Framework framework = new Framework(frameworkInfo);

		frameworks.put(frameworkId, framework);
		frameworkSorter.add(frameworkId.getValue(), frameworkInfo.getWeight());

		for (Map.Entry<SlaveID, Slave> slaveEntry : slaves.entrySet()) {
			final Slave slave = slaveEntry.getValue();

			// resources parked for the framework while it was unknown are replaced by what it reports
			final Resources parked = slave.unclaimed.remove(frameworkId);
			if (parked != null) {
				slave.available = slave.available.plus(parked);
			}

			final Resources claimed = used.containsKey(slaveEntry.getKey())
				? used.get(slaveEntry.getKey())
				: parked;

			if (claimed != null && !claimed.isEmpty()) {
				charge(frameworkId, framework, slaveEntry.getKey(), slave, claimed);
			}
		}

		for (SlaveID slaveId : used.keySet()) {
			if (!slaves.containsKey(slaveId)) {
				LOG.warn("Framework {} reported used resources on unknown slave {}. Ignoring them.", frameworkId, slaveId);
			}
		}

		LOG.info("Added framework {} ({}) in role {}.", frameworkId, frameworkInfo.getName(), role);

		allocate(slaves.keySet());
	}

	private Sorter createFrameworkSorter(String role) {
		final Sorter frameworkSorter = frameworkSorterFactory.createSorter();
		frameworkSorter.add(clusterResources);
		roleSorter.add(role, configuration.getRoleWeight(role));

		LOG.debug("Added role {}.", role);
		return frameworkSorter;
	}

	@Override
	public void frameworkRemoved(FrameworkID frameworkId) {
		checkInit();

		final Framework framework = frameworks.remove(frameworkId);

		if (framework == null) {
			LOG.debug("Framework {} is not registered. Ignoring the removal.", frameworkId);
			return;
		}

		final String role = framework.getRole();
		final Sorter frameworkSorter = frameworkSorters.get(role);

		for (Map.Entry<SlaveID, Resources> allocation : framework.allocations.entrySet()) {
			final Slave slave = slaves.get(allocation.getKey());
			slave.available = slave.available.plus(allocation.getValue());
			roleSorter.unallocated(role, allocation.getValue());
		}

		frameworkSorter.remove(frameworkId.getValue());

		if (frameworkSorter.count() == 0) {
			frameworkSorters.remove(role);
			roleSorter.remove(role);
			LOG.debug("Removed role {} since it has no frameworks left.", role);
		}

		LOG.info("Removed framework {} and released {}.", frameworkId, framework.getTotalAllocation());
	}

	@Override
	public void frameworkActivated(FrameworkID frameworkId) {
		checkInit();

		final Framework framework = frameworks.get(frameworkId);

		if (framework == null) {
			LOG.debug("Trying to activate unknown framework {}.", frameworkId);
			return;
		}

		frameworkSorters.get(framework.getRole()).activate(frameworkId.getValue());

		LOG.info("Activated framework {}.", frameworkId);

		allocate(slaves.keySet());
	}

	@Override
	public void frameworkDeactivated(FrameworkID frameworkId) {
		checkInit();

		final Framework framework = frameworks.get(frameworkId);

		if (framework == null) {
			LOG.debug("Trying to deactivate unknown framework {}.", frameworkId);
			return;
		}

		frameworkSorters.get(framework.getRole()).deactivate(frameworkId.getValue());

		// a failed over scheduler should see the resources its predecessor declined
		framework.filters.clear();

		LOG.info("Deactivated framework {}.", frameworkId);
	}

	@Override
	public void offersRevived(FrameworkID frameworkId) {
		checkInit();

		final Framework framework = frameworks.get(frameworkId);

		if (framework == null) {
			LOG.debug("Ignoring revived offers of unknown framework {}.", frameworkId);
			return;
		}

		framework.filters.clear();
		LOG.debug("Removed all filters of framework {}.", frameworkId);

		allocate(slaves.keySet());
	}

	// ---------------------------------------------------------------------------------------------
	// Slaves
	// ---------------------------------------------------------------------------------------------

	@Override
	public void slaveAdded(SlaveID slaveId, SlaveInfo slaveInfo, Resources total, Map<FrameworkID, Resources> used) {
		checkInit();
		Preconditions.checkNotNull(slaveInfo);
		Preconditions.checkNotNull(total);
		Preconditions.checkNotNull(used);

		if (slaves.containsKey(slaveId)) {
			LOG.error("Slave {} has already been added. Ignoring the repeated registration.", slaveId);
			return;
		}

		final Slave slave = new Slave(slaveInfo, total);
		slaves.put(slaveId, slave);

		clusterResources = clusterResources.plus(total);
		roleSorter.add(total);
		for (Sorter frameworkSorter : frameworkSorters.values()) {
			frameworkSorter.add(total);
		}

		for (Map.Entry<FrameworkID, Resources> usedEntry : used.entrySet()) {
			final FrameworkID frameworkId = usedEntry.getKey();
			final Framework framework = frameworks.get(frameworkId);

			if (framework != null) {
				charge(frameworkId, framework, slaveId, slave, usedEntry.getValue());
			} else {
				final Resources parked = takeAvailable(slaveId, slave, usedEntry.getValue());
				slave.unclaimed.merge(frameworkId, parked, Resources::plus);
				LOG.debug("Parked {} of unknown framework {} on slave {}.", parked, frameworkId, slaveId);
			}
		}

		LOG.info("Added slave {} ({}) with {} (free: {}).", slaveId, slaveInfo.getHostname(), total, slave.available);

		allocate(Collections.singleton(slaveId));
	}

	@Override
	public void slaveRemoved(SlaveID slaveId) {
		checkInit();

		final Slave slave = slaves.remove(slaveId);

		if (slave == null) {
			LOG.debug("Slave {} is not registered. Ignoring the removal.", slaveId);
			return;
		}

		for (Map.Entry<FrameworkID, Framework> frameworkEntry : frameworks.entrySet()) {
			final Framework framework = frameworkEntry.getValue();
			final Resources allocation = framework.allocations.remove(slaveId);

			if (allocation != null) {
				final String role = framework.getRole();
				frameworkSorters.get(role).unallocated(frameworkEntry.getKey().getValue(), allocation);
				roleSorter.unallocated(role, allocation);
			}

			framework.filters.removeIf(filter -> filter.getSlaveId().equals(slaveId));
		}

		clusterResources = clusterResources.minus(slave.total);
		roleSorter.remove(slave.total);
		for (Sorter frameworkSorter : frameworkSorters.values()) {
			frameworkSorter.remove(slave.total);
		}

		LOG.info("Removed slave {} ({}).", slaveId, slave.info.getHostname());
	}

	@Override
	public void updateWhitelist(@Nullable Collection<String> hostnames) throws AllocatorException {
		checkInit();

		whitelist = Whitelist.of(hostnames);

		if (hostnames == null) {
			LOG.info("Advertising offers for all slaves.");
		} else {
			LOG.info("Updated the slave whitelist: {}.", hostnames);
		}
	}

	// ---------------------------------------------------------------------------------------------
	// Resources
	// ---------------------------------------------------------------------------------------------

	@Override
	public void resourcesUnused(
			FrameworkID frameworkId,
			SlaveID slaveId,
			Resources resources,
			@Nullable Duration filterTimeout) {
		checkInit();

		if (resources.isEmpty()) {
			return;
		}

		final Framework framework = release(frameworkId, slaveId, resources);

		if (framework == null || !slaves.containsKey(slaveId)) {
			return;
		}

		if (filterTimeout != null && filterTimeout.isNegative()) {
			LOG.warn(
				"Framework {} requested the negative filter timeout {}. Using the default filter timeout {} instead.",
				frameworkId,
				filterTimeout,
				configuration.getDefaultFilterTimeout());
		}

		final Duration timeout = configuration.resolveFilterTimeout(filterTimeout);

		if (!timeout.isZero()) {
			final long now = clock.relativeTimeMillis();
			final long timeoutMillis = timeout.toMillis();
			final long expiration = timeoutMillis > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + timeoutMillis;
			final Filter filter = new Filter(slaveId, resources, expiration);
			framework.filters.add(filter);

			LOG.debug("Framework {} filtered slave {} for {}.", frameworkId, slaveId, timeout);
		}
	}

	@Override
	public void resourcesRecovered(FrameworkID frameworkId, SlaveID slaveId, Resources resources) {
		checkInit();

		if (resources.isEmpty()) {
			return;
		}

		release(frameworkId, slaveId, resources);

		if (slaves.containsKey(slaveId)) {
			allocate(Collections.singleton(slaveId));
		}
	}

	/**
	 * Returns resources of a framework to the slave's free pool.
	 *
	 * @return the framework if it is still registered, otherwise null
	 */
	@Nullable
	private Framework release(FrameworkID frameworkId, SlaveID slaveId, Resources resources) {
		final Slave slave = slaves.get(slaveId);
		final Framework framework = frameworks.get(frameworkId);

		if (slave == null) {
			// the slave's resources have been removed together with the slave
			LOG.debug("Ignoring resources {} of framework {} on unknown slave {}.", resources, frameworkId, slaveId);
			return framework;
		}

		if (framework != null) {
			final Resources allocation = framework.getAllocation(slaveId);
			Resources toRelease = resources;

			if (!allocation.contains(resources)) {
				LOG.error(
					"Framework {} returned {} on slave {} but only {} is allocated to it. Returning the allocated part only.",
					frameworkId,
					resources,
					slaveId,
					allocation);
				toRelease = allocation.intersection(resources);
			}

			framework.unallocate(slaveId, toRelease);
			frameworkSorters.get(framework.getRole()).unallocated(frameworkId.getValue(), toRelease);
			roleSorter.unallocated(framework.getRole(), toRelease);
			slave.available = slave.available.plus(toRelease);

			LOG.debug("Recovered {} of framework {} on slave {}.", toRelease, frameworkId, slaveId);
		} else {
			final Resources parked = slave.unclaimed.get(frameworkId);

			if (parked == null) {
				// removing the framework already returned everything it held
				LOG.debug("Framework {} is not registered. Its resources on slave {} have already been released.", frameworkId, slaveId);
				return null;
			}

			final Resources toRelease = parked.intersection(resources);
			final Resources remaining = parked.minus(toRelease);

			if (remaining.isEmpty()) {
				slave.unclaimed.remove(frameworkId);
			} else {
				slave.unclaimed.put(frameworkId, remaining);
			}

			slave.available = slave.available.plus(toRelease);

			LOG.debug("Recovered {} of unregistered framework {} on slave {}.", toRelease, frameworkId, slaveId);
		}

		return framework;
	}

	/**
	 * Charges resources which are already in use on a slave to a framework.
	 */
	private void charge(FrameworkID frameworkId, Framework framework, SlaveID slaveId, Slave slave, Resources used) {
		final Resources charged = takeAvailable(slaveId, slave, used);

		framework.allocate(slaveId, charged);
		frameworkSorters.get(framework.getRole()).allocated(frameworkId.getValue(), charged);
		roleSorter.allocated(framework.getRole(), charged);
	}

	private Resources takeAvailable(SlaveID slaveId, Slave slave, Resources resources) {
		Resources taken = resources;

		if (!slave.available.contains(resources)) {
			LOG.error(
				"Resources {} in use on slave {} exceed its free resources {}. Accounting for the free part only.",
				resources,
				slaveId,
				slave.available);
			taken = slave.available.intersection(resources);
		}

		slave.available = slave.available.minus(taken);
		return taken;
	}

	// ---------------------------------------------------------------------------------------------
	// Allocation
	// ---------------------------------------------------------------------------------------------

	@Override
	public void batch() {
		checkInit();
		allocate(slaves.keySet());
	}

	/**
	 * Offers the free resources of the given slaves.
	 */
	private void allocate(Collection<SlaveID> slaveIds) {
		final long now = clock.relativeTimeMillis();
		expireFilters(now);

		if (frameworks.isEmpty() || slaveIds.isEmpty()) {
			return;
		}

		final List<SlaveID> candidates = new ArrayList<>(slaveIds.size());
		for (Map.Entry<SlaveID, Slave> slaveEntry : slaves.entrySet()) {
			final Slave slave = slaveEntry.getValue();

			if (slaveIds.contains(slaveEntry.getKey())
				&& !slave.available.isEmpty()
				&& whitelist.isWhitelisted(slave.info.getHostname())) {
				candidates.add(slaveEntry.getKey());
			}
		}

		if (candidates.isEmpty()) {
			return;
		}

		final Map<FrameworkID, Map<SlaveID, Resources>> offerable = new LinkedHashMap<>();

		for (String role : roleSorter.sort()) {
			final Sorter frameworkSorter = frameworkSorters.get(role);

			for (String client : frameworkSorter.sort()) {
				final FrameworkID frameworkId = new FrameworkID(client);
				final Framework framework = frameworks.get(frameworkId);

				for (SlaveID slaveId : candidates) {
					final Slave slave = slaves.get(slaveId);
					final Resources offer = slave.available.allocatableTo(role);

					if (!isAllocatable(offer) || framework.isFiltered(slaveId, offer, now)) {
						continue;
					}

					offerable.computeIfAbsent(frameworkId, ignored -> new LinkedHashMap<>()).put(slaveId, offer);

					slave.available = slave.available.minus(offer);
					framework.allocate(slaveId, offer);
					frameworkSorter.allocated(client, offer);
					roleSorter.allocated(role, offer);
				}
			}
		}

		for (Map.Entry<FrameworkID, Map<SlaveID, Resources>> offers : offerable.entrySet()) {
			LOG.debug("Offering {} to framework {}.", offers.getValue(), offers.getKey());
			offerListener.onResourceOffers(offers.getKey(), Collections.unmodifiableMap(offers.getValue()));
		}
	}

	private boolean isAllocatable(Resources resources) {
		if (resources.isEmpty()) {
			return false;
		}

		final double cpus = resources.cpus().orElse(0.0);
		final double mem = resources.mem().orElse(0.0);

		return (cpus > 0.0 && cpus >= configuration.getMinAllocatableCpus())
			|| (mem > 0.0 && mem >= configuration.getMinAllocatableMem());
	}

	private void expireFilters(long now) {
		for (Map.Entry<FrameworkID, Framework> frameworkEntry : frameworks.entrySet()) {
			if (frameworkEntry.getValue().filters.removeIf(filter -> filter.isExpired(now))) {
				LOG.debug("Expired filters of framework {}.", frameworkEntry.getKey());
			}
		}
	}

	// ---------------------------------------------------------------------------------------------
	// Testing
	// ---------------------------------------------------------------------------------------------

	@VisibleForTesting
	Resources getAvailable(SlaveID slaveId) {
		final Slave slave = slaves.get(slaveId);
		return slave != null ? slave.available : Resources.empty();
	}

	@VisibleForTesting
	Resources getAllocation(FrameworkID frameworkId) {
		final Framework framework = frameworks.get(frameworkId);
		return framework != null ? framework.getTotalAllocation() : Resources.empty();
	}

	@VisibleForTesting
	Resources getAllocation(FrameworkID frameworkId, SlaveID slaveId) {
		final Framework framework = frameworks.get(frameworkId);
		return framework != null ? framework.getAllocation(slaveId) : Resources.empty();
	}

	@VisibleForTesting
	int getNumberOfFilters(FrameworkID frameworkId) {
		final Framework framework = frameworks.get(frameworkId);
		return framework != null ? framework.filters.size() : 0;
	}

	@VisibleForTesting
	boolean isRegistered(FrameworkID frameworkId) {
		return frameworks.containsKey(frameworkId);
	}

	@VisibleForTesting
	boolean hasRole(String role) {
		return roleSorter.contains(role);
	}

	@VisibleForTesting
	Resources getClusterResources() {
		return clusterResources;
	}

	// ---------------------------------------------------------------------------------------------
	// Bookkeeping
	// ---------------------------------------------------------------------------------------------

	private static final class Framework {

		private final FrameworkInfo info;

		/** Resources held by the framework, per slave. */
		private final Map<SlaveID, Resources> allocations = new LinkedHashMap<>();

		private final List<Filter> filters = new ArrayList<>();

		private Framework(FrameworkInfo info) {
			this.info = info;
		}

		private String getRole() {
			return info.getRole();
		}

		private Resources getAllocation(SlaveID slaveId) {
			return allocations.getOrDefault(slaveId, Resources.empty());
		}

		private Resources getTotalAllocation() {
			Resources total = Resources.empty();
			for (Resources allocation : allocations.values()) {
				total = total.plus(allocation);
			}
			return total;
		}

		private void allocate(SlaveID slaveId, Resources resources) {
			if (!resources.isEmpty()) {
				allocations.merge(slaveId, resources, Resources::plus);
			}
		}

		private void unallocate(SlaveID slaveId, Resources resources) {
			final Resources remaining = getAllocation(slaveId).minus(resources);

			if (remaining.isEmpty()) {
				allocations.remove(slaveId);
			} else {
				allocations.put(slaveId, remaining);
			}
		}

		private boolean isFiltered(SlaveID slaveId, Resources offer, long now) {
			for (Filter filter : filters) {
				if (filter.filters(slaveId, offer, now)) {
					return true;
				}
			}
			return false;
		}
	}

	private static final class Slave {

		private final SlaveInfo info;

		private final Resources total;

		/** Resources which are neither allocated nor parked. */
		private Resources available;

		/** Resources in use by frameworks which have not registered yet. */
		private final Map<FrameworkID, Resources> unclaimed = new HashMap<>(4);

		private Slave(SlaveInfo info, Resources total) {
			this.info = info;
			this.total = total;
			this.available = total;
		}
	}
}
