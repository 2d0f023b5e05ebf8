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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link Sorter} implementing Dominant Resource Fairness. Clients are ordered by ascending
 * dominant share, i.e. the largest fraction of any scalar resource of the pool which is allocated
 * to the client, divided by the client's weight. Clients with equal shares are ordered by the time
 * they were added.
 *
 * <p>Shares are recomputed from the current allocations on every call to {@link #sort()}.
 */
public class DRFSorter implements Sorter {
	private static final Logger LOG = LoggerFactory.getLogger(DRFSorter.class);

	/** All registered clients. */
	private final Map<String, Client> clients = new HashMap<>();

	/** Resources the shares are computed against. */
	private Resources resources = Resources.empty();

	/** Sequence number handed to the next added client; breaks ties between equal shares. */
	private long nextSequenceNumber;

	@Override
	public void add(String client, double weight) {
		Preconditions.checkNotNull(client);
		Preconditions.checkArgument(weight > 0.0, "The weight of client %s must be positive but was %s.", client, weight);
		Preconditions.checkState(!clients.containsKey(client), "Client %s has already been added.", client);

		clients.put(client, new Client(client, weight, nextSequenceNumber++));
	}

	@Override
	public void remove(String client) {
		if (clients.remove(client) == null) {
			LOG.debug("Client {} is not registered. Ignoring the removal.", client);
		}
	}

	@Override
	public void activate(String client) {
		final Client registeredClient = clients.get(client);

		if (registeredClient != null) {
			registeredClient.active = true;
		} else {
			LOG.debug("Trying to activate unknown client {}.", client);
		}
	}

	@Override
	public void deactivate(String client) {
		final Client registeredClient = clients.get(client);

		if (registeredClient != null) {
			registeredClient.active = false;
		} else {
			LOG.debug("Trying to deactivate unknown client {}.", client);
		}
	}

	@Override
	public void allocated(String client, Resources allocatedResources) {
		final Client registeredClient = clients.get(client);

		if (registeredClient != null) {
			registeredClient.allocation = registeredClient.allocation.plus(allocatedResources);
		} else {
			LOG.error("Cannot allocate {} to unknown client {}.", allocatedResources, client);
		}
	}

	@Override
	public void unallocated(String client, Resources unallocatedResources) {
		final Client registeredClient = clients.get(client);

		if (registeredClient == null) {
			LOG.debug("Ignoring unallocated resources {} of unknown client {}.", unallocatedResources, client);
			return;
		}

		Resources toRemove = unallocatedResources;
		if (!registeredClient.allocation.contains(unallocatedResources)) {
			LOG.error(
				"Client {} should release {} but only {} is allocated to it. Releasing the allocated part only.",
				client,
				unallocatedResources,
				registeredClient.allocation);
			toRemove = registeredClient.allocation.intersection(unallocatedResources);
		}

		registeredClient.allocation = registeredClient.allocation.minus(toRemove);
	}

	@Override
	public Resources allocation(String client) {
		final Client registeredClient = clients.get(client);
		return registeredClient != null ? registeredClient.allocation : Resources.empty();
	}

	@Override
	public void add(Resources addedResources) {
		resources = resources.plus(addedResources);
	}

	@Override
	public void remove(Resources removedResources) {
		if (!resources.contains(removedResources)) {
			LOG.error("Cannot remove {} from the pool {}. Removing the contained part only.", removedResources, resources);
			resources = resources.minus(resources.intersection(removedResources));
		} else {
			resources = resources.minus(removedResources);
		}
	}

	@Override
	public List<String> sort() {
		final Map<String, Double> poolTotals = resources.scalarTotals();
		final List<Client> activeClients = new ArrayList<>(clients.size());

		for (Client client : clients.values()) {
			if (client.active) {
				client.share = calculateShare(client, poolTotals);
				activeClients.add(client);
			}
		}

		activeClients.sort(
			Comparator.comparingDouble((Client client) -> client.share)
				.thenComparingLong(client -> client.sequenceNumber));

		return activeClients.stream().map(client -> client.name).collect(Collectors.toList());
	}

	private static double calculateShare(Client client, Map<String, Double> poolTotals) {
		double share = 0.0;

		for (Map.Entry<String, Double> allocated : client.allocation.scalarTotals().entrySet()) {
			final Double total = poolTotals.get(allocated.getKey());

			if (total != null && total > 0.0) {
				share = Math.max(share, allocated.getValue() / total);
			}
		}

		return share / client.weight;
	}

	@Override
	public boolean contains(String client) {
		return clients.containsKey(client);
	}

	@Override
	public int count() {
		return clients.size();
	}

	@VisibleForTesting
	double getShare(String client) {
		final Client registeredClient = clients.get(client);
		Preconditions.checkArgument(registeredClient != null, "Unknown client %s.", client);
		return calculateShare(registeredClient, resources.scalarTotals());
	}

	@VisibleForTesting
	Resources getResources() {
		return resources;
	}

	private static final class Client {
		private final String name;
		private final double weight;
		private final long sequenceNumber;
		private boolean active = true;
		private double share;
		private Resources allocation = Resources.empty();

		private Client(String name, double weight, long sequenceNumber) {
			this.name = name;
			this.weight = weight;
			this.sequenceNumber = sequenceNumber;
		}
	}
}
