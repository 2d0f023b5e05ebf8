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

import java.util.List;

/**
 * Orders the clients sharing a pool of resources. The allocator uses one sorter to rank the roles
 * against each other and one sorter per role to rank the frameworks of that role.
 *
 * <p>Implementations are not thread-safe. They are only accessed from the allocator's main thread.
 */
public interface Sorter {

	/**
	 * Adds a client with an empty allocation.
	 *
	 * @param client to add
	 * @param weight by which the client's share is divided
	 * @throws IllegalStateException if the client has already been added
	 */
	void add(String client, double weight);

	/**
	 * Removes a client together with its allocation. Removing an unknown client is a no-op.
	 *
	 * @param client to remove
	 */
	void remove(String client);

	/**
	 * Makes the client take part in {@link #sort()} again.
	 */
	void activate(String client);

	/**
	 * Excludes the client from {@link #sort()} while keeping its allocation.
	 */
	void deactivate(String client);

	/**
	 * Records that the given resources have been allocated to the client.
	 */
	void allocated(String client, Resources resources);

	/**
	 * Records that the given resources are no longer allocated to the client. Resources which are
	 * not allocated to the client are reported and ignored.
	 */
	void unallocated(String client, Resources resources);

	/**
	 * Returns the resources currently allocated to the client, or empty resources if the client
	 * is unknown.
	 */
	Resources allocation(String client);

	/**
	 * Adds resources to the pool the shares are computed against.
	 */
	void add(Resources resources);

	/**
	 * Removes resources from the pool the shares are computed against.
	 */
	void remove(Resources resources);

	/**
	 * Returns the active clients in the order in which they should be offered resources.
	 */
	List<String> sort();

	boolean contains(String client);

	/**
	 * Returns the number of clients, active or not.
	 */
	int count();
}
