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
import org.apache.mesos.types.SlaveID;

import java.util.Map;

/**
 * Receives the offers computed by an allocation pass. Implemented by the master, which turns them
 * into resource offers for the framework's scheduler.
 */
public interface ResourceOfferListener {

	/**
	 * Offers resources to a framework.
	 *
	 * @param frameworkId framework to offer the resources to
	 * @param offers resources per slave, in the order in which the slaves registered
	 */
	void onResourceOffers(FrameworkID frameworkId, Map<SlaveID, Resources> offers);
}
