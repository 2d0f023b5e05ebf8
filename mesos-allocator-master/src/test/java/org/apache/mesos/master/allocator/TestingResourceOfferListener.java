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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.BiConsumer;

/**
 * Testing implementation of the {@link ResourceOfferListener} which records all offers.
 */
public class TestingResourceOfferListener implements ResourceOfferListener {

	private final BiConsumer<FrameworkID, Map<SlaveID, Resources>> onResourceOffersConsumer;

	private final BlockingQueue<ResourceOffer> offers = new LinkedBlockingQueue<>();

	TestingResourceOfferListener(BiConsumer<FrameworkID, Map<SlaveID, Resources>> onResourceOffersConsumer) {
		this.onResourceOffersConsumer = onResourceOffersConsumer;
	}

	@Override
	public void onResourceOffers(FrameworkID frameworkId, Map<SlaveID, Resources> resourceOffers) {
		offers.add(new ResourceOffer(frameworkId, new LinkedHashMap<>(resourceOffers)));
		onResourceOffersConsumer.accept(frameworkId, resourceOffers);
	}

	/**
	 * Returns and forgets all offers made so far.
	 */
	public List<ResourceOffer> drainOffers() {
		final List<ResourceOffer> drained = new ArrayList<>();
		offers.drainTo(drained);
		return drained;
	}

	public ResourceOffer takeOffer() throws InterruptedException {
		return offers.take();
	}

	/**
	 * Offers made to a single framework in one allocation pass.
	 */
	public static final class ResourceOffer {

		private final FrameworkID frameworkId;

		private final Map<SlaveID, Resources> offers;

		ResourceOffer(FrameworkID frameworkId, Map<SlaveID, Resources> offers) {
			this.frameworkId = frameworkId;
			this.offers = offers;
		}

		public FrameworkID getFrameworkId() {
			return frameworkId;
		}

		public Map<SlaveID, Resources> getOffers() {
			return offers;
		}

		public Resources getTotal() {
			Resources total = Resources.empty();
			for (Resources resources : offers.values()) {
				total = total.plus(resources);
			}
			return total;
		}

		@Override
		public String toString() {
			return "ResourceOffer{frameworkId=" + frameworkId + ", offers=" + offers + '}';
		}
	}
}
