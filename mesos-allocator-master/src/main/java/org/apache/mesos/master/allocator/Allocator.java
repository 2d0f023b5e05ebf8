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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.util.ExecutorUtils;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.concurrent.ExecutorThreadFactory;
import org.apache.flink.util.concurrent.FutureUtils;
import org.apache.flink.util.function.ThrowingRunnable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asynchronous front of an {@link AllocatorProcess}. Every call is enqueued on a single main
 * thread and returns immediately, so that the process is only ever touched by that thread.
 *
 * <p>Besides dispatching the calls, the allocator runs the periodic allocation pass, schedules a
 * pass whenever a filter installed for unused resources expires and, if a whitelist file is
 * configured, watches that file.
 */
public class Allocator implements AutoCloseable {
	private static final Logger LOG = LoggerFactory.getLogger(Allocator.class);

	private static final long SHUTDOWN_TIMEOUT_MILLIS = 10000L;

	private final AllocatorProcess process;

	private final ScheduledExecutorService mainThreadExecutor;

	private final AtomicBoolean closed = new AtomicBoolean(false);

	private final CompletableFuture<Void> terminationFuture = new CompletableFuture<>();

	// the following fields are only accessed from the main thread

	@Nullable
	private AllocatorConfiguration configuration;

	@Nullable
	private ScheduledFuture<?> periodicAllocation;

	@Nullable
	private WhitelistWatcher whitelistWatcher;

	/** Pending passes which run once the filters installed for unused resources expire. */
	private final Set<ScheduledFuture<?>> filterExpiries = new HashSet<>(4);

	public Allocator(AllocatorProcess process) {
		this(process, Executors.newSingleThreadScheduledExecutor(new ExecutorThreadFactory("mesos-allocator")));
	}

	@VisibleForTesting
	Allocator(AllocatorProcess process, ScheduledExecutorService mainThreadExecutor) {
		this.process = Preconditions.checkNotNull(process);
		this.mainThreadExecutor = Preconditions.checkNotNull(mainThreadExecutor);

		configuration = null;
		periodicAllocation = null;
		whitelistWatcher = null;
	}

	// ---------------------------------------------------------------------------------------------
	// Lifecycle
	// ---------------------------------------------------------------------------------------------

	/**
	 * Initializes the process, starts the periodic allocation pass and, if configured, the
	 * whitelist watcher.
	 *
	 * @return future which is completed once the allocator has been initialized
	 */
	public CompletableFuture<Void> initialize(AllocatorConfiguration newConfiguration, ResourceOfferListener offerListener) {
		Preconditions.checkNotNull(newConfiguration);
		Preconditions.checkNotNull(offerListener);

		return callAsync("initialize", () -> {
			process.initialize(newConfiguration, offerListener);
			configuration = newConfiguration;

			final long intervalMillis = newConfiguration.getAllocationInterval().toMillis();
			periodicAllocation = mainThreadExecutor.scheduleWithFixedDelay(
				() -> runSafely("batch", process::batch),
				intervalMillis,
				intervalMillis,
				TimeUnit.MILLISECONDS);

			final Optional<Path> whitelistPath = newConfiguration.getWhitelistPath();
			if (whitelistPath.isPresent()) {
				whitelistWatcher = new WhitelistWatcher(
					whitelistPath.get(),
					newConfiguration.getWhitelistWatchInterval(),
					this::updateWhitelist);
				whitelistWatcher.start();
			}
		});
	}

	/**
	 * Shuts the allocator down. Calls which arrive afterwards are dropped.
	 *
	 * @return future which is completed once the allocator has been shut down
	 */
	public CompletableFuture<Void> closeAsync() {
		if (closed.compareAndSet(false, true)) {
			LOG.info("Stopping the allocator.");

			try {
				mainThreadExecutor.execute(this::stopServices);
			} catch (RejectedExecutionException e) {
				LOG.debug("The main thread executor has already been shut down.", e);
			}

			ExecutorUtils.nonBlockingShutdown(SHUTDOWN_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS, mainThreadExecutor)
				.whenComplete((ignored, throwable) -> {
					if (throwable != null) {
						terminationFuture.completeExceptionally(throwable);
					} else {
						terminationFuture.complete(null);
					}
				});
		}

		return terminationFuture;
	}

	@Override
	public void close() throws Exception {
		closeAsync().get();
	}

	private void stopServices() {
		if (periodicAllocation != null) {
			periodicAllocation.cancel(false);
			periodicAllocation = null;
		}

		if (whitelistWatcher != null) {
			whitelistWatcher.close();
			whitelistWatcher = null;
		}

		for (ScheduledFuture<?> filterExpiry : filterExpiries) {
			filterExpiry.cancel(false);
		}
		filterExpiries.clear();
	}

	// ---------------------------------------------------------------------------------------------
	// Frameworks
	// ---------------------------------------------------------------------------------------------

	public void frameworkAdded(FrameworkID frameworkId, FrameworkInfo frameworkInfo, Map<SlaveID, Resources> used) {
		final Map<SlaveID, Resources> usedCopy = new HashMap<>(used);
		runAsync("frameworkAdded", () -> process.frameworkAdded(frameworkId, frameworkInfo, usedCopy));
	}

	public void frameworkRemoved(FrameworkID frameworkId) {
		runAsync("frameworkRemoved", () -> process.frameworkRemoved(frameworkId));
	}

	public void frameworkActivated(FrameworkID frameworkId) {
		runAsync("frameworkActivated", () -> process.frameworkActivated(frameworkId));
	}

	public void frameworkDeactivated(FrameworkID frameworkId) {
		runAsync("frameworkDeactivated", () -> process.frameworkDeactivated(frameworkId));
	}

	public void offersRevived(FrameworkID frameworkId) {
		runAsync("offersRevived", () -> process.offersRevived(frameworkId));
	}

	// ---------------------------------------------------------------------------------------------
	// Slaves
	// ---------------------------------------------------------------------------------------------

	public void slaveAdded(SlaveID slaveId, SlaveInfo slaveInfo, Resources total, Map<FrameworkID, Resources> used) {
		final Map<FrameworkID, Resources> usedCopy = new HashMap<>(used);
		runAsync("slaveAdded", () -> process.slaveAdded(slaveId, slaveInfo, total, usedCopy));
	}

	public void slaveRemoved(SlaveID slaveId) {
		runAsync("slaveRemoved", () -> process.slaveRemoved(slaveId));
	}

	/**
	 * Replaces the whitelist.
	 *
	 * @param hostnames of the admitted slaves, or null to admit all slaves
	 * @return future which is completed exceptionally with an {@link AllocatorException} if the
	 * whitelist has been rejected
	 */
	public CompletableFuture<Void> updateWhitelist(@Nullable Collection<String> hostnames) {
		final Collection<String> hostnamesCopy = hostnames != null ? new ArrayList<>(hostnames) : null;
		return callAsync("updateWhitelist", () -> process.updateWhitelist(hostnamesCopy));
	}

	// ---------------------------------------------------------------------------------------------
	// Resources
	// ---------------------------------------------------------------------------------------------

	public void resourcesUnused(
			FrameworkID frameworkId,
			SlaveID slaveId,
			Resources resources,
			@Nullable Duration filterTimeout) {
		runAsync("resourcesUnused", () -> {
			process.resourcesUnused(frameworkId, slaveId, resources, filterTimeout);

			final Duration timeout = configuration.resolveFilterTimeout(filterTimeout);
			if (!timeout.isZero() && !closed.get()) {
				filterExpiries.removeIf(Future::isDone);

				// offer the filtered resources again once the filter has expired
				filterExpiries.add(mainThreadExecutor.schedule(
					() -> runSafely("batch", process::batch),
					timeout.toMillis(),
					TimeUnit.MILLISECONDS));
			}
		});
	}

	public void resourcesRecovered(FrameworkID frameworkId, SlaveID slaveId, Resources resources) {
		runAsync("resourcesRecovered", () -> process.resourcesRecovered(frameworkId, slaveId, resources));
	}

	// ---------------------------------------------------------------------------------------------
	// Internal methods
	// ---------------------------------------------------------------------------------------------

	private void runAsync(String operation, Runnable runnable) {
		try {
			mainThreadExecutor.execute(() -> runSafely(operation, runnable));
		} catch (RejectedExecutionException e) {
			LOG.debug("Dropping {} since the allocator has been shut down.", operation, e);
		}
	}

	private void runSafely(String operation, Runnable runnable) {
		try {
			runnable.run();
		} catch (Throwable t) {
			LOG.error("Failed to handle {}.", operation, t);
		}
	}

	private CompletableFuture<Void> callAsync(String operation, ThrowingRunnable<? extends Exception> runnable) {
		final CompletableFuture<Void> result = new CompletableFuture<>();

		try {
			mainThreadExecutor.execute(() -> {
				try {
					runnable.run();
					result.complete(null);
				} catch (Throwable t) {
					LOG.error("Failed to handle {}.", operation, t);
					result.completeExceptionally(t);
				}
			});
		} catch (RejectedExecutionException e) {
			LOG.debug("Dropping {} since the allocator has been shut down.", operation, e);
			return FutureUtils.completedExceptionally(
				new AllocatorException("The allocator has been shut down.", e));
		}

		return result;
	}
}
