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
import org.apache.flink.util.ExecutorUtils;
import org.apache.flink.util.Preconditions;
import org.apache.flink.util.concurrent.ExecutorThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Periodically reads a whitelist file and hands its hostnames to a consumer whenever the content
 * of the file changes.
 *
 * <p>The file lists one hostname per line. Blank lines and lines starting with {@code #} are
 * skipped. If the file cannot be read, the previous whitelist stays in force.
 */
public class WhitelistWatcher implements AutoCloseable {
	private static final Logger LOG = LoggerFactory.getLogger(WhitelistWatcher.class);

	private static final String COMMENT_PREFIX = "#";

	private final Path path;

	private final Duration watchInterval;

	private final Consumer<Collection<String>> whitelistConsumer;

	private final ScheduledExecutorService ioExecutor;

	/** Last whitelist handed to the consumer; null if none has been read yet. */
	@Nullable
	private List<String> lastWhitelist;

	public WhitelistWatcher(Path path, Duration watchInterval, Consumer<Collection<String>> whitelistConsumer) {
		this(
			path,
			watchInterval,
			whitelistConsumer,
			Executors.newSingleThreadScheduledExecutor(new ExecutorThreadFactory("mesos-allocator-whitelist-watcher")));
	}

	@VisibleForTesting
	WhitelistWatcher(
			Path path,
			Duration watchInterval,
			Consumer<Collection<String>> whitelistConsumer,
			ScheduledExecutorService ioExecutor) {
		this.path = Preconditions.checkNotNull(path);
		this.watchInterval = Preconditions.checkNotNull(watchInterval);
		this.whitelistConsumer = Preconditions.checkNotNull(whitelistConsumer);
		this.ioExecutor = Preconditions.checkNotNull(ioExecutor);

		lastWhitelist = null;
	}

	public void start() {
		LOG.info("Watching the whitelist file {} every {}.", path, watchInterval);

		ioExecutor.scheduleWithFixedDelay(
			this::checkWhitelist,
			0L,
			watchInterval.toMillis(),
			TimeUnit.MILLISECONDS);
	}

	@Override
	public void close() {
		ExecutorUtils.gracefulShutdown(watchInterval.toMillis(), TimeUnit.MILLISECONDS, ioExecutor);
	}

	/**
	 * Reads the whitelist file and hands it to the consumer if it differs from the last one.
	 */
	@VisibleForTesting
	synchronized void checkWhitelist() {
		final List<String> whitelist;

		try {
			whitelist = readWhitelist(path);
		} catch (IOException e) {
			LOG.warn("Could not read the whitelist file {}. Keeping the previous whitelist.", path, e);
			return;
		}

		if (!whitelist.equals(lastWhitelist)) {
			lastWhitelist = whitelist;

			if (whitelist.isEmpty()) {
				LOG.warn("The whitelist file {} is empty. No slave will be offered.", path);
			}

			whitelistConsumer.accept(whitelist);
		}
	}

	@VisibleForTesting
	static List<String> readWhitelist(Path path) throws IOException {
		final List<String> hostnames = new ArrayList<>();

		for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
			final String hostname = line.trim();

			if (!hostname.isEmpty() && !hostname.startsWith(COMMENT_PREFIX)) {
				hostnames.add(hostname);
			}
		}

		return hostnames;
	}
}
