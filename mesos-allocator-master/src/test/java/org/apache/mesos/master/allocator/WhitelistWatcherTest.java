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

import org.apache.flink.util.TestLogger;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThat;

/**
 * Tests for the {@link WhitelistWatcher}.
 */
public class WhitelistWatcherTest extends TestLogger {

	@Rule
	public final TemporaryFolder temporaryFolder = new TemporaryFolder();

	@Test
	public void testCommentsAndBlankLinesAreSkipped() throws Exception {
		final Path whitelistFile = writeWhitelist("# slaves of rack 1", "host-1", "", "  host-2  ", "#host-3");

		assertThat(WhitelistWatcher.readWhitelist(whitelistFile), contains("host-1", "host-2"));
	}

	@Test
	public void testWhitelistIsOnlyPushedWhenChanged() throws Exception {
		final Path whitelistFile = writeWhitelist("host-1");
		final List<Collection<String>> pushedWhitelists = new ArrayList<>();

		try (WhitelistWatcher watcher = new WhitelistWatcher(whitelistFile, Duration.ofHours(1L), pushedWhitelists::add)) {
			watcher.checkWhitelist();
			watcher.checkWhitelist();
			assertThat(pushedWhitelists, hasSize(1));

			writeWhitelist(whitelistFile, "host-1", "host-2");
			watcher.checkWhitelist();

			assertThat(pushedWhitelists, hasSize(2));
			assertThat(new ArrayList<>(pushedWhitelists.get(1)), contains("host-1", "host-2"));
		}
	}

	@Test
	public void testUnreadableFileKeepsPreviousWhitelist() throws Exception {
		final Path whitelistFile = writeWhitelist("host-1");
		final List<Collection<String>> pushedWhitelists = new ArrayList<>();

		try (WhitelistWatcher watcher = new WhitelistWatcher(whitelistFile, Duration.ofHours(1L), pushedWhitelists::add)) {
			watcher.checkWhitelist();

			Files.delete(whitelistFile);
			watcher.checkWhitelist();

			assertThat(pushedWhitelists, hasSize(1));
		}
	}

	@Test
	public void testMissingFileIsNotPushed() throws Exception {
		final Path whitelistFile = new File(temporaryFolder.getRoot(), "missing").toPath();
		final List<Collection<String>> pushedWhitelists = new ArrayList<>();

		try (WhitelistWatcher watcher = new WhitelistWatcher(whitelistFile, Duration.ofHours(1L), pushedWhitelists::add)) {
			watcher.checkWhitelist();

			assertThat(pushedWhitelists, is(empty()));
		}
	}

	@Test
	public void testStartReadsTheFilePeriodically() throws Exception {
		final Path whitelistFile = writeWhitelist("host-1");
		final CompletableFuture<Collection<String>> firstWhitelist = new CompletableFuture<>();
		final CompletableFuture<Collection<String>> secondWhitelist = new CompletableFuture<>();

		try (WhitelistWatcher watcher = new WhitelistWatcher(
				whitelistFile,
				Duration.ofMillis(10L),
				whitelist -> {
					if (!firstWhitelist.complete(whitelist)) {
						secondWhitelist.complete(whitelist);
					}
				})) {
			watcher.start();

			assertThat(new ArrayList<>(firstWhitelist.get(10L, TimeUnit.SECONDS)), contains("host-1"));

			// replace the file atomically so that the watcher never reads a partially written file
			final Path updatedFile = writeWhitelist("host-2");
			Files.move(updatedFile, whitelistFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

			assertThat(new ArrayList<>(secondWhitelist.get(10L, TimeUnit.SECONDS)), contains("host-2"));
		}
	}

	private Path writeWhitelist(String... lines) throws Exception {
		final Path whitelistFile = temporaryFolder.newFile().toPath();
		writeWhitelist(whitelistFile, lines);
		return whitelistFile;
	}

	private static void writeWhitelist(Path whitelistFile, String... lines) throws Exception {
		Files.write(whitelistFile, Arrays.asList(lines), StandardCharsets.UTF_8);
	}
}
