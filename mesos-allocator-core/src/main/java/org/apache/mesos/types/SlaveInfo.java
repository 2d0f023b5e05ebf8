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

package org.apache.mesos.types;

import org.apache.flink.util.Preconditions;

import java.io.Serializable;

/**
 * Description of a slave as reported upon registration. The allocator only looks at the
 * hostname, which is what the whitelist refers to.
 */
public final class SlaveInfo implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String hostname;

	private final int port;

	private final boolean checkpoint;

	public SlaveInfo(String hostname) {
		this(hostname, 5051, false);
	}

	public SlaveInfo(String hostname, int port, boolean checkpoint) {
		Preconditions.checkArgument(hostname != null && !hostname.trim().isEmpty(), "The hostname must not be blank.");
		this.hostname = hostname;
		this.port = port;
		this.checkpoint = checkpoint;
	}

	public String getHostname() {
		return hostname;
	}

	public int getPort() {
		return port;
	}

	public boolean isCheckpoint() {
		return checkpoint;
	}

	@Override
	public String toString() {
		return "SlaveInfo{" +
			"hostname='" + hostname + '\'' +
			", port=" + port +
			", checkpoint=" + checkpoint +
			'}';
	}
}
