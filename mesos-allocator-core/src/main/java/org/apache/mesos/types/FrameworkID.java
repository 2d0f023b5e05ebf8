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

import org.apache.flink.util.AbstractID;
import org.apache.flink.util.Preconditions;

import java.io.Serializable;

/**
 * Unique identifier of a framework registered with the master.
 */
public final class FrameworkID implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String value;

	public FrameworkID(String value) {
		Preconditions.checkArgument(value != null && !value.isEmpty(), "FrameworkID must not be empty.");
		this.value = value;
	}

	public static FrameworkID generate() {
		return new FrameworkID(new AbstractID().toString());
	}

	public String getValue() {
		return value;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return value.equals(((FrameworkID) o).value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return value;
	}
}
