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

package org.apache.mesos.resources;

import org.apache.flink.util.Preconditions;

import java.util.Objects;

/**
 * A named resource value which is either unreserved or reserved to a single role.
 */
public final class Resource {

	/** Role of resources which are not reserved to any role. */
	public static final String UNRESERVED_ROLE = "*";

	private final String name;

	private final String role;

	private final Value value;

	public Resource(String name, String role, Value value) {
		Preconditions.checkArgument(name != null && !name.trim().isEmpty(), "Resource name must not be blank.");
		Preconditions.checkArgument(role != null && !role.trim().isEmpty(), "Resource role must not be blank.");
		this.name = name;
		this.role = role;
		this.value = Preconditions.checkNotNull(value);
	}

	public static Resource scalar(String name, double value) {
		return new Resource(name, UNRESERVED_ROLE, ScalarValue.of(value));
	}

	public static Resource scalar(String name, String role, double value) {
		return new Resource(name, role, ScalarValue.of(value));
	}

	public static Resource ranges(String name, RangesValue.Range... ranges) {
		return new Resource(name, UNRESERVED_ROLE, RangesValue.of(ranges));
	}

	public static Resource set(String name, String... items) {
		return new Resource(name, UNRESERVED_ROLE, SetValue.of(items));
	}

	public String getName() {
		return name;
	}

	public String getRole() {
		return role;
	}

	public Value getValue() {
		return value;
	}

	public Value.Type getType() {
		return value.getType();
	}

	public boolean isReserved() {
		return !UNRESERVED_ROLE.equals(role);
	}

	Resource withValue(Value newValue) {
		return new Resource(name, role, newValue);
	}

	Key getKey() {
		return new Key(name, role);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		final Resource resource = (Resource) o;
		return name.equals(resource.name) && role.equals(resource.role) && value.equals(resource.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, role, value);
	}

	@Override
	public String toString() {
		return name + "(" + role + "):" + value;
	}

	/**
	 * Identity of a resource within {@link Resources}.
	 */
	static final class Key implements Comparable<Key> {

		private final String name;

		private final String role;

		Key(String name, String role) {
			this.name = name;
			this.role = role;
		}

		String getName() {
			return name;
		}

		String getRole() {
			return role;
		}

		@Override
		public int compareTo(Key other) {
			final int byName = name.compareTo(other.name);
			return byName != 0 ? byName : role.compareTo(other.role);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (o == null || getClass() != o.getClass()) {
				return false;
			}
			final Key key = (Key) o;
			return name.equals(key.name) && role.equals(key.role);
		}

		@Override
		public int hashCode() {
			return Objects.hash(name, role);
		}

		@Override
		public String toString() {
			return name + "(" + role + ")";
		}
	}
}
