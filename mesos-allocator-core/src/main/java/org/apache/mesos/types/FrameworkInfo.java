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

import org.apache.mesos.resources.Resource;

import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.Objects;

/**
 * Description of a framework as provided by its scheduler upon registration.
 */
public final class FrameworkInfo implements Serializable {

	private static final long serialVersionUID = 1L;

	public static final double DEFAULT_WEIGHT = 1.0;

	private final String name;

	private final String user;

	/** Role whose resource share the framework competes for. */
	private final String role;

	/** Weight dividing the framework's dominant share within its role. */
	private final double weight;

	private FrameworkInfo(String name, String user, String role, double weight) {
		this.name = Preconditions.checkNotNull(name);
		this.user = Preconditions.checkNotNull(user);
		Preconditions.checkArgument(role != null && !role.trim().isEmpty(), "The role must not be blank.");
		Preconditions.checkArgument(weight > 0.0, "The weight must be positive but was %s.", weight);
		this.role = role;
		this.weight = weight;
	}

	public String getName() {
		return name;
	}

	public String getUser() {
		return user;
	}

	public String getRole() {
		return role;
	}

	public double getWeight() {
		return weight;
	}

	public static Builder newBuilder() {
		return new Builder();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		final FrameworkInfo that = (FrameworkInfo) o;
		return Double.compare(that.weight, weight) == 0 &&
			name.equals(that.name) &&
			user.equals(that.user) &&
			role.equals(that.role);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, user, role, weight);
	}

	@Override
	public String toString() {
		return "FrameworkInfo{" +
			"name='" + name + '\'' +
			", user='" + user + '\'' +
			", role='" + role + '\'' +
			", weight=" + weight +
			'}';
	}

	/**
	 * Builder for {@link FrameworkInfo}.
	 */
	public static class Builder {
		private String name = "";
		private String user = "";
		private String role = Resource.UNRESERVED_ROLE;
		private double weight = DEFAULT_WEIGHT;

		private Builder() {}

		public Builder setName(String name) {
			this.name = name;
			return this;
		}

		public Builder setUser(String user) {
			this.user = user;
			return this;
		}

		public Builder setRole(String role) {
			this.role = role;
			return this;
		}

		public Builder setWeight(double weight) {
			this.weight = weight;
			return this;
		}

		public FrameworkInfo build() {
			return new FrameworkInfo(name, user, role, weight);
		}
	}
}
