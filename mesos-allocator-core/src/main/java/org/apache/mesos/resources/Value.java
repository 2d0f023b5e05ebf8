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

/**
 * Quantity of a single resource dimension. Values are immutable; every operation returns a new
 * value of the same {@link Type}.
 *
 * <p>Operations combining values of different types are rejected with an
 * {@link IllegalArgumentException}.
 */
public abstract class Value {

	/**
	 * Kinds of resource values.
	 */
	public enum Type {
		SCALAR,
		RANGES,
		SET
	}

	public abstract Type getType();

	public abstract boolean isEmpty();

	/**
	 * Checks whether every unit of the given value is also part of this value.
	 */
	public abstract boolean contains(Value other);

	public abstract Value add(Value other);

	/**
	 * Subtracts the given value. The given value must be contained in this value.
	 */
	public abstract Value subtract(Value other);

	public abstract Value intersect(Value other);

	@SuppressWarnings("unchecked")
	<V extends Value> V checkCompatible(Value other) {
		Preconditions.checkNotNull(other);
		Preconditions.checkArgument(
			getType() == other.getType(),
			"Cannot combine a %s value with a %s value.",
			getType(),
			other.getType());
		return (V) other;
	}

	void checkContained(Value other) {
		Preconditions.checkArgument(
			contains(other),
			"Cannot subtract %s from %s because it is not contained.",
			other,
			this);
	}
}
