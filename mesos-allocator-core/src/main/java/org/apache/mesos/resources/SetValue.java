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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Set of named items, e.g. the disks of a slave.
 */
public final class SetValue extends Value {

	public static final SetValue EMPTY = new SetValue(new TreeSet<>());

	private final SortedSet<String> items;

	private SetValue(SortedSet<String> items) {
		this.items = Collections.unmodifiableSortedSet(items);
	}

	public static SetValue of(String... items) {
		return of(Arrays.asList(items));
	}

	public static SetValue of(Collection<String> items) {
		for (String item : items) {
			Preconditions.checkArgument(item != null && !item.trim().isEmpty(), "Set items must not be blank.");
		}
		return new SetValue(new TreeSet<>(items));
	}

	public SortedSet<String> getItems() {
		return items;
	}

	@Override
	public Type getType() {
		return Type.SET;
	}

	@Override
	public boolean isEmpty() {
		return items.isEmpty();
	}

	@Override
	public boolean contains(Value other) {
		final SetValue setValue = checkCompatible(other);
		return items.containsAll(setValue.items);
	}

	@Override
	public SetValue add(Value other) {
		final SetValue setValue = checkCompatible(other);
		final TreeSet<String> union = new TreeSet<>(items);
		union.addAll(setValue.items);
		return new SetValue(union);
	}

	@Override
	public SetValue subtract(Value other) {
		final SetValue setValue = checkCompatible(other);
		checkContained(setValue);
		final TreeSet<String> difference = new TreeSet<>(items);
		difference.removeAll(setValue.items);
		return new SetValue(difference);
	}

	@Override
	public SetValue intersect(Value other) {
		final SetValue setValue = checkCompatible(other);
		final TreeSet<String> intersection = new TreeSet<>(items);
		intersection.retainAll(setValue.items);
		return new SetValue(intersection);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return items.equals(((SetValue) o).items);
	}

	@Override
	public int hashCode() {
		return items.hashCode();
	}

	@Override
	public String toString() {
		return "{" + String.join(",", items) + "}";
	}
}
