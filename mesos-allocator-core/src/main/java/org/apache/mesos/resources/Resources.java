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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Immutable multi-dimensional resource vector. Every {@link Resource} is identified by its name
 * and role; quantities are never negative and empty quantities are dropped.
 *
 * <p>All operations return new instances.
 */
public final class Resources implements Iterable<Resource> {

	public static final String CPUS = "cpus";

	public static final String MEM = "mem";

	public static final String DISK = "disk";

	public static final String PORTS = "ports";

	private static final Resources EMPTY = new Resources(new TreeMap<>());

	private final TreeMap<Resource.Key, Resource> resources;

	private Resources(TreeMap<Resource.Key, Resource> resources) {
		this.resources = resources;
	}

	public static Resources empty() {
		return EMPTY;
	}

	public static Resources of(Resource... resources) {
		return of(Arrays.asList(resources));
	}

	public static Resources of(Collection<Resource> resources) {
		final TreeMap<Resource.Key, Resource> result = new TreeMap<>();
		for (Resource resource : resources) {
			internalAdd(result, resource);
		}
		return new Resources(result);
	}

	/**
	 * Parses resources from their textual form, e.g.
	 * {@code cpus:2;mem(prod):1024;ports:[31000-32000];disks:{sda,sdb}}.
	 *
	 * @param text to parse
	 * @return parsed resources
	 * @throws IllegalArgumentException if the text is malformed
	 */
	public static Resources parse(String text) {
		return parse(text, Resource.UNRESERVED_ROLE);
	}

	/**
	 * Parses resources from their textual form, assigning resources without an explicit role to
	 * the given default role.
	 */
	public static Resources parse(String text, String defaultRole) {
		Preconditions.checkNotNull(text);
		final List<Resource> parsed = new ArrayList<>();

		for (String token : text.split(";")) {
			if (token.trim().isEmpty()) {
				continue;
			}
			parsed.add(parseResource(token.trim(), defaultRole));
		}

		return of(parsed);
	}

	private static Resource parseResource(String token, String defaultRole) {
		final int separator = token.indexOf(':');
		if (separator <= 0 || separator == token.length() - 1) {
			throw new IllegalArgumentException("Bad resource '" + token + "': expected 'name:value'.");
		}

		String name = token.substring(0, separator).trim();
		String role = defaultRole;
		final int roleStart = name.indexOf('(');
		if (roleStart >= 0) {
			if (!name.endsWith(")") || roleStart == 0 || roleStart == name.length() - 2) {
				throw new IllegalArgumentException("Bad resource name '" + name + "' in '" + token + "'.");
			}
			role = name.substring(roleStart + 1, name.length() - 1).trim();
			name = name.substring(0, roleStart).trim();
		}

		return new Resource(name, role, parseValue(token.substring(separator + 1).trim(), token));
	}

	private static Value parseValue(String text, String token) {
		if (text.startsWith("[")) {
			if (!text.endsWith("]")) {
				throw new IllegalArgumentException("Unterminated ranges in '" + token + "'.");
			}
			final List<RangesValue.Range> ranges = new ArrayList<>();
			for (String range : splitItems(text)) {
				final String[] bounds = range.split("-");
				if (bounds.length != 2) {
					throw new IllegalArgumentException("Bad range '" + range + "' in '" + token + "'.");
				}
				try {
					ranges.add(new RangesValue.Range(Long.parseLong(bounds[0].trim()), Long.parseLong(bounds[1].trim())));
				} catch (IllegalArgumentException e) {
					throw new IllegalArgumentException("Bad range '" + range + "' in '" + token + "'.", e);
				}
			}
			return RangesValue.of(ranges);
		} else if (text.startsWith("{")) {
			if (!text.endsWith("}")) {
				throw new IllegalArgumentException("Unterminated set in '" + token + "'.");
			}
			return SetValue.of(splitItems(text));
		} else {
			try {
				return ScalarValue.of(Double.parseDouble(text));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Bad scalar value '" + text + "' in '" + token + "'.", e);
			}
		}
	}

	private static List<String> splitItems(String enclosed) {
		final String inner = enclosed.substring(1, enclosed.length() - 1);
		if (inner.trim().isEmpty()) {
			return Collections.emptyList();
		}
		return Arrays.stream(inner.split(",")).map(String::trim).collect(Collectors.toList());
	}

	// ---------------------------------------------------------------------------------------------
	// Arithmetic
	// ---------------------------------------------------------------------------------------------

	public Resources plus(Resources increment) {
		if (increment.isEmpty()) {
			return this;
		}
		final TreeMap<Resource.Key, Resource> result = new TreeMap<>(resources);
		for (Resource resource : increment) {
			internalAdd(result, resource);
		}
		return new Resources(result);
	}

	public Resources plus(Resource increment) {
		final TreeMap<Resource.Key, Resource> result = new TreeMap<>(resources);
		internalAdd(result, increment);
		return new Resources(result);
	}

	private static void internalAdd(Map<Resource.Key, Resource> target, Resource increment) {
		final Resource current = target.get(increment.getKey());
		final Resource updated = current == null
			? increment
			: current.withValue(current.getValue().add(increment.getValue()));

		updateNewValue(target, updated);
	}

	/**
	 * Subtracts the given resources, which must be contained in these resources.
	 *
	 * @param decrement resources to subtract
	 * @return remaining resources
	 * @throws IllegalArgumentException if the decrement is not contained in these resources
	 */
	public Resources minus(Resources decrement) {
		if (decrement.isEmpty()) {
			return this;
		}
		Preconditions.checkArgument(contains(decrement), "Cannot subtract %s from %s.", decrement, this);

		final TreeMap<Resource.Key, Resource> result = new TreeMap<>(resources);
		for (Resource resource : decrement) {
			final Resource current = result.get(resource.getKey());
			if (current != null) {
				updateNewValue(result, current.withValue(current.getValue().subtract(resource.getValue())));
			}
		}
		return new Resources(result);
	}

	private static void updateNewValue(Map<Resource.Key, Resource> target, Resource resource) {
		if (resource.getValue().isEmpty()) {
			target.remove(resource.getKey());
		} else {
			target.put(resource.getKey(), resource);
		}
	}

	/**
	 * Returns the resources which are part of both vectors: the smaller quantity of every scalar,
	 * the common ranges and the common set items.
	 */
	public Resources intersection(Resources other) {
		final TreeMap<Resource.Key, Resource> result = new TreeMap<>();
		for (Resource resource : other) {
			final Resource current = resources.get(resource.getKey());
			if (current != null && current.getType() == resource.getType()) {
				updateNewValue(result, current.withValue(current.getValue().intersect(resource.getValue())));
			}
		}
		return new Resources(result);
	}

	/**
	 * Checks whether every dimension of the given resources is contained in the corresponding
	 * dimension of these resources.
	 */
	public boolean contains(Resources other) {
		for (Resource resource : other) {
			final Resource current = resources.get(resource.getKey());
			if (current == null
				|| current.getType() != resource.getType()
				|| !current.getValue().contains(resource.getValue())) {
				return false;
			}
		}
		return true;
	}

	public boolean isEmpty() {
		return resources.isEmpty();
	}

	public int size() {
		return resources.size();
	}

	// ---------------------------------------------------------------------------------------------
	// Projections
	// ---------------------------------------------------------------------------------------------

	public Resources filter(Predicate<Resource> predicate) {
		final TreeMap<Resource.Key, Resource> result = new TreeMap<>();
		for (Resource resource : resources.values()) {
			if (predicate.test(resource)) {
				result.put(resource.getKey(), resource);
			}
		}
		return new Resources(result);
	}

	/**
	 * Returns the resources reserved to the given role.
	 */
	public Resources reserved(String role) {
		return filter(resource -> resource.getRole().equals(role));
	}

	public Resources unreserved() {
		return reserved(Resource.UNRESERVED_ROLE);
	}

	/**
	 * Returns the resources a framework of the given role may use: the unreserved resources plus
	 * the ones reserved to the role.
	 */
	public Resources allocatableTo(String role) {
		return filter(resource -> !resource.isReserved() || resource.getRole().equals(role));
	}

	/**
	 * Returns the sum of all scalar resources per name, regardless of their role.
	 */
	public Map<String, Double> scalarTotals() {
		final Map<String, Long> milliTotals = new LinkedHashMap<>();
		for (Resource resource : resources.values()) {
			if (resource.getType() == Value.Type.SCALAR) {
				milliTotals.merge(resource.getName(), ((ScalarValue) resource.getValue()).getMilliValue(), Long::sum);
			}
		}

		final Map<String, Double> totals = new LinkedHashMap<>();
		milliTotals.forEach((name, milliTotal) -> totals.put(name, milliTotal / (double) ScalarValue.SCALE));
		return totals;
	}

	public Optional<Double> getScalar(String name) {
		return Optional.ofNullable(scalarTotals().get(name));
	}

	public Optional<Double> cpus() {
		return getScalar(CPUS);
	}

	public Optional<Double> mem() {
		return getScalar(MEM);
	}

	public Optional<Double> disk() {
		return getScalar(DISK);
	}

	public Optional<RangesValue> ports() {
		RangesValue ports = null;
		for (Resource resource : resources.values()) {
			if (PORTS.equals(resource.getName()) && resource.getType() == Value.Type.RANGES) {
				final RangesValue value = (RangesValue) resource.getValue();
				ports = ports == null ? value : ports.add(value);
			}
		}
		return Optional.ofNullable(ports);
	}

	@Override
	public Iterator<Resource> iterator() {
		return Collections.unmodifiableCollection(resources.values()).iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return resources.equals(((Resources) o).resources);
	}

	@Override
	public int hashCode() {
		return resources.hashCode();
	}

	@Override
	public String toString() {
		if (resources.isEmpty()) {
			return "{}";
		}
		return resources.values().stream().map(Resource::toString).collect(Collectors.joining("; "));
	}
}
