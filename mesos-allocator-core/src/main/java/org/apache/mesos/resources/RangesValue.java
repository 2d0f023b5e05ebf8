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
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Set of inclusive integer ranges, e.g. the ports of a slave. The ranges are kept sorted and
 * coalesced, so two values describing the same numbers are equal.
 */
public final class RangesValue extends Value {

	public static final RangesValue EMPTY = new RangesValue(Collections.emptyList());

	private final List<Range> ranges;

	private RangesValue(List<Range> coalescedRanges) {
		this.ranges = Collections.unmodifiableList(coalescedRanges);
	}

	public static RangesValue of(Range... ranges) {
		return of(Arrays.asList(ranges));
	}

	public static RangesValue of(Collection<Range> ranges) {
		return new RangesValue(coalesce(ranges));
	}

	public List<Range> getRanges() {
		return ranges;
	}

	/**
	 * Returns the number of integers covered by the ranges.
	 */
	public long size() {
		long size = 0L;
		for (Range range : ranges) {
			size += range.size();
		}
		return size;
	}

	@Override
	public Type getType() {
		return Type.RANGES;
	}

	@Override
	public boolean isEmpty() {
		return ranges.isEmpty();
	}

	@Override
	public boolean contains(Value other) {
		final RangesValue rangesValue = checkCompatible(other);

		for (Range range : rangesValue.ranges) {
			if (!covers(range)) {
				return false;
			}
		}

		return true;
	}

	private boolean covers(Range range) {
		for (Range candidate : ranges) {
			if (candidate.getBegin() <= range.getBegin() && candidate.getEnd() >= range.getEnd()) {
				return true;
			}
		}
		return false;
	}

	@Override
	public RangesValue add(Value other) {
		final RangesValue rangesValue = checkCompatible(other);
		final List<Range> union = new ArrayList<>(ranges);
		union.addAll(rangesValue.ranges);
		return of(union);
	}

	@Override
	public RangesValue subtract(Value other) {
		final RangesValue rangesValue = checkCompatible(other);
		checkContained(rangesValue);

		List<Range> remaining = new ArrayList<>(ranges);
		for (Range toRemove : rangesValue.ranges) {
			final List<Range> next = new ArrayList<>(remaining.size() + 1);
			for (Range range : remaining) {
				if (range.getEnd() < toRemove.getBegin() || range.getBegin() > toRemove.getEnd()) {
					next.add(range);
					continue;
				}
				if (range.getBegin() < toRemove.getBegin()) {
					next.add(new Range(range.getBegin(), toRemove.getBegin() - 1));
				}
				if (range.getEnd() > toRemove.getEnd()) {
					next.add(new Range(toRemove.getEnd() + 1, range.getEnd()));
				}
			}
			remaining = next;
		}

		return of(remaining);
	}

	@Override
	public RangesValue intersect(Value other) {
		final RangesValue rangesValue = checkCompatible(other);
		final List<Range> intersection = new ArrayList<>();

		for (Range left : ranges) {
			for (Range right : rangesValue.ranges) {
				final long begin = Math.max(left.getBegin(), right.getBegin());
				final long end = Math.min(left.getEnd(), right.getEnd());
				if (begin <= end) {
					intersection.add(new Range(begin, end));
				}
			}
		}

		return of(intersection);
	}

	private static List<Range> coalesce(Collection<Range> ranges) {
		final List<Range> sorted = new ArrayList<>(ranges);
		sorted.sort(Comparator.comparingLong(Range::getBegin).thenComparingLong(Range::getEnd));

		final List<Range> coalesced = new ArrayList<>(sorted.size());
		Range current = null;

		for (Range range : sorted) {
			if (current == null) {
				current = range;
			} else if (range.getBegin() <= current.getEnd() + 1) {
				current = new Range(current.getBegin(), Math.max(current.getEnd(), range.getEnd()));
			} else {
				coalesced.add(current);
				current = range;
			}
		}

		if (current != null) {
			coalesced.add(current);
		}

		return coalesced;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return ranges.equals(((RangesValue) o).ranges);
	}

	@Override
	public int hashCode() {
		return ranges.hashCode();
	}

	@Override
	public String toString() {
		return ranges.stream().map(Range::toString).collect(Collectors.joining(", ", "[", "]"));
	}

	/**
	 * Inclusive range of non-negative integers.
	 */
	public static final class Range {

		private final long begin;

		private final long end;

		public Range(long begin, long end) {
			Preconditions.checkArgument(begin >= 0L, "Range begin must not be negative.");
			Preconditions.checkArgument(begin <= end, "Range begin %s must not be larger than its end %s.", begin, end);
			this.begin = begin;
			this.end = end;
		}

		public long getBegin() {
			return begin;
		}

		public long getEnd() {
			return end;
		}

		public long size() {
			return end - begin + 1;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (o == null || getClass() != o.getClass()) {
				return false;
			}
			final Range range = (Range) o;
			return begin == range.begin && end == range.end;
		}

		@Override
		public int hashCode() {
			return 31 * Long.hashCode(begin) + Long.hashCode(end);
		}

		@Override
		public String toString() {
			return begin + "-" + end;
		}
	}
}
