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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scalar resource value such as cpus or mem.
 *
 * <p>The quantity is kept in fixed point with three decimal digits, so that repeated additions
 * and subtractions are exact.
 */
public final class ScalarValue extends Value {

	static final int SCALE = 1000;

	public static final ScalarValue ZERO = new ScalarValue(0L);

	/** Quantity in thousandths. */
	private final long milliValue;

	private ScalarValue(long milliValue) {
		Preconditions.checkArgument(milliValue >= 0L, "Scalar values must not be negative.");
		this.milliValue = milliValue;
	}

	public static ScalarValue of(double value) {
		Preconditions.checkArgument(!Double.isNaN(value) && !Double.isInfinite(value), "Invalid scalar value %s.", value);
		final long milliValue;
		try {
			milliValue = BigDecimal.valueOf(value).movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
		} catch (ArithmeticException e) {
			throw new IllegalArgumentException("Scalar value " + value + " is out of range.", e);
		}
		return new ScalarValue(milliValue);
	}

	static ScalarValue ofMillis(long milliValue) {
		return milliValue == 0L ? ZERO : new ScalarValue(milliValue);
	}

	public double getValue() {
		return milliValue / (double) SCALE;
	}

	long getMilliValue() {
		return milliValue;
	}

	@Override
	public Type getType() {
		return Type.SCALAR;
	}

	@Override
	public boolean isEmpty() {
		return milliValue == 0L;
	}

	@Override
	public boolean contains(Value other) {
		final ScalarValue scalar = checkCompatible(other);
		return milliValue >= scalar.milliValue;
	}

	@Override
	public ScalarValue add(Value other) {
		final ScalarValue scalar = checkCompatible(other);
		return ofMillis(Math.addExact(milliValue, scalar.milliValue));
	}

	@Override
	public ScalarValue subtract(Value other) {
		final ScalarValue scalar = checkCompatible(other);
		checkContained(scalar);
		return ofMillis(milliValue - scalar.milliValue);
	}

	@Override
	public ScalarValue intersect(Value other) {
		final ScalarValue scalar = checkCompatible(other);
		return ofMillis(Math.min(milliValue, scalar.milliValue));
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return milliValue == ((ScalarValue) o).milliValue;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(milliValue);
	}

	@Override
	public String toString() {
		return BigDecimal.valueOf(milliValue, 3).stripTrailingZeros().toPlainString();
	}
}
