package org.metricshub.jlaunch.state;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JLaunch
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import org.metricshub.jlaunch.model.Cardinality;

/**
 * Number of occurrences of a switch, never negative.
 */
public final class CounterValue extends ArgValue {

	private int count;

	CounterValue() {}

	public int getCount() {
		return count;
	}

	void increment() {
		if (count < Integer.MAX_VALUE) {
			count++;
		}
	}

	/**
	 * Decrements the counter; a counter at 0 stays at 0.
	 */
	void decrement() {
		if (count > 0) {
			count--;
		}
	}

	@Override
	public Cardinality getCardinality() {
		return Cardinality.COUNTER;
	}

	@Override
	public boolean isEmpty() {
		return count == 0;
	}

	@Override
	public <R> R accept(ArgValueVisitor<R> visitor) {
		return visitor.visitCounter(this);
	}

	@Override
	public String toString() {
		return Integer.toString(count);
	}
}
