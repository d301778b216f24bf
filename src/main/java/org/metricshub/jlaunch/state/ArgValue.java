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
 * Current value of one argument. There is exactly one subclass per
 * {@link Cardinality}, and operations that depend on the kind of value go
 * through {@link #accept(ArgValueVisitor)}.
 */
public abstract class ArgValue {

	ArgValue() {}

	/**
	 * Creates the empty value of the specified cardinality: empty text, empty
	 * list, {@code false} or {@code 0}.
	 *
	 * @param cardinality kind of value
	 * @return a new empty value
	 */
	public static ArgValue empty(Cardinality cardinality) {
		switch (cardinality) {
		case SINGLE:
			return new SingleValue();
		case MULTIPLE:
			return new MultipleValue();
		case FLAG:
			return new FlagValue();
		case COUNTER:
			return new CounterValue();
		default:
			throw new IllegalArgumentException("Unsupported cardinality: " + cardinality);
		}
	}

	/**
	 * @return the cardinality this value implements
	 */
	public abstract Cardinality getCardinality();

	/**
	 * @return whether the value would write nothing on the command line
	 */
	public abstract boolean isEmpty();

	/**
	 * Dispatches to the visitor method of this kind of value.
	 *
	 * @param <R> result type
	 * @param visitor the operation
	 * @return the result of the operation
	 */
	public abstract <R> R accept(ArgValueVisitor<R> visitor);
}
