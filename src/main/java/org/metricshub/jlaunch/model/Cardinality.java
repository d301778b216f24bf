package org.metricshub.jlaunch.model;

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

import org.metricshub.jlaunch.schema.ArgAction;

/**
 * How many values an argument holds, and of which kind.
 */
public enum Cardinality {
	/** One text value. */
	SINGLE,
	/** An ordered list of text values. */
	MULTIPLE,
	/** A switch, either present or absent. */
	FLAG,
	/** A switch repeated a number of times. */
	COUNTER;

	/**
	 * @param action what the host parser does with the argument
	 * @return the cardinality of its value
	 */
	public static Cardinality of(ArgAction action) {
		switch (action) {
		case SET:
			return SINGLE;
		case APPEND:
			return MULTIPLE;
		case SET_TRUE:
		case SET_FALSE:
			return FLAG;
		case COUNT:
			return COUNTER;
		default:
			throw new IllegalArgumentException("Unsupported action: " + action);
		}
	}

	/**
	 * @return whether values of this cardinality are switches, written as their
	 *         invocation token alone
	 */
	public boolean isSwitch() {
		return this == FLAG || this == COUNTER;
	}
}
