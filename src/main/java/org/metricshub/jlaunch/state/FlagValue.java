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
 * A switch, either set or not.
 */
public final class FlagValue extends ArgValue {

	private boolean set;

	FlagValue() {}

	public boolean isSet() {
		return set;
	}

	void setSet(boolean set) {
		this.set = set;
	}

	void toggle() {
		set = !set;
	}

	@Override
	public Cardinality getCardinality() {
		return Cardinality.FLAG;
	}

	@Override
	public boolean isEmpty() {
		return !set;
	}

	@Override
	public <R> R accept(ArgValueVisitor<R> visitor) {
		return visitor.visitFlag(this);
	}

	@Override
	public String toString() {
		return Boolean.toString(set);
	}
}
