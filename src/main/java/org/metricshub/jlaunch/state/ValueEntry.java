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

/**
 * One text value together with its synthetic identity.
 * <p>
 * The identity follows the entry when its text changes, so that a list
 * widget keeps track of the row being edited.
 */
public final class ValueEntry {

	private final String text;
	private final long identity;

	ValueEntry(String text, long identity) {
		this.text = text == null ? "" : text;
		this.identity = identity;
	}

	static ValueEntry create(String text) {
		return new ValueEntry(text, IdentityGenerator.next());
	}

	ValueEntry withText(String newText) {
		return new ValueEntry(newText, identity);
	}

	public String getText() {
		return text;
	}

	public long getIdentity() {
		return identity;
	}

	public boolean isEmpty() {
		return text.isEmpty();
	}

	@Override
	public String toString() {
		return text;
	}
}
