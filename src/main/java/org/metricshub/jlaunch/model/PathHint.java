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

import org.metricshub.jlaunch.schema.ValueHint;

/**
 * Which native picker the presentation layer may offer next to a text value.
 */
public enum PathHint {
	NONE,
	FILE,
	DIRECTORY,
	EITHER;

	/**
	 * @param hint the value hint declared by the host command line
	 * @return the matching picker
	 */
	public static PathHint of(ValueHint hint) {
		if (hint == null) {
			return NONE;
		}
		switch (hint) {
		case FILE_PATH:
		case EXECUTABLE_PATH:
			return FILE;
		case DIR_PATH:
			return DIRECTORY;
		case ANY_PATH:
			return EITHER;
		default:
			return NONE;
		}
	}

	public boolean allowsFile() {
		return this == FILE || this == EITHER;
	}

	public boolean allowsDirectory() {
		return this == DIRECTORY || this == EITHER;
	}
}
