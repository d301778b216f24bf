package org.metricshub.jlaunch.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for every SLF4J logger of JLaunch.
 * <p>
 * Loading this class lowers SLF4J's internal verbosity, so that a host
 * application without a binding does not get SLF4J's own start-up notices
 * mixed with the output of the child process it launches.
 */
public final class JLaunchLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private JLaunchLogger() {
		// utility class
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Returns a logger nested under the logger of the specified class, e.g.
	 * {@code org.metricshub.jlaunch.process.DataPump.stderr}, so that each
	 * output channel of a child process can be tuned separately.
	 *
	 * @param clazz Class owning the logger
	 * @param channel Name of the sub-logger
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz, String channel) {
		if (channel == null || channel.isEmpty()) {
			return getLogger(clazz);
		}
		return LoggerFactory.getLogger(clazz.getName() + "." + channel);
	}
}
