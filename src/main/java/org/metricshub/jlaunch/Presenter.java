package org.metricshub.jlaunch;

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
 * The presentation layer of a launch session: renders the arguments, lets the
 * user edit them, runs and kills the program, and shows its output.
 * <p>
 * Implementations drive the session from a single thread. They read the
 * argument tree through {@link LaunchSession#getState()}, poll
 * {@link LaunchSession#getChild()} on every redraw, and look user-facing text
 * up in {@link LaunchSession#getLocalization()}.
 */
public interface Presenter {

	/**
	 * Runs the interactive session until the user closes it.
	 *
	 * @param session the session to present
	 * @return the exit code of the host application
	 * @throws Exception if the presentation fails
	 */
	int present(LaunchSession session) throws Exception;
}
