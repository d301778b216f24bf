package org.metricshub.jlaunch.process;

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.metricshub.jlaunch.assembly.ValidationException;

/**
 * Starts child processes.
 * <p>
 * Every child inherits the environment of the current process, except the
 * hidden variables given at construction, with the variables of its request
 * set on top of it.
 */
public class ChildProcessSupervisor {

	private final long killTimeoutMillis;
	private final Set<String> hiddenVariables;

	/**
	 * Creates a supervisor with the default kill timeout that hides no variable.
	 */
	public ChildProcessSupervisor() {
		this(ChildProcess.DEFAULT_KILL_TIMEOUT_MILLIS, Collections.<String>emptySet());
	}

	/**
	 * @param killTimeoutMillis time given to a killed process to terminate before it is forced to
	 * @param hiddenVariables variables of the current environment that children do not inherit
	 */
	public ChildProcessSupervisor(long killTimeoutMillis, Collection<String> hiddenVariables) {
		if (killTimeoutMillis < 0) {
			throw new IllegalArgumentException("Kill timeout must not be negative: " + killTimeoutMillis);
		}
		this.killTimeoutMillis = killTimeoutMillis;
		this.hiddenVariables = Collections.unmodifiableSet(new LinkedHashSet<String>(hiddenVariables));
	}

	public long getKillTimeoutMillis() {
		return killTimeoutMillis;
	}

	public Set<String> getHiddenVariables() {
		return hiddenVariables;
	}

	/**
	 * Creates the handle of a process without starting it.
	 *
	 * @param request what to run
	 * @return the handle, in the {@code NOT_STARTED} state
	 */
	public ChildProcess create(ExecutionRequest request) {
		return new ChildProcess(request, killTimeoutMillis, hiddenVariables);
	}

	/**
	 * Starts a process.
	 *
	 * @param request what to run
	 * @return the handle of the running process
	 * @throws ValidationException if an environment variable has an empty name
	 * @throws SpawnException if the operating system cannot start the process
	 */
	public ChildProcess spawn(ExecutionRequest request) throws ValidationException, SpawnException {
		ChildProcess child = create(request);
		child.start();
		return child;
	}
}
