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

import java.io.IOException;

/**
 * The operating system refused to start a child process: executable not found,
 * permission denied, unreadable standard input file...
 * <p>
 * The {@link ChildProcess} concerned is left in the
 * {@link ProcessStatus.State#SPAWN_FAILED} state.
 */
public class SpawnException extends IOException {

	private static final long serialVersionUID = 1L;

	private final transient ChildProcess process;

	/**
	 * @param message description of the failure
	 * @param cause the error reported by the operating system
	 * @param process the process that could not be started
	 */
	public SpawnException(String message, Throwable cause, ChildProcess process) {
		super(message, cause);
		this.process = process;
	}

	/**
	 * @return the process that could not be started
	 */
	public ChildProcess getProcess() {
		return process;
	}
}
