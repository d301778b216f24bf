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

/**
 * Immutable snapshot of the lifecycle of a {@link ChildProcess}.
 * <p>
 * Transitions: {@code NOT_STARTED -> RUNNING -> EXITED | KILLED}, or
 * {@code NOT_STARTED -> SPAWN_FAILED} when the program cannot be started.
 */
public final class ProcessStatus {

	/**
	 * Lifecycle states.
	 */
	public enum State {
		NOT_STARTED,
		RUNNING,
		EXITED,
		KILLED,
		SPAWN_FAILED
	}

	private static final ProcessStatus NOT_STARTED = new ProcessStatus(State.NOT_STARTED, -1, -1, null);

	private final State state;
	private final long pid;
	private final int exitCode;
	private final Throwable error;

	private ProcessStatus(State state, long pid, int exitCode, Throwable error) {
		this.state = state;
		this.pid = pid;
		this.exitCode = exitCode;
		this.error = error;
	}

	static ProcessStatus notStarted() {
		return NOT_STARTED;
	}

	static ProcessStatus running(long pid) {
		return new ProcessStatus(State.RUNNING, pid, -1, null);
	}

	static ProcessStatus exited(long pid, int exitCode) {
		return new ProcessStatus(State.EXITED, pid, exitCode, null);
	}

	static ProcessStatus killed(long pid) {
		return new ProcessStatus(State.KILLED, pid, -1, null);
	}

	static ProcessStatus spawnFailed(Throwable error) {
		return new ProcessStatus(State.SPAWN_FAILED, -1, -1, error);
	}

	public State getState() {
		return state;
	}

	public boolean isRunning() {
		return state == State.RUNNING;
	}

	/**
	 * @return whether the process reached a terminal state: exited, killed, or never started because of an error
	 */
	public boolean isTerminated() {
		return state == State.EXITED || state == State.KILLED || state == State.SPAWN_FAILED;
	}

	/**
	 * @return the operating system identifier of the process, or {@code -1} if it never started
	 */
	public long getPid() {
		return pid;
	}

	/**
	 * @return the exit code of an {@link State#EXITED} process, {@code -1} otherwise
	 */
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * @return the cause of a {@link State#SPAWN_FAILED} status, {@code null} otherwise
	 */
	public Throwable getError() {
		return error;
	}

	@Override
	public String toString() {
		switch (state) {
		case EXITED:
			return "Exited(" + exitCode + ")";
		case SPAWN_FAILED:
			return "SpawnFailed(" + error + ")";
		default:
			return state.name();
		}
	}
}
