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

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.metricshub.jlaunch.assembly.ValidationException;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.metricshub.jlaunch.util.MessageId;
import org.slf4j.Logger;

/**
 * Handle of one external program run: its lifecycle status and the text it
 * writes on its standard output and error.
 * <p>
 * Both output streams are drained continuously by {@link DataPump} threads
 * into an {@link OutputBuffer}. The status is refreshed whenever it is read:
 * {@link #getStatus()} and {@link #isRunning()} never wait for the process.
 * A run ends when the program exits or when {@link #kill()} is called; there
 * is no timeout.
 */
public final class ChildProcess {

	private static final Logger LOG = JLaunchLogger.getLogger(ChildProcess.class);

	/**
	 * Default time given to a killed process to terminate before it is forced to.
	 */
	public static final long DEFAULT_KILL_TIMEOUT_MILLIS = 5000;

	private final ExecutionRequest request;
	private final long killTimeoutMillis;
	private final Set<String> hiddenVariables;
	private final OutputBuffer output = new OutputBuffer();

	private volatile ProcessStatus status = ProcessStatus.notStarted();
	private Process process;
	private boolean killRequested;
	private Thread stdoutPump;
	private Thread stderrPump;

	/**
	 * Creates the handle of a process that is not started yet.
	 *
	 * @param request what to run
	 */
	public ChildProcess(ExecutionRequest request) {
		this(request, DEFAULT_KILL_TIMEOUT_MILLIS, Collections.<String>emptySet());
	}

	/**
	 * @param request what to run
	 * @param killTimeoutMillis time given to a killed process to terminate before it is forced to
	 * @param hiddenVariables variables of the current environment that the child does not inherit
	 */
	ChildProcess(ExecutionRequest request, long killTimeoutMillis, Collection<String> hiddenVariables) {
		this.request = request;
		this.killTimeoutMillis = killTimeoutMillis;
		this.hiddenVariables = new LinkedHashSet<String>(hiddenVariables);
	}

	public ExecutionRequest getRequest() {
		return request;
	}

	/**
	 * @return the text written so far by the process, standard output and error mixed
	 */
	public OutputBuffer getOutput() {
		return output;
	}

	/**
	 * Starts the process.
	 *
	 * @throws ValidationException if an environment variable has an empty name;
	 *         nothing is started and the status remains {@code NOT_STARTED}
	 * @throws SpawnException if the operating system cannot start the process;
	 *         the status becomes {@code SPAWN_FAILED}
	 * @throws IllegalStateException if this handle was already started
	 */
	public synchronized void start() throws ValidationException, SpawnException {
		if (status.getState() != ProcessStatus.State.NOT_STARTED) {
			throw new IllegalStateException("Process already started: " + status);
		}
		for (EnvironmentVariable variable : request.getEnvironment()) {
			if (variable.getKey().isEmpty()) {
				throw new ValidationException(MessageId.ENV_KEY_EMPTY);
			}
		}

		String executable = request.getCommand().get(0);
		try {
			process = createProcessBuilder().start();
		} catch (IOException | RuntimeException e) {
			// the environment rejects names with '=' and NUL characters
			status = ProcessStatus.spawnFailed(e);
			LOG.warn("Cannot start {}: {}", executable, e.getMessage());
			throw new SpawnException("Cannot start " + executable + ": " + e.getMessage(), e, this);
		}
		status = ProcessStatus.running(process.pid());
		LOG.debug("Started {} (pid {})", request.getCommand(), Long.valueOf(process.pid()));

		String description = executable + "[" + process.pid() + "]";
		stdoutPump = DataPump.dump(description, "stdout", process.getInputStream(), output);
		stderrPump = DataPump.dump(description, "stderr", process.getErrorStream(), output);

		StdinSource stdin = request.getStdin();
		if (stdin == null) {
			// no input to this process!
			closeQuietly(process.getOutputStream(), description);
		} else if (stdin.getKind() == StdinSource.Kind.TEXT) {
			feed(process.getOutputStream(), stdin.getContent(), description);
		}
	}

	private ProcessBuilder createProcessBuilder() {
		ProcessBuilder builder = new ProcessBuilder(request.getCommand());
		Map<String, String> environment = builder.environment();
		for (String hidden : hiddenVariables) {
			environment.remove(hidden);
		}
		for (EnvironmentVariable variable : request.getEnvironment()) {
			environment.put(variable.getKey(), variable.getValue());
		}
		if (request.getWorkingDirectory() != null) {
			builder.directory(new File(request.getWorkingDirectory()));
		}
		StdinSource stdin = request.getStdin();
		if (stdin != null && stdin.getKind() == StdinSource.Kind.FILE) {
			builder.redirectInput(Redirect.from(new File(stdin.getContent())));
		}
		return builder;
	}

	/**
	 * Writes the inline text on its own thread, so that a process that reads
	 * its input slowly never blocks the caller.
	 */
	private static void feed(final OutputStream in, final String text, final String description) {
		Thread feeder = new Thread(new Runnable() {
			@Override
			public void run() {
				try {
					in.write(text.getBytes(StandardCharsets.UTF_8));
					in.flush();
				} catch (IOException e) {
					LOG.warn("Cannot write the standard input of {}: {}", description, e.getMessage());
				} finally {
					closeQuietly(in, description);
				}
			}
		}, "StdinFeeder-" + description);
		feeder.setDaemon(true);
		feeder.start();
	}

	private static void closeQuietly(OutputStream in, String description) {
		try {
			in.close();
		} catch (IOException e) {
			LOG.debug("Cannot close the standard input of {}", description, e);
		}
	}

	/**
	 * Returns the current status, noticing that the process exited if it did.
	 *
	 * @return the status
	 */
	public ProcessStatus getStatus() {
		refresh();
		return status;
	}

	/**
	 * @return whether the process is still running
	 */
	public boolean isRunning() {
		return getStatus().isRunning();
	}

	private synchronized void refresh() {
		if (status.getState() == ProcessStatus.State.RUNNING && !process.isAlive()) {
			if (killRequested) {
				status = ProcessStatus.killed(process.pid());
				LOG.debug("Process {} killed", Long.valueOf(process.pid()));
			} else {
				status = ProcessStatus.exited(process.pid(), process.exitValue());
				LOG.debug("Process {} exited with code {}", Long.valueOf(process.pid()), Integer.valueOf(process.exitValue()));
			}
		}
	}

	/**
	 * Asks the process and its descendants to terminate, and returns without
	 * waiting. Those still alive after the kill timeout are terminated
	 * forcibly. Calling this method again while the process is still running
	 * forces the termination at once. Calling it on a process that is not
	 * running does nothing.
	 * <p>
	 * The status becomes {@code KILLED} once the process has terminated.
	 */
	public void kill() {
		final Process target;
		final List<ProcessHandle> descendants;
		boolean force;
		synchronized (this) {
			refresh();
			if (status.getState() != ProcessStatus.State.RUNNING) {
				return;
			}
			force = killRequested;
			killRequested = true;
			target = process;
			descendants = target.descendants().collect(Collectors.<ProcessHandle>toList());
		}

		if (force) {
			forceTermination(target, descendants);
			return;
		}

		LOG.debug("Killing process {}", Long.valueOf(target.pid()));
		for (ProcessHandle descendant : descendants) {
			descendant.destroy();
		}
		target.destroy();
		CompletableFuture.delayedExecutor(killTimeoutMillis, TimeUnit.MILLISECONDS).execute(new Runnable() {
			@Override
			public void run() {
				if (target.isAlive() || anyAlive(descendants)) {
					forceTermination(target, descendants);
				}
			}
		});
	}

	private static void forceTermination(Process target, List<ProcessHandle> descendants) {
		LOG.debug("Forcing termination of process {}", Long.valueOf(target.pid()));
		List<ProcessHandle> all = new ArrayList<ProcessHandle>(descendants);
		if (target.isAlive()) {
			target.descendants().forEach(all::add);
		}
		for (ProcessHandle descendant : all) {
			descendant.destroyForcibly();
		}
		target.destroyForcibly();
	}

	private static boolean anyAlive(List<ProcessHandle> handles) {
		for (ProcessHandle handle : handles) {
			if (handle.isAlive()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Waits until the process terminates and all its output has been read.
	 *
	 * @param timeout maximum time to wait
	 * @param unit unit of the timeout
	 * @return {@code true} if the process terminated and its output was fully
	 *         read, {@code false} if the timeout elapsed first
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 */
	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		Process target;
		Thread[] pumps;
		synchronized (this) {
			if (process == null) {
				return status.isTerminated();
			}
			target = process;
			pumps = new Thread[] { stdoutPump, stderrPump };
		}
		long deadline = System.nanoTime() + unit.toNanos(timeout);
		if (!target.waitFor(timeout, unit)) {
			return false;
		}
		for (Thread pump : pumps) {
			long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
			if (remaining <= 0) {
				return false;
			}
			pump.join(remaining);
			if (pump.isAlive()) {
				return false;
			}
		}
		refresh();
		return true;
	}

	@Override
	public String toString() {
		return "ChildProcess" + request.getCommand() + " " + status;
	}
}
