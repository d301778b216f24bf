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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything needed to start one child process: the command (executable first,
 * then its arguments), the environment variables to set, the standard input
 * and the working directory.
 */
public final class ExecutionRequest {

	private final List<String> command;
	private final List<EnvironmentVariable> environment;
	private final StdinSource stdin;
	private final String workingDirectory;

	private ExecutionRequest(Builder builder) {
		this.command = Collections.unmodifiableList(new ArrayList<String>(builder.command));
		this.environment = Collections.unmodifiableList(new ArrayList<EnvironmentVariable>(builder.environment));
		this.stdin = builder.stdin;
		this.workingDirectory = builder.workingDirectory;
	}

	/**
	 * @param command the executable followed by its arguments
	 * @return a new builder
	 */
	public static Builder builder(List<String> command) {
		return new Builder(command);
	}

	/**
	 * @param command the executable followed by its arguments
	 * @return a new builder
	 */
	public static Builder builder(String... command) {
		return new Builder(Arrays.asList(command));
	}

	/**
	 * @return the executable followed by its arguments
	 */
	public List<String> getCommand() {
		return command;
	}

	/**
	 * @return the variables to set, in order: a later one wins over an earlier one with the same key
	 */
	public List<EnvironmentVariable> getEnvironment() {
		return environment;
	}

	/**
	 * @return the standard input, or {@code null} for an empty, closed input
	 */
	public StdinSource getStdin() {
		return stdin;
	}

	/**
	 * @return the working directory, or {@code null} to inherit the current one
	 */
	public String getWorkingDirectory() {
		return workingDirectory;
	}

	@Override
	public String toString() {
		return "ExecutionRequest" + command;
	}

	/**
	 * Builder of {@link ExecutionRequest}.
	 */
	public static final class Builder {

		private final List<String> command;
		private final List<EnvironmentVariable> environment = new ArrayList<EnvironmentVariable>();
		private StdinSource stdin;
		private String workingDirectory;

		private Builder(List<String> command) {
			Objects.requireNonNull(command, "command must not be null");
			if (command.isEmpty()) {
				throw new IllegalArgumentException("command must at least contain the executable");
			}
			this.command = new ArrayList<String>(command);
		}

		public Builder environment(String key, String value) {
			environment.add(new EnvironmentVariable(key, value));
			return this;
		}

		public Builder environment(List<EnvironmentVariable> variables) {
			environment.addAll(variables);
			return this;
		}

		public Builder stdin(StdinSource stdin) {
			this.stdin = stdin;
			return this;
		}

		/**
		 * @param workingDirectory the working directory; {@code null} or blank to inherit the current one
		 * @return this builder
		 */
		public Builder workingDirectory(String workingDirectory) {
			this.workingDirectory = workingDirectory == null || workingDirectory.trim().isEmpty() ? null : workingDirectory;
			return this;
		}

		public ExecutionRequest build() {
			return new ExecutionRequest(this);
		}
	}
}
