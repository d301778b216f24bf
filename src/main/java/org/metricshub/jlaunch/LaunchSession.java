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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.jlaunch.assembly.ArgumentAssembler;
import org.metricshub.jlaunch.assembly.ArgumentValidator;
import org.metricshub.jlaunch.assembly.ValidationException;
import org.metricshub.jlaunch.model.CommandModel;
import org.metricshub.jlaunch.process.ChildProcess;
import org.metricshub.jlaunch.process.ChildProcessSupervisor;
import org.metricshub.jlaunch.process.EnvironmentVariable;
import org.metricshub.jlaunch.process.ExecutionRequest;
import org.metricshub.jlaunch.process.OutputBuffer;
import org.metricshub.jlaunch.process.SpawnException;
import org.metricshub.jlaunch.process.StdinSource;
import org.metricshub.jlaunch.schema.CommandDefinition;
import org.metricshub.jlaunch.state.CommandState;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.metricshub.jlaunch.util.LaunchSettings;
import org.metricshub.jlaunch.util.Localization;
import org.metricshub.jlaunch.util.MessageId;
import org.slf4j.Logger;

/**
 * The editable command line of a program, and the last run of this program.
 * <p>
 * A run attempt ({@link #run()}) assembles the arguments, checks them,
 * rejects empty environment variable names, then starts the program. When a
 * check fails, nothing is started: the error is painted on the argument
 * concerned and reported as the {@linkplain #getNotice() notice}.
 * <p>
 * Only the last started process is tracked. Starting a new run does not kill
 * the previous one; the presentation layer decides whether to allow it.
 * <p>
 * This class is not thread-safe: it is driven by the controlling thread of the
 * presentation layer.
 */
public class LaunchSession {

	private static final Logger LOG = JLaunchLogger.getLogger(LaunchSession.class);

	private final CommandState state;
	private final List<String> launchCommand;
	private final List<EnvironmentVariable> launchEnvironment;
	private final LaunchSettings settings;
	private final Localization localization;
	private final ChildProcessSupervisor supervisor;
	private final ArgumentValidator validator;

	private final List<EnvironmentVariable> environment = new ArrayList<EnvironmentVariable>();
	private StdinSource stdin = StdinSource.text("");
	private String workingDirectory = "";

	private ChildProcess child;
	private Exception lastError;
	private String notice;

	private LaunchSession(Builder builder) {
		this.state = new CommandState(builder.model);
		this.launchCommand = Collections.unmodifiableList(new ArrayList<String>(builder.launchCommand));
		this.launchEnvironment = Collections.unmodifiableList(new ArrayList<EnvironmentVariable>(builder.launchEnvironment));
		this.settings = builder.settings;
		this.localization = builder.localization != null ? builder.localization : new Localization(settings.getLocale());
		this.supervisor = builder.supervisor != null ?
				builder.supervisor :
				new ChildProcessSupervisor(settings.getKillTimeoutMillis(), Collections.<String>emptySet());
		this.validator = builder.validator;
	}

	/**
	 * Starts the creation of a session.
	 *
	 * @param definition the command line of the program
	 * @param launchCommand the executable of the program, possibly followed by
	 *        fixed arguments written before the edited ones
	 * @return a new builder
	 */
	public static Builder builder(CommandDefinition definition, List<String> launchCommand) {
		return new Builder(CommandModel.from(definition), launchCommand);
	}

	/**
	 * @param definition the command line of the program
	 * @param launchCommand the executable of the program, possibly followed by fixed arguments
	 * @return a new builder
	 */
	public static Builder builder(CommandDefinition definition, String... launchCommand) {
		return builder(definition, Arrays.asList(launchCommand));
	}

	/**
	 * @return the argument tree, which the presentation layer renders and edits
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The argument tree is edited in place by the presentation layer.")
	public CommandState getState() {
		return state;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Settings are shared with the host application.")
	public LaunchSettings getSettings() {
		return settings;
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Presenters may override entries of the shared lookup table.")
	public Localization getLocalization() {
		return localization;
	}

	/**
	 * @return the executable and fixed arguments written before the edited ones
	 */
	public List<String> getLaunchCommand() {
		return launchCommand;
	}

	// Environment

	/**
	 * @return the environment variables defined by the user, in order
	 */
	public List<EnvironmentVariable> getEnvironment() {
		return Collections.unmodifiableList(environment);
	}

	/**
	 * Appends an environment variable, with an empty name and value.
	 */
	public void addEnvironmentVariable() {
		environment.add(new EnvironmentVariable("", ""));
	}

	public void setEnvironmentVariable(int index, String key, String value) {
		environment.set(index, new EnvironmentVariable(key, value));
	}

	public void removeEnvironmentVariable(int index) {
		environment.remove(index);
	}

	// Standard input

	/**
	 * @return the standard input defined by the user, inline text by default
	 */
	public StdinSource getStdin() {
		return stdin;
	}

	public void setStdin(StdinSource stdin) {
		this.stdin = Objects.requireNonNull(stdin, "stdin must not be null");
	}

	// Working directory

	public String getWorkingDirectory() {
		return workingDirectory;
	}

	/**
	 * @param workingDirectory the working directory, empty to inherit the current one
	 */
	public void setWorkingDirectory(String workingDirectory) {
		this.workingDirectory = workingDirectory == null ? "" : workingDirectory;
	}

	// Runs

	/**
	 * Assembles the arguments and starts the program.
	 *
	 * @return the started process, or {@code null} if the attempt was refused or
	 *         the program could not be started; see {@link #getNotice()}
	 */
	public ChildProcess run() {
		state.clearValidationErrors();
		lastError = null;
		notice = null;

		List<String> args;
		try {
			args = ArgumentAssembler.assemble(state);
			if (validator != null) {
				validator.validate(args);
			}
			if (settings.isEnableEnvironment()) {
				checkEnvironment();
			}
		} catch (ValidationException e) {
			report(e);
			return null;
		}

		ExecutionRequest request = createRequest(args);
		try {
			child = supervisor.spawn(request);
			LOG.debug("Running {}", request.getCommand());
			return child;
		} catch (ValidationException e) {
			report(e);
			return null;
		} catch (SpawnException e) {
			child = e.getProcess();
			lastError = e;
			Throwable cause = e.getCause() != null ? e.getCause() : e;
			notice = localization.format(MessageId.SPAWN_FAILED, request.getCommand().get(0), String.valueOf(cause.getMessage()));
			return null;
		}
	}

	private void checkEnvironment() throws ValidationException {
		for (EnvironmentVariable variable : environment) {
			if (variable.getKey().isEmpty()) {
				throw new ValidationException(MessageId.ENV_KEY_EMPTY);
			}
		}
	}

	private ExecutionRequest createRequest(List<String> args) {
		List<String> command = new ArrayList<String>(launchCommand);
		command.addAll(args);
		ExecutionRequest.Builder request = ExecutionRequest.builder(command).environment(launchEnvironment);
		if (settings.isEnableEnvironment()) {
			request.environment(environment);
		}
		if (settings.isEnableStdin()) {
			request.stdin(stdin);
		}
		if (settings.isEnableWorkingDirectory()) {
			request.workingDirectory(workingDirectory);
		}
		return request.build();
	}

	private void report(ValidationException e) {
		lastError = e;
		notice = e.getLocalizedMessage(localization);
		LOG.debug("Run refused: {}", e.getMessage());
		if (e.getArgumentId() == null) {
			return;
		}
		CommandState node;
		try {
			node = state.findNode(e.getCommandPath());
		} catch (IllegalArgumentException ex) {
			node = state;
		}
		if (!node.applyValidationError(e.getArgumentId(), notice)) {
			LOG.debug("No argument '{}' to show the error on", e.getArgumentId());
		}
	}

	/**
	 * Kills the tracked process, if it is running.
	 */
	public void kill() {
		if (child != null) {
			child.kill();
		}
	}

	/**
	 * @return whether the tracked process is running
	 */
	public boolean isRunning() {
		return child != null && child.isRunning();
	}

	/**
	 * @return the last process started (or that failed to start), or {@code null}
	 */
	public ChildProcess getChild() {
		return child;
	}

	/**
	 * @return the output of the tracked process, or {@code null} if none
	 */
	public OutputBuffer getOutput() {
		return child == null ? null : child.getOutput();
	}

	/**
	 * @return the error of the last run attempt, or {@code null} if it succeeded
	 */
	public Exception getLastError() {
		return lastError;
	}

	/**
	 * @return the localized message of the last run attempt error, or {@code null}
	 */
	public String getNotice() {
		return notice;
	}

	/**
	 * Builder of {@link LaunchSession}.
	 */
	public static final class Builder {

		private final CommandModel model;
		private final List<String> launchCommand;
		private final List<EnvironmentVariable> launchEnvironment = new ArrayList<EnvironmentVariable>();
		private LaunchSettings settings = new LaunchSettings();
		private Localization localization;
		private ChildProcessSupervisor supervisor;
		private ArgumentValidator validator;

		private Builder(CommandModel model, List<String> launchCommand) {
			this.model = model;
			Objects.requireNonNull(launchCommand, "launchCommand must not be null");
			if (launchCommand.isEmpty()) {
				throw new IllegalArgumentException("launchCommand must at least contain the executable");
			}
			this.launchCommand = new ArrayList<String>(launchCommand);
		}

		public Builder settings(LaunchSettings settings) {
			this.settings = Objects.requireNonNull(settings, "settings must not be null");
			return this;
		}

		/**
		 * @param localization the lookup table of user-facing text; by default the bundled one for the settings locale
		 * @return this builder
		 */
		public Builder localization(Localization localization) {
			this.localization = localization;
			return this;
		}

		public Builder supervisor(ChildProcessSupervisor supervisor) {
			this.supervisor = supervisor;
			return this;
		}

		/**
		 * @param validator checks the assembled arguments before each run, or {@code null}
		 * @return this builder
		 */
		public Builder validator(ArgumentValidator validator) {
			this.validator = validator;
			return this;
		}

		/**
		 * Sets a variable in the environment of every run, regardless of the
		 * variables defined by the user.
		 *
		 * @param key name of the variable
		 * @param value value of the variable
		 * @return this builder
		 */
		public Builder launchEnvironment(String key, String value) {
			launchEnvironment.add(new EnvironmentVariable(key, value));
			return this;
		}

		public LaunchSession build() {
			return new LaunchSession(this);
		}
	}
}
