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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.jlaunch.assembly.PicocliArgumentValidator;
import org.metricshub.jlaunch.process.ChildProcessSupervisor;
import org.metricshub.jlaunch.schema.PicocliCommandReader;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.metricshub.jlaunch.util.LaunchSettings;
import org.slf4j.Logger;
import picocli.CommandLine;

/**
 * Entry point of a host application that wraps its own picocli command with
 * an interactive launcher.
 * <p>
 * The host calls {@link #run(CommandLine, LaunchSettings, Presenter, String[])}
 * from its {@code main} method. The first invocation opens the presenter; each
 * run started from the presenter re-executes the same {@code main} class in a
 * new JVM, which detects {@value #CHILD_APP_ENV_VAR} and goes straight to the
 * command's own execution.
 *
 * <pre>
 * public static void main(String[] args) throws Exception {
 *     System.exit(JLaunch.run(new CommandLine(new MyCommand()), new LaunchSettings(), new MyPresenter(), args));
 * }
 * </pre>
 */
public final class JLaunch {

	/**
	 * Marker set in the environment of the re-executed host application.
	 */
	public static final String CHILD_APP_ENV_VAR = "JLAUNCH_CHILD_APP";

	private static final Logger LOG = JLaunchLogger.getLogger(JLaunch.class);

	private JLaunch() {
		// utility class
	}

	/**
	 * Runs the host application, as the interactive launcher or as the
	 * launched child. The main class re-executed for each run is the class
	 * calling this method.
	 *
	 * @param commandLine the command of the host application
	 * @param settings the launcher settings
	 * @param presenter the presentation layer
	 * @param args the arguments of the current invocation
	 * @return the exit code of the host application
	 * @throws Exception if the presenter fails
	 */
	public static int run(CommandLine commandLine, LaunchSettings settings, Presenter presenter, String[] args)
		throws Exception {
		Class<?> mainClass = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE).getCallerClass();
		return run(commandLine, settings, presenter, mainClass, args);
	}

	/**
	 * Runs the host application, as the interactive launcher or as the
	 * launched child.
	 *
	 * @param commandLine the command of the host application
	 * @param settings the launcher settings
	 * @param presenter the presentation layer
	 * @param mainClass the class whose {@code main} method calls this one
	 * @param args the arguments of the current invocation
	 * @return the exit code of the host application
	 * @throws Exception if the presenter fails
	 */
	public static int run(
		CommandLine commandLine,
		LaunchSettings settings,
		Presenter presenter,
		Class<?> mainClass,
		String[] args
	) throws Exception {
		if (isChildProcess(System.getenv())) {
			return commandLine.execute(args);
		}
		LaunchSession session = createSession(commandLine, settings, selfCommand(mainClass));
		LOG.debug("Presenting {}", commandLine.getCommandName());
		return presenter.present(session);
	}

	/**
	 * @param environment the environment of the current process
	 * @return whether the current process was started by a launch session
	 */
	static boolean isChildProcess(Map<String, String> environment) {
		return environment.get(CHILD_APP_ENV_VAR) != null;
	}

	/**
	 * Creates the session launching the specified command. Every run gets the
	 * {@value #CHILD_APP_ENV_VAR} marker, and is validated by the command's
	 * own parser before being started.
	 *
	 * @param commandLine the command of the host application
	 * @param settings the launcher settings
	 * @param launchCommand the executable re-entering the host application, with its fixed arguments
	 * @return a new session
	 */
	public static LaunchSession createSession(CommandLine commandLine, LaunchSettings settings, List<String> launchCommand) {
		return LaunchSession
			.builder(PicocliCommandReader.read(commandLine), launchCommand)
			.settings(settings)
			.supervisor(
				new ChildProcessSupervisor(settings.getKillTimeoutMillis(), Collections.singleton(CHILD_APP_ENV_VAR))
			)
			.validator(new PicocliArgumentValidator(commandLine))
			.launchEnvironment(CHILD_APP_ENV_VAR, "true")
			.build();
	}

	/**
	 * @param mainClass the class to re-execute
	 * @return the command starting {@code mainClass} in a new JVM with the current class path
	 */
	static List<String> selfCommand(Class<?> mainClass) {
		List<String> command = new ArrayList<String>();
		command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
		command.add("-cp");
		command.add(System.getProperty("java.class.path"));
		command.add(mainClass.getName());
		return command;
	}
}
