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

import static org.junit.Assert.assertTrue;

import java.util.concurrent.TimeUnit;
import org.metricshub.jlaunch.process.ChildProcess;
import org.metricshub.jlaunch.schema.ArgAction;
import org.metricshub.jlaunch.schema.ArgumentDefinition;
import org.metricshub.jlaunch.schema.CommandDefinition;
import org.metricshub.jlaunch.schema.ValueHint;

/**
 * Shared fixtures of the JLaunch tests.
 */
public final class JLaunchTestSupport {

	public static final boolean IS_WINDOWS = (System.getProperty("os.name").contains("Windows"));

	private JLaunchTestSupport() {}

	/**
	 * A command with one argument of each kind, and two sub-commands, one of
	 * which is required.
	 *
	 * <pre>
	 * tool [-v]... [--quiet] --output=FILE [--define KEY=VALUE]... [INPUT] (build --target T [--release] | clean [--all])
	 * </pre>
	 *
	 * @return the definition of {@code tool}
	 */
	public static CommandDefinition toolDefinition() {
		return CommandDefinition
				.builder("tool")
				.about("A tool with a bit of everything")
				.argument(ArgumentDefinition.builder("verbose").shortName('v').action(ArgAction.COUNT).help("Verbosity"))
				.argument(ArgumentDefinition.builder("quiet").longName("quiet").action(ArgAction.SET_TRUE))
				.argument(
						ArgumentDefinition
								.builder("output_file")
								.longName("output")
								.shortName('o')
								.required(true)
								.requireEquals(true)
								.valueHint(ValueHint.FILE_PATH))
				.argument(ArgumentDefinition.builder("define").longName("define").action(ArgAction.APPEND))
				.argument(ArgumentDefinition.builder("input"))
				.subcommand(
						CommandDefinition
								.builder("build")
								.argument(ArgumentDefinition.builder("target").longName("target").required(true))
								.argument(ArgumentDefinition.builder("release").longName("release").action(ArgAction.SET_TRUE)))
				.subcommand(
						CommandDefinition
								.builder("clean")
								.argument(ArgumentDefinition.builder("all").longName("all").action(ArgAction.SET_TRUE)))
				.subcommandRequired(true)
				.build();
	}

	/**
	 * Waits for the specified process to terminate and its output to be read.
	 *
	 * @param process the process to wait for
	 * @return the process
	 * @throws InterruptedException if interrupted while waiting
	 */
	public static ChildProcess await(ChildProcess process) throws InterruptedException {
		assertTrue("Process did not terminate in time: " + process, process.awaitTermination(10, TimeUnit.SECONDS));
		return process;
	}
}
