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

import static org.junit.Assert.*;
import static org.metricshub.jlaunch.JLaunchTestSupport.IS_WINDOWS;
import static org.metricshub.jlaunch.JLaunchTestSupport.await;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jlaunch.assembly.ArgumentValidator;
import org.metricshub.jlaunch.assembly.ValidationException;
import org.metricshub.jlaunch.process.ChildProcess;
import org.metricshub.jlaunch.process.ProcessStatus;
import org.metricshub.jlaunch.process.StdinSource;
import org.metricshub.jlaunch.schema.ArgAction;
import org.metricshub.jlaunch.schema.ArgumentDefinition;
import org.metricshub.jlaunch.schema.CommandDefinition;
import org.metricshub.jlaunch.state.CommandState;
import org.metricshub.jlaunch.util.LaunchSettings;
import org.metricshub.jlaunch.util.MessageId;

public class LaunchSessionTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	/**
	 * <pre>
	 * echo [--loud] MESSAGE
	 * </pre>
	 */
	private static final CommandDefinition ECHO = CommandDefinition
			.builder("echo")
			.argument(ArgumentDefinition.builder("loud").longName("loud").action(ArgAction.SET_TRUE))
			.argument(ArgumentDefinition.builder("message").required(true))
			.build();

	private static final CommandDefinition NO_ARGUMENTS = CommandDefinition.builder("none").build();

	@Before
	public void assumePosix() {
		Assume.assumeFalse(IS_WINDOWS);
	}

	@Test
	public void testRun() throws Exception {
		LaunchSession session = LaunchSession.builder(ECHO, "echo").build();
		session.getState().setFlag("loud", true);
		session.getState().setSingle("message", "hello world");

		ChildProcess process = session.run();
		assertNotNull(process);
		assertSame(process, session.getChild());
		assertNull(session.getNotice());
		assertNull(session.getLastError());

		await(process);
		assertEquals("--loud hello world\n", session.getOutput().snapshot());
		assertFalse(session.isRunning());
	}

	@Test
	public void testMissingRequiredIsPainted() throws Exception {
		LaunchSession session = LaunchSession.builder(ECHO, "echo").build();
		session.getState().setFlag("loud", true);

		assertNull(session.run());
		assertNull(session.getChild());
		assertEquals("Argument 'Message' is required", session.getNotice());
		assertTrue(session.getLastError() instanceof ValidationException);

		CommandState state = session.getState();
		assertEquals("Argument 'Message' is required", state.getArgState("message").getValidationError());
		assertFalse(state.getArgState("loud").hasValidationError());
		assertEquals(1, state.getArgStatesWithError().size());

		// fixing the value and running again clears the error
		state.setSingle("message", "hi");
		state.applyValidationError("loud", "stale");
		assertNotNull(await(session.run()));
		assertTrue(state.getArgStatesWithError().isEmpty());
		assertNull(session.getNotice());
	}

	@Test
	public void testMissingRequiredInSubcommandIsPainted() throws Exception {
		LaunchSession session = LaunchSession.builder(JLaunchTestSupport.toolDefinition(), "echo").build();
		session.getState().setSingle("output_file", "out.txt");
		CommandState build = session.getState().selectSubcommand("build");

		assertNull(session.run());
		assertEquals("Argument 'Target' is required", build.getArgState("target").getValidationError());
		assertFalse(session.getState().getArgState("output_file").hasValidationError());
	}

	@Test
	public void testMissingSubcommandIsANotice() throws Exception {
		LaunchSession session = LaunchSession.builder(JLaunchTestSupport.toolDefinition(), "echo").build();
		session.getState().setSingle("output_file", "out.txt");

		assertNull(session.run());
		assertEquals("A subcommand of 'Tool' must be selected", session.getNotice());
		assertTrue(session.getState().getArgStatesWithError().isEmpty());
	}

	@Test
	public void testLocalizedErrors() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setLocale(new Locale("pl"));
		LaunchSession session = LaunchSession.builder(ECHO, "echo").settings(settings).build();

		assertNull(session.run());
		assertEquals("Argument 'Message' jest wymagany", session.getNotice());
	}

	@Test
	public void testValidatorErrorIsPainted() throws Exception {
		LaunchSession session = LaunchSession
				.builder(ECHO, "echo")
				.validator(new ArgumentValidator() {
					@Override
					public void validate(List<String> args) throws ValidationException {
						if (args.contains("bad")) {
							throw new ValidationException(
									MessageId.INVALID_VALUE,
									"message",
									"Message",
									Collections.<String>emptyList(),
									"bad");
						}
					}
				})
				.build();
		session.getState().setSingle("message", "bad");

		assertNull(session.run());
		assertEquals("Invalid value 'bad' for 'Message'", session.getState().getArgState("message").getValidationError());

		session.getState().setSingle("message", "good");
		assertNotNull(await(session.run()));
	}

	@Test
	public void testEmptyEnvironmentKey() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableEnvironment(true);
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "true").settings(settings).build();
		session.addEnvironmentVariable();

		assertNull(session.run());
		assertNull(session.getChild());
		assertEquals("Environment variable name cannot be empty", session.getNotice());
		assertEquals(
				MessageId.ENV_KEY_EMPTY,
				((ValidationException) session.getLastError()).getMessageId());
		assertTrue(session.getState().getArgStatesWithError().isEmpty());
	}

	@Test
	public void testInvalidEnvironmentName() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableEnvironment(true);
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "true").settings(settings).build();
		session.addEnvironmentVariable();
		session.setEnvironmentVariable(0, "A=B", "x");

		assertNull(session.run());
		assertNotNull(session.getChild());
		assertEquals(ProcessStatus.State.SPAWN_FAILED, session.getChild().getStatus().getState());
		assertTrue(session.getNotice(), session.getNotice().startsWith("Cannot start 'true': "));
		assertFalse(session.isRunning());
	}

	@Test
	public void testEnvironment() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableEnvironment(true);
		LaunchSession session = LaunchSession
				.builder(NO_ARGUMENTS, "sh", "-c", "echo \"$JLAUNCH_TEST_VAR\"")
				.settings(settings)
				.build();
		session.addEnvironmentVariable();
		session.setEnvironmentVariable(0, "JLAUNCH_TEST_VAR", "from session");

		await(session.run());
		assertEquals("from session\n", session.getOutput().snapshot());
	}

	@Test
	public void testDisabledFeaturesAreIgnored() throws Exception {
		LaunchSession session = LaunchSession
				.builder(NO_ARGUMENTS, "sh", "-c", "echo \"[$JLAUNCH_TEST_VAR]\"; cat")
				.build();
		// an empty name is not an error when the environment is disabled
		session.addEnvironmentVariable();
		session.addEnvironmentVariable();
		session.setEnvironmentVariable(1, "JLAUNCH_TEST_VAR", "ignored");
		session.setStdin(StdinSource.text("ignored too"));

		await(session.run());
		assertEquals("[]\n", session.getOutput().snapshot());
	}

	@Test
	public void testRemoveEnvironmentVariable() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableEnvironment(true);
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "true").settings(settings).build();
		session.addEnvironmentVariable();
		session.removeEnvironmentVariable(0);
		assertTrue(session.getEnvironment().isEmpty());
		assertNotNull(await(session.run()));
	}

	@Test
	public void testStdin() throws Exception {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableStdin(true);
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "cat").settings(settings).build();
		session.setStdin(StdinSource.text("piped"));

		await(session.run());
		assertEquals("piped", session.getOutput().snapshot());
	}

	@Test
	public void testWorkingDirectory() throws Exception {
		File directory = folder.newFolder("session");
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableWorkingDirectory(true);
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "pwd").settings(settings).build();
		session.setWorkingDirectory(directory.getPath());

		await(session.run());
		assertEquals(
				directory.getCanonicalPath(),
				new File(session.getOutput().snapshot().trim()).getCanonicalPath());
	}

	@Test
	public void testLaunchEnvironment() throws Exception {
		LaunchSession session = LaunchSession
				.builder(NO_ARGUMENTS, "sh", "-c", "echo \"$JLAUNCH_TEST_MARKER\"")
				.launchEnvironment("JLAUNCH_TEST_MARKER", "set")
				.build();
		await(session.run());
		assertEquals("set\n", session.getOutput().snapshot());
	}

	@Test
	public void testSpawnFailure() throws Exception {
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "/nonexistent/jlaunch-no-such-program").build();

		assertNull(session.run());
		assertNotNull(session.getChild());
		assertEquals(ProcessStatus.State.SPAWN_FAILED, session.getChild().getStatus().getState());
		assertTrue(session.getNotice(), session.getNotice().startsWith("Cannot start '/nonexistent/jlaunch-no-such-program': "));
		assertFalse(session.isRunning());
	}

	@Test
	public void testNewRunDoesNotKillPreviousOne() throws Exception {
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "sleep", "30").build();
		ChildProcess first = session.run();
		ChildProcess second = null;
		try {
			second = session.run();
			assertSame(second, session.getChild());
			assertTrue(first.isRunning());
			assertTrue(session.isRunning());

			session.kill();
			await(second);
			assertEquals(ProcessStatus.State.KILLED, second.getStatus().getState());
			assertTrue(first.isRunning());
		} finally {
			first.kill();
			if (second != null) {
				second.kill();
			}
		}
	}

	@Test
	public void testKillWithoutProcess() {
		LaunchSession session = LaunchSession.builder(NO_ARGUMENTS, "true").build();
		session.kill();
		assertFalse(session.isRunning());
		assertNull(session.getOutput());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyLaunchCommand() {
		LaunchSession.builder(NO_ARGUMENTS, Collections.<String>emptyList());
	}
}
