package org.metricshub.jlaunch.assembly;

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

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jlaunch.util.Localization;
import org.metricshub.jlaunch.util.MessageId;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

public class PicocliArgumentValidatorTest {

	@Command(name = "app", subcommands = Serve.class)
	static class App implements Runnable {

		@Option(names = "--count")
		int count;

		@Override
		public void run() {}
	}

	@Command(name = "serve")
	static class Serve implements Runnable {

		@Option(names = { "-p", "--port" }, required = true)
		int port;

		@Override
		public void run() {}
	}

	private final PicocliArgumentValidator validator = new PicocliArgumentValidator(new CommandLine(new App()));

	@Test
	public void testValidArguments() throws Exception {
		validator.validate(Arrays.asList("--count", "3", "serve", "--port", "8080"));
		validator.validate(Collections.<String>emptyList());
	}

	@Test
	public void testInvalidValue() {
		try {
			validator.validate(Arrays.asList("--count", "abc"));
			fail("ValidationException expected");
		} catch (ValidationException e) {
			assertEquals(MessageId.INVALID_VALUE, e.getMessageId());
			assertEquals("count", e.getArgumentId());
			assertEquals("Count", e.getSubject());
			assertEquals("abc", e.getValue());
			assertTrue(e.getCommandPath().isEmpty());
			assertEquals("Invalid value 'abc' for 'Count'", e.getLocalizedMessage(new Localization()));
		}
	}

	@Test
	public void testMissingOptionInSubcommand() {
		try {
			validator.validate(Arrays.asList("serve"));
			fail("ValidationException expected");
		} catch (ValidationException e) {
			assertEquals(MessageId.INVALID_VALUE, e.getMessageId());
			assertEquals("port", e.getArgumentId());
			assertEquals(Collections.singletonList("serve"), e.getCommandPath());
		}
	}

	@Test
	public void testUnknownArgument() {
		try {
			validator.validate(Arrays.asList("--unknown"));
			fail("ValidationException expected");
		} catch (ValidationException e) {
			assertEquals(MessageId.INVALID_VALUE, e.getMessageId());
			assertNull(e.getArgumentId());
			assertNotNull(e.getValue());
		}
	}
}
