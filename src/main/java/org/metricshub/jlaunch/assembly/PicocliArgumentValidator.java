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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jlaunch.model.SentenceCase;
import org.metricshub.jlaunch.schema.PicocliCommandReader;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.metricshub.jlaunch.util.MessageId;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.ParameterException;

/**
 * Validates assembled arguments by parsing them with the picocli
 * {@link CommandLine} of the program, so that the type conversions and
 * constraints of the program (numbers, enums, arity...) are checked before it
 * is started.
 * <p>
 * Note that parsing populates the annotated fields of the command objects, as
 * a regular parse would.
 */
public class PicocliArgumentValidator implements ArgumentValidator {

	private static final Logger LOG = JLaunchLogger.getLogger(PicocliArgumentValidator.class);

	private final CommandLine commandLine;

	/**
	 * @param commandLine the command line of the program receiving the arguments
	 */
	public PicocliArgumentValidator(CommandLine commandLine) {
		this.commandLine = commandLine;
	}

	@Override
	public void validate(List<String> args) throws ValidationException {
		try {
			commandLine.parseArgs(args.toArray(new String[0]));
		} catch (ParameterException e) {
			LOG.debug("Arguments {} rejected: {}", args, e.getMessage());
			throw toValidationException(e);
		}
	}

	static ValidationException toValidationException(ParameterException e) {
		ArgSpec argSpec = e.getArgSpec();
		if (argSpec == null && e instanceof CommandLine.MissingParameterException) {
			List<ArgSpec> missing = ((CommandLine.MissingParameterException) e).getMissing();
			if (missing != null && !missing.isEmpty()) {
				argSpec = missing.get(0);
			}
		}
		List<String> path = pathOf(e.getCommandLine());
		String value = e.getValue();
		if (argSpec == null) {
			return new ValidationException(MessageId.INVALID_VALUE, null, null, path, value == null ? e.getMessage() : value);
		}
		String id = PicocliCommandReader.idOf(argSpec);
		return new ValidationException(
				MessageId.INVALID_VALUE,
				id,
				SentenceCase.of(id),
				path,
				value == null ? e.getMessage() : value);
	}

	private static List<String> pathOf(CommandLine failing) {
		List<String> path = new ArrayList<String>();
		CommandLine current = failing;
		while (current != null && current.getParent() != null) {
			path.add(current.getCommandName());
			current = current.getParent();
		}
		Collections.reverse(path);
		return path;
	}
}
