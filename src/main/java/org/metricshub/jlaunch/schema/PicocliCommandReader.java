package org.metricshub.jlaunch.schema;

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
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.slf4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Model.OptionSpec;
import picocli.CommandLine.Model.PositionalParamSpec;

/**
 * Walks the model of a picocli {@link CommandLine} and converts it into a
 * {@link CommandDefinition}.
 * <p>
 * Mapping rules:
 * <ul>
 * <li>options without parameter (arity 0) are switches: a single boolean
 * becomes {@link ArgAction#SET_TRUE}, a multi-value one (e.g.
 * {@code boolean[] verbose}) becomes {@link ArgAction#COUNT}</li>
 * <li>multi-value options and positional parameters become
 * {@link ArgAction#APPEND}, everything else {@link ArgAction#SET}</li>
 * <li>usage and version help options, hidden arguments, and the built-in
 * {@code help} sub-command are left out</li>
 * <li>{@code File} and {@code Path} values get {@link ValueHint#ANY_PATH}</li>
 * <li>a command with sub-commands requires one when its user object cannot be
 * executed on its own</li>
 * </ul>
 */
public final class PicocliCommandReader {

	private static final Logger LOG = JLaunchLogger.getLogger(PicocliCommandReader.class);

	private PicocliCommandReader() {}

	/**
	 * Converts the specified picocli command and all its sub-commands.
	 *
	 * @param commandLine the picocli command
	 * @return the equivalent command definition
	 */
	public static CommandDefinition read(CommandLine commandLine) {
		return read(commandLine.getCommandSpec());
	}

	/**
	 * Converts the specified picocli command model and all its sub-commands.
	 *
	 * @param spec the picocli command model
	 * @return the equivalent command definition
	 */
	public static CommandDefinition read(CommandSpec spec) {
		CommandDefinition.Builder builder = CommandDefinition.builder(spec.name());

		String[] description = spec.usageMessage().description();
		if (description != null && description.length > 0) {
			builder.about(join(description));
		}

		for (ArgSpec arg : spec.args()) {
			if (arg.hidden()) {
				continue;
			}
			if (arg.isOption()) {
				OptionSpec option = (OptionSpec) arg;
				if (option.usageHelp() || option.versionHelp()) {
					continue;
				}
			}
			builder.argument(readArgument(arg));
		}

		boolean hasSubcommands = false;
		for (Map.Entry<String, CommandLine> entry : spec.subcommands().entrySet()) {
			CommandLine sub = entry.getValue();
			// aliases map to the same CommandLine, keep the main name only
			if (!entry.getKey().equals(sub.getCommandName())) {
				continue;
			}
			if (sub.getCommandSpec().helpCommand()) {
				continue;
			}
			builder.subcommand(read(sub.getCommandSpec()));
			hasSubcommands = true;
		}
		if (hasSubcommands) {
			builder.subcommandRequired(!isExecutable(spec.userObject()));
		}

		return builder.build();
	}

	/**
	 * Returns the identifier under which the specified picocli argument is known
	 * in the converted definition: the longest option name without its leading
	 * dashes, or the label of a positional parameter without its angle brackets.
	 *
	 * @param arg the picocli argument
	 * @return its identifier
	 */
	public static String idOf(ArgSpec arg) {
		if (arg.isOption()) {
			return stripDashes(((OptionSpec) arg).longestName());
		}
		String label = arg.paramLabel();
		if (label == null || label.isEmpty()) {
			return "arg" + ((PositionalParamSpec) arg).index();
		}
		if (label.startsWith("<") && label.endsWith(">") && label.length() > 2) {
			label = label.substring(1, label.length() - 1);
		}
		return label;
	}

	private static ArgumentDefinition readArgument(ArgSpec arg) {
		ArgumentDefinition.Builder builder = ArgumentDefinition.builder(idOf(arg)).required(arg.required());

		if (arg.isOption()) {
			OptionSpec option = (OptionSpec) arg;
			String longName = null;
			Character shortName = null;
			for (String name : option.names()) {
				if (longName == null && name.startsWith("--") && name.length() > 2) {
					longName = name.substring(2);
				} else if (shortName == null && name.length() == 2 && name.charAt(0) == '-') {
					shortName = Character.valueOf(name.charAt(1));
				}
			}
			if (longName == null && shortName == null) {
				LOG.debug("Option {} has no conventional name, using {}", option.longestName(), idOf(arg));
				longName = idOf(arg);
			}
			if (longName != null) {
				builder.longName(longName);
			}
			if (shortName != null) {
				builder.shortName(shortName.charValue());
			}
			if (option.arity().max() == 0) {
				builder.action(option.isMultiValue() ? ArgAction.COUNT : ArgAction.SET_TRUE);
			} else {
				builder.action(option.isMultiValue() ? ArgAction.APPEND : ArgAction.SET);
			}
		} else {
			builder.action(arg.isMultiValue() ? ArgAction.APPEND : ArgAction.SET);
		}

		String[] description = arg.description();
		if (description != null && description.length > 0) {
			builder.help(description[0]);
			if (description.length > 1) {
				builder.longHelp(join(description));
			}
		}

		if (arg.defaultValue() != null) {
			builder.defaultValues(arg.defaultValue());
		}

		Iterable<String> candidates = arg.completionCandidates();
		if (candidates != null) {
			List<String> possible = new ArrayList<String>();
			for (String candidate : candidates) {
				possible.add(candidate);
			}
			builder.possibleValues(possible);
		}

		if (isPath(arg.type())) {
			builder.valueHint(ValueHint.ANY_PATH);
		} else if (arg.auxiliaryTypes() != null) {
			for (Class<?> type : arg.auxiliaryTypes()) {
				if (isPath(type)) {
					builder.valueHint(ValueHint.ANY_PATH);
					break;
				}
			}
		}

		return builder.build();
	}

	private static boolean isExecutable(Object userObject) {
		return userObject instanceof Runnable || userObject instanceof Callable || userObject instanceof Method;
	}

	private static boolean isPath(Class<?> type) {
		return type != null && (File.class.isAssignableFrom(type) || Path.class.isAssignableFrom(type));
	}

	private static String stripDashes(String name) {
		int i = 0;
		while (i < name.length() - 1 && name.charAt(i) == '-') {
			i++;
		}
		return name.substring(i);
	}

	private static String join(String[] lines) {
		StringBuilder joined = new StringBuilder();
		for (String line : lines) {
			if (joined.length() > 0) {
				joined.append(' ');
			}
			joined.append(line);
		}
		return joined.toString();
	}
}
