package org.metricshub.jlaunch.model;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jlaunch.schema.ArgumentDefinition;
import org.metricshub.jlaunch.schema.CommandDefinition;

/**
 * Read-only model of a command: the specs of its arguments in declaration
 * order, and the models of its alternative sub-commands. Built once, from the
 * definition supplied by the host application.
 */
public final class CommandModel {

	private final String name;
	private final String displayName;
	private final String about;
	private final List<ArgSpec> argSpecs;
	private final Map<String, CommandModel> subcommands;
	private final boolean subcommandRequired;

	private CommandModel(CommandDefinition definition) {
		this.name = definition.getName();
		this.displayName = SentenceCase.of(definition.getName());
		this.about = definition.getAbout();

		List<ArgSpec> specs = new ArrayList<ArgSpec>(definition.getArguments().size());
		for (ArgumentDefinition argument : definition.getArguments()) {
			specs.add(ArgSpec.from(argument));
		}
		this.argSpecs = Collections.unmodifiableList(specs);

		Map<String, CommandModel> children = new LinkedHashMap<String, CommandModel>();
		for (CommandDefinition subcommand : definition.getSubcommands()) {
			children.put(subcommand.getName(), new CommandModel(subcommand));
		}
		this.subcommands = Collections.unmodifiableMap(children);
		this.subcommandRequired = definition.isSubcommandRequired() && !children.isEmpty();
	}

	/**
	 * Builds the model of the specified command and, recursively, of all its
	 * sub-commands.
	 *
	 * @param definition the command as declared by the host application
	 * @return the model
	 * @throws SchemaException if an argument cannot be modeled
	 */
	public static CommandModel from(CommandDefinition definition) {
		return new CommandModel(definition);
	}

	/**
	 * @return the name of the command, which is also the token selecting it when
	 *         it is a sub-command
	 */
	public String getName() {
		return name;
	}

	public String getDisplayName() {
		return displayName;
	}

	public String getAbout() {
		return about;
	}

	public List<ArgSpec> getArgSpecs() {
		return argSpecs;
	}

	/**
	 * @param id identifier of an argument
	 * @return its spec, or {@code null} if this command has no such argument
	 */
	public ArgSpec getArgSpec(String id) {
		for (ArgSpec spec : argSpecs) {
			if (spec.getId().equals(id)) {
				return spec;
			}
		}
		return null;
	}

	/**
	 * @return the sub-command alternatives, by name, in declaration order
	 */
	public Map<String, CommandModel> getSubcommands() {
		return subcommands;
	}

	public boolean hasSubcommands() {
		return !subcommands.isEmpty();
	}

	public boolean isSubcommandRequired() {
		return subcommandRequired;
	}

	@Override
	public String toString() {
		return "CommandModel[" + name + "]";
	}
}
