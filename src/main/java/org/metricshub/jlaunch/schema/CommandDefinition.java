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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Declaration of a command, its arguments and its alternative sub-commands,
 * as provided by the host application.
 * <p>
 * The declaration order of the arguments is the order in which their values
 * are later written on the command line.
 */
public final class CommandDefinition {

	private final String name;
	private final String about;
	private final List<ArgumentDefinition> arguments;
	private final List<CommandDefinition> subcommands;
	private final boolean subcommandRequired;

	private CommandDefinition(Builder builder) {
		this.name = builder.name;
		this.about = builder.about;
		this.arguments = Collections.unmodifiableList(new ArrayList<ArgumentDefinition>(builder.arguments));
		this.subcommands = Collections.unmodifiableList(new ArrayList<CommandDefinition>(builder.subcommands));
		this.subcommandRequired = builder.subcommandRequired;
	}

	/**
	 * Starts the declaration of a command.
	 *
	 * @param name name of the command; for a sub-command, the token that selects it
	 * @return a new builder
	 */
	public static Builder builder(String name) {
		return new Builder(name);
	}

	public String getName() {
		return name;
	}

	public String getAbout() {
		return about;
	}

	public List<ArgumentDefinition> getArguments() {
		return arguments;
	}

	public List<CommandDefinition> getSubcommands() {
		return subcommands;
	}

	/**
	 * @return whether one of the sub-commands must be selected
	 */
	public boolean isSubcommandRequired() {
		return subcommandRequired;
	}

	@Override
	public String toString() {
		return "CommandDefinition[" + name + "]";
	}

	/**
	 * Builder of {@link CommandDefinition}.
	 */
	public static final class Builder {

		private final String name;
		private String about;
		private final List<ArgumentDefinition> arguments = new ArrayList<ArgumentDefinition>();
		private final List<CommandDefinition> subcommands = new ArrayList<CommandDefinition>();
		private boolean subcommandRequired;
		private final Set<String> argumentIds = new HashSet<String>();
		private final Set<String> subcommandNames = new HashSet<String>();

		private Builder(String name) {
			this.name = Objects.requireNonNull(name, "Command name must not be null");
		}

		public Builder about(String about) {
			this.about = about;
			return this;
		}

		/**
		 * Appends an argument.
		 *
		 * @param argument the argument
		 * @return this builder
		 * @throws IllegalArgumentException if the id is already used in this command
		 */
		public Builder argument(ArgumentDefinition argument) {
			Objects.requireNonNull(argument, "argument must not be null");
			if (!argumentIds.add(argument.getId())) {
				throw new IllegalArgumentException("Duplicate argument '" + argument.getId() + "' in command " + name);
			}
			arguments.add(argument);
			return this;
		}

		public Builder argument(ArgumentDefinition.Builder argument) {
			return argument(argument.build());
		}

		/**
		 * Appends a sub-command alternative.
		 *
		 * @param subcommand the sub-command
		 * @return this builder
		 * @throws IllegalArgumentException if the name is already used in this command
		 */
		public Builder subcommand(CommandDefinition subcommand) {
			Objects.requireNonNull(subcommand, "subcommand must not be null");
			if (subcommand.getName().isEmpty()) {
				throw new IllegalArgumentException("Subcommand of " + name + " must have a name");
			}
			if (!subcommandNames.add(subcommand.getName())) {
				throw new IllegalArgumentException("Duplicate subcommand '" + subcommand.getName() + "' in command " + name);
			}
			subcommands.add(subcommand);
			return this;
		}

		public Builder subcommand(CommandDefinition.Builder subcommand) {
			return subcommand(subcommand.build());
		}

		public Builder subcommandRequired(boolean subcommandRequired) {
			this.subcommandRequired = subcommandRequired;
			return this;
		}

		public CommandDefinition build() {
			return new CommandDefinition(this);
		}
	}
}
