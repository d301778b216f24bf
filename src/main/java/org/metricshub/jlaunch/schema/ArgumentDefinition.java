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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one argument of a command, as provided by the host
 * application. This is the raw input from which the argument model is derived.
 * <p>
 * Instances are immutable and created with {@link #builder(String)}:
 *
 * <pre>
 * ArgumentDefinition.builder("output").longName("output").shortName('o').required(true).build();
 * </pre>
 */
public final class ArgumentDefinition {

	private final String id;
	private final String longName;
	private final Character shortName;
	private final String help;
	private final String longHelp;
	private final boolean required;
	private final boolean requireEquals;
	private final ArgAction action;
	private final List<String> defaultValues;
	private final List<String> possibleValues;
	private final ValueHint valueHint;

	private ArgumentDefinition(Builder builder) {
		this.id = builder.id;
		this.longName = builder.longName;
		this.shortName = builder.shortName;
		this.help = builder.help;
		this.longHelp = builder.longHelp;
		this.required = builder.required;
		this.requireEquals = builder.requireEquals;
		this.action = builder.action;
		this.defaultValues = Collections.unmodifiableList(new ArrayList<String>(builder.defaultValues));
		this.possibleValues = Collections.unmodifiableList(new ArrayList<String>(builder.possibleValues));
		this.valueHint = builder.valueHint;
	}

	/**
	 * Starts the declaration of an argument.
	 *
	 * @param id stable identifier of the argument, unique within its command
	 * @return a builder of {@code SET} argument without any name, i.e. positional
	 */
	public static Builder builder(String id) {
		return new Builder(id);
	}

	public String getId() {
		return id;
	}

	/**
	 * @return the long name without its leading dashes, or {@code null}
	 */
	public String getLongName() {
		return longName;
	}

	/**
	 * @return the short name without its leading dash, or {@code null}
	 */
	public Character getShortName() {
		return shortName;
	}

	public String getHelp() {
		return help;
	}

	public String getLongHelp() {
		return longHelp;
	}

	public boolean isRequired() {
		return required;
	}

	/**
	 * @return whether the value must be attached to the option name with {@code =}
	 */
	public boolean isRequireEquals() {
		return requireEquals;
	}

	public ArgAction getAction() {
		return action;
	}

	public List<String> getDefaultValues() {
		return defaultValues;
	}

	public List<String> getPossibleValues() {
		return possibleValues;
	}

	public ValueHint getValueHint() {
		return valueHint;
	}

	@Override
	public String toString() {
		return "ArgumentDefinition[" + id + ", " + action + "]";
	}

	/**
	 * Builder of {@link ArgumentDefinition}.
	 */
	public static final class Builder {

		private final String id;
		private String longName;
		private Character shortName;
		private String help;
		private String longHelp;
		private boolean required;
		private boolean requireEquals;
		private ArgAction action = ArgAction.SET;
		private List<String> defaultValues = new ArrayList<String>();
		private List<String> possibleValues = new ArrayList<String>();
		private ValueHint valueHint = ValueHint.NONE;

		private Builder(String id) {
			this.id = Objects.requireNonNull(id, "Argument id must not be null");
			if (id.isEmpty()) {
				throw new IllegalArgumentException("Argument id must not be empty");
			}
		}

		public Builder longName(String longName) {
			this.longName = stripDashes(longName);
			return this;
		}

		public Builder shortName(char shortName) {
			if (shortName == '-' || Character.isWhitespace(shortName)) {
				throw new IllegalArgumentException("Invalid short name '" + shortName + "' for argument " + id);
			}
			this.shortName = Character.valueOf(shortName);
			return this;
		}

		public Builder help(String help) {
			this.help = help;
			return this;
		}

		public Builder longHelp(String longHelp) {
			this.longHelp = longHelp;
			return this;
		}

		public Builder required(boolean required) {
			this.required = required;
			return this;
		}

		public Builder requireEquals(boolean requireEquals) {
			this.requireEquals = requireEquals;
			return this;
		}

		public Builder action(ArgAction action) {
			this.action = Objects.requireNonNull(action, "action must not be null");
			return this;
		}

		public Builder defaultValues(String... defaultValues) {
			this.defaultValues = new ArrayList<String>(Arrays.asList(defaultValues));
			return this;
		}

		public Builder defaultValues(List<String> defaultValues) {
			this.defaultValues = new ArrayList<String>(defaultValues);
			return this;
		}

		public Builder possibleValues(String... possibleValues) {
			this.possibleValues = new ArrayList<String>(Arrays.asList(possibleValues));
			return this;
		}

		public Builder possibleValues(List<String> possibleValues) {
			this.possibleValues = new ArrayList<String>(possibleValues);
			return this;
		}

		public Builder valueHint(ValueHint valueHint) {
			this.valueHint = valueHint == null ? ValueHint.NONE : valueHint;
			return this;
		}

		public ArgumentDefinition build() {
			return new ArgumentDefinition(this);
		}

		private static String stripDashes(String name) {
			if (name == null) {
				return null;
			}
			int i = 0;
			while (i < name.length() && name.charAt(i) == '-') {
				i++;
			}
			String stripped = name.substring(i);
			return stripped.isEmpty() ? null : stripped;
		}
	}
}
