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
import java.util.List;
import org.metricshub.jlaunch.schema.ArgumentDefinition;

/**
 * Read-only description of one argument of a command: how it is labeled, how
 * many values it holds, and how these values are written on the command line.
 * <p>
 * A switch ({@link Cardinality#FLAG} or {@link Cardinality#COUNTER}) always
 * has an invocation token: it is checked when the spec is built.
 */
public final class ArgSpec {

	private final String id;
	private final String displayName;
	private final String invocationToken;
	private final String helpText;
	private final boolean required;
	private final boolean useEquals;
	private final Cardinality cardinality;
	private final List<String> defaultValues;
	private final List<String> allowedValues;
	private final PathHint pathHint;

	private ArgSpec(ArgumentDefinition definition) {
		this.id = definition.getId();
		this.displayName = SentenceCase.of(definition.getId());
		this.invocationToken = invocationTokenOf(definition);
		this.helpText = definition.getLongHelp() != null ? definition.getLongHelp() : definition.getHelp();
		this.required = definition.isRequired();
		this.useEquals = definition.isRequireEquals();
		this.cardinality = Cardinality.of(definition.getAction());
		this.defaultValues = Collections.unmodifiableList(new ArrayList<String>(definition.getDefaultValues()));
		this.allowedValues = Collections.unmodifiableList(new ArrayList<String>(definition.getPossibleValues()));
		this.pathHint = PathHint.of(definition.getValueHint());

		if (cardinality.isSwitch() && invocationToken == null) {
			throw new SchemaException("Argument '" + id + "' is a " + cardinality + " but has neither long nor short name");
		}
	}

	/**
	 * Builds the spec of the specified argument.
	 *
	 * @param definition the argument as declared by the host application
	 * @return the spec
	 * @throws SchemaException if the argument is a switch without name
	 */
	public static ArgSpec from(ArgumentDefinition definition) {
		return new ArgSpec(definition);
	}

	private static String invocationTokenOf(ArgumentDefinition definition) {
		if (definition.getLongName() != null) {
			return "--" + definition.getLongName();
		}
		if (definition.getShortName() != null) {
			return "-" + definition.getShortName();
		}
		return null;
	}

	public String getId() {
		return id;
	}

	/**
	 * @return the sentence-cased label of the argument, e.g. {@code Output file}
	 */
	public String getDisplayName() {
		return displayName;
	}

	/**
	 * @return the literal token written before the value, e.g. {@code --output},
	 *         or {@code null} for a positional argument
	 */
	public String getInvocationToken() {
		return invocationToken;
	}

	public boolean isPositional() {
		return invocationToken == null;
	}

	public String getHelpText() {
		return helpText;
	}

	public boolean isRequired() {
		return required;
	}

	/**
	 * @return whether token and value are written as one {@code token=value} argument
	 */
	public boolean isUseEquals() {
		return useEquals;
	}

	public Cardinality getCardinality() {
		return cardinality;
	}

	/**
	 * @return the default values, used as placeholder and as target of
	 *         "reset to default", never written on the command line by themselves
	 */
	public List<String> getDefaultValues() {
		return defaultValues;
	}

	/**
	 * @return the first default value, or {@code null}
	 */
	public String getDefaultValue() {
		return defaultValues.isEmpty() ? null : defaultValues.get(0);
	}

	/**
	 * @return the closed set of accepted values, empty when any value is accepted
	 */
	public List<String> getAllowedValues() {
		return allowedValues;
	}

	public boolean isClosedChoice() {
		return !allowedValues.isEmpty();
	}

	public PathHint getPathHint() {
		return pathHint;
	}

	/**
	 * Writes one value of this argument on the command line.
	 *
	 * @param value the value
	 * @param args the command line being built
	 */
	public void appendValue(String value, List<String> args) {
		if (invocationToken == null) {
			args.add(value);
		} else if (useEquals) {
			args.add(invocationToken + "=" + value);
		} else {
			args.add(invocationToken);
			args.add(value);
		}
	}

	@Override
	public String toString() {
		return "ArgSpec[" + id + ", " + cardinality + (invocationToken == null ? "" : ", " + invocationToken) + "]";
	}
}
