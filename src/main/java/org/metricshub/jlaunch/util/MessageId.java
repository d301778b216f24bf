package org.metricshub.jlaunch.util;

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

/**
 * Fixed identifiers of every user-facing text. The core never builds display
 * text itself: it reports one of these identifiers with a structured payload,
 * and {@link Localization} turns it into a sentence.
 */
public enum MessageId {

	// Validation errors
	REQUIRED_FIELD_MISSING("required-field-missing"),
	SUBCOMMAND_MISSING("subcommand-missing"),
	ENV_KEY_EMPTY("env-key-empty"),
	INVALID_VALUE("invalid-value"),
	SPAWN_FAILED("spawn-failed"),

	// Labels used by presenters
	OPTIONAL("optional"),
	SELECT_FILE("select-file"),
	SELECT_DIRECTORY("select-directory"),
	NEW_VALUE("new-value"),
	RESET("reset"),
	RESET_TO_DEFAULT("reset-to-default"),
	ARGUMENTS("arguments"),
	ENV_VARIABLES("env-variables"),
	INPUT("input"),
	TEXT("text"),
	FILE("file"),
	WORKING_DIRECTORY("working-directory"),
	RUN("run"),
	KILL("kill"),
	RUNNING("running");

	private final String key;

	MessageId(String key) {
		this.key = key;
	}

	/**
	 * @return the key of this message in the {@code jlaunch.messages} bundle
	 */
	public String getKey() {
		return key;
	}

	/**
	 * Resolves a message identifier from its bundle key.
	 *
	 * @param key bundle key, e.g. {@code env-key-empty}
	 * @return the matching identifier
	 * @throws IllegalArgumentException if no identifier uses this key
	 */
	public static MessageId fromKey(String key) {
		for (MessageId id : values()) {
			if (id.key.equals(key)) {
				return id;
			}
		}
		throw new IllegalArgumentException("Unknown message id: " + key);
	}

	@Override
	public String toString() {
		return key;
	}
}
