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
import org.metricshub.jlaunch.util.Localization;
import org.metricshub.jlaunch.util.MessageId;

/**
 * A run attempt was refused because of a value the user can fix.
 * <p>
 * The exception carries no display text of its own: it names the
 * {@link MessageId} to show, and its payload (the argument concerned, the
 * sub-command path leading to it, the offending value).
 */
public class ValidationException extends Exception {

	private static final long serialVersionUID = 1L;

	private final MessageId messageId;
	private final String argumentId;
	private final String subject;
	private final List<String> commandPath;
	private final String value;

	/**
	 * @param messageId what went wrong
	 * @param argumentId identifier of the argument concerned, or {@code null}
	 * @param subject display name of the argument or command concerned, or {@code null}
	 * @param commandPath names of the selected sub-commands leading to the command concerned
	 * @param value the offending value, or {@code null}
	 */
	public ValidationException(
			MessageId messageId,
			String argumentId,
			String subject,
			List<String> commandPath,
			String value) {
		super(describe(messageId, argumentId, commandPath, value));
		this.messageId = messageId;
		this.argumentId = argumentId;
		this.subject = subject;
		this.commandPath = commandPath == null ?
				Collections.<String>emptyList() :
				Collections.unmodifiableList(new ArrayList<String>(commandPath));
		this.value = value;
	}

	/**
	 * Creates an error that is not tied to any argument.
	 *
	 * @param messageId what went wrong
	 */
	public ValidationException(MessageId messageId) {
		this(messageId, null, null, null, null);
	}

	private static String describe(MessageId messageId, String argumentId, List<String> commandPath, String value) {
		StringBuilder desc = new StringBuilder(messageId.getKey());
		if (argumentId != null) {
			desc.append(": ");
			if (commandPath != null && !commandPath.isEmpty()) {
				desc.append(String.join(" ", commandPath)).append(' ');
			}
			desc.append(argumentId);
		}
		if (value != null) {
			desc.append(" '").append(value).append('\'');
		}
		return desc.toString();
	}

	public MessageId getMessageId() {
		return messageId;
	}

	/**
	 * @return the identifier of the argument concerned, or {@code null} when the
	 *         error is a standalone notice
	 */
	public String getArgumentId() {
		return argumentId;
	}

	public String getSubject() {
		return subject;
	}

	/**
	 * @return names of the selected sub-commands leading to the command of the
	 *         argument concerned, empty for the top-level command
	 */
	public List<String> getCommandPath() {
		return commandPath;
	}

	public String getValue() {
		return value;
	}

	/**
	 * @param localization the lookup table of user-facing text
	 * @return the message to show to the user
	 */
	public String getLocalizedMessage(Localization localization) {
		return localization.format(messageId, subject == null ? "" : subject, value == null ? "" : value);
	}
}
