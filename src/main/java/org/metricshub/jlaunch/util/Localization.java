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

import java.text.MessageFormat;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import org.slf4j.Logger;

/**
 * Lookup table of user-facing text, keyed by {@link MessageId}.
 * <p>
 * Entries come from the {@code jlaunch.messages} resource bundle for the
 * requested locale, and may be overridden one by one by the presentation
 * layer with {@link #override(MessageId, String)}. Patterns use
 * {@link MessageFormat} placeholders: <code>{0}</code> is the display name of
 * the argument concerned, <code>{1}</code> the offending value or detail.
 * <p>
 * A key missing from the bundle is not fatal: the key itself is returned, and
 * the gap is logged.
 */
public class Localization {

	private static final Logger LOG = JLaunchLogger.getLogger(Localization.class);

	static final String BUNDLE_NAME = "jlaunch.messages";

	private final Locale locale;
	private final ResourceBundle bundle;
	private final Map<MessageId, String> overrides = new EnumMap<MessageId, String>(MessageId.class);

	/**
	 * Creates the English (default) localization.
	 */
	public Localization() {
		this(Locale.ROOT);
	}

	/**
	 * Creates a localization for the specified locale, falling back to the
	 * English base bundle for missing translations.
	 *
	 * @param locale the locale to load
	 */
	public Localization(Locale locale) {
		this.locale = Objects.requireNonNull(locale, "locale must not be null");
		this.bundle = loadBundle(locale);
	}

	private static ResourceBundle loadBundle(Locale locale) {
		try {
			return ResourceBundle.getBundle(BUNDLE_NAME, locale, ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES));
		} catch (MissingResourceException e) {
			LOG.warn("Cannot load message bundle '{}' for locale '{}'", BUNDLE_NAME, locale, e);
			return null;
		}
	}

	/**
	 * @return the locale of this table
	 */
	public Locale getLocale() {
		return locale;
	}

	/**
	 * Replaces the text of one message. Passing {@code null} removes the
	 * override and restores the bundled text.
	 *
	 * @param id message to replace
	 * @param pattern new text, with optional {@link MessageFormat} placeholders
	 * @return this instance
	 */
	public Localization override(MessageId id, String pattern) {
		Objects.requireNonNull(id, "id must not be null");
		if (pattern == null) {
			overrides.remove(id);
		} else {
			overrides.put(id, pattern);
		}
		return this;
	}

	/**
	 * Returns the raw text of the specified message.
	 *
	 * @param id message to look up
	 * @return the text, or the message key when no translation exists
	 */
	public String get(MessageId id) {
		String pattern = overrides.get(id);
		if (pattern != null) {
			return pattern;
		}
		if (bundle != null) {
			try {
				return bundle.getString(id.getKey());
			} catch (MissingResourceException e) {
				LOG.debug("No translation for '{}' in locale '{}'", id, locale);
			}
		}
		LOG.warn("Missing translation for key: {}", id);
		return id.getKey();
	}

	/**
	 * Returns the text of the specified message with its placeholders resolved.
	 *
	 * @param id message to look up
	 * @param args values of <code>{0}</code>, <code>{1}</code>...
	 * @return the formatted text
	 */
	public String format(MessageId id, Object... args) {
		String pattern = get(id);
		if (args == null || args.length == 0) {
			return pattern;
		}
		try {
			return new MessageFormat(pattern, locale).format(args);
		} catch (IllegalArgumentException e) {
			LOG.warn("Cannot format message '{}' with pattern '{}'", id, pattern, e);
			return pattern;
		}
	}
}
