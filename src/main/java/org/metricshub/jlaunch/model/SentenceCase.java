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

/**
 * Turns identifiers such as {@code output_file}, {@code outputFile} or
 * {@code --output-file} into a human label: {@code Output file}.
 * <p>
 * Words are separated by non-alphanumeric characters and by a lower-case
 * letter followed by an upper-case one. A digit ends the current word. The
 * first letter is upper-cased, every other letter lower-cased, and words are
 * joined with a single space. Leading and trailing separators are dropped.
 */
public final class SentenceCase {

	private SentenceCase() {}

	/**
	 * @param identifier the identifier to convert
	 * @return the sentence-cased label, empty if the identifier has no letter or digit
	 */
	public static String of(String identifier) {
		if (identifier == null) {
			return "";
		}
		int end = identifier.length();
		while (end > 0 && !Character.isLetterOrDigit(identifier.charAt(end - 1))) {
			end--;
		}

		StringBuilder result = new StringBuilder(identifier.length() * 2);
		boolean newWord = true;
		boolean firstWord = true;
		boolean foundRealChar = false;
		char lastChar = ' ';

		for (int i = 0; i < end; i++) {
			char c = identifier.charAt(i);
			if (!Character.isLetterOrDigit(c)) {
				if (foundRealChar) {
					newWord = true;
				}
			} else if (Character.isDigit(c)) {
				foundRealChar = true;
				newWord = true;
				result.append(c);
			} else if (newWord || (Character.isLowerCase(lastChar) && Character.isUpperCase(c))) {
				foundRealChar = true;
				newWord = false;
				if (firstWord) {
					result.append(Character.toUpperCase(c));
					firstWord = false;
				} else {
					result.append(' ').append(Character.toLowerCase(c));
				}
			} else {
				foundRealChar = true;
				lastChar = c;
				result.append(Character.toLowerCase(c));
			}
		}
		return result.toString();
	}
}
