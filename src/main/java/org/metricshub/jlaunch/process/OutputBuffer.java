package org.metricshub.jlaunch.process;

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
 * Append-only text shared by the threads draining the outputs of a child
 * process and the thread displaying it.
 * <p>
 * Text appended by one writer keeps its order; text of different writers is
 * interleaved as it arrives.
 */
public final class OutputBuffer {

	private final StringBuilder text = new StringBuilder();

	/**
	 * @param chars characters to append
	 * @param offset index of the first character to append
	 * @param length number of characters to append
	 */
	public synchronized void append(char[] chars, int offset, int length) {
		text.append(chars, offset, length);
	}

	public synchronized void append(String chars) {
		text.append(chars);
	}

	/**
	 * @return the number of characters received so far
	 */
	public synchronized int length() {
		return text.length();
	}

	/**
	 * @return all the text received so far
	 */
	public synchronized String snapshot() {
		return text.toString();
	}

	/**
	 * Returns the text received since the specified position, so that a reader
	 * can follow the output incrementally.
	 *
	 * @param fromOffset a value previously returned by {@link #length()}
	 * @return the text received from this position on
	 */
	public synchronized String snapshot(int fromOffset) {
		if (fromOffset < 0 || fromOffset > text.length()) {
			throw new IndexOutOfBoundsException("Offset " + fromOffset + " out of " + text.length() + " characters");
		}
		return text.substring(fromOffset);
	}

	@Override
	public String toString() {
		return snapshot();
	}
}
