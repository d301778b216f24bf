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

import java.util.Objects;

/**
 * What the child process reads on its standard input: an inline text, or the
 * content of a file.
 */
public final class StdinSource {

	/**
	 * Kind of source.
	 */
	public enum Kind {
		TEXT,
		FILE
	}

	private final Kind kind;
	private final String content;

	private StdinSource(Kind kind, String content) {
		this.kind = kind;
		this.content = Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * @param text text written to the standard input, which is closed afterwards
	 * @return the source
	 */
	public static StdinSource text(String text) {
		return new StdinSource(Kind.TEXT, text);
	}

	/**
	 * @param path path of the file the standard input is redirected from
	 * @return the source
	 */
	public static StdinSource file(String path) {
		return new StdinSource(Kind.FILE, path);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the inline text, or the file path
	 */
	public String getContent() {
		return content;
	}

	@Override
	public String toString() {
		return kind == Kind.FILE ? "file:" + content : "text(" + content.length() + " chars)";
	}
}
