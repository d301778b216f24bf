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

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * A simple container for the options of a launch session.
 * These values have defaults, which the host application may change before
 * creating the session.
 * <p>
 * Each optional input of the child process (environment overrides, standard
 * input, working directory) is only taken into account when enabled here. The
 * descriptions are free text shown by the presentation layer above the
 * corresponding input; an empty description shows nothing.
 */
public class LaunchSettings {

	/**
	 * Whether the user may define environment variables for the child process;
	 * <code>false</code> by default.
	 */
	private boolean enableEnvironment = false;

	/**
	 * Text shown above the environment variables.
	 */
	private String environmentDescription = "";

	/**
	 * Whether the user may feed the standard input of the child process;
	 * <code>false</code> by default.
	 */
	private boolean enableStdin = false;

	/**
	 * Text shown above the standard input.
	 */
	private String stdinDescription = "";

	/**
	 * Whether the user may change the working directory of the child process;
	 * <code>false</code> by default.
	 */
	private boolean enableWorkingDirectory = false;

	/**
	 * Text shown above the working directory.
	 */
	private String workingDirectoryDescription = "";

	/**
	 * Locale of the user-facing messages.
	 * <code>Locale.ROOT</code> (English) by default.
	 */
	private Locale locale = Locale.ROOT;

	/**
	 * Time given to a killed child process to terminate gracefully before it
	 * is forcibly terminated, in milliseconds.
	 */
	private long killTimeoutMillis = TimeUnit.SECONDS.toMillis(5);

	/**
	 * @return a human readable representation of the settings
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("enableEnvironment = ").append(isEnableEnvironment()).append(newLine);
		desc.append("enableStdin = ").append(isEnableStdin()).append(newLine);
		desc.append("enableWorkingDirectory = ").append(isEnableWorkingDirectory()).append(newLine);
		desc.append("locale = ").append(getLocale()).append(newLine);
		desc.append("killTimeoutMillis = ").append(getKillTimeoutMillis()).append(newLine);

		return desc.toString();
	}

	public boolean isEnableEnvironment() {
		return enableEnvironment;
	}

	public void setEnableEnvironment(boolean enableEnvironment) {
		this.enableEnvironment = enableEnvironment;
	}

	public String getEnvironmentDescription() {
		return environmentDescription;
	}

	/**
	 * Enables the environment variables and sets the text shown above them.
	 *
	 * @param environmentDescription the description, may be empty
	 */
	public void setEnvironmentDescription(String environmentDescription) {
		this.environmentDescription = environmentDescription == null ? "" : environmentDescription;
		this.enableEnvironment = true;
	}

	public boolean isEnableStdin() {
		return enableStdin;
	}

	public void setEnableStdin(boolean enableStdin) {
		this.enableStdin = enableStdin;
	}

	public String getStdinDescription() {
		return stdinDescription;
	}

	/**
	 * Enables the standard input and sets the text shown above it.
	 *
	 * @param stdinDescription the description, may be empty
	 */
	public void setStdinDescription(String stdinDescription) {
		this.stdinDescription = stdinDescription == null ? "" : stdinDescription;
		this.enableStdin = true;
	}

	public boolean isEnableWorkingDirectory() {
		return enableWorkingDirectory;
	}

	public void setEnableWorkingDirectory(boolean enableWorkingDirectory) {
		this.enableWorkingDirectory = enableWorkingDirectory;
	}

	public String getWorkingDirectoryDescription() {
		return workingDirectoryDescription;
	}

	/**
	 * Enables the working directory and sets the text shown above it.
	 *
	 * @param workingDirectoryDescription the description, may be empty
	 */
	public void setWorkingDirectoryDescription(String workingDirectoryDescription) {
		this.workingDirectoryDescription = workingDirectoryDescription == null ? "" : workingDirectoryDescription;
		this.enableWorkingDirectory = true;
	}

	public Locale getLocale() {
		return locale;
	}

	/**
	 * @param locale the locale of the user-facing messages, {@code null} for English
	 */
	public void setLocale(Locale locale) {
		this.locale = locale == null ? Locale.ROOT : locale;
	}

	public long getKillTimeoutMillis() {
		return killTimeoutMillis;
	}

	/**
	 * @param killTimeoutMillis grace period of a kill request, in milliseconds
	 * @throws IllegalArgumentException if negative
	 */
	public void setKillTimeoutMillis(long killTimeoutMillis) {
		if (killTimeoutMillis < 0) {
			throw new IllegalArgumentException("Kill timeout must not be negative: " + killTimeoutMillis);
		}
		this.killTimeoutMillis = killTimeoutMillis;
	}
}
