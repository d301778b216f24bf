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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import org.metricshub.jlaunch.util.JLaunchLogger;
import org.slf4j.Logger;

/**
 * Drains one output stream of a child process into an {@link OutputBuffer},
 * on its own daemon thread, until the end of the stream.
 * <p>
 * Text is decoded as it arrives and appended as soon as a read returns, so
 * that the output shows up while the process is still running. Each stream of
 * a process gets its own pump: a pump never waits for another one.
 */
public final class DataPump implements Runnable {

	private static final int BUFFER_SIZE = 4096;

	private final String description;
	private final Reader reader;
	private final OutputBuffer output;
	private final Logger logger;

	private DataPump(String description, String channel, InputStream in, Charset charset, OutputBuffer output) {
		this.description = description;
		this.reader = new InputStreamReader(in, charset);
		this.output = output;
		this.logger = JLaunchLogger.getLogger(DataPump.class, channel);
	}

	/**
	 * Starts draining the specified stream.
	 *
	 * @param description what is being drained, for the thread name and the logs
	 * @param channel name of the stream, e.g. {@code stdout}
	 * @param in the stream to drain
	 * @param output where decoded text is appended
	 * @return the started thread
	 */
	public static Thread dump(String description, String channel, InputStream in, OutputBuffer output) {
		DataPump pump = new DataPump(description, channel, in, StandardCharsets.UTF_8, output);
		Thread thread = new Thread(pump, "DataPump-" + channel + "-" + description);
		thread.setDaemon(true);
		thread.start();
		return thread;
	}

	@Override
	public void run() {
		char[] buffer = new char[BUFFER_SIZE];
		try {
			int read;
			while ((read = reader.read(buffer)) >= 0) {
				if (read > 0) {
					output.append(buffer, 0, read);
				}
			}
		} catch (IOException e) {
			logger.warn("Error while reading the output of {}: {}", description, e.getMessage());
			logger.debug("Stack trace", e);
		} finally {
			try {
				reader.close();
			} catch (IOException e) {
				logger.debug("Cannot close the output of {}", description, e);
			}
		}
	}
}
