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

import static org.junit.Assert.*;

import java.util.Locale;
import org.junit.Test;

public class LaunchSettingsTest {

	@Test
	public void testDefaults() {
		LaunchSettings settings = new LaunchSettings();
		assertFalse(settings.isEnableEnvironment());
		assertFalse(settings.isEnableStdin());
		assertFalse(settings.isEnableWorkingDirectory());
		assertEquals(Locale.ROOT, settings.getLocale());
		assertEquals(5000L, settings.getKillTimeoutMillis());
	}

	@Test
	public void testDescriptionEnablesFeature() {
		LaunchSettings settings = new LaunchSettings();
		settings.setStdinDescription("Text read by the program");
		assertTrue(settings.isEnableStdin());
		assertEquals("Text read by the program", settings.getStdinDescription());

		settings.setEnvironmentDescription("Variables");
		assertTrue(settings.isEnableEnvironment());
		settings.setWorkingDirectoryDescription("Where to run");
		assertTrue(settings.isEnableWorkingDirectory());
	}

	@Test
	public void testDescriptionString() {
		LaunchSettings settings = new LaunchSettings();
		settings.setEnableStdin(true);
		assertTrue(settings.toDescriptionString().contains("enableStdin = true\n"));
	}
}
