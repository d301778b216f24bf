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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jlaunch.schema.ArgAction;
import org.metricshub.jlaunch.schema.ArgumentDefinition;
import org.metricshub.jlaunch.schema.CommandDefinition;
import org.metricshub.jlaunch.schema.ValueHint;

public class ArgSpecTest {

	@Test
	public void testLongNameIsPreferred() {
		ArgSpec spec = ArgSpec.from(ArgumentDefinition.builder("output").longName("output").shortName('o').build());
		assertEquals("--output", spec.getInvocationToken());
		assertFalse(spec.isPositional());
	}

	@Test
	public void testLongNameWithDashes() {
		ArgSpec spec = ArgSpec.from(ArgumentDefinition.builder("output").longName("--output").build());
		assertEquals("--output", spec.getInvocationToken());
	}

	@Test
	public void testShortName() {
		ArgSpec spec = ArgSpec.from(ArgumentDefinition.builder("verbose").shortName('v').action(ArgAction.COUNT).build());
		assertEquals("-v", spec.getInvocationToken());
		assertEquals(Cardinality.COUNTER, spec.getCardinality());
	}

	@Test
	public void testPositional() {
		ArgSpec spec = ArgSpec.from(ArgumentDefinition.builder("input_file").build());
		assertNull(spec.getInvocationToken());
		assertTrue(spec.isPositional());
		assertEquals("Input file", spec.getDisplayName());
		assertEquals(Cardinality.SINGLE, spec.getCardinality());
	}

	@Test(expected = SchemaException.class)
	public void testFlagWithoutToken() {
		ArgSpec.from(ArgumentDefinition.builder("quiet").action(ArgAction.SET_TRUE).build());
	}

	@Test(expected = SchemaException.class)
	public void testCounterWithoutToken() {
		ArgSpec.from(ArgumentDefinition.builder("verbose").action(ArgAction.COUNT).build());
	}

	@Test
	public void testCardinalities() {
		assertEquals(Cardinality.SINGLE, Cardinality.of(ArgAction.SET));
		assertEquals(Cardinality.MULTIPLE, Cardinality.of(ArgAction.APPEND));
		assertEquals(Cardinality.FLAG, Cardinality.of(ArgAction.SET_TRUE));
		assertEquals(Cardinality.FLAG, Cardinality.of(ArgAction.SET_FALSE));
		assertEquals(Cardinality.COUNTER, Cardinality.of(ArgAction.COUNT));
	}

	@Test
	public void testPathHints() {
		assertEquals(PathHint.NONE, PathHint.of(ValueHint.NONE));
		assertEquals(PathHint.FILE, PathHint.of(ValueHint.FILE_PATH));
		assertEquals(PathHint.FILE, PathHint.of(ValueHint.EXECUTABLE_PATH));
		assertEquals(PathHint.DIRECTORY, PathHint.of(ValueHint.DIR_PATH));
		assertEquals(PathHint.EITHER, PathHint.of(ValueHint.ANY_PATH));
	}

	@Test
	public void testHelpText() {
		assertEquals(
				"Long help",
				ArgSpec.from(ArgumentDefinition.builder("a").help("Short help").longHelp("Long help").build()).getHelpText());
		assertEquals("Short help", ArgSpec.from(ArgumentDefinition.builder("a").help("Short help").build()).getHelpText());
		assertNull(ArgSpec.from(ArgumentDefinition.builder("a").build()).getHelpText());
	}

	@Test
	public void testDefaultsAndChoices() {
		ArgSpec spec = ArgSpec.from(
				ArgumentDefinition.builder("mode").longName("mode").defaultValues("fast").possibleValues("fast", "slow").build());
		assertEquals("fast", spec.getDefaultValue());
		assertEquals(Arrays.asList("fast", "slow"), spec.getAllowedValues());
		assertTrue(spec.isClosedChoice());

		ArgSpec free = ArgSpec.from(ArgumentDefinition.builder("name").longName("name").build());
		assertNull(free.getDefaultValue());
		assertFalse(free.isClosedChoice());
	}

	@Test
	public void testAppendValue() {
		List<String> args = new ArrayList<String>();
		ArgSpec.from(ArgumentDefinition.builder("name").longName("name").build()).appendValue("x", args);
		ArgSpec.from(ArgumentDefinition.builder("level").shortName('l').requireEquals(true).build()).appendValue("2", args);
		ArgSpec.from(ArgumentDefinition.builder("file").build()).appendValue("a b", args);
		assertEquals(Arrays.asList("--name", "x", "-l=2", "a b"), args);
	}

	@Test
	public void testCommandModel() {
		CommandModel model = CommandModel.from(
				CommandDefinition
						.builder("my_tool")
						.argument(ArgumentDefinition.builder("name").longName("name"))
						.subcommandRequired(true)
						.build());
		assertEquals("My tool", model.getDisplayName());
		assertNotNull(model.getArgSpec("name"));
		assertNull(model.getArgSpec("other"));
		assertFalse(model.hasSubcommands());
		// nothing to select
		assertFalse(model.isSubcommandRequired());
	}
}
