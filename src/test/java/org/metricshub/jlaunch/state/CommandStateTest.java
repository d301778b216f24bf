package org.metricshub.jlaunch.state;

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

import java.util.Arrays;
import java.util.Collections;
import org.junit.Before;
import org.junit.Test;
import org.metricshub.jlaunch.JLaunchTestSupport;
import org.metricshub.jlaunch.model.CommandModel;
import org.metricshub.jlaunch.schema.ArgAction;
import org.metricshub.jlaunch.schema.ArgumentDefinition;
import org.metricshub.jlaunch.schema.CommandDefinition;
import org.metricshub.jlaunch.util.Localization;

public class CommandStateTest {

	private CommandState root;

	@Before
	public void setUp() {
		root = new CommandState(CommandModel.from(JLaunchTestSupport.toolDefinition()));
	}

	@Test
	public void testInitialValues() {
		assertTrue(((SingleValue) root.getArgState("output_file").getValue()).isEmpty());
		assertEquals("", ((SingleValue) root.getArgState("output_file").getValue()).getText());
		assertEquals(0, ((MultipleValue) root.getArgState("define").getValue()).size());
		assertFalse(((FlagValue) root.getArgState("quiet").getValue()).isSet());
		assertEquals(0, ((CounterValue) root.getArgState("verbose").getValue()).getCount());
		assertNull(root.getSelectedSubcommand());
		assertNull(root.getSelectedChild());
	}

	@Test
	public void testDeclarationOrder() {
		StringBuilder ids = new StringBuilder();
		for (ArgState state : root.getArgStates()) {
			ids.append(state.getId()).append(' ');
		}
		assertEquals("verbose quiet output_file define input ", ids.toString());
	}

	@Test
	public void testSetSingle() {
		root.setSingle("output_file", "out.txt");
		assertEquals("out.txt", ((SingleValue) root.getArgState("output_file").getValue()).getText());
		root.setSingle("output_file", "");
		assertTrue(root.getArgState("output_file").getValue().isEmpty());
	}

	@Test
	public void testMultipleEntries() {
		root.addMultiple("define", "a=1");
		root.addMultiple("define", "b=2");
		root.addMultiple("define", "c=3");
		MultipleValue value = (MultipleValue) root.getArgState("define").getValue();
		long identity = value.getEntries().get(1).getIdentity();

		root.setMultipleEntry("define", 1, "b=20");
		assertEquals(Arrays.asList("a=1", "b=20", "c=3"), value.getTexts());
		assertEquals(identity, value.getEntries().get(1).getIdentity());

		root.removeMultiple("define", 0);
		assertEquals(Arrays.asList("b=20", "c=3"), value.getTexts());
		assertEquals(identity, value.getEntries().get(0).getIdentity());
	}

	@Test
	public void testEntryIdentitiesAreUnique() {
		root.addMultiple("define", "same");
		root.addMultiple("define", "same");
		MultipleValue value = (MultipleValue) root.getArgState("define").getValue();
		assertNotEquals(value.getEntries().get(0).getIdentity(), value.getEntries().get(1).getIdentity());
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testRemoveOutOfRange() {
		root.addMultiple("define", "a=1");
		root.removeMultiple("define", 1);
	}

	@Test
	public void testResetMultipleToDefault() {
		CommandState state = new CommandState(
				CommandModel.from(
						CommandDefinition
								.builder("cmd")
								.argument(
										ArgumentDefinition
												.builder("include")
												.longName("include")
												.action(ArgAction.APPEND)
												.defaultValues("src", "lib"))
								.build()));
		MultipleValue value = (MultipleValue) state.getArgState("include").getValue();
		assertTrue(value.isEmpty());

		state.addMultiple("include", "test");
		state.resetMultipleToDefault("include");
		assertEquals(Arrays.asList("src", "lib"), value.getTexts());
	}

	@Test
	public void testFlag() {
		root.toggleFlag("quiet");
		assertTrue(((FlagValue) root.getArgState("quiet").getValue()).isSet());
		root.toggleFlag("quiet");
		assertFalse(((FlagValue) root.getArgState("quiet").getValue()).isSet());
		root.setFlag("quiet", true);
		assertTrue(((FlagValue) root.getArgState("quiet").getValue()).isSet());
	}

	@Test
	public void testCounterFloor() {
		CounterValue value = (CounterValue) root.getArgState("verbose").getValue();
		root.decrementCounter("verbose");
		assertEquals(0, value.getCount());
		root.incrementCounter("verbose");
		root.incrementCounter("verbose");
		root.decrementCounter("verbose");
		assertEquals(1, value.getCount());
		root.decrementCounter("verbose");
		root.decrementCounter("verbose");
		assertEquals(0, value.getCount());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testWrongCardinality() {
		root.toggleFlag("output_file");
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownArgument() {
		root.setSingle("nope", "x");
	}

	@Test
	public void testSelectSubcommandDiscardsPreviousBranch() {
		CommandState build = root.selectSubcommand("build");
		build.setSingle("target", "x86");
		assertEquals("build", root.getSelectedSubcommand());
		assertSame(build, root.getSelectedChild());

		root.selectSubcommand("clean");
		CommandState rebuilt = root.selectSubcommand("build");
		assertNotSame(build, rebuilt);
		assertTrue(rebuilt.getArgState("target").getValue().isEmpty());
	}

	@Test
	public void testDeselectSubcommand() {
		root.selectSubcommand("build");
		assertNull(root.selectSubcommand(null));
		assertNull(root.getSelectedSubcommand());
		assertNull(root.getSelectedChild());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testUnknownSubcommand() {
		root.selectSubcommand("deploy");
	}

	@Test
	public void testFindNode() {
		CommandState build = root.selectSubcommand(Collections.<String>emptyList(), "build");
		assertSame(root, root.findNode(Collections.<String>emptyList()));
		assertSame(build, root.findNode(Collections.singletonList("build")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testFindNodeNotSelected() {
		root.selectSubcommand("clean");
		root.findNode(Collections.singletonList("build"));
	}

	@Test
	public void testApplyValidationError() {
		assertTrue(root.applyValidationError("output_file", "Required"));
		assertEquals("Required", root.getArgState("output_file").getValidationError());
		assertTrue(root.getArgState("output_file").isHighlighted());
		assertFalse(root.getArgState("input").hasValidationError());
		assertEquals(1, root.getArgStatesWithError().size());

		// unknown identifiers are dropped
		assertFalse(root.applyValidationError("nope", "Lost"));
		assertEquals(1, root.getArgStatesWithError().size());
	}

	@Test
	public void testApplyValidationErrorInSelectedChild() {
		CommandState build = root.selectSubcommand("build");
		assertTrue(root.applyValidationError("target", "Required"));
		assertEquals("Required", build.getArgState("target").getValidationError());
	}

	@Test
	public void testEditClearsValidationError() {
		root.applyValidationError("output_file", "Required");
		root.setSingle("output_file", "out.txt");
		assertNull(root.getArgState("output_file").getValidationError());
		assertFalse(root.getArgState("output_file").isHighlighted());
	}

	@Test
	public void testClearValidationErrors() {
		CommandState build = root.selectSubcommand("build");
		root.applyValidationError("output_file", "Required");
		build.applyValidationError("target", "Required");
		assertEquals(2, root.getArgStatesWithError().size());

		root.clearValidationErrors();
		assertTrue(root.getArgStatesWithError().isEmpty());
	}

	@Test
	public void testHighlight() {
		// required and empty
		assertTrue(root.getArgState("output_file").isHighlighted());
		assertFalse(root.getArgState("input").isHighlighted());
		assertFalse(root.getArgState("quiet").isHighlighted());
	}

	@Test
	public void testPlaceholder() {
		CommandState state = new CommandState(
				CommandModel.from(
						CommandDefinition
								.builder("cmd")
								.argument(ArgumentDefinition.builder("mode").longName("mode").defaultValues("fast"))
								.argument(ArgumentDefinition.builder("name").longName("name"))
								.argument(ArgumentDefinition.builder("target").longName("target").required(true))
								.build()));
		Localization localization = new Localization();
		assertEquals("fast", state.getArgState("mode").getPlaceholder(localization));
		assertEquals("(Optional)", state.getArgState("name").getPlaceholder(localization));
		assertEquals("", state.getArgState("target").getPlaceholder(localization));
	}
}
