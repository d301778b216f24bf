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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jlaunch.model.ArgSpec;
import org.metricshub.jlaunch.model.CommandModel;

/**
 * Runtime state of a command: the value of each of its arguments and, when
 * the command has sub-commands, the state of the selected one.
 * <p>
 * The tree is built once from the {@link CommandModel} and then mutated in
 * place. Only the argument values and the sub-command selections change:
 * selecting a sub-command always creates a fresh child state, so the edits
 * made in a previously selected branch are lost.
 * <p>
 * This class is not thread-safe; it is owned by the controlling thread.
 */
public final class CommandState {

	private final CommandModel model;
	private final Map<String, ArgState> argStates = new LinkedHashMap<String, ArgState>();
	private String selectedSubcommand;
	private CommandState selectedChild;

	/**
	 * Builds the state of the specified command, with every argument empty and
	 * no sub-command selected.
	 *
	 * @param model the command model
	 */
	public CommandState(CommandModel model) {
		this.model = model;
		for (ArgSpec spec : model.getArgSpecs()) {
			argStates.put(spec.getId(), new ArgState(spec));
		}
	}

	public CommandModel getModel() {
		return model;
	}

	/**
	 * @return the states of the arguments, in declaration order
	 */
	public Collection<ArgState> getArgStates() {
		return Collections.unmodifiableCollection(argStates.values());
	}

	/**
	 * @param id identifier of an argument of this command
	 * @return its state
	 * @throws IllegalArgumentException if this command has no such argument
	 */
	public ArgState getArgState(String id) {
		ArgState state = argStates.get(id);
		if (state == null) {
			throw new IllegalArgumentException("Command '" + model.getName() + "' has no argument '" + id + "'");
		}
		return state;
	}

	/**
	 * @return the name of the selected sub-command, or {@code null}
	 */
	public String getSelectedSubcommand() {
		return selectedSubcommand;
	}

	/**
	 * @return the state of the selected sub-command, or {@code null}
	 */
	public CommandState getSelectedChild() {
		return selectedChild;
	}

	public void setSingle(String id, String text) {
		getArgState(id).setSingle(text);
	}

	public void addMultiple(String id, String text) {
		getArgState(id).addMultiple(text);
	}

	public void setMultipleEntry(String id, int index, String text) {
		getArgState(id).setMultiple(index, text);
	}

	public void removeMultiple(String id, int index) {
		getArgState(id).removeMultiple(index);
	}

	/**
	 * Replaces all the values of a multi-value argument with its default values
	 * (which clears it when it has none).
	 *
	 * @param id identifier of the argument
	 */
	public void resetMultipleToDefault(String id) {
		getArgState(id).resetMultipleToDefault();
	}

	public void toggleFlag(String id) {
		getArgState(id).toggleFlag();
	}

	public void setFlag(String id, boolean set) {
		getArgState(id).setFlag(set);
	}

	public void incrementCounter(String id) {
		getArgState(id).incrementCounter();
	}

	/**
	 * Decrements a counter; a counter at 0 stays at 0.
	 *
	 * @param id identifier of the argument
	 */
	public void decrementCounter(String id) {
		getArgState(id).decrementCounter();
	}

	/**
	 * Selects a sub-command of this command, replacing the previous selection
	 * with a fresh state. Passing {@code null} clears the selection.
	 *
	 * @param name name of the sub-command, or {@code null}
	 * @return the new state of the selected sub-command, or {@code null}
	 * @throws IllegalArgumentException if this command has no such sub-command
	 */
	public CommandState selectSubcommand(String name) {
		if (name == null) {
			selectedSubcommand = null;
			selectedChild = null;
			return null;
		}
		CommandModel child = model.getSubcommands().get(name);
		if (child == null) {
			throw new IllegalArgumentException("Command '" + model.getName() + "' has no subcommand '" + name + "'");
		}
		selectedSubcommand = name;
		selectedChild = new CommandState(child);
		return selectedChild;
	}

	/**
	 * Selects a sub-command of the node at the specified path.
	 *
	 * @param path names of the selected sub-commands leading to the node, empty for this node
	 * @param name name of the sub-command to select, or {@code null}
	 * @return the new state of the selected sub-command, or {@code null}
	 * @see #findNode(List)
	 */
	public CommandState selectSubcommand(List<String> path, String name) {
		return findNode(path).selectSubcommand(name);
	}

	/**
	 * Follows the selected sub-commands along the specified path.
	 *
	 * @param path names of the selected sub-commands, from this node down
	 * @return the node at the end of the path
	 * @throws IllegalArgumentException if a name of the path is not the selected sub-command
	 */
	public CommandState findNode(List<String> path) {
		CommandState node = this;
		for (String name : path) {
			if (node.selectedChild == null || !name.equals(node.selectedSubcommand)) {
				throw new IllegalArgumentException("Subcommand '" + name + "' is not selected in '" + node.model.getName() + "'");
			}
			node = node.selectedChild;
		}
		return node;
	}

	/**
	 * Paints a validation error on the argument with the specified identifier,
	 * looking in this command first, then down the selected sub-commands. An
	 * identifier that matches no argument is ignored.
	 *
	 * @param id identifier of the argument
	 * @param message the error message
	 * @return whether an argument was found
	 */
	public boolean applyValidationError(String id, String message) {
		ArgState state = argStates.get(id);
		if (state != null) {
			state.setValidationError(message);
			return true;
		}
		return selectedChild != null && selectedChild.applyValidationError(id, message);
	}

	/**
	 * Clears the validation errors of this command and of the selected sub-commands.
	 */
	public void clearValidationErrors() {
		for (ArgState state : argStates.values()) {
			state.setValidationError(null);
		}
		if (selectedChild != null) {
			selectedChild.clearValidationErrors();
		}
	}

	/**
	 * @return the arguments of this command and of the selected sub-commands
	 *         that carry a validation error
	 */
	public List<ArgState> getArgStatesWithError() {
		List<ArgState> result = new ArrayList<ArgState>();
		collectErrors(result);
		return result;
	}

	private void collectErrors(List<ArgState> result) {
		for (ArgState state : argStates.values()) {
			if (state.hasValidationError()) {
				result.add(state);
			}
		}
		if (selectedChild != null) {
			selectedChild.collectErrors(result);
		}
	}

	@Override
	public String toString() {
		return model.getName() + argStates.values() + (selectedChild == null ? "" : " " + selectedChild);
	}
}
