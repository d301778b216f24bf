package org.metricshub.jlaunch.assembly;

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
import java.util.List;
import org.metricshub.jlaunch.model.ArgSpec;
import org.metricshub.jlaunch.state.ArgState;
import org.metricshub.jlaunch.state.ArgValueVisitor;
import org.metricshub.jlaunch.state.CommandState;
import org.metricshub.jlaunch.state.CounterValue;
import org.metricshub.jlaunch.state.FlagValue;
import org.metricshub.jlaunch.state.MultipleValue;
import org.metricshub.jlaunch.state.SingleValue;
import org.metricshub.jlaunch.state.ValueEntry;
import org.metricshub.jlaunch.util.MessageId;

/**
 * Turns a {@link CommandState} tree into the list of arguments to pass to the
 * program.
 * <p>
 * Arguments are written command by command, each in declaration order: a
 * single value as {@code token value} (or {@code token=value}, or the bare
 * value of a positional argument), each entry of a multi-value argument the
 * same way, a flag as its token when set, a counter as its token repeated. The
 * name of the selected sub-command follows, then its own arguments.
 * <p>
 * The assembly is deterministic and does not modify the tree. The name of the
 * top-level command is not written: the caller prepends the executable.
 */
public final class ArgumentAssembler {

	private ArgumentAssembler() {}

	/**
	 * Assembles the arguments of the specified command tree.
	 *
	 * @param root state of the top-level command
	 * @return the arguments, in command-line order
	 * @throws ValidationException if a required single value is empty
	 *         ({@link MessageId#REQUIRED_FIELD_MISSING}) or a required
	 *         sub-command is not selected ({@link MessageId#SUBCOMMAND_MISSING})
	 */
	public static List<String> assemble(CommandState root) throws ValidationException {
		List<String> args = new ArrayList<String>();
		assemble(root, new ArrayList<String>(), args);
		return args;
	}

	private static void assemble(CommandState node, List<String> path, List<String> args) throws ValidationException {
		for (ArgState state : node.getArgStates()) {
			ValidationException failure = state.getValue().accept(new ValueWriter(state.getSpec(), path, args));
			if (failure != null) {
				throw failure;
			}
		}

		CommandState child = node.getSelectedChild();
		if (child != null) {
			args.add(node.getSelectedSubcommand());
			path.add(node.getSelectedSubcommand());
			assemble(child, path, args);
			path.remove(path.size() - 1);
		} else if (node.getModel().isSubcommandRequired()) {
			throw new ValidationException(
					MessageId.SUBCOMMAND_MISSING,
					null,
					node.getModel().getDisplayName(),
					path,
					null);
		}
	}

	/**
	 * Writes one value, or returns the validation failure it causes.
	 */
	private static final class ValueWriter implements ArgValueVisitor<ValidationException> {

		private final ArgSpec spec;
		private final List<String> path;
		private final List<String> args;

		private ValueWriter(ArgSpec spec, List<String> path, List<String> args) {
			this.spec = spec;
			this.path = path;
			this.args = args;
		}

		@Override
		public ValidationException visitSingle(SingleValue value) {
			if (!value.isEmpty()) {
				spec.appendValue(value.getText(), args);
			} else if (spec.isRequired()) {
				return new ValidationException(
						MessageId.REQUIRED_FIELD_MISSING,
						spec.getId(),
						spec.getDisplayName(),
						path,
						null);
			}
			return null;
		}

		@Override
		public ValidationException visitMultiple(MultipleValue value) {
			for (ValueEntry entry : value.getEntries()) {
				spec.appendValue(entry.getText(), args);
			}
			return null;
		}

		@Override
		public ValidationException visitFlag(FlagValue value) {
			if (value.isSet()) {
				args.add(spec.getInvocationToken());
			}
			return null;
		}

		@Override
		public ValidationException visitCounter(CounterValue value) {
			for (int i = 0; i < value.getCount(); i++) {
				args.add(spec.getInvocationToken());
			}
			return null;
		}
	}
}
