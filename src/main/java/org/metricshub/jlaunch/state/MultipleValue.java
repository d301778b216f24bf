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
import java.util.Collections;
import java.util.List;
import org.metricshub.jlaunch.model.Cardinality;

/**
 * An ordered list of text values, which the user extends and shrinks.
 */
public final class MultipleValue extends ArgValue {

	private final List<ValueEntry> entries = new ArrayList<ValueEntry>();

	MultipleValue() {}

	/**
	 * @return read-only view of the entries, in command-line order
	 */
	public List<ValueEntry> getEntries() {
		return Collections.unmodifiableList(entries);
	}

	/**
	 * @return the texts of the entries, in command-line order
	 */
	public List<String> getTexts() {
		List<String> texts = new ArrayList<String>(entries.size());
		for (ValueEntry entry : entries) {
			texts.add(entry.getText());
		}
		return texts;
	}

	public int size() {
		return entries.size();
	}

	void add(String text) {
		entries.add(ValueEntry.create(text));
	}

	void set(int index, String text) {
		checkIndex(index);
		entries.set(index, entries.get(index).withText(text));
	}

	void remove(int index) {
		checkIndex(index);
		entries.remove(index);
	}

	void resetTo(List<String> texts) {
		entries.clear();
		for (String text : texts) {
			entries.add(ValueEntry.create(text));
		}
	}

	private void checkIndex(int index) {
		if (index < 0 || index >= entries.size()) {
			throw new IndexOutOfBoundsException("Index " + index + " out of " + entries.size() + " values");
		}
	}

	@Override
	public Cardinality getCardinality() {
		return Cardinality.MULTIPLE;
	}

	@Override
	public boolean isEmpty() {
		return entries.isEmpty();
	}

	@Override
	public <R> R accept(ArgValueVisitor<R> visitor) {
		return visitor.visitMultiple(this);
	}

	@Override
	public String toString() {
		return getTexts().toString();
	}
}
