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

import java.util.List;
import org.metricshub.jlaunch.model.ArgSpec;
import org.metricshub.jlaunch.model.Cardinality;
import org.metricshub.jlaunch.util.Localization;
import org.metricshub.jlaunch.util.MessageId;

/**
 * The spec of an argument, its current value, and the validation error
 * painted on it by the last run attempt, if any.
 * <p>
 * Every change of the value clears the validation error.
 */
public final class ArgState {

	private final ArgSpec spec;
	private final ArgValue value;
	private String validationError;

	ArgState(ArgSpec spec) {
		this.spec = spec;
		this.value = ArgValue.empty(spec.getCardinality());
	}

	public ArgSpec getSpec() {
		return spec;
	}

	public String getId() {
		return spec.getId();
	}

	public ArgValue getValue() {
		return value;
	}

	/**
	 * @return the message of the last validation failure of this argument, or {@code null}
	 */
	public String getValidationError() {
		return validationError;
	}

	public boolean hasValidationError() {
		return validationError != null;
	}

	void setValidationError(String validationError) {
		this.validationError = validationError;
	}

	/**
	 * Whether the presentation layer should highlight this argument: either a
	 * validation error is painted on it, or it is a required single value still empty.
	 *
	 * @return {@code true} to highlight
	 */
	public boolean isHighlighted() {
		return validationError != null
				|| (spec.isRequired() && spec.getCardinality() == Cardinality.SINGLE && value.isEmpty());
	}

	/**
	 * Returns the hint shown in an empty text field: the default value if there
	 * is one, the localized "optional" label for an optional argument, nothing
	 * otherwise.
	 *
	 * @param localization the lookup table of user-facing text
	 * @return the placeholder text, possibly empty
	 */
	public String getPlaceholder(Localization localization) {
		String defaultValue = spec.getDefaultValue();
		if (defaultValue != null) {
			return defaultValue;
		}
		if (!spec.isRequired()) {
			return localization.get(MessageId.OPTIONAL);
		}
		return "";
	}

	void setSingle(String text) {
		as(SingleValue.class).setText(text);
		validationError = null;
	}

	void addMultiple(String text) {
		as(MultipleValue.class).add(text);
		validationError = null;
	}

	void setMultiple(int index, String text) {
		as(MultipleValue.class).set(index, text);
		validationError = null;
	}

	void removeMultiple(int index) {
		as(MultipleValue.class).remove(index);
		validationError = null;
	}

	void resetMultipleToDefault() {
		List<String> defaults = spec.getDefaultValues();
		as(MultipleValue.class).resetTo(defaults);
		validationError = null;
	}

	void toggleFlag() {
		as(FlagValue.class).toggle();
		validationError = null;
	}

	void setFlag(boolean set) {
		as(FlagValue.class).setSet(set);
		validationError = null;
	}

	void incrementCounter() {
		as(CounterValue.class).increment();
		validationError = null;
	}

	void decrementCounter() {
		as(CounterValue.class).decrement();
		validationError = null;
	}

	private <T extends ArgValue> T as(Class<T> type) {
		if (!type.isInstance(value)) {
			throw new IllegalArgumentException(
					"Argument '" + spec.getId() + "' holds a " + value.getCardinality() + " value, not a "
							+ type.getSimpleName());
		}
		return type.cast(value);
	}

	@Override
	public String toString() {
		return spec.getId() + "=" + value;
	}
}
