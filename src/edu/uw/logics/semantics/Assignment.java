package edu.uw.logics.semantics;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * Values of free variables during evaluation. Assignments are persistent: {@link #bind} returns a new assignment
 * that shadows any earlier value of the variable and leaves the receiver untouched, so a quantifier can hand each
 * element of its range to the body without restoring anything afterwards.
 */
public final class Assignment {
	private static final Assignment EMPTY = new Assignment(null, null, null);

	private final String variable;
	private final Object value;
	private final Assignment parent;

	private Assignment(final String variable, final Object value, final Assignment parent) {
		this.variable = variable;
		this.value = value;
		this.parent = parent;
	}

	public static Assignment empty() {
		return EMPTY;
	}

	public static Assignment of(final Map<String, ?> values) {
		Assignment result = EMPTY;
		for (final Map.Entry<String, ?> entry : values.entrySet()) {
			result = result.bind(entry.getKey(), entry.getValue());
		}
		return result;
	}

	public Assignment bind(final String newVariable, final Object newValue) {
		return new Assignment(Preconditions.checkNotNull(newVariable), Preconditions.checkNotNull(newValue), this);
	}

	/**
	 * The value of the variable, or null if it is unassigned.
	 */
	public Object get(final String name) {
		for (Assignment current = this; current != EMPTY; current = current.parent) {
			if (current.variable.equals(name)) {
				return current.value;
			}
		}
		return null;
	}

	public boolean contains(final String name) {
		return get(name) != null;
	}

	public ImmutableMap<String, Object> asMap() {
		final Map<String, Object> result = new LinkedHashMap<>();
		for (Assignment current = this; current != EMPTY; current = current.parent) {
			result.putIfAbsent(current.variable, current.value);
		}
		return ImmutableMap.copyOf(result);
	}

	@Override
	public String toString() {
		return asMap().toString();
	}
}
