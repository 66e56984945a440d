package edu.uw.logics.semantics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/**
 * A truth function given by its table over a fixed, ordered list of truth values. Rows and columns follow the order
 * of the truth values: for values [1, 0], binary(values, {{"1", "0"}, {"0", "0"}}) is classical conjunction.
 */
public class TruthTable implements TruthFunction {
	private final ImmutableList<String> truthValues;
	private final int arity;
	private final ImmutableMap<List<String>, String> entries;

	private TruthTable(final List<String> truthValues, final int arity, final Map<List<String>, String> entries) {
		this.truthValues = ImmutableList.copyOf(truthValues);
		this.arity = arity;
		this.entries = ImmutableMap.copyOf(entries);
	}

	public static TruthTable unary(final List<String> truthValues, final String... column) {
		Preconditions.checkArgument(column.length == truthValues.size(),
				"Unary table needs %s entries, got %s", truthValues.size(), column.length);
		final ImmutableMap.Builder<List<String>, String> entries = ImmutableMap.builder();
		for (int i = 0; i < column.length; i++) {
			entries.put(ImmutableList.of(truthValues.get(i)), checkValue(truthValues, column[i]));
		}
		return new TruthTable(truthValues, 1, entries.build());
	}

	public static TruthTable binary(final List<String> truthValues, final String[]... rows) {
		Preconditions.checkArgument(rows.length == truthValues.size(), "Binary table needs %s rows, got %s",
				truthValues.size(), rows.length);
		final ImmutableMap.Builder<List<String>, String> entries = ImmutableMap.builder();
		for (int i = 0; i < rows.length; i++) {
			Preconditions.checkArgument(rows[i].length == truthValues.size(), "Row %s needs %s entries", i,
					truthValues.size());
			for (int j = 0; j < rows[i].length; j++) {
				entries.put(ImmutableList.of(truthValues.get(i), truthValues.get(j)),
						checkValue(truthValues, rows[i][j]));
			}
		}
		return new TruthTable(truthValues, 2, entries.build());
	}

	/**
	 * Tabulates a truth function of any arity over the given values.
	 */
	public static TruthTable tabulate(final List<String> truthValues, final int arity,
			final TruthFunction function) {
		final ImmutableMap.Builder<List<String>, String> entries = ImmutableMap.builder();
		for (final List<String> arguments : allArguments(truthValues, arity)) {
			entries.put(ImmutableList.copyOf(arguments), checkValue(truthValues, function.apply(arguments)));
		}
		return new TruthTable(truthValues, arity, entries.build());
	}

	static List<List<String>> allArguments(final List<String> truthValues, final int arity) {
		final List<List<String>> axes = new ArrayList<>(arity);
		for (int i = 0; i < arity; i++) {
			axes.add(truthValues);
		}
		return Lists.cartesianProduct(axes);
	}

	private static String checkValue(final List<String> truthValues, final String value) {
		Preconditions.checkArgument(truthValues.contains(value), "%s is not one of the truth values %s", value,
				truthValues);
		return value;
	}

	/**
	 * @throws IllegalArgumentException
	 *             for the wrong number of arguments or values outside the table
	 */
	@Override
	public String apply(final List<String> values) {
		final String result = entries.get(values);
		if (result == null) {
			throw new IllegalArgumentException("No entry for " + values + " in table over " + truthValues);
		}
		return result;
	}

	public int getArity() {
		return arity;
	}

	public ImmutableList<String> getTruthValues() {
		return truthValues;
	}

	@Override
	public String toString() {
		return entries.toString();
	}
}
