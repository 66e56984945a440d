package edu.uw.logics.instances;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.uw.logics.semantics.AtomicClause;
import edu.uw.logics.semantics.TruthFunction;
import edu.uw.logics.semantics.TruthTable;

/**
 * Truth tables and clauses shared by the predefined model theories.
 */
public final class TruthFunctions {

	public static final ImmutableList<String> CLASSICAL_VALUES = ImmutableList.of("1", "0");
	public static final ImmutableList<String> TRIVALUED_VALUES = ImmutableList.of("1", "i", "0");

	public static final ImmutableMap<String, TruthFunction> CLASSICAL_CONNECTIVES = ImmutableMap
			.<String, TruthFunction> builder()
			.put("~", TruthTable.unary(CLASSICAL_VALUES, "0", "1"))
			.put("∧", TruthTable.binary(CLASSICAL_VALUES,
					new String[] { "1", "0" },
					new String[] { "0", "0" }))
			.put("∨", TruthTable.binary(CLASSICAL_VALUES,
					new String[] { "1", "1" },
					new String[] { "1", "0" }))
			.put("→", TruthTable.binary(CLASSICAL_VALUES,
					new String[] { "1", "0" },
					new String[] { "1", "1" }))
			.put("↔", TruthTable.binary(CLASSICAL_VALUES,
					new String[] { "1", "0" },
					new String[] { "0", "1" }))
			.build();

	// Strong Kleene tables, rows and columns in the order 1 i 0.
	public static final ImmutableMap<String, TruthFunction> TRIVALUED_CONNECTIVES = ImmutableMap
			.<String, TruthFunction> builder()
			.put("~", TruthTable.unary(TRIVALUED_VALUES, "0", "i", "1"))
			.put("∧", TruthTable.binary(TRIVALUED_VALUES,
					new String[] { "1", "i", "0" },
					new String[] { "i", "i", "0" },
					new String[] { "0", "0", "0" }))
			.put("∨", TruthTable.binary(TRIVALUED_VALUES,
					new String[] { "1", "1", "1" },
					new String[] { "1", "i", "i" },
					new String[] { "1", "i", "0" }))
			.put("→", TruthTable.binary(TRIVALUED_VALUES,
					new String[] { "1", "i", "0" },
					new String[] { "1", "i", "i" },
					new String[] { "1", "1", "1" }))
			.put("↔", TruthTable.binary(TRIVALUED_VALUES,
					new String[] { "1", "i", "0" },
					new String[] { "i", "i", "i" },
					new String[] { "0", "i", "1" }))
			.build();

	public static final TruthFunction CLASSICAL_UNIVERSAL = values -> values.contains("0") ? "0" : "1";
	public static final TruthFunction CLASSICAL_EXISTENTIAL = values -> values.contains("1") ? "1" : "0";

	public static final TruthFunction TRIVALUED_UNIVERSAL = values -> firstPresent(values, "0", "i", "1");
	public static final TruthFunction TRIVALUED_EXISTENTIAL = values -> firstPresent(values, "1", "i", "0");

	/**
	 * Membership of the term denotations in the predicate's extension.
	 */
	public static final AtomicClause CLASSICAL_ATOMIC = (predicate, arguments) -> Boolean.TRUE
			.equals(predicate.apply(arguments)) ? "1" : "0";

	public static final ImmutableMap<String, String> CLASSICAL_SENTENTIAL_CONSTANTS = ImmutableMap.of("⊥", "0",
			"⊤", "1");

	private TruthFunctions() {
	}

	private static String firstPresent(final List<String> values, final String decisive, final String weaker,
			final String otherwise) {
		if (values.contains(decisive)) {
			return decisive;
		}
		return values.contains(weaker) ? weaker : otherwise;
	}
}
