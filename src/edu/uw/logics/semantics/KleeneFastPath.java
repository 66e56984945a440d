package edu.uw.logics.semantics;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;

/**
 * Short-circuiting clauses for ~, ∧, ∨, →, ↔, ∀ and ∃ under the strong Kleene tables over "1", "i" and "0" (the
 * classical tables are their restriction to "1" and "0"). A false conjunct decides a conjunction without evaluating
 * the other one, and a quantifier stops at the first element that decides it.
 *
 * Only valid for theories whose tables agree with these clauses, see {@link #checkAgrees}.
 */
final class KleeneFastPath {
	private static final Logger LOG = LogManager.getLogger();

	static final String TRUE = "1";
	static final String UNDETERMINED = "i";
	static final String FALSE = "0";

	static final ImmutableSet<String> TRUTH_VALUES = ImmutableSet.of(TRUE, UNDETERMINED, FALSE);
	static final ImmutableMap<String, Integer> CONNECTIVES = ImmutableMap.of("~", 1, "∧", 2, "∨", 2, "→", 2, "↔", 2);
	static final ImmutableSet<String> QUANTIFIERS = ImmutableSet.of("∀", "∃");

	// Longest value sequence compared against a quantifier's truth function.
	private static final int MAX_CHECKED_RANGE = 3;

	private KleeneFastPath() {
	}

	static boolean handlesConnective(final String connective, final int arity) {
		return CONNECTIVES.containsKey(connective) && CONNECTIVES.get(connective) == arity;
	}

	static boolean handlesQuantifier(final String quantifier) {
		return QUANTIFIERS.contains(quantifier);
	}

	/**
	 * Value of a molecular formula. The suppliers evaluate the arguments and are only called when needed.
	 */
	static String molecular(final String connective, final List<Supplier<String>> arguments) {
		switch (connective) {
		case "~":
			return negation(arguments.get(0).get());
		case "∧": {
			final String first = arguments.get(0).get();
			if (FALSE.equals(first)) {
				return FALSE;
			}
			final String second = arguments.get(1).get();
			if (FALSE.equals(second)) {
				return FALSE;
			}
			return TRUE.equals(first) && TRUE.equals(second) ? TRUE : UNDETERMINED;
		}
		case "∨": {
			final String first = arguments.get(0).get();
			if (TRUE.equals(first)) {
				return TRUE;
			}
			final String second = arguments.get(1).get();
			if (TRUE.equals(second)) {
				return TRUE;
			}
			return FALSE.equals(first) && FALSE.equals(second) ? FALSE : UNDETERMINED;
		}
		case "→": {
			final String first = arguments.get(0).get();
			if (FALSE.equals(first)) {
				return TRUE;
			}
			final String second = arguments.get(1).get();
			if (TRUE.equals(second)) {
				return TRUE;
			}
			return TRUE.equals(first) && FALSE.equals(second) ? FALSE : UNDETERMINED;
		}
		case "↔": {
			final String first = arguments.get(0).get();
			if (UNDETERMINED.equals(first)) {
				return UNDETERMINED;
			}
			final String second = arguments.get(1).get();
			if (UNDETERMINED.equals(second)) {
				return UNDETERMINED;
			}
			return first.equals(second) ? TRUE : FALSE;
		}
		default:
			throw new IllegalArgumentException("No fast clause for " + connective);
		}
	}

	private static String negation(final String value) {
		if (TRUE.equals(value)) {
			return FALSE;
		} else if (FALSE.equals(value)) {
			return TRUE;
		}
		return UNDETERMINED;
	}

	/**
	 * Folds the values of a quantified body, pulling them one at a time and stopping once the result is decided.
	 */
	static String quantifier(final String quantifier, final Iterator<String> values) {
		final boolean universal;
		if ("∀".equals(quantifier)) {
			universal = true;
		} else if ("∃".equals(quantifier)) {
			universal = false;
		} else {
			throw new IllegalArgumentException("No fast clause for " + quantifier);
		}
		final String decisive = universal ? FALSE : TRUE;
		String result = universal ? TRUE : FALSE;
		int evaluated = 0;
		while (values.hasNext()) {
			final String value = values.next();
			evaluated++;
			if (decisive.equals(value)) {
				LOG.trace("{} decided after {} elements", quantifier, evaluated);
				return decisive;
			} else if (UNDETERMINED.equals(value)) {
				result = UNDETERMINED;
			}
		}
		return result;
	}

	/**
	 * Throws if the truth function disagrees with the fast clause for the symbol on some argument values.
	 */
	static void checkAgrees(final String symbol, final TruthFunction function, final List<String> truthValues) {
		if (CONNECTIVES.containsKey(symbol)) {
			for (final List<String> arguments : TruthTable.allArguments(truthValues, CONNECTIVES.get(symbol))) {
				final List<Supplier<String>> suppliers = ImmutableList.copyOf(Iterators
						.transform(arguments.iterator(), value -> (Supplier<String>) () -> value));
				checkSame(symbol, arguments, function.apply(arguments), molecular(symbol, suppliers));
			}
		} else if (QUANTIFIERS.contains(symbol)) {
			for (int length = 0; length <= MAX_CHECKED_RANGE; length++) {
				for (final List<String> arguments : TruthTable.allArguments(truthValues, length)) {
					checkSame(symbol, arguments, function.apply(arguments),
							quantifier(symbol, arguments.iterator()));
				}
			}
		}
	}

	private static void checkSame(final String symbol, final List<String> arguments, final String expected,
			final String fast) {
		if (!expected.equals(fast)) {
			throw new IllegalArgumentException("Fast valuation of " + symbol + " gives " + fast + " for "
					+ arguments + " but its truth function gives " + expected);
		}
	}
}
