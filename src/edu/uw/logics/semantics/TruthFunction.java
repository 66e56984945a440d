package edu.uw.logics.semantics;

import java.util.List;

/**
 * Meaning of a connective or quantifier: maps the values of the arguments (for a quantifier, the values of the body
 * under every element of the range, in range order) to a truth value.
 */
@FunctionalInterface
public interface TruthFunction {
	String apply(List<String> values);
}
