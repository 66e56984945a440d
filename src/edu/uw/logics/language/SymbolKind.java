package edu.uw.logics.language;

/**
 * The syntactic categories a {@link Language} sorts its symbols into.
 */
public enum SymbolKind {
	INDIVIDUAL_CONSTANT, VARIABLE, PREDICATE_LETTER, PREDICATE_VARIABLE, FUNCTION_SYMBOL, QUANTIFIER, CONNECTIVE,
	SENTENTIAL_CONSTANT, SENTENTIAL_METAVARIABLE, INDIVIDUAL_METAVARIABLE, VARIABLE_METAVARIABLE,
	PREDICATE_METAVARIABLE;

	public boolean isMetavariable() {
		return this == SENTENTIAL_METAVARIABLE || this == INDIVIDUAL_METAVARIABLE || this == VARIABLE_METAVARIABLE
				|| this == PREDICATE_METAVARIABLE;
	}
}
