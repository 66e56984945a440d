package edu.uw.logics.unification;

import edu.uw.logics.formula.Substitution;

/**
 * Outcome of matching a formula against a schema. When the match fails the substitution holds whatever was bound
 * before the failure, which is only useful for diagnostics.
 */
public class MatchResult {
	private final boolean isMatch;
	private final Substitution substitution;

	MatchResult(final boolean isMatch, final Substitution substitution) {
		this.isMatch = isMatch;
		this.substitution = substitution;
	}

	public boolean isMatch() {
		return isMatch;
	}

	public Substitution getSubstitution() {
		return substitution;
	}

	@Override
	public String toString() {
		return (isMatch ? "match " : "no match ") + substitution;
	}
}
