package edu.uw.logics.formula;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import edu.uw.logics.language.Language;

/**
 * An individual-level expression: a symbol (constant, variable, metavariable) or a function symbol applied to
 * argument terms. Terms are immutable and compared by value.
 */
public abstract class Term implements Serializable {
	private static final long serialVersionUID = 1L;

	Term() {
	}

	public abstract boolean isAtomic();

	/**
	 * The symbol of an atomic term, or the function symbol of a compound one.
	 */
	public abstract String getSymbol();

	public List<Term> getArguments() {
		return Collections.emptyList();
	}

	/**
	 * Replace the free occurrences of `variable` with `replacement`.
	 */
	public Term vsubstitute(final String variable, final Term replacement) {
		return vsubstitute(variable, replacement, ImmutableSet.of());
	}

	abstract Term vsubstitute(String variable, Term replacement, Set<String> boundVariables);

	/**
	 * Replace individual, variable and predicate metavariables by their bindings.
	 *
	 * @throws UnboundMetavariableException
	 *             if a metavariable has no binding
	 */
	public abstract Term instantiate(Language language, Substitution substitution);

	public Set<String> freeVariables(final Language language) {
		return freeVariables(language, ImmutableSet.of());
	}

	abstract Set<String> freeVariables(Language language, Set<String> boundVariables);

	public abstract boolean isSchematic(Language language);

	public abstract boolean containsSymbol(String symbol);

	public abstract <T> T accept(TermVisitor<T> visitor);

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result);
		return result.toString();
	}

	abstract void toString(StringBuilder result);

	public interface TermVisitor<T> {
		T visit(AtomicTerm term);

		T visit(CompoundTerm term);
	}
}
