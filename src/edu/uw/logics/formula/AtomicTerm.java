package edu.uw.logics.formula;

import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

import edu.uw.logics.language.Language;

public class AtomicTerm extends Term {
	private static final long serialVersionUID = 1L;

	private final String symbol;

	public AtomicTerm(final String symbol) {
		super();
		Preconditions.checkNotNull(symbol);
		Preconditions.checkArgument(!symbol.isEmpty(), "Empty symbol");
		this.symbol = symbol;
	}

	@Override
	public boolean isAtomic() {
		return true;
	}

	@Override
	public String getSymbol() {
		return symbol;
	}

	@Override
	Term vsubstitute(final String variable, final Term replacement, final Set<String> boundVariables) {
		if (symbol.equals(variable) && !boundVariables.contains(variable)) {
			return replacement;
		}
		return this;
	}

	@Override
	public Term instantiate(final Language language, final Substitution substitution) {
		if (language.isIndividualMetavariable(symbol) || language.isVariableMetavariable(symbol)
				|| language.isPredicateMetavariable(symbol)) {
			return substitution.requireTerm(symbol);
		}
		return this;
	}

	@Override
	Set<String> freeVariables(final Language language, final Set<String> boundVariables) {
		if ((language.isVariable(symbol) || language.isPredicateVariable(symbol))
				&& !boundVariables.contains(symbol)) {
			return ImmutableSet.of(symbol);
		}
		return ImmutableSet.of();
	}

	@Override
	public boolean isSchematic(final Language language) {
		return language.isMetavariable(symbol);
	}

	@Override
	public boolean containsSymbol(final String other) {
		return symbol.equals(other);
	}

	@Override
	public <T> T accept(final TermVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(symbol);
	}

	@Override
	public boolean equals(final Object obj) {
		return obj instanceof AtomicTerm && symbol.equals(((AtomicTerm) obj).symbol);
	}

	@Override
	public int hashCode() {
		return symbol.hashCode();
	}
}
