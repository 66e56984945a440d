package edu.uw.logics.formula;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.logics.language.Language;

/**
 * A predicate applied to terms, P(a, f(x)), or a bare symbol: a sentential constant (⊥), a sentential metavariable
 * (A) or a packed substitution token ([α/χ]A).
 */
public class AtomicFormula extends Formula {
	private static final long serialVersionUID = 1L;

	private final String symbol;
	private final ImmutableList<Term> terms;

	public AtomicFormula(final String symbol, final Term... terms) {
		this(symbol, Arrays.asList(terms));
	}

	public AtomicFormula(final String symbol, final List<? extends Term> terms) {
		super();
		Preconditions.checkNotNull(symbol);
		Preconditions.checkArgument(!symbol.isEmpty(), "Empty symbol");
		this.symbol = symbol;
		this.terms = ImmutableList.copyOf(terms);
	}

	/**
	 * Predicate applied to atomic terms, e.g. of("R", "a", "x") for R(a, x).
	 */
	public static AtomicFormula of(final String symbol, final String... terms) {
		return new AtomicFormula(symbol, Arrays.stream(terms).map(AtomicTerm::new).collect(Collectors.toList()));
	}

	@Override
	public boolean isAtomic() {
		return true;
	}

	@Override
	public String getMainSymbol() {
		return symbol;
	}

	@Override
	public List<Formula> getArguments() {
		return ImmutableList.of();
	}

	public List<Term> getTerms() {
		return terms;
	}

	@Override
	Set<String> freeVariables(final Language language, final Set<String> boundVariables) {
		final Set<String> result = new HashSet<>();
		if (language.isPredicateVariable(symbol) && !boundVariables.contains(symbol)) {
			result.add(symbol);
		}
		for (final Term term : terms) {
			result.addAll(term.freeVariables(language, boundVariables));
		}
		return result;
	}

	@Override
	public boolean isSchematic(final Language language) {
		return language.isMetavariable(symbol) || PackedSubstitution.parse(language, symbol).isPresent()
				|| terms.stream().anyMatch(x -> x.isSchematic(language));
	}

	@Override
	public boolean containsSymbol(final String other) {
		return symbol.equals(other) || terms.stream().anyMatch(x -> x.containsSymbol(other));
	}

	@Override
	Formula vsubstitute(final String variable, final Term replacement, final Set<String> boundVariables) {
		String newSymbol = symbol;
		if (symbol.equals(variable) && !boundVariables.contains(variable)) {
			// Predicate variable in head position.
			Preconditions.checkArgument(replacement.isAtomic(), "Cannot replace predicate %s with the term %s",
					symbol, replacement);
			newSymbol = replacement.getSymbol();
		}
		return new AtomicFormula(newSymbol,
				terms.stream().map(x -> x.vsubstitute(variable, replacement, boundVariables))
						.collect(Collectors.toList()));
	}

	@Override
	public Formula instantiate(final Language language, final Substitution substitution) {
		if (language.isSententialMetavariable(symbol)) {
			return substitution.requireFormula(symbol);
		}
		final Optional<PackedSubstitution> packed = PackedSubstitution.parse(language, symbol);
		if (packed.isPresent()) {
			return packed.get().instantiate(language, substitution);
		}
		final String newSymbol = language.isPredicateMetavariable(symbol) ? substitution.requireSymbol(symbol)
				: symbol;
		return new AtomicFormula(newSymbol,
				terms.stream().map(x -> x.instantiate(language, substitution)).collect(Collectors.toList()));
	}

	@Override
	Formula withArguments(final List<Formula> arguments) {
		Preconditions.checkArgument(arguments.isEmpty(), "Atomic formulas have no subformulas");
		return this;
	}

	@Override
	public <T> T accept(final FormulaVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(symbol);
		if (terms.isEmpty()) {
			return;
		}
		result.append("(");
		boolean isFirst = true;
		for (final Term term : terms) {
			if (isFirst) {
				isFirst = false;
			} else {
				result.append(", ");
			}
			term.toString(result);
		}
		result.append(")");
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof AtomicFormula)) {
			return false;
		}
		final AtomicFormula other = (AtomicFormula) obj;
		return symbol.equals(other.symbol) && terms.equals(other.terms);
	}

	@Override
	public int hashCode() {
		return Objects.hash(symbol, terms);
	}
}
