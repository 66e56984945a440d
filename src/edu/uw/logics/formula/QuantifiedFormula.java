package edu.uw.logics.formula;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.logics.language.Language;

/**
 * ∀x (body), or the bounded form ∀x ∈ t (body) where x ranges over the denotation of the restriction term t.
 *
 * The restriction term is outside the scope of the quantifier: the x in ∀x ∈ f(x) (P(x)) is free in f(x).
 */
public class QuantifiedFormula extends Formula {
	private static final long serialVersionUID = 1L;

	private final String quantifier;
	private final String variable;
	// null for unbounded quantification
	private final Term restriction;
	private final Formula body;

	public QuantifiedFormula(final String quantifier, final String variable, final Formula body) {
		this(quantifier, variable, null, body);
	}

	public QuantifiedFormula(final String quantifier, final String variable, final Term restriction,
			final Formula body) {
		super();
		this.quantifier = Preconditions.checkNotNull(quantifier);
		this.variable = Preconditions.checkNotNull(variable);
		this.restriction = restriction;
		this.body = Preconditions.checkNotNull(body);
	}

	public String getQuantifier() {
		return quantifier;
	}

	public String getVariable() {
		return variable;
	}

	public boolean isBounded() {
		return restriction != null;
	}

	/**
	 * The restriction term, or null if the quantifier is not bounded.
	 */
	public Term getRestriction() {
		return restriction;
	}

	public Formula getBody() {
		return body;
	}

	@Override
	public boolean isAtomic() {
		return false;
	}

	@Override
	public String getMainSymbol() {
		return quantifier;
	}

	@Override
	public List<Formula> getArguments() {
		return ImmutableList.of(body);
	}

	private Set<String> bind(final Set<String> boundVariables) {
		return ImmutableSet.<String> builder().addAll(boundVariables).add(variable).build();
	}

	@Override
	Set<String> freeVariables(final Language language, final Set<String> boundVariables) {
		final Set<String> result = new HashSet<>();
		if (restriction != null) {
			result.addAll(restriction.freeVariables(language, boundVariables));
		}
		result.addAll(body.freeVariables(language, bind(boundVariables)));
		return result;
	}

	@Override
	public boolean isSchematic(final Language language) {
		return language.isMetavariable(variable) || (restriction != null && restriction.isSchematic(language))
				|| body.isSchematic(language);
	}

	@Override
	public boolean containsSymbol(final String symbol) {
		return quantifier.equals(symbol) || variable.equals(symbol)
				|| (restriction != null && restriction.containsSymbol(symbol)) || body.containsSymbol(symbol);
	}

	@Override
	Formula vsubstitute(final String oldVariable, final Term replacement, final Set<String> boundVariables) {
		final Term newRestriction = restriction == null ? null
				: restriction.vsubstitute(oldVariable, replacement, boundVariables);
		return new QuantifiedFormula(quantifier, variable, newRestriction,
				body.vsubstitute(oldVariable, replacement, bind(boundVariables)));
	}

	@Override
	public Formula instantiate(final Language language, final Substitution substitution) {
		final String newVariable = language.isMetavariable(variable) ? substitution.requireSymbol(variable)
				: variable;
		final Term newRestriction = restriction == null ? null : restriction.instantiate(language, substitution);
		return new QuantifiedFormula(quantifier, newVariable, newRestriction,
				body.instantiate(language, substitution));
	}

	@Override
	Formula withArguments(final List<Formula> arguments) {
		Preconditions.checkArgument(arguments.size() == 1, "Quantified formulas have exactly one subformula");
		return new QuantifiedFormula(quantifier, variable, restriction, arguments.get(0));
	}

	@Override
	public <T> T accept(final FormulaVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(quantifier);
		result.append(variable);
		if (restriction != null) {
			result.append(" ∈ ");
			restriction.toString(result);
		}
		result.append(" (");
		body.toString(result);
		result.append(")");
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof QuantifiedFormula)) {
			return false;
		}
		final QuantifiedFormula other = (QuantifiedFormula) obj;
		return quantifier.equals(other.quantifier) && variable.equals(other.variable)
				&& Objects.equals(restriction, other.restriction) && body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(quantifier, variable, restriction, body);
	}
}
