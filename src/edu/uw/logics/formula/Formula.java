package edu.uw.logics.formula;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.uw.logics.language.Language;
import edu.uw.logics.unification.MatchResult;
import edu.uw.logics.unification.SchemaMatcher;

/**
 * A sentence-level tree: an {@link AtomicFormula}, a {@link MolecularFormula} or a {@link QuantifiedFormula}.
 *
 * Formulas are immutable and compared by value. Every transformation returns a new tree. Callers that need to
 * distinguish the three shapes should use a {@link FormulaVisitor} rather than instanceof checks.
 */
public abstract class Formula implements Serializable {
	private static final long serialVersionUID = 1L;

	Formula() {
	}

	public abstract boolean isAtomic();

	/**
	 * The predicate, metavariable or sentential constant of an atomic formula, the connective of a molecular one, or
	 * the quantifier of a quantified one.
	 */
	public abstract String getMainSymbol();

	/**
	 * The immediate subformulas. For a quantified formula this is only its body, never the variable or the
	 * restriction term.
	 */
	public abstract List<Formula> getArguments();

	/**
	 * 0 for atomic formulas, otherwise 1 + the maximum depth of the arguments.
	 */
	public int getDepth() {
		int result = 0;
		for (final Formula argument : getArguments()) {
			result = Math.max(result, argument.getDepth() + 1);
		}
		return result;
	}

	/**
	 * Every subformula including this one, in post-order, without repetitions.
	 */
	public List<Formula> getSubformulae() {
		final Set<Formula> result = new LinkedHashSet<>();
		addSubformulae(result);
		return ImmutableList.copyOf(result);
	}

	private void addSubformulae(final Set<Formula> result) {
		for (final Formula argument : getArguments()) {
			argument.addSubformulae(result);
		}
		result.add(this);
	}

	/**
	 * Individual and predicate variables with at least one free occurrence.
	 */
	public Set<String> freeVariables(final Language language) {
		return ImmutableSet.copyOf(freeVariables(language, ImmutableSet.of()));
	}

	abstract Set<String> freeVariables(Language language, Set<String> boundVariables);

	public boolean isClosed(final Language language) {
		return freeVariables(language).isEmpty();
	}

	public boolean isOpen(final Language language) {
		return !isClosed(language);
	}

	/**
	 * True if some symbol of the formula, including terms and quantified variables, is a metavariable.
	 */
	public abstract boolean isSchematic(Language language);

	public abstract boolean containsSymbol(String symbol);

	/**
	 * Replaces every subformula equal to `pattern` by `replacement`.
	 */
	public Formula substitute(final Formula pattern, final Formula replacement) {
		if (equals(pattern)) {
			return replacement;
		}
		final List<Formula> arguments = getArguments();
		if (arguments.isEmpty()) {
			return this;
		}
		final ImmutableList.Builder<Formula> newArguments = ImmutableList.builder();
		for (final Formula argument : arguments) {
			newArguments.add(argument.substitute(pattern, replacement));
		}
		return withArguments(newArguments.build());
	}

	/**
	 * Replaces the free occurrences of an individual or predicate variable with a term. Bound occurrences are left
	 * alone. The restriction term of a bounded quantifier lies outside the scope of its own variable.
	 */
	public Formula vsubstitute(final String variable, final Term replacement) {
		return vsubstitute(variable, replacement, ImmutableSet.of());
	}

	public Formula vsubstitute(final String variable, final String replacement) {
		return vsubstitute(variable, new AtomicTerm(replacement));
	}

	abstract Formula vsubstitute(String variable, Term replacement, Set<String> boundVariables);

	/**
	 * Replaces every metavariable with its binding in the substitution.
	 *
	 * @throws UnboundMetavariableException
	 *             if some metavariable of the formula is not bound
	 */
	public abstract Formula instantiate(Language language, Substitution substitution);

	/**
	 * Rewrites, bottom-up, every subformula that is an instance of `schemaFrom` into the matching instance of
	 * `schemaTo`. For example P(x) → Q(x) with schemas A → B and ~A ∨ B becomes ~P(x) ∨ Q(x).
	 */
	public Formula schematicSubstitute(final Language language, final Formula schemaFrom, final Formula schemaTo) {
		Formula result = this;
		final List<Formula> arguments = getArguments();
		if (!arguments.isEmpty()) {
			final ImmutableList.Builder<Formula> newArguments = ImmutableList.builder();
			for (final Formula argument : arguments) {
				newArguments.add(argument.schematicSubstitute(language, schemaFrom, schemaTo));
			}
			result = withArguments(newArguments.build());
		}
		final MatchResult match = result.match(language, schemaFrom);
		if (match.isMatch()) {
			return schemaTo.instantiate(language, match.getSubstitution());
		}
		return result;
	}

	/**
	 * The same formula with its immediate subformulas replaced.
	 */
	abstract Formula withArguments(List<Formula> arguments);

	public boolean isWellFormed(final Language language) {
		return language.isWellFormed(this);
	}

	/**
	 * Whether this formula is a substitution instance of `schema`.
	 */
	public boolean isInstanceOf(final Language language, final Formula schema) {
		return new SchemaMatcher(language).isInstanceOf(this, schema);
	}

	public MatchResult match(final Language language, final Formula schema) {
		return new SchemaMatcher(language).match(this, schema);
	}

	public abstract <T> T accept(FormulaVisitor<T> visitor);

	@Override
	public String toString() {
		final StringBuilder result = new StringBuilder();
		toString(result);
		return result.toString();
	}

	abstract void toString(StringBuilder result);

	/**
	 * Appends the formula, parenthesized unless it is atomic.
	 */
	void toStringAsArgument(final StringBuilder result) {
		if (isAtomic()) {
			toString(result);
		} else {
			result.append("(");
			toString(result);
			result.append(")");
		}
	}

	public interface FormulaVisitor<T> {
		T visit(AtomicFormula formula);

		T visit(MolecularFormula formula);

		T visit(QuantifiedFormula formula);
	}
}
