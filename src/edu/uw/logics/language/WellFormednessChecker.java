package edu.uw.logics.language;

import java.util.Optional;

import edu.uw.logics.formula.AtomicFormula;
import edu.uw.logics.formula.AtomicTerm;
import edu.uw.logics.formula.CompoundTerm;
import edu.uw.logics.formula.Formula;
import edu.uw.logics.formula.Formula.FormulaVisitor;
import edu.uw.logics.formula.MolecularFormula;
import edu.uw.logics.formula.PackedSubstitution;
import edu.uw.logics.formula.QuantifiedFormula;
import edu.uw.logics.formula.Term;

/**
 * Returns empty if the formula is well-formed, otherwise the defect of the innermost ill-formed subformula.
 */
class WellFormednessChecker implements FormulaVisitor<Optional<String>> {
	private final Language language;

	WellFormednessChecker(final Language language) {
		this.language = language;
	}

	boolean isWellFormed(final Term term) {
		return term.accept(new Term.TermVisitor<Boolean>() {
			@Override
			public Boolean visit(final AtomicTerm atomic) {
				return language.isAtomicTermSymbol(atomic.getSymbol());
			}

			@Override
			public Boolean visit(final CompoundTerm compound) {
				final String functionSymbol = compound.getSymbol();
				if (!language.isFunctionSymbol(functionSymbol)
						|| compound.getArguments().size() != language.arity(functionSymbol)) {
					return false;
				}
				return compound.getArguments().stream().allMatch(x -> x.accept(this));
			}
		});
	}

	private static Optional<String> error(final Formula formula, final String defect) {
		return Optional.of(formula + " is not well-formed: " + defect);
	}

	@Override
	public Optional<String> visit(final AtomicFormula formula) {
		final String symbol = formula.getMainSymbol();
		if (language.isSententialMetavariable(symbol) || language.isSententialConstant(symbol)
				|| PackedSubstitution.parse(language, symbol).isPresent()) {
			if (!formula.getTerms().isEmpty()) {
				return error(formula, symbol + " takes no arguments");
			}
			return Optional.empty();
		}
		if (!language.isPredicate(symbol)) {
			return error(formula, symbol + " is not a valid predicate");
		}
		final int arity = language.arity(symbol);
		if (formula.getTerms().size() != arity) {
			return error(formula, "Incorrect number of arguments for " + arity + "-ary predicate " + symbol);
		}
		for (final Term term : formula.getTerms()) {
			if (!isWellFormed(term)) {
				return error(formula, "Term " + term + " is not well-formed");
			}
		}
		return Optional.empty();
	}

	@Override
	public Optional<String> visit(final MolecularFormula formula) {
		final String connective = formula.getConnective();
		if (!language.isConnective(connective)) {
			return error(formula, connective + " is not a connective of the language");
		}
		if (formula.getArguments().size() != language.arity(connective)) {
			return error(formula, "Number of arguments does not coincide with the arity of " + connective);
		}
		for (final Formula argument : formula.getArguments()) {
			final Optional<String> result = argument.accept(this);
			if (result.isPresent()) {
				return result;
			}
		}
		return Optional.empty();
	}

	@Override
	public Optional<String> visit(final QuantifiedFormula formula) {
		if (!language.isQuantifier(formula.getQuantifier())) {
			return error(formula, formula.getQuantifier() + " is not a quantifier of the language");
		}
		if (!language.isBindable(formula.getVariable())) {
			return error(formula, formula.getVariable() + " is not a valid variable");
		}
		if (formula.isBounded() && !isWellFormed(formula.getRestriction())) {
			return error(formula, "Quantifier bound " + formula.getRestriction() + " is not a term");
		}
		return formula.getBody().accept(this);
	}
}
