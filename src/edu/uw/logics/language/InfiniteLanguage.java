package edu.uw.logics.language;

import java.util.Optional;

/**
 * Language that also accepts individual constants, predicate letters and sentential metavariables followed by
 * digits (a1, P2, A3) as fresh symbols of the same kind and arity.
 */
public class InfiniteLanguage extends Language {

	InfiniteLanguage(final Builder builder) {
		super(builder);
	}

	@Override
	public boolean isIndividualConstant(final String symbol) {
		if (super.isIndividualConstant(symbol)) {
			return true;
		}
		return !hasIndividualConstantRecognizer() && declaredBase(symbol, getIndividualConstants()).isPresent();
	}

	@Override
	public boolean isPredicateLetter(final String symbol) {
		return declaredBase(symbol, getPredicateLetters().keySet()).isPresent();
	}

	@Override
	protected Optional<Integer> predicateLetterArity(final String symbol) {
		return declaredBase(symbol, getPredicateLetters().keySet()).map(base -> getPredicateLetters().get(base));
	}

	@Override
	public boolean isSententialMetavariable(final String symbol) {
		return declaredBase(symbol, getSententialMetavariables()).isPresent();
	}
}
