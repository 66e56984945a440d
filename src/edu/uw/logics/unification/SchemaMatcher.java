package edu.uw.logics.unification;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.uw.logics.formula.AtomicFormula;
import edu.uw.logics.formula.AtomicTerm;
import edu.uw.logics.formula.Formula;
import edu.uw.logics.formula.Formula.FormulaVisitor;
import edu.uw.logics.formula.MolecularFormula;
import edu.uw.logics.formula.PackedSubstitution;
import edu.uw.logics.formula.QuantifiedFormula;
import edu.uw.logics.formula.Substitution;
import edu.uw.logics.formula.Term;
import edu.uw.logics.language.Language;

/**
 * Decides whether a formula is a substitution instance of a schema, recovering the substitution that witnesses it.
 *
 * Matching is a single structural pass with no backtracking. The first binding of a metavariable is permanent for
 * the rest of the call, so A ∧ A matches P(a) ∧ P(a) but not P(a) ∧ Q(b). Callers that want several independent
 * attempts call {@link #match(Formula, Formula, Substitution)} again with a fresh or carried-forward seed.
 *
 * Metavariables are interpreted as follows:
 * <ul>
 * <li>sentential metavariables match any formula;</li>
 * <li>individual metavariables match any term;</li>
 * <li>variable and predicate metavariables match a single symbol;</li>
 * <li>[α/χ]A matches the formula bound to A with the variable bound to χ replaced by α. A token reached before A
 * and χ are bound is set aside and checked once the rest of the schema has been matched, so [α/χ]A ∧ ∀χ A works
 * as well as ∀χ A ∧ [α/χ]A. If the variable does not occur free in A, α stays unbound.</li>
 * </ul>
 */
public class SchemaMatcher {
	private static final Logger LOG = LogManager.getLogger();

	private final Language language;

	public SchemaMatcher(final Language language) {
		this.language = language;
	}

	public boolean isInstanceOf(final Formula candidate, final Formula schema) {
		return match(candidate, schema).isMatch();
	}

	public MatchResult match(final Formula candidate, final Formula schema) {
		return match(candidate, schema, new Substitution());
	}

	/**
	 * Matches with some metavariables already bound. The seed is not modified.
	 */
	public MatchResult match(final Formula candidate, final Formula schema, final Substitution seed) {
		final Substitution substitution = new Substitution(seed);
		final List<DeferredToken> deferred = new ArrayList<>();
		final boolean result = matches(candidate, schema, substitution, deferred)
				&& resolveDeferred(deferred, substitution);
		if (!result) {
			LOG.trace("{} is not an instance of {} (bindings so far: {})", candidate, schema, substitution);
		}
		return new MatchResult(result, substitution);
	}

	private boolean matches(final Formula candidate, final Formula schema, final Substitution substitution,
			final List<DeferredToken> deferred) {
		if (!schema.isSchematic(language)) {
			return candidate.equals(schema);
		}
		return schema.accept(new FormulaVisitor<Boolean>() {

			@Override
			public Boolean visit(final AtomicFormula atomic) {
				return matchesAtomic(candidate, atomic, substitution, deferred);
			}

			@Override
			public Boolean visit(final MolecularFormula molecular) {
				if (!(candidate instanceof MolecularFormula)
						|| !candidate.getMainSymbol().equals(molecular.getConnective())) {
					return false;
				}
				return matchesAll(candidate.getArguments(), molecular.getArguments(), substitution, deferred);
			}

			@Override
			public Boolean visit(final QuantifiedFormula quantified) {
				if (!(candidate instanceof QuantifiedFormula)) {
					return false;
				}
				final QuantifiedFormula other = (QuantifiedFormula) candidate;
				if (!other.getQuantifier().equals(quantified.getQuantifier())
						|| other.isBounded() != quantified.isBounded()
						|| !matchesSymbol(other.getVariable(), quantified.getVariable(), substitution)) {
					return false;
				}
				if (quantified.isBounded()
						&& !matchesTerm(other.getRestriction(), quantified.getRestriction(), substitution)) {
					return false;
				}
				return matches(other.getBody(), quantified.getBody(), substitution, deferred);
			}
		});
	}

	private boolean matchesAll(final List<Formula> candidates, final List<Formula> schemas,
			final Substitution substitution, final List<DeferredToken> deferred) {
		if (candidates.size() != schemas.size()) {
			return false;
		}
		for (int i = 0; i < candidates.size(); i++) {
			if (!matches(candidates.get(i), schemas.get(i), substitution, deferred)) {
				return false;
			}
		}
		return true;
	}

	private boolean matchesAtomic(final Formula candidate, final AtomicFormula schema,
			final Substitution substitution, final List<DeferredToken> deferred) {
		final String symbol = schema.getMainSymbol();
		if (language.isSententialMetavariable(symbol)) {
			return substitution.tryBind(symbol, candidate);
		}
		final Optional<PackedSubstitution> packed = PackedSubstitution.parse(language, symbol);
		if (packed.isPresent()) {
			if (!isResolvable(packed.get(), substitution)) {
				deferred.add(new DeferredToken(candidate, packed.get()));
				return true;
			}
			return matchesPacked(candidate, packed.get(), substitution, deferred);
		}

		if (!(candidate instanceof AtomicFormula)) {
			return false;
		}
		final AtomicFormula other = (AtomicFormula) candidate;
		if (!matchesSymbol(other.getMainSymbol(), symbol, substitution)) {
			return false;
		}
		final List<Term> candidateTerms = other.getTerms();
		final List<Term> schemaTerms = schema.getTerms();
		if (candidateTerms.size() != schemaTerms.size()) {
			return false;
		}
		for (int i = 0; i < candidateTerms.size(); i++) {
			if (!matchesTerm(candidateTerms.get(i), schemaTerms.get(i), substitution)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isResolvable(final PackedSubstitution packed, final Substitution substitution) {
		return substitution.getFormula(packed.getSententialMetavariable()) != null
				&& substitution.getTerm(packed.getVariableMetavariable()) != null;
	}

	private boolean matchesPacked(final Formula candidate, final PackedSubstitution packed,
			final Substitution substitution, final List<DeferredToken> deferred) {
		final Formula body = substitution.getFormula(packed.getSententialMetavariable());
		final Term variable = substitution.getTerm(packed.getVariableMetavariable());
		if (!variable.isAtomic()) {
			return false;
		}
		final Formula expected = body.vsubstitute(variable.getSymbol(),
				new AtomicTerm(packed.getIndividualMetavariable()));
		return matches(candidate, expected, substitution, deferred);
	}

	/**
	 * Checks the tokens set aside during the structural pass. Each round resolves every token whose A and χ are now
	 * bound; a round that resolves nothing means the rest can never be resolved.
	 */
	private boolean resolveDeferred(final List<DeferredToken> deferred, final Substitution substitution) {
		while (!deferred.isEmpty()) {
			final List<DeferredToken> pending = new ArrayList<>(deferred);
			deferred.clear();
			boolean progress = false;
			for (final DeferredToken token : pending) {
				if (!isResolvable(token.packed, substitution)) {
					deferred.add(token);
					continue;
				}
				progress = true;
				if (!matchesPacked(token.candidate, token.packed, substitution, deferred)) {
					return false;
				}
			}
			if (!progress) {
				LOG.trace("Cannot match {}: metavariables never bound", deferred);
				return false;
			}
		}
		return true;
	}

	/**
	 * Symbol slots: predicates in head position and quantified variables.
	 */
	private boolean matchesSymbol(final String candidate, final String schema, final Substitution substitution) {
		if (language.isMetavariable(schema)) {
			return substitution.tryBind(schema, new AtomicTerm(candidate));
		}
		return candidate.equals(schema);
	}

	private boolean matchesTerm(final Term candidate, final Term schema, final Substitution substitution) {
		final String symbol = schema.getSymbol();
		if (schema.isAtomic()) {
			if (language.isIndividualMetavariable(symbol)) {
				return substitution.tryBind(symbol, candidate);
			} else if (language.isVariableMetavariable(symbol) || language.isPredicateMetavariable(symbol)) {
				return candidate.isAtomic() && substitution.tryBind(symbol, candidate);
			}
			return candidate.equals(schema);
		}

		if (candidate.isAtomic() || !candidate.getSymbol().equals(symbol)) {
			return false;
		}
		final List<Term> candidateArguments = candidate.getArguments();
		final List<Term> schemaArguments = schema.getArguments();
		if (candidateArguments.size() != schemaArguments.size()) {
			return false;
		}
		for (int i = 0; i < candidateArguments.size(); i++) {
			if (!matchesTerm(candidateArguments.get(i), schemaArguments.get(i), substitution)) {
				return false;
			}
		}
		return true;
	}

	private static class DeferredToken {
		private final Formula candidate;
		private final PackedSubstitution packed;

		private DeferredToken(final Formula candidate, final PackedSubstitution packed) {
			this.candidate = candidate;
			this.packed = packed;
		}

		@Override
		public String toString() {
			return packed.getSententialMetavariable() + "/" + packed.getVariableMetavariable() + " against "
					+ candidate;
		}
	}
}
