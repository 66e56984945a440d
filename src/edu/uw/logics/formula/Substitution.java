package edu.uw.logics.formula;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * Maps metavariables to what they stand for. Sentential metavariables are bound to formulas; individual, variable
 * and predicate metavariables are bound to terms (a bare symbol is an {@link AtomicTerm}).
 *
 * The first binding of a metavariable wins: {@link #tryBind} refuses to change an existing binding, which is what
 * keeps repeated metavariables consistent during matching.
 */
public class Substitution {

	private static final Joiner.MapJoiner BINDING_JOINER = Joiner.on(", ").withKeyValueSeparator("=");

	private final Map<String, Formula> formulas = new LinkedHashMap<>();
	private final Map<String, Term> terms = new LinkedHashMap<>();

	public Substitution() {
	}

	public Substitution(final Substitution other) {
		formulas.putAll(other.formulas);
		terms.putAll(other.terms);
	}

	/**
	 * Binds a metavariable, for building substitutions by hand.
	 *
	 * @throws IllegalArgumentException
	 *             if the metavariable is already bound to something else
	 */
	public Substitution bind(final String metavariable, final Formula value) {
		Preconditions.checkArgument(tryBind(metavariable, value), "%s is already bound to %s", metavariable,
				formulas.get(metavariable));
		return this;
	}

	public Substitution bind(final String metavariable, final Term value) {
		Preconditions.checkArgument(tryBind(metavariable, value), "%s is already bound to %s", metavariable,
				terms.get(metavariable));
		return this;
	}

	public Substitution bind(final String metavariable, final String symbol) {
		return bind(metavariable, new AtomicTerm(symbol));
	}

	/**
	 * Binds the metavariable if it is unbound. Returns false if it was already bound to a different value.
	 */
	public boolean tryBind(final String metavariable, final Formula value) {
		Preconditions.checkNotNull(value);
		if (terms.containsKey(metavariable)) {
			return false;
		}
		final Formula previous = formulas.putIfAbsent(metavariable, value);
		return previous == null || previous.equals(value);
	}

	public boolean tryBind(final String metavariable, final Term value) {
		Preconditions.checkNotNull(value);
		if (formulas.containsKey(metavariable)) {
			return false;
		}
		final Term previous = terms.putIfAbsent(metavariable, value);
		return previous == null || previous.equals(value);
	}

	public boolean isBound(final String metavariable) {
		return formulas.containsKey(metavariable) || terms.containsKey(metavariable);
	}

	/**
	 * The formula bound to a sentential metavariable, or null.
	 */
	public Formula getFormula(final String metavariable) {
		return formulas.get(metavariable);
	}

	/**
	 * The term bound to an individual, variable or predicate metavariable, or null.
	 */
	public Term getTerm(final String metavariable) {
		return terms.get(metavariable);
	}

	public Formula requireFormula(final String metavariable) {
		final Formula result = formulas.get(metavariable);
		if (result == null) {
			throw new UnboundMetavariableException(metavariable);
		}
		return result;
	}

	public Term requireTerm(final String metavariable) {
		final Term result = terms.get(metavariable);
		if (result == null) {
			throw new UnboundMetavariableException(metavariable);
		}
		return result;
	}

	/**
	 * The symbol bound to a variable or predicate metavariable.
	 */
	public String requireSymbol(final String metavariable) {
		final Term result = requireTerm(metavariable);
		Preconditions.checkState(result.isAtomic(), "%s is bound to the compound term %s, not a symbol",
				metavariable, result);
		return result.getSymbol();
	}

	public Set<String> getMetavariables() {
		return ImmutableSet.copyOf(Sets.union(formulas.keySet(), terms.keySet()));
	}

	public boolean isEmpty() {
		return formulas.isEmpty() && terms.isEmpty();
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof Substitution)) {
			return false;
		}
		final Substitution other = (Substitution) obj;
		return formulas.equals(other.formulas) && terms.equals(other.terms);
	}

	@Override
	public int hashCode() {
		return Objects.hash(formulas, terms);
	}

	@Override
	public String toString() {
		final List<String> parts = new ArrayList<>(2);
		if (!formulas.isEmpty()) {
			parts.add(BINDING_JOINER.join(formulas));
		}
		if (!terms.isEmpty()) {
			parts.add(BINDING_JOINER.join(terms));
		}
		return "{" + Joiner.on(", ").join(parts) + "}";
	}
}
