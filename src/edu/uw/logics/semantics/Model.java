package edu.uw.logics.semantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import edu.uw.logics.formula.AtomicTerm;
import edu.uw.logics.formula.CompoundTerm;
import edu.uw.logics.formula.Term;
import edu.uw.logics.formula.Term.TermVisitor;

/**
 * A domain together with the denotations of the non-logical symbols. Individual constants denote domain elements,
 * predicates denote {@link Denotation}s (usually extensions), function symbols denote {@link Denotation}s (usually
 * graphs).
 *
 * The domain is any {@link Iterable}: it is only ever walked, as the range of unbounded quantifiers, so it may be
 * lazy and unbounded. Subclasses can give some symbols a fixed meaning through {@link #fixedDenotation(String)},
 * which takes precedence over the model's own data.
 *
 * A {@link Collection} given as a denotation is read as an extension, so a predicate may be given as the plain set
 * of its members (or of its {@link Denotation#tuple}s).
 */
public class Model {
	private final Iterable<?> domain;
	private final ImmutableMap<String, Object> denotations;

	public Model(final Iterable<?> domain, final Map<String, ?> denotations) {
		this.domain = Preconditions.checkNotNull(domain);
		this.denotations = ImmutableMap.copyOf(Maps.transformValues(denotations, Model::asDenotation));
	}

	private static Object asDenotation(final Object value) {
		return value instanceof Collection ? Denotation.extension((Collection<?>) value) : value;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Iterable<?> getDomain() {
		return domain;
	}

	/**
	 * Meaning of a symbol that does not depend on the model's data, or null.
	 */
	protected Object fixedDenotation(final String symbol) {
		return null;
	}

	/**
	 * Resolves a symbol from, in order, the fixed denotations, the model's data, and the assignment.
	 *
	 * @throws DenotationException
	 *             if none of them has a value for the symbol
	 */
	public Object denotation(final String symbol, final Assignment assignment) {
		final Object fixed = fixedDenotation(symbol);
		if (fixed != null) {
			return fixed;
		}
		final Object data = denotations.get(symbol);
		if (data != null) {
			return data;
		}
		final Object assigned = assignment.get(symbol);
		if (assigned != null) {
			return assigned;
		}
		throw DenotationException.noDenotation(symbol);
	}

	public Object denotation(final Term term) {
		return denotation(term, Assignment.empty());
	}

	/**
	 * Value of a term. A compound term applies the denotation of its function symbol to the values of its arguments.
	 *
	 * @throws DenotationException
	 *             if some symbol has no denotation, or a partial function is undefined for the arguments
	 */
	public Object denotation(final Term term, final Assignment assignment) {
		return term.accept(new TermVisitor<Object>() {
			@Override
			public Object visit(final AtomicTerm atomic) {
				return denotation(atomic.getSymbol(), assignment);
			}

			@Override
			public Object visit(final CompoundTerm compound) {
				final Object function = denotation(compound.getSymbol(), assignment);
				if (!(function instanceof Denotation)) {
					throw new DenotationException("Function symbol " + compound.getSymbol()
							+ " does not denote a function: " + function);
				}
				final List<Object> arguments = new ArrayList<>(compound.getArguments().size());
				for (final Term argument : compound.getArguments()) {
					arguments.add(argument.accept(this));
				}
				return ((Denotation) function).apply(arguments);
			}
		});
	}

	/**
	 * Every possible extension of a predicate variable of the given arity over this model's domain.
	 */
	public QuantificationRange predicateVariableRange(final int arity) {
		return QuantificationRange.forPredicateVariable(domain, arity);
	}

	public ImmutableMap<String, Object> getDenotations() {
		return denotations;
	}

	@Override
	public String toString() {
		return "domain=" + domain + " " + denotations;
	}

	public static class Builder {
		private Iterable<?> domain = ImmutableSet.of();
		private final Map<String, Object> denotations = new LinkedHashMap<>();

		private Builder() {
		}

		public Builder domain(final Object... elements) {
			return domain(ImmutableSet.copyOf(Arrays.asList(elements)));
		}

		public Builder domain(final Iterable<?> elements) {
			this.domain = Preconditions.checkNotNull(elements);
			return this;
		}

		public Builder constant(final String symbol, final Object element) {
			return denote(symbol, element);
		}

		/**
		 * Predicate with the given extension: bare elements for unary predicates, {@link Denotation#tuple}s
		 * otherwise.
		 */
		public Builder predicate(final String symbol, final Collection<?> extension) {
			return denote(symbol, Denotation.extension(extension));
		}

		/**
		 * Function given by its graph, from argument {@link Denotation#tuple}s to values.
		 */
		public Builder function(final String symbol, final Map<? extends List<?>, ?> graph) {
			return denote(symbol, Denotation.graph(graph));
		}

		public Builder denote(final String symbol, final Object denotation) {
			Preconditions.checkArgument(!denotations.containsKey(symbol), "%s already has a denotation", symbol);
			denotations.put(symbol, Preconditions.checkNotNull(denotation));
			return this;
		}

		public Model build() {
			return new Model(domain, denotations);
		}
	}
}
