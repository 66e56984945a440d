package edu.uw.logics.semantics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;

import edu.uw.logics.formula.AtomicFormula;
import edu.uw.logics.formula.Formula;
import edu.uw.logics.formula.Formula.FormulaVisitor;
import edu.uw.logics.formula.MolecularFormula;
import edu.uw.logics.formula.QuantifiedFormula;
import edu.uw.logics.formula.Term;
import edu.uw.logics.language.Language;

/**
 * Truth-functional semantics for a {@link Language}: the truth values, which of them are designated, a truth function
 * for every connective and quantifier, a value for every sentential constant, and the clause that evaluates atomic
 * formulas. Built with {@link #builder(Language)}, which rejects incomplete configurations.
 *
 * Valuation optionally takes short cuts for the standard connectives and quantifiers (see
 * {@link Builder#fastMolecularValuation()}). The builder only accepts them when the configured truth functions
 * agree with the short cuts, so both ways of evaluating always give the same value.
 */
public class ModelTheory {
	private static final Logger LOG = LogManager.getLogger();

	private final Language language;
	private final ImmutableList<String> truthValues;
	private final ImmutableSet<String> designatedValues;
	private final ImmutableMap<String, TruthFunction> truthFunctions;
	private final AtomicClause atomicClause;
	private final ImmutableMap<String, String> sententialConstantValues;
	private final boolean fastMolecularValuation;
	private final boolean fastQuantifierValuation;

	private ModelTheory(final Builder builder) {
		this.language = builder.language;
		this.truthValues = ImmutableList.copyOf(builder.truthValues);
		this.designatedValues = ImmutableSet.copyOf(builder.designatedValues);
		this.truthFunctions = ImmutableMap.copyOf(builder.truthFunctions);
		this.atomicClause = builder.atomicClause;
		this.sententialConstantValues = ImmutableMap.copyOf(builder.sententialConstantValues);
		this.fastMolecularValuation = builder.fastMolecularValuation;
		this.fastQuantifierValuation = builder.fastQuantifierValuation;
	}

	public static Builder builder(final Language language) {
		return new Builder(language);
	}

	public String valuation(final Formula formula, final Model model) {
		return valuation(formula, model, Assignment.empty());
	}

	/**
	 * Truth value of the formula in the model, with free variables taken from the assignment.
	 *
	 * @throws DenotationException
	 *             if some term of the formula has no denotation
	 */
	public String valuation(final Formula formula, final Model model, final Assignment assignment) {
		return formula.accept(new Valuation(model, assignment));
	}

	public String applyTruthFunction(final String symbol, final String... values) {
		return applyTruthFunction(symbol, Arrays.asList(values));
	}

	/**
	 * @throws IllegalArgumentException
	 *             if the symbol has no truth function
	 */
	public String applyTruthFunction(final String symbol, final List<String> values) {
		final TruthFunction function = truthFunctions.get(symbol);
		Preconditions.checkArgument(function != null, "No truth function for %s", symbol);
		return function.apply(values);
	}

	public boolean isDesignated(final String truthValue) {
		return designatedValues.contains(truthValue);
	}

	/**
	 * Whether the formula takes a designated value in the model.
	 */
	public boolean satisfies(final Model model, final Formula formula) {
		return isDesignated(valuation(formula, model));
	}

	public Language getLanguage() {
		return language;
	}

	public ImmutableList<String> getTruthValues() {
		return truthValues;
	}

	public ImmutableSet<String> getDesignatedValues() {
		return designatedValues;
	}

	public boolean usesFastMolecularValuation() {
		return fastMolecularValuation;
	}

	public boolean usesFastQuantifierValuation() {
		return fastQuantifierValuation;
	}

	/**
	 * Evaluates one formula tree. Quantifiers evaluate their body with a fresh Valuation over the extended assignment.
	 */
	private class Valuation implements FormulaVisitor<String> {
		private final Model model;
		private final Assignment assignment;

		Valuation(final Model model, final Assignment assignment) {
			this.model = model;
			this.assignment = assignment;
		}

		@Override
		public String visit(final AtomicFormula formula) {
			final String symbol = formula.getMainSymbol();
			if (language.isSententialConstant(symbol)) {
				return sententialConstantValues.get(symbol);
			}
			final Object predicate = model.denotation(symbol, assignment);
			if (!(predicate instanceof Denotation)) {
				throw new DenotationException("Predicate " + symbol + " does not denote a relation: " + predicate);
			}
			final List<Object> arguments = new ArrayList<>(formula.getTerms().size());
			for (final Term term : formula.getTerms()) {
				arguments.add(model.denotation(term, assignment));
			}
			final Denotation relation = (Denotation) predicate;
			if (relation.isComputed()) {
				final Object result = relation.apply(arguments);
				if (!(result instanceof String) || !truthValues.contains(result)) {
					throw new DenotationException("Predicate " + symbol + " gave " + result + " for " + arguments
							+ ", which is not a truth value");
				}
				return (String) result;
			}
			return atomicClause.apply(relation, arguments);
		}

		@Override
		public String visit(final MolecularFormula formula) {
			final String connective = formula.getConnective();
			final List<Formula> arguments = formula.getArguments();
			if (fastMolecularValuation && KleeneFastPath.handlesConnective(connective, arguments.size())) {
				final List<Supplier<String>> values = new ArrayList<>(arguments.size());
				for (final Formula argument : arguments) {
					values.add(() -> argument.accept(this));
				}
				return KleeneFastPath.molecular(connective, values);
			}
			final List<String> values = new ArrayList<>(arguments.size());
			for (final Formula argument : arguments) {
				values.add(argument.accept(this));
			}
			return applyTruthFunction(connective, values);
		}

		@Override
		public String visit(final QuantifiedFormula formula) {
			final String quantifier = formula.getQuantifier();
			final String variable = formula.getVariable();
			final Formula body = formula.getBody();
			final Iterator<String> values = Iterators.transform(range(formula).iterator(),
					element -> body.accept(new Valuation(model, assignment.bind(variable, element))));
			if (fastQuantifierValuation && KleeneFastPath.handlesQuantifier(quantifier)) {
				return KleeneFastPath.quantifier(quantifier, values);
			}
			return applyTruthFunction(quantifier, ImmutableList.copyOf(values));
		}

		private Iterable<?> range(final QuantifiedFormula formula) {
			if (formula.isBounded()) {
				final Object restriction = model.denotation(formula.getRestriction(), assignment);
				if (restriction instanceof Denotation.Extension) {
					return ((Denotation.Extension) restriction).getMembers();
				} else if (restriction instanceof Iterable) {
					return (Iterable<?>) restriction;
				}
				throw new DenotationException("Quantifier bound " + formula.getRestriction()
						+ " does not denote a collection: " + restriction);
			}
			if (language.isPredicateVariable(formula.getVariable())) {
				return model.predicateVariableRange(language.arity(formula.getVariable()));
			}
			return model.getDomain();
		}
	}

	public static class Builder {
		private final Language language;
		private final List<String> truthValues = new ArrayList<>();
		private final Set<String> designatedValues = new LinkedHashSet<>();
		private final Map<String, TruthFunction> truthFunctions = new LinkedHashMap<>();
		private AtomicClause atomicClause;
		private final Map<String, String> sententialConstantValues = new LinkedHashMap<>();
		private boolean fastMolecularValuation = false;
		private boolean fastQuantifierValuation = false;

		private Builder(final Language language) {
			this.language = Preconditions.checkNotNull(language);
		}

		public Builder truthValues(final String... values) {
			return truthValues(Arrays.asList(values));
		}

		public Builder truthValues(final List<String> values) {
			truthValues.clear();
			truthValues.addAll(values);
			return this;
		}

		public Builder designatedValue(final String value) {
			designatedValues.add(value);
			return this;
		}

		public Builder designatedValues(final String... values) {
			designatedValues.addAll(Arrays.asList(values));
			return this;
		}

		public Builder truthFunction(final String symbol, final TruthFunction function) {
			truthFunctions.put(symbol, Preconditions.checkNotNull(function));
			return this;
		}

		public Builder truthFunctions(final Map<String, ? extends TruthFunction> functions) {
			truthFunctions.putAll(functions);
			return this;
		}

		public Builder atomicClause(final AtomicClause clause) {
			this.atomicClause = Preconditions.checkNotNull(clause);
			return this;
		}

		public Builder sententialConstantValue(final String constant, final String value) {
			sententialConstantValues.put(constant, value);
			return this;
		}

		public Builder sententialConstantValues(final Map<String, String> values) {
			sententialConstantValues.putAll(values);
			return this;
		}

		/**
		 * Evaluate ~, ∧, ∨, → and ↔ with short-circuiting Kleene clauses.
		 */
		public Builder fastMolecularValuation() {
			this.fastMolecularValuation = true;
			return this;
		}

		/**
		 * Evaluate ∀ and ∃ as Kleene conjunction and disjunction, stopping at the first deciding element.
		 */
		public Builder fastQuantifierValuation() {
			this.fastQuantifierValuation = true;
			return this;
		}

		/**
		 * @throws IllegalArgumentException
		 *             if a connective or quantifier has no truth function, a sentential constant has no value, the
		 *             designated values are not truth values, or a requested fast valuation disagrees with the
		 *             truth functions
		 */
		public ModelTheory build() {
			Preconditions.checkArgument(!truthValues.isEmpty(), "No truth values");
			Preconditions.checkArgument(ImmutableSet.copyOf(truthValues).size() == truthValues.size(),
					"Repeated truth values in %s", truthValues);
			Preconditions.checkArgument(!designatedValues.isEmpty(), "No designated value");
			for (final String value : designatedValues) {
				Preconditions.checkArgument(truthValues.contains(value), "Value %s is not in truth values %s", value,
						truthValues);
			}
			Preconditions.checkArgument(atomicClause != null, "No valuation clause for atomic formulas");
			for (final String connective : language.connectives()) {
				Preconditions.checkArgument(truthFunctions.containsKey(connective),
						"Constant %s did not receive a truth function", connective);
			}
			for (final String quantifier : language.getQuantifiers()) {
				Preconditions.checkArgument(truthFunctions.containsKey(quantifier),
						"Quantifier %s did not receive a truth function", quantifier);
			}
			for (final String constant : language.getSententialConstants()) {
				final String value = sententialConstantValues.get(constant);
				Preconditions.checkArgument(value != null, "Sentential constant %s did not receive a truth value",
						constant);
				Preconditions.checkArgument(truthValues.contains(value),
						"Sentential constant %s has value %s, which is not a truth value", constant, value);
			}
			if (fastMolecularValuation || fastQuantifierValuation) {
				Preconditions.checkArgument(KleeneFastPath.TRUTH_VALUES.containsAll(truthValues),
						"Fast valuation needs truth values among %s, got %s", KleeneFastPath.TRUTH_VALUES,
						truthValues);
			}
			if (fastMolecularValuation) {
				for (final String connective : language.connectives()) {
					if (KleeneFastPath.handlesConnective(connective, language.arity(connective))) {
						KleeneFastPath.checkAgrees(connective, truthFunctions.get(connective), truthValues);
					}
				}
			}
			if (fastQuantifierValuation) {
				for (final String quantifier : language.getQuantifiers()) {
					if (KleeneFastPath.handlesQuantifier(quantifier)) {
						KleeneFastPath.checkAgrees(quantifier, truthFunctions.get(quantifier), truthValues);
					}
				}
			}

			LOG.debug("Model theory over {} with designated {}, fast molecular {}, fast quantifiers {}", truthValues,
					designatedValues, fastMolecularValuation, fastQuantifierValuation);
			return new ModelTheory(this);
		}
	}
}
