package edu.uw.logics.language;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import edu.uw.logics.formula.Formula;
import edu.uw.logics.formula.Term;

/**
 * Vocabulary of a first or second-order language: which strings are individual constants, variables, predicates,
 * function symbols, quantifiers, connectives, sentential constants and metavariables, and what their arities are.
 *
 * There is always an unbounded supply of individual and predicate variables: a declared variable followed by digits
 * (x1, X23) is a variable of the same kind and arity. {@link InfiniteLanguage} extends this to individual constants,
 * predicate letters and sentential metavariables. Individual, variable and predicate metavariables never take
 * digits.
 *
 * Instances are immutable; build them with {@link #builder()}.
 */
public class Language {

	private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

	private final ImmutableSet<String> individualConstants;
	// When present, replaces the enumerated individual constants (e.g. "every numeral").
	private final Predicate<String> individualConstantRecognizer;
	private final ImmutableSet<String> variables;
	private final ImmutableList<String> quantifiers;
	private final ImmutableMap<String, Integer> connectives;
	private final ImmutableMap<String, Integer> predicateLetters;
	private final ImmutableMap<String, Integer> predicateVariables;
	private final ImmutableMap<String, Integer> functionSymbols;
	private final ImmutableSet<String> sententialConstants;
	private final ImmutableSet<String> sententialMetavariables;
	private final ImmutableSet<String> individualMetavariables;
	private final ImmutableSet<String> variableMetavariables;
	private final ImmutableMap<String, Integer> predicateMetavariables;
	private final boolean allowPredicatesAsTerms;

	protected Language(final Builder builder) {
		this.individualConstants = ImmutableSet.copyOf(builder.individualConstants);
		this.individualConstantRecognizer = builder.individualConstantRecognizer;
		this.variables = ImmutableSet.copyOf(builder.variables);
		this.quantifiers = ImmutableList.copyOf(builder.quantifiers);
		this.connectives = ImmutableMap.copyOf(builder.connectives);
		this.predicateLetters = ImmutableMap.copyOf(builder.predicateLetters);
		this.predicateVariables = ImmutableMap.copyOf(builder.predicateVariables);
		this.functionSymbols = ImmutableMap.copyOf(builder.functionSymbols);
		this.sententialConstants = ImmutableSet.copyOf(builder.sententialConstants);
		this.sententialMetavariables = ImmutableSet.copyOf(builder.sententialMetavariables);
		this.individualMetavariables = ImmutableSet.copyOf(builder.individualMetavariables);
		this.variableMetavariables = ImmutableSet.copyOf(builder.variableMetavariables);
		this.predicateMetavariables = ImmutableMap.copyOf(builder.predicateMetavariables);
		this.allowPredicatesAsTerms = builder.allowPredicatesAsTerms;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the declared symbol that `symbol` is an instance of, either the symbol itself or the symbol with
	 * trailing digits removed.
	 */
	protected static Optional<String> declaredBase(final String symbol, final Collection<String> declared) {
		if (declared.contains(symbol)) {
			return Optional.of(symbol);
		}
		for (final String base : declared) {
			if (symbol.length() > base.length() && symbol.startsWith(base)
					&& DIGITS.matchesAllOf(symbol.substring(base.length()))) {
				return Optional.of(base);
			}
		}
		return Optional.empty();
	}

	public boolean isIndividualConstant(final String symbol) {
		if (individualConstantRecognizer != null) {
			return individualConstantRecognizer.test(symbol);
		}
		return individualConstants.contains(symbol);
	}

	public boolean isVariable(final String symbol) {
		return declaredBase(symbol, variables).isPresent();
	}

	public boolean isPredicateLetter(final String symbol) {
		return predicateLetters.containsKey(symbol);
	}

	public boolean isPredicateVariable(final String symbol) {
		return declaredBase(symbol, predicateVariables.keySet()).isPresent();
	}

	public boolean isFunctionSymbol(final String symbol) {
		return functionSymbols.containsKey(symbol);
	}

	public boolean isQuantifier(final String symbol) {
		return quantifiers.contains(symbol);
	}

	public boolean isConnective(final String symbol) {
		return connectives.containsKey(symbol);
	}

	public boolean isSententialConstant(final String symbol) {
		return sententialConstants.contains(symbol);
	}

	public boolean isSententialMetavariable(final String symbol) {
		return sententialMetavariables.contains(symbol);
	}

	public boolean isIndividualMetavariable(final String symbol) {
		return individualMetavariables.contains(symbol);
	}

	public boolean isVariableMetavariable(final String symbol) {
		return variableMetavariables.contains(symbol);
	}

	public boolean isPredicateMetavariable(final String symbol) {
		return predicateMetavariables.containsKey(symbol);
	}

	/**
	 * True for sentential, individual, variable and predicate metavariables.
	 */
	public boolean isMetavariable(final String symbol) {
		return isSententialMetavariable(symbol) || isIndividualMetavariable(symbol)
				|| isVariableMetavariable(symbol) || isPredicateMetavariable(symbol);
	}

	/**
	 * Predicate letters, predicate variables and predicate metavariables.
	 */
	public boolean isPredicate(final String symbol) {
		return isPredicateLetter(symbol) || isPredicateVariable(symbol) || isPredicateMetavariable(symbol);
	}

	/**
	 * Symbols that may occupy the variable slot of a quantifier: individual and predicate variables, and the
	 * metavariables that stand for them.
	 */
	public boolean isBindable(final String symbol) {
		return isVariable(symbol) || isPredicateVariable(symbol) || isIndividualMetavariable(symbol)
				|| isVariableMetavariable(symbol) || isPredicateMetavariable(symbol);
	}

	/**
	 * Symbols that are well-formed terms on their own.
	 */
	public boolean isAtomicTermSymbol(final String symbol) {
		if (allowPredicatesAsTerms
				&& (isPredicateLetter(symbol) || isPredicateVariable(symbol) || isFunctionSymbol(symbol))) {
			return true;
		}
		return isIndividualConstant(symbol) || isVariable(symbol) || isIndividualMetavariable(symbol)
				|| isVariableMetavariable(symbol);
	}

	public Optional<SymbolKind> kindOf(final String symbol) {
		if (isConnective(symbol)) {
			return Optional.of(SymbolKind.CONNECTIVE);
		} else if (isQuantifier(symbol)) {
			return Optional.of(SymbolKind.QUANTIFIER);
		} else if (isSententialConstant(symbol)) {
			return Optional.of(SymbolKind.SENTENTIAL_CONSTANT);
		} else if (isSententialMetavariable(symbol)) {
			return Optional.of(SymbolKind.SENTENTIAL_METAVARIABLE);
		} else if (isIndividualMetavariable(symbol)) {
			return Optional.of(SymbolKind.INDIVIDUAL_METAVARIABLE);
		} else if (isVariableMetavariable(symbol)) {
			return Optional.of(SymbolKind.VARIABLE_METAVARIABLE);
		} else if (isPredicateMetavariable(symbol)) {
			return Optional.of(SymbolKind.PREDICATE_METAVARIABLE);
		} else if (isFunctionSymbol(symbol)) {
			return Optional.of(SymbolKind.FUNCTION_SYMBOL);
		} else if (isPredicateLetter(symbol)) {
			return Optional.of(SymbolKind.PREDICATE_LETTER);
		} else if (isPredicateVariable(symbol)) {
			return Optional.of(SymbolKind.PREDICATE_VARIABLE);
		} else if (isVariable(symbol)) {
			return Optional.of(SymbolKind.VARIABLE);
		} else if (isIndividualConstant(symbol)) {
			return Optional.of(SymbolKind.INDIVIDUAL_CONSTANT);
		}
		return Optional.empty();
	}

	/**
	 * Arity of a connective, predicate letter, predicate variable, predicate metavariable or function symbol.
	 *
	 * @throws IllegalArgumentException
	 *             if the symbol has no arity in this language
	 */
	public int arity(final String symbol) {
		if (connectives.containsKey(symbol)) {
			return connectives.get(symbol);
		}
		final Optional<Integer> predicateArity = predicateLetterArity(symbol);
		if (predicateArity.isPresent()) {
			return predicateArity.get();
		} else if (predicateMetavariables.containsKey(symbol)) {
			return predicateMetavariables.get(symbol);
		} else if (functionSymbols.containsKey(symbol)) {
			return functionSymbols.get(symbol);
		}
		final Optional<String> predicateVariable = declaredBase(symbol, predicateVariables.keySet());
		if (predicateVariable.isPresent()) {
			return predicateVariables.get(predicateVariable.get());
		}
		throw new IllegalArgumentException("Incorrect symbol " + symbol + ", does not have arity");
	}

	protected Optional<Integer> predicateLetterArity(final String symbol) {
		return Optional.ofNullable(predicateLetters.get(symbol));
	}

	public Set<String> connectives() {
		return connectives.keySet();
	}

	public Set<String> connectives(final int arity) {
		return withArity(connectives, arity);
	}

	public Set<String> predicates() {
		return predicateLetters.keySet();
	}

	public Set<String> predicates(final int arity) {
		return withArity(predicateLetters, arity);
	}

	private static Set<String> withArity(final Map<String, Integer> symbols, final int arity) {
		final ImmutableSet.Builder<String> result = ImmutableSet.builder();
		for (final Map.Entry<String, Integer> entry : symbols.entrySet()) {
			if (entry.getValue() == arity) {
				result.add(entry.getKey());
			}
		}
		return result.build();
	}

	public boolean isWellFormed(final Formula formula) {
		return !wellFormednessError(formula).isPresent();
	}

	public boolean isWellFormed(final Term term) {
		return new WellFormednessChecker(this).isWellFormed(term);
	}

	/**
	 * Empty if the formula is well-formed, otherwise a message naming the offending subformula and its defect.
	 */
	public Optional<String> wellFormednessError(final Formula formula) {
		return formula.accept(new WellFormednessChecker(this));
	}

	/**
	 * @throws NotWellFormedException
	 *             if the formula is not well-formed
	 */
	public void checkWellFormed(final Formula formula) {
		final Optional<String> error = wellFormednessError(formula);
		if (error.isPresent()) {
			throw new NotWellFormedException(formula, error.get());
		}
	}

	public ImmutableList<String> getQuantifiers() {
		return quantifiers;
	}

	public ImmutableSet<String> getSententialConstants() {
		return sententialConstants;
	}

	public ImmutableSet<String> getVariables() {
		return variables;
	}

	public ImmutableSet<String> getIndividualConstants() {
		return individualConstants;
	}

	public boolean allowsPredicatesAsTerms() {
		return allowPredicatesAsTerms;
	}

	protected ImmutableMap<String, Integer> getPredicateLetters() {
		return predicateLetters;
	}

	protected ImmutableSet<String> getSententialMetavariables() {
		return sententialMetavariables;
	}

	protected boolean hasIndividualConstantRecognizer() {
		return individualConstantRecognizer != null;
	}

	public static class Builder {
		private final Set<String> individualConstants = new LinkedHashSet<>();
		private Predicate<String> individualConstantRecognizer;
		private final Set<String> variables = new LinkedHashSet<>();
		private final Set<String> quantifiers = new LinkedHashSet<>();
		private final Map<String, Integer> connectives = new LinkedHashMap<>();
		private final Map<String, Integer> predicateLetters = new LinkedHashMap<>();
		private final Map<String, Integer> predicateVariables = new LinkedHashMap<>();
		private final Map<String, Integer> functionSymbols = new LinkedHashMap<>();
		private final Set<String> sententialConstants = new LinkedHashSet<>();
		private final Set<String> sententialMetavariables = new LinkedHashSet<>();
		private final Set<String> individualMetavariables = new LinkedHashSet<>();
		private final Set<String> variableMetavariables = new LinkedHashSet<>();
		private final Map<String, Integer> predicateMetavariables = new LinkedHashMap<>();
		private boolean allowPredicatesAsTerms = false;
		private boolean infinite = false;

		private Builder() {
		}

		public Builder individualConstants(final String... symbols) {
			individualConstants.addAll(Arrays.asList(symbols));
			return this;
		}

		/**
		 * Recognize individual constants with a predicate instead of enumerating them.
		 */
		public Builder individualConstants(final Predicate<String> recognizer) {
			this.individualConstantRecognizer = Preconditions.checkNotNull(recognizer);
			return this;
		}

		public Builder variables(final String... symbols) {
			variables.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder quantifiers(final String... symbols) {
			quantifiers.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder connective(final String symbol, final int arity) {
			Preconditions.checkArgument(arity > 0, "Connective %s needs a positive arity", symbol);
			connectives.put(symbol, arity);
			return this;
		}

		public Builder predicateLetter(final String symbol, final int arity) {
			Preconditions.checkArgument(arity > 0, "Predicate %s needs a positive arity", symbol);
			predicateLetters.put(symbol, arity);
			return this;
		}

		public Builder predicateVariable(final String symbol, final int arity) {
			Preconditions.checkArgument(arity > 0, "Predicate variable %s needs a positive arity", symbol);
			predicateVariables.put(symbol, arity);
			return this;
		}

		public Builder functionSymbol(final String symbol, final int arity) {
			Preconditions.checkArgument(arity > 0, "Function symbol %s needs a positive arity", symbol);
			functionSymbols.put(symbol, arity);
			return this;
		}

		public Builder sententialConstants(final String... symbols) {
			sententialConstants.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder sententialMetavariables(final String... symbols) {
			sententialMetavariables.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder individualMetavariables(final String... symbols) {
			individualMetavariables.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder variableMetavariables(final String... symbols) {
			variableMetavariables.addAll(Arrays.asList(symbols));
			return this;
		}

		public Builder predicateMetavariable(final String symbol, final int arity) {
			Preconditions.checkArgument(arity > 0, "Predicate metavariable %s needs a positive arity", symbol);
			predicateMetavariables.put(symbol, arity);
			return this;
		}

		public Builder allowPredicatesAsTerms(final boolean allow) {
			this.allowPredicatesAsTerms = allow;
			return this;
		}

		/**
		 * Also accept digit-suffixed individual constants, predicate letters and sentential metavariables.
		 */
		public Builder infinite() {
			this.infinite = true;
			return this;
		}

		public Language build() {
			checkDisjoint();
			return infinite ? new InfiniteLanguage(this) : new Language(this);
		}

		private void checkDisjoint() {
			final Set<String> seen = new LinkedHashSet<>();
			for (final Iterable<String> symbols : ImmutableList.<Iterable<String>> of(individualConstants, variables,
					quantifiers, connectives.keySet(), predicateLetters.keySet(), predicateVariables.keySet(),
					functionSymbols.keySet(), sententialConstants, sententialMetavariables, individualMetavariables,
					variableMetavariables, predicateMetavariables.keySet())) {
				for (final String symbol : symbols) {
					Preconditions.checkArgument(!symbol.isEmpty(), "Empty symbol");
					Preconditions.checkArgument(seen.add(symbol), "Symbol %s is declared more than once", symbol);
				}
			}
		}
	}
}
