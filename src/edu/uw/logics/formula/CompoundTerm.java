package edu.uw.logics.formula;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.uw.logics.language.Language;

/**
 * Represents f(t1, ..., tn), a function symbol applied to its argument terms. Whether n matches the arity of f is
 * up to the {@link Language}, see {@link Language#isWellFormed(Term)}.
 */
public class CompoundTerm extends Term {
	private static final long serialVersionUID = 1L;

	private final String functionSymbol;
	private final ImmutableList<Term> arguments;

	public CompoundTerm(final String functionSymbol, final Term... arguments) {
		this(functionSymbol, Arrays.asList(arguments));
	}

	public CompoundTerm(final String functionSymbol, final List<? extends Term> arguments) {
		super();
		this.functionSymbol = Preconditions.checkNotNull(functionSymbol);
		this.arguments = ImmutableList.copyOf(arguments);
		Preconditions.checkArgument(this.arguments.size() > 0, "Function %s applied to no arguments", functionSymbol);
	}

	/**
	 * Function applied to atomic terms, e.g. of("g", "x", "a") for g(x, a).
	 */
	public static CompoundTerm of(final String functionSymbol, final String... arguments) {
		return new CompoundTerm(functionSymbol,
				Arrays.stream(arguments).map(AtomicTerm::new).collect(Collectors.toList()));
	}

	@Override
	public boolean isAtomic() {
		return false;
	}

	@Override
	public String getSymbol() {
		return functionSymbol;
	}

	@Override
	public List<Term> getArguments() {
		return arguments;
	}

	@Override
	Term vsubstitute(final String variable, final Term replacement, final Set<String> boundVariables) {
		return new CompoundTerm(functionSymbol, arguments.stream()
				.map(x -> x.vsubstitute(variable, replacement, boundVariables)).collect(Collectors.toList()));
	}

	@Override
	public Term instantiate(final Language language, final Substitution substitution) {
		return new CompoundTerm(functionSymbol,
				arguments.stream().map(x -> x.instantiate(language, substitution)).collect(Collectors.toList()));
	}

	@Override
	Set<String> freeVariables(final Language language, final Set<String> boundVariables) {
		final Set<String> result = new HashSet<>();
		for (final Term argument : arguments) {
			result.addAll(argument.freeVariables(language, boundVariables));
		}
		return result;
	}

	@Override
	public boolean isSchematic(final Language language) {
		return arguments.stream().anyMatch(x -> x.isSchematic(language));
	}

	@Override
	public boolean containsSymbol(final String symbol) {
		return functionSymbol.equals(symbol) || arguments.stream().anyMatch(x -> x.containsSymbol(symbol));
	}

	@Override
	public <T> T accept(final TermVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	void toString(final StringBuilder result) {
		result.append(functionSymbol);
		result.append("(");
		boolean isFirst = true;
		for (final Term argument : arguments) {
			if (isFirst) {
				isFirst = false;
			} else {
				result.append(", ");
			}
			argument.toString(result);
		}
		result.append(")");
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof CompoundTerm)) {
			return false;
		}
		final CompoundTerm other = (CompoundTerm) obj;
		return functionSymbol.equals(other.functionSymbol) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(functionSymbol, arguments);
	}
}
