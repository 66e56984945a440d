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
 * A connective applied to argument formulas.
 */
public class MolecularFormula extends Formula {
	private static final long serialVersionUID = 1L;

	private final String connective;
	private final ImmutableList<Formula> arguments;

	public MolecularFormula(final String connective, final Formula... arguments) {
		this(connective, Arrays.asList(arguments));
	}

	public MolecularFormula(final String connective, final List<? extends Formula> arguments) {
		super();
		this.connective = Preconditions.checkNotNull(connective);
		this.arguments = ImmutableList.copyOf(arguments);
		Preconditions.checkArgument(this.arguments.size() > 0, "Connective %s applied to no arguments", connective);
	}

	public String getConnective() {
		return connective;
	}

	@Override
	public boolean isAtomic() {
		return false;
	}

	@Override
	public String getMainSymbol() {
		return connective;
	}

	@Override
	public List<Formula> getArguments() {
		return arguments;
	}

	@Override
	Set<String> freeVariables(final Language language, final Set<String> boundVariables) {
		final Set<String> result = new HashSet<>();
		for (final Formula argument : arguments) {
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
		return connective.equals(symbol) || arguments.stream().anyMatch(x -> x.containsSymbol(symbol));
	}

	@Override
	Formula vsubstitute(final String variable, final Term replacement, final Set<String> boundVariables) {
		return new MolecularFormula(connective, arguments.stream()
				.map(x -> x.vsubstitute(variable, replacement, boundVariables)).collect(Collectors.toList()));
	}

	@Override
	public Formula instantiate(final Language language, final Substitution substitution) {
		return new MolecularFormula(connective,
				arguments.stream().map(x -> x.instantiate(language, substitution)).collect(Collectors.toList()));
	}

	@Override
	Formula withArguments(final List<Formula> newArguments) {
		return new MolecularFormula(connective, newArguments);
	}

	@Override
	public <T> T accept(final FormulaVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	void toString(final StringBuilder result) {
		if (arguments.size() == 1) {
			result.append(connective);
			arguments.get(0).toStringAsArgument(result);
		} else if (arguments.size() == 2) {
			arguments.get(0).toStringAsArgument(result);
			result.append(" ").append(connective).append(" ");
			arguments.get(1).toStringAsArgument(result);
		} else {
			result.append(connective).append("(");
			boolean isFirst = true;
			for (final Formula argument : arguments) {
				if (isFirst) {
					isFirst = false;
				} else {
					result.append(", ");
				}
				argument.toString(result);
			}
			result.append(")");
		}
	}

	@Override
	public boolean equals(final Object obj) {
		if (!(obj instanceof MolecularFormula)) {
			return false;
		}
		final MolecularFormula other = (MolecularFormula) obj;
		return connective.equals(other.connective) && arguments.equals(other.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(connective, arguments);
	}
}
