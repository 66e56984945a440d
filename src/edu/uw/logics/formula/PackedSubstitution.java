package edu.uw.logics.formula;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.uw.logics.language.Language;

/**
 * The atomic token [α/χ]A: "the formula bound to A, with the variable bound to χ replaced by the term bound to α".
 * Quantifier rules use it to thread an arbitrary constant through a schema, e.g. ∀χ A / [α/χ]A.
 */
public class PackedSubstitution {
	private static final Pattern TOKEN = Pattern.compile("\\[(.+)/(.+)\\](.+)");

	private final String individualMetavariable;
	private final String variableMetavariable;
	private final String sententialMetavariable;

	private PackedSubstitution(final String individualMetavariable, final String variableMetavariable,
			final String sententialMetavariable) {
		this.individualMetavariable = individualMetavariable;
		this.variableMetavariable = variableMetavariable;
		this.sententialMetavariable = sententialMetavariable;
	}

	/**
	 * Reads a token of the form [α/χ]A, where the three parts are metavariables of the right kinds in the language.
	 */
	public static Optional<PackedSubstitution> parse(final Language language, final String symbol) {
		final Matcher matcher = TOKEN.matcher(symbol);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		final String individual = matcher.group(1);
		final String variable = matcher.group(2);
		final String sentential = matcher.group(3);
		if (language.isIndividualMetavariable(individual) && language.isVariableMetavariable(variable)
				&& language.isSententialMetavariable(sentential)) {
			return Optional.of(new PackedSubstitution(individual, variable, sentential));
		}
		return Optional.empty();
	}

	/**
	 * The atomic formula [α/χ]A.
	 */
	public static AtomicFormula token(final String individualMetavariable, final String variableMetavariable,
			final String sententialMetavariable) {
		return new AtomicFormula("[" + individualMetavariable + "/" + variableMetavariable + "]"
				+ sententialMetavariable);
	}

	/**
	 * α is only needed when the variable actually occurs free in A. Otherwise A is returned as is, so a vacuous
	 * quantifier such as ∀x P(a) instantiates without a binding for α.
	 */
	public Formula instantiate(final Language language, final Substitution substitution) {
		final Formula body = substitution.requireFormula(sententialMetavariable);
		final String variable = substitution.requireSymbol(variableMetavariable);
		if (!body.freeVariables(language).contains(variable)) {
			return body;
		}
		return body.vsubstitute(variable, substitution.requireTerm(individualMetavariable));
	}

	public String getIndividualMetavariable() {
		return individualMetavariable;
	}

	public String getVariableMetavariable() {
		return variableMetavariable;
	}

	public String getSententialMetavariable() {
		return sententialMetavariable;
	}
}
