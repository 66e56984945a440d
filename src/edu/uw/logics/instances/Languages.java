package edu.uw.logics.instances;

import com.google.common.primitives.Doubles;

import edu.uw.logics.language.Language;

/**
 * Predefined languages. All of them share the connectives ~ ∧ ∨ → ↔, the quantifiers ∀ ∃, the sentential
 * metavariables A to E, the individual metavariables α to ε, the variable metavariable χ and the predicate
 * metavariables Π Σ (unary), Φ (binary) and Ψ (ternary).
 */
public final class Languages {

	/**
	 * Second-order classical language: constants a to e, variables x y z, predicates P Q (unary), R (binary),
	 * S (ternary), predicate variables W X Y (unary), Z (binary), sentential constants ⊥ ⊤.
	 */
	public static final Language CLASSICAL = classical().build();

	/**
	 * As {@link #CLASSICAL}, also accepting a1, P2, A3 etc.
	 */
	public static final Language CLASSICAL_INFINITE = classical().infinite().build();

	/**
	 * As {@link #CLASSICAL_INFINITE}, with function symbols f (unary) and g (binary).
	 */
	public static final Language CLASSICAL_FUNCTION = classical().infinite().functionSymbol("f", 1)
			.functionSymbol("g", 2).build();

	/**
	 * Arithmetic: the constant 0, functions s (unary), + * ** (binary), relations = &gt; &lt;.
	 */
	public static final Language ARITHMETIC = common().individualConstants("0").predicateLetter("=", 2)
			.predicateLetter(">", 2).predicateLetter("<", 2).functionSymbol("s", 1).functionSymbol("+", 2)
			.functionSymbol("*", 2).functionSymbol("**", 2).build();

	/**
	 * Arithmetic where every numeral is a constant, with functions + - * / // ** and relations = &gt; &lt;.
	 */
	public static final Language REAL_NUMBER_ARITHMETIC = common()
			.individualConstants(symbol -> Doubles.tryParse(symbol) != null).predicateLetter("=", 2)
			.predicateLetter(">", 2).predicateLetter("<", 2).functionSymbol("+", 2).functionSymbol("-", 2)
			.functionSymbol("*", 2).functionSymbol("/", 2).functionSymbol("//", 2).functionSymbol("**", 2).build();

	private Languages() {
	}

	private static Language.Builder common() {
		return Language.builder()
				.variables("x", "y", "z")
				.quantifiers("∀", "∃")
				.connective("~", 1).connective("∧", 2).connective("∨", 2).connective("→", 2).connective("↔", 2)
				.predicateVariable("W", 1).predicateVariable("X", 1).predicateVariable("Y", 1)
				.predicateVariable("Z", 2)
				.sententialMetavariables("A", "B", "C", "D", "E")
				.individualMetavariables("α", "β", "γ", "δ", "ε")
				.variableMetavariables("χ")
				.predicateMetavariable("Π", 1).predicateMetavariable("Σ", 1).predicateMetavariable("Φ", 2)
				.predicateMetavariable("Ψ", 3);
	}

	private static Language.Builder classical() {
		return common()
				.individualConstants("a", "b", "c", "d", "e")
				.predicateLetter("P", 1).predicateLetter("Q", 1).predicateLetter("R", 2).predicateLetter("S", 3)
				.sententialConstants("⊥", "⊤");
	}
}
