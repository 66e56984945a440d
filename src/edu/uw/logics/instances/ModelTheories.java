package edu.uw.logics.instances;

import edu.uw.logics.language.Language;
import edu.uw.logics.semantics.ModelTheory;

/**
 * Predefined model theories. All use the fast valuation clauses.
 */
public final class ModelTheories {

	public static final ModelTheory CLASSICAL = classical(Languages.CLASSICAL_INFINITE).build();

	public static final ModelTheory CLASSICAL_FUNCTIONAL = classical(Languages.CLASSICAL_FUNCTION).build();

	public static final ModelTheory ARITHMETIC = classical(Languages.ARITHMETIC).build();

	public static final ModelTheory REAL_NUMBER_ARITHMETIC = classical(Languages.REAL_NUMBER_ARITHMETIC).build();

	/**
	 * Strong Kleene logic: only 1 is designated.
	 */
	public static final ModelTheory K3 = trivalued(Languages.CLASSICAL_FUNCTION).designatedValue("1").build();

	/**
	 * Logic of paradox: the Kleene tables with 1 and i designated.
	 */
	public static final ModelTheory LP = trivalued(Languages.CLASSICAL_FUNCTION).designatedValues("1", "i").build();

	private ModelTheories() {
	}

	private static ModelTheory.Builder classical(final Language language) {
		return ModelTheory.builder(language)
				.truthValues(TruthFunctions.CLASSICAL_VALUES)
				.designatedValue("1")
				.truthFunctions(TruthFunctions.CLASSICAL_CONNECTIVES)
				.truthFunction("∀", TruthFunctions.CLASSICAL_UNIVERSAL)
				.truthFunction("∃", TruthFunctions.CLASSICAL_EXISTENTIAL)
				.atomicClause(TruthFunctions.CLASSICAL_ATOMIC)
				.sententialConstantValues(TruthFunctions.CLASSICAL_SENTENTIAL_CONSTANTS)
				.fastMolecularValuation()
				.fastQuantifierValuation();
	}

	private static ModelTheory.Builder trivalued(final Language language) {
		return ModelTheory.builder(language)
				.truthValues(TruthFunctions.TRIVALUED_VALUES)
				.truthFunctions(TruthFunctions.TRIVALUED_CONNECTIVES)
				.truthFunction("∀", TruthFunctions.TRIVALUED_UNIVERSAL)
				.truthFunction("∃", TruthFunctions.TRIVALUED_EXISTENTIAL)
				.atomicClause(TruthFunctions.CLASSICAL_ATOMIC)
				.sententialConstantValues(TruthFunctions.CLASSICAL_SENTENTIAL_CONSTANTS)
				.fastMolecularValuation()
				.fastQuantifierValuation();
	}
}
