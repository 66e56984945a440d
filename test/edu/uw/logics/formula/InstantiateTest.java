package edu.uw.logics.formula;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import edu.uw.logics.instances.Languages;
import edu.uw.logics.language.Language;

public class InstantiateTest {
	private final Language language = Languages.CLASSICAL_FUNCTION;

	@Test
	public void testSententialMetavariables() {
		final Formula schema = new MolecularFormula("∧", new AtomicFormula("A"), new AtomicFormula("B"));
		final Substitution substitution = new Substitution()
				.bind("A", AtomicFormula.of("P", "a"))
				.bind("B", new MolecularFormula("~", AtomicFormula.of("Q", "b")));
		assertEquals(new MolecularFormula("∧", AtomicFormula.of("P", "a"),
				new MolecularFormula("~", AtomicFormula.of("Q", "b"))), schema.instantiate(language, substitution));
	}

	@Test
	public void testTermMetavariables() {
		assertEquals(new AtomicFormula("P", CompoundTerm.of("f", "a")), AtomicFormula.of("P", "α")
				.instantiate(language, new Substitution().bind("α", CompoundTerm.of("f", "a"))));
		assertEquals(new AtomicFormula("R", CompoundTerm.of("g", "b", "c"), new AtomicTerm("a")),
				new AtomicFormula("R", new CompoundTerm("g", new AtomicTerm("β"), new AtomicTerm("c")),
						new AtomicTerm("α")).instantiate(language, new Substitution().bind("α", "a").bind("β", "b")));
	}

	@Test
	public void testPredicateMetavariable() {
		final Substitution substitution = new Substitution().bind("Π", "Q").bind("α", "b");
		assertEquals(AtomicFormula.of("Q", "b"), AtomicFormula.of("Π", "α").instantiate(language, substitution));
	}

	@Test
	public void testVariableMetavariable() {
		final Formula schema = new QuantifiedFormula("∀", "χ", AtomicFormula.of("P", "χ"));
		assertEquals(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x")),
				schema.instantiate(language, new Substitution().bind("χ", "x")));

		final Formula bounded = new QuantifiedFormula("∃", "χ", CompoundTerm.of("f", "α"), AtomicFormula.of("P", "χ"));
		assertEquals(new QuantifiedFormula("∃", "y", CompoundTerm.of("f", "a"), AtomicFormula.of("P", "y")),
				bounded.instantiate(language, new Substitution().bind("χ", "y").bind("α", "a")));
	}

	@Test
	public void testPackedSubstitution() {
		final Substitution substitution = new Substitution()
				.bind("A", AtomicFormula.of("R", "x", "b"))
				.bind("χ", "x")
				.bind("α", "a");
		assertEquals(AtomicFormula.of("R", "a", "b"),
				PackedSubstitution.token("α", "χ", "A").instantiate(language, substitution));

		// Bound occurrences of the variable stay.
		substitution.bind("B", new MolecularFormula("∧", AtomicFormula.of("P", "x"),
				new QuantifiedFormula("∀", "x", AtomicFormula.of("Q", "x"))));
		assertEquals(new MolecularFormula("∧", AtomicFormula.of("P", "a"),
				new QuantifiedFormula("∀", "x", AtomicFormula.of("Q", "x"))),
				PackedSubstitution.token("α", "χ", "B").instantiate(language, substitution));
	}

	@Test
	public void testPackedSubstitutionWithoutFreeOccurrence() {
		final Substitution substitution = new Substitution()
				.bind("A", new QuantifiedFormula("∃", "x", AtomicFormula.of("P", "x")))
				.bind("χ", "x");
		assertEquals(new QuantifiedFormula("∃", "x", AtomicFormula.of("P", "x")),
				PackedSubstitution.token("α", "χ", "A").instantiate(language, substitution));

		try {
			PackedSubstitution.token("α", "χ", "A").instantiate(language,
					new Substitution().bind("A", AtomicFormula.of("P", "x")).bind("χ", "x"));
			fail();
		} catch (final UnboundMetavariableException e) {
			assertEquals("α", e.getMetavariable());
		}
	}

	@Test
	public void testPackedTokenParsing() {
		final PackedSubstitution packed = PackedSubstitution.parse(language, "[β/χ]C").get();
		assertEquals("β", packed.getIndividualMetavariable());
		assertEquals("χ", packed.getVariableMetavariable());
		assertEquals("C", packed.getSententialMetavariable());
		assertFalse(PackedSubstitution.parse(language, "[a/χ]C").isPresent());
		assertFalse(PackedSubstitution.parse(language, "[β/x]C").isPresent());
		assertFalse(PackedSubstitution.parse(language, "C").isPresent());
	}

	@Test
	public void testUnboundMetavariable() {
		try {
			new MolecularFormula("∨", new AtomicFormula("A"), AtomicFormula.of("P", "α")).instantiate(language,
					new Substitution().bind("A", AtomicFormula.of("P", "a")));
			fail();
		} catch (final UnboundMetavariableException e) {
			assertEquals("α", e.getMetavariable());
			assertEquals("Metavariable α not present in substitution dict given", e.getMessage());
		}
	}

	@Test
	public void testNonSchematicFormulaIsUnchanged() {
		final Formula formula = new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x"));
		assertEquals(formula, formula.instantiate(language, new Substitution()));
	}

	@Test
	public void testFirstBindingWins() {
		final Substitution substitution = new Substitution();
		assertTrue(substitution.tryBind("A", AtomicFormula.of("P", "a")));
		assertTrue(substitution.tryBind("A", AtomicFormula.of("P", "a")));
		assertFalse(substitution.tryBind("A", AtomicFormula.of("Q", "a")));
		assertEquals(AtomicFormula.of("P", "a"), substitution.getFormula("A"));
		// A name bound to a formula cannot also be bound to a term.
		assertFalse(substitution.tryBind("A", new AtomicTerm("a")));
		assertNull(substitution.getTerm("A"));
		assertEquals(ImmutableSet.of("A"), substitution.getMetavariables());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testConflictingBind() {
		new Substitution().bind("α", "a").bind("α", "b");
	}

	@Test(expected = IllegalStateException.class)
	public void testSymbolSlotBoundToCompoundTerm() {
		new Substitution().bind("χ", CompoundTerm.of("f", "a")).requireSymbol("χ");
	}

	@Test
	public void testCopiesAreIndependent() {
		final Substitution original = new Substitution().bind("α", "a");
		final Substitution copy = new Substitution(original).bind("β", "b");
		assertFalse(original.isBound("β"));
		assertTrue(copy.isBound("α"));
		assertEquals("{α=a, β=b}", copy.toString());
	}
}
