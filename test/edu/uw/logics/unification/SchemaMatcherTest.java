package edu.uw.logics.unification;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import edu.uw.logics.formula.AtomicFormula;
import edu.uw.logics.formula.AtomicTerm;
import edu.uw.logics.formula.CompoundTerm;
import edu.uw.logics.formula.Formula;
import edu.uw.logics.formula.MolecularFormula;
import edu.uw.logics.formula.PackedSubstitution;
import edu.uw.logics.formula.QuantifiedFormula;
import edu.uw.logics.formula.Substitution;
import edu.uw.logics.instances.Languages;

public class SchemaMatcherTest {
	private final SchemaMatcher matcher = new SchemaMatcher(Languages.CLASSICAL_FUNCTION);

	private static final Formula A = new AtomicFormula("A");
	private static final Formula B = new AtomicFormula("B");

	private static Formula and(final Formula left, final Formula right) {
		return new MolecularFormula("∧", left, right);
	}

	private static Formula implies(final Formula left, final Formula right) {
		return new MolecularFormula("→", left, right);
	}

	@Test
	public void testNonSchematicIsEquality() {
		assertTrue(matcher.isInstanceOf(AtomicFormula.of("P", "a"), AtomicFormula.of("P", "a")));
		assertFalse(matcher.isInstanceOf(AtomicFormula.of("P", "a"), AtomicFormula.of("P", "b")));
	}

	@Test
	public void testRepeatedMetavariableMustAgree() {
		final MatchResult result = matcher.match(and(AtomicFormula.of("P", "a"), AtomicFormula.of("Q", "b")),
				and(A, A));
		assertFalse(result.isMatch());
		assertEquals(AtomicFormula.of("P", "a"), result.getSubstitution().getFormula("A"));

		assertTrue(matcher.isInstanceOf(and(AtomicFormula.of("P", "a"), AtomicFormula.of("P", "a")), and(A, A)));
	}

	@Test
	public void testRecoversSubstitution() {
		final Formula consequent = new MolecularFormula("∨", AtomicFormula.of("Q", "b"), AtomicFormula.of("P", "a"));
		final MatchResult result = matcher.match(implies(AtomicFormula.of("P", "a"), consequent), implies(A, B));
		assertTrue(result.isMatch());
		assertEquals(new Substitution().bind("A", AtomicFormula.of("P", "a")).bind("B", consequent),
				result.getSubstitution());
	}

	@Test
	public void testShapeMismatch() {
		assertFalse(matcher.isInstanceOf(AtomicFormula.of("P", "a"), new MolecularFormula("~", A)));
		assertFalse(matcher.isInstanceOf(and(AtomicFormula.of("P", "a"), AtomicFormula.of("P", "a")),
				implies(A, B)));
		assertFalse(matcher.isInstanceOf(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x")),
				new QuantifiedFormula("∃", "χ", A)));
	}

	@Test
	public void testSeedIsNotModified() {
		final Substitution seed = new Substitution().bind("A", AtomicFormula.of("P", "a"));
		final Formula candidate = and(AtomicFormula.of("P", "a"), AtomicFormula.of("Q", "b"));
		final MatchResult result = matcher.match(candidate, and(A, B), seed);
		assertTrue(result.isMatch());
		assertEquals(AtomicFormula.of("Q", "b"), result.getSubstitution().getFormula("B"));
		assertNull(seed.getFormula("B"));

		assertFalse(matcher.match(candidate, and(A, B), new Substitution().bind("A", AtomicFormula.of("Q", "b")))
				.isMatch());
	}

	@Test
	public void testIndividualMetavariables() {
		final MatchResult result = matcher.match(new AtomicFormula("P", CompoundTerm.of("f", "a")),
				AtomicFormula.of("P", "α"));
		assertTrue(result.isMatch());
		assertEquals(CompoundTerm.of("f", "a"), result.getSubstitution().getTerm("α"));

		assertFalse(matcher.isInstanceOf(AtomicFormula.of("R", "a", "b"), AtomicFormula.of("R", "α", "α")));
		assertTrue(matcher.isInstanceOf(AtomicFormula.of("R", "a", "a"), AtomicFormula.of("R", "α", "α")));
		assertTrue(matcher.isInstanceOf(new AtomicFormula("P", CompoundTerm.of("g", "a", "b")),
				new AtomicFormula("P", CompoundTerm.of("g", "α", "β"))));
		assertFalse(matcher.isInstanceOf(new AtomicFormula("P", CompoundTerm.of("g", "a", "b")),
				new AtomicFormula("P", CompoundTerm.of("f", "α"))));
	}

	@Test
	public void testPredicateMetavariable() {
		final MatchResult result = matcher.match(AtomicFormula.of("Q", "c"), AtomicFormula.of("Π", "α"));
		assertTrue(result.isMatch());
		assertEquals(new AtomicTerm("Q"), result.getSubstitution().getTerm("Π"));
		assertEquals(new AtomicTerm("c"), result.getSubstitution().getTerm("α"));
		assertFalse(matcher.isInstanceOf(and(AtomicFormula.of("P", "a"), AtomicFormula.of("Q", "a")),
				and(AtomicFormula.of("Π", "α"), AtomicFormula.of("Π", "α"))));
	}

	@Test
	public void testVariableMetavariableNeedsSymbol() {
		assertTrue(matcher.isInstanceOf(AtomicFormula.of("P", "x"), AtomicFormula.of("P", "χ")));
		assertFalse(matcher.isInstanceOf(new AtomicFormula("P", CompoundTerm.of("f", "a")),
				AtomicFormula.of("P", "χ")));
	}

	@Test
	public void testQuantifiers() {
		final MatchResult result = matcher.match(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x")),
				new QuantifiedFormula("∀", "χ", A));
		assertTrue(result.isMatch());
		assertEquals(new AtomicTerm("x"), result.getSubstitution().getTerm("χ"));
		assertEquals(AtomicFormula.of("P", "x"), result.getSubstitution().getFormula("A"));

		final Formula bounded = new QuantifiedFormula("∀", "x", CompoundTerm.of("f", "a"), AtomicFormula.of("P", "x"));
		final MatchResult boundedResult = matcher.match(bounded,
				new QuantifiedFormula("∀", "χ", new AtomicTerm("α"), A));
		assertTrue(boundedResult.isMatch());
		assertEquals(CompoundTerm.of("f", "a"), boundedResult.getSubstitution().getTerm("α"));

		assertFalse(matcher.isInstanceOf(bounded, new QuantifiedFormula("∀", "χ", A)));
		assertFalse(matcher.isInstanceOf(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x")),
				new QuantifiedFormula("∀", "χ", new AtomicTerm("α"), A)));
	}

	@Test
	public void testPackedTokenAfterPremise() {
		final Formula premise = new QuantifiedFormula("∀", "χ", A);
		final Substitution seed = matcher.match(new QuantifiedFormula("∀", "x", AtomicFormula.of("R", "x", "b")),
				premise).getSubstitution();
		final Formula conclusion = PackedSubstitution.token("α", "χ", "A");

		final MatchResult result = matcher.match(AtomicFormula.of("R", "c", "b"), conclusion, seed);
		assertTrue(result.isMatch());
		assertEquals(new AtomicTerm("c"), result.getSubstitution().getTerm("α"));

		assertFalse(matcher.match(AtomicFormula.of("R", "c", "c"), conclusion, seed).isMatch());
	}

	@Test
	public void testPackedTokenInsideRule() {
		final Formula rule = implies(new QuantifiedFormula("∀", "χ", A), PackedSubstitution.token("α", "χ", "A"));
		final Formula instance = implies(new QuantifiedFormula("∀", "x", AtomicFormula.of("R", "x", "b")),
				new AtomicFormula("R", CompoundTerm.of("f", "c"), new AtomicTerm("b")));
		final MatchResult result = matcher.match(instance, rule);
		assertTrue(result.isMatch());
		assertEquals(CompoundTerm.of("f", "c"), result.getSubstitution().getTerm("α"));
	}

	@Test
	public void testPackedTokenWithNothingBound() {
		assertFalse(matcher.isInstanceOf(AtomicFormula.of("R", "c", "b"), PackedSubstitution.token("α", "χ", "A")));
	}

	@Test
	public void testInstantiateThenMatchRecoversSubstitution() {
		final Formula schema = implies(and(new MolecularFormula("~", A), AtomicFormula.of("Π", "α")),
				new QuantifiedFormula("∀", "χ", AtomicFormula.of("R", "χ", "β")));
		final Substitution substitution = new Substitution()
				.bind("A", AtomicFormula.of("P", "a"))
				.bind("Π", "Q")
				.bind("α", CompoundTerm.of("f", "b"))
				.bind("χ", "y")
				.bind("β", "c");
		final Formula instance = schema.instantiate(Languages.CLASSICAL_FUNCTION, substitution);
		final MatchResult result = matcher.match(instance, schema);
		assertTrue(result.isMatch());
		assertEquals(substitution, result.getSubstitution());
		assertTrue(instance.isInstanceOf(Languages.CLASSICAL_FUNCTION, schema));
	}

	@Test
	public void testPackedTokenBeforeQuantifierRecoversSubstitution() {
		final Formula schema = and(PackedSubstitution.token("α", "χ", "A"), new QuantifiedFormula("∀", "χ", A));
		final Substitution substitution = new Substitution()
				.bind("A", AtomicFormula.of("P", "x"))
				.bind("χ", "x")
				.bind("α", "a");
		final Formula instance = schema.instantiate(Languages.CLASSICAL_FUNCTION, substitution);
		assertEquals(and(AtomicFormula.of("P", "a"), new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x"))),
				instance);

		final MatchResult result = matcher.match(instance, schema);
		assertTrue(result.isMatch());
		assertEquals(substitution, result.getSubstitution());

		assertFalse(matcher.isInstanceOf(and(AtomicFormula.of("Q", "a"),
				new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "x"))), schema));
	}

	@Test
	public void testVacuousQuantifierLeavesIndividualUnbound() {
		final Formula rule = implies(new QuantifiedFormula("∀", "χ", A), PackedSubstitution.token("α", "χ", "A"));
		final Formula instance = implies(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "a")),
				AtomicFormula.of("P", "a"));
		final MatchResult result = matcher.match(instance, rule);
		assertTrue(result.isMatch());
		assertEquals(new Substitution().bind("A", AtomicFormula.of("P", "a")).bind("χ", "x"),
				result.getSubstitution());
		assertFalse(result.getSubstitution().isBound("α"));
		assertEquals(instance, rule.instantiate(Languages.CLASSICAL_FUNCTION, result.getSubstitution()));

		assertFalse(matcher.isInstanceOf(implies(new QuantifiedFormula("∀", "x", AtomicFormula.of("P", "a")),
				AtomicFormula.of("P", "b")), rule));
	}
}
