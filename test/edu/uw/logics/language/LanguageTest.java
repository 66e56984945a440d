package edu.uw.logics.language;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Optional;

import org.junit.Test;

import com.google.common.collect.ImmutableSet;

import edu.uw.logics.instances.Languages;

public class LanguageTest {

	@Test
	public void testVariablesAcceptDigits() {
		final Language language = Languages.CLASSICAL;
		assertTrue(language.isVariable("x"));
		assertTrue(language.isVariable("x1"));
		assertTrue(language.isVariable("z23"));
		assertFalse(language.isVariable("w"));
		assertEquals(ImmutableSet.of("x", "y", "z"), language.getVariables());
		assertFalse(language.isVariable("x1a"));
		assertTrue(language.isPredicateVariable("X2"));
		assertEquals(1, language.arity("X2"));
		assertEquals(2, language.arity("Z3"));
	}

	@Test
	public void testFiniteLanguageRejectsFreshConstants() {
		final Language language = Languages.CLASSICAL;
		assertTrue(language.isIndividualConstant("a"));
		assertFalse(language.isIndividualConstant("a1"));
		assertFalse(language.isPredicateLetter("P1"));
		assertFalse(language.isSententialMetavariable("A1"));
	}

	@Test
	public void testInfiniteLanguageAcceptsFreshConstants() {
		final Language language = Languages.CLASSICAL_INFINITE;
		assertTrue(language instanceof InfiniteLanguage);
		assertTrue(language.isIndividualConstant("a1"));
		assertTrue(language.isPredicateLetter("R12"));
		assertEquals(2, language.arity("R12"));
		assertTrue(language.isSententialMetavariable("A3"));
		// only constants, predicate letters and sentential metavariables get fresh copies
		assertFalse(language.isIndividualMetavariable("α1"));
		assertFalse(language.isVariableMetavariable("χ1"));
		assertFalse(language.isPredicateMetavariable("Π1"));
	}

	@Test
	public void testDeclaredSymbolEndingInDigit() {
		final Language language = Language.builder().individualConstants("c1").variables("x").infinite().build();
		assertTrue(language.isIndividualConstant("c1"));
		assertTrue(language.isIndividualConstant("c12"));
		assertFalse(language.isIndividualConstant("c"));
	}

	@Test
	public void testArity() {
		final Language language = Languages.CLASSICAL_FUNCTION;
		assertEquals(1, language.arity("~"));
		assertEquals(2, language.arity("→"));
		assertEquals(3, language.arity("S"));
		assertEquals(2, language.arity("Φ"));
		assertEquals(2, language.arity("g"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testArityOfConstant() {
		Languages.CLASSICAL.arity("a");
	}

	@Test
	public void testConnectivesAndPredicatesByArity() {
		final Language language = Languages.CLASSICAL;
		assertEquals(ImmutableSet.of("~", "∧", "∨", "→", "↔"), language.connectives());
		assertEquals(ImmutableSet.of("∧", "∨", "→", "↔"), language.connectives(2));
		assertEquals(ImmutableSet.of("P", "Q"), language.predicates(1));
		assertEquals(ImmutableSet.of("S"), language.predicates(3));
	}

	@Test
	public void testKindOf() {
		final Language language = Languages.CLASSICAL_FUNCTION;
		assertEquals(Optional.of(SymbolKind.CONNECTIVE), language.kindOf("∧"));
		assertEquals(Optional.of(SymbolKind.QUANTIFIER), language.kindOf("∃"));
		assertEquals(Optional.of(SymbolKind.VARIABLE_METAVARIABLE), language.kindOf("χ"));
		assertEquals(Optional.of(SymbolKind.PREDICATE_VARIABLE), language.kindOf("X1"));
		assertEquals(Optional.of(SymbolKind.FUNCTION_SYMBOL), language.kindOf("f"));
		assertEquals(Optional.of(SymbolKind.SENTENTIAL_CONSTANT), language.kindOf("⊥"));
		assertEquals(Optional.empty(), language.kindOf("h"));
		assertTrue(language.kindOf("Π").get().isMetavariable());
	}

	@Test
	public void testConstantRecognizer() {
		final Language language = Languages.REAL_NUMBER_ARITHMETIC;
		assertTrue(language.isIndividualConstant("0"));
		assertTrue(language.isIndividualConstant("3.25"));
		assertTrue(language.isIndividualConstant("-7"));
		assertFalse(language.isIndividualConstant("x"));
		assertTrue(language.isFunctionSymbol("//"));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRepeatedSymbol() {
		Language.builder().individualConstants("a").variables("a").build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testConnectiveWithoutArguments() {
		Language.builder().connective("⊕", 0);
	}
}
