package edu.uw.logics.semantics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class AssignmentTest {

	@Test
	public void testBindLeavesReceiverUntouched() {
		final Assignment outer = Assignment.empty().bind("x", 1);
		final Assignment inner = outer.bind("x", 2).bind("y", 3);
		assertEquals(1, outer.get("x"));
		assertFalse(outer.contains("y"));
		assertEquals(2, inner.get("x"));
		assertEquals(3, inner.get("y"));
	}

	@Test
	public void testAsMapShowsInnermostValues() {
		final Assignment assignment = Assignment.of(ImmutableMap.of("x", "a", "y", "b")).bind("x", "c");
		assertEquals(ImmutableMap.of("x", "c", "y", "b"), assignment.asMap());
	}

	@Test
	public void testEmpty() {
		assertNull(Assignment.empty().get("x"));
		assertTrue(Assignment.empty().asMap().isEmpty());
	}

	@Test(expected = NullPointerException.class)
	public void testNullValue() {
		Assignment.empty().bind("x", null);
	}
}
