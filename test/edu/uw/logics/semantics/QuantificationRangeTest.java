package edu.uw.logics.semantics;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;

public class QuantificationRangeTest {

	private static List<Set<Object>> members(final Iterable<Denotation> range) {
		final List<Set<Object>> result = new ArrayList<>();
		for (final Denotation denotation : range) {
			result.add(((Denotation.Extension) denotation).getMembers());
		}
		return result;
	}

	@Test
	public void testUnary() {
		assertEquals(ImmutableList.of(ImmutableSet.of(), ImmutableSet.of(1), ImmutableSet.of(2),
				ImmutableSet.of(1, 2)), members(QuantificationRange.forPredicateVariable(ImmutableList.of(1, 2), 1)));
	}

	@Test
	public void testBinary() {
		final List<Set<Object>> subsets = members(
				QuantificationRange.forPredicateVariable(ImmutableList.of(1, 2), 2));
		assertEquals(16, subsets.size());
		assertEquals(ImmutableList.of(
				ImmutableSet.of(),
				ImmutableSet.of(Denotation.tuple(1, 1)),
				ImmutableSet.of(Denotation.tuple(1, 2)),
				ImmutableSet.of(Denotation.tuple(2, 1)),
				ImmutableSet.of(Denotation.tuple(2, 2)),
				ImmutableSet.of(Denotation.tuple(1, 1), Denotation.tuple(1, 2))), subsets.subList(0, 6));
		assertEquals(ImmutableSet.of(Denotation.tuple(1, 1), Denotation.tuple(1, 2), Denotation.tuple(2, 1),
				Denotation.tuple(2, 2)), subsets.get(15));
		assertEquals(16, ImmutableSet.copyOf(subsets).size());
	}

	@Test
	public void testTuples() {
		assertEquals(ImmutableList.of(Denotation.tuple("a", "a"), Denotation.tuple("a", "b"),
				Denotation.tuple("b", "a"), Denotation.tuple("b", "b")),
				ImmutableList.copyOf(QuantificationRange.tuples(ImmutableList.of("a", "b"), 2)));
	}

	@Test
	public void testRestartable() {
		final QuantificationRange range = QuantificationRange.forPredicateVariable(ImmutableList.of(1, 2, 3), 1);
		assertEquals(8, Iterables.size(range));
		assertEquals(members(range), members(range));
	}

	@Test
	public void testUnboundedDomain() {
		final QuantificationRange range = QuantificationRange.forPredicateVariable(ArithmeticModel.naturals(), 1);
		assertEquals(ImmutableList.of(ImmutableSet.of(), ImmutableSet.of(0L), ImmutableSet.of(1L),
				ImmutableSet.of(2L)), members(Iterables.limit(range, 4)));
	}

	@Test
	public void testEmptyDomain() {
		assertEquals(ImmutableList.of(ImmutableSet.of()),
				members(QuantificationRange.forPredicateVariable(ImmutableList.of(), 1)));
	}
}
