package edu.uw.logics.semantics;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import com.google.common.math.LongMath;
import com.google.common.primitives.Ints;

/**
 * Model of arithmetic over the natural numbers (as {@link Long}s) where 0, s, +, *, ** and the relations =, &gt; and
 * &lt; have their standard meaning. The domain is unbounded, so quantified formulas terminate only when the fast
 * quantifier clauses find a deciding element.
 */
public class ArithmeticModel extends Model {

	private static final Map<String, Object> FIXED = ImmutableMap.<String, Object> builder()
			.put("0", 0L)
			.put("s", Denotation.computed(x -> LongMath.checkedAdd(natural(x, 0), 1)))
			.put("+", binary(LongMath::checkedAdd))
			.put("*", binary(LongMath::checkedMultiply))
			.put("**", binary((x, y) -> LongMath.checkedPow(x, Ints.checkedCast(y))))
			.put("=", relation((x, y) -> x.longValue() == y.longValue()))
			.put(">", relation((x, y) -> x > y))
			.put("<", relation((x, y) -> x < y))
			.build();

	public static Iterable<Long> naturals() {
		return ContiguousSet.create(Range.atLeast(0L), DiscreteDomain.longs());
	}

	public ArithmeticModel() {
		this(ImmutableMap.of());
	}

	/**
	 * Arithmetic with additional denotations, e.g. for predicate letters of an extended language.
	 */
	public ArithmeticModel(final Map<String, ?> denotations) {
		super(naturals(), denotations);
	}

	@Override
	protected Object fixedDenotation(final String symbol) {
		return FIXED.get(symbol);
	}

	private static long natural(final List<Object> arguments, final int index) {
		return ((Number) arguments.get(index)).longValue();
	}

	private static Denotation binary(final BiFunction<Long, Long, Long> operation) {
		return Denotation.computed(x -> operation.apply(natural(x, 0), natural(x, 1)));
	}

	private static Denotation relation(final BiFunction<Long, Long, Boolean> relation) {
		return Denotation.computed(x -> relation.apply(natural(x, 0), natural(x, 1)) ? "1" : "0");
	}
}
