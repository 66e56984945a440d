package edu.uw.logics.semantics;

import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;

import com.google.common.collect.ImmutableMap;
import com.google.common.math.LongMath;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Longs;

/**
 * Arithmetic where every numeral is an individual constant denoting its number: integral numerals denote
 * {@link Long}s, the others {@link Double}s. Operations stay integral while both operands are, except / which always
 * divides exactly; // is floor division.
 */
public class RealNumberArithmeticModel extends Model {

	private static final Map<String, Object> FIXED = ImmutableMap.<String, Object> builder()
			.put("+", operation(LongMath::checkedAdd, (x, y) -> x + y))
			.put("-", operation(LongMath::checkedSubtract, (x, y) -> x - y))
			.put("*", operation(LongMath::checkedMultiply, (x, y) -> x * y))
			.put("/", Denotation.computed(x -> number(x, 0).doubleValue() / number(x, 1).doubleValue()))
			.put("//", operation(Math::floorDiv, (x, y) -> Math.floor(x / y)))
			.put("**", Denotation.computed(RealNumberArithmeticModel::power))
			.put("=", relation(x -> x == 0))
			.put(">", relation(x -> x > 0))
			.put("<", relation(x -> x < 0))
			.build();

	public RealNumberArithmeticModel(final Iterable<?> domain) {
		this(domain, ImmutableMap.of());
	}

	public RealNumberArithmeticModel(final Iterable<?> domain, final Map<String, ?> denotations) {
		super(domain, denotations);
	}

	/**
	 * The number a numeral denotes, or null if the symbol is not a numeral.
	 */
	public static Number parseNumeral(final String symbol) {
		final Long integral = Longs.tryParse(symbol);
		if (integral != null) {
			return integral;
		}
		return Doubles.tryParse(symbol);
	}

	@Override
	protected Object fixedDenotation(final String symbol) {
		final Number numeral = parseNumeral(symbol);
		if (numeral != null) {
			return numeral;
		}
		return FIXED.get(symbol);
	}

	private static Number number(final List<Object> arguments, final int index) {
		return (Number) arguments.get(index);
	}

	private static boolean integral(final Number x, final Number y) {
		return x instanceof Long && y instanceof Long;
	}

	private static Denotation operation(final BinaryOperator<Long> onIntegers, final BinaryOperator<Double> onReals) {
		return Denotation.computed(arguments -> {
			final Number x = number(arguments, 0);
			final Number y = number(arguments, 1);
			if (integral(x, y)) {
				return onIntegers.apply(x.longValue(), y.longValue());
			}
			return onReals.apply(x.doubleValue(), y.doubleValue());
		});
	}

	private static Object power(final List<Object> arguments) {
		final Number x = number(arguments, 0);
		final Number y = number(arguments, 1);
		if (integral(x, y) && y.longValue() >= 0 && y.longValue() <= Integer.MAX_VALUE) {
			return LongMath.checkedPow(x.longValue(), (int) y.longValue());
		}
		return Math.pow(x.doubleValue(), y.doubleValue());
	}

	/**
	 * A relation given by the sign of the comparison of its arguments.
	 */
	private static Denotation relation(final IntPredicate holds) {
		return Denotation.computed(arguments -> holds.test(compare(number(arguments, 0), number(arguments, 1)))
				? "1" : "0");
	}

	private static int compare(final Number x, final Number y) {
		if (integral(x, y)) {
			return Long.compare(x.longValue(), y.longValue());
		}
		return Double.compare(x.doubleValue(), y.doubleValue());
	}
}
