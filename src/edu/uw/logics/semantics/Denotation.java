package edu.uw.logics.semantics;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * What a predicate or function symbol means in a model. Three representations share one operation,
 * {@link #apply(List)}:
 * <ul>
 * <li>{@link Extension}: a set of members. Members of unary predicates are bare domain elements, members of n-ary
 * ones are n-element lists. Applying it answers membership.</li>
 * <li>{@link Graph}: a possibly partial function given as argument lists mapped to values.</li>
 * <li>{@link Computed}: a Java function, e.g. successor on the naturals.</li>
 * </ul>
 */
public abstract class Denotation {

	Denotation() {
	}

	public abstract Object apply(List<?> arguments);

	public Object apply(final Object... arguments) {
		return apply(Arrays.asList(arguments));
	}

	public boolean isComputed() {
		return false;
	}

	public static Extension extension(final Collection<?> members) {
		return new Extension(members);
	}

	public static Graph graph(final Map<? extends List<?>, ?> graph) {
		return new Graph(graph);
	}

	public static Computed computed(final Function<List<Object>, Object> function) {
		return new Computed(function);
	}

	/**
	 * An ordered tuple of domain elements, as used in n-ary extensions and function graphs.
	 */
	public static ImmutableList<Object> tuple(final Object... elements) {
		return ImmutableList.copyOf(elements);
	}

	public static class Extension extends Denotation {
		private final ImmutableSet<Object> members;

		private Extension(final Collection<?> members) {
			this.members = ImmutableSet.<Object> copyOf(members);
		}

		@Override
		public Boolean apply(final List<?> arguments) {
			Preconditions.checkArgument(!arguments.isEmpty(), "Extension applied to no arguments");
			if (arguments.size() == 1) {
				return members.contains(arguments.get(0));
			}
			return members.contains(ImmutableList.copyOf(arguments));
		}

		public ImmutableSet<Object> getMembers() {
			return members;
		}

		@Override
		public boolean equals(final Object obj) {
			return obj instanceof Extension && members.equals(((Extension) obj).members);
		}

		@Override
		public int hashCode() {
			return members.hashCode();
		}

		@Override
		public String toString() {
			return members.toString();
		}
	}

	public static class Graph extends Denotation {
		private final ImmutableMap<ImmutableList<Object>, Object> values;

		private Graph(final Map<? extends List<?>, ?> graph) {
			final ImmutableMap.Builder<ImmutableList<Object>, Object> builder = ImmutableMap.builder();
			for (final Map.Entry<? extends List<?>, ?> entry : graph.entrySet()) {
				builder.put(ImmutableList.<Object> copyOf(entry.getKey()), entry.getValue());
			}
			this.values = builder.build();
		}

		/**
		 * @throws DenotationException
		 *             if the function is not defined for the arguments
		 */
		@Override
		public Object apply(final List<?> arguments) {
			final Object result = values.get(ImmutableList.<Object> copyOf(arguments));
			if (result == null) {
				throw new DenotationException("Function " + values + " is not defined for " + arguments);
			}
			return result;
		}

		@Override
		public String toString() {
			return values.toString();
		}
	}

	public static class Computed extends Denotation {
		private final Function<List<Object>, Object> function;

		private Computed(final Function<List<Object>, Object> function) {
			this.function = Preconditions.checkNotNull(function);
		}

		@Override
		public Object apply(final List<?> arguments) {
			return function.apply(ImmutableList.<Object> copyOf(arguments));
		}

		@Override
		public boolean isComputed() {
			return true;
		}
	}
}
