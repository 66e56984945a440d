package edu.uw.logics.semantics;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.FluentIterable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The range of a predicate variable of arity n: every subset of D (n = 1) or of D^n, as {@link Denotation.Extension}s.
 *
 * Subsets come in order of size, starting with the empty set; subsets of the same size come in the lexicographic
 * order of the positions of their members in the base sequence, and n-tuples in the order of the n-fold product.
 * Nothing is materialized up front, so the range can be consumed over an unbounded domain (where it never gets past
 * the singletons). Every call to {@link #iterator()} starts again from the empty set.
 */
public class QuantificationRange implements Iterable<Denotation> {
	private final Iterable<?> base;

	private QuantificationRange(final Iterable<?> base) {
		this.base = base;
	}

	public static QuantificationRange forPredicateVariable(final Iterable<?> domain, final int arity) {
		Preconditions.checkArgument(arity > 0, "Predicate variables have positive arity");
		return new QuantificationRange(arity == 1 ? domain : tuples(domain, arity));
	}

	/**
	 * D^n as n-element lists, in product order.
	 */
	static Iterable<ImmutableList<Object>> tuples(final Iterable<?> domain, final int arity) {
		if (arity == 0) {
			return ImmutableList.of(ImmutableList.<Object> of());
		}
		final Iterable<ImmutableList<Object>> shorter = tuples(domain, arity - 1);
		return FluentIterable.from(domain).transformAndConcat(first -> FluentIterable.from(shorter)
				.transform(rest -> ImmutableList.<Object> builder().add(first).addAll(rest).build()));
	}

	@Override
	public Iterator<Denotation> iterator() {
		return new SubsetIterator(base.iterator());
	}

	/**
	 * Walks the k-combinations of the base, k = 0, 1, 2, ..., pulling base elements only as they are needed.
	 */
	private static class SubsetIterator extends AbstractIterator<Denotation> {
		private final Iterator<?> source;
		private final List<Object> buffer = new ArrayList<>();
		// Positions of the members of the next subset, null before the empty set has been returned.
		private int[] indices;

		SubsetIterator(final Iterator<?> source) {
			this.source = source;
		}

		private boolean available(final int position) {
			while (buffer.size() <= position && source.hasNext()) {
				buffer.add(source.next());
			}
			return buffer.size() > position;
		}

		@Override
		protected Denotation computeNext() {
			if (indices == null) {
				indices = new int[0];
				return Denotation.extension(ImmutableSet.of());
			}
			if (!advance()) {
				return endOfData();
			}
			final ImmutableSet.Builder<Object> members = ImmutableSet.builder();
			for (final int index : indices) {
				members.add(buffer.get(index));
			}
			return Denotation.extension(members.build());
		}

		private boolean advance() {
			final int k = indices.length;
			for (int i = k - 1; i >= 0; i--) {
				// indices[i] can move right if the remaining k - i - 1 positions still fit after it
				if (available(indices[i] + k - i)) {
					indices[i]++;
					for (int j = i + 1; j < k; j++) {
						indices[j] = indices[j - 1] + 1;
					}
					return true;
				}
			}
			if (!available(k)) {
				return false;
			}
			indices = new int[k + 1];
			for (int i = 0; i <= k; i++) {
				indices[i] = i;
			}
			return true;
		}
	}
}
