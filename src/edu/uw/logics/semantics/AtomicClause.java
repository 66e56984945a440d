package edu.uw.logics.semantics;

import java.util.List;

/**
 * Valuation of an atomic formula whose predicate is not computed: given the predicate's denotation and the
 * denotations of its terms, return a truth value. Classical semantics answers with membership in the extension;
 * other semantics can read extensions and anti-extensions, or relations, their own way.
 */
@FunctionalInterface
public interface AtomicClause {
	String apply(Denotation predicate, List<Object> arguments);
}
