package edu.uw.logics.semantics;

/**
 * Thrown when a term has no value in a model under an assignment, or a partial function is applied outside its
 * graph. Callers may recover by trying another model or assignment.
 */
public class DenotationException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public DenotationException(final String message) {
		super(message);
	}

	static DenotationException noDenotation(final Object term) {
		return new DenotationException("Term " + term + " does not have a denotation assigned");
	}
}
