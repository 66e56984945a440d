package edu.uw.logics.formula;

/**
 * Thrown when a schema is instantiated with a substitution that has no binding for one of its metavariables.
 */
public class UnboundMetavariableException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final String metavariable;

	public UnboundMetavariableException(final String metavariable) {
		super("Metavariable " + metavariable + " not present in substitution dict given");
		this.metavariable = metavariable;
	}

	public String getMetavariable() {
		return metavariable;
	}
}
