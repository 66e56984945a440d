package edu.uw.logics.language;

import edu.uw.logics.formula.Formula;

/**
 * Thrown when a formula is checked against a {@link Language} and is not well-formed.
 */
public class NotWellFormedException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	private final Formula formula;
	private final String reason;

	public NotWellFormedException(final Formula formula, final String reason) {
		super(reason);
		this.formula = formula;
		this.reason = reason;
	}

	public Formula getFormula() {
		return formula;
	}

	public String getReason() {
		return reason;
	}
}
