package org.qintervals;

/**
 * Thrown when an operation asks a domain for something it cannot supply, such as the successor of its maximum, the value adjacent to a cut
 * in a dense domain, or the universe of an unbounded domain
 */
public class DomainException extends IllegalArgumentException {
	/** @param message The message describing the violation */
	public DomainException(String message) {
		super(message);
	}
}
