package edu.cwru.neymanpearsontesting.exceptions;

/**
 * Thrown when a hypothesis pair, an outcome count or a region violates the
 * input contract. Nothing is computed once this is thrown.
 */
public class InvalidInputException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	public InvalidInputException(String message) {
		super(message);
	}
}
