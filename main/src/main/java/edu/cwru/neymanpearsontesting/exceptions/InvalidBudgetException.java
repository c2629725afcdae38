package edu.cwru.neymanpearsontesting.exceptions;

/**
 * Thrown when a size budget admits no rejection region, i.e. it is negative or
 * not a number.
 */
public class InvalidBudgetException extends IllegalArgumentException {
	private static final long serialVersionUID = 1L;

	private final double maxSize;

	public InvalidBudgetException(double maxSize) {
		super("Size budget must be a non-negative number: " + maxSize);
		this.maxSize = maxSize;
	}

	public double getMaxSize() {
		return this.maxSize;
	}
}
