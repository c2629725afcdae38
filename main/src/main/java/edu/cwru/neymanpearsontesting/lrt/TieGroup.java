package edu.cwru.neymanpearsontesting.lrt;

import edu.cwru.neymanpearsontesting.regions.Region;

/**
 * Outcomes sharing one likelihood ratio. A group enters or leaves a
 * likelihood-ratio test as a whole. The ratio of the trailing group of
 * outcomes impossible under both hypotheses is NaN.
 */
public final class TieGroup {
	private final double ratio;
	private final Region outcomes;

	TieGroup(double ratio, Region outcomes) {
		this.ratio = ratio;
		this.outcomes = outcomes;
	}

	/** Ratio of the first outcome placed in the group. */
	public double getRatio() {
		return this.ratio;
	}

	public Region getOutcomes() {
		return this.outcomes;
	}

	public boolean isIrrelevant() {
		return Double.isNaN(ratio);
	}

	@Override
	public String toString() {
		return outcomes + " @ " + ratio;
	}
}
