package edu.cwru.neymanpearsontesting.analysis;

import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;

/**
 * One row of a {@link RegionAnalysis}.
 */
public final class AnalyzedRegion {
	private final EvaluatedRegion evaluated;
	private final boolean dominated;
	private final boolean likelihoodRatioTest;

	public AnalyzedRegion(EvaluatedRegion evaluated, boolean dominated, boolean likelihoodRatioTest) {
		this.evaluated = evaluated;
		this.dominated = dominated;
		this.likelihoodRatioTest = likelihoodRatioTest;
	}

	public Region getRegion() {
		return evaluated.getRegion();
	}

	public double getSize() {
		return evaluated.getSize();
	}

	public double getPower() {
		return evaluated.getPower();
	}

	public EvaluatedRegion getEvaluated() {
		return this.evaluated;
	}

	public boolean isDominated() {
		return this.dominated;
	}

	public boolean isLikelihoodRatioTest() {
		return this.likelihoodRatioTest;
	}

	@Override
	public String toString() {
		return evaluated + ", " + dominated + ", " + likelihoodRatioTest;
	}
}
