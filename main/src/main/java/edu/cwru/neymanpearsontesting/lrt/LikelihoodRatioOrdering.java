package edu.cwru.neymanpearsontesting.lrt;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import edu.cwru.neymanpearsontesting.regions.Region;

/**
 * Outcomes grouped by strictly decreasing likelihood ratio, and the prefix
 * regions built from those groups: the empty region, the first group, the
 * first two groups, ..., the full space.
 */
public final class LikelihoodRatioOrdering {
	private final double[] ratios;
	private final ImmutableList<TieGroup> groups;
	private final ImmutableList<Region> prefixRegions;
	private final ImmutableSet<Region> prefixSet;

	LikelihoodRatioOrdering(double[] ratios, ImmutableList<TieGroup> groups) {
		this.ratios = ratios;
		this.groups = groups;
		ImmutableList.Builder<Region> prefixes = ImmutableList.builderWithExpectedSize(groups.size() + 1);
		Region cumulative = Region.empty();
		prefixes.add(cumulative);
		for (TieGroup group : groups) {
			cumulative = cumulative.union(group.getOutcomes());
			prefixes.add(cumulative);
		}
		this.prefixRegions = prefixes.build();
		this.prefixSet = ImmutableSet.copyOf(prefixRegions);
	}

	/** Likelihood ratio of each outcome, alternative over null. */
	public double[] getRatios() {
		return this.ratios.clone();
	}

	public double ratio(int outcome) {
		return this.ratios[outcome];
	}

	public ImmutableList<TieGroup> getGroups() {
		return this.groups;
	}

	/** Prefix regions in order of growing size; one more than the groups. */
	public ImmutableList<Region> getPrefixRegions() {
		return this.prefixRegions;
	}

	/**
	 * @param region
	 * @return whether {@code region} is, as a set, one of the prefix regions
	 */
	public boolean isLikelihoodRatioTest(Region region) {
		return prefixSet.contains(region);
	}
}
