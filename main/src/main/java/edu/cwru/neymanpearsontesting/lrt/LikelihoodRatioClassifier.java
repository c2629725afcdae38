package edu.cwru.neymanpearsontesting.lrt;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.neymanpearsontesting.analysis.AnalysisParams;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.utilities.Utility;

/**
 * Orders outcomes by likelihood ratio and decides which regions are
 * likelihood-ratio tests. A region is an LRT iff it equals one of the prefix
 * regions of the ordering; a numeric threshold per outcome would split tie
 * groups.
 */
public class LikelihoodRatioClassifier {
	private static final Logger logger = LogManager.getLogger(LikelihoodRatioClassifier.class);

	/** Descending ratio, NaN last. */
	private static final Comparator<Double> DESCENDING_RATIO = (a, b) -> {
		if (Double.isNaN(a) || Double.isNaN(b))
			return Boolean.compare(Double.isNaN(a), Double.isNaN(b));
		return Double.compare(b, a);
	};

	private final double ratioTolerance;

	public LikelihoodRatioClassifier(AnalysisParams params) {
		this.ratioTolerance = Preconditions.checkNotNull(params).ratioTolerance;
	}

	public LikelihoodRatioClassifier() {
		this(AnalysisParams.defaults());
	}

	/**
	 * alt(x) / null(x). Positive infinity when only the null probability is 0,
	 * NaN when both are.
	 * 
	 * @param nullProbability
	 * @param alternativeProbability
	 * @return likelihood ratio
	 */
	public static double likelihoodRatio(double nullProbability, double alternativeProbability) {
		if (nullProbability == 0.0)
			return alternativeProbability > 0.0 ? Double.POSITIVE_INFINITY : Double.NaN;
		return alternativeProbability / nullProbability;
	}

	public static double[] likelihoodRatios(DistributionPair pair) {
		Preconditions.checkNotNull(pair);
		double[] ret = new double[pair.outcomes()];
		for (int i = 0; i < ret.length; i++)
			ret[i] = likelihoodRatio(pair.nullProbability(i), pair.alternativeProbability(i));
		return ret;
	}

	/**
	 * Groups the outcomes by decreasing likelihood ratio. An outcome joins the
	 * current group when its ratio ties with the group's first ratio, so a run of
	 * slowly drifting ratios cannot chain into one group.
	 * 
	 * @param pair
	 * @return ordering with its prefix regions
	 */
	public LikelihoodRatioOrdering order(DistributionPair pair) {
		double[] ratios = likelihoodRatios(pair);
		List<Integer> sorted = IntStream.range(0, ratios.length).boxed()
				.sorted(Comparator.comparing(i -> ratios[i], DESCENDING_RATIO))
				.collect(ImmutableList.toImmutableList());

		List<TieGroup> groups = new ArrayList<>();
		double leader = Double.NaN;
		int members = 0;
		for (int outcome : sorted) {
			if (members != 0 && !Utility.ratiosTie(leader, ratios[outcome], ratioTolerance)) {
				groups.add(new TieGroup(leader, Region.fromMask(members)));
				members = 0;
			}
			if (members == 0)
				leader = ratios[outcome];
			members |= (1 << outcome);
		}
		if (members != 0)
			groups.add(new TieGroup(leader, Region.fromMask(members)));

		logger.debug("{} outcomes fall into {} likelihood-ratio groups: {}", ratios.length, groups.size(), groups);
		return new LikelihoodRatioOrdering(ratios, ImmutableList.copyOf(groups));
	}

	/**
	 * LRT flag for each of the given regions, in iteration order.
	 * 
	 * @param pair
	 * @param regions usually the output of a
	 *                {@link edu.cwru.neymanpearsontesting.regions.RegionEnumerator}
	 * @return region to LRT flag
	 */
	public ImmutableMap<Region, Boolean> classify(DistributionPair pair, Iterable<Region> regions) {
		LikelihoodRatioOrdering ordering = order(pair);
		ImmutableMap.Builder<Region, Boolean> ret = ImmutableMap.builder();
		for (Region region : regions)
			ret.put(region, ordering.isLikelihoodRatioTest(region));
		return ret.buildOrThrow();
	}
}
