package edu.cwru.neymanpearsontesting.dominance;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;

/**
 * Flags the regions that are dominated: some other region has size &lt;= and
 * power &gt;= with at least one strict. Regions sharing identical size and
 * power never dominate one another.
 */
public class DominanceAnalyzer {
	private static final Logger logger = LogManager.getLogger(DominanceAnalyzer.class);

	private static final Comparator<EvaluatedRegion> BY_SIZE_THEN_POWER_DESCENDING = Comparator
			.comparingDouble(EvaluatedRegion::getSize)
			.thenComparing(Comparator.comparingDouble(EvaluatedRegion::getPower).reversed());

	/**
	 * Pairwise comparison of every region against every other.
	 * 
	 * @param evaluated
	 * @return region to dominated flag, in input order
	 */
	public ImmutableMap<Region, Boolean> analyzePairwise(List<EvaluatedRegion> evaluated) {
		Preconditions.checkNotNull(evaluated);
		boolean[] dominated = new boolean[evaluated.size()];
		for (int a = 0; a < evaluated.size(); a++)
			dominated[a] = isDominated(a, evaluated);
		return collect(evaluated, dominated);
	}

	/**
	 * Multithreading version of {@link #analyzePairwise}. Reads the completed
	 * stats table only; each region's flag is independent of the others.
	 * 
	 * @param evaluated
	 * @return region to dominated flag, in input order
	 */
	public ImmutableMap<Region, Boolean> analyzePairwiseParallel(List<EvaluatedRegion> evaluated) {
		Preconditions.checkNotNull(evaluated);
		boolean[] dominated = new boolean[evaluated.size()];
		IntStream.range(0, evaluated.size()).parallel().forEach(a -> {
			dominated[a] = isDominated(a, evaluated);
		});
		return collect(evaluated, dominated);
	}

	/**
	 * Same flags as {@link #analyzePairwise}, from one sweep over the regions
	 * sorted by increasing size. A region is dominated iff a strictly smaller
	 * region reaches at least its power, or an equally sized one reaches more.
	 * 
	 * @param evaluated
	 * @return region to dominated flag, in input order
	 */
	public ImmutableMap<Region, Boolean> analyze(List<EvaluatedRegion> evaluated) {
		Preconditions.checkNotNull(evaluated);
		int[] order = IntStream.range(0, evaluated.size()).boxed()
				.sorted(Comparator.comparing(evaluated::get, BY_SIZE_THEN_POWER_DESCENDING))
				.mapToInt(Integer::intValue).toArray();

		boolean[] dominated = new boolean[evaluated.size()];
		double bestPowerAtSmallerSize = Double.NEGATIVE_INFINITY;
		int start = 0;
		while (start < order.length) {
			double size = evaluated.get(order[start]).getSize();
			// sorted by power descending within a size, so the first is the best
			double bestPowerAtThisSize = evaluated.get(order[start]).getPower();
			int end = start;
			while (end < order.length && Double.compare(evaluated.get(order[end]).getSize(), size) == 0) {
				double power = evaluated.get(order[end]).getPower();
				dominated[order[end]] = bestPowerAtSmallerSize >= power || bestPowerAtThisSize > power;
				end++;
			}
			bestPowerAtSmallerSize = Math.max(bestPowerAtSmallerSize, bestPowerAtThisSize);
			start = end;
		}
		return collect(evaluated, dominated);
	}

	private static boolean isDominated(int a, List<EvaluatedRegion> evaluated) {
		EvaluatedRegion candidate = evaluated.get(a);
		for (int b = 0; b < evaluated.size(); b++) {
			if (b != a && evaluated.get(b).getStats().dominates(candidate.getStats()))
				return true;
		}
		return false;
	}

	private static ImmutableMap<Region, Boolean> collect(List<EvaluatedRegion> evaluated, boolean[] dominated) {
		ImmutableMap.Builder<Region, Boolean> ret = ImmutableMap.builderWithExpectedSize(evaluated.size());
		int count = 0;
		for (int i = 0; i < dominated.length; i++) {
			ret.put(evaluated.get(i).getRegion(), dominated[i]);
			if (dominated[i])
				count++;
		}
		logger.debug("{} of {} regions are dominated", count, dominated.length);
		return ret.buildOrThrow();
	}

	public static ImmutableList<Region> undominated(Map<Region, Boolean> flags) {
		return flags.entrySet().stream().filter(e -> !e.getValue()).map(Map.Entry::getKey)
				.collect(ImmutableList.toImmutableList());
	}
}
