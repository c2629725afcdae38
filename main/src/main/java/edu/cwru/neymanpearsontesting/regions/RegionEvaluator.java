package edu.cwru.neymanpearsontesting.regions;

import java.util.stream.IntStream;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.cwru.neymanpearsontesting.exceptions.InvalidInputException;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;

/**
 * Computes size and power of rejection regions. Probabilities are accumulated
 * in ascending outcome order, so a region gets bit-identical stats whether it
 * is evaluated alone or as part of a full enumeration.
 */
public class RegionEvaluator {

	/**
	 * Size and power of a single region.
	 * 
	 * @param region
	 * @param pair
	 * @return stats
	 * @throws InvalidInputException if the region reaches outside the pair's
	 *                               outcome space
	 */
	public RegionStats evaluate(Region region, DistributionPair pair) {
		Preconditions.checkNotNull(region);
		Preconditions.checkNotNull(pair);
		if (!region.fitsWithin(pair.outcomes()))
			throw new InvalidInputException(
					"Region " + region + " lies outside the outcome space of size " + pair.outcomes());
		double size = 0.0;
		double power = 0.0;
		for (int outcome : region.outcomes()) {
			size += pair.nullProbability(outcome);
			power += pair.alternativeProbability(outcome);
		}
		return new RegionStats(size, power);
	}

	/**
	 * Every region of the pair's outcome space with its stats, in enumeration
	 * order. Each region extends the one without its highest outcome, so the
	 * table is filled in a single pass.
	 * 
	 * @param enumerator
	 * @param pair
	 * @return evaluated regions ordered by bitmask
	 */
	public ImmutableList<EvaluatedRegion> evaluateAll(RegionEnumerator enumerator, DistributionPair pair) {
		checkDomain(enumerator, pair);
		int total = enumerator.totalRegions();
		double[] sizes = new double[total];
		double[] powers = new double[total];
		ImmutableList.Builder<EvaluatedRegion> ret = ImmutableList.builderWithExpectedSize(total);
		ret.add(new EvaluatedRegion(Region.empty(), new RegionStats(0.0, 0.0)));
		for (int mask = 1; mask < total; mask++) {
			int highest = 31 - Integer.numberOfLeadingZeros(mask);
			int rest = mask & ~(1 << highest);
			sizes[mask] = sizes[rest] + pair.nullProbability(highest);
			powers[mask] = powers[rest] + pair.alternativeProbability(highest);
			ret.add(new EvaluatedRegion(Region.fromMask(mask), new RegionStats(sizes[mask], powers[mask])));
		}
		return ret.build();
	}

	/**
	 * Multithreading version of {@link #evaluateAll}. Regions are independent,
	 * so each is summed on its own; the result keeps enumeration order.
	 * 
	 * @param enumerator
	 * @param pair
	 * @return evaluated regions ordered by bitmask
	 */
	public ImmutableList<EvaluatedRegion> evaluateAllParallel(RegionEnumerator enumerator, DistributionPair pair) {
		checkDomain(enumerator, pair);
		return IntStream.range(0, enumerator.totalRegions()).parallel()
				.mapToObj(mask -> {
					Region region = Region.fromMask(mask);
					return new EvaluatedRegion(region, evaluate(region, pair));
				})
				.collect(ImmutableList.toImmutableList());
	}

	private static void checkDomain(RegionEnumerator enumerator, DistributionPair pair) {
		Preconditions.checkNotNull(enumerator);
		Preconditions.checkNotNull(pair);
		if (enumerator.getOutcomes() != pair.outcomes())
			throw new InvalidInputException("Enumerator covers " + enumerator.getOutcomes()
					+ " outcomes but the distributions cover " + pair.outcomes());
	}
}
