package edu.cwru.neymanpearsontesting.regions;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.cwru.neymanpearsontesting.analysis.AnalysisParams;
import edu.cwru.neymanpearsontesting.exceptions.InvalidInputException;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;

/**
 * The power set of the outcome space {0, ..., n - 1}, generated lazily in
 * ascending bitmask order: (), (0), (1), (0, 1), (2), ... Each call to
 * {@link #iterator()} restarts the enumeration.
 */
public class RegionEnumerator implements Iterable<Region> {
	private static final Logger logger = LogManager.getLogger(RegionEnumerator.class);

	private final int outcomes;

	/**
	 * @param outcomes number of outcomes n
	 * @param params   supplies the outcome limits
	 * @throws InvalidInputException if n is negative or above the configured
	 *                               maximum
	 */
	public RegionEnumerator(int outcomes, AnalysisParams params) {
		Preconditions.checkNotNull(params);
		if (outcomes < 0)
			throw new InvalidInputException("Number of outcomes must be non-negative: " + outcomes);
		if (outcomes > params.maxOutcomes)
			throw new InvalidInputException(
					"Number of outcomes " + outcomes + " exceeds the maximum of " + params.maxOutcomes);
		if (outcomes > params.warnOutcomes)
			logger.warn("Enumerating {} regions over {} outcomes", 1L << outcomes, outcomes);
		this.outcomes = outcomes;
	}

	public RegionEnumerator(int outcomes) {
		this(outcomes, AnalysisParams.defaults());
	}

	/**
	 * Enumerator over the domain of {@code pair}.
	 * 
	 * @param pair
	 * @param params
	 * @return enumerator over {0, ..., pair.outcomes() - 1}
	 */
	public static RegionEnumerator forPair(DistributionPair pair, AnalysisParams params) {
		return new RegionEnumerator(Preconditions.checkNotNull(pair).outcomes(), params);
	}

	/**
	 * Checks that an explicitly requested outcome count agrees with a pair's
	 * domain before enumerating.
	 * 
	 * @param outcomes
	 * @param pair
	 * @param params
	 * @return enumerator over {0, ..., outcomes - 1}
	 */
	public static RegionEnumerator forPair(int outcomes, DistributionPair pair, AnalysisParams params) {
		Preconditions.checkNotNull(pair);
		if (outcomes != pair.outcomes())
			throw new InvalidInputException(
					"Requested " + outcomes + " outcomes but the distributions cover " + pair.outcomes());
		return new RegionEnumerator(outcomes, params);
	}

	public int getOutcomes() {
		return this.outcomes;
	}

	/** Number of regions, 2^n. */
	public int totalRegions() {
		return 1 << outcomes;
	}

	@Override
	public Iterator<Region> iterator() {
		return new Iterator<Region>() {
			private int next = 0;

			@Override
			public boolean hasNext() {
				return next < totalRegions();
			}

			@Override
			public Region next() {
				if (!hasNext())
					throw new NoSuchElementException();
				return Region.fromMask(next++);
			}
		};
	}

	public Stream<Region> stream() {
		return IntStream.range(0, totalRegions()).mapToObj(Region::fromMask);
	}

	public ImmutableList<Region> toList() {
		return ImmutableList.copyOf(this);
	}
}
