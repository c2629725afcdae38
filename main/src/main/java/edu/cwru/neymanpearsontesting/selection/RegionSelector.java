package edu.cwru.neymanpearsontesting.selection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;

import edu.cwru.neymanpearsontesting.exceptions.InvalidBudgetException;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioClassifier;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioOrdering;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.regions.RegionEvaluator;

/**
 * Picks the most powerful likelihood-ratio test whose size stays within a
 * budget. Only the prefix regions of the likelihood-ratio ordering are
 * searched; no other region can beat the best of them.
 */
public class RegionSelector {
	private static final Logger logger = LogManager.getLogger(RegionSelector.class);

	private final LikelihoodRatioClassifier classifier;
	private final RegionEvaluator evaluator;

	public RegionSelector(LikelihoodRatioClassifier classifier, RegionEvaluator evaluator) {
		this.classifier = Preconditions.checkNotNull(classifier);
		this.evaluator = Preconditions.checkNotNull(evaluator);
	}

	public RegionSelector() {
		this(new LikelihoodRatioClassifier(), new RegionEvaluator());
	}

	/**
	 * @param pair
	 * @param maxSize largest acceptable size
	 * @return the selected region
	 * @throws InvalidBudgetException if {@code maxSize} is negative or NaN
	 */
	public Region select(DistributionPair pair, double maxSize) {
		return selectEvaluated(pair, maxSize).getRegion();
	}

	/**
	 * Like {@link #select} but returns the selected region's stats as well.
	 * Ties in power go to the smaller size, then to the earlier prefix.
	 * 
	 * @param pair
	 * @param maxSize
	 * @return the selected region with its size and power
	 */
	public EvaluatedRegion selectEvaluated(DistributionPair pair, double maxSize) {
		Preconditions.checkNotNull(pair);
		if (Double.isNaN(maxSize) || maxSize < 0)
			throw new InvalidBudgetException(maxSize);

		LikelihoodRatioOrdering ordering = classifier.order(pair);
		EvaluatedRegion best = null;
		for (Region prefix : ordering.getPrefixRegions()) {
			EvaluatedRegion candidate = new EvaluatedRegion(prefix, evaluator.evaluate(prefix, pair));
			if (candidate.getSize() > maxSize)
				continue;
			if (best == null || candidate.getPower() > best.getPower()
					|| (candidate.getPower() == best.getPower() && candidate.getSize() < best.getSize()))
				best = candidate;
		}
		// the empty prefix has size 0, so a non-negative budget always admits it
		if (best == null)
			throw new InvalidBudgetException(maxSize);
		logger.debug("Selected {} for budget {}", best, maxSize);
		return best;
	}
}
