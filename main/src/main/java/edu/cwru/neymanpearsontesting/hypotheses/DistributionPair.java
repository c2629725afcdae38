package edu.cwru.neymanpearsontesting.hypotheses;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math3.distribution.BinomialDistribution;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;

import edu.cwru.neymanpearsontesting.analysis.AnalysisParams;
import edu.cwru.neymanpearsontesting.exceptions.InvalidInputException;

/**
 * Null and alternative probability mass functions over the outcome space
 * {0, ..., n - 1}. An alternative list shorter than the null list is padded
 * with zeros. Instances are immutable; accessors return copies.
 */
public final class DistributionPair {
	private final double[] nullProbabilities;
	private final double[] alternativeProbabilities;

	private DistributionPair(double[] nullProbabilities, double[] alternativeProbabilities) {
		this.nullProbabilities = nullProbabilities;
		this.alternativeProbabilities = alternativeProbabilities;
	}

	public static DistributionPair of(double[] nullProbabilities, double[] alternativeProbabilities) {
		return of(nullProbabilities, alternativeProbabilities, AnalysisParams.defaults().sumTolerance);
	}

	public static DistributionPair of(List<Double> nullProbabilities, List<Double> alternativeProbabilities) {
		Preconditions.checkNotNull(nullProbabilities, "null hypothesis");
		Preconditions.checkNotNull(alternativeProbabilities, "alternative hypothesis");
		return of(Doubles.toArray(nullProbabilities), Doubles.toArray(alternativeProbabilities));
	}

	/**
	 * Validating factory.
	 * 
	 * @param nullProbabilities        likelihoods under the null hypothesis
	 * @param alternativeProbabilities likelihoods under the alternative; may be
	 *                                 shorter than the null list
	 * @param sumTolerance             allowed absolute deviation of each sum from 1
	 * @return the pair, with the alternative padded to the null length
	 * @throws InvalidInputException on a domain mismatch, a negative or
	 *                               non-finite probability, or a bad sum
	 */
	public static DistributionPair of(double[] nullProbabilities, double[] alternativeProbabilities,
			double sumTolerance) {
		Preconditions.checkNotNull(nullProbabilities, "null hypothesis");
		Preconditions.checkNotNull(alternativeProbabilities, "alternative hypothesis");
		if (alternativeProbabilities.length > nullProbabilities.length)
			throw new InvalidInputException("Alternative covers " + alternativeProbabilities.length
					+ " outcomes but the null covers only " + nullProbabilities.length);

		double[] nulls = nullProbabilities.clone();
		double[] alts = Arrays.copyOf(alternativeProbabilities, nullProbabilities.length);
		checkDistribution("null", nulls, sumTolerance);
		checkDistribution("alternative", alts, sumTolerance);
		return new DistributionPair(nulls, alts);
	}

	/**
	 * Pair of binomial distributions over the number of successes in
	 * {@code trials} trials.
	 * 
	 * @param trials
	 * @param nullSuccess        success probability under the null
	 * @param alternativeSuccess success probability under the alternative
	 * @return pair over {0, ..., trials}
	 */
	public static DistributionPair binomial(int trials, double nullSuccess, double alternativeSuccess) {
		if (trials < 0)
			throw new InvalidInputException("Negative number of trials: " + trials);
		if (!(nullSuccess >= 0 && nullSuccess <= 1) || !(alternativeSuccess >= 0 && alternativeSuccess <= 1))
			throw new InvalidInputException(
					"Success probabilities must lie in [0, 1]: " + nullSuccess + ", " + alternativeSuccess);
		BinomialDistribution nullDistribution = new BinomialDistribution(trials, nullSuccess);
		BinomialDistribution alternativeDistribution = new BinomialDistribution(trials, alternativeSuccess);
		double[] nulls = new double[trials + 1];
		double[] alts = new double[trials + 1];
		for (int k = 0; k <= trials; k++) {
			nulls[k] = nullDistribution.probability(k);
			alts[k] = alternativeDistribution.probability(k);
		}
		return of(nulls, alts);
	}

	private static void checkDistribution(String name, double[] probabilities, double sumTolerance) {
		double sum = 0.0;
		for (int i = 0; i < probabilities.length; i++) {
			double p = probabilities[i];
			if (!Double.isFinite(p) || p < 0)
				throw new InvalidInputException(
						"Probability of outcome " + i + " under the " + name + " is invalid: " + p);
			sum += p;
		}
		if (Math.abs(sum - 1.0) > sumTolerance)
			throw new InvalidInputException("Probabilities under the " + name + " sum to " + sum
					+ ", outside 1 +/- " + sumTolerance + ": " + ArrayUtils.toString(probabilities));
	}

	/** Number of outcomes n. */
	public int outcomes() {
		return this.nullProbabilities.length;
	}

	public double nullProbability(int outcome) {
		return this.nullProbabilities[outcome];
	}

	public double alternativeProbability(int outcome) {
		return this.alternativeProbabilities[outcome];
	}

	public double[] getNullProbabilities() {
		return this.nullProbabilities.clone();
	}

	public double[] getAlternativeProbabilities() {
		return this.alternativeProbabilities.clone();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof DistributionPair))
			return false;
		DistributionPair other = (DistributionPair) o;
		return Arrays.equals(nullProbabilities, other.nullProbabilities)
				&& Arrays.equals(alternativeProbabilities, other.alternativeProbabilities);
	}

	@Override
	public int hashCode() {
		return 31 * Arrays.hashCode(nullProbabilities) + Arrays.hashCode(alternativeProbabilities);
	}

	@Override
	public String toString() {
		return "DistributionPair{null=" + Arrays.toString(nullProbabilities) + ", alternative="
				+ Arrays.toString(alternativeProbabilities) + "}";
	}
}
