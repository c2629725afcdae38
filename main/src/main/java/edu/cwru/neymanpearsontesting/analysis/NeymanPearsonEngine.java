package edu.cwru.neymanpearsontesting.analysis;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.neymanpearsontesting.dominance.DominanceAnalyzer;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioClassifier;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioOrdering;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.regions.RegionEnumerator;
import edu.cwru.neymanpearsontesting.regions.RegionEvaluator;
import edu.cwru.neymanpearsontesting.regions.RegionStats;
import edu.cwru.neymanpearsontesting.selection.RegionSelector;

/**
 * Wires the enumerator, evaluator, classifier, dominance analyzer and selector
 * together. Stateless apart from its parameters; every call recomputes from
 * the pair it is given.
 */
public class NeymanPearsonEngine implements RejectionRegionEngine {
	private static final Logger logger = LogManager.getLogger(NeymanPearsonEngine.class);

	private final AnalysisParams params;
	private final RegionEvaluator evaluator;
	private final LikelihoodRatioClassifier classifier;
	private final DominanceAnalyzer dominanceAnalyzer;
	private final RegionSelector selector;

	public NeymanPearsonEngine(AnalysisParams params) {
		params.validate();
		this.params = params;
		this.evaluator = new RegionEvaluator();
		this.classifier = new LikelihoodRatioClassifier(params);
		this.dominanceAnalyzer = new DominanceAnalyzer();
		this.selector = new RegionSelector(classifier, evaluator);
	}

	public NeymanPearsonEngine() {
		this(AnalysisParams.defaults());
	}

	public AnalysisParams getParams() {
		return this.params;
	}

	/**
	 * Parses a pair with this engine's sum tolerance.
	 * 
	 * @param nullProbabilities
	 * @param alternativeProbabilities
	 * @return validated pair
	 */
	public DistributionPair distributions(double[] nullProbabilities, double[] alternativeProbabilities) {
		return DistributionPair.of(nullProbabilities, alternativeProbabilities, params.sumTolerance);
	}

	@Override
	public RegionEnumerator enumerateRegions(int outcomes) {
		return new RegionEnumerator(outcomes, params);
	}

	@Override
	public RegionStats evaluate(Region region, DistributionPair pair) {
		return evaluator.evaluate(region, pair);
	}

	@Override
	public ImmutableList<EvaluatedRegion> evaluateAll(DistributionPair pair) {
		RegionEnumerator enumerator = RegionEnumerator.forPair(pair, params);
		return params.parallel ? evaluator.evaluateAllParallel(enumerator, pair)
				: evaluator.evaluateAll(enumerator, pair);
	}

	@Override
	public ImmutableMap<Region, Boolean> classifyLRT(DistributionPair pair) {
		return classifier.classify(pair, RegionEnumerator.forPair(pair, params));
	}

	@Override
	public ImmutableMap<Region, Boolean> analyzeDominance(List<EvaluatedRegion> evaluated) {
		return dominanceAnalyzer.analyze(evaluated);
	}

	@Override
	public Region select(DistributionPair pair, double maxSize) {
		return selector.select(pair, maxSize);
	}

	@Override
	public EvaluatedRegion selectEvaluated(DistributionPair pair, double maxSize) {
		return selector.selectEvaluated(pair, maxSize);
	}

	@Override
	public RegionAnalysis analyze(DistributionPair pair) {
		Preconditions.checkNotNull(pair);
		ImmutableList<EvaluatedRegion> evaluated = evaluateAll(pair);
		ImmutableMap<Region, Boolean> dominated = analyzeDominance(evaluated);
		LikelihoodRatioOrdering ordering = classifier.order(pair);

		ImmutableList.Builder<AnalyzedRegion> rows = ImmutableList.builderWithExpectedSize(evaluated.size());
		for (EvaluatedRegion e : evaluated)
			rows.add(new AnalyzedRegion(e, dominated.get(e.getRegion()),
					ordering.isLikelihoodRatioTest(e.getRegion())));
		logger.debug("Analyzed {} regions over {} outcomes, {} of them LRTs", evaluated.size(), pair.outcomes(),
				ordering.getPrefixRegions().size());
		return new RegionAnalysis(pair, ordering, rows.build());
	}
}
