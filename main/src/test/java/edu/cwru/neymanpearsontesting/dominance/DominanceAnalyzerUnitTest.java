package edu.cwru.neymanpearsontesting.dominance;

import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.collect.ImmutableList;

import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.hypotheses.RandomPairs;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioClassifier;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioOrdering;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.regions.RegionEnumerator;
import edu.cwru.neymanpearsontesting.regions.RegionEvaluator;
import edu.cwru.neymanpearsontesting.regions.RegionStats;

public final class DominanceAnalyzerUnitTest {
    private final DominanceAnalyzer analyzer = new DominanceAnalyzer();
    private final RegionEvaluator evaluator = new RegionEvaluator();

    private List<EvaluatedRegion> evaluate(final DistributionPair pair) {
        return evaluator.evaluateAll(new RegionEnumerator(pair.outcomes()), pair);
    }

    private static EvaluatedRegion point(final Region region, final double size, final double power) {
        return new EvaluatedRegion(region, new RegionStats(size, power));
    }

    @DataProvider(name = "pairs")
    public Object[][] pairs() {
        return new Object[][] {
                { RandomPairs.tulip() },
                { DistributionPair.binomial(7, 0.5, 0.2) },
                { DistributionPair.binomial(6, 0.4, 0.7) },
                { RandomPairs.positive(7, 1L) },
                { RandomPairs.positive(8, 2L) },
                { RandomPairs.positive(5, 3L) },
        };
    }

    @Test
    public void testTulipRegions() {
        final Map<Region, Boolean> dominated = analyzer.analyze(evaluate(RandomPairs.tulip()));

        Assert.assertEquals(dominated.size(), 64);
        Assert.assertFalse(dominated.get(Region.empty()));
        Assert.assertFalse(dominated.get(Region.of(0)));
        Assert.assertFalse(dominated.get(Region.of(0, 1)));
        Assert.assertTrue(dominated.get(Region.of(2)));
        Assert.assertFalse(dominated.get(Region.full(6)));
    }

    @Test
    public void testIdenticalStatsDoNotDominateEachOther() {
        final List<EvaluatedRegion> points = ImmutableList.of(
                point(Region.of(0), 0.2, 0.5),
                point(Region.of(1), 0.2, 0.5),
                point(Region.of(2), 0.3, 0.4));
        Assert.assertEquals(analyzer.analyze(points).values().asList(), ImmutableList.of(false, false, true));
        Assert.assertEquals(analyzer.analyzePairwise(points).values().asList(), ImmutableList.of(false, false, true));
    }

    @Test
    public void testEqualPowerAtSmallerSizeDominatesTies() {
        final List<EvaluatedRegion> points = ImmutableList.of(
                point(Region.of(0), 0.2, 0.5),
                point(Region.of(1), 0.2, 0.5),
                point(Region.of(2), 0.1, 0.5));
        Assert.assertEquals(analyzer.analyze(points).values().asList(), ImmutableList.of(true, true, false));
        Assert.assertEquals(analyzer.analyzePairwise(points).values().asList(), ImmutableList.of(true, true, false));
    }

    @Test
    public void testNothingDominatesItself() {
        final List<EvaluatedRegion> single = ImmutableList.of(point(Region.of(0), 0.2, 0.5));
        Assert.assertFalse(analyzer.analyze(single).get(Region.of(0)));
        Assert.assertFalse(analyzer.analyzePairwise(single).get(Region.of(0)));
        Assert.assertTrue(analyzer.analyze(ImmutableList.of()).isEmpty());
    }

    @Test(dataProvider = "pairs")
    public void testSweepAgreesWithPairwiseComparison(final DistributionPair pair) {
        final List<EvaluatedRegion> evaluated = evaluate(pair);
        final Map<Region, Boolean> pairwise = analyzer.analyzePairwise(evaluated);

        Assert.assertEquals(analyzer.analyze(evaluated), pairwise);
        Assert.assertEquals(analyzer.analyzePairwiseParallel(evaluated), pairwise);
        Assert.assertEquals(ImmutableList.copyOf(pairwise.keySet()), new RegionEnumerator(pair.outcomes()).toList());
    }

    @Test(dataProvider = "pairs")
    public void testExtremeRegionsAreNeverDominated(final DistributionPair pair) {
        final Map<Region, Boolean> dominated = analyzer.analyze(evaluate(pair));
        Assert.assertFalse(dominated.get(Region.empty()));
        Assert.assertFalse(dominated.get(Region.full(pair.outcomes())));
    }

    @Test(dataProvider = "pairs")
    public void testLikelihoodRatioTestsAreUndominated(final DistributionPair pair) {
        final Map<Region, Boolean> dominated = analyzer.analyze(evaluate(pair));
        final LikelihoodRatioOrdering ordering = new LikelihoodRatioClassifier().order(pair);
        for (final Region prefix : ordering.getPrefixRegions()) {
            Assert.assertFalse(dominated.get(prefix), prefix.toString());
        }
        Assert.assertTrue(DominanceAnalyzer.undominated(dominated).containsAll(ordering.getPrefixRegions()));
    }
}
