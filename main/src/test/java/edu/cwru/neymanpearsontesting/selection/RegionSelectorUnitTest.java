package edu.cwru.neymanpearsontesting.selection;

import java.util.List;
import java.util.Map;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import edu.cwru.neymanpearsontesting.dominance.DominanceAnalyzer;
import edu.cwru.neymanpearsontesting.exceptions.InvalidBudgetException;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.hypotheses.RandomPairs;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioClassifier;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioOrdering;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.regions.RegionEnumerator;
import edu.cwru.neymanpearsontesting.regions.RegionEvaluator;

public final class RegionSelectorUnitTest {
    private static final double EPSILON = 1e-12;

    private final RegionSelector selector = new RegionSelector();

    @Test
    public void testTulipBudget() {
        final EvaluatedRegion selected = selector.selectEvaluated(RandomPairs.tulip(), 0.15);
        Assert.assertEquals(selected.getRegion(), Region.of(0, 1, 2));
        Assert.assertEquals(selected.getSize(), .104, EPSILON);
        Assert.assertEquals(selected.getPower(), .837, EPSILON);
        Assert.assertEquals(selector.select(RandomPairs.tulip(), 0.15), Region.of(0, 1, 2));
    }

    @DataProvider(name = "tulipBudgets")
    public Object[][] tulipBudgets() {
        return new Object[][] {
                { 0.0, Region.empty() },
                { 0.0005, Region.empty() },
                // the budget is inclusive
                { 0.001, Region.of(0) },
                { 0.02, Region.of(0, 1) },
                { 0.5, Region.of(0, 1, 2, 3) },
                { 2.0, Region.full(6) },
        };
    }

    @Test(dataProvider = "tulipBudgets")
    public void testTulipBudgets(final double maxSize, final Region expected) {
        Assert.assertEquals(selector.select(RandomPairs.tulip(), maxSize), expected);
    }

    @Test
    public void testPowerTieGoesToSmallerSize() {
        // outcome 2 cannot occur under the alternative, adding it costs size and buys no power
        final DistributionPair pair = DistributionPair.of(new double[] { .5, .3, .2 }, new double[] { .6, .4, 0.0 });
        final EvaluatedRegion selected = selector.selectEvaluated(pair, 1.0);
        Assert.assertEquals(selected.getRegion(), Region.of(0, 1));
        Assert.assertEquals(selected.getPower(), 1.0, EPSILON);
    }

    @Test
    public void testFullTieGoesToEarlierPrefix() {
        // outcome 1 is impossible under both hypotheses
        final DistributionPair pair = DistributionPair.of(new double[] { .5, 0.0, .5 }, new double[] { .2, 0.0, .8 });
        Assert.assertEquals(selector.select(pair, 1.0), Region.of(0, 2));
    }

    @Test
    public void testNegativeBudget() {
        final InvalidBudgetException e = Assert.expectThrows(InvalidBudgetException.class,
                () -> selector.select(RandomPairs.tulip(), -0.01));
        Assert.assertEquals(e.getMaxSize(), -0.01);
    }

    @Test(expectedExceptions = InvalidBudgetException.class)
    public void testNaNBudget() {
        selector.select(RandomPairs.tulip(), Double.NaN);
    }

    @DataProvider(name = "pairsAndBudgets")
    public Object[][] pairsAndBudgets() {
        final DistributionPair[] pairs = {
                RandomPairs.tulip(),
                DistributionPair.binomial(8, 0.5, 0.25),
                RandomPairs.positive(6, 5L),
                RandomPairs.positive(7, 6L),
        };
        final double[] budgets = { 0.0, 0.01, 0.05, 0.1, 0.25, 0.5, 0.9, 1.0 };
        final Object[][] ret = new Object[pairs.length * budgets.length][];
        int i = 0;
        for (final DistributionPair pair : pairs) {
            for (final double budget : budgets) {
                ret[i++] = new Object[] { pair, budget };
            }
        }
        return ret;
    }

    @Test(dataProvider = "pairsAndBudgets")
    public void testSelectionBeatsEveryAffordableLikelihoodRatioTest(final DistributionPair pair,
            final double maxSize) {
        final EvaluatedRegion selected = selector.selectEvaluated(pair, maxSize);
        Assert.assertTrue(selected.getSize() <= maxSize);

        final List<EvaluatedRegion> all = new RegionEvaluator().evaluateAll(new RegionEnumerator(pair.outcomes()),
                pair);
        final LikelihoodRatioOrdering ordering = new LikelihoodRatioClassifier().order(pair);
        Assert.assertTrue(ordering.isLikelihoodRatioTest(selected.getRegion()));
        for (final EvaluatedRegion e : all) {
            if (ordering.isLikelihoodRatioTest(e.getRegion()) && e.getSize() <= maxSize) {
                Assert.assertTrue(selected.getPower() >= e.getPower(), e + " beats " + selected);
            }
        }

        final Map<Region, Boolean> dominated = new DominanceAnalyzer().analyzePairwise(all);
        Assert.assertFalse(dominated.get(selected.getRegion()));
    }
}
