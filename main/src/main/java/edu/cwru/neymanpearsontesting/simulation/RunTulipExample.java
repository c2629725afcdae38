package edu.cwru.neymanpearsontesting.simulation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import edu.cwru.neymanpearsontesting.analysis.AnalysisParams;
import edu.cwru.neymanpearsontesting.analysis.NeymanPearsonEngine;
import edu.cwru.neymanpearsontesting.analysis.RegionAnalysis;
import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.util.RegionReport;

/**
 * Five bulbs are planted and the number flowering red is counted. Under the
 * null 75% of bulbs flower red, under the alternative 30%. Prints every
 * rejection region and the one chosen for a size budget.
 * 
 * Usage: {@code RunTulipExample [maxSize]}, default 0.15.
 */
public class RunTulipExample {
    private static final Logger logger = LogManager.getLogger(RunTulipExample.class);

    public static final double[] NULL = { .001, .015, .088, .264, .396, .237 };
    public static final double[] ALTERNATIVE = { .168, .360, .309, .132, .028, .002 };

    public static void main(String[] args) {
        double maxSize = args.length > 0 ? Double.parseDouble(args[0]) : 0.15;

        AnalysisParams params = AnalysisParams.load();
        logger.info("Running with {}", params);
        NeymanPearsonEngine engine = new NeymanPearsonEngine(params);
        DistributionPair pair = engine.distributions(NULL, ALTERNATIVE);

        RegionAnalysis analysis = engine.analyze(pair);
        RegionReport report = new RegionReport(System.out);
        report.outputAnalysis(analysis);
        System.out.println();
        report.outputOrdering(analysis);
        System.out.println();

        EvaluatedRegion selected = engine.selectEvaluated(pair, maxSize);
        report.outputSelection(selected, maxSize);
        logger.info("{} of {} regions are undominated, {} are LRTs", analysis.undominated().size(),
                analysis.getRows().size(), analysis.likelihoodRatioTests().size());
    }
}
