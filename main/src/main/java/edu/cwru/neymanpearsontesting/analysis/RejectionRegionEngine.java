package edu.cwru.neymanpearsontesting.analysis;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;
import edu.cwru.neymanpearsontesting.regions.Region;
import edu.cwru.neymanpearsontesting.regions.RegionEnumerator;
import edu.cwru.neymanpearsontesting.regions.RegionStats;

public interface RejectionRegionEngine {
    RegionEnumerator enumerateRegions(int outcomes);

    RegionStats evaluate(Region region, DistributionPair pair);

    ImmutableList<EvaluatedRegion> evaluateAll(DistributionPair pair);

    ImmutableMap<Region, Boolean> classifyLRT(DistributionPair pair);

    ImmutableMap<Region, Boolean> analyzeDominance(List<EvaluatedRegion> evaluated);

    Region select(DistributionPair pair, double maxSize);

    EvaluatedRegion selectEvaluated(DistributionPair pair, double maxSize);

    RegionAnalysis analyze(DistributionPair pair);
}
