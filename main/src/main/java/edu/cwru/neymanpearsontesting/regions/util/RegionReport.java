package edu.cwru.neymanpearsontesting.regions.util;

import java.io.PrintStream;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import edu.cwru.neymanpearsontesting.analysis.AnalyzedRegion;
import edu.cwru.neymanpearsontesting.analysis.RegionAnalysis;
import edu.cwru.neymanpearsontesting.lrt.TieGroup;
import edu.cwru.neymanpearsontesting.regions.EvaluatedRegion;

/**
 * Plain-text tables of evaluated regions, one line per region in enumeration
 * order. Values are printed unrounded.
 */
public class RegionReport {
    public static final String REGIONS_HEADER = "region, size, power";
    public static final String ANALYSIS_HEADER = "region, size, power, dominated?, LRT?";

    private final PrintStream out;

    public RegionReport(PrintStream out) {
        this.out = out;
    }

    public static String formatRow(EvaluatedRegion row) {
        return StringUtils.join(new Object[] { row.getRegion(), row.getSize(), row.getPower() }, ", ");
    }

    public static String formatRow(AnalyzedRegion row) {
        return StringUtils.join(new Object[] { row.getRegion(), row.getSize(), row.getPower(), row.isDominated(),
                row.isLikelihoodRatioTest() }, ", ");
    }

    public void outputRegions(List<EvaluatedRegion> rows) {
        out.println(REGIONS_HEADER);
        for (EvaluatedRegion row : rows)
            out.println(formatRow(row));
    }

    public void outputAnalysis(RegionAnalysis analysis) {
        out.println(ANALYSIS_HEADER);
        for (AnalyzedRegion row : analysis.getRows())
            out.println(formatRow(row));
    }

    public void outputOrdering(RegionAnalysis analysis) {
        out.println("Likelihood ratio groups, highest first:");
        for (TieGroup group : analysis.getOrdering().getGroups())
            out.println(group.getOutcomes() + ", " + (group.isIrrelevant() ? "undefined" : group.getRatio()));
    }

    public void outputSelection(EvaluatedRegion selected, double maxSize) {
        out.println("Most powerful LRT with size <= " + maxSize + ": " + formatRow(selected));
    }
}
