package edu.cwru.neymanpearsontesting.analysis;

import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.neymanpearsontesting.hypotheses.DistributionPair;
import edu.cwru.neymanpearsontesting.lrt.LikelihoodRatioOrdering;
import edu.cwru.neymanpearsontesting.regions.Region;

/**
 * Size, power, dominance and LRT status of every region of one hypothesis
 * pair, in enumeration order.
 */
public final class RegionAnalysis {
	private final DistributionPair pair;
	private final LikelihoodRatioOrdering ordering;
	private final ImmutableList<AnalyzedRegion> rows;
	private final ImmutableMap<Region, AnalyzedRegion> byRegion;

	RegionAnalysis(DistributionPair pair, LikelihoodRatioOrdering ordering, ImmutableList<AnalyzedRegion> rows) {
		this.pair = pair;
		this.ordering = ordering;
		this.rows = rows;
		this.byRegion = rows.stream()
				.collect(ImmutableMap.toImmutableMap(AnalyzedRegion::getRegion, row -> row));
	}

	public DistributionPair getPair() {
		return this.pair;
	}

	public LikelihoodRatioOrdering getOrdering() {
		return this.ordering;
	}

	public ImmutableList<AnalyzedRegion> getRows() {
		return this.rows;
	}

	public AnalyzedRegion get(Region region) {
		AnalyzedRegion row = byRegion.get(region);
		if (row == null)
			throw new NoSuchElementException("Region " + region + " was not enumerated");
		return row;
	}

	public ImmutableList<AnalyzedRegion> likelihoodRatioTests() {
		return rows.stream().filter(AnalyzedRegion::isLikelihoodRatioTest).collect(ImmutableList.toImmutableList());
	}

	public ImmutableList<AnalyzedRegion> undominated() {
		return rows.stream().filter(row -> !row.isDominated()).collect(ImmutableList.toImmutableList());
	}
}
