package edu.cwru.neymanpearsontesting.regions;

import com.google.common.base.Preconditions;

/**
 * A region paired with its size and power.
 */
public final class EvaluatedRegion {
	private final Region region;
	private final RegionStats stats;

	public EvaluatedRegion(Region region, RegionStats stats) {
		this.region = Preconditions.checkNotNull(region);
		this.stats = Preconditions.checkNotNull(stats);
	}

	public Region getRegion() {
		return this.region;
	}

	public RegionStats getStats() {
		return this.stats;
	}

	public double getSize() {
		return stats.getSize();
	}

	public double getPower() {
		return stats.getPower();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof EvaluatedRegion))
			return false;
		EvaluatedRegion other = (EvaluatedRegion) o;
		return region.equals(other.region) && stats.equals(other.stats);
	}

	@Override
	public int hashCode() {
		return 31 * region.hashCode() + stats.hashCode();
	}

	@Override
	public String toString() {
		return region + ", " + stats.getSize() + ", " + stats.getPower();
	}
}
