package edu.cwru.neymanpearsontesting.regions;

/**
 * Size (probability under the null) and power (probability under the
 * alternative) of a region.
 */
public final class RegionStats {
	private final double size;
	private final double power;

	public RegionStats(double size, double power) {
		this.size = size;
		this.power = power;
	}

	public double getSize() {
		return this.size;
	}

	public double getPower() {
		return this.power;
	}

	/**
	 * @param other
	 * @return whether {@code this} has size &lt;= and power &gt;= those of
	 *         {@code other}, with at least one strict
	 */
	public boolean dominates(RegionStats other) {
		return size <= other.size && power >= other.power && (size < other.size || power > other.power);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof RegionStats))
			return false;
		RegionStats other = (RegionStats) o;
		return Double.compare(size, other.size) == 0 && Double.compare(power, other.power) == 0;
	}

	@Override
	public int hashCode() {
		return 31 * Double.hashCode(size) + Double.hashCode(power);
	}

	@Override
	public String toString() {
		return "RegionStats{size=" + size + ", power=" + power + "}";
	}
}
