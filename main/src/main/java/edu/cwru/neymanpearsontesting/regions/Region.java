package edu.cwru.neymanpearsontesting.regions;

import java.util.Arrays;
import java.util.stream.Collectors;

import edu.cwru.neymanpearsontesting.utilities.Utility;

/**
 * A rejection region: the set of outcomes on which the null hypothesis is
 * rejected. Backed by a bitmask where bit i stands for outcome i, so equality
 * is set equality and the natural order is the enumeration order.
 */
public final class Region implements Comparable<Region> {
	private static final Region EMPTY = new Region(0);

	private final int mask;

	private Region(int mask) {
		this.mask = mask;
	}

	public static Region empty() {
		return EMPTY;
	}

	/**
	 * The whole outcome space {0, ..., n - 1}.
	 * 
	 * @param n
	 * @return full region
	 */
	public static Region full(int n) {
		if (n < 0 || n >= Integer.SIZE - 1)
			throw new IllegalArgumentException("Invalid outcome count: " + n);
		return fromMask(Utility.fullMask(n));
	}

	public static Region of(int... outcomes) {
		return fromMask(Utility.maskOf(outcomes));
	}

	public static Region fromMask(int mask) {
		if (mask < 0)
			throw new IllegalArgumentException("Region mask must be non-negative: " + mask);
		return mask == 0 ? EMPTY : new Region(mask);
	}

	public int mask() {
		return this.mask;
	}

	/** Outcomes in the region, ascending. */
	public int[] outcomes() {
		return Utility.indicesOf(mask);
	}

	/** Number of outcomes in the region, not its statistical size. */
	public int cardinality() {
		return Integer.bitCount(mask);
	}

	public boolean isEmpty() {
		return mask == 0;
	}

	public boolean contains(int outcome) {
		return outcome >= 0 && outcome < Integer.SIZE && (mask & (1 << outcome)) != 0;
	}

	public boolean isSubsetOf(Region other) {
		return (mask & ~other.mask) == 0;
	}

	public Region union(Region other) {
		return fromMask(mask | other.mask);
	}

	/** Whether every outcome lies in {0, ..., n - 1}. */
	public boolean fitsWithin(int n) {
		return (mask & ~Utility.fullMask(n)) == 0;
	}

	@Override
	public int compareTo(Region other) {
		return Integer.compare(mask, other.mask);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		return o instanceof Region && ((Region) o).mask == mask;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(mask);
	}

	/** Canonical form, e.g. {@code ()}, {@code (0)}, {@code (0, 1)}. */
	@Override
	public String toString() {
		return Arrays.stream(outcomes()).mapToObj(Integer::toString).collect(Collectors.joining(", ", "(", ")"));
	}
}
